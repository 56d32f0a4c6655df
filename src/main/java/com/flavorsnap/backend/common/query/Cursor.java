package com.flavorsnap.backend.common.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resume position inside a filtered + sorted sequence.
 * {@code id == null} with {@link #BEFORE} means "before the end of the sequence".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Cursor(
        @JsonProperty("k") String sortKey,
        @JsonProperty("id") String id,
        @JsonProperty("d") String direction
) {
    public static final String AFTER = "a";
    public static final String BEFORE = "b";

    public static Cursor after(String sortKey, String id) {
        return new Cursor(sortKey, id, AFTER);
    }

    public static Cursor before(String sortKey, String id) {
        return new Cursor(sortKey, id, BEFORE);
    }

    public static Cursor beforeEnd() {
        return new Cursor(null, null, BEFORE);
    }

    public boolean isBefore() {
        return BEFORE.equals(direction);
    }

    public boolean isAfter() {
        return AFTER.equals(direction);
    }
}
