package com.flavorsnap.backend.common.query;

import lombok.Builder;

import java.util.Map;
import java.util.Set;

/**
 * Raw listing request. Nothing here is validated: the engine clamps, ignores
 * or falls back instead of rejecting.
 *
 * @param anyOf        field -> accepted values (equality / membership)
 * @param numberRanges field -> inclusive numeric window
 * @param timeRanges   field -> inclusive ISO-8601 window
 * @param offset       explicit start index; wins over {@code page} when both are set
 * @param cursor       opaque token from a previous page's {@code nextCursor} / {@code prevCursor}
 */
@Builder(toBuilder = true)
public record ListQuery(
        Map<String, Set<String>> anyOf,
        Map<String, NumberRange> numberRanges,
        Map<String, TimeRange> timeRanges,
        String sortBy,
        String sortDir,
        Integer page,
        Integer offset,
        Integer limit,
        String cursor
) {
    public ListQuery {
        anyOf = anyOf == null ? Map.of() : Map.copyOf(anyOf);
        numberRanges = numberRanges == null ? Map.of() : Map.copyOf(numberRanges);
        timeRanges = timeRanges == null ? Map.of() : Map.copyOf(timeRanges);
    }

    public static ListQuery empty() {
        return ListQuery.builder().build();
    }
}
