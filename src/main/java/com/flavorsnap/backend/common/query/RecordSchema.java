package com.flavorsnap.backend.common.query;

import com.flavorsnap.backend.common.store.StoreFilter;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Typed accessor table describing what a record kind can be filtered and sorted on.
 * Only fields registered here are visible to {@link QueryEngine}; anything else in a
 * {@link ListQuery} is ignored.
 */
public final class RecordSchema<T> {

    /**
     * @param ascending ascending order of the primary key only; the id tie-break is added by the schema
     * @param cursorKey string form of the sort key, embedded in cursors
     */
    public record SortField<T>(String name, Comparator<T> ascending, Function<T, String> cursorKey) {}

    private final Function<T, String> idOf;
    private final Map<String, Function<T, ?>> matchFields;
    private final Map<String, Function<T, ? extends Number>> numberFields;
    private final Map<String, Function<T, ? extends Number>> computedNumberFields;
    private final Map<String, Function<T, Instant>> timeFields;
    private final Map<String, SortField<T>> sortFields;
    private final String defaultSort;
    private final SortDirection defaultDirection;

    private RecordSchema(Builder<T> b) {
        this.idOf = b.idOf;
        this.matchFields = Map.copyOf(b.matchFields);
        this.numberFields = Map.copyOf(b.numberFields);
        this.computedNumberFields = Map.copyOf(b.computedNumberFields);
        this.timeFields = Map.copyOf(b.timeFields);
        this.sortFields = Map.copyOf(b.sortFields);
        this.defaultSort = b.defaultSort;
        this.defaultDirection = b.defaultDirection;
    }

    public static <T> Builder<T> builder(Function<T, String> idOf) {
        return new Builder<>(idOf);
    }

    public String idOf(T record) {
        return idOf.apply(record);
    }

    /** Unknown field or direction falls back to the default, never an error. */
    public ResolvedSort resolveSort(String sortBy, String sortDir) {
        String field = sortBy == null ? null : sortBy.trim();
        SortDirection dir = SortDirection.parseOrNull(sortDir);
        if (field == null || !sortFields.containsKey(field) || (sortDir != null && dir == null)) {
            return new ResolvedSort(defaultSort, defaultDirection);
        }
        return new ResolvedSort(field, dir == null ? defaultDirection : dir);
    }

    /**
     * Total order: primary key in the requested direction, then id ascending.
     * Without the id tie-break, cursor pages could skip or repeat records sharing a sort key.
     */
    public Comparator<T> comparator(ResolvedSort sort) {
        Comparator<T> primary = sortFields.get(sort.field()).ascending();
        if (sort.direction() == SortDirection.DESC) primary = primary.reversed();
        return primary.thenComparing(idOf, Comparator.nullsLast(Comparator.<String>naturalOrder()));
    }

    public String cursorKey(ResolvedSort sort, T record) {
        return sortFields.get(sort.field()).cursorKey().apply(record);
    }

    /**
     * Conditions on stored columns, evaluated by the record store. Field names registered with
     * {@code match}, {@code number} and {@code time} are the entity's column names.
     */
    public StoreFilter<T> storeFilter(ListQuery q) {
        StoreFilter<T> f = StoreFilter.all();
        for (var e : q.anyOf().entrySet()) {
            Function<T, ?> accessor = matchFields.get(e.getKey());
            if (accessor != null) f = f.in(e.getKey(), accessor, e.getValue());
        }
        for (var e : q.numberRanges().entrySet()) {
            Function<T, ? extends Number> accessor = numberFields.get(e.getKey());
            if (accessor != null) f = f.range(e.getKey(), accessor, e.getValue());
        }
        for (var e : q.timeRanges().entrySet()) {
            Function<T, Instant> accessor = timeFields.get(e.getKey());
            if (accessor != null) f = f.between(e.getKey(), accessor, e.getValue());
        }
        return f;
    }

    /** Full filter: {@link #storeFilter} plus ranges over computed values. */
    public Predicate<T> filter(ListQuery q) {
        StoreFilter<T> stored = storeFilter(q);
        Predicate<T> p = stored::matches;
        for (var e : q.numberRanges().entrySet()) {
            Function<T, ? extends Number> accessor = computedNumberFields.get(e.getKey());
            NumberRange range = e.getValue();
            if (accessor == null || range == null) continue;
            p = p.and(r -> range.contains(accessor.apply(r)));
        }
        return p;
    }

    public record ResolvedSort(String field, SortDirection direction) {}

    public static final class Builder<T> {
        private final Function<T, String> idOf;
        private final Map<String, Function<T, ?>> matchFields = new LinkedHashMap<>();
        private final Map<String, Function<T, ? extends Number>> numberFields = new LinkedHashMap<>();
        private final Map<String, Function<T, ? extends Number>> computedNumberFields = new LinkedHashMap<>();
        private final Map<String, Function<T, Instant>> timeFields = new LinkedHashMap<>();
        private final Map<String, SortField<T>> sortFields = new LinkedHashMap<>();
        private String defaultSort;
        private SortDirection defaultDirection = SortDirection.DESC;

        private Builder(Function<T, String> idOf) {
            this.idOf = idOf;
        }

        public Builder<T> match(String field, Function<T, ?> accessor) {
            matchFields.put(field, accessor);
            return this;
        }

        public Builder<T> number(String field, Function<T, ? extends Number> accessor) {
            numberFields.put(field, accessor);
            return this;
        }

        /** Not a column: filtered in memory after the store scan. */
        public Builder<T> computedNumber(String field, Function<T, ? extends Number> accessor) {
            computedNumberFields.put(field, accessor);
            return this;
        }

        public Builder<T> time(String field, Function<T, Instant> accessor) {
            timeFields.put(field, accessor);
            return this;
        }

        public Builder<T> sortable(String field, Comparator<T> ascending, Function<T, String> cursorKey) {
            sortFields.put(field, new SortField<>(field, ascending, cursorKey));
            return this;
        }

        public Builder<T> defaultSort(String field, SortDirection direction) {
            this.defaultSort = field;
            this.defaultDirection = direction;
            return this;
        }

        public RecordSchema<T> build() {
            if (defaultSort == null || !sortFields.containsKey(defaultSort)) {
                throw new IllegalStateException("default sort field must be sortable: " + defaultSort);
            }
            return new RecordSchema<>(this);
        }
    }
}
