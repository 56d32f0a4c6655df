package com.flavorsnap.backend.common.store;

import com.flavorsnap.backend.common.query.NumberRange;
import com.flavorsnap.backend.common.query.TimeRange;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.ToLongFunction;
import java.util.stream.Collectors;

/**
 * Conjunction of column conditions a {@link RecordStore} evaluates itself.
 * The JPA engine turns it into a {@link Specification} (WHERE clause); the in-memory engine calls {@link #matches}.
 * Both readings must agree, so every condition carries the column name and the getter for the same field.
 */
public final class StoreFilter<T> {

    private interface Condition<T> {
        boolean matches(T record);

        Predicate toPredicate(Root<T> root, CriteriaBuilder cb);
    }

    private static final StoreFilter<?> ALL = new StoreFilter<>(List.of());

    private final List<Condition<T>> conditions;

    private StoreFilter(List<Condition<T>> conditions) {
        this.conditions = conditions;
    }

    @SuppressWarnings("unchecked")
    public static <T> StoreFilter<T> all() {
        return (StoreFilter<T>) ALL;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /**
     * Case-insensitive membership; enums compare by name. Blank values are dropped and an
     * empty value set adds no condition.
     */
    public StoreFilter<T> in(String column, Function<T, ?> getter, Collection<?> values) {
        if (values == null) return this;
        Set<String> wanted = values.stream()
                .filter(Objects::nonNull)
                .map(StoreFilter::norm)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        if (wanted.isEmpty()) return this;

        return with(new Condition<>() {
            @Override
            public boolean matches(T record) {
                Object v = getter.apply(record);
                return v != null && wanted.contains(norm(v));
            }

            @Override
            public Predicate toPredicate(Root<T> root, CriteriaBuilder cb) {
                Path<Object> path = root.get(column);
                Class<?> type = path.getJavaType();
                if (type.isEnum()) {
                    List<Object> constants = Arrays.stream(type.getEnumConstants())
                            .filter(c -> wanted.contains(norm(c)))
                            .map(c -> (Object) c)
                            .toList();
                    return constants.isEmpty() ? cb.disjunction() : path.in(constants);
                }
                return cb.lower(cb.trim(root.<String>get(column))).in(wanted);
            }
        });
    }

    /** Inclusive; rows with a null value never match. */
    public StoreFilter<T> range(String column, Function<T, ? extends Number> getter, NumberRange range) {
        if (range == null) return this;
        return with(new Condition<>() {
            @Override
            public boolean matches(T record) {
                return range.contains(getter.apply(record));
            }

            @Override
            public Predicate toPredicate(Root<T> root, CriteriaBuilder cb) {
                Path<Number> path = root.get(column);
                List<Predicate> ps = new ArrayList<>();
                ps.add(cb.isNotNull(path));
                if (range.min() != null) ps.add(cb.ge(path, range.min()));
                if (range.max() != null) ps.add(cb.le(path, range.max()));
                return cb.and(ps.toArray(new Predicate[0]));
            }
        });
    }

    /** Inclusive; an unparseable bound is open, a null timestamp never matches. */
    public StoreFilter<T> between(String column, Function<T, Instant> getter, TimeRange range) {
        if (range == null) return this;
        Instant from = TimeRange.parseOrNull(range.from());
        Instant to = TimeRange.parseOrNull(range.to());
        return with(new Condition<>() {
            @Override
            public boolean matches(T record) {
                return range.contains(getter.apply(record));
            }

            @Override
            public Predicate toPredicate(Root<T> root, CriteriaBuilder cb) {
                Path<Instant> path = root.get(column);
                List<Predicate> ps = new ArrayList<>();
                ps.add(cb.isNotNull(path));
                if (from != null) ps.add(cb.greaterThanOrEqualTo(path, from));
                if (to != null) ps.add(cb.lessThanOrEqualTo(path, to));
                return cb.and(ps.toArray(new Predicate[0]));
            }
        });
    }

    /** {@code column1 + column2 + ... >= min} over integer columns. */
    public StoreFilter<T> sumAtLeast(List<String> columns, ToLongFunction<T> getter, long min) {
        if (columns.isEmpty()) throw new IllegalArgumentException("columns must not be empty");
        return with(new Condition<>() {
            @Override
            public boolean matches(T record) {
                return getter.applyAsLong(record) >= min;
            }

            @Override
            public Predicate toPredicate(Root<T> root, CriteriaBuilder cb) {
                Expression<Integer> sum = root.get(columns.get(0));
                for (int i = 1; i < columns.size(); i++) {
                    sum = cb.sum(sum, root.<Integer>get(columns.get(i)));
                }
                return cb.ge(sum, min);
            }
        });
    }

    public boolean matches(T record) {
        for (Condition<T> c : conditions) {
            if (!c.matches(record)) return false;
        }
        return true;
    }

    public Specification<T> toSpecification() {
        return (root, query, cb) -> cb.and(conditions.stream()
                .map(c -> c.toPredicate(root, cb))
                .toArray(Predicate[]::new));
    }

    private StoreFilter<T> with(Condition<T> c) {
        List<Condition<T>> next = new ArrayList<>(conditions);
        next.add(c);
        return new StoreFilter<>(List.copyOf(next));
    }

    static String norm(Object v) {
        String s = (v instanceof Enum<?> en) ? en.name() : String.valueOf(v);
        return s.trim().toLowerCase(Locale.ROOT);
    }
}
