package com.flavorsnap.backend.common.query;

import java.util.List;
import java.util.function.Function;

public record PageResult<T>(List<T> items, Pagination pagination) {

    public <R> PageResult<R> map(Function<? super T, ? extends R> fn) {
        List<R> mapped = items.stream().<R>map(fn).toList();
        return new PageResult<>(mapped, pagination);
    }
}
