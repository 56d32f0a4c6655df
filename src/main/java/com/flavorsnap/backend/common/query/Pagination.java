package com.flavorsnap.backend.common.query;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Pagination(
        int page,          // 1-based
        int limit,
        int offset,        // start index of this page
        long total,
        int totalPages,
        int count,         // items actually returned
        boolean hasNext,
        boolean hasPrev,
        String nextCursor,
        String prevCursor
) {}
