package com.flavorsnap.backend.category.dto;

import com.flavorsnap.backend.common.query.Pagination;

import java.util.List;

public record CategoryListResponse(
        List<CategoryView> items,
        Pagination pagination
) {}
