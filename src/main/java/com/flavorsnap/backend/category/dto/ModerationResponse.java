package com.flavorsnap.backend.category.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModerationResponse(
        String categoryId,
        String status,
        String trainingJobId // 只有 approve 才有
) {}
