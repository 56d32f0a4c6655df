package com.flavorsnap.backend.category.dto;

public record CategorySubmitResponse(
        String categoryId,
        String status,
        String submittedAt // ISO-8601
) {}
