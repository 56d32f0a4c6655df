package com.flavorsnap.backend.category.dto;

public record VoteResponse(
        String categoryId,
        String outcome, // RECORDED / CHANGED / UNCHANGED
        int votesUp,
        int votesDown
) {}
