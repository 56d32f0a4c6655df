package com.flavorsnap.backend.category.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flavorsnap.backend.category.entity.TrainingJobEntity;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrainingJobView(
        String jobId,
        String categoryId,
        String status,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String errorMessage
) {
    public static TrainingJobView of(TrainingJobEntity j) {
        return new TrainingJobView(j.getId(), j.getCategoryId(), j.getStatus().name(),
                j.getCreatedAt(), j.getStartedAt(), j.getCompletedAt(), j.getErrorMessage());
    }
}
