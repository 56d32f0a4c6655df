package com.flavorsnap.backend.prediction.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flavorsnap.backend.prediction.entity.PredictionEntity;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PredictionView(
        String id,
        String label,
        double confidence,
        String imageUrl,
        Instant createdAt,
        List<PredictionEntity.LabelScore> topPredictions
) {
    public static PredictionView of(PredictionEntity e) {
        return new PredictionView(e.getId(), e.getLabel(), e.getConfidence(), e.getImageUrl(),
                e.getCreatedAt(), e.getTopPredictions());
    }
}
