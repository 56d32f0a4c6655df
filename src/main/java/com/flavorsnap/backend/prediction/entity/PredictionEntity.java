package com.flavorsnap.backend.prediction.entity;

import com.flavorsnap.backend.common.store.StoredRecord;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Entity
@Table(name = "prediction_history",
        indexes = {
                @Index(name = "idx_prediction_history_created", columnList = "created_at_utc"),
                @Index(name = "idx_prediction_history_label", columnList = "label")
        }
)
public class PredictionEntity implements StoredRecord<PredictionEntity> {

    public static final int IMAGE_URL_MAX = 512;

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(length = 100, nullable = false)
    private String label;

    @Column(nullable = false)
    private double confidence;

    @Column(name = "image_url", length = IMAGE_URL_MAX)
    private String imageUrl;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAt;

    /** classifier 給的前幾名（可為空） */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "top_predictions_json")
    private List<LabelScore> topPredictions;

    public record LabelScore(String label, double confidence) {}

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }

    @Override
    public PredictionEntity copy() {
        PredictionEntity c = new PredictionEntity();
        c.id = id;
        c.label = label;
        c.confidence = confidence;
        c.imageUrl = imageUrl;
        c.createdAt = createdAt;
        c.topPredictions = topPredictions == null ? null : new ArrayList<>(topPredictions);
        return c;
    }
}
