package com.flavorsnap.backend.category.entity;

import com.flavorsnap.backend.category.model.TrainingStatus;
import com.flavorsnap.backend.common.store.StoredRecord;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "training_jobs",
        indexes = {
                @Index(name = "idx_training_jobs_status", columnList = "status,created_at_utc"),
                @Index(name = "idx_training_jobs_category", columnList = "category_id")
        }
)
public class TrainingJobEntity implements StoredRecord<TrainingJobEntity> {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "category_id", length = 36, nullable = false)
    private String categoryId;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private TrainingStatus status;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at_utc")
    private Instant startedAt;

    @Column(name = "completed_at_utc")
    private Instant completedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    public static TrainingJobEntity queued(String categoryId, Instant now) {
        TrainingJobEntity j = new TrainingJobEntity();
        j.categoryId = categoryId;
        j.status = TrainingStatus.QUEUED;
        j.createdAt = now;
        return j;
    }

    /**
     * worker 回報：startedAt / completedAt 只寫一次（重複回報不報錯），
     * errorMessage 只在 FAILED 時保留。
     */
    public void applyStatus(TrainingStatus next, String error, Instant now) {
        this.status = next;
        if (next == TrainingStatus.TRAINING && startedAt == null) {
            this.startedAt = now;
        }
        if (next.terminal() && completedAt == null) {
            this.completedAt = now;
        }
        if (next == TrainingStatus.FAILED) {
            this.errorMessage = (error == null || error.isBlank()) ? null : error.trim();
        } else {
            this.errorMessage = null;
        }
    }

    @Override
    public TrainingJobEntity copy() {
        TrainingJobEntity c = new TrainingJobEntity();
        c.id = id;
        c.categoryId = categoryId;
        c.status = status;
        c.createdAt = createdAt;
        c.startedAt = startedAt;
        c.completedAt = completedAt;
        c.errorMessage = errorMessage;
        return c;
    }
}
