package com.flavorsnap.backend.category.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum TrainingStatus {
    QUEUED, TRAINING, COMPLETED, FAILED;

    /** 還在 queue 裡（worker 會看到）的狀態 */
    public static final Set<TrainingStatus> LIVE = EnumSet.of(QUEUED, TRAINING);

    public boolean terminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * strict mode 用：QUEUED -> TRAINING|FAILED，TRAINING -> COMPLETED|FAILED，同狀態重送視為 OK
     */
    public boolean canMoveTo(TrainingStatus next) {
        if (next == this) return true;
        return switch (this) {
            case QUEUED -> next == TRAINING || next == FAILED;
            case TRAINING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    public static TrainingStatus parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
