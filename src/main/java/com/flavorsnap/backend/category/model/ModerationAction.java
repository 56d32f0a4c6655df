package com.flavorsnap.backend.category.model;

import java.util.Locale;

public enum ModerationAction {
    APPROVE(CategoryStatus.APPROVED),
    REJECT(CategoryStatus.REJECTED);

    private final CategoryStatus target;

    ModerationAction(CategoryStatus target) {
        this.target = target;
    }

    public CategoryStatus target() { return target; }

    public static ModerationAction parseOrNull(String raw) {
        if (raw == null) return null;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "approve" -> APPROVE;
            case "reject" -> REJECT;
            default -> null;
        };
    }
}
