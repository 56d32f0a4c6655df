package com.flavorsnap.backend.category.model;

import java.util.Locale;

/**
 * IN_TRAINING 只存在於詞彙中（可被 filter），目前沒有任何流程會寫入它。
 */
public enum CategoryStatus {
    PENDING, APPROVED, REJECTED, IN_TRAINING;

    public static CategoryStatus parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
