package com.flavorsnap.backend.common.query;

import java.util.Locale;

public enum SortDirection {
    ASC, DESC;

    /** 不認得就回 null，由 caller 決定 fallback */
    public static SortDirection parseOrNull(String raw) {
        if (raw == null) return null;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "asc" -> ASC;
            case "desc" -> DESC;
            default -> null;
        };
    }
}
