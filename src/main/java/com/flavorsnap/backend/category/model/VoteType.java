package com.flavorsnap.backend.category.model;

import java.util.Locale;

public enum VoteType {
    UPVOTE, DOWNVOTE;

    /** 接受 upvote / UPVOTE / up / down */
    public static VoteType parseOrNull(String raw) {
        if (raw == null) return null;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "upvote", "up" -> UPVOTE;
            case "downvote", "down" -> DOWNVOTE;
            default -> null;
        };
    }
}
