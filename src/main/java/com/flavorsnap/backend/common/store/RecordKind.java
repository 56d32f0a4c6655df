package com.flavorsnap.backend.common.store;

public enum RecordKind {
    CATEGORY_SUBMISSION("CATEGORY_NOT_FOUND"),
    CATEGORY_VOTE("VOTE_NOT_FOUND"),
    TRAINING_JOB("TRAINING_JOB_NOT_FOUND"),
    PREDICTION("PREDICTION_NOT_FOUND");

    private final String notFoundCode;

    RecordKind(String notFoundCode) {
        this.notFoundCode = notFoundCode;
    }

    public String notFoundCode() { return notFoundCode; }
}
