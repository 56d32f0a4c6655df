package com.flavorsnap.backend.common.query;

/** Inclusive; a null bound is open. */
public record NumberRange(Double min, Double max) {

    public boolean contains(Number value) {
        if (value == null) return false;
        double v = value.doubleValue();
        if (min != null && v < min) return false;
        return max == null || v <= max;
    }
}
