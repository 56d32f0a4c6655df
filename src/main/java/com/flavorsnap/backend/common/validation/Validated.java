package com.flavorsnap.backend.common.validation;

import com.flavorsnap.backend.common.error.ValidationException;

/**
 * Result of a pure validation step: either a typed value or the error that rejected the input.
 */
public record Validated<T>(T value, ValidationException error) {

    public static <T> Validated<T> valid(T value) {
        return new Validated<>(value, null);
    }

    public static <T> Validated<T> invalid(String code, String message) {
        return new Validated<>(null, new ValidationException(code, message));
    }

    public boolean isValid() {
        return error == null;
    }

    public T orElseThrow() {
        if (error != null) throw error;
        return value;
    }
}
