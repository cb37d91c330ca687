package io.github.vishalmysore.chasm.domain;

import io.github.vishalmysore.chasm.exception.EntityValidationException;

final class EntityChecks {

    private EntityChecks() {
    }

    static String requireText(String id, String field, String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new EntityValidationException(id, field + " must not be blank");
        }
        return value;
    }

    static <T> T requirePresent(String id, String field, T value) {
        if (value == null) {
            throw new EntityValidationException(id, field + " is required");
        }
        return value;
    }
}
