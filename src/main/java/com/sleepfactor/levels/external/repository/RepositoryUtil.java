package com.sleepfactor.levels.external.repository;

import java.util.UUID;

/**
 * Column conversions shared by the repositories.
 */
final class RepositoryUtil {

    private RepositoryUtil() {
    }

    /**
     * @throws IllegalArgumentException if the id is not a UUID
     */
    static UUID toUuid(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id is required");
        }
        return UUID.fromString(id);
    }

    static String toText(Object value) {
        return value != null ? value.toString() : null;
    }

    static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            return Double.valueOf(value.toString());
        }
        return null;
    }
}
