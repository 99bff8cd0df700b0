package com.sleepfactor.levels.domain.model;

/**
 * Habit kinds stored in the habits table. Only drug and quick consumption
 * habits carry decay semantics.
 */
public enum HabitType {
    BINARY("binary"),
    NUMERIC("numeric"),
    TIME("time"),
    TEXT("text"),
    DRUG("drug"),
    QUICK_CONSUMPTION("quick_consumption");

    private final String value;

    HabitType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isDecaying() {
        return this == DRUG || this == QUICK_CONSUMPTION;
    }

    public static HabitType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (HabitType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown habit type: " + value);
    }
}
