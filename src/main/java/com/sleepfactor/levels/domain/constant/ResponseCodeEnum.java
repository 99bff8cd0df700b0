package com.sleepfactor.levels.domain.constant;
/**
 * Enum to define standard response codes and descriptions for the application.
 */
public enum ResponseCodeEnum {

    // General exception layer error
    EXCEPTION_CONTROLLER_LAYER("E1000", "Exception Controller Layer Error"),
    EXCEPTION_SERVICE_LAYER("E1001", "Exception Service Layer Error"),

    // Estimation errors
    INVALID_CONFIGURATION("E2001", "Invalid Decay Configuration"),
    INVALID_EVENT("E2002", "Invalid Consumption Event"),
    HABIT_NOT_FOUND("E2004", "Habit Not Found");


    private final String code;
    private final String description;

    ResponseCodeEnum(String code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * Returns the response code.
     */
    public String code() {
        return code;
    }

    /**
     * Returns the description of the response code.
     */
    public String description() {
        return description;
    }
}
