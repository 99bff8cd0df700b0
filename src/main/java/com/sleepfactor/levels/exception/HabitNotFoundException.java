package com.sleepfactor.levels.exception;

import com.sleepfactor.levels.domain.constant.ResponseCodeEnum;
import jakarta.ws.rs.core.Response;

/**
 * Thrown when no habit configuration exists for the requested user and habit.
 */
public class HabitNotFoundException extends BaseException {

    private static final String DESCRIPTION = "Database Layer";

    public HabitNotFoundException(String userId, String habitId) {
        super(
            "Habit " + habitId + " not found for user " + userId,
            DESCRIPTION,
            Response.Status.NOT_FOUND,
            ResponseCodeEnum.HABIT_NOT_FOUND.code(),
            new StackTraceElement[0]
        );
    }
}
