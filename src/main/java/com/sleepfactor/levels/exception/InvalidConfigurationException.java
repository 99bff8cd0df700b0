package com.sleepfactor.levels.exception;

import com.sleepfactor.levels.domain.constant.ResponseCodeEnum;
import jakarta.ws.rs.core.Response;

/**
 * Thrown when a habit's decay configuration cannot be used for estimation:
 * a missing, non-positive or non-finite half-life, or a threshold outside (0, 100].
 * Never replaced by a default value.
 */
public class InvalidConfigurationException extends BaseException {

    private static final String DESCRIPTION = "Decay Configuration";

    public InvalidConfigurationException(String message) {
        super(
            message,
            DESCRIPTION,
            Response.Status.BAD_REQUEST,
            ResponseCodeEnum.INVALID_CONFIGURATION.code(),
            new StackTraceElement[0]
        );
    }
}
