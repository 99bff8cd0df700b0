package com.sleepfactor.levels.exception;

import com.sleepfactor.levels.domain.constant.ResponseCodeEnum;
import jakarta.ws.rs.core.Response;

/**
 * Thrown when a single consumption event is malformed: negative or missing amount,
 * or an unparsable consumption timestamp.
 */
public class InvalidEventException extends BaseException {

    private static final String DESCRIPTION = "Consumption Event Validation";

    private final String eventId;

    /**
     * @param eventId identifier of the offending event, may be null
     * @param message the validation failure
     * @param cause   the underlying parse failure, may be null
     */
    public InvalidEventException(String eventId, String message, Throwable cause) {
        super(
            message,
            DESCRIPTION,
            Response.Status.BAD_REQUEST,
            ResponseCodeEnum.INVALID_EVENT.code(),
            cause != null ? cause.getStackTrace() : new StackTraceElement[0]
        );
        this.eventId = eventId;
        if (cause != null) {
            initCause(cause);
        }
    }

    public InvalidEventException(String eventId, String message) {
        this(eventId, message, null);
    }

    public String getEventId() {
        return eventId;
    }
}
