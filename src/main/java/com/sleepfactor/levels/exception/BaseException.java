package com.sleepfactor.levels.exception;

import jakarta.ws.rs.core.Response;
import lombok.Getter;

/**
 * Root of the application exception hierarchy.
 * Carries the layer description, HTTP status and response code used when the
 * failure is surfaced through the REST layer.
 */
@Getter
public class BaseException extends RuntimeException {

    private final String description;
    private final Response.Status httpStatus;
    private final String responseCode;
    private final StackTraceElement[] stackTraceElements;

    public BaseException(String message, String description, Response.Status httpStatus,
                         String responseCode, StackTraceElement[] stackTraceElements) {
        super(message);
        this.description = description;
        this.httpStatus = httpStatus;
        this.responseCode = responseCode;
        this.stackTraceElements = stackTraceElements;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "message='" + getMessage() + '\'' +
                ", description='" + description + '\'' +
                ", httpStatus=" + httpStatus +
                ", responseCode='" + responseCode + '\'' +
                '}';
    }
}
