package com.sleepfactor.levels.domain.model.response;


import jakarta.ws.rs.core.Response;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;


@Getter
@Setter
public class ApiResponse<T> {
    private Instant timestamp;
    private String message;
    private String responseCode;
    private Response.Status status;
    private T data;
}
