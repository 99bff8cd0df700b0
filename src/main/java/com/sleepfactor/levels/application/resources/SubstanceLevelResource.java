package com.sleepfactor.levels.application.resources;

import com.sleepfactor.levels.domain.constant.ResponseCodeEnum;
import com.sleepfactor.levels.domain.model.EstimationOutcome;
import com.sleepfactor.levels.domain.model.SubstanceLevelReport;
import com.sleepfactor.levels.domain.model.response.ApiResponse;
import com.sleepfactor.levels.domain.service.SubstanceLevelService;
import com.sleepfactor.levels.exception.BaseException;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.UUID;
import java.util.function.Supplier;


@Path("/levels")
@ApplicationScoped
public class SubstanceLevelResource {
    private static final Logger log = Logger.getLogger(SubstanceLevelResource.class);
    private final SubstanceLevelService substanceLevelService;

    public SubstanceLevelResource(SubstanceLevelService substanceLevelService) {
        this.substanceLevelService = substanceLevelService;
    }

    @GET
    @Path("/{userId}/{habitId}")
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<Response> getLevel(@PathParam("userId") String userId,
                                  @PathParam("habitId") String habitId,
                                  @QueryParam("date") String date,
                                  @QueryParam("sleepStart") String sleepStart) {
        log.infof("Level query Start %s/%s date=%s", userId, habitId, date);
        return parseAndRun(userId, habitId, () -> substanceLevelService.estimateAtReferenceTime(
                        userId, habitId, parseDate("date", date), parseInstant(sleepStart)))
                .onItem().transform(this::toResponse)
                .onFailure().recoverWithItem(this::errorResponse)
                .onItem().invoke(() -> log.infof("Level query Completed %s/%s", userId, habitId));
    }

    @POST
    @Path("/{userId}/{habitId}/publish")
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<Response> publishLevel(@PathParam("userId") String userId,
                                      @PathParam("habitId") String habitId,
                                      @QueryParam("date") String date,
                                      @QueryParam("sleepStart") String sleepStart) {
        log.infof("Level publish Start %s/%s date=%s", userId, habitId, date);
        return parseAndRun(userId, habitId, () -> substanceLevelService.estimateAndPublish(
                        userId, habitId, parseDate("date", date), parseInstant(sleepStart)))
                .onItem().transform(this::toResponse)
                .onFailure().recoverWithItem(this::errorResponse);
    }

    @GET
    @Path("/{userId}/{habitId}/timeline")
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<Response> getTimeline(@PathParam("userId") String userId,
                                     @PathParam("habitId") String habitId,
                                     @QueryParam("from") String from,
                                     @QueryParam("to") String to) {
        return parseAndRun(userId, habitId, () -> substanceLevelService.timeline(
                        userId, habitId, requireInstant("from", from), requireInstant("to", to)))
                .onItem().transform(timeline -> dataResponse("Timeline generated", timeline))
                .onFailure().recoverWithItem(this::errorResponse);
    }

    @GET
    @Path("/{userId}/{habitId}/pattern")
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<Response> getDailyPattern(@PathParam("userId") String userId,
                                         @PathParam("habitId") String habitId,
                                         @QueryParam("from") String from,
                                         @QueryParam("to") String to) {
        return parseAndRun(userId, habitId, () -> substanceLevelService.dailyPattern(
                        userId, habitId, parseDate("from", from), parseDate("to", to)))
                .onItem().transform(pattern -> dataResponse("Daily pattern generated", pattern))
                .onFailure().recoverWithItem(this::errorResponse);
    }

    private Response dataResponse(String message, Object data) {
        ApiResponse<Object> response = newResponse(Response.Status.OK, message);
        response.setData(data);
        return Response.ok(response).build();
    }

    private Response toResponse(EstimationOutcome outcome) {
        if (!outcome.success()) {
            ApiResponse<Object> response = newResponse(Response.Status.BAD_REQUEST, outcome.errorMessage());
            response.setResponseCode(outcome.errorCode().code());
            return Response.status(response.getStatus()).entity(response).build();
        }
        SubstanceLevelReport report = outcome.report();
        return dataResponse(report.result().hasRejections()
                ? "Level estimated, " + report.result().rejectedEvents().size() + " events rejected"
                : "Level estimated", report);
    }

    private Response errorResponse(Throwable failure) {
        BaseException e;
        if (failure instanceof BaseException baseException) {
            e = baseException;
        } else {
            log.error("Unexpected failure while serving level request", failure);
            e = new BaseException(failure.getMessage(), "Service Layer", Response.Status.INTERNAL_SERVER_ERROR,
                    ResponseCodeEnum.EXCEPTION_SERVICE_LAYER.code(), failure.getStackTrace());
        }
        log.warnf("Level request failed [%s]: %s", e.getResponseCode(), e.getMessage());
        ApiResponse<Object> response = newResponse(e.getHttpStatus(), e.getMessage());
        response.setResponseCode(e.getResponseCode());
        return Response.status(e.getHttpStatus()).entity(response).build();
    }

    private static ApiResponse<Object> newResponse(Response.Status status, String message) {
        ApiResponse<Object> response = new ApiResponse<>();
        response.setTimestamp(Instant.now());
        response.setStatus(status);
        response.setMessage(message);
        return response;
    }

    /**
     * Validates the path ids and runs the call. Invalid request input fails with 400 before
     * anything reaches the service.
     */
    private static <T> Uni<T> parseAndRun(String userId, String habitId, Supplier<Uni<T>> call) {
        try {
            requireId("userId", userId);
            requireId("habitId", habitId);
            return call.get();
        } catch (IllegalArgumentException e) {
            return Uni.createFrom().failure(new BadRequestParameterException(e.getMessage()));
        }
    }

    private static void requireId(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        try {
            UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(name + " is not a valid UUID: " + value);
        }
    }

    private static LocalDate parseDate(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required (YYYY-MM-DD)");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(name + " is not a valid YYYY-MM-DD value: " + value);
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("not a valid ISO-8601 timestamp: " + value);
        }
    }

    private static Instant requireInstant(String name, String value) {
        Instant instant = parseInstant(value);
        if (instant == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return instant;
    }

    static class BadRequestParameterException extends BaseException {
        BadRequestParameterException(String message) {
            super(message, "Controller Layer", Response.Status.BAD_REQUEST,
                    ResponseCodeEnum.EXCEPTION_CONTROLLER_LAYER.code(), new StackTraceElement[0]);
        }
    }
}
