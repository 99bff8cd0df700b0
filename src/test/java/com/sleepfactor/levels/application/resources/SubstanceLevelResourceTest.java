package com.sleepfactor.levels.application.resources;

import com.sleepfactor.levels.domain.constant.ResponseCodeEnum;
import com.sleepfactor.levels.domain.model.EstimationOutcome;
import com.sleepfactor.levels.domain.model.EstimationResult;
import com.sleepfactor.levels.domain.model.LevelPoint;
import com.sleepfactor.levels.domain.model.LevelTimeline;
import com.sleepfactor.levels.domain.model.RejectedEvent;
import com.sleepfactor.levels.domain.model.SubstanceLevelReport;
import com.sleepfactor.levels.domain.model.response.ApiResponse;
import com.sleepfactor.levels.domain.service.SubstanceLevelService;
import com.sleepfactor.levels.exception.HabitNotFoundException;
import io.smallrye.mutiny.Uni;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubstanceLevelResourceTest {

    private static final String USER_ID = "6f1c2a9e-0d4b-4e55-9a57-1f3b2c4d5e6f";
    private static final String HABIT_ID = "a3d9e1c7-5b2f-4f0e-8c6d-7e8f9a0b1c2d";
    private static final LocalDate LOGGED_DATE = LocalDate.of(2025, 1, 5);

    @Mock
    private SubstanceLevelService substanceLevelService;

    @InjectMocks
    private SubstanceLevelResource substanceLevelResource;

    private static SubstanceLevelReport report(List<RejectedEvent> rejected) {
        EstimationResult result = new EstimationResult(62.89, "mg", Instant.parse("2025-01-05T22:00:00Z"),
                List.of(), rejected);
        return SubstanceLevelReport.of(USER_ID, HABIT_ID, LOGGED_DATE, result, true, false, 0.3);
    }

    private static ApiResponse<?> body(Response response) {
        return (ApiResponse<?>) response.getEntity();
    }

    @Test
    void testGetLevel() {
        SubstanceLevelReport report = report(List.of());
        when(substanceLevelService.estimateAtReferenceTime(USER_ID, HABIT_ID, LOGGED_DATE, null))
                .thenReturn(Uni.createFrom().item(EstimationOutcome.success(report)));

        Response response = substanceLevelResource.getLevel(USER_ID, HABIT_ID, "2025-01-05", null)
                .await().indefinitely();

        assertEquals(200, response.getStatus());
        assertEquals("Level estimated", body(response).getMessage());
        assertEquals(report, body(response).getData());
    }

    @Test
    void testGetLevelWithSleepStartAndRejections() {
        Instant sleepStart = Instant.parse("2025-01-05T23:10:00Z");
        SubstanceLevelReport report = report(List.of(new RejectedEvent("e9", "amount is required", null)));
        when(substanceLevelService.estimateAtReferenceTime(USER_ID, HABIT_ID, LOGGED_DATE, sleepStart))
                .thenReturn(Uni.createFrom().item(EstimationOutcome.success(report)));

        Response response = substanceLevelResource.getLevel(USER_ID, HABIT_ID, "2025-01-05", "2025-01-05T23:10:00Z")
                .await().indefinitely();

        assertEquals(200, response.getStatus());
        assertEquals("Level estimated, 1 events rejected", body(response).getMessage());
    }

    @Test
    void testGetLevelInvalidDate() {
        Response response = substanceLevelResource.getLevel(USER_ID, HABIT_ID, "05/01/2025", null)
                .await().indefinitely();

        assertEquals(400, response.getStatus());
        assertEquals(ResponseCodeEnum.EXCEPTION_CONTROLLER_LAYER.code(), body(response).getResponseCode());
        verifyNoInteractions(substanceLevelService);
    }

    @Test
    void testGetLevelMissingDate() {
        Response response = substanceLevelResource.getLevel(USER_ID, HABIT_ID, null, null)
                .await().indefinitely();

        assertEquals(400, response.getStatus());
        assertTrue(body(response).getMessage().contains("date is required"));
    }

    @Test
    void testGetLevelConfigurationFailure() {
        when(substanceLevelService.estimateAtReferenceTime(USER_ID, HABIT_ID, LOGGED_DATE, null))
                .thenReturn(Uni.createFrom().item(EstimationOutcome.failure(
                        ResponseCodeEnum.INVALID_CONFIGURATION, "halfLifeHours is not configured")));

        Response response = substanceLevelResource.getLevel(USER_ID, HABIT_ID, "2025-01-05", null)
                .await().indefinitely();

        assertEquals(400, response.getStatus());
        assertEquals("E2001", body(response).getResponseCode());
        assertEquals("halfLifeHours is not configured", body(response).getMessage());
    }

    @Test
    void testGetLevelHabitNotFound() {
        when(substanceLevelService.estimateAtReferenceTime(USER_ID, HABIT_ID, LOGGED_DATE, null))
                .thenReturn(Uni.createFrom().failure(new HabitNotFoundException(USER_ID, HABIT_ID)));

        Response response = substanceLevelResource.getLevel(USER_ID, HABIT_ID, "2025-01-05", null)
                .await().indefinitely();

        assertEquals(404, response.getStatus());
        assertEquals("E2004", body(response).getResponseCode());
    }

    @Test
    void testGetLevelUnexpectedFailure() {
        when(substanceLevelService.estimateAtReferenceTime(USER_ID, HABIT_ID, LOGGED_DATE, null))
                .thenReturn(Uni.createFrom().failure(new IllegalStateException("pool closed")));

        Response response = substanceLevelResource.getLevel(USER_ID, HABIT_ID, "2025-01-05", null)
                .await().indefinitely();

        assertEquals(500, response.getStatus());
        assertEquals(ResponseCodeEnum.EXCEPTION_SERVICE_LAYER.code(), body(response).getResponseCode());
    }

    @Test
    void testPublishLevel() {
        SubstanceLevelReport report = report(List.of());
        when(substanceLevelService.estimateAndPublish(USER_ID, HABIT_ID, LOGGED_DATE, null))
                .thenReturn(Uni.createFrom().item(EstimationOutcome.success(report)));

        Response response = substanceLevelResource.publishLevel(USER_ID, HABIT_ID, "2025-01-05", null)
                .await().indefinitely();

        assertEquals(200, response.getStatus());
        verify(substanceLevelService).estimateAndPublish(USER_ID, HABIT_ID, LOGGED_DATE, null);
        verify(substanceLevelService, never()).estimateAtReferenceTime(any(), any(), any(), any());
    }

    @Test
    void testGetTimeline() {
        Instant from = Instant.parse("2025-01-05T08:00:00Z");
        Instant to = Instant.parse("2025-01-05T09:00:00Z");
        LevelTimeline timeline = LevelTimeline.of(List.of(new LevelPoint(from, 10.0), new LevelPoint(to, 5.0)), 10.0, 0.3);
        when(substanceLevelService.timeline(USER_ID, HABIT_ID, from, to)).thenReturn(Uni.createFrom().item(timeline));

        Response response = substanceLevelResource.getTimeline(USER_ID, HABIT_ID, "2025-01-05T08:00:00Z",
                "2025-01-05T09:00:00Z").await().indefinitely();

        assertEquals(200, response.getStatus());
        assertEquals(timeline, body(response).getData());
    }

    @Test
    void testGetTimelineMissingBound() {
        Response response = substanceLevelResource.getTimeline(USER_ID, HABIT_ID, "2025-01-05T08:00:00Z", null)
                .await().indefinitely();

        assertEquals(400, response.getStatus());
        assertEquals("to is required", body(response).getMessage());
        verifyNoInteractions(substanceLevelService);
    }

    @Test
    void testGetTimelineTooManyPoints() {
        Instant from = Instant.parse("2020-01-01T00:00:00Z");
        Instant to = Instant.parse("2025-01-01T00:00:00Z");
        when(substanceLevelService.timeline(USER_ID, HABIT_ID, from, to))
                .thenThrow(new IllegalArgumentException("limit is 10000"));

        Response response = substanceLevelResource.getTimeline(USER_ID, HABIT_ID, "2020-01-01T00:00:00Z",
                "2025-01-01T00:00:00Z").await().indefinitely();

        assertEquals(400, response.getStatus());
        assertEquals(ResponseCodeEnum.EXCEPTION_CONTROLLER_LAYER.code(), body(response).getResponseCode());
    }

    @Test
    void testMalformedIdsNeverReachService() {
        Response level = substanceLevelResource.getLevel("not-a-uuid", HABIT_ID, "2025-01-05", null)
                .await().indefinitely();
        Response publish = substanceLevelResource.publishLevel(USER_ID, "habit-1", "2025-01-05", null)
                .await().indefinitely();
        Response timeline = substanceLevelResource.getTimeline(USER_ID, " ", "2025-01-05T08:00:00Z",
                "2025-01-05T09:00:00Z").await().indefinitely();
        Response pattern = substanceLevelResource.getDailyPattern(null, HABIT_ID, "2025-01-05", "2025-01-06")
                .await().indefinitely();

        assertEquals(400, level.getStatus());
        assertEquals("userId is not a valid UUID: not-a-uuid", body(level).getMessage());
        assertEquals(400, publish.getStatus());
        assertEquals("habitId is not a valid UUID: habit-1", body(publish).getMessage());
        assertEquals(400, timeline.getStatus());
        assertEquals("habitId is required", body(timeline).getMessage());
        assertEquals(400, pattern.getStatus());
        assertEquals(ResponseCodeEnum.EXCEPTION_CONTROLLER_LAYER.code(), body(pattern).getResponseCode());
        verifyNoInteractions(substanceLevelService);
    }

    @Test
    void testDataLayerArgumentFailureIsServerError() {
        when(substanceLevelService.estimateAtReferenceTime(USER_ID, HABIT_ID, LOGGED_DATE, null))
                .thenReturn(Uni.createFrom().failure(new IllegalArgumentException("Unknown habit type: mood")));

        Response response = substanceLevelResource.getLevel(USER_ID, HABIT_ID, "2025-01-05", null)
                .await().indefinitely();

        assertEquals(500, response.getStatus());
        assertEquals(ResponseCodeEnum.EXCEPTION_SERVICE_LAYER.code(), body(response).getResponseCode());
    }

    @Test
    void testGetDailyPatternReversedRange() {
        when(substanceLevelService.dailyPattern(USER_ID, HABIT_ID, LOGGED_DATE, LOGGED_DATE.minusDays(2)))
                .thenThrow(new IllegalArgumentException("to 2025-01-03 precedes from 2025-01-05"));

        Response response = substanceLevelResource.getDailyPattern(USER_ID, HABIT_ID, "2025-01-05", "2025-01-03")
                .await().indefinitely();

        assertEquals(400, response.getStatus());
        assertTrue(body(response).getMessage().contains("precedes"));
    }
}
