package com.sleepfactor.levels.domain.service;

import com.sleepfactor.levels.domain.model.ConsumptionEvent;
import com.sleepfactor.levels.domain.model.ConsumptionEventRecord;
import com.sleepfactor.levels.domain.model.EstimationResult;
import com.sleepfactor.levels.domain.model.HabitDecayProfile;
import com.sleepfactor.levels.exception.InvalidConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LevelEstimator Tests")
class LevelEstimatorTest {

    private static final String HABIT_ID = "caffeine";
    private static final Instant T0 = Instant.parse("2025-01-05T08:00:00Z");
    private static final double DELTA = 1e-9;

    private LevelEstimator estimator;

    @BeforeEach
    void setUp() {
        estimator = new LevelEstimator();
    }

    private static ConsumptionEvent event(Instant at, double amount) {
        return ConsumptionEvent.of(HABIT_ID, at, amount);
    }

    private static Instant hoursAfter(Instant instant, double hours) {
        return instant.plus(Duration.ofMillis((long) (hours * 3_600_000)));
    }

    @Nested
    @DisplayName("Single event decay")
    class SingleEventTests {

        @Test
        @DisplayName("Should count the full amount at the consumption instant")
        void shouldCountFullAmountAtConsumption() {
            assertEquals(100.0, estimator.estimateLevel(List.of(event(T0, 100)), T0, 5.0), DELTA);
        }

        @Test
        @DisplayName("Should halve after one half-life")
        void shouldHalveAfterOneHalfLife() {
            double level = estimator.estimateLevel(List.of(event(T0, 100)), hoursAfter(T0, 5), 5.0);
            assertEquals(50.0, level, DELTA);
        }

        @Test
        @DisplayName("Should use a fractional elapsed time")
        void shouldUseFractionalElapsedTime() {
            double level = estimator.estimateLevel(List.of(event(T0, 80)), hoursAfter(T0, 2.5), 5.0);
            assertEquals(80.0 * Math.pow(2.0, -0.5), level, 1e-6);
        }

        @Test
        @DisplayName("Should exclude an event consumed after the reference instant")
        void shouldExcludeFutureEvent() {
            Instant reference = T0;
            double level = estimator.estimateLevel(List.of(event(hoursAfter(T0, 1), 200)), reference, 5.0);
            assertEquals(0.0, level);
        }

        @Test
        @DisplayName("Should return zero for an explicit zero-amount log")
        void shouldReturnZeroForZeroAmount() {
            double level = estimator.estimateLevel(List.of(event(T0, 0)), hoursAfter(T0, 1), 5.0);
            assertEquals(0.0, level);
        }
    }

    @Nested
    @DisplayName("Superposition of events")
    class SuperpositionTests {

        @Test
        @DisplayName("Should sum the decayed contribution of every prior event")
        void shouldSumPriorEvents() {
            // 100 mg ten hours and 50 mg two hours before a 22:00 reference, half-life 5h
            Instant reference = Instant.parse("2025-01-05T22:00:00Z");
            List<ConsumptionEvent> events = List.of(
                    event(Instant.parse("2025-01-05T12:00:00Z"), 100),
                    event(Instant.parse("2025-01-05T20:00:00Z"), 50));

            double level = estimator.estimateLevel(events, reference, 5.0);

            assertEquals(100 * 0.25 + 50 * Math.pow(2.0, -0.4), level, DELTA);
            assertEquals(62.8929, level, 1e-4);
        }

        @Test
        @DisplayName("Should equal the sum of single-event estimates")
        void shouldBeAdditive() {
            Instant reference = hoursAfter(T0, 12);
            ConsumptionEvent first = event(T0, 120);
            ConsumptionEvent second = event(hoursAfter(T0, 3), 40);
            ConsumptionEvent third = event(hoursAfter(T0, 7.25), 95);

            double combined = estimator.estimateLevel(List.of(first, second, third), reference, 4.0);
            double separately = estimator.estimateLevel(List.of(first), reference, 4.0)
                    + estimator.estimateLevel(List.of(second), reference, 4.0)
                    + estimator.estimateLevel(List.of(third), reference, 4.0);

            assertEquals(separately, combined, 1e-9);
        }

        @Test
        @DisplayName("Should give an identical result regardless of input order")
        void shouldBeOrderIndependent() {
            Instant reference = hoursAfter(T0, 30);
            List<ConsumptionEvent> events = new ArrayList<>();
            for (int i = 0; i < 25; i++) {
                events.add(event(hoursAfter(T0, i * 1.13), 10.0 + i * 3.7));
            }
            double ordered = estimator.estimateLevel(events, reference, 6.0);

            List<ConsumptionEvent> shuffled = new ArrayList<>(events);
            Collections.reverse(shuffled);
            Collections.swap(shuffled, 3, 17);

            assertEquals(ordered, estimator.estimateLevel(shuffled, reference, 6.0));
        }

        @Test
        @DisplayName("Should not change when a later event is added")
        void shouldIgnoreLaterEvents() {
            Instant reference = hoursAfter(T0, 6);
            List<ConsumptionEvent> before = List.of(event(T0, 100), event(hoursAfter(T0, 4), 30));
            List<ConsumptionEvent> withLater = new ArrayList<>(before);
            withLater.add(event(hoursAfter(T0, 6.5), 500));

            assertEquals(estimator.estimateLevel(before, reference, 5.0),
                    estimator.estimateLevel(withLater, reference, 5.0));
        }

        @Test
        @DisplayName("Should never be negative")
        void shouldNeverBeNegative() {
            List<ConsumptionEvent> events = List.of(event(T0, 0), event(hoursAfter(T0, 1), 0.001));
            assertTrue(estimator.estimateLevel(events, hoursAfter(T0, 500), 2.0) >= 0.0);
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCaseTests {

        @Test
        @DisplayName("Should return zero for empty or missing events")
        void shouldReturnZeroForNoEvents() {
            assertEquals(0.0, estimator.estimateLevel(List.of(), T0, 5.0));
            assertEquals(0.0, estimator.estimateLevel(null, T0, 5.0));
        }

        @Test
        @DisplayName("Should reject invalid half-life even without events")
        void shouldRejectInvalidHalfLife() {
            assertThrows(InvalidConfigurationException.class, () -> estimator.estimateLevel(List.of(), T0, 0.0));
            assertThrows(InvalidConfigurationException.class, () -> estimator.estimateLevel(List.of(), T0, -1.0));
            assertThrows(InvalidConfigurationException.class,
                    () -> estimator.estimateLevel(List.of(), T0, Double.NaN));
        }

        @Test
        @DisplayName("Should treat a very old event as negligible")
        void shouldTreatOldEventAsNegligible() {
            double level = estimator.estimateLevel(List.of(event(T0, 100)), hoursAfter(T0, 24 * 30), 5.0);
            assertTrue(level < 1e-40);
        }
    }

    @Nested
    @DisplayName("Estimation results")
    class EstimationResultTests {

        private final HabitDecayProfile profile = new HabitDecayProfile(5.0, 5.0, "mg");

        @Test
        @DisplayName("Should report the included events and the unit")
        void shouldReportIncludedEvents() {
            Instant reference = hoursAfter(T0, 5);
            ConsumptionEvent included = event(T0, 100);
            ConsumptionEvent excluded = event(hoursAfter(T0, 6), 100);

            EstimationResult result = estimator.estimate(List.of(excluded, included), reference, profile);

            assertEquals(50.0, result.level(), DELTA);
            assertEquals("mg", result.unit());
            assertEquals(reference, result.referenceInstant());
            assertEquals(List.of(included), result.includedEvents());
            assertFalse(result.hasRejections());
        }

        @Test
        @DisplayName("Should skip invalid records and report them")
        void shouldSkipInvalidRecords() {
            List<ConsumptionEventRecord> records = List.of(
                    ConsumptionEventRecord.builder().id("e1").habitId(HABIT_ID)
                            .consumedAt("2025-01-05T08:00:00Z").amount(new BigDecimal("100")).build(),
                    ConsumptionEventRecord.builder().id("e2").habitId(HABIT_ID)
                            .consumedAt("2025-01-05T09:00:00Z").amount(new BigDecimal("-5")).build(),
                    ConsumptionEventRecord.builder().id("e3").habitId(HABIT_ID)
                            .consumedAt("yesterday").amount(new BigDecimal("40")).build());

            EstimationResult result = estimator.estimateFromRecords(records, hoursAfter(T0, 5), profile);

            assertEquals(50.0, result.level(), DELTA);
            assertEquals(1, result.includedEvents().size());
            assertTrue(result.hasRejections());
            assertEquals(List.of("e2", "e3"),
                    result.rejectedEvents().stream().map(rejected -> rejected.eventId()).toList());
        }
    }
}
