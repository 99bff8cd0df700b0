package com.sleepfactor.levels.domain.service;

import com.sleepfactor.levels.domain.model.ConsumptionEvent;
import com.sleepfactor.levels.domain.model.ConsumptionEventRecord;
import com.sleepfactor.levels.domain.model.EstimationResult;
import com.sleepfactor.levels.domain.model.HabitDecayProfile;
import com.sleepfactor.levels.domain.model.ValidatedEvents;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Estimates the residual level of a substance at a reference instant by
 * superposing the exponential decay of every event at or before that instant.
 * <p>
 * Events after the reference instant are excluded outright. No event is pruned
 * for being old: the caller bounds history through {@link LookbackWindowPolicy}.
 * Stateless; the decay profile is passed on every call.
 */
@ApplicationScoped
public class LevelEstimator {

    private static final Logger log = Logger.getLogger(LevelEstimator.class);

    // Fixed summation order makes the result independent of input order, bit for bit
    private static final Comparator<ConsumptionEvent> SUMMATION_ORDER = Comparator
            .comparing(ConsumptionEvent::consumedAt)
            .thenComparingDouble(ConsumptionEvent::amount);

    private final ConsumptionEventValidator validator;

    @Inject
    public LevelEstimator(ConsumptionEventValidator validator) {
        this.validator = validator;
    }

    public LevelEstimator() {
        this(new ConsumptionEventValidator());
    }

    /**
     * Sum of {@code amount * remainingFraction(reference - consumedAt, halfLife)} over the
     * events consumed at or before the reference instant.
     *
     * @return estimated level, 0 when no event contributes
     * @throws com.sleepfactor.levels.exception.InvalidConfigurationException for an invalid half-life
     */
    public double estimateLevel(Collection<ConsumptionEvent> events, Instant referenceInstant, double halfLifeHours) {
        DecayFunction.requireValidHalfLife(halfLifeHours);
        Objects.requireNonNull(referenceInstant, "referenceInstant");
        return sum(contributingEvents(events, referenceInstant), referenceInstant, halfLifeHours);
    }

    /**
     * Estimate from already validated events.
     */
    public EstimationResult estimate(Collection<ConsumptionEvent> events, Instant referenceInstant,
                                     HabitDecayProfile profile) {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(referenceInstant, "referenceInstant");

        List<ConsumptionEvent> included = contributingEvents(events, referenceInstant);
        double level = sum(included, referenceInstant, profile.halfLifeHours());

        if (log.isDebugEnabled()) {
            log.debugf("Estimated level %.4f %s at %s from %d of %d events (half-life %.2fh)",
                    level, profile.unit(), referenceInstant, included.size(),
                    events != null ? events.size() : 0, profile.halfLifeHours());
        }
        return new EstimationResult(level, profile.unit(), referenceInstant, included, List.of());
    }

    /**
     * Validate raw records and estimate from the valid ones. Invalid records are
     * reported in the result, never fatal.
     */
    public EstimationResult estimateFromRecords(Collection<ConsumptionEventRecord> records, Instant referenceInstant,
                                                HabitDecayProfile profile) {
        Objects.requireNonNull(profile, "profile");
        ValidatedEvents validated = validator.validateAll(records);
        EstimationResult result = estimate(validated.valid(), referenceInstant, profile);
        return new EstimationResult(result.level(), result.unit(), result.referenceInstant(),
                result.includedEvents(), validated.rejected());
    }

    private static List<ConsumptionEvent> contributingEvents(Collection<ConsumptionEvent> events,
                                                             Instant referenceInstant) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        List<ConsumptionEvent> included = new ArrayList<>(events.size());
        for (ConsumptionEvent event : events) {
            if (event != null && !event.consumedAt().isAfter(referenceInstant)) {
                included.add(event);
            }
        }
        included.sort(SUMMATION_ORDER);
        return included;
    }

    private static double sum(List<ConsumptionEvent> included, Instant referenceInstant, double halfLifeHours) {
        double level = 0.0;
        for (ConsumptionEvent event : included) {
            double elapsedHours = TimeUtil.elapsedHours(event.consumedAt(), referenceInstant);
            level += event.amount() * DecayFunction.remainingFraction(elapsedHours, halfLifeHours);
        }
        return level;
    }
}
