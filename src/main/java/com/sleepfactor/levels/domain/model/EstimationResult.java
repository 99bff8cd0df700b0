package com.sleepfactor.levels.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Estimated residual level at a reference instant, with the events that were
 * summed and the ones rejected during validation. Never persisted here.
 */
public record EstimationResult(
        double level,
        String unit,
        Instant referenceInstant,
        List<ConsumptionEvent> includedEvents,
        List<RejectedEvent> rejectedEvents) {

    public EstimationResult {
        includedEvents = includedEvents != null ? List.copyOf(includedEvents) : List.of();
        rejectedEvents = rejectedEvents != null ? List.copyOf(rejectedEvents) : List.of();
    }

    public boolean hasRejections() {
        return !rejectedEvents.isEmpty();
    }
}
