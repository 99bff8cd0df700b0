package com.sleepfactor.levels.domain.model;

/**
 * A consumption record left out of an estimation because it failed validation.
 */
public record RejectedEvent(String eventId, String reason, ConsumptionEventRecord source) {
}
