package com.sleepfactor.levels.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Level at the reference instant of one logged day, as handed to the insights
 * collaborator.
 *
 * @param hasLoggedEvents      true when at least one valid event, whatever its amount, was consumed
 *                             between the start of the logged day and the reference instant;
 *                             distinguishes "logged zero" from "not logged"
 * @param projected            true when the reference instant had not yet passed
 * @param typicalDose          mean amount of the summed events, 0 when there are none
 * @param indicator            level classified against the typical dose
 * @param percentOfTypicalDose level as a percentage of the typical dose, not capped
 */
public record SubstanceLevelReport(
        String userId,
        String habitId,
        LocalDate loggedDate,
        EstimationResult result,
        boolean hasLoggedEvents,
        boolean projected,
        double typicalDose,
        LevelIndicator indicator,
        double percentOfTypicalDose) {

    /**
     * Builds the report and rates the level against the typical dose of the summed events.
     */
    public static SubstanceLevelReport of(String userId, String habitId, LocalDate loggedDate,
                                          EstimationResult result, boolean hasLoggedEvents, boolean projected,
                                          double moderateRatio) {
        double typicalDose = typicalDose(result.includedEvents());
        double percent = typicalDose > 0 ? result.level() / typicalDose * 100.0 : 0.0;
        return new SubstanceLevelReport(userId, habitId, loggedDate, result, hasLoggedEvents, projected,
                typicalDose, LevelIndicator.classify(result.level(), typicalDose, moderateRatio), percent);
    }

    static double typicalDose(List<ConsumptionEvent> events) {
        if (events.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (ConsumptionEvent event : events) {
            total += event.amount();
        }
        return total / events.size();
    }

    public double level() {
        return result.level();
    }

    public String unit() {
        return result.unit();
    }
}
