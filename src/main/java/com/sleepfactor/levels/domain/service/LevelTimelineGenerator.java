package com.sleepfactor.levels.domain.service;

import com.sleepfactor.levels.domain.constant.AppConstant;
import com.sleepfactor.levels.domain.model.ConsumptionEvent;
import com.sleepfactor.levels.domain.model.LevelPoint;
import com.sleepfactor.levels.domain.model.PatternPoint;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Level series over a time range, and the average daily pattern across days.
 * Every point is an independent {@link LevelEstimator#estimateLevel} call.
 */
@ApplicationScoped
public class LevelTimelineGenerator {

    private static final Logger log = Logger.getLogger(LevelTimelineGenerator.class);

    private final LevelEstimator levelEstimator;

    @Inject
    public LevelTimelineGenerator(LevelEstimator levelEstimator) {
        this.levelEstimator = levelEstimator;
    }

    /**
     * Levels at {@code start}, {@code start + interval}, ... up to and including {@code end}.
     *
     * @return ordered points, empty when {@code end} precedes {@code start}
     * @throws IllegalArgumentException if the interval is not positive or the range needs
     *                                  more than {@value AppConstant#MAX_TIMELINE_POINTS} points
     */
    public List<LevelPoint> generateTimeline(Collection<ConsumptionEvent> events, Instant start, Instant end,
                                             double halfLifeHours, Duration interval) {
        requirePositive(interval);
        DecayFunction.requireValidHalfLife(halfLifeHours);
        if (end.isBefore(start)) {
            return List.of();
        }

        long pointCount = requireWithinPointLimit(start, end, interval);

        List<LevelPoint> points = new ArrayList<>((int) pointCount);
        for (long i = 0; i < pointCount; i++) {
            Instant time = start.plus(interval.multipliedBy(i));
            points.add(new LevelPoint(time, levelEstimator.estimateLevel(events, time, halfLifeHours)));
        }

        if (log.isDebugEnabled()) {
            log.debugf("Generated %d level points between %s and %s", points.size(), start, end);
        }
        return points;
    }

    /**
     * Number of grid points from {@code start} to {@code end}, both included.
     *
     * @throws IllegalArgumentException if the interval is not positive or the count exceeds
     *                                  {@value AppConstant#MAX_TIMELINE_POINTS}
     */
    public static long requireWithinPointLimit(Instant start, Instant end, Duration interval) {
        requirePositive(interval);
        if (end.isBefore(start)) {
            return 0;
        }
        long pointCount = Duration.between(start, end).toNanos() / interval.toNanos() + 1;
        if (pointCount > AppConstant.MAX_TIMELINE_POINTS) {
            throw new IllegalArgumentException("Timeline from " + start + " to " + end + " every " + interval
                    + " needs " + pointCount + " points, limit is " + AppConstant.MAX_TIMELINE_POINTS);
        }
        return pointCount;
    }

    /**
     * Average of each day's timeline on a shared clock grid. For every day, the grid runs from
     * {@code startTime} on that day to {@code endTime}, on the next day when {@code endTime} is
     * not after {@code startTime}. A full day ({@code endTime} equal to {@code startTime})
     * reports the shared clock time once, at the start of the grid.
     *
     * @param eventsByDay events to use for each day, typically that day plus its lookback
     * @return one point per grid clock time, empty when no days are given
     */
    public List<PatternPoint> averageDailyPattern(Map<LocalDate, ? extends Collection<ConsumptionEvent>> eventsByDay,
                                                  LocalTime startTime, LocalTime endTime, ZoneId zone,
                                                  double halfLifeHours, Duration interval) {
        if (eventsByDay == null || eventsByDay.isEmpty()) {
            return List.of();
        }

        boolean fullDay = endTime.equals(startTime);
        double[] totals = null;
        List<LocalTime> grid = null;
        for (Map.Entry<LocalDate, ? extends Collection<ConsumptionEvent>> day : eventsByDay.entrySet()) {
            LocalDateTime dayStart = day.getKey().atTime(startTime);
            LocalDateTime dayEnd = endTime.isAfter(startTime)
                    ? day.getKey().atTime(endTime)
                    : day.getKey().plusDays(1).atTime(endTime);

            List<LevelPoint> timeline = generateTimeline(day.getValue(),
                    dayStart.atZone(zone).toInstant(), dayEnd.atZone(zone).toInstant(), halfLifeHours, interval);
            if (fullDay && !timeline.isEmpty()
                    && timeline.get(timeline.size() - 1).time().atZone(zone).toLocalTime().equals(startTime)) {
                // The closing point is the next day's opening clock time
                timeline = timeline.subList(0, timeline.size() - 1);
            }

            if (totals == null) {
                totals = new double[timeline.size()];
                grid = new ArrayList<>(timeline.size());
                for (LevelPoint point : timeline) {
                    grid.add(point.time().atZone(zone).toLocalTime());
                }
            }
            // A DST transition can lengthen or shorten one day's grid; align on the shared prefix
            for (int i = 0; i < Math.min(totals.length, timeline.size()); i++) {
                totals[i] += timeline.get(i).level();
            }
        }

        int days = eventsByDay.size();
        List<PatternPoint> pattern = new ArrayList<>(totals.length);
        for (int i = 0; i < totals.length; i++) {
            pattern.add(new PatternPoint(grid.get(i), totals[i] / days));
        }
        return pattern;
    }

    /**
     * Highest level in the series, 0 for a missing or empty series.
     */
    public static double maxLevel(List<LevelPoint> points) {
        if (points == null || points.isEmpty()) {
            return 0.0;
        }
        double max = 0.0;
        for (LevelPoint point : points) {
            max = Math.max(max, point.level());
        }
        return max;
    }

    private static void requirePositive(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Timeline interval must be positive but was " + interval);
        }
    }
}
