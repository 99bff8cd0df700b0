package com.sleepfactor.levels.domain.service;

import com.sleepfactor.levels.application.config.LevelEstimationConfig;
import com.sleepfactor.levels.domain.constant.AppConstant;
import com.sleepfactor.levels.domain.constant.ResponseCodeEnum;
import com.sleepfactor.levels.domain.model.ConsumptionEvent;
import com.sleepfactor.levels.domain.model.EstimationOutcome;
import com.sleepfactor.levels.domain.model.EstimationResult;
import com.sleepfactor.levels.domain.model.HabitConfig;
import com.sleepfactor.levels.domain.model.HabitDecayProfile;
import com.sleepfactor.levels.domain.model.LevelPoint;
import com.sleepfactor.levels.domain.model.LevelTimeline;
import com.sleepfactor.levels.domain.model.PatternPoint;
import com.sleepfactor.levels.domain.model.ReferenceInstant;
import com.sleepfactor.levels.domain.model.SubstanceLevelReport;
import com.sleepfactor.levels.domain.model.ValidatedEvents;
import com.sleepfactor.levels.domain.produce.SubstanceLevelProducer;
import com.sleepfactor.levels.exception.HabitNotFoundException;
import com.sleepfactor.levels.exception.InvalidConfigurationException;
import com.sleepfactor.levels.external.repository.ConsumptionEventRepository;
import com.sleepfactor.levels.external.repository.HabitRepository;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fetches a habit's configuration and consumption history and runs the estimator.
 * The habit record is read on every call so a half-life edit applies immediately.
 */
@ApplicationScoped
public class SubstanceLevelService {

    private static final Logger log = Logger.getLogger(SubstanceLevelService.class);

    private final HabitRepository habitRepository;
    private final ConsumptionEventRepository consumptionEventRepository;
    private final LevelEstimator levelEstimator;
    private final LookbackWindowPolicy lookbackWindowPolicy;
    private final ReferenceInstantResolver referenceInstantResolver;
    private final LevelTimelineGenerator levelTimelineGenerator;
    private final ConsumptionEventValidator consumptionEventValidator;
    private final SubstanceLevelProducer substanceLevelProducer;
    private final TimeUtil timeUtil;
    private final LevelEstimationConfig config;

    public SubstanceLevelService(HabitRepository habitRepository,
                                 ConsumptionEventRepository consumptionEventRepository,
                                 LevelEstimator levelEstimator,
                                 LookbackWindowPolicy lookbackWindowPolicy,
                                 ReferenceInstantResolver referenceInstantResolver,
                                 LevelTimelineGenerator levelTimelineGenerator,
                                 ConsumptionEventValidator consumptionEventValidator,
                                 SubstanceLevelProducer substanceLevelProducer,
                                 TimeUtil timeUtil,
                                 LevelEstimationConfig config) {
        this.habitRepository = habitRepository;
        this.consumptionEventRepository = consumptionEventRepository;
        this.levelEstimator = levelEstimator;
        this.lookbackWindowPolicy = lookbackWindowPolicy;
        this.referenceInstantResolver = referenceInstantResolver;
        this.levelTimelineGenerator = levelTimelineGenerator;
        this.consumptionEventValidator = consumptionEventValidator;
        this.substanceLevelProducer = substanceLevelProducer;
        this.timeUtil = timeUtil;
        this.config = config;
    }

    /**
     * Estimate a habit's level at the reference instant of a logged day.
     *
     * @param sleepStart observed sleep start overriding the habitual reference time, may be null
     * @return success with the report, or failure with {@link ResponseCodeEnum#INVALID_CONFIGURATION};
     * fails with {@link HabitNotFoundException} when the habit does not exist
     */
    public Uni<EstimationOutcome> estimateAtReferenceTime(String userId, String habitId,
                                                          LocalDate loggedDate, Instant sleepStart) {
        log.infof("Estimating level for userId: %s, habitId: %s, date: %s", userId, habitId, loggedDate);

        return loadHabit(userId, habitId)
                .onItem().transformToUni(habit -> {
                    HabitDecayProfile profile;
                    try {
                        profile = HabitDecayProfile.fromHabit(habit);
                    } catch (InvalidConfigurationException e) {
                        log.warnf("Cannot estimate habit %s for user %s: %s", habitId, userId, e.getMessage());
                        return Uni.createFrom().item(
                                EstimationOutcome.failure(ResponseCodeEnum.INVALID_CONFIGURATION, e.getMessage()));
                    }
                    return resolveReference(userId, loggedDate, sleepStart)
                            .onItem().transformToUni(reference -> estimateForReference(userId, habit, profile, reference))
                            .onItem().transform(EstimationOutcome::success);
                });
    }

    /**
     * Estimate and hand the result to the insights collaborator. A publishing failure is
     * logged and does not turn a successful estimation into a failure.
     */
    public Uni<EstimationOutcome> estimateAndPublish(String userId, String habitId,
                                                     LocalDate loggedDate, Instant sleepStart) {
        return estimateAtReferenceTime(userId, habitId, loggedDate, sleepStart)
                .onItem().transformToUni(outcome -> {
                    if (!outcome.success()) {
                        return Uni.createFrom().item(outcome);
                    }
                    return substanceLevelProducer.produceSubstanceLevel(outcome.report())
                            .onFailure().invoke(e -> log.errorf(e,
                                    "Failed to publish level for habitId: %s, date: %s", habitId, loggedDate))
                            .onFailure().recoverWithNull()
                            .replaceWith(outcome);
                });
    }

    /**
     * Level series between two instants on the configured grid, each point classified
     * against the peak of the series.
     *
     * @return Uni failing with {@link InvalidConfigurationException} for a habit without decay configuration
     * @throws IllegalArgumentException if the range needs more grid points than allowed
     */
    public Uni<LevelTimeline> timeline(String userId, String habitId, Instant from, Instant to) {
        Duration interval = Duration.ofMinutes(config.timeline().intervalMinutes());
        LevelTimelineGenerator.requireWithinPointLimit(from, to, interval);

        return loadHabit(userId, habitId)
                .onItem().transformToUni(habit -> {
                    HabitDecayProfile profile = HabitDecayProfile.fromHabit(habit);
                    Instant queryStart = lookbackWindowPolicy.windowStart(from, profile.halfLifeHours());
                    return consumptionEventRepository.findEvents(userId, habitId, queryStart, to)
                            .onItem().transform(records -> {
                                ValidatedEvents validated = consumptionEventValidator.validateAll(records);
                                List<LevelPoint> levels = levelTimelineGenerator.generateTimeline(
                                        validated.valid(), from, to, profile.halfLifeHours(), interval);
                                return LevelTimeline.of(levels, LevelTimelineGenerator.maxLevel(levels),
                                        config.indicator().moderateRatio());
                            });
                });
    }

    /**
     * Average level per clock time over the logged days {@code fromDate..toDate}. Each day is
     * evaluated from its start (the configured day-start time) to the start of the next day.
     *
     * @throws IllegalArgumentException if {@code toDate} precedes {@code fromDate} or the range
     *                                  exceeds {@value AppConstant#MAX_PATTERN_DAYS} days
     */
    public Uni<List<PatternPoint>> dailyPattern(String userId, String habitId, LocalDate fromDate, LocalDate toDate) {
        if (toDate.isBefore(fromDate)) {
            throw new IllegalArgumentException("to " + toDate + " precedes from " + fromDate);
        }
        long days = ChronoUnit.DAYS.between(fromDate, toDate) + 1;
        if (days > AppConstant.MAX_PATTERN_DAYS) {
            throw new IllegalArgumentException("Pattern covers " + days + " days, limit is " + AppConstant.MAX_PATTERN_DAYS);
        }
        ZoneId zone = timeUtil.getDefaultZoneId();
        Duration interval = Duration.ofMinutes(config.timeline().intervalMinutes());
        LocalTime dayStart = referenceInstantResolver.getDayStartTime();

        return loadHabit(userId, habitId)
                .onItem().transformToUni(habit -> {
                    HabitDecayProfile profile = HabitDecayProfile.fromHabit(habit);
                    Instant rangeStart = referenceInstantResolver.startOfLoggedDay(fromDate, zone);
                    Instant rangeEnd = referenceInstantResolver.startOfLoggedDay(toDate.plusDays(1), zone);
                    Instant queryStart = lookbackWindowPolicy.windowStart(rangeStart, profile.halfLifeHours());

                    return consumptionEventRepository.findEvents(userId, habitId, queryStart, rangeEnd)
                            .onItem().transform(records -> {
                                List<ConsumptionEvent> events = consumptionEventValidator.validateAll(records).valid();
                                // Events after a day's grid are excluded by the estimator itself
                                Map<LocalDate, List<ConsumptionEvent>> eventsByDay = new TreeMap<>();
                                for (LocalDate day = fromDate; !day.isAfter(toDate); day = day.plusDays(1)) {
                                    eventsByDay.put(day, events);
                                }
                                return levelTimelineGenerator.averageDailyPattern(eventsByDay,
                                        dayStart, dayStart, zone, profile.halfLifeHours(), interval);
                            });
                });
    }

    private Uni<HabitConfig> loadHabit(String userId, String habitId) {
        return habitRepository.findHabitConfig(userId, habitId)
                .onItem().ifNull().failWith(() -> new HabitNotFoundException(userId, habitId));
    }

    private Uni<ReferenceInstant> resolveReference(String userId, LocalDate loggedDate, Instant sleepStart) {
        ZoneId zone = timeUtil.getDefaultZoneId();
        Instant now = timeUtil.getCurrentTimeUTC();
        if (sleepStart != null) {
            return Uni.createFrom().item(
                    referenceInstantResolver.fromObservedSleepStart(loggedDate, sleepStart, zone, now));
        }
        return habitRepository.findReferenceClockTime(userId)
                .onItem().transform(clockTime -> referenceInstantResolver.resolve(loggedDate, clockTime, zone, now));
    }

    private Uni<SubstanceLevelReport> estimateForReference(String userId, HabitConfig habit,
                                                           HabitDecayProfile profile, ReferenceInstant reference) {
        Instant referenceInstant = reference.instant();
        double moderateRatio = config.indicator().moderateRatio();
        Instant queryStart = lookbackWindowPolicy.windowStart(referenceInstant, profile.halfLifeHours());
        Instant dayStart = referenceInstantResolver.startOfLoggedDay(reference.loggedDate(), timeUtil.getDefaultZoneId());
        if (log.isDebugEnabled()) {
            log.debugf("Querying habit %s events from %s, single doses negligible after %.1fh",
                    habit.getId(), queryStart, profile.negligibleAfterHours());
        }

        return consumptionEventRepository.findEvents(userId, habit.getId(), queryStart, referenceInstant)
                .onItem().transform(records -> {
                    EstimationResult result = levelEstimator.estimateFromRecords(records, referenceInstant, profile);
                    boolean loggedThatDay = result.includedEvents().stream()
                            .anyMatch(event -> !event.consumedAt().isBefore(dayStart));

                    if (result.hasRejections()) {
                        log.warnf("Estimation for habitId: %s, date: %s skipped %d invalid events",
                                habit.getId(), reference.loggedDate(), result.rejectedEvents().size());
                    }
                    log.infof("Level for habit %s (%s) on %s: %.2f %s at %s",
                            habit.getId(), habit.getName(), reference.loggedDate(), result.level(),
                            result.unit(), referenceInstant);

                    return SubstanceLevelReport.of(userId, habit.getId(), reference.loggedDate(), result,
                            loggedThatDay, reference.projected(), moderateRatio);
                });
    }
}
