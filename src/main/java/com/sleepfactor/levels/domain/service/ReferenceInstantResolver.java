package com.sleepfactor.levels.domain.service;

import com.sleepfactor.levels.application.config.LevelEstimationConfig;
import com.sleepfactor.levels.domain.constant.AppConstant;
import com.sleepfactor.levels.domain.model.ReferenceInstant;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a logged day and a habitual clock time to the instant a level is evaluated at.
 * <p>
 * A logged day D starts at the configured day-start time (04:00 by default). The
 * reference instant is the first occurrence of the clock time at or after that start:
 * 22:00 resolves to D 22:00, 01:30 resolves to D+1 01:30. The result depends only on
 * the date, the clock time and the zone; "now" is used solely to flag a reference
 * instant that has not happened yet.
 */
@ApplicationScoped
public class ReferenceInstantResolver {

    private static final Logger log = Logger.getLogger(ReferenceInstantResolver.class);

    // HH:mm, HH:mm:ss, HH:mm:ss.SSS with an optional trailing offset, which is ignored
    private static final Pattern CLOCK_TIME = Pattern.compile(
            "^(\\d{1,2}):(\\d{2})(?::(\\d{2})(?:\\.\\d{1,9})?)?\\s*(?:Z|[+-]\\d{2}(?::?\\d{2})?)?$");

    private final LocalTime defaultReferenceTime;
    private final LocalTime dayStartTime;

    @Inject
    public ReferenceInstantResolver(LevelEstimationConfig config) {
        this(parseOrFallback(config.defaultReferenceTime(), AppConstant.DEFAULT_REFERENCE_TIME),
                parseOrFallback(config.dayStartTime(), AppConstant.DEFAULT_DAY_START_TIME));
    }

    public ReferenceInstantResolver() {
        this(LocalTime.parse(AppConstant.DEFAULT_REFERENCE_TIME), LocalTime.parse(AppConstant.DEFAULT_DAY_START_TIME));
    }

    public ReferenceInstantResolver(LocalTime defaultReferenceTime, LocalTime dayStartTime) {
        this.defaultReferenceTime = Objects.requireNonNull(defaultReferenceTime, "defaultReferenceTime");
        this.dayStartTime = Objects.requireNonNull(dayStartTime, "dayStartTime");
    }

    /**
     * @param loggedDate        the logged day
     * @param habitualClockTime user's reference time as HH:mm[:ss]; missing or unparsable
     *                          values fall back to the default reference time
     * @param zone              zone the clock time is expressed in
     * @param now               current instant
     * @return concrete reference instant
     */
    public Instant resolveReferenceInstant(LocalDate loggedDate, String habitualClockTime, ZoneId zone, Instant now) {
        return resolve(loggedDate, habitualClockTime, zone, now).instant();
    }

    public ReferenceInstant resolve(LocalDate loggedDate, String habitualClockTime, ZoneId zone, Instant now) {
        Objects.requireNonNull(loggedDate, "loggedDate");
        Objects.requireNonNull(zone, "zone");

        Optional<LocalTime> parsed = parseClockTime(habitualClockTime);
        if (parsed.isEmpty() && habitualClockTime != null && !habitualClockTime.isBlank()) {
            log.warnf("Unparsable reference time '%s' for %s, using default %s",
                    habitualClockTime, loggedDate, defaultReferenceTime);
        }
        LocalTime clockTime = parsed.orElse(defaultReferenceTime);

        LocalDate referenceDate = clockTime.isBefore(dayStartTime) ? loggedDate.plusDays(1) : loggedDate;
        Instant instant = referenceDate.atTime(clockTime).atZone(zone).toInstant();
        boolean projected = now != null && instant.isAfter(now);

        if (log.isDebugEnabled()) {
            log.debugf("Reference instant for %s at %s (%s): %s%s",
                    loggedDate, clockTime, zone, instant, projected ? " [projected]" : "");
        }
        return new ReferenceInstant(loggedDate, clockTime, instant, parsed.isEmpty(), projected);
    }

    /**
     * Use an observed sleep start (e.g. from a sleep record) instead of the habitual time.
     */
    public ReferenceInstant fromObservedSleepStart(LocalDate loggedDate, Instant sleepStart, ZoneId zone, Instant now) {
        Objects.requireNonNull(sleepStart, "sleepStart");
        LocalTime clockTime = sleepStart.atZone(zone).toLocalTime();
        boolean projected = now != null && sleepStart.isAfter(now);
        return new ReferenceInstant(loggedDate, clockTime, sleepStart, false, projected);
    }

    /**
     * First instant that belongs to the logged day.
     */
    public Instant startOfLoggedDay(LocalDate loggedDate, ZoneId zone) {
        return loggedDate.atTime(dayStartTime).atZone(zone).toInstant();
    }

    Optional<LocalTime> parseClockTime(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = CLOCK_TIME.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            int hour = Integer.parseInt(matcher.group(1));
            int minute = Integer.parseInt(matcher.group(2));
            int second = matcher.group(3) != null ? Integer.parseInt(matcher.group(3)) : 0;
            return Optional.of(LocalTime.of(hour, minute, second));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static LocalTime parseOrFallback(String configured, String fallback) {
        try {
            return LocalTime.parse(configured.trim());
        } catch (RuntimeException e) {
            log.warnf("Invalid clock time '%s' in configuration, using %s", configured, fallback);
            return LocalTime.parse(fallback);
        }
    }

    public LocalTime getDayStartTime() {
        return dayStartTime;
    }
}
