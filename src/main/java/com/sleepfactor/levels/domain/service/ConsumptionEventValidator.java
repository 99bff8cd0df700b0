package com.sleepfactor.levels.domain.service;

import com.sleepfactor.levels.domain.constant.AppConstant;
import com.sleepfactor.levels.domain.model.ConsumptionEvent;
import com.sleepfactor.levels.domain.model.ConsumptionEventRecord;
import com.sleepfactor.levels.domain.model.RejectedEvent;
import com.sleepfactor.levels.domain.model.ValidatedEvents;
import com.sleepfactor.levels.exception.InvalidEventException;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Turns raw consumption rows into validated {@link ConsumptionEvent}s.
 * A bad row is rejected on its own; the remaining rows are still usable.
 */
@ApplicationScoped
public class ConsumptionEventValidator {

    private static final Logger log = Logger.getLogger(ConsumptionEventValidator.class);

    // ISO-8601 ("2025-01-05T08:00:00Z") and Postgres text form ("2025-01-05 08:00:00.123+00")
    static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffset("+HH:MM:ss", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHmm", "Z").optionalEnd()
            .optionalStart().appendOffset("+HH", "Z").optionalEnd()
            .toFormatter();

    /**
     * Validate a single record.
     *
     * @throws InvalidEventException if the timestamp is missing, unparsable or has no offset,
     *                               or the amount is missing or negative
     */
    public ConsumptionEvent toEvent(ConsumptionEventRecord record) {
        if (record == null) {
            throw new InvalidEventException(null, "consumption record is null");
        }
        Instant consumedAt = parseTimestamp(record.getId(), record.getConsumedAt());

        BigDecimal amount = record.getAmount();
        if (amount == null) {
            throw new InvalidEventException(record.getId(), "amount is required");
        }
        if (amount.signum() < 0) {
            throw new InvalidEventException(record.getId(), "amount must not be negative but was " + amount);
        }

        return new ConsumptionEvent(
                record.getId(),
                record.getHabitId(),
                consumedAt,
                amount.doubleValue(),
                record.getDrinkType());
    }

    /**
     * Validate every record, partitioning into usable events and rejections.
     */
    public ValidatedEvents validateAll(Collection<ConsumptionEventRecord> records) {
        if (records == null || records.isEmpty()) {
            return new ValidatedEvents(List.of(), List.of());
        }

        List<ConsumptionEvent> valid = new ArrayList<>(
                Math.max(records.size(), AppConstant.CONSUMPTION_EVENTS_INITIAL_CAPACITY));
        List<RejectedEvent> rejected = new ArrayList<>();

        for (ConsumptionEventRecord record : records) {
            try {
                valid.add(toEvent(record));
            } catch (InvalidEventException e) {
                log.warnf("Rejected consumption event %s for habit %s: %s",
                        e.getEventId(), record != null ? record.getHabitId() : null, e.getMessage());
                rejected.add(new RejectedEvent(e.getEventId(), e.getMessage(), record));
            }
        }

        if (log.isDebugEnabled()) {
            log.debugf("Validated %d consumption records: %d valid, %d rejected",
                    records.size(), valid.size(), rejected.size());
        }
        return new ValidatedEvents(valid, rejected);
    }

    Instant parseTimestamp(String eventId, String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidEventException(eventId, "consumedAt is required");
        }
        TemporalAccessor parsed;
        try {
            parsed = TIMESTAMP_FORMAT.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidEventException(eventId, "consumedAt is not a valid timestamp: " + text, e);
        }
        if (!parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            throw new InvalidEventException(eventId, "consumedAt has no zone offset: " + text);
        }
        return OffsetDateTime.from(parsed).toInstant();
    }
}
