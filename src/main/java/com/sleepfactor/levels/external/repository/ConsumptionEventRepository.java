package com.sleepfactor.levels.external.repository;

import com.sleepfactor.levels.domain.constant.AppConstant;
import com.sleepfactor.levels.domain.model.ConsumptionEventRecord;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.Pool;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.RowSet;
import io.vertx.mutiny.sqlclient.Tuple;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.sleepfactor.levels.domain.constant.SQLConstant.QUERY_CONSUMPTION_EVENTS;

/**
 * Repository for habit_consumption_events.
 * Rows are returned unvalidated; malformed values are left for the estimator to reject.
 */
@ApplicationScoped
public class ConsumptionEventRepository {

    private static final Logger log = Logger.getLogger(ConsumptionEventRepository.class);

    private static final String COL_ID = "id";
    private static final String COL_USER_ID = "user_id";
    private static final String COL_HABIT_ID = "habit_id";
    private static final String COL_CONSUMED_AT = "consumed_at";
    private static final String COL_AMOUNT = "amount";
    private static final String COL_DRINK_TYPE = "drink_type";

    private final Pool client;

    @Inject
    public ConsumptionEventRepository(Pool client) {
        this.client = client;
    }

    /**
     * Fetch consumption events of one habit with {@code from <= consumed_at <= to}.
     *
     * @return Uni containing the rows ordered by consumption time, failing with
     * {@link IllegalArgumentException} for a malformed id without retry or breaker accounting
     */
    @CircuitBreaker(
            requestVolumeThreshold = 10,
            failureRatio = 0.5,
            delay = 10000,
            successThreshold = 2,
            skipOn = IllegalArgumentException.class
    )
    @Retry(
            maxRetries = 2,
            delay = 100,
            maxDuration = 10000,
            abortOn = IllegalArgumentException.class
    )
    @Timeout(value = 5000)
    public Uni<List<ConsumptionEventRecord>> findEvents(String userId, String habitId, Instant from, Instant to) {
        if (log.isDebugEnabled()) {
            log.debugf("Fetching consumption events for userId: %s, habitId: %s between %s and %s",
                    userId, habitId, from, to);
        }
        return Uni.createFrom().item(() -> Tuple.of(
                        RepositoryUtil.toUuid(userId),
                        RepositoryUtil.toUuid(habitId),
                        OffsetDateTime.ofInstant(from, ZoneOffset.UTC),
                        OffsetDateTime.ofInstant(to, ZoneOffset.UTC)))
                .onItem().transformToUni(params -> client.preparedQuery(QUERY_CONSUMPTION_EVENTS).execute(params))
                .onItem().transform(this::mapRowsToRecords)
                .onFailure(IllegalArgumentException.class).invoke(error ->
                        log.warnf("Rejected consumption event lookup for userId: %s, habitId: %s: %s",
                                userId, habitId, error.getMessage()))
                .onFailure(error -> !(error instanceof IllegalArgumentException)).invoke(error ->
                        log.errorf(error, "Error fetching consumption events for userId: %s, habitId: %s",
                                userId, habitId))
                .onItem().invoke(results -> {
                    if (log.isDebugEnabled()) {
                        log.debugf("Fetched %d consumption events for habitId: %s", results.size(), habitId);
                    }
                });
    }

    private List<ConsumptionEventRecord> mapRowsToRecords(RowSet<Row> rows) {
        List<ConsumptionEventRecord> records = new ArrayList<>(
                Math.max(rows.size(), AppConstant.CONSUMPTION_EVENTS_INITIAL_CAPACITY));
        for (Row row : rows) {
            records.add(ConsumptionEventRecord.builder()
                    .id(RepositoryUtil.toText(row.getValue(COL_ID)))
                    .userId(RepositoryUtil.toText(row.getValue(COL_USER_ID)))
                    .habitId(RepositoryUtil.toText(row.getValue(COL_HABIT_ID)))
                    .consumedAt(RepositoryUtil.toText(row.getValue(COL_CONSUMED_AT)))
                    .amount(toAmount(row))
                    .drinkType(row.getString(COL_DRINK_TYPE))
                    .build());
        }
        return records;
    }

    private BigDecimal toAmount(Row row) {
        Object value = row.getValue(COL_AMOUNT);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.toString());
        } catch (NumberFormatException e) {
            log.warnf("Unreadable amount '%s' on consumption event %s", value, row.getValue(COL_ID));
            return null;
        }
    }
}
