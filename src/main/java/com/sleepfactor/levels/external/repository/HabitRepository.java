package com.sleepfactor.levels.external.repository;

import com.sleepfactor.levels.domain.model.HabitConfig;
import com.sleepfactor.levels.domain.model.HabitType;
import com.sleepfactor.levels.exception.InvalidConfigurationException;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.Pool;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.RowIterator;
import io.vertx.mutiny.sqlclient.RowSet;
import io.vertx.mutiny.sqlclient.Tuple;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;


import static com.sleepfactor.levels.domain.constant.SQLConstant.QUERY_HABIT_CONFIG;
import static com.sleepfactor.levels.domain.constant.SQLConstant.QUERY_USER_REFERENCE_TIME;

/**
 * Read access to habit configuration and the user's habitual reference time.
 * Nothing is cached: a configuration edit applies to the next estimation.
 */
@ApplicationScoped
@JBossLog
public class HabitRepository {

    private static final String COL_ID = "id";
    private static final String COL_USER_ID = "user_id";
    private static final String COL_NAME = "name";
    private static final String COL_TYPE = "type";
    private static final String COL_UNIT = "unit";
    private static final String COL_HALF_LIFE_HOURS = "half_life_hours";
    private static final String COL_DRUG_THRESHOLD_PERCENT = "drug_threshold_percent";
    private static final String COL_NOTIFICATION_TIME = "notification_time";

    private final Pool client;

    @Inject
    public HabitRepository(Pool client) {
        this.client = client;
    }

    /**
     * Fetch the configuration of one habit.
     *
     * @return Uni emitting the habit, or null when it does not exist for the user; fails with
     * {@link InvalidConfigurationException} when the stored habit type is unknown
     */
    @CircuitBreaker(requestVolumeThreshold = 10, failureRatio = 0.5, delay = 5000,
            skipOn = {IllegalArgumentException.class, InvalidConfigurationException.class})
    @Retry(maxRetries = 2, delay = 100, maxDuration = 5000,
            abortOn = {IllegalArgumentException.class, InvalidConfigurationException.class})
    @Timeout(value = 5000)
    public Uni<HabitConfig> findHabitConfig(String userId, String habitId) {
        if (log.isDebugEnabled()) {
            log.debugf("Fetching habit config for userId: %s, habitId: %s", userId, habitId);
        }
        return Uni.createFrom().item(() -> Tuple.of(RepositoryUtil.toUuid(userId), RepositoryUtil.toUuid(habitId)))
                .onItem().transformToUni(params -> client.preparedQuery(QUERY_HABIT_CONFIG).execute(params))
                .onItem().transform(this::mapFirstRowToHabitConfig)
                .onFailure(IllegalArgumentException.class).invoke(e ->
                        log.warnf("Rejected habit config lookup for userId: %s, habitId: %s: %s",
                                userId, habitId, e.getMessage()))
                .onFailure(e -> !(e instanceof IllegalArgumentException)).invoke(e ->
                        log.errorf(e, "Failed to fetch habit config for userId: %s, habitId: %s", userId, habitId));
    }

    /**
     * Fetch the user's habitual reference clock time as stored (HH:mm[:ss]).
     *
     * @return Uni emitting the clock time text, or null when unset
     */
    @CircuitBreaker(requestVolumeThreshold = 10, failureRatio = 0.5, delay = 5000,
            skipOn = {IllegalArgumentException.class, InvalidConfigurationException.class})
    @Retry(maxRetries = 2, delay = 100, maxDuration = 5000,
            abortOn = {IllegalArgumentException.class, InvalidConfigurationException.class})
    @Timeout(value = 3000)
    public Uni<String> findReferenceClockTime(String userId) {
        return Uni.createFrom().item(() -> Tuple.of(RepositoryUtil.toUuid(userId)))
                .onItem().transformToUni(params -> client.preparedQuery(QUERY_USER_REFERENCE_TIME).execute(params))
                .onItem().transform(rows -> {
                    RowIterator<Row> iterator = rows.iterator();
                    if (!iterator.hasNext()) {
                        return null;
                    }
                    Object value = iterator.next().getValue(COL_NOTIFICATION_TIME);
                    return value != null ? value.toString() : null;
                })
                .onFailure(IllegalArgumentException.class).invoke(e ->
                        log.warnf("Rejected reference time lookup for userId: %s: %s", userId, e.getMessage()))
                .onFailure(e -> !(e instanceof IllegalArgumentException)).invoke(e ->
                        log.errorf(e, "Failed to fetch reference time for userId: %s", userId));
    }

    private static HabitType toHabitType(String value, Object habitId) {
        try {
            return HabitType.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Habit " + habitId + " has unknown type '" + value + "'");
        }
    }

    private HabitConfig mapFirstRowToHabitConfig(RowSet<Row> rows) {
        RowIterator<Row> iterator = rows.iterator();
        if (!iterator.hasNext()) {
            return null;
        }
        Row row = iterator.next();
        return HabitConfig.builder()
                .id(RepositoryUtil.toText(row.getValue(COL_ID)))
                .userId(RepositoryUtil.toText(row.getValue(COL_USER_ID)))
                .name(row.getString(COL_NAME))
                .type(toHabitType(row.getString(COL_TYPE), row.getValue(COL_ID)))
                .unit(row.getString(COL_UNIT))
                .halfLifeHours(RepositoryUtil.toDouble(row.getValue(COL_HALF_LIFE_HOURS)))
                .drugThresholdPercent(RepositoryUtil.toDouble(row.getValue(COL_DRUG_THRESHOLD_PERCENT)))
                .build();
    }
}
