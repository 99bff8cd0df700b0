package com.sleepfactor.levels.domain.constant;

public class SQLConstant {
    private SQLConstant() {
    }
    public static final String QUERY_HABIT_CONFIG = """
                        SELECT
                           h.id,
                           h.user_id,
                           h.name,
                           h.type,
                           h.unit,
                           h.half_life_hours,
                           h.drug_threshold_percent
                        FROM habits h
                        WHERE h.user_id = $1
                          AND h.id = $2
            """;

    public static final String QUERY_USER_REFERENCE_TIME = """
                        SELECT u.notification_time
                        FROM users u
                        WHERE u.id = $1
            """;

    public static final String QUERY_CONSUMPTION_EVENTS = """
                        SELECT
                           e.id,
                           e.user_id,
                           e.habit_id,
                           e.consumed_at,
                           e.amount,
                           e.drink_type
                        FROM habit_consumption_events e
                        WHERE e.user_id = $1
                          AND e.habit_id = $2
                          AND e.consumed_at >= $3
                          AND e.consumed_at <= $4
                        ORDER BY e.consumed_at ASC
            """;

    /**
     * One row per table the estimator reads: table name and whether it resolves.
     */
    public static final String QUERY_HEALTH = """
                        SELECT t.name, to_regclass(t.name) IS NOT NULL AS present
                        FROM (VALUES ('habits'), ('users'), ('habit_consumption_events')) AS t(name)
            """;
}
