package com.sleepfactor.levels.application.health;

import com.sleepfactor.levels.domain.constant.SQLConstant;
import io.vertx.mutiny.sqlclient.Pool;
import io.vertx.mutiny.sqlclient.Row;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Readiness of the database holding habits, users and consumption events. Up only when
 * every table the estimator reads is present.
 */
@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    private static final Logger log = Logger.getLogger(DatabaseHealthCheck.class);
    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String PRESENT = "present";
    private static final String MISSING = "missing";

    private final Pool client;

    @Inject
    public DatabaseHealthCheck(Pool client) {
        this.client = client;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("Level estimation tables health check");

        try {
            Map<String, Boolean> tables = client.query(SQLConstant.QUERY_HEALTH)
                    .execute()
                    .map(rowSet -> {
                        Map<String, Boolean> found = new LinkedHashMap<>();
                        for (Row row : rowSet) {
                            found.put(row.getString(0), Boolean.TRUE.equals(row.getBoolean(1)));
                        }
                        return found;
                    })
                    .await()
                    .atMost(TIMEOUT);

            if (tables.isEmpty()) {
                return builder
                        .down()
                        .withData("status", "Database returned no table status")
                        .build();
            }
            boolean allPresent = true;
            for (Map.Entry<String, Boolean> table : tables.entrySet()) {
                builder.withData(table.getKey(), table.getValue() ? PRESENT : MISSING);
                allPresent &= table.getValue();
            }
            if (!allPresent) {
                log.warnf("Level estimation tables incomplete: %s", tables);
                return builder.down().withData("status", "Required tables missing").build();
            }
            return builder.up().withData("status", "Database is responding").build();
        } catch (Exception e) {
            log.error("Database health check failed", e);
            return builder
                    .down()
                    .withData("status", "Database connection failed")
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
