package com.sleepfactor.levels.domain.produce;

import com.sleepfactor.levels.domain.model.SubstanceLevelReport;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.kafka.api.OutgoingKafkaRecordMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes reference-time levels to the insights collaborator.
 * One message per (habit, logged date), keyed so that a recomputation replaces the previous value.
 */
@ApplicationScoped
public class SubstanceLevelProducer {

    private static final Logger log = Logger.getLogger(SubstanceLevelProducer.class);

    private final Emitter<SubstanceLevelReport> substanceLevelEmitter;

    public SubstanceLevelProducer(@Channel("substance-level-events") Emitter<SubstanceLevelReport> substanceLevelEmitter) {
        this.substanceLevelEmitter = substanceLevelEmitter;
    }

    @Retry(
            maxRetries = 2,
            delay = 100,
            maxDuration = 10000
    )
    @Timeout(value = 10000)
    public Uni<Void> produceSubstanceLevel(SubstanceLevelReport report) {
        long startTime = System.currentTimeMillis();
        String key = messageKey(report);

        if (log.isDebugEnabled()) {
            log.debugf("Producing substance level event %s: %.4f %s", key, report.level(), report.unit());
        }

        return Uni.createFrom().emitter(em -> {
            Message<SubstanceLevelReport> message = Message.of(report)
                    .addMetadata(OutgoingKafkaRecordMetadata.<String>builder()
                            .withKey(key)
                            .build())
                    .withAck(() -> {
                        em.complete(null);
                        if (log.isDebugEnabled()) {
                            log.debugf("Sent substance level event %s in %d ms",
                                    key, System.currentTimeMillis() - startTime);
                        }
                        return CompletableFuture.completedFuture(null);
                    })
                    .withNack(throwable -> {
                        log.errorf(throwable, "Failed to send substance level event %s after %d ms",
                                key, System.currentTimeMillis() - startTime);
                        em.fail(throwable);
                        return CompletableFuture.completedFuture(null);
                    });

            substanceLevelEmitter.send(message);
        });
    }

    static String messageKey(SubstanceLevelReport report) {
        return report.habitId() + ":" + report.loggedDate();
    }
}
