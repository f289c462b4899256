package com.anomalywatch.producer;

import com.anomalywatch.config.KafkaTopics;
import com.anomalywatch.event.InvestigationCompleted;
import com.anomalywatch.event.InvestigationResultAdded;
import com.anomalywatch.event.InvestigationStarted;
import com.anomalywatch.event.InvestigationStatusChanged;
import com.anomalywatch.model.ExecutionStatus;
import com.anomalywatch.model.InvestigationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Publishes investigation notifications to Kafka.
 *
 * DISPATCH:
 * =========
 * Callers are investigator and result-writer threads. They only enqueue the event
 * on the single-threaded notification executor and return immediately. That thread
 * calls KafkaTemplate.send, which is asynchronous as well: the broker acknowledgment
 * is handled in the whenComplete callback.
 *
 * Because the executor has one thread and a FIFO queue, events leave in the order
 * they were produced. All events are keyed by investigator id, so they also stay in
 * order on the partition.
 *
 * Every failure (serialization, broker unavailable, full dispatch queue, executor shut down) is logged
 * and dropped. Notifications are best effort; the database is the source of truth.
 */
@Service
@Slf4j
public class KafkaInvestigationNotifier implements InvestigationNotifier {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Executor notificationExecutor;
    private final Clock clock;

    public KafkaInvestigationNotifier(KafkaTemplate<String, Object> kafkaTemplate,
                                      @Qualifier("notificationExecutor") Executor notificationExecutor,
                                      Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.notificationExecutor = notificationExecutor;
        this.clock = clock;
    }

    @Override
    public void investigationStarted(String investigatorId, Long executionId, Instant timestamp) {
        dispatch(KafkaTopics.INVESTIGATION_STARTED, investigatorId,
                () -> new InvestigationStarted(investigatorId, executionId, timestamp));
    }

    @Override
    public void resultAdded(String investigatorId, InvestigationResult result) {
        if (result == null) {
            log.warn("Ignoring result notification without a result for investigator {}", investigatorId);
            return;
        }
        dispatch(KafkaTopics.INVESTIGATION_RESULT_ADDED, investigatorId,
                () -> new InvestigationResultAdded(
                        investigatorId,
                        result.getExecutionId(),
                        result.getId(),
                        result.getSeverity(),
                        result.getMessage(),
                        result.getEntityType(),
                        result.getEntityId(),
                        result.getPayload(),
                        result.getTimestamp()));
    }

    @Override
    public void statusChanged(String investigatorId, Long executionId, ExecutionStatus status) {
        Instant now = clock.instant();
        dispatch(KafkaTopics.INVESTIGATION_STATUS_CHANGED, investigatorId,
                () -> new InvestigationStatusChanged(investigatorId, executionId, status, now));
    }

    @Override
    public void investigationCompleted(String investigatorId, Long executionId, long resultCount, Instant timestamp) {
        dispatch(KafkaTopics.INVESTIGATION_COMPLETED, investigatorId,
                () -> new InvestigationCompleted(investigatorId, executionId, resultCount, timestamp));
    }

    private void dispatch(String topic, String key, Supplier<Object> supplier) {
        try {
            notificationExecutor.execute(() -> send(topic, key, supplier));
        } catch (RuntimeException e) {
            log.error("Failed to enqueue {} notification for investigator {}", topic, key, e);
        }
    }

    private void send(String topic, String key, Supplier<Object> supplier) {
        try {
            // Built here so event validation errors are handled like any publish failure
            Object event = supplier.get();
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish {} notification for investigator {}", topic, key, ex);
                } else {
                    log.debug("Published {} notification for investigator {} to partition {}",
                            topic, key, result.getRecordMetadata().partition());
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to publish {} notification for investigator {}", topic, key, e);
        }
    }
}
