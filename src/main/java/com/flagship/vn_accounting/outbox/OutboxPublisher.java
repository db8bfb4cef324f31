package com.flagship.vn_accounting.outbox;

import com.flagship.vn_accounting.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and publishes pending events to the accounting events topic.
 *
 * Events are sent one at a time and acknowledged before being marked, keyed by
 * aggregate id, so all events of one voucher land on one partition in order.
 * A failed send increments the retry count; after max-retries the event stays
 * in the table as a dead letter.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "eventType";
    static final String AGGREGATE_TYPE_HEADER = "aggregateType";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.accounting-events:accounting-events}")
    private String accountingEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Value("${outbox.retention-days:7}")
    private int retentionDays;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findPublishableEvents(maxRetries, batchSize);
        } catch (RuntimeException e) {
            log.error("Failed to read pending outbox events", e);
            return;
        }
        if (events.isEmpty()) {
            return;
        }
        log.debug("Found {} unpublished events to process", events.size());
        for (OutboxEvent event : events) {
            publishEvent(event);
        }
    }

    /**
     * Daily removal of events that were published more than retention-days ago.
     */
    @Scheduled(cron = "${outbox.retention-cron:0 30 2 * * *}")
    public void purgePublishedEvents() {
        outboxService.purgePublishedBefore(Instant.now().minus(Duration.ofDays(retentionDays)));
    }

    void publishEvent(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
                accountingEventsTopic, event.getAggregateId().toString(), event.getPayload());
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
        record.headers().add(AGGREGATE_TYPE_HEADER, event.getAggregateType().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), leaving it as a dead letter. eventType={}, aggregateId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }
}
