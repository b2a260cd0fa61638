package com.tally.ledger.events;

import com.tally.ledger.config.AccountingProperties;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards committed ledger events to Kafka. Publication is best effort: a failed send
 * is logged and counted, the ledger change stays committed.
 */
@Component
@ConditionalOnProperty(prefix = "accounting.events", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class LedgerEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final AccountingProperties properties;
    private final MeterRegistry meterRegistry;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onLedgerEvent(LedgerEvent event) {
        String topic = properties.getEvents().getTopic();
        try {
            kafkaTemplate.send(topic, event.getAggregateId(), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        meterRegistry.counter("ledger.events.failed", "type", event.getEventType().name()).increment();
                        log.error("Failed to publish ledger event {} {} to {}",
                            event.getEventType(), event.getAggregateId(), topic, ex);
                    } else {
                        meterRegistry.counter("ledger.events.published", "type", event.getEventType().name()).increment();
                        log.debug("Published ledger event {} {} at offset {}",
                            event.getEventType(), event.getAggregateId(), result.getRecordMetadata().offset());
                    }
                });
        } catch (RuntimeException e) {
            meterRegistry.counter("ledger.events.failed", "type", event.getEventType().name()).increment();
            log.error("Failed to hand ledger event {} {} to Kafka", event.getEventType(), event.getAggregateId(), e);
        }
    }
}
