package com.tally.ledger.events;

import com.tally.ledger.config.AccountingProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerEventPublisherTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private SimpleMeterRegistry meterRegistry;
    private LedgerEventPublisher publisher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        AccountingProperties properties = new AccountingProperties("XOF", "121", "OD", false,
            new AccountingProperties.Chart(true),
            new AccountingProperties.Lock("local", 30, 120),
            new AccountingProperties.Events(true, "ledger-events"),
            new AccountingProperties.Retry(3, 50));
        publisher = new LedgerEventPublisher(kafkaTemplate, properties, meterRegistry);
    }

    private LedgerEvent postedEvent() {
        return LedgerEvent.builder()
            .eventId("evt-1")
            .eventType(LedgerEventType.ENTRY_POSTED)
            .aggregateId("entry-1")
            .reference("OD-00000001")
            .effectiveDate(LocalDate.of(2024, 3, 15))
            .amount(new BigDecimal("1000"))
            .currency("XOF")
            .actor("test-user")
            .occurredAt(Instant.now())
            .version("1.0")
            .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void sendsEventKeyedByAggregate() {
        SendResult<String, Object> result = mock(SendResult.class);
        when(result.getRecordMetadata()).thenReturn(mock(RecordMetadata.class));
        LedgerEvent event = postedEvent();
        when(kafkaTemplate.send("ledger-events", "entry-1", event))
            .thenReturn(CompletableFuture.completedFuture(result));

        publisher.onLedgerEvent(event);

        verify(kafkaTemplate).send("ledger-events", "entry-1", event);
        assertThat(meterRegistry.counter("ledger.events.published", "type", "ENTRY_POSTED").count()).isEqualTo(1.0);
    }

    @Test
    void failedSendIsCountedAndNotRethrown() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThatCode(() -> publisher.onLedgerEvent(postedEvent())).doesNotThrowAnyException();

        assertThat(meterRegistry.counter("ledger.events.failed", "type", "ENTRY_POSTED").count()).isEqualTo(1.0);
    }

    @Test
    void synchronousSendFailureIsCountedAndNotRethrown() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
            .thenThrow(new IllegalStateException("producer closed"));

        assertThatCode(() -> publisher.onLedgerEvent(postedEvent())).doesNotThrowAnyException();

        assertThat(meterRegistry.counter("ledger.events.failed", "type", "ENTRY_POSTED").count()).isEqualTo(1.0);
    }
}
