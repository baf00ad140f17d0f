package com.flagship.credit_ledger.outbox;

import com.flagship.credit_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Publisher behavior against a mocked Kafka template.
 */
class OutboxPublisherTest {

    private static final String TOPIC = "ledger-events";

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics, TOPIC, 100, 5, Duration.ofDays(7));
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private static OutboxEvent event(int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "Account", UUID.randomUUID(), "BalanceChanged",
                "{\"amount\":\"10.00\"}", Instant.now(), null, retryCount, null);
    }

    private static SendResult<String, String> sent(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(TOPIC, event.getAggregateId().toString(), event.getPayload());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, System.currentTimeMillis(), 0, 0);
        return new SendResult<>(record, metadata);
    }

    @Test
    @DisplayName("Published event is keyed by aggregate id and marked published")
    void publishSuccess() {
        OutboxEvent event = event(0);
        when(kafkaTemplate.send(TOPIC, event.getAggregateId().toString(), event.getPayload()))
                .thenReturn(CompletableFuture.completedFuture(sent(event)));

        publisher.publishEvent(event);

        verify(outboxService).markPublished(event.getId());
        verify(outboxService, never()).markFailed(any(), anyString());
        verify(outboxMetrics).recordEventPublished("BalanceChanged");
    }

    @Test
    @DisplayName("Failed send is recorded for retry")
    void publishFailure() {
        OutboxEvent event = event(1);
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishEvent(event);

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxService, never()).markPublished(any());
        verify(outboxMetrics).recordEventPublishFailed("BalanceChanged");
    }

    @Test
    @DisplayName("Event past max retries is left as a dead letter")
    void deadLetter() {
        OutboxEvent event = event(5);

        publisher.publishEvent(event);

        verifyNoInteractions(kafkaTemplate);
        verify(outboxMetrics).recordEventDeadLettered("BalanceChanged");
        verify(outboxService, never()).markPublished(any());
    }

    @Test
    @DisplayName("Polling loop publishes each pending event")
    void pollingLoop() {
        OutboxEvent first = event(0);
        OutboxEvent second = event(0);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(first, second));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(sent(first)));

        publisher.publishPendingEvents();

        verify(outboxService).markPublished(first.getId());
        verify(outboxService).markPublished(second.getId());
    }
}
