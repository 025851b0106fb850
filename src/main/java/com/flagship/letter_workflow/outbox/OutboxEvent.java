package com.flagship.letter_workflow.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A notification waiting in (or already sent from) the outbox.
 *
 * Written atomically with the business change it reports; published to Kafka
 * later by {@link OutboxPublisher}, keyed by aggregate id.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Letter" or "Subscription"
    UUID aggregateId;
    String eventType;          // e.g. "LetterApproved"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until sent
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public String partitionKey() {
        return aggregateId.toString();
    }
}
