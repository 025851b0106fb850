package com.flagship.letter_workflow.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes notifications to the outbox inside business transactions and
 * tracks their delivery.
 *
 * If the business change commits, its notification is guaranteed to be
 * written; if it rolls back, so does the notification. Nothing in the
 * workflow waits for delivery.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String LETTER_AGGREGATE = "Letter";
    public static final String SUBSCRIPTION_AGGREGATE = "Subscription";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves a notification within the caller's transaction (MANDATORY propagation).
     *
     * @param payload serialized to JSON
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId,
                                 String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType, serializePayload(payload));
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                eventType, aggregateType, aggregateId);

        return saved.toDomain();
    }

    /**
     * Returns the next batch of unpublished events still under the retry limit.
     *
     * The {@code FOR UPDATE SKIP LOCKED} row locks only last for this
     * selection transaction and are released before anything is sent, so
     * the rows are not claimed: an event stays selectable until
     * {@link #markPublished} commits. Two publishers polling at once can both
     * send the same event, which makes delivery at-least-once; consumers
     * de-duplicate on the event id.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishable(int maxRetries, int limit) {
        return repository.findPublishableForUpdate(maxRetries, limit)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(Instant.now());
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    /**
     * Deletes events published before the cutoff.
     */
    @Transactional
    public int purgePublishedBefore(Instant cutoff) {
        return repository.deletePublishedBefore(cutoff);
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
