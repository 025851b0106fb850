package com.flagship.letter_workflow.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit trail.
 *
 * Writes participate in the caller's transaction (MANDATORY propagation):
 * an audit line becomes durable exactly when the state change it documents
 * commits, and is rolled back with it otherwise.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditTrailService {

    private final AuditEntryRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Records a letter status transition.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEntry recordTransition(UUID letterId, AuditAction action, UUID performedBy,
                                       Enum<?> oldStatus, Enum<?> newStatus, String notes) {
        return save(letterId, action, performedBy,
                oldStatus != null ? oldStatus.name() : null,
                newStatus != null ? newStatus.name() : null,
                notes, null);
    }

    /**
     * Records an event that is not a letter transition, e.g. a credit deduction.
     *
     * @param letterId may be null
     * @param metadata serialized as JSON, may be null
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEntry record(UUID letterId, AuditAction action, UUID performedBy,
                             String notes, Map<String, ?> metadata) {
        return save(letterId, action, performedBy, null, null, notes, serialize(metadata));
    }

    @Transactional(readOnly = true)
    public List<AuditEntry> getTrail(UUID letterId) {
        return repository.findByLetterIdOrderByCreatedAtAscSequenceNumberAsc(letterId)
                .stream()
                .map(AuditEntryEntity::toDomain)
                .toList();
    }

    /**
     * Entries without a letter (allowance and subscription events) performed by a user.
     */
    @Transactional(readOnly = true)
    public List<AuditEntry> getAccountTrail(UUID userId) {
        return repository.findByLetterIdIsNullAndPerformedByOrderBySequenceNumberAsc(userId)
                .stream()
                .map(AuditEntryEntity::toDomain)
                .toList();
    }

    private AuditEntry save(UUID letterId, AuditAction action, UUID performedBy,
                            String oldStatus, String newStatus, String notes, String metadata) {
        AuditEntryEntity entity = AuditEntryEntity.create(letterId, action, performedBy,
                oldStatus, newStatus, notes, metadata, clock.instant());
        AuditEntryEntity saved = repository.save(entity);
        log.debug("Audit {}: letterId={}, performedBy={}, {} -> {}",
                action.getValue(), letterId, performedBy, oldStatus, newStatus);
        return saved.toDomain();
    }

    private String serialize(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit metadata", e);
        }
    }
}
