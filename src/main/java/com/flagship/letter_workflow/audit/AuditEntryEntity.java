package com.flagship.letter_workflow.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of {@code audit_entries}. Rows are insert-only: the entity is
 * immutable and a database trigger rejects UPDATE and DELETE.
 */
@Entity
@Immutable
@Table(name = "audit_entries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    @Column(name = "letter_id", updatable = false)
    private UUID letterId;

    @Column(nullable = false, updatable = false, length = 64)
    private String action;

    @Column(name = "performed_by", nullable = false, updatable = false)
    private UUID performedBy;

    @Column(name = "old_status", updatable = false, length = 32)
    private String oldStatus;

    @Column(name = "new_status", updatable = false, length = 32)
    private String newStatus;

    @Column(updatable = false, columnDefinition = "TEXT")
    private String notes;

    @Column(updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static AuditEntryEntity create(UUID letterId, AuditAction action, UUID performedBy,
                                   String oldStatus, String newStatus, String notes,
                                   String metadata, Instant createdAt) {
        return new AuditEntryEntity(UUID.randomUUID(), null, letterId, action.getValue(), performedBy,
                oldStatus, newStatus, notes, metadata, createdAt);
    }

    public AuditEntry toDomain() {
        return new AuditEntry(id, sequenceNumber, letterId, AuditAction.fromValue(action), performedBy,
                oldStatus, newStatus, notes, metadata, createdAt);
    }
}
