package com.flagship.letter_workflow.audit;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One immutable line of the audit trail.
 *
 * {@code letterId} is null for events that are not about a letter, such as
 * allowance deductions and subscription activations. Automated actors are
 * recorded as {@link #SYSTEM_ACTOR}.
 */
@Value
public class AuditEntry {

    public static final UUID SYSTEM_ACTOR = new UUID(0L, 0L);

    UUID id;
    Long sequenceNumber;
    UUID letterId;
    AuditAction action;
    UUID performedBy;
    String oldStatus;
    String newStatus;
    String notes;
    String metadata;
    Instant createdAt;
}
