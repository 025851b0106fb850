package com.flagship.letter_workflow.letter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.letter_workflow.audit.AuditEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AuditEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("letter_id")
    UUID letterId;

    @JsonProperty("action")
    String action;

    @JsonProperty("performed_by")
    UUID performedBy;

    @JsonProperty("old_status")
    String oldStatus;

    @JsonProperty("new_status")
    String newStatus;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AuditEntryResponse from(AuditEntry entry) {
        return AuditEntryResponse.builder()
            .id(entry.getId())
            .letterId(entry.getLetterId())
            .action(entry.getAction().getValue())
            .performedBy(entry.getPerformedBy())
            .oldStatus(entry.getOldStatus())
            .newStatus(entry.getNewStatus())
            .notes(entry.getNotes())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
