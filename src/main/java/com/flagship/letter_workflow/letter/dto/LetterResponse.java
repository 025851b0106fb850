package com.flagship.letter_workflow.letter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.letter_workflow.letter.Letter;
import com.flagship.letter_workflow.letter.LetterStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class LetterResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("owner_id")
    UUID ownerId;

    @JsonProperty("letter_type")
    String letterType;

    @JsonProperty("title")
    String title;

    @JsonProperty("intake_data")
    Map<String, Object> intakeData;

    @JsonProperty("status")
    LetterStatus status;

    @JsonProperty("free_trial")
    boolean freeTrial;

    @JsonProperty("claimed_by")
    UUID claimedBy;

    @JsonProperty("claimed_at")
    Instant claimedAt;

    @JsonProperty("draft_content")
    String draftContent;

    @JsonProperty("final_content")
    String finalContent;

    @JsonProperty("reviewed_by")
    UUID reviewedBy;

    @JsonProperty("reviewed_at")
    Instant reviewedAt;

    @JsonProperty("review_notes")
    String reviewNotes;

    @JsonProperty("rejection_reason")
    String rejectionReason;

    @JsonProperty("approved_at")
    Instant approvedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static LetterResponse from(Letter letter) {
        return LetterResponse.builder()
            .id(letter.getId())
            .ownerId(letter.getOwnerId())
            .letterType(letter.getLetterType())
            .title(letter.getTitle())
            .intakeData(letter.getIntakeData())
            .status(letter.getStatus())
            .freeTrial(letter.isFreeTrial())
            .claimedBy(letter.getClaimedBy())
            .claimedAt(letter.getClaimedAt())
            .draftContent(letter.getDraftContent())
            .finalContent(letter.getFinalContent())
            .reviewedBy(letter.getReviewedBy())
            .reviewedAt(letter.getReviewedAt())
            .reviewNotes(letter.getReviewNotes())
            .rejectionReason(letter.getRejectionReason())
            .approvedAt(letter.getApprovedAt())
            .createdAt(letter.getCreatedAt())
            .updatedAt(letter.getUpdatedAt())
            .build();
    }
}
