package com.flagship.letter_workflow.claim.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.letter_workflow.letter.LetterStatus;
import com.flagship.letter_workflow.letter.ReviewQueueItem;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Review queue row. {@code claimExpired} tells the UI a stale claim can be taken over.
 */
@Value
@Builder
public class ReviewQueueItemResponse {

    @JsonProperty("letter_id")
    UUID letterId;

    @JsonProperty("owner_id")
    UUID ownerId;

    @JsonProperty("letter_type")
    String letterType;

    @JsonProperty("title")
    String title;

    @JsonProperty("status")
    LetterStatus status;

    @JsonProperty("claimed_by")
    UUID claimedBy;

    @JsonProperty("claimed_at")
    Instant claimedAt;

    @JsonProperty("claim_expired")
    boolean claimExpired;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ReviewQueueItemResponse from(ReviewQueueItem item) {
        return ReviewQueueItemResponse.builder()
            .letterId(item.getLetterId())
            .ownerId(item.getOwnerId())
            .letterType(item.getLetterType())
            .title(item.getTitle())
            .status(item.getStatus())
            .claimedBy(item.getClaimedBy())
            .claimedAt(item.getClaimedAt())
            .claimExpired(item.isClaimExpired())
            .createdAt(item.getCreatedAt())
            .build();
    }
}
