package com.flagship.letter_workflow.claim.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.letter_workflow.claim.ReviewClaim;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ClaimResponse {

    @JsonProperty("letter_id")
    UUID letterId;

    @JsonProperty("claimed_by")
    UUID claimedBy;

    @JsonProperty("claimed_at")
    Instant claimedAt;

    @JsonProperty("expires_at")
    Instant expiresAt;

    public static ClaimResponse from(ReviewClaim claim, Duration ttl) {
        return ClaimResponse.builder()
            .letterId(claim.getLetterId())
            .claimedBy(claim.getClaimedBy())
            .claimedAt(claim.getClaimedAt())
            .expiresAt(claim.expiresAt(ttl))
            .build();
    }
}
