package com.flagship.letter_workflow.exception;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Another reviewer holds a live claim on the letter. Carries the current
 * claimant so the caller can show who is reviewing it.
 */
public class AlreadyClaimedException extends WorkflowException {

    private final UUID letterId;
    private final UUID claimedBy;
    private final Instant claimedAt;

    public AlreadyClaimedException(UUID letterId, UUID claimedBy, Instant claimedAt) {
        super(ErrorCode.ALREADY_CLAIMED,
                "Letter " + letterId + " is being reviewed by " + claimedBy);
        this.letterId = letterId;
        this.claimedBy = claimedBy;
        this.claimedAt = claimedAt;
    }

    public UUID getLetterId() {
        return letterId;
    }

    public UUID getClaimedBy() {
        return claimedBy;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of(
                "letterId", letterId.toString(),
                "claimedBy", claimedBy.toString(),
                "claimedAt", claimedAt.toString());
    }
}
