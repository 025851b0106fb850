package com.flagship.letter_workflow.letter;

import com.flagship.letter_workflow.claim.ReviewClaim;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Snapshot of a letter and its review lifecycle.
 */
@Value
public class Letter {
    UUID id;
    UUID ownerId;
    String letterType;
    String title;
    Map<String, Object> intakeData;
    LetterStatus status;
    boolean freeTrial;
    UUID claimedBy;
    Instant claimedAt;
    String draftContent;
    String finalContent;
    UUID reviewedBy;
    Instant reviewedAt;
    String reviewNotes;
    String rejectionReason;
    Instant approvedAt;
    Instant createdAt;
    Instant updatedAt;

    public Optional<ReviewClaim> currentClaim() {
        if (claimedBy == null) {
            return Optional.empty();
        }
        return Optional.of(new ReviewClaim(id, claimedBy, claimedAt));
    }

    public boolean isOwnedBy(UUID userId) {
        return ownerId.equals(userId);
    }
}
