package com.flagship.letter_workflow.letter;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A letter awaiting a reviewer decision, with its claim state.
 */
@Value
public class ReviewQueueItem {
    UUID letterId;
    UUID ownerId;
    String letterType;
    String title;
    LetterStatus status;
    UUID claimedBy;
    Instant claimedAt;
    boolean claimExpired;
    Instant createdAt;
}
