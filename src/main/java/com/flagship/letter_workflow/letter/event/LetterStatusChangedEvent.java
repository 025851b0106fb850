package com.flagship.letter_workflow.letter.event;

import com.flagship.letter_workflow.letter.Letter;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A letter reached a status the notification subsystem reacts to
 * (e-mail to the owner, delivery of the final document).
 */
@Value
public class LetterStatusChangedEvent implements LetterEvent {

    public static final String LETTER_SUBMITTED = "LetterSubmitted";
    public static final String LETTER_READY_FOR_REVIEW = "LetterReadyForReview";
    public static final String LETTER_GENERATION_FAILED = "LetterGenerationFailed";
    public static final String LETTER_APPROVED = "LetterApproved";
    public static final String LETTER_REJECTED = "LetterRejected";
    public static final String LETTER_COMPLETED = "LetterCompleted";

    UUID eventId;
    String eventType;
    UUID letterId;
    UUID ownerId;
    String title;
    String status;
    UUID actorId;
    String reason;
    Instant occurredAt;

    public static LetterStatusChangedEvent of(String eventType, Letter letter, UUID actorId, String reason) {
        return new LetterStatusChangedEvent(
            UUID.randomUUID(),
            eventType,
            letter.getId(),
            letter.getOwnerId(),
            letter.getTitle(),
            letter.getStatus().name(),
            actorId,
            reason,
            Instant.now()
        );
    }
}
