package com.flagship.letter_workflow.letter.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Notification about a letter, written to the outbox in the same transaction
 * as the transition it reports.
 */
public interface LetterEvent {

    UUID getEventId();

    UUID getLetterId();

    String getEventType();

    Instant getOccurredAt();
}
