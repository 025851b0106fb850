package com.flagship.letter_workflow.webhook;

import lombok.Value;

/**
 * Outcome of {@link IdempotentEventRecorder#recordIfNew}: whether the event
 * was seen before, and its dedup record.
 */
@Value
public class RecordResult {
    boolean alreadyProcessed;
    WebhookEvent event;

    public static RecordResult fresh(WebhookEvent event) {
        return new RecordResult(false, event);
    }

    public static RecordResult duplicate(WebhookEvent event) {
        return new RecordResult(true, event);
    }
}
