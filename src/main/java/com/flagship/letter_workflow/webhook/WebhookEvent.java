package com.flagship.letter_workflow.webhook;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Dedup record of an externally delivered notification. Written once, never
 * updated, purged after the retention window.
 */
@Value
public class WebhookEvent {
    UUID id;
    String externalEventId;
    String eventType;
    Instant processedAt;
    String metadata;
    Instant createdAt;
}
