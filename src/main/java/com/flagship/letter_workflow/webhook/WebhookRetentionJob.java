package com.flagship.letter_workflow.webhook;

import com.flagship.letter_workflow.config.WorkflowProperties;
import com.flagship.letter_workflow.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Purges dedup records and published outbox rows past the retention window.
 *
 * A notification redelivered after its record was purged would be handled
 * again; the window is chosen well beyond the provider's retry horizon.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookRetentionJob {

    private final IdempotentEventRecorder recorder;
    private final OutboxService outboxService;
    private final WorkflowProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${letters.webhook.cleanup-cron:0 15 3 * * *}")
    public void purgeExpired() {
        Instant cutoff = clock.instant().minus(properties.getWebhook().getRetention());
        int webhookEvents = recorder.purgeRecordedBefore(cutoff);
        int outboxEvents = outboxService.purgePublishedBefore(cutoff);
        log.info("Retention purge before {}: {} webhook event(s), {} published outbox event(s)",
                cutoff, webhookEvents, outboxEvents);
    }
}
