package com.flagship.letter_workflow.observability;

import com.flagship.letter_workflow.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the workflow engine.
 */
public class HealthIndicators {

    /**
     * Review queue depth and stale claims. Stale claims do not block anyone
     * (the next claimant takes them over) so they only raise a WARNING.
     */
    @Component("reviewQueue")
    public static class ReviewQueueHealthIndicator implements HealthIndicator {

        private static final long STALE_CLAIM_WARNING_THRESHOLD = 25;

        private final ReviewQueueMetrics reviewQueueMetrics;

        public ReviewQueueHealthIndicator(ReviewQueueMetrics reviewQueueMetrics) {
            this.reviewQueueMetrics = reviewQueueMetrics;
        }

        @Override
        public Health health() {
            try {
                ReviewQueueMetrics.ReviewQueueSnapshot snapshot = reviewQueueMetrics.snapshot();
                Health.Builder builder = snapshot.getStaleClaims() < STALE_CLAIM_WARNING_THRESHOLD
                        ? Health.up()
                        : Health.status("WARNING");
                return builder
                        .withDetail("awaitingReview", snapshot.getAwaitingReview())
                        .withDetail("staleClaims", snapshot.getStaleClaims())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Unhealthy when too many notifications wait to be published.
     */
    @Component("outbox")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }
}
