package com.flagship.letter_workflow.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer counters and timers for the workflow engine.
 *
 * Metrics exposed:
 * - letters.allowance.deductions{outcome}: free_trial, credit, exhausted, no_allowance
 * - letters.allowance.refunds{outcome}: refunded, unreconciled
 * - letters.claims{outcome}: claimed, reclaimed, expired_takeover, conflict, released
 * - letters.transitions{to}: letter status transitions by target status
 * - letters.webhook.events{event_type, outcome}: fresh, duplicate
 * - letters.subscription.activations{outcome}: activated, with_commission, failed
 * - letters.operation.latency{operation}
 */
@Component
public class WorkflowMetrics {

    private final MeterRegistry registry;

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDeduction(String outcome) {
        registry.counter("letters.allowance.deductions", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordRefund(String outcome) {
        registry.counter("letters.allowance.refunds", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordClaim(String outcome) {
        registry.counter("letters.claims", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordTransition(Enum<?> targetStatus) {
        registry.counter("letters.transitions", "to", targetStatus.name().toLowerCase()).increment();
    }

    public void recordWebhookEvent(String eventType, boolean fresh) {
        registry.counter("letters.webhook.events",
                "event_type", sanitizeTag(eventType),
                "outcome", fresh ? "fresh" : "duplicate"
        ).increment();
    }

    public void recordActivation(String outcome) {
        registry.counter("letters.subscription.activations", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordLatency(String operation, Duration duration) {
        registry.timer("letters.operation.latency", "operation", sanitizeTag(operation)).record(duration);
    }

    /**
     * Limits tag cardinality and strips characters Prometheus does not like.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
