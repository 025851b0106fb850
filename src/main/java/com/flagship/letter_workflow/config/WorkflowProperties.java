package com.flagship.letter_workflow.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Tunables of the workflow engine, bound from the {@code letters.*} namespace.
 */
@Value
@Validated
@ConfigurationProperties(prefix = "letters")
public class WorkflowProperties {

    @Valid Claim claim;
    @Valid Commission commission;
    @Valid Subscription subscription;
    @Valid Webhook webhook;
    @Valid Retry retry;
    Map<String, @Valid Plan> plans;

    public WorkflowProperties(@DefaultValue Claim claim,
                              @DefaultValue Commission commission,
                              @DefaultValue Subscription subscription,
                              @DefaultValue Webhook webhook,
                              @DefaultValue Retry retry,
                              Map<String, Plan> plans) {
        this.claim = claim;
        this.commission = commission;
        this.subscription = subscription;
        this.webhook = webhook;
        this.retry = retry;
        this.plans = plans != null ? Map.copyOf(plans) : Map.of();
    }

    @Value
    public static class Claim {
        @NotNull Duration ttl;

        public Claim(@DefaultValue("30m") Duration ttl) {
            this.ttl = ttl;
        }
    }

    @Value
    public static class Commission {
        @NotNull
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        BigDecimal rate;

        public Commission(@DefaultValue("0.05") BigDecimal rate) {
            this.rate = rate;
        }
    }

    @Value
    public static class Subscription {
        @NotNull Duration period;

        public Subscription(@DefaultValue("30d") Duration period) {
            this.period = period;
        }
    }

    @Value
    public static class Webhook {
        @NotNull Duration retention;
        String cleanupCron;

        public Webhook(@DefaultValue("30d") Duration retention,
                       @DefaultValue("0 15 3 * * *") String cleanupCron) {
            this.retention = retention;
            this.cleanupCron = cleanupCron;
        }
    }

    @Value
    public static class Retry {
        @Min(1) int maxAttempts;
        @NotNull Duration backoff;

        public Retry(@DefaultValue("3") int maxAttempts,
                     @DefaultValue("50ms") Duration backoff) {
            this.maxAttempts = maxAttempts;
            this.backoff = backoff;
        }
    }

    /**
     * A purchasable plan: list price and the credits it grants per period.
     */
    @Value
    public static class Plan {
        @NotNull
        @DecimalMin("0.0")
        BigDecimal price;
        @Min(1) int letters;
    }
}
