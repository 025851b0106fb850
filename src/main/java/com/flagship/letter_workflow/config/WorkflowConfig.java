package com.flagship.letter_workflow.config;

import com.flagship.letter_workflow.exception.TransactionConflictException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;

@Configuration
public class WorkflowConfig {

    /**
     * Source of "now" for claim expiry, review timestamps and subscription periods.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Retries only lock-wait timeouts and serialization failures. Each attempt
     * runs a fresh transaction, and a failed attempt committed nothing.
     */
    @Bean
    public RetryTemplate transactionConflictRetryTemplate(WorkflowProperties properties) {
        WorkflowProperties.Retry retry = properties.getRetry();
        return RetryTemplate.builder()
                .maxAttempts(retry.getMaxAttempts())
                .fixedBackoff(retry.getBackoff().toMillis())
                .retryOn(TransactionConflictException.class)
                .traversingCauses()
                .build();
    }
}
