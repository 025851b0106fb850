package com.flagship.letter_workflow.retry;

import com.flagship.letter_workflow.exception.TransactionConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs a transactional operation and retries it a bounded number of times
 * when the database reports a lock-wait timeout, deadlock or serialization
 * failure.
 *
 * The operation must open its own transaction (a {@code @Transactional}
 * service method), so every attempt starts from a clean slate.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionRetrier {

    private final RetryTemplate transactionConflictRetryTemplate;

    public <T> T execute(String operation, Supplier<T> action) {
        return transactionConflictRetryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying {} after transient conflict (attempt {})",
                        operation, context.getRetryCount() + 1);
            }
            try {
                return action.get();
            } catch (PessimisticLockingFailureException e) {
                throw new TransactionConflictException(operation, e);
            }
        });
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }
}
