package com.flagship.letter_workflow.retry;

import com.flagship.letter_workflow.exception.NotFoundException;
import com.flagship.letter_workflow.exception.TransactionConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.retry.support.RetryTemplate;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TransactionRetrierTest {

    private final TransactionRetrier retrier = new TransactionRetrier(RetryTemplate.builder()
            .maxAttempts(3)
            .fixedBackoff(1)
            .retryOn(TransactionConflictException.class)
            .traversingCauses()
            .build());

    @Test
    @DisplayName("Lock timeouts are retried until the operation succeeds")
    void testRetriesLockTimeout() {
        AtomicInteger attempts = new AtomicInteger();

        String result = retrier.execute("op", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("lock timeout");
            }
            return "done";
        });

        assertEquals("done", result);
        assertEquals(3, attempts.get());
    }

    @Test
    @DisplayName("Persistent conflicts surface as TransactionConflictException")
    void testGivesUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        TransactionConflictException e = assertThrows(TransactionConflictException.class,
                () -> retrier.execute("claim", () -> {
                    attempts.incrementAndGet();
                    throw new CannotAcquireLockException("lock timeout");
                }));

        assertEquals(3, attempts.get());
        assertInstanceOf(CannotAcquireLockException.class, e.getCause());
    }

    @Test
    @DisplayName("Business failures are not retried")
    void testDoesNotRetryBusinessFailures() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(NotFoundException.class, () -> retrier.run("op", () -> {
            attempts.incrementAndGet();
            throw new NotFoundException("Letter", UUID.randomUUID());
        }));

        assertEquals(1, attempts.get());
    }
}
