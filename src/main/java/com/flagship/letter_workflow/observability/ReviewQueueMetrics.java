package com.flagship.letter_workflow.observability;

import com.flagship.letter_workflow.config.WorkflowProperties;
import com.flagship.letter_workflow.letter.LetterRepository;
import com.flagship.letter_workflow.letter.LetterStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Size of the review queue and number of claims past their TTL.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReviewQueueMetrics {

    private final LetterRepository letterRepository;
    private final WorkflowProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicLong awaitingReview = new AtomicLong(0);
    private final AtomicLong staleClaims = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("letters.review.queue.size", awaitingReview, AtomicLong::get)
                .description("Letters pending or under review")
                .register(meterRegistry);
        Gauge.builder("letters.review.claims.stale", staleClaims, AtomicLong::get)
                .description("Claims older than the claim TTL, free for takeover")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public ReviewQueueSnapshot snapshot() {
        long queued = letterRepository.countByStatusIn(LetterStatus.REVIEWABLE);
        long stale = letterRepository.countClaimsOlderThan(
                clock.instant().minus(properties.getClaim().getTtl()));
        return new ReviewQueueSnapshot(queued, stale);
    }

    public void refreshMetrics() {
        try {
            ReviewQueueSnapshot snapshot = snapshot();
            awaitingReview.set(snapshot.getAwaitingReview());
            staleClaims.set(snapshot.getStaleClaims());
        } catch (Exception e) {
            log.warn("Failed to refresh review queue metrics: {}", e.getMessage());
        }
    }

    @Value
    public static class ReviewQueueSnapshot {
        long awaitingReview;
        long staleClaims;
    }
}
