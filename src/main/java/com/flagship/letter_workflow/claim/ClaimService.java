package com.flagship.letter_workflow.claim;

import com.flagship.letter_workflow.audit.AuditAction;
import com.flagship.letter_workflow.audit.AuditTrailService;
import com.flagship.letter_workflow.config.WorkflowProperties;
import com.flagship.letter_workflow.exception.AlreadyClaimedException;
import com.flagship.letter_workflow.exception.InvalidStateException;
import com.flagship.letter_workflow.exception.NotClaimOwnerException;
import com.flagship.letter_workflow.exception.NotFoundException;
import com.flagship.letter_workflow.letter.LetterEntity;
import com.flagship.letter_workflow.letter.LetterRepository;
import com.flagship.letter_workflow.letter.LetterStatus;
import com.flagship.letter_workflow.observability.CorrelationContext;
import com.flagship.letter_workflow.observability.WorkflowMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Grants reviewers exclusive, expiring review rights on a letter.
 *
 * Both operations lock the letter row for the whole read-check-write, so two
 * reviewers racing for the same letter are serialized and exactly one wins.
 * An abandoned claim is not swept in the background: it is taken over by the
 * next reviewer who asks for it after the TTL.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClaimService {

    private final LetterRepository letterRepository;
    private final AuditTrailService auditTrail;
    private final WorkflowProperties properties;
    private final WorkflowMetrics metrics;
    private final Clock clock;

    /**
     * Claims the letter for the reviewer.
     *
     * Succeeds when the letter is unclaimed, its claim expired, or the reviewer
     * already holds it (which refreshes the lease). A pending letter moves
     * under review.
     *
     * @throws NotFoundException if the letter does not exist
     * @throws InvalidStateException if the letter is not pending or under review
     * @throws AlreadyClaimedException if another reviewer holds a live claim
     */
    @Transactional
    public ReviewClaim claim(UUID letterId, UUID reviewerId) {
        try (CorrelationContext.MdcScope ignored = CorrelationContext.letterScope(letterId)) {
            LetterEntity letter = letterRepository.findByIdForUpdate(letterId)
                    .orElseThrow(() -> new NotFoundException("Letter", letterId));

            if (!letter.getStatus().isReviewable()) {
                metrics.recordClaim("not_claimable");
                throw new InvalidStateException(
                        "Letter " + letterId + " is not claimable in " + letter.getStatus() + " status");
            }

            Instant now = clock.instant();
            Duration ttl = properties.getClaim().getTtl();
            Optional<ReviewClaim> existing = letter.currentClaim();

            String outcome = "claimed";
            String notes = null;
            if (existing.isPresent()) {
                ReviewClaim current = existing.get();
                if (current.isHeldBy(reviewerId)) {
                    outcome = "reclaimed";
                } else if (!current.isExpiredAt(now, ttl)) {
                    metrics.recordClaim("conflict");
                    log.warn("Claim refused: letter held by {} since {}",
                            current.getClaimedBy(), current.getClaimedAt());
                    throw new AlreadyClaimedException(letterId, current.getClaimedBy(), current.getClaimedAt());
                } else {
                    outcome = "expired_takeover";
                    notes = "Took over claim of " + current.getClaimedBy() + " acquired at " + current.getClaimedAt();
                }
            }

            LetterStatus oldStatus = letter.getStatus();
            letter.claim(reviewerId, now);

            auditTrail.recordTransition(letterId, AuditAction.CLAIMED, reviewerId, oldStatus, letter.getStatus(), notes);
            if (oldStatus != letter.getStatus()) {
                metrics.recordTransition(letter.getStatus());
            }
            metrics.recordClaim(outcome);
            log.info("Letter claimed by {} ({}), status {} -> {}", reviewerId, outcome, oldStatus, letter.getStatus());

            return new ReviewClaim(letterId, reviewerId, now);
        }
    }

    /**
     * Releases the reviewer's claim. Releasing an unclaimed letter is a no-op.
     * The status is left as is: a letter under review stays under review.
     *
     * @throws NotClaimOwnerException if another reviewer holds the claim, expired or not
     */
    @Transactional
    public void release(UUID letterId, UUID reviewerId) {
        try (CorrelationContext.MdcScope ignored = CorrelationContext.letterScope(letterId)) {
            LetterEntity letter = letterRepository.findByIdForUpdate(letterId)
                    .orElseThrow(() -> new NotFoundException("Letter", letterId));

            Optional<ReviewClaim> existing = letter.currentClaim();
            if (existing.isEmpty()) {
                log.debug("Release of unclaimed letter ignored");
                return;
            }
            if (!existing.get().isHeldBy(reviewerId)) {
                log.warn("Release refused: claim held by {}, requested by {}",
                        existing.get().getClaimedBy(), reviewerId);
                throw new NotClaimOwnerException(letterId, reviewerId);
            }

            letter.releaseClaim();
            auditTrail.recordTransition(letterId, AuditAction.RELEASED, reviewerId,
                    letter.getStatus(), letter.getStatus(), null);
            metrics.recordClaim("released");
            log.info("Claim released by {}", reviewerId);
        }
    }

    /**
     * Current claim of a letter, live or expired, without locking.
     */
    @Transactional(readOnly = true)
    public Optional<ReviewClaim> currentClaim(UUID letterId) {
        return letterRepository.findById(letterId)
                .orElseThrow(() -> new NotFoundException("Letter", letterId))
                .currentClaim();
    }

    public boolean isExpired(ReviewClaim claim) {
        return claim.isExpiredAt(clock.instant(), properties.getClaim().getTtl());
    }
}
