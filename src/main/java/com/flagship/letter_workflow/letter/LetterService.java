package com.flagship.letter_workflow.letter;

import com.flagship.letter_workflow.allowance.AllowanceService;
import com.flagship.letter_workflow.allowance.DeductionResult;
import com.flagship.letter_workflow.audit.AuditAction;
import com.flagship.letter_workflow.audit.AuditEntry;
import com.flagship.letter_workflow.audit.AuditTrailService;
import com.flagship.letter_workflow.claim.ReviewClaim;
import com.flagship.letter_workflow.config.WorkflowProperties;
import com.flagship.letter_workflow.exception.AlreadyClaimedException;
import com.flagship.letter_workflow.exception.NotClaimOwnerException;
import com.flagship.letter_workflow.exception.NotFoundException;
import com.flagship.letter_workflow.exception.NotLetterOwnerException;
import com.flagship.letter_workflow.exception.ValidationException;
import com.flagship.letter_workflow.letter.event.LetterStatusChangedEvent;
import com.flagship.letter_workflow.observability.CorrelationContext;
import com.flagship.letter_workflow.observability.WorkflowMetrics;
import com.flagship.letter_workflow.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Drives letters through their review lifecycle.
 *
 * Every transition locks the letter row, validates its inputs, applies the
 * status change and appends the audit entry in one transaction: a transition
 * is never visible without its audit record. Notifications for the owner go
 * through the outbox in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LetterService {

    private final LetterRepository letterRepository;
    private final AllowanceService allowanceService;
    private final AuditTrailService auditTrail;
    private final OutboxService outboxService;
    private final WorkflowProperties properties;
    private final WorkflowMetrics metrics;
    private final Clock clock;

    @Transactional
    public Letter createDraft(UUID ownerId, String letterType, String title, Map<String, Object> intakeData) {
        if (letterType == null || letterType.isBlank()) {
            throw new ValidationException("Letter type is required");
        }
        if (title == null || title.isBlank()) {
            throw new ValidationException("Title is required");
        }
        LetterEntity saved = letterRepository.save(LetterEntity.draft(ownerId, letterType, title, intakeData));
        auditTrail.recordTransition(saved.getId(), AuditAction.CREATED, ownerId, null, LetterStatus.DRAFT, null);
        metrics.recordTransition(LetterStatus.DRAFT);
        log.info("Draft letter {} created by {}", saved.getId(), ownerId);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Letter getLetter(UUID letterId) {
        return letterRepository.findById(letterId)
                .map(LetterEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("Letter", letterId));
    }

    @Transactional(readOnly = true)
    public List<Letter> listForOwner(UUID ownerId) {
        return letterRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId)
                .stream()
                .map(LetterEntity::toDomain)
                .toList();
    }

    /**
     * Letters pending or under review, oldest first.
     */
    @Transactional(readOnly = true)
    public List<ReviewQueueItem> listReviewQueue() {
        Instant now = clock.instant();
        return letterRepository.findByStatusInOrderByCreatedAtAsc(LetterStatus.REVIEWABLE)
                .stream()
                .map(letter -> new ReviewQueueItem(
                        letter.getId(),
                        letter.getOwnerId(),
                        letter.getLetterType(),
                        letter.getTitle(),
                        letter.getStatus(),
                        letter.getClaimedBy(),
                        letter.getClaimedAt(),
                        letter.currentClaim()
                                .map(claim -> claim.isExpiredAt(now, properties.getClaim().getTtl()))
                                .orElse(false),
                        letter.getCreatedAt()))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<AuditEntry> getAuditTrail(UUID letterId) {
        if (!letterRepository.existsById(letterId)) {
            throw new NotFoundException("Letter", letterId);
        }
        return auditTrail.getTrail(letterId);
    }

    /**
     * Charges one unit to the owner and hands the draft to the generation
     * subsystem. The deduction and the transition commit together, so a
     * refused transition never consumes a credit.
     */
    @Transactional
    public SubmissionResult submitForGeneration(UUID letterId, UUID ownerId) {
        try (CorrelationContext.MdcScope ignored = CorrelationContext.letterScope(letterId)) {
            LetterEntity letter = lockLetter(letterId);
            requireOwner(letter, ownerId);
            LetterTransition.SUBMIT.requireFrom(letter.getStatus());

            DeductionResult deduction = allowanceService.checkAndDeduct(ownerId, letterId);
            letter.markGenerating(deduction.isFreeTrial());

            String notes = deduction.isFreeTrial()
                    ? "Funded by free trial"
                    : "Funded by subscription credit, " + deduction.getRemaining() + " remaining";
            Letter result = recordTransition(letter, LetterTransition.SUBMIT, ownerId, notes,
                    LetterStatusChangedEvent.LETTER_SUBMITTED);
            return new SubmissionResult(result, deduction);
        }
    }

    @Transactional
    public Letter completeGeneration(UUID letterId, String draftContent) {
        if (draftContent == null || draftContent.isBlank()) {
            throw new ValidationException("Generated draft content must not be empty");
        }
        try (CorrelationContext.MdcScope ignored = CorrelationContext.letterScope(letterId)) {
            LetterEntity letter = lockLetter(letterId);
            letter.completeGeneration(draftContent);
            return recordTransition(letter, LetterTransition.GENERATION_SUCCEEDED, AuditEntry.SYSTEM_ACTOR, null,
                    LetterStatusChangedEvent.LETTER_READY_FOR_REVIEW);
        }
    }

    /**
     * Marks generation as failed. The credit refund is the caller's follow-up
     * once this commits, see {@link GenerationWorkflow#failGeneration}.
     */
    @Transactional
    public Letter failGeneration(UUID letterId, String reason) {
        try (CorrelationContext.MdcScope ignored = CorrelationContext.letterScope(letterId)) {
            LetterEntity letter = lockLetter(letterId);
            letter.failGeneration();
            return recordTransition(letter, LetterTransition.GENERATION_FAILED, AuditEntry.SYSTEM_ACTOR, reason,
                    LetterStatusChangedEvent.LETTER_GENERATION_FAILED);
        }
    }

    /**
     * Approves the letter. The reviewer must hold the claim; it is cleared.
     */
    @Transactional
    public Letter approve(UUID letterId, UUID reviewerId, String finalContent, String notes) {
        if (finalContent == null || finalContent.isBlank()) {
            throw new ValidationException("Final content is required to approve a letter");
        }
        try (CorrelationContext.MdcScope ignored = CorrelationContext.letterScope(letterId)) {
            LetterEntity letter = lockLetter(letterId);
            LetterTransition.APPROVE.requireFrom(letter.getStatus());
            Instant now = clock.instant();
            requireClaimHolder(letter, reviewerId, now);

            letter.approve(reviewerId, finalContent, notes, now);
            return recordTransition(letter, LetterTransition.APPROVE, reviewerId, notes,
                    LetterStatusChangedEvent.LETTER_APPROVED);
        }
    }

    /**
     * Rejects the letter with a reason. The reviewer must hold the claim; it is cleared.
     */
    @Transactional
    public Letter reject(UUID letterId, UUID reviewerId, String reason, String notes) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A rejection reason is required");
        }
        try (CorrelationContext.MdcScope ignored = CorrelationContext.letterScope(letterId)) {
            LetterEntity letter = lockLetter(letterId);
            LetterTransition.REJECT.requireFrom(letter.getStatus());
            Instant now = clock.instant();
            requireClaimHolder(letter, reviewerId, now);

            letter.reject(reviewerId, reason, notes, now);
            return recordTransition(letter, LetterTransition.REJECT, reviewerId, reason,
                    LetterStatusChangedEvent.LETTER_REJECTED);
        }
    }

    /**
     * Records delivery of an approved letter. Delivery problems downstream do
     * not undo the approval.
     */
    @Transactional
    public Letter markDelivered(UUID letterId, UUID actorId) {
        try (CorrelationContext.MdcScope ignored = CorrelationContext.letterScope(letterId)) {
            LetterEntity letter = lockLetter(letterId);
            letter.deliver();
            return recordTransition(letter, LetterTransition.DELIVER, actorId, null,
                    LetterStatusChangedEvent.LETTER_COMPLETED);
        }
    }

    /**
     * Sends a rejected letter back to draft so the owner can revise it.
     */
    @Transactional
    public Letter resubmit(UUID letterId, UUID ownerId) {
        try (CorrelationContext.MdcScope ignored = CorrelationContext.letterScope(letterId)) {
            LetterEntity letter = lockLetter(letterId);
            requireOwner(letter, ownerId);
            String previousReason = letter.getRejectionReason();
            letter.resubmit();
            return recordTransition(letter, LetterTransition.RESUBMIT, ownerId,
                    previousReason != null ? "Previously rejected: " + previousReason : null, null);
        }
    }

    private LetterEntity lockLetter(UUID letterId) {
        return letterRepository.findByIdForUpdate(letterId)
                .orElseThrow(() -> new NotFoundException("Letter", letterId));
    }

    private void requireOwner(LetterEntity letter, UUID userId) {
        if (!letter.getOwnerId().equals(userId)) {
            throw new NotLetterOwnerException(letter.getId(), userId);
        }
    }

    /**
     * The reviewer's own claim counts even past its TTL as long as nobody took
     * it over. A live claim of someone else is a conflict; anything else means
     * the reviewer has to claim first.
     */
    private void requireClaimHolder(LetterEntity letter, UUID reviewerId, Instant now) {
        ReviewClaim claim = letter.currentClaim().orElse(null);
        if (claim != null && claim.isHeldBy(reviewerId)) {
            return;
        }
        if (claim != null && !claim.isExpiredAt(now, properties.getClaim().getTtl())) {
            throw new AlreadyClaimedException(letter.getId(), claim.getClaimedBy(), claim.getClaimedAt());
        }
        throw new NotClaimOwnerException(letter.getId(), reviewerId);
    }

    private Letter recordTransition(LetterEntity letter, LetterTransition transition, UUID actorId,
                                    String notes, String notificationType) {
        auditTrail.recordTransition(letter.getId(), transition.getAuditAction(), actorId,
                transition.getFrom(), transition.getTo(), notes);
        metrics.recordTransition(transition.getTo());

        Letter result = letter.toDomain();
        if (notificationType != null) {
            outboxService.saveEvent(OutboxService.LETTER_AGGREGATE, letter.getId(), notificationType,
                    LetterStatusChangedEvent.of(notificationType, result, actorId, notes));
        }
        log.info("Letter {} {} -> {} by {}", letter.getId(), transition.getFrom(), transition.getTo(), actorId);
        return result;
    }
}
