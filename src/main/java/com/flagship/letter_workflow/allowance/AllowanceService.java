package com.flagship.letter_workflow.allowance;

import com.flagship.letter_workflow.audit.AuditAction;
import com.flagship.letter_workflow.audit.AuditTrailService;
import com.flagship.letter_workflow.exception.AllowanceExhaustedException;
import com.flagship.letter_workflow.exception.NoActiveAllowanceException;
import com.flagship.letter_workflow.exception.ValidationException;
import com.flagship.letter_workflow.observability.CorrelationContext;
import com.flagship.letter_workflow.observability.WorkflowMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Checks and deducts letter credits, with a compensating refund path.
 *
 * Every mutation runs in one transaction that reads and writes under row
 * lock. Deduction locks the user's profile row first and the active allowance
 * second, so concurrent calls for the same user are serialized while calls for
 * different users never wait on each other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AllowanceService {

    private final AllowanceRepository allowanceRepository;
    private final UsageCounterRepository usageCounter;
    private final AuditTrailService auditTrail;
    private final WorkflowMetrics metrics;

    /**
     * Consumes one unit for the user.
     *
     * A user who never consumed a unit and holds no active allowance gets the
     * free trial. Otherwise one credit is taken from the active allowance.
     *
     * @throws NoActiveAllowanceException if there is no active allowance and the free trial is used
     * @throws AllowanceExhaustedException if the active allowance has no credits left
     */
    @Transactional
    public DeductionResult checkAndDeduct(UUID userId) {
        return checkAndDeduct(userId, null);
    }

    /**
     * Same as {@link #checkAndDeduct(UUID)}, attributing the audit entry to a letter.
     */
    @Transactional
    public DeductionResult checkAndDeduct(UUID userId, UUID letterId) {
        try (CorrelationContext.MdcScope ignored = CorrelationContext.userScope(userId)) {
            int lifetimeUsage = usageCounter.lockAndGet(userId);
            Optional<AllowanceEntity> active = allowanceRepository.findActiveForUpdate(userId);

            if (active.isEmpty()) {
                if (lifetimeUsage == 0) {
                    usageCounter.increment(userId);
                    auditTrail.record(letterId, AuditAction.FREE_TRIAL_USED, userId, "Free trial letter", null);
                    metrics.recordDeduction("free_trial");
                    log.info("Free trial granted");
                    return DeductionResult.freeTrial();
                }
                metrics.recordDeduction("no_allowance");
                log.warn("Deduction refused: no active allowance, lifetime usage={}", lifetimeUsage);
                throw new NoActiveAllowanceException(userId);
            }

            AllowanceEntity allowance = active.get();
            if (allowance.getCreditsRemaining() <= 0) {
                metrics.recordDeduction("exhausted");
                log.warn("Deduction refused: allowance {} exhausted", allowance.getId());
                throw new AllowanceExhaustedException(userId);
            }

            allowance.consumeCredit();
            usageCounter.increment(userId);
            auditTrail.record(letterId, AuditAction.CREDIT_DEDUCTED, userId, null,
                    Map.of("allowanceId", allowance.getId(), "remaining", allowance.getCreditsRemaining()));

            metrics.recordDeduction("credit");
            log.info("Credit deducted from allowance {}: remaining={}",
                    allowance.getId(), allowance.getCreditsRemaining());
            return DeductionResult.credit(allowance.getCreditsRemaining(), allowance.getId());
        }
    }

    /**
     * Returns credits to the user's active allowance after downstream work failed.
     *
     * @return credits remaining after the refund
     * @throws NoActiveAllowanceException if the user's subscription lapsed in between
     */
    @Transactional
    public int refund(UUID userId, int amount) {
        return refund(userId, amount, null);
    }

    @Transactional
    public int refund(UUID userId, int amount, UUID letterId) {
        return applyRefund(userId, amount, letterId, userId, null);
    }

    /**
     * Manual refund issued by an operator, e.g. after a support case. The
     * audit entry names the operator as actor and the credited user in its
     * metadata.
     *
     * @return credits remaining after the refund
     * @throws NoActiveAllowanceException if the user has no active allowance
     */
    @Transactional
    public int refundByOperator(UUID userId, int amount, UUID operatorId, String reason) {
        if (operatorId == null) {
            throw new ValidationException("Operator id is required for a manual refund");
        }
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A reason is required for a manual refund");
        }
        int remaining = applyRefund(userId, amount, null, operatorId, reason.trim());
        log.info("Operator {} refunded {} credit(s) to user {}", operatorId, amount, userId);
        return remaining;
    }

    private int applyRefund(UUID userId, int amount, UUID letterId, UUID performedBy, String notes) {
        if (amount < 1) {
            throw new ValidationException("Refund amount must be at least 1, got " + amount);
        }
        try (CorrelationContext.MdcScope ignored = CorrelationContext.userScope(userId)) {
            AllowanceEntity allowance = allowanceRepository.findActiveForUpdate(userId)
                    .orElseThrow(() -> new NoActiveAllowanceException(userId));

            allowance.refundCredits(amount);
            auditTrail.record(letterId, AuditAction.CREDIT_REFUNDED, performedBy, notes,
                    Map.of("userId", userId, "allowanceId", allowance.getId(), "amount", amount,
                            "remaining", allowance.getCreditsRemaining()));

            metrics.recordRefund(performedBy.equals(userId) ? "refunded" : "manual");
            log.info("Refunded {} credit(s) to allowance {}: remaining={}",
                    amount, allowance.getId(), allowance.getCreditsRemaining());
            return allowance.getCreditsRemaining();
        }
    }

    /**
     * Grants a paid subscription as part of the caller's activation
     * transaction: the current active allowance expires, and the user's latest
     * pending checkout is activated (or a new active allowance is created when
     * there is none).
     *
     * Locks the profile row first, like {@link #checkAndDeduct}, so an
     * activation and a deduction for the same user never interleave.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Allowance grantSubscription(UUID userId, String planType, int credits, AllowanceTerms terms,
                                       Instant periodStart, Instant periodEnd,
                                       String externalSessionId, String externalCustomerId) {
        try (CorrelationContext.MdcScope ignored = CorrelationContext.userScope(userId)) {
            usageCounter.lockAndGet(userId);

            allowanceRepository.findActiveForUpdate(userId).ifPresent(previous -> {
                previous.expire();
                allowanceRepository.saveAndFlush(previous);
                log.info("Expired previous allowance {}", previous.getId());
            });

            AllowanceEntity granted = allowanceRepository
                    .findFirstByUserIdAndStatusOrderByCreatedAtDesc(userId, AllowanceStatus.PENDING)
                    .map(pending -> {
                        pending.activate(planType, credits, terms, periodStart, periodEnd);
                        return pending;
                    })
                    .orElseGet(() -> AllowanceEntity.active(userId, planType, credits, terms, periodStart, periodEnd));
            granted.recordExternalReferences(externalSessionId, externalCustomerId);
            granted = allowanceRepository.saveAndFlush(granted);

            log.info("Granted {} credits on plan {} through allowance {}", credits, planType, granted.getId());
            return granted.toDomain();
        }
    }

    /**
     * Opens a checkout for a plan; the allowance stays PENDING until payment
     * is confirmed.
     */
    @Transactional
    public Allowance openCheckout(UUID userId, String planType, int credits, AllowanceTerms terms) {
        AllowanceEntity pending = allowanceRepository.save(AllowanceEntity.pending(userId, planType, credits, terms));
        log.info("Opened checkout {} for user {} on plan {}", pending.getId(), userId, planType);
        return pending.toDomain();
    }

    /**
     * Closes the user's pending checkouts with the given outcome, e.g. when the
     * payment provider reports the checkout expired or the payment failed.
     *
     * @return number of checkouts closed
     */
    @Transactional
    public int closePendingCheckouts(UUID userId, AllowanceStatus outcome) {
        if (outcome != AllowanceStatus.CANCELED && outcome != AllowanceStatus.PAYMENT_FAILED) {
            throw new ValidationException("Pending checkouts can only be closed as CANCELED or PAYMENT_FAILED");
        }
        int closed = allowanceRepository.transitionAll(userId, AllowanceStatus.PENDING, outcome, Instant.now());
        log.info("Closed {} pending checkout(s) of user {} as {}", closed, userId, outcome);
        return closed;
    }

    @Transactional(readOnly = true)
    public Optional<Allowance> findActive(UUID userId) {
        return allowanceRepository.findByUserIdAndStatus(userId, AllowanceStatus.ACTIVE)
                .map(AllowanceEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Allowance> history(UUID userId) {
        return allowanceRepository.findByUserIdOrderByCreatedAtDesc(userId)
                .stream()
                .map(AllowanceEntity::toDomain)
                .toList();
    }

    /**
     * Whether the user's next deduction would be served by the free trial.
     */
    @Transactional(readOnly = true)
    public boolean isFreeTrialAvailable(UUID userId) {
        return usageCounter.get(userId) == 0
                && allowanceRepository.countByUserIdAndStatus(userId, AllowanceStatus.ACTIVE) == 0;
    }

    @Transactional(readOnly = true)
    public int lifetimeUsage(UUID userId) {
        return usageCounter.get(userId);
    }
}
