package com.flagship.letter_workflow.subscription;

import com.flagship.letter_workflow.allowance.Allowance;
import com.flagship.letter_workflow.allowance.AllowanceService;
import com.flagship.letter_workflow.allowance.AllowanceTerms;
import com.flagship.letter_workflow.audit.AuditAction;
import com.flagship.letter_workflow.audit.AuditTrailService;
import com.flagship.letter_workflow.config.WorkflowProperties;
import com.flagship.letter_workflow.exception.NotFoundException;
import com.flagship.letter_workflow.exception.ValidationException;
import com.flagship.letter_workflow.observability.CorrelationContext;
import com.flagship.letter_workflow.observability.WorkflowMetrics;
import com.flagship.letter_workflow.outbox.OutboxService;
import com.flagship.letter_workflow.subscription.event.CommissionEarnedEvent;
import com.flagship.letter_workflow.subscription.event.SubscriptionActivatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Activates a subscription together with its accounting, all or nothing.
 *
 * In one transaction:
 * 1. The user's allowance is granted (previous active allowance expired,
 *    latest pending checkout activated or a new allowance created)
 * 2. A referring employee on a paid subscription earns a commission and
 *    their coupon usage counter is incremented
 * 3. A coupon, if any, is recorded with the price before and after
 *
 * Any failure rolls back the grant as well. Called from the payment
 * notification processor inside the transaction that recorded the
 * notification, so a failed activation also forgets the notification and
 * the provider's retry gets a clean second attempt.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionActivationService {

    private final AllowanceService allowanceService;
    private final CommissionRepository commissionRepository;
    private final EmployeeCouponRepository couponRepository;
    private final CouponUsageRepository couponUsageRepository;
    private final AuditTrailService auditTrail;
    private final OutboxService outboxService;
    private final WorkflowProperties properties;
    private final WorkflowMetrics metrics;
    private final Clock clock;

    @Transactional
    public ActivationResult activate(ActivationRequest request) {
        validate(request);
        try (CorrelationContext.MdcScope ignored = CorrelationContext.userScope(request.getUserId())) {
            Instant periodStart = clock.instant();
            Instant periodEnd = periodStart.plus(properties.getSubscription().getPeriod());
            PriceQuote quote = PriceQuote.fromAmounts(
                    request.getBasePrice(), request.getDiscountAmount(), request.getFinalPrice());

            AllowanceTerms terms = new AllowanceTerms(quote.getBasePrice(), quote.getDiscountAmount(),
                    quote.getFinalPrice(), request.getCouponCode(), request.getEmployeeId());
            Allowance allowance = allowanceService.grantSubscription(request.getUserId(), request.getPlanType(),
                    request.getLetters(), terms, periodStart, periodEnd,
                    request.getExternalSessionId(), request.getExternalCustomerId());

            Commission commission = null;
            if (request.earnsCommission()) {
                commission = createCommission(request.getEmployeeId(), allowance.getId(), quote.getFinalPrice());
            }

            UUID couponUsageId = null;
            if (request.hasCoupon()) {
                couponUsageId = couponUsageRepository.saveAndFlush(CouponUsageEntity.record(
                        request.getUserId(), allowance.getId(), request.getCouponCode(),
                        request.getEmployeeId(), quote)).getId();
            }

            auditTrail.record(null, AuditAction.SUBSCRIPTION_ACTIVATED, request.getUserId(),
                    "Plan " + request.getPlanType() + " with " + request.getLetters() + " letters",
                    auditMetadata(allowance, commission));

            outboxService.saveEvent(OutboxService.SUBSCRIPTION_AGGREGATE, allowance.getId(),
                    SubscriptionActivatedEvent.EVENT_TYPE, SubscriptionActivatedEvent.from(allowance));
            if (commission != null) {
                outboxService.saveEvent(OutboxService.SUBSCRIPTION_AGGREGATE, allowance.getId(),
                        CommissionEarnedEvent.EVENT_TYPE, CommissionEarnedEvent.from(commission));
            }

            metrics.recordActivation(commission != null ? "with_commission" : "activated");
            log.info("Subscription activated: allowance={}, plan={}, letters={}, finalPrice={}, commission={}",
                    allowance.getId(), request.getPlanType(), request.getLetters(), quote.getFinalPrice(),
                    commission != null ? commission.getCommissionAmount() : BigDecimal.ZERO);

            return new ActivationResult(allowance, commission, couponUsageId);
        }
    }

    private Commission createCommission(UUID employeeId, UUID allowanceId, BigDecimal finalPrice) {
        CommissionEntity commission = commissionRepository.saveAndFlush(
                CommissionEntity.earned(employeeId, allowanceId, finalPrice, properties.getCommission().getRate()));

        if (couponRepository.incrementUsage(employeeId) == 0) {
            throw new NotFoundException("Employee coupon", employeeId);
        }
        log.info("Commission {} of {} earned by employee {}",
                commission.getId(), commission.getCommissionAmount(), employeeId);
        return commission.toDomain();
    }

    private void validate(ActivationRequest request) {
        if (request.getUserId() == null) {
            throw new ValidationException("User id is required for activation");
        }
        if (request.getPlanType() == null || request.getPlanType().isBlank()) {
            throw new ValidationException("Plan type is required for activation");
        }
        if (request.getLetters() < 1) {
            throw new ValidationException("A subscription must grant at least one letter, got " + request.getLetters());
        }
        if (request.getBasePrice() == null || request.getDiscountAmount() == null || request.getFinalPrice() == null) {
            throw new ValidationException("Base price, discount and final price are required for activation");
        }
        if (request.getFinalPrice().signum() < 0) {
            throw new ValidationException("Final price must not be negative: " + request.getFinalPrice());
        }
    }

    private Map<String, Object> auditMetadata(Allowance allowance, Commission commission) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("allowanceId", allowance.getId());
        metadata.put("credits", allowance.getGrantedCredits());
        metadata.put("finalPrice", allowance.getFinalPrice());
        if (allowance.getCouponCode() != null) {
            metadata.put("couponCode", allowance.getCouponCode());
        }
        if (commission != null) {
            metadata.put("commissionId", commission.getId());
            metadata.put("commissionAmount", commission.getCommissionAmount());
        }
        return metadata;
    }
}
