package com.flagship.letter_workflow.allowance;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for {@code allowances}.
 *
 * No setters: credits and status only move through the guarded mutators
 * below, which callers invoke while holding the row lock.
 */
@Entity
@Table(name = "allowances")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AllowanceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AllowanceStatus status;

    @Column(name = "plan_type", nullable = false, length = 64)
    private String planType;

    @Column(name = "granted_credits", nullable = false)
    private int grantedCredits;

    @Column(name = "credits_remaining", nullable = false)
    private int creditsRemaining;

    @Column(name = "base_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal basePrice;

    @Column(name = "discount_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal discountAmount;

    @Column(name = "final_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal finalPrice;

    @Column(name = "coupon_code", length = 64)
    private String couponCode;

    @Column(name = "employee_id")
    private UUID employeeId;

    @Column(name = "external_session_id")
    private String externalSessionId;

    @Column(name = "external_customer_id")
    private String externalCustomerId;

    @Column(name = "period_start")
    private Instant periodStart;

    @Column(name = "period_end")
    private Instant periodEnd;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Opens a checkout: the row waits in PENDING with its pricing captured
     * until the payment notification activates it.
     */
    public static AllowanceEntity pending(UUID userId, String planType, int credits, AllowanceTerms terms) {
        return new AllowanceEntity(UUID.randomUUID(), userId, AllowanceStatus.PENDING, planType,
                credits, 0,
                terms.getBasePrice(), terms.getDiscountAmount(), terms.getFinalPrice(),
                terms.getCouponCode(), terms.getEmployeeId(),
                null, null, null, null, null, null);
    }

    /**
     * Creates an allowance that is active from the start, used when a payment
     * notification arrives without a matching pending checkout.
     */
    public static AllowanceEntity active(UUID userId, String planType, int credits, AllowanceTerms terms,
                                         Instant periodStart, Instant periodEnd) {
        return new AllowanceEntity(UUID.randomUUID(), userId, AllowanceStatus.ACTIVE, planType,
                credits, credits,
                terms.getBasePrice(), terms.getDiscountAmount(), terms.getFinalPrice(),
                terms.getCouponCode(), terms.getEmployeeId(),
                null, null, periodStart, periodEnd, null, null);
    }

    public void activate(String planType, int credits, AllowanceTerms terms,
                         Instant periodStart, Instant periodEnd) {
        if (status != AllowanceStatus.PENDING) {
            throw new IllegalStateException(
                "Cannot activate allowance " + id + " in " + status + " status. Only PENDING allowances can be activated.");
        }
        if (credits < 0) {
            throw new IllegalArgumentException("Granted credits must not be negative: " + credits);
        }
        this.status = AllowanceStatus.ACTIVE;
        this.planType = planType;
        this.grantedCredits = credits;
        this.creditsRemaining = credits;
        this.basePrice = terms.getBasePrice();
        this.discountAmount = terms.getDiscountAmount();
        this.finalPrice = terms.getFinalPrice();
        this.couponCode = terms.getCouponCode();
        this.employeeId = terms.getEmployeeId();
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
    }

    public void recordExternalReferences(String sessionId, String customerId) {
        this.externalSessionId = sessionId;
        this.externalCustomerId = customerId;
    }

    /**
     * Takes one credit. Caller must hold the row lock.
     */
    void consumeCredit() {
        if (status != AllowanceStatus.ACTIVE) {
            throw new IllegalStateException("Cannot consume credit from allowance " + id + " in " + status + " status");
        }
        if (creditsRemaining <= 0) {
            throw new IllegalStateException("Allowance " + id + " has no credits remaining");
        }
        this.creditsRemaining--;
    }

    /**
     * Returns credits. The balance is not capped at the granted amount.
     */
    void refundCredits(int amount) {
        if (status != AllowanceStatus.ACTIVE) {
            throw new IllegalStateException("Cannot refund credits to allowance " + id + " in " + status + " status");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Refund amount must be positive: " + amount);
        }
        this.creditsRemaining += amount;
    }

    public void expire() {
        if (status != AllowanceStatus.ACTIVE) {
            throw new IllegalStateException("Only ACTIVE allowances can expire, allowance " + id + " is " + status);
        }
        this.status = AllowanceStatus.EXPIRED;
    }

    public Allowance toDomain() {
        return new Allowance(id, userId, status, planType, grantedCredits, creditsRemaining,
                basePrice, discountAmount, finalPrice, couponCode, employeeId,
                periodStart, periodEnd, createdAt);
    }
}
