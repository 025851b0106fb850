package com.flagship.letter_workflow.subscription;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for {@code coupon_usage}: the price a coupon took a subscription from and to.
 */
@Entity
@Table(name = "coupon_usage")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CouponUsageEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "allowance_id", nullable = false, updatable = false)
    private UUID allowanceId;

    @Column(name = "coupon_code", nullable = false, updatable = false, length = 64)
    private String couponCode;

    @Column(name = "employee_id", updatable = false)
    private UUID employeeId;

    @Column(name = "discount_percent", nullable = false, precision = 5, scale = 2)
    private BigDecimal discountPercent;

    @Column(name = "amount_before", nullable = false, precision = 12, scale = 2)
    private BigDecimal amountBefore;

    @Column(name = "amount_after", nullable = false, precision = 12, scale = 2)
    private BigDecimal amountAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static CouponUsageEntity record(UUID userId, UUID allowanceId, String couponCode, UUID employeeId,
                                    PriceQuote quote) {
        return new CouponUsageEntity(UUID.randomUUID(), userId, allowanceId, couponCode, employeeId,
                quote.getDiscountPercent(), quote.getBasePrice(), quote.getFinalPrice(), null);
    }
}
