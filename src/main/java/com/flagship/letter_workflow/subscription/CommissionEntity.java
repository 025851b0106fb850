package com.flagship.letter_workflow.subscription;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for {@code commissions}. One commission per activated allowance
 * (unique on {@code allowance_id}); the employee must own a coupon
 * (foreign key on {@code employee_id}).
 */
@Entity
@Table(name = "commissions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CommissionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "employee_id", nullable = false, updatable = false)
    private UUID employeeId;

    @Column(name = "allowance_id", nullable = false, updatable = false)
    private UUID allowanceId;

    @Column(name = "subscription_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal subscriptionAmount;

    @Column(name = "commission_rate", nullable = false, precision = 5, scale = 4)
    private BigDecimal commissionRate;

    @Column(name = "commission_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal commissionAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private CommissionStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    /**
     * Commission on a paid subscription: final price times rate, rounded half up to cents.
     */
    static CommissionEntity earned(UUID employeeId, UUID allowanceId, BigDecimal finalPrice, BigDecimal rate) {
        return new CommissionEntity(UUID.randomUUID(), employeeId, allowanceId,
                finalPrice, rate, amountFor(finalPrice, rate), CommissionStatus.PENDING, null);
    }

    static BigDecimal amountFor(BigDecimal finalPrice, BigDecimal rate) {
        return finalPrice.multiply(rate).setScale(2, RoundingMode.HALF_UP);
    }

    public Commission toDomain() {
        return new Commission(id, employeeId, allowanceId, subscriptionAmount,
                commissionRate, commissionAmount, status, createdAt);
    }
}
