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
 * JPA entity for {@code employee_coupons}: one referral coupon per employee.
 * The usage counter is only moved by {@link EmployeeCouponRepository#incrementUsage}.
 */
@Entity
@Table(name = "employee_coupons")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EmployeeCouponEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "employee_id", nullable = false, updatable = false)
    private UUID employeeId;

    @Column(nullable = false, updatable = false, length = 64)
    private String code;

    @Column(name = "discount_percent", nullable = false, precision = 5, scale = 2)
    private BigDecimal discountPercent;

    @Column(name = "usage_count", nullable = false, insertable = false, updatable = false)
    private int usageCount;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public static EmployeeCouponEntity issue(UUID employeeId, String code, BigDecimal discountPercent) {
        if (discountPercent.signum() < 0 || discountPercent.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new IllegalArgumentException("Discount percent must be between 0 and 100: " + discountPercent);
        }
        return new EmployeeCouponEntity(UUID.randomUUID(), employeeId, code, discountPercent, 0, true, null);
    }

    public void deactivate() {
        this.active = false;
    }
}
