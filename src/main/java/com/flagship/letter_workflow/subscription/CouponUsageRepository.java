package com.flagship.letter_workflow.subscription;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CouponUsageRepository extends JpaRepository<CouponUsageEntity, UUID> {

    long countByCouponCode(String couponCode);
}
