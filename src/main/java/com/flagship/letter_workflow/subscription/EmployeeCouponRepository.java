package com.flagship.letter_workflow.subscription;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface EmployeeCouponRepository extends JpaRepository<EmployeeCouponEntity, UUID> {

    Optional<EmployeeCouponEntity> findByCodeIgnoreCaseAndActiveTrue(String code);

    Optional<EmployeeCouponEntity> findByEmployeeId(UUID employeeId);

    /**
     * Atomic in-place increment, so concurrent activations crediting the same
     * employee never lose an update.
     *
     * @return number of coupons updated, 0 when the employee has none
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE EmployeeCouponEntity c SET c.usageCount = c.usageCount + 1 WHERE c.employeeId = :employeeId")
    int incrementUsage(@Param("employeeId") UUID employeeId);
}
