package com.flagship.letter_workflow.subscription;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CommissionRepository extends JpaRepository<CommissionEntity, UUID> {

    List<CommissionEntity> findByEmployeeIdOrderByCreatedAtDesc(UUID employeeId);

    Optional<CommissionEntity> findByAllowanceId(UUID allowanceId);

    @Query("SELECT COALESCE(SUM(c.commissionAmount), 0) FROM CommissionEntity c WHERE c.employeeId = :employeeId")
    BigDecimal sumAmountByEmployeeId(@Param("employeeId") UUID employeeId);
}
