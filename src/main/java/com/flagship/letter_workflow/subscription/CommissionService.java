package com.flagship.letter_workflow.subscription;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Read side of commissions. Commissions are only ever created by
 * {@link SubscriptionActivationService}.
 */
@Service
@RequiredArgsConstructor
public class CommissionService {

    private final CommissionRepository commissionRepository;

    @Transactional(readOnly = true)
    public List<Commission> listForEmployee(UUID employeeId) {
        return commissionRepository.findByEmployeeIdOrderByCreatedAtDesc(employeeId)
                .stream()
                .map(CommissionEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public BigDecimal totalForEmployee(UUID employeeId) {
        return commissionRepository.sumAmountByEmployeeId(employeeId);
    }
}
