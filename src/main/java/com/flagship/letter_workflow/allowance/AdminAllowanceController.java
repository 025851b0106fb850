package com.flagship.letter_workflow.allowance;

import com.flagship.letter_workflow.allowance.dto.ManualRefundRequest;
import com.flagship.letter_workflow.retry.TransactionRetrier;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * Operator endpoints for the allowance meter. The credited user comes from
 * the path, the acting operator from the {@code X-User-Id} header.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/allowances")
@RequiredArgsConstructor
public class AdminAllowanceController {

    private final AllowanceService allowanceService;
    private final TransactionRetrier retrier;

    @PostMapping("/{userId}/refund")
    public Map<String, Object> refund(
            @PathVariable UUID userId,
            @RequestHeader(AllowanceController.USER_ID_HEADER) UUID operatorId,
            @Valid @RequestBody ManualRefundRequest request) {

        log.info("Manual refund requested: operator={}, user={}, amount={}",
                operatorId, userId, request.getAmount());

        int remaining = retrier.execute("manualRefund",
                () -> allowanceService.refundByOperator(userId, request.getAmount(), operatorId, request.getReason()));
        return Map.of("user_id", userId, "credits_remaining", remaining);
    }
}
