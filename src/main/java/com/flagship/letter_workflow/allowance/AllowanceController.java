package com.flagship.letter_workflow.allowance;

import com.flagship.letter_workflow.allowance.dto.AllowanceResponse;
import com.flagship.letter_workflow.allowance.dto.AllowanceSummaryResponse;
import com.flagship.letter_workflow.allowance.dto.DeductionResponse;
import com.flagship.letter_workflow.retry.TransactionRetrier;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller exposing the allowance meter.
 *
 * Metering failures answer 402 with an "upgrade or wait" message. Refunds
 * are not offered to subscribers: failed generations refund themselves and
 * manual refunds go through {@link AdminAllowanceController}.
 */
@RestController
@RequestMapping("/api/allowances")
@RequiredArgsConstructor
public class AllowanceController {

    static final String USER_ID_HEADER = "X-User-Id";

    private final AllowanceService allowanceService;
    private final TransactionRetrier retrier;

    @GetMapping("/me")
    public AllowanceSummaryResponse summary(@RequestHeader(USER_ID_HEADER) UUID userId) {
        return AllowanceSummaryResponse.builder()
                .active(allowanceService.findActive(userId).map(AllowanceResponse::from).orElse(null))
                .freeTrialAvailable(allowanceService.isFreeTrialAvailable(userId))
                .lifetimeLetters(allowanceService.lifetimeUsage(userId))
                .build();
    }

    @GetMapping("/me/history")
    public List<AllowanceResponse> history(@RequestHeader(USER_ID_HEADER) UUID userId) {
        return allowanceService.history(userId).stream()
                .map(AllowanceResponse::from)
                .toList();
    }

    @PostMapping("/deduct")
    public DeductionResponse deduct(@RequestHeader(USER_ID_HEADER) UUID userId) {
        return DeductionResponse.from(retrier.execute("checkAndDeduct",
                () -> allowanceService.checkAndDeduct(userId)));
    }
}
