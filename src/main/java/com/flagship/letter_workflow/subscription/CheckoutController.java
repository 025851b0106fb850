package com.flagship.letter_workflow.subscription;

import com.flagship.letter_workflow.config.WorkflowProperties;
import com.flagship.letter_workflow.retry.TransactionRetrier;
import com.flagship.letter_workflow.subscription.dto.CheckoutRequest;
import com.flagship.letter_workflow.subscription.dto.CheckoutResponse;
import com.flagship.letter_workflow.subscription.dto.CommissionSummaryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * REST controller for plan purchase and referral commissions.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class CheckoutController {

    private static final String USER_ID_HEADER = "X-User-Id";

    private final CheckoutService checkoutService;
    private final CommissionService commissionService;
    private final TransactionRetrier retrier;

    @GetMapping("/api/checkout/plans")
    public Map<String, WorkflowProperties.Plan> plans() {
        return checkoutService.plans();
    }

    /**
     * Opens a checkout. Answers 201 with the payment metadata for a paid plan,
     * or with the already active allowance when the coupon covers the full price.
     */
    @PostMapping("/api/checkout")
    public ResponseEntity<CheckoutResponse> openCheckout(
            @Valid @RequestBody CheckoutRequest request,
            @RequestHeader(USER_ID_HEADER) UUID userId) {

        log.info("Checkout requested: plan={}, coupon={}", request.getPlanType(), request.getCouponCode());
        CheckoutResult result = retrier.execute("openCheckout",
                () -> checkoutService.openCheckout(userId, request.getPlanType(), request.getCouponCode()));
        return ResponseEntity.status(HttpStatus.CREATED).body(CheckoutResponse.from(result));
    }

    @GetMapping("/api/commissions/me")
    public CommissionSummaryResponse myCommissions(@RequestHeader(USER_ID_HEADER) UUID employeeId) {
        return CommissionSummaryResponse.builder()
                .employeeId(employeeId)
                .totalAmount(commissionService.totalForEmployee(employeeId))
                .commissions(commissionService.listForEmployee(employeeId).stream()
                        .map(CommissionSummaryResponse.Item::from)
                        .toList())
                .build();
    }
}
