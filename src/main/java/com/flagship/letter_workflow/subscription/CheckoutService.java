package com.flagship.letter_workflow.subscription;

import com.flagship.letter_workflow.allowance.Allowance;
import com.flagship.letter_workflow.allowance.AllowanceService;
import com.flagship.letter_workflow.allowance.AllowanceTerms;
import com.flagship.letter_workflow.config.WorkflowProperties;
import com.flagship.letter_workflow.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Prices a plan purchase and opens the checkout.
 *
 * A paid checkout leaves a PENDING allowance and returns the metadata the
 * payment provider must echo back in its completion notification. A
 * checkout discounted to zero needs no payment and is activated right away.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckoutService {

    public static final String META_USER_ID = "user_id";
    public static final String META_PLAN_TYPE = "plan_type";
    public static final String META_LETTERS = "letters";
    public static final String META_BASE_PRICE = "base_price";
    public static final String META_DISCOUNT = "discount";
    public static final String META_FINAL_PRICE = "final_price";
    public static final String META_COUPON_CODE = "coupon_code";
    public static final String META_EMPLOYEE_ID = "employee_id";

    private final AllowanceService allowanceService;
    private final SubscriptionActivationService activationService;
    private final EmployeeCouponRepository couponRepository;
    private final WorkflowProperties properties;

    @Transactional
    public CheckoutResult openCheckout(UUID userId, String planType, String couponCode) {
        WorkflowProperties.Plan plan = properties.getPlans().get(planType);
        if (plan == null) {
            throw new ValidationException("Invalid plan type: " + planType);
        }

        EmployeeCouponEntity coupon = null;
        if (couponCode != null && !couponCode.isBlank()) {
            coupon = couponRepository.findByCodeIgnoreCaseAndActiveTrue(couponCode.trim())
                    .orElseThrow(() -> new ValidationException("Invalid coupon code: " + couponCode));
        }

        PriceQuote quote = coupon != null
                ? PriceQuote.of(plan.getPrice(), coupon.getDiscountPercent())
                : PriceQuote.undiscounted(plan.getPrice());
        String code = coupon != null ? coupon.getCode() : null;
        UUID employeeId = coupon != null ? coupon.getEmployeeId() : null;

        if (quote.isFree()) {
            ActivationResult activation = activationService.activate(ActivationRequest.builder()
                    .userId(userId)
                    .planType(planType)
                    .letters(plan.getLetters())
                    .basePrice(quote.getBasePrice())
                    .discountAmount(quote.getDiscountAmount())
                    .finalPrice(quote.getFinalPrice())
                    .couponCode(code)
                    .employeeId(employeeId)
                    .build());
            log.info("Checkout for plan {} fully discounted, activated allowance {}",
                    planType, activation.getAllowance().getId());
            return new CheckoutResult(activation.getAllowance(), quote, true, Map.of());
        }

        Allowance pending = allowanceService.openCheckout(userId, planType, plan.getLetters(),
                new AllowanceTerms(quote.getBasePrice(), quote.getDiscountAmount(), quote.getFinalPrice(),
                        code, employeeId));
        return new CheckoutResult(pending, quote, false,
                paymentMetadata(userId, planType, plan.getLetters(), quote, code, employeeId));
    }

    public Map<String, WorkflowProperties.Plan> plans() {
        return properties.getPlans();
    }

    private Map<String, String> paymentMetadata(UUID userId, String planType, int letters, PriceQuote quote,
                                                String couponCode, UUID employeeId) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(META_USER_ID, userId.toString());
        metadata.put(META_PLAN_TYPE, planType);
        metadata.put(META_LETTERS, Integer.toString(letters));
        metadata.put(META_BASE_PRICE, plain(quote.getBasePrice()));
        metadata.put(META_DISCOUNT, plain(quote.getDiscountAmount()));
        metadata.put(META_FINAL_PRICE, plain(quote.getFinalPrice()));
        if (couponCode != null) {
            metadata.put(META_COUPON_CODE, couponCode);
        }
        if (employeeId != null) {
            metadata.put(META_EMPLOYEE_ID, employeeId.toString());
        }
        return metadata;
    }

    private static String plain(BigDecimal amount) {
        return amount.toPlainString();
    }
}
