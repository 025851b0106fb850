package com.flagship.letter_workflow.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.letter_workflow.allowance.AllowanceStatus;
import com.flagship.letter_workflow.subscription.CheckoutResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class CheckoutResponse {

    @JsonProperty("allowance_id")
    UUID allowanceId;

    @JsonProperty("status")
    AllowanceStatus status;

    @JsonProperty("plan_type")
    String planType;

    @JsonProperty("letters")
    int letters;

    @JsonProperty("base_price")
    BigDecimal basePrice;

    @JsonProperty("discount_percent")
    BigDecimal discountPercent;

    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    @JsonProperty("final_price")
    BigDecimal finalPrice;

    @JsonProperty("activated")
    boolean activated;

    @JsonProperty("payment_metadata")
    Map<String, String> paymentMetadata;

    public static CheckoutResponse from(CheckoutResult result) {
        return CheckoutResponse.builder()
            .allowanceId(result.getAllowance().getId())
            .status(result.getAllowance().getStatus())
            .planType(result.getAllowance().getPlanType())
            .letters(result.getAllowance().getGrantedCredits())
            .basePrice(result.getQuote().getBasePrice())
            .discountPercent(result.getQuote().getDiscountPercent())
            .discountAmount(result.getQuote().getDiscountAmount())
            .finalPrice(result.getQuote().getFinalPrice())
            .activated(result.isActivated())
            .paymentMetadata(result.getPaymentMetadata())
            .build();
    }
}
