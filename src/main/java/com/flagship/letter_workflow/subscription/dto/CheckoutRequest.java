package com.flagship.letter_workflow.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class CheckoutRequest {

    @NotBlank(message = "Plan type is required")
    @JsonProperty("plan_type")
    String planType;

    @JsonProperty("coupon_code")
    String couponCode;
}
