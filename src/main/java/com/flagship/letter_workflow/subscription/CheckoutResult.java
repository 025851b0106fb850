package com.flagship.letter_workflow.subscription;

import com.flagship.letter_workflow.allowance.Allowance;
import lombok.Value;

import java.util.Map;

/**
 * An opened checkout. A fully discounted checkout is activated on the spot
 * and carries no payment metadata.
 */
@Value
public class CheckoutResult {
    Allowance allowance;
    PriceQuote quote;
    boolean activated;
    Map<String, String> paymentMetadata;
}
