package com.flagship.letter_workflow.subscription;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Price of a plan after an optional percentage discount. Amounts are in
 * currency units with two decimals.
 */
@Value
public class PriceQuote {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    BigDecimal basePrice;
    BigDecimal discountPercent;
    BigDecimal discountAmount;
    BigDecimal finalPrice;

    public static PriceQuote of(BigDecimal basePrice, BigDecimal discountPercent) {
        BigDecimal base = basePrice.setScale(2, RoundingMode.HALF_UP);
        BigDecimal percent = discountPercent.setScale(2, RoundingMode.HALF_UP);
        BigDecimal discount = base.multiply(percent).divide(HUNDRED, 2, RoundingMode.HALF_UP);
        return new PriceQuote(base, percent, discount, base.subtract(discount));
    }

    /**
     * Rebuilds a quote from amounts reported back by the payment provider.
     */
    public static PriceQuote fromAmounts(BigDecimal basePrice, BigDecimal discountAmount, BigDecimal finalPrice) {
        BigDecimal base = basePrice.setScale(2, RoundingMode.HALF_UP);
        BigDecimal discount = discountAmount.setScale(2, RoundingMode.HALF_UP);
        BigDecimal percent = base.signum() == 0
                ? BigDecimal.ZERO.setScale(2)
                : discount.multiply(HUNDRED).divide(base, 2, RoundingMode.HALF_UP);
        return new PriceQuote(base, percent, discount, finalPrice.setScale(2, RoundingMode.HALF_UP));
    }

    public static PriceQuote undiscounted(BigDecimal basePrice) {
        return of(basePrice, BigDecimal.ZERO);
    }

    public boolean isFree() {
        return finalPrice.signum() == 0;
    }
}
