package com.skycaster.forecast.pricing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Price of one forecast request. Amounts keep full precision; the
 * {@code display*} accessors round HALF_UP to two decimals.
 */
@Value
@Builder
public class PricingResult {

    BigDecimal subtotal;
    String currency;
    BigDecimal taxRate;
    boolean taxEnabled;
    BigDecimal taxAmount;
    BigDecimal finalAmount;
    boolean fallbackApplied;

    public static PricingResult zero(String currency) {
        return PricingResult.builder()
                .subtotal(BigDecimal.ZERO)
                .currency(currency)
                .taxRate(BigDecimal.ZERO)
                .taxEnabled(false)
                .taxAmount(BigDecimal.ZERO)
                .finalAmount(BigDecimal.ZERO)
                .build();
    }

    public String displaySubtotal() {
        return display(subtotal);
    }

    public String displayTaxAmount() {
        return display(taxAmount);
    }

    public String displayFinalAmount() {
        return display(finalAmount);
    }

    public String displayTaxApplied() {
        return taxEnabled ? "Yes" : "No";
    }

    /**
     * Tax rate as a percentage without trailing zeros, e.g. "18%" or "12.5%".
     */
    public String displayTaxRate() {
        return taxRate.stripTrailingZeros().toPlainString() + "%";
    }

    static String display(BigDecimal amount) {
        return amount.setScale(PricingEngine.DISPLAY_SCALE, RoundingMode.HALF_UP).toPlainString();
    }
}
