package com.skycaster.forecast.catalog;

import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.SubscriptionTier;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Pricing entry for one variable. Prices are per variable per location in the base currency.
 */
@Value
@Builder(toBuilder = true)
public class VariablePricing {

    String variableName;
    ProviderGroup group;
    BigDecimal basePrice;
    String currency;
    BigDecimal taxRate;
    boolean taxEnabled;
    String hsnSacCode;
    @Singular
    Map<SubscriptionTier, BigDecimal> tierPrices;
    @Builder.Default
    boolean active = true;

    public Optional<BigDecimal> tierPrice(SubscriptionTier tier) {
        if (tier == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tierPrices.get(tier));
    }
}
