package com.skycaster.forecast.dto.response;

import com.skycaster.forecast.catalog.VariablePricing;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingInfo {

    private String variableName;
    private String endpointType;
    private BigDecimal basePrice;
    private String currency;
    private BigDecimal taxRate;
    private boolean taxEnabled;
    private String hsnSacCode;
    private Map<String, BigDecimal> tierPrices;

    public static PricingInfo from(VariablePricing pricing) {
        Map<String, BigDecimal> tiers = new LinkedHashMap<>();
        pricing.getTierPrices().forEach((tier, price) -> tiers.put(tier.name().toLowerCase(Locale.ROOT), price));
        return PricingInfo.builder()
                .variableName(pricing.getVariableName())
                .endpointType(pricing.getGroup() != null ? pricing.getGroup().getWireName() : null)
                .basePrice(pricing.getBasePrice())
                .currency(pricing.getCurrency())
                .taxRate(pricing.getTaxRate())
                .taxEnabled(pricing.isTaxEnabled())
                .hsnSacCode(pricing.getHsnSacCode())
                .tierPrices(tiers)
                .build();
    }
}
