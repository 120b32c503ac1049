package com.skycaster.forecast.dto.response;

import com.skycaster.forecast.pricing.PricingOverview;
import com.skycaster.forecast.pricing.PricingResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingOverviewResponse {

    private String baseCurrency;
    private BigDecimal defaultUnitPrice;
    private List<PricingInfo> pricing;
    private List<CurrencyInfo> currencies;
    private CalculationExample calculationExample;

    public static PricingOverviewResponse from(PricingOverview overview) {
        PricingOverview.Example example = overview.example();
        PricingResult result = example.result();
        return PricingOverviewResponse.builder()
                .baseCurrency(overview.baseCurrency())
                .defaultUnitPrice(overview.defaultUnitPrice())
                .pricing(overview.entries().stream().map(PricingInfo::from).toList())
                .currencies(overview.currencies().stream()
                        .map(rate -> new CurrencyInfo(rate.getCode(), rate.getSymbol(), rate.getName(), rate.getExchangeRate()))
                        .toList())
                .calculationExample(CalculationExample.builder()
                        .variables(example.variables())
                        .locations(example.locations())
                        .costPerVariablePerLocation(example.unitPrice())
                        .totalCost(result.displaySubtotal())
                        .taxRate(result.displayTaxRate())
                        .taxAmount(result.displayTaxAmount())
                        .finalAmount(result.displayFinalAmount())
                        .currency(result.getCurrency())
                        .build())
                .build();
    }

    public record CurrencyInfo(String code, String symbol, String name, BigDecimal exchangeRate) {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CalculationExample {
        private int variables;
        private int locations;
        private BigDecimal costPerVariablePerLocation;
        private String totalCost;
        private String taxRate;
        private String taxAmount;
        private String finalAmount;
        private String currency;
    }
}
