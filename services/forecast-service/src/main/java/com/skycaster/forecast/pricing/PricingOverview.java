package com.skycaster.forecast.pricing;

import com.skycaster.forecast.catalog.CurrencyRate;
import com.skycaster.forecast.catalog.TaxSettings;
import com.skycaster.forecast.catalog.VariablePricing;

import java.math.BigDecimal;
import java.util.List;

/**
 * Published price list with a worked example priced by the engine itself.
 */
public record PricingOverview(String baseCurrency,
                              BigDecimal defaultUnitPrice,
                              TaxSettings defaultTax,
                              List<VariablePricing> entries,
                              List<CurrencyRate> currencies,
                              Example example) {

    public record Example(int variables, int locations, BigDecimal unitPrice, PricingResult result) {
    }
}
