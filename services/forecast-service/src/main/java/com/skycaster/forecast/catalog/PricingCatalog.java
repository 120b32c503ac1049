package com.skycaster.forecast.catalog;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable pricing configuration: per-variable prices, currency table and defaults.
 */
@Getter
@Builder(toBuilder = true)
public class PricingCatalog {

    private final String baseCurrency;
    private final BigDecimal defaultUnitPrice;
    private final TaxSettings defaultTax;
    @Singular
    private final Map<String, VariablePricing> variablePrices;
    @Singular
    private final Map<String, CurrencyRate> currencies;

    /**
     * Active pricing entry for a variable, if any.
     */
    public Optional<VariablePricing> pricingFor(String variableName) {
        VariablePricing pricing = variablePrices.get(variableName);
        return pricing != null && pricing.isActive() ? Optional.of(pricing) : Optional.empty();
    }

    /**
     * Active currency by ISO code (case-insensitive).
     */
    public Optional<CurrencyRate> currency(String code) {
        if (code == null) {
            return Optional.empty();
        }
        CurrencyRate rate = currencies.get(code.toUpperCase(Locale.ROOT));
        return rate != null && rate.isActive() ? Optional.of(rate) : Optional.empty();
    }

    /**
     * Active currency mapped to the given ISO country code.
     */
    public Optional<CurrencyRate> currencyForCountry(String countryCode) {
        if (countryCode == null || countryCode.isBlank()) {
            return Optional.empty();
        }
        String normalized = countryCode.trim().toUpperCase(Locale.ROOT);
        return currencies.values().stream()
            .filter(CurrencyRate::isActive)
            .filter(rate -> rate.getCountryCodes().contains(normalized))
            .findFirst();
    }

    public List<VariablePricing> activePricing() {
        return variablePrices.values().stream()
            .filter(VariablePricing::isActive)
            .toList();
    }

    public Collection<CurrencyRate> allCurrencies() {
        return currencies.values();
    }
}
