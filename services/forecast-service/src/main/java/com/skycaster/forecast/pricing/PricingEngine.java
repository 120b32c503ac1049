package com.skycaster.forecast.pricing;

import com.skycaster.forecast.catalog.CurrencyRate;
import com.skycaster.forecast.catalog.PricingCatalog;
import com.skycaster.forecast.catalog.TaxSettings;
import com.skycaster.forecast.catalog.VariablePricing;
import com.skycaster.forecast.domain.CallerContext;
import com.skycaster.forecast.domain.SubscriptionTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Layered request pricing.
 * <ul>
 *   <li>Unit price per variable: the caller's tier price if configured, else the
 *       variable's base price, else the catalog default.</li>
 *   <li>Subtotal: sum of unit prices times the number of locations.</li>
 *   <li>Currency: the caller's preference, else the currency mapped to the caller's
 *       country, else the base currency. Unknown currencies stay in base.</li>
 *   <li>Tax: settings of the first requested variable with pricing, else the catalog default.</li>
 * </ul>
 */
@Slf4j
@Component
public class PricingEngine {

    static final int DISPLAY_SCALE = 2;

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final BigDecimal FALLBACK_UNIT_PRICE = BigDecimal.ONE;
    private static final String FALLBACK_CURRENCY = "INR";
    private static final BigDecimal FALLBACK_TAX_RATE = new BigDecimal("18");

    /**
     * Never throws: an unexpected failure yields the all-default price.
     */
    public PricingResult price(List<String> variables, int locationCount, CallerContext caller, PricingCatalog catalog) {
        try {
            return calculate(variables, locationCount, caller != null ? caller : CallerContext.anonymous(), catalog);
        } catch (RuntimeException e) {
            log.warn("Pricing failed for {} variables x {} locations, applying default pricing",
                    variables.size(), locationCount, e);
            return fallback(variables.size(), locationCount);
        }
    }

    public PricingOverview overview(PricingCatalog catalog) {
        int exampleVariables = 2;
        int exampleLocations = 2;
        BigDecimal subtotal = catalog.getDefaultUnitPrice()
                .multiply(BigDecimal.valueOf((long) exampleVariables * exampleLocations));
        PricingResult example = applyTax(subtotal, catalog.getBaseCurrency(), catalog.getDefaultTax(), false);

        return new PricingOverview(
                catalog.getBaseCurrency(),
                catalog.getDefaultUnitPrice(),
                catalog.getDefaultTax(),
                catalog.activePricing(),
                catalog.allCurrencies().stream().filter(CurrencyRate::isActive).toList(),
                new PricingOverview.Example(exampleVariables, exampleLocations, catalog.getDefaultUnitPrice(), example));
    }

    private PricingResult calculate(List<String> variables, int locationCount, CallerContext caller, PricingCatalog catalog) {
        SubscriptionTier tier = caller.getSubscriptionTier();
        BigDecimal locations = BigDecimal.valueOf(locationCount);

        BigDecimal subtotal = BigDecimal.ZERO;
        for (String variable : variables) {
            subtotal = subtotal.add(unitPrice(variable, tier, catalog).multiply(locations));
        }

        String currency = catalog.getBaseCurrency();
        Optional<CurrencyRate> target = targetCurrency(caller, catalog);
        if (target.isPresent() && !target.get().getCode().equals(catalog.getBaseCurrency())) {
            subtotal = subtotal.multiply(target.get().getExchangeRate());
            currency = target.get().getCode();
        }

        TaxSettings tax = variables.stream()
                .map(catalog::pricingFor)
                .flatMap(Optional::stream)
                .findFirst()
                .map(pricing -> new TaxSettings(pricing.getTaxRate(), pricing.isTaxEnabled()))
                .orElse(catalog.getDefaultTax());

        PricingResult result = applyTax(subtotal, currency, tax, false);
        log.debug("Priced {} variables x {} locations for tier {}: {} {}",
                variables.size(), locationCount, tier, result.displayFinalAmount(), currency);
        return result;
    }

    private BigDecimal unitPrice(String variable, SubscriptionTier tier, PricingCatalog catalog) {
        Optional<VariablePricing> pricing = catalog.pricingFor(variable);
        if (pricing.isEmpty()) {
            return catalog.getDefaultUnitPrice();
        }
        return pricing.get().tierPrice(tier).orElse(pricing.get().getBasePrice());
    }

    private Optional<CurrencyRate> targetCurrency(CallerContext caller, PricingCatalog catalog) {
        String preferred = caller.getPreferredCurrency();
        if (preferred != null && !preferred.isBlank()) {
            Optional<CurrencyRate> rate = catalog.currency(preferred.trim());
            if (rate.isEmpty()) {
                log.warn("Unknown or inactive currency {}, pricing in {}", preferred, catalog.getBaseCurrency());
            }
            return rate;
        }
        return catalog.currencyForCountry(caller.getCountryCode());
    }

    private PricingResult applyTax(BigDecimal subtotal, String currency, TaxSettings tax, boolean fallback) {
        BigDecimal taxAmount = tax.enabled()
                ? subtotal.multiply(tax.rate()).divide(HUNDRED)
                : BigDecimal.ZERO;

        return PricingResult.builder()
                .subtotal(subtotal)
                .currency(currency)
                .taxRate(tax.rate())
                .taxEnabled(tax.enabled())
                .taxAmount(taxAmount)
                .finalAmount(subtotal.add(taxAmount))
                .fallbackApplied(fallback)
                .build();
    }

    private PricingResult fallback(int variableCount, int locationCount) {
        BigDecimal subtotal = FALLBACK_UNIT_PRICE.multiply(BigDecimal.valueOf((long) variableCount * locationCount));
        return applyTax(subtotal, FALLBACK_CURRENCY, new TaxSettings(FALLBACK_TAX_RATE, true), true);
    }
}
