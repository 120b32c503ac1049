package com.skycaster.forecast.support;

import com.skycaster.forecast.catalog.CatalogSnapshot;
import com.skycaster.forecast.catalog.CurrencyRate;
import com.skycaster.forecast.catalog.PricingCatalog;
import com.skycaster.forecast.catalog.TaxSettings;
import com.skycaster.forecast.catalog.VariableCatalog;
import com.skycaster.forecast.catalog.VariablePricing;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.WeatherVariable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog fixtures mirroring the seeded production catalog.
 */
public final class TestCatalogs {

    public static final Map<String, ProviderGroup> SEED = seed();

    private TestCatalogs() {
    }

    public static VariableCatalog variables() {
        List<WeatherVariable> variables = new ArrayList<>();
        SEED.forEach((name, group) -> variables.add(WeatherVariable.builder()
                .name(name)
                .group(group)
                .unit("-")
                .description(name)
                .build()));
        return new VariableCatalog(variables);
    }

    /**
     * Every seeded variable priced at 1.00 INR with 18% tax, plus USD/EUR rates.
     */
    public static PricingCatalog pricing() {
        PricingCatalog.PricingCatalogBuilder builder = basePricing();
        SEED.forEach((name, group) -> builder.variablePrice(name, VariablePricing.builder()
                .variableName(name)
                .group(group)
                .basePrice(new BigDecimal("1.00"))
                .currency("INR")
                .taxRate(new BigDecimal("18"))
                .taxEnabled(true)
                .hsnSacCode("998314")
                .build()));
        return builder.build();
    }

    public static PricingCatalog.PricingCatalogBuilder basePricing() {
        return PricingCatalog.builder()
                .baseCurrency("INR")
                .defaultUnitPrice(new BigDecimal("1.00"))
                .defaultTax(new TaxSettings(new BigDecimal("18"), true))
                .currency("INR", CurrencyRate.builder()
                        .code("INR").symbol("₹").name("Indian Rupee")
                        .exchangeRate(BigDecimal.ONE).countryCode("IN").build())
                .currency("USD", CurrencyRate.builder()
                        .code("USD").symbol("$").name("US Dollar")
                        .exchangeRate(new BigDecimal("0.012")).countryCode("US").build())
                .currency("EUR", CurrencyRate.builder()
                        .code("EUR").symbol("€").name("Euro")
                        .exchangeRate(new BigDecimal("0.011")).countryCode("DE").countryCode("FR").build());
    }

    public static CatalogSnapshot snapshot() {
        return new CatalogSnapshot(1L, Instant.parse("2030-01-01T00:00:00Z"), variables(), pricing());
    }

    private static Map<String, ProviderGroup> seed() {
        Map<String, ProviderGroup> seed = new LinkedHashMap<>();
        seed.put("ambient_temp(K)", ProviderGroup.OMEGA);
        seed.put("wind_10m", ProviderGroup.OMEGA);
        seed.put("wind_100m", ProviderGroup.OMEGA);
        seed.put("relative_humidity(%)", ProviderGroup.OMEGA);
        seed.put("temperature(K)", ProviderGroup.NOVA);
        seed.put("surface_pressure(Pa)", ProviderGroup.NOVA);
        seed.put("cumulus_precipitation(mm)", ProviderGroup.NOVA);
        seed.put("ghi(W/m2)", ProviderGroup.NOVA);
        seed.put("ghi_farms(W/m2)", ProviderGroup.NOVA);
        seed.put("clear_sky_ghi_farms(W/m2)", ProviderGroup.NOVA);
        seed.put("albedo", ProviderGroup.NOVA);
        seed.put("ct", ProviderGroup.ARC);
        seed.put("pc", ProviderGroup.ARC);
        seed.put("pcph", ProviderGroup.ARC);
        return seed;
    }
}
