package com.skycaster.forecast.config;

import com.skycaster.forecast.catalog.CurrencyRate;
import com.skycaster.forecast.catalog.PricingCatalog;
import com.skycaster.forecast.catalog.TaxSettings;
import com.skycaster.forecast.catalog.VariableCatalog;
import com.skycaster.forecast.catalog.VariablePricing;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.SubscriptionTier;
import com.skycaster.forecast.domain.WeatherVariable;
import com.skycaster.forecast.exception.ProviderConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Seed data for the variable catalog, pricing table and currency table.
 */
@Data
@ConfigurationProperties(prefix = "skycaster.catalog")
public class CatalogProperties {

    private String baseCurrency = "INR";
    private BigDecimal defaultUnitPrice = BigDecimal.ONE;
    private Tax defaultTax = new Tax();
    private List<Variable> variables = new ArrayList<>();
    private List<Pricing> pricing = new ArrayList<>();
    private List<Currency> currencies = new ArrayList<>();

    public VariableCatalog toVariableCatalog() {
        List<WeatherVariable> seeded = new ArrayList<>();
        for (Variable variable : variables) {
            ProviderGroup group = ProviderGroup.fromWireName(variable.getGroup())
                .orElseThrow(() -> new ProviderConfigurationException(
                    "Unknown provider group '" + variable.getGroup() + "' for variable " + variable.getName()));
            seeded.add(WeatherVariable.builder()
                .name(variable.getName())
                .group(group)
                .unit(variable.getUnit())
                .dataType(variable.getDataType())
                .description(variable.getDescription())
                .active(variable.isActive())
                .build());
        }
        return new VariableCatalog(seeded);
    }

    public PricingCatalog toPricingCatalog(VariableCatalog variableCatalog) {
        PricingCatalog.PricingCatalogBuilder builder = PricingCatalog.builder()
            .baseCurrency(baseCurrency.toUpperCase(Locale.ROOT))
            .defaultUnitPrice(defaultUnitPrice)
            .defaultTax(new TaxSettings(defaultTax.getRate(), defaultTax.isEnabled()));

        for (Pricing entry : pricing) {
            VariablePricing.VariablePricingBuilder pricingBuilder = VariablePricing.builder()
                .variableName(entry.getVariable())
                .group(variableCatalog.find(entry.getVariable()).map(WeatherVariable::getGroup).orElse(null))
                .basePrice(entry.getBasePrice())
                .currency(entry.getCurrency() != null ? entry.getCurrency() : baseCurrency)
                .taxRate(entry.getTaxRate() != null ? entry.getTaxRate() : defaultTax.getRate())
                .taxEnabled(entry.getTaxEnabled() != null ? entry.getTaxEnabled() : defaultTax.isEnabled())
                .hsnSacCode(entry.getHsnSacCode())
                .active(entry.isActive());
            entry.getTierPrices().forEach((tier, price) -> pricingBuilder.tierPrice(
                SubscriptionTier.parse(tier).orElseThrow(() -> new ProviderConfigurationException(
                    "Unknown subscription tier '" + tier + "' in pricing for " + entry.getVariable())),
                price));
            builder.variablePrice(entry.getVariable(), pricingBuilder.build());
        }

        for (Currency currency : currencies) {
            String code = currency.getCode().toUpperCase(Locale.ROOT);
            CurrencyRate.CurrencyRateBuilder rate = CurrencyRate.builder()
                .code(code)
                .symbol(currency.getSymbol())
                .name(currency.getName())
                .exchangeRate(currency.getExchangeRate())
                .active(currency.isActive());
            currency.getCountryCodes().forEach(c -> rate.countryCode(c.toUpperCase(Locale.ROOT)));
            builder.currency(code, rate.build());
        }
        return builder.build();
    }

    @Data
    public static class Tax {
        private BigDecimal rate = new BigDecimal("18");
        private boolean enabled = true;
    }

    @Data
    public static class Variable {
        private String name;
        private String group;
        private String unit;
        private String dataType = "float";
        private String description;
        private boolean active = true;
    }

    @Data
    public static class Pricing {
        private String variable;
        private BigDecimal basePrice;
        private String currency;
        private BigDecimal taxRate;
        private Boolean taxEnabled;
        private String hsnSacCode = "998314";
        private Map<String, BigDecimal> tierPrices = new LinkedHashMap<>();
        private boolean active = true;
    }

    @Data
    public static class Currency {
        private String code;
        private String symbol;
        private String name;
        private BigDecimal exchangeRate = BigDecimal.ONE;
        private Set<String> countryCodes = new LinkedHashSet<>();
        private boolean active = true;
    }
}
