package com.skycaster.forecast.catalog;

import com.skycaster.forecast.domain.WeatherVariable;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Copy-on-write catalog store. Writers serialize on this instance and publish a
 * fresh snapshot; readers never lock.
 */
@Slf4j
public class InMemoryCatalogStore implements CatalogStore {

    private final Clock clock;
    private final AtomicReference<CatalogSnapshot> current;

    public InMemoryCatalogStore(VariableCatalog variables, PricingCatalog pricing, Clock clock) {
        this.clock = clock;
        this.current = new AtomicReference<>(new CatalogSnapshot(1L, clock.instant(), variables, pricing));
        log.info("Catalog initialized with {} variables, {} pricing entries, {} currencies",
            variables.describe().size(), pricing.getVariablePrices().size(), pricing.getCurrencies().size());
    }

    @Override
    public CatalogSnapshot snapshot() {
        return current.get();
    }

    @Override
    public synchronized void upsertVariable(WeatherVariable variable) {
        CatalogSnapshot previous = current.get();
        Map<String, WeatherVariable> updated = new LinkedHashMap<>(previous.getVariables().asMap());
        updated.put(variable.getName(), variable);
        publish(previous, new VariableCatalog(updated.values()), previous.getPricing());
        log.info("Catalog variable {} upserted (group={}, active={})",
            variable.getName(), variable.getGroup(), variable.isActive());
    }

    @Override
    public synchronized void upsertPricing(VariablePricing pricing) {
        CatalogSnapshot previous = current.get();
        PricingCatalog updated = previous.getPricing().toBuilder()
            .variablePrice(pricing.getVariableName(), pricing)
            .build();
        publish(previous, previous.getVariables(), updated);
        log.info("Pricing for {} upserted (base={})", pricing.getVariableName(), pricing.getBasePrice());
    }

    @Override
    public synchronized void upsertCurrency(CurrencyRate currency) {
        CatalogSnapshot previous = current.get();
        CurrencyRate normalized = currency.toBuilder()
            .code(currency.getCode().toUpperCase(Locale.ROOT))
            .build();
        PricingCatalog updated = previous.getPricing().toBuilder()
            .currency(normalized.getCode(), normalized)
            .build();
        publish(previous, previous.getVariables(), updated);
        log.info("Currency {} upserted (rate={})", currency.getCode(), currency.getExchangeRate());
    }

    @Override
    public synchronized void updateDefaultTax(TaxSettings tax) {
        CatalogSnapshot previous = current.get();
        PricingCatalog updated = previous.getPricing().toBuilder()
            .defaultTax(tax)
            .build();
        publish(previous, previous.getVariables(), updated);
        log.info("Default tax updated (rate={}, enabled={})", tax.rate(), tax.enabled());
    }

    private void publish(CatalogSnapshot previous, VariableCatalog variables, PricingCatalog pricing) {
        current.set(new CatalogSnapshot(previous.getVersion() + 1, clock.instant(), variables, pricing));
    }
}
