package com.skycaster.forecast.catalog;

import com.skycaster.forecast.domain.WeatherVariable;

/**
 * Catalog and pricing store. Queries read immutable snapshots; the admin path
 * replaces the snapshot atomically so a query never sees a half-applied update.
 */
public interface CatalogStore {

    CatalogSnapshot snapshot();

    void upsertVariable(WeatherVariable variable);

    void upsertPricing(VariablePricing pricing);

    void upsertCurrency(CurrencyRate currency);

    void updateDefaultTax(TaxSettings tax);
}
