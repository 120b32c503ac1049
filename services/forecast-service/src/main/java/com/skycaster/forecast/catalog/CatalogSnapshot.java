package com.skycaster.forecast.catalog;

import lombok.Value;

import java.time.Instant;

/**
 * Consistent view of variables and pricing taken once per query.
 */
@Value
public class CatalogSnapshot {

    long version;
    Instant takenAt;
    VariableCatalog variables;
    PricingCatalog pricing;
}
