package com.skycaster.forecast.catalog;

import java.math.BigDecimal;

/**
 * Tax rate as a percentage, e.g. 18 for 18% GST.
 */
public record TaxSettings(BigDecimal rate, boolean enabled) {
}
