package com.skycaster.forecast.catalog;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Exchange rate from the base currency into this currency.
 */
@Value
@Builder(toBuilder = true)
public class CurrencyRate {

    String code;
    String symbol;
    String name;
    BigDecimal exchangeRate;
    @Singular
    Set<String> countryCodes;
    @Builder.Default
    boolean active = true;
}
