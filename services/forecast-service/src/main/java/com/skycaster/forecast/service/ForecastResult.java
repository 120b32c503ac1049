package com.skycaster.forecast.service;

import com.skycaster.forecast.domain.ForecastQuery;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.pricing.PricingResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ForecastResult {

    String requestId;
    ForecastQuery query;
    Map<String, Map<String, Object>> locationData;
    List<ProviderGroup> endpointsCalled;
    PricingResult pricing;
    long responseTimeMillis;
}
