package com.skycaster.forecast.dto.response;

import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.pricing.PricingResult;
import com.skycaster.forecast.service.ForecastResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Unified forecast data keyed by "lat,lon", plus request and pricing metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastResponse {

    private Map<String, Map<String, Object>> locationData;
    private ForecastMetadata metadata;

    public static ForecastResponse from(ForecastResult result) {
        PricingResult pricing = result.getPricing();
        return ForecastResponse.builder()
                .locationData(result.getLocationData())
                .metadata(ForecastMetadata.builder()
                        .requestId(result.getRequestId())
                        .timestamp(result.getQuery().getRawTimestamp())
                        .timezone(result.getQuery().getTimezone().getId())
                        .endpointsCalled(result.getEndpointsCalled().stream().map(ProviderGroup::getWireName).toList())
                        .variablesRequested(result.getQuery().getVariables())
                        .locationsCount(result.getQuery().getLocationCount())
                        .totalCost(pricing.displaySubtotal())
                        .currency(pricing.getCurrency())
                        .taxApplied(pricing.displayTaxApplied())
                        .taxRate(pricing.displayTaxRate())
                        .taxAmount(pricing.displayTaxAmount())
                        .finalAmount(pricing.displayFinalAmount())
                        .responseTimeMs(result.getResponseTimeMillis())
                        .build())
                .build();
    }
}
