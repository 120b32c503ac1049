package com.skycaster.forecast.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastMetadata {

    private String requestId;
    private String timestamp;
    private String timezone;
    private List<String> endpointsCalled;
    private List<String> variablesRequested;
    private int locationsCount;
    private String totalCost;
    private String currency;
    private String taxApplied;
    private String taxRate;
    private String taxAmount;
    private String finalAmount;
    private long responseTimeMs;
}
