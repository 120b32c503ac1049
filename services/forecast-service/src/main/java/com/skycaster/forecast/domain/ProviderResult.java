package com.skycaster.forecast.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one provider call. Remote failures are data, not exceptions.
 */
@Value
@Builder
public class ProviderResult {

    ProviderGroup group;
    boolean success;
    ProviderPayload payload;
    String error;
    List<String> variables;
    long latencyMillis;
    boolean timedOut;

    public static ProviderResult success(ProviderSubRequest request, ProviderPayload payload, long latencyMillis) {
        return ProviderResult.builder()
            .group(request.getGroup())
            .success(true)
            .payload(payload)
            .variables(request.getVariables())
            .latencyMillis(latencyMillis)
            .build();
    }

    public static ProviderResult failure(ProviderSubRequest request, String error, long latencyMillis, boolean timedOut) {
        return ProviderResult.builder()
            .group(request.getGroup())
            .success(false)
            .error(error)
            .variables(request.getVariables())
            .latencyMillis(latencyMillis)
            .timedOut(timedOut)
            .build();
    }
}
