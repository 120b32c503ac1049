package com.skycaster.forecast.exception;

import com.skycaster.common.exception.BusinessException;
import com.skycaster.common.exception.ErrorCode;

import java.util.Map;

/**
 * Thrown when every provider referenced by a query failed. No partial data is returned.
 */
public class AllProvidersFailedException extends BusinessException {

    private final Map<String, String> providerErrors;

    public AllProvidersFailedException(Map<String, String> providerErrors) {
        super(ErrorCode.FORECAST_ALL_PROVIDERS_FAILED,
            "All forecast providers failed: " + providerErrors.keySet(),
            Map.of("providerErrors", Map.copyOf(providerErrors)));
        this.providerErrors = Map.copyOf(providerErrors);
    }

    public Map<String, String> getProviderErrors() {
        return providerErrors;
    }
}
