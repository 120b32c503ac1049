package com.skycaster.forecast.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.ProviderPayload;

import java.util.List;

/**
 * Turns a provider's raw JSON body into a typed payload.
 */
public interface ProviderPayloadParser {

    ProviderGroup group();

    /**
     * @throws ProviderResponseException when the body carries a provider error
     *         or has a shape that cannot be addressed by location
     */
    ProviderPayload parse(JsonNode body, List<String> requestedVariables);
}
