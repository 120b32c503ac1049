package com.skycaster.forecast.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skycaster.forecast.domain.ProviderGroup;

import java.util.Set;

/**
 * Omega serves temperature, wind and humidity. Wind arrives under the
 * {@code wind_speed_*} names, with directions alongside.
 */
public class OmegaPayloadParser extends AbstractPayloadParser {

    private static final Set<String> FIELDS = Set.of(
            "ambient_temp", "relative_humidity",
            "wind_speed_10", "wind_speed_100",
            "direction_10", "direction_100");

    public OmegaPayloadParser(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ProviderGroup group() {
        return ProviderGroup.OMEGA;
    }

    @Override
    protected Set<String> knownFields() {
        return FIELDS;
    }
}
