package com.skycaster.forecast.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skycaster.forecast.domain.ProviderGroup;

import java.util.Set;

public class NovaPayloadParser extends AbstractPayloadParser {

    private static final Set<String> FIELDS = Set.of(
            "temperature", "surface_pressure", "cumulus_precipitation",
            "ghi", "ghi_farms", "clear_sky_ghi_farms", "albedo");

    public NovaPayloadParser(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ProviderGroup group() {
        return ProviderGroup.NOVA;
    }

    @Override
    protected Set<String> knownFields() {
        return FIELDS;
    }
}
