package com.skycaster.forecast.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skycaster.forecast.domain.ProviderGroup;

import java.util.Set;

public class ArcPayloadParser extends AbstractPayloadParser {

    private static final Set<String> FIELDS = Set.of("ct", "pc", "pcph");

    public ArcPayloadParser(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ProviderGroup group() {
        return ProviderGroup.ARC;
    }

    @Override
    protected Set<String> knownFields() {
        return FIELDS;
    }
}
