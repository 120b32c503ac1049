package com.skycaster.forecast.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.exception.ProviderConfigurationException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Parser lookup by provider group.
 */
public class ProviderPayloadParsers {

    private final Map<ProviderGroup, ProviderPayloadParser> parsers = new EnumMap<>(ProviderGroup.class);

    public ProviderPayloadParsers(List<ProviderPayloadParser> parsers) {
        for (ProviderPayloadParser parser : parsers) {
            if (this.parsers.putIfAbsent(parser.group(), parser) != null) {
                throw new ProviderConfigurationException("Duplicate payload parser for provider group " + parser.group());
            }
        }
    }

    public static ProviderPayloadParsers standard(ObjectMapper objectMapper) {
        return new ProviderPayloadParsers(List.of(
                new OmegaPayloadParser(objectMapper),
                new NovaPayloadParser(objectMapper),
                new ArcPayloadParser(objectMapper)));
    }

    public ProviderPayloadParser forGroup(ProviderGroup group) {
        ProviderPayloadParser parser = parsers.get(group);
        if (parser == null) {
            throw new ProviderConfigurationException("No payload parser registered for provider group " + group);
        }
        return parser;
    }
}
