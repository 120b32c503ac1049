package com.skycaster.forecast.gateway;

import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.exception.ProviderConfigurationException;
import org.springframework.web.client.RestTemplate;

import java.util.EnumMap;
import java.util.Map;

/**
 * One configured {@link RestTemplate} per provider group.
 */
public class ProviderRestTemplates {

    private final Map<ProviderGroup, RestTemplate> templates;

    public ProviderRestTemplates(Map<ProviderGroup, RestTemplate> templates) {
        this.templates = new EnumMap<>(templates);
    }

    public static ProviderRestTemplates sharing(RestTemplate restTemplate) {
        Map<ProviderGroup, RestTemplate> templates = new EnumMap<>(ProviderGroup.class);
        for (ProviderGroup group : ProviderGroup.values()) {
            templates.put(group, restTemplate);
        }
        return new ProviderRestTemplates(templates);
    }

    public RestTemplate forGroup(ProviderGroup group) {
        RestTemplate template = templates.get(group);
        if (template == null) {
            throw new ProviderConfigurationException("No HTTP client configured for provider group " + group);
        }
        return template;
    }
}
