package com.skycaster.forecast.config;

import com.skycaster.forecast.domain.ProviderGroup;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Forecast engine settings: provider endpoints, default timezone and mock mode.
 */
@Data
@ConfigurationProperties(prefix = "skycaster.forecast")
public class ForecastProperties {

    /**
     * Serve deterministic mock data instead of calling providers.
     */
    private boolean useMock = false;

    private String defaultTimezone = "Asia/Kolkata";

    /**
     * Endpoints keyed by provider group wire name (omega, nova, arc).
     */
    private Map<String, Provider> providers = new LinkedHashMap<>();

    private Mock mock = new Mock();

    public Optional<Provider> providerFor(ProviderGroup group) {
        Provider provider = providers.get(group.getWireName());
        if (provider == null || provider.getUrl() == null || provider.getUrl().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(provider);
    }

    @Data
    public static class Provider {
        private String url;
        private int timeoutSeconds = 30;
    }

    @Data
    public static class Mock {
        /**
         * Simulated latency per group wire name.
         */
        private Map<String, Long> latencyMillis = new LinkedHashMap<>();

        /**
         * Groups that always fail, for exercising partial failure.
         */
        private Set<String> failingGroups = new LinkedHashSet<>();
    }
}
