package com.skycaster.forecast.config;

import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.gateway.ProviderRestTemplates;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP clients for the upstream forecast providers. All groups share one
 * connection pool; each group gets its own response timeout.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RestTemplateConfig {

    private final MeterRegistry meterRegistry;

    @Value("${http.client.connection-timeout:10000}")
    private int connectionTimeout;

    @Value("${http.client.max-connections:100}")
    private int maxConnections;

    @Value("${http.client.max-connections-per-route:20}")
    private int maxConnectionsPerRoute;

    @Bean(destroyMethod = "close")
    public PoolingHttpClientConnectionManager providerConnectionManager() {
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(maxConnections);
        connectionManager.setDefaultMaxPerRoute(maxConnectionsPerRoute);
        connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectionTimeout))
                .build());
        return connectionManager;
    }

    @Bean
    public ProviderRestTemplates providerRestTemplates(RestTemplateBuilder builder,
                                                       PoolingHttpClientConnectionManager connectionManager,
                                                       ForecastProperties properties) {
        Map<ProviderGroup, RestTemplate> templates = new EnumMap<>(ProviderGroup.class);

        for (ProviderGroup group : ProviderGroup.values()) {
            int timeoutSeconds = properties.providerFor(group)
                    .map(ForecastProperties.Provider::getTimeoutSeconds)
                    .orElse(30);

            RequestConfig requestConfig = RequestConfig.custom()
                    .setConnectionRequestTimeout(Timeout.ofMilliseconds(connectionTimeout))
                    .setResponseTimeout(Timeout.ofSeconds(timeoutSeconds))
                    .build();

            HttpClient httpClient = HttpClients.custom()
                    .setConnectionManager(connectionManager)
                    .setConnectionManagerShared(true)
                    .setDefaultRequestConfig(requestConfig)
                    .build();

            HttpComponentsClientHttpRequestFactory requestFactory = new HttpComponentsClientHttpRequestFactory(httpClient);

            RestTemplate restTemplate = builder
                    .requestFactory(() -> requestFactory)
                    .additionalInterceptors(loggingInterceptor(group))
                    .additionalInterceptors(metricsInterceptor(group))
                    .additionalInterceptors(requestIdInterceptor())
                    .build();

            templates.put(group, restTemplate);
            log.info("Provider {} client configured with connection timeout: {}ms, response timeout: {}s",
                    group, connectionTimeout, timeoutSeconds);
        }

        return new ProviderRestTemplates(templates);
    }

    private ClientHttpRequestInterceptor loggingInterceptor(ProviderGroup group) {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();

            log.debug("Provider {} request: {} {}", group, request.getMethod(), request.getURI());

            ClientHttpResponse response = execution.execute(request, body);

            log.debug("Provider {} response: {} - Status: {} - Duration: {}ms",
                    group,
                    request.getURI(),
                    response.getStatusCode(),
                    System.currentTimeMillis() - startTime);

            return response;
        };
    }

    private ClientHttpRequestInterceptor metricsInterceptor(ProviderGroup group) {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();

            try {
                ClientHttpResponse response = execution.execute(request, body);

                meterRegistry.counter("skycaster.provider.http.requests",
                        "group", group.getWireName(),
                        "status", String.valueOf(response.getStatusCode().value())
                ).increment();
                meterRegistry.timer("skycaster.provider.http.duration", "group", group.getWireName())
                        .record(Duration.ofMillis(System.currentTimeMillis() - startTime));

                return response;

            } catch (Exception e) {
                meterRegistry.counter("skycaster.provider.http.errors",
                        "group", group.getWireName(),
                        "exception", e.getClass().getSimpleName()
                ).increment();
                meterRegistry.timer("skycaster.provider.http.duration", "group", group.getWireName())
                        .record(Duration.ofMillis(System.currentTimeMillis() - startTime));

                throw e;
            }
        };
    }

    /**
     * Forwards the forecast request id so provider logs can be correlated.
     */
    private ClientHttpRequestInterceptor requestIdInterceptor() {
        return (request, body, execution) -> {
            if (!request.getHeaders().containsKey("X-Request-ID")) {
                String requestId = MDC.get("requestId");
                request.getHeaders().add("X-Request-ID", requestId != null ? requestId : UUID.randomUUID().toString());
            }
            request.getHeaders().add("X-Service-Name", "forecast-service");

            return execution.execute(request, body);
        };
    }
}
