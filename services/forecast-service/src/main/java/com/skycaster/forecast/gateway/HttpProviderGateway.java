package com.skycaster.forecast.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skycaster.forecast.config.ForecastProperties;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.ProviderPayload;
import com.skycaster.forecast.domain.ProviderResult;
import com.skycaster.forecast.domain.ProviderSubRequest;
import com.skycaster.forecast.exception.ProviderConfigurationException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.util.List;

/**
 * Calls the Skycaster provider endpoints over HTTP.
 */
@Slf4j
public class HttpProviderGateway implements ProviderGateway {

    private final ForecastProperties properties;
    private final ProviderRestTemplates restTemplates;
    private final ProviderPayloadParsers parsers;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final ObjectMapper objectMapper;

    public HttpProviderGateway(ForecastProperties properties,
                               ProviderRestTemplates restTemplates,
                               ProviderPayloadParsers parsers,
                               CircuitBreakerRegistry circuitBreakerRegistry,
                               ObjectMapper objectMapper) {
        this.properties = properties;
        this.restTemplates = restTemplates;
        this.parsers = parsers;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean supports(ProviderGroup group) {
        return properties.providerFor(group).isPresent();
    }

    @Override
    public ProviderResult call(ProviderSubRequest request) {
        ProviderGroup group = request.getGroup();
        String url = properties.providerFor(group)
                .map(ForecastProperties.Provider::getUrl)
                .orElseThrow(() -> new ProviderConfigurationException(
                        "No endpoint configured for provider group " + group));

        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker("provider-" + group.getWireName());
        long startTime = System.currentTimeMillis();

        log.info("Calling provider {} for {} locations, variables {}",
                group, request.getCoordinates().size(), request.getVariables());

        try {
            ProviderPayload payload = circuitBreaker.executeSupplier(() -> fetch(url, request));
            long latency = System.currentTimeMillis() - startTime;
            log.info("Provider {} answered with {} records in {}ms", group, payload.size(), latency);
            return ProviderResult.success(request, payload, latency);

        } catch (CallNotPermittedException e) {
            log.warn("Provider {} short-circuited: circuit breaker {} is {}",
                    group, circuitBreaker.getName(), circuitBreaker.getState());
            return ProviderResult.failure(request, "Circuit breaker open for provider " + group,
                    System.currentTimeMillis() - startTime, false);

        } catch (HttpStatusCodeException e) {
            String error = describeHttpError(e);
            log.warn("Provider {} returned {}: {}", group, e.getStatusCode().value(), error);
            return ProviderResult.failure(request, error, System.currentTimeMillis() - startTime, false);

        } catch (ResourceAccessException e) {
            boolean timedOut = e.getCause() instanceof SocketTimeoutException;
            log.warn("Provider {} {}: {}", group, timedOut ? "timed out" : "unreachable", e.getMessage());
            return ProviderResult.failure(request,
                    timedOut ? "Request timeout" : "Connection error: " + e.getMessage(),
                    System.currentTimeMillis() - startTime, timedOut);

        } catch (ProviderResponseException e) {
            log.warn("Provider {} response rejected: {}", group, e.getMessage());
            return ProviderResult.failure(request, e.getMessage(), System.currentTimeMillis() - startTime, false);

        } catch (RestClientException e) {
            log.warn("Provider {} call failed: {}", group, e.getMessage());
            return ProviderResult.failure(request, "Request failed: " + e.getMessage(),
                    System.currentTimeMillis() - startTime, false);
        }
    }

    private ProviderPayload fetch(String url, ProviderSubRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response = restTemplates.forGroup(request.getGroup()).exchange(
                url,
                HttpMethod.POST,
                new HttpEntity<>(ProviderWireRequest.from(request), headers),
                String.class);

        JsonNode body = readBody(response.getBody());
        return parsers.forGroup(request.getGroup()).parse(body, request.getVariables());
    }

    private JsonNode readBody(String body) {
        if (body == null || body.isBlank()) {
            throw new ProviderResponseException("Empty response body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderResponseException("Malformed response body: " + e.getOriginalMessage(), e);
        }
    }

    private String describeHttpError(HttpStatusCodeException e) {
        String body = e.getResponseBodyAsString();
        try {
            JsonNode node = objectMapper.readTree(body);
            return AbstractPayloadParser.providerError(node)
                    .map(message -> "Skycaster API Error: " + message)
                    .orElse("HTTP " + e.getStatusCode().value() + ": " + body);
        } catch (JsonProcessingException ignored) {
            return "HTTP " + e.getStatusCode().value() + ": " + body;
        }
    }
}
