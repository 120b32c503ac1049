package com.skycaster.forecast.controller;

import com.skycaster.forecast.domain.CallerContext;
import com.skycaster.forecast.domain.ForecastInput;
import com.skycaster.forecast.domain.SubscriptionTier;
import com.skycaster.forecast.dto.request.ForecastRequest;
import com.skycaster.forecast.dto.response.ForecastResponse;
import com.skycaster.forecast.dto.response.PricingOverviewResponse;
import com.skycaster.forecast.dto.response.SupportedVariablesResponse;
import com.skycaster.forecast.service.ForecastResult;
import com.skycaster.forecast.service.WeatherForecastService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for weather forecasts. Authentication happens upstream;
 * the caller identity arrives in headers.
 */
@RestController
@RequestMapping("/api/v1/weather")
@Tag(name = "Weather Forecast", description = "Multi-provider weather forecast endpoints")
@Slf4j
@RequiredArgsConstructor
public class WeatherForecastController {

    private final WeatherForecastService forecastService;

    @PostMapping("/forecast")
    @Operation(summary = "Fetch forecast data for a set of locations and variables")
    public ResponseEntity<ForecastResponse> getForecast(
            @Valid @RequestBody ForecastRequest request,
            @RequestHeader(value = "X-User-Id", required = false) String userId,
            @RequestHeader(value = "X-Api-Key-Id", required = false) String apiKeyId,
            @RequestHeader(value = "X-Subscription-Tier", required = false) String subscriptionTier,
            @RequestHeader(value = "X-Country-Code", required = false) String countryCode,
            @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
            HttpServletRequest servletRequest) {

        log.info("Forecast requested by user: {} for {} variables", userId,
                request.getVariables() != null ? request.getVariables().size() : 0);

        CallerContext caller = CallerContext.builder()
                .userId(userId)
                .apiKeyId(apiKeyId)
                .subscriptionTier(resolveTier(subscriptionTier))
                .preferredCurrency(request.getCurrency())
                .countryCode(countryCode)
                .clientIp(clientIp(servletRequest))
                .userAgent(userAgent)
                .build();

        ForecastInput input = ForecastInput.builder()
                .coordinates(request.getCoordinates())
                .variables(request.getVariables())
                .timestamp(request.getTimestamp())
                .timezone(request.getTimezone())
                .build();

        ForecastResult result = forecastService.forecast(input, caller);
        return ResponseEntity.ok(ForecastResponse.from(result));
    }

    @GetMapping("/variables")
    @Operation(summary = "List supported weather variables grouped by endpoint")
    public ResponseEntity<SupportedVariablesResponse> getSupportedVariables() {
        return ResponseEntity.ok(SupportedVariablesResponse.from(forecastService.supportedVariables()));
    }

    @GetMapping("/pricing")
    @Operation(summary = "Get per-variable pricing and a worked calculation example")
    public ResponseEntity<PricingOverviewResponse> getPricing() {
        return ResponseEntity.ok(PricingOverviewResponse.from(forecastService.pricingOverview()));
    }

    private SubscriptionTier resolveTier(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        return SubscriptionTier.parse(header).orElseGet(() -> {
            log.warn("Ignoring unknown subscription tier header: {}", header);
            return null;
        });
    }

    private String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
