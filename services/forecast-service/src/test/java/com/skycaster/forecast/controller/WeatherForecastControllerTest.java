package com.skycaster.forecast.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skycaster.forecast.domain.CallerContext;
import com.skycaster.forecast.domain.Coordinate;
import com.skycaster.forecast.domain.ForecastInput;
import com.skycaster.forecast.domain.ForecastQuery;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.SubscriptionTier;
import com.skycaster.forecast.exception.AllProvidersFailedException;
import com.skycaster.forecast.exception.UnknownVariableException;
import com.skycaster.forecast.pricing.PricingEngine;
import com.skycaster.forecast.pricing.PricingResult;
import com.skycaster.forecast.service.ForecastResult;
import com.skycaster.forecast.service.WeatherForecastService;
import com.skycaster.forecast.support.TestCatalogs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WeatherForecastController.class)
@DisplayName("WeatherForecastController Tests")
class WeatherForecastControllerTest {

    private static final String FORECAST_BODY = """
            {
              "coordinates": [[26.85, 80.95]],
              "variables": ["ambient_temp(K)", "ghi(W/m2)"],
              "timestamp": "2030-01-02 12:00:00",
              "timezone": "Asia/Kolkata"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private WeatherForecastService forecastService;

    private static ForecastResult forecastResult() {
        ZoneId zone = ZoneId.of("Asia/Kolkata");
        ForecastQuery query = ForecastQuery.builder()
                .requestId("req-1")
                .coordinates(List.of(new Coordinate(26.85, 80.95)))
                .variables(List.of("ambient_temp(K)", "ghi(W/m2)"))
                .rawTimestamp("2030-01-02 12:00:00")
                .timestamp(LocalDateTime.of(2030, 1, 2, 12, 0).atZone(zone))
                .timezone(zone)
                .caller(CallerContext.anonymous())
                .build();

        Map<String, Object> values = new LinkedHashMap<>();
        values.put("ambient_temp(K)", 298.15);
        values.put("ghi(W/m2)", 800.0);

        return ForecastResult.builder()
                .requestId("req-1")
                .query(query)
                .locationData(Map.of("26.85,80.95", values))
                .endpointsCalled(List.of(ProviderGroup.OMEGA, ProviderGroup.NOVA))
                .pricing(PricingResult.builder()
                        .subtotal(new BigDecimal("2.00"))
                        .currency("INR")
                        .taxRate(new BigDecimal("18"))
                        .taxEnabled(true)
                        .taxAmount(new BigDecimal("0.36"))
                        .finalAmount(new BigDecimal("2.36"))
                        .build())
                .responseTimeMillis(120)
                .build();
    }

    @Test
    @DisplayName("Should return unified location data with pricing metadata")
    void shouldReturnForecast() throws Exception {
        when(forecastService.forecast(any(), any())).thenReturn(forecastResult());

        MvcResult mvcResult = mockMvc.perform(post("/api/v1/weather/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(FORECAST_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.endpointsCalled[0]").value("omega"))
                .andExpect(jsonPath("$.metadata.endpointsCalled[1]").value("nova"))
                .andExpect(jsonPath("$.metadata.locationsCount").value(1))
                .andExpect(jsonPath("$.metadata.totalCost").value("2.00"))
                .andExpect(jsonPath("$.metadata.taxApplied").value("Yes"))
                .andExpect(jsonPath("$.metadata.taxRate").value("18%"))
                .andExpect(jsonPath("$.metadata.taxAmount").value("0.36"))
                .andExpect(jsonPath("$.metadata.finalAmount").value("2.36"))
                .andExpect(jsonPath("$.metadata.currency").value("INR"))
                .andReturn();

        JsonNode location = objectMapper.readTree(mvcResult.getResponse().getContentAsString())
                .path("locationData").path("26.85,80.95");
        assertThat(location.path("ambient_temp(K)").asDouble()).isEqualTo(298.15);
        assertThat(location.path("ghi(W/m2)").asDouble()).isEqualTo(800.0);
    }

    @Test
    @DisplayName("Should map caller headers and accept list_lat_lon")
    void shouldMapCallerHeaders() throws Exception {
        when(forecastService.forecast(any(), any())).thenReturn(forecastResult());

        mockMvc.perform(post("/api/v1/weather/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-User-Id", "user-7")
                        .header("X-Api-Key-Id", "key-7")
                        .header("X-Subscription-Tier", "business")
                        .header("X-Country-Code", "US")
                        .header("User-Agent", "skycaster-sdk/1.0")
                        .header("X-Forwarded-For", "203.0.113.9, 10.0.0.1")
                        .content("""
                                {"list_lat_lon": [[26.85, 80.95]], "variables": ["ct"],
                                 "timestamp": "2030-01-02 12:00:00", "currency": "USD"}
                                """))
                .andExpect(status().isOk());

        ArgumentCaptor<ForecastInput> input = ArgumentCaptor.forClass(ForecastInput.class);
        ArgumentCaptor<CallerContext> caller = ArgumentCaptor.forClass(CallerContext.class);
        verify(forecastService).forecast(input.capture(), caller.capture());

        assertThat(input.getValue().getCoordinates()).containsExactly(List.of(26.85, 80.95));
        assertThat(input.getValue().getTimezone()).isNull();
        assertThat(caller.getValue().getUserId()).isEqualTo("user-7");
        assertThat(caller.getValue().getApiKeyId()).isEqualTo("key-7");
        assertThat(caller.getValue().getSubscriptionTier()).isEqualTo(SubscriptionTier.BUSINESS);
        assertThat(caller.getValue().getCountryCode()).isEqualTo("US");
        assertThat(caller.getValue().getPreferredCurrency()).isEqualTo("USD");
        assertThat(caller.getValue().getClientIp()).isEqualTo("203.0.113.9");
        assertThat(caller.getValue().getUserAgent()).isEqualTo("skycaster-sdk/1.0");
    }

    @Test
    @DisplayName("Unknown tier header is ignored")
    void unknownTierIgnored() throws Exception {
        when(forecastService.forecast(any(), any())).thenReturn(forecastResult());

        mockMvc.perform(post("/api/v1/weather/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Subscription-Tier", "platinum")
                        .content(FORECAST_BODY))
                .andExpect(status().isOk());

        ArgumentCaptor<CallerContext> caller = ArgumentCaptor.forClass(CallerContext.class);
        verify(forecastService).forecast(any(), caller.capture());
        assertThat(caller.getValue().getSubscriptionTier()).isNull();
    }

    @Test
    @DisplayName("Unknown variables map to 400 with the offending names")
    void unknownVariables() throws Exception {
        when(forecastService.forecast(any(), any())).thenThrow(new UnknownVariableException(List.of("snow", "hail")));

        mockMvc.perform(post("/api/v1/weather/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(FORECAST_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("FORECAST_002"))
                .andExpect(jsonPath("$.details.invalidVariables[0]").value("snow"))
                .andExpect(jsonPath("$.details.invalidVariables[1]").value("hail"));
    }

    @Test
    @DisplayName("All providers failing maps to 502")
    void allProvidersFailed() throws Exception {
        when(forecastService.forecast(any(), any()))
                .thenThrow(new AllProvidersFailedException(Map.of("omega", "Request timeout")));

        mockMvc.perform(post("/api/v1/weather/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(FORECAST_BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("FORECAST_003"));
    }

    @Test
    @DisplayName("Malformed currency is rejected by bean validation")
    void invalidCurrency() throws Exception {
        mockMvc.perform(post("/api/v1/weather/forecast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"coordinates": [[26.85, 80.95]], "variables": ["ct"],
                                 "timestamp": "2030-01-02 12:00:00", "currency": "DOLLARS"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VAL_001"))
                .andExpect(jsonPath("$.details.currency").exists());
    }

    @Test
    @DisplayName("Should list supported variables grouped by endpoint")
    void supportedVariables() throws Exception {
        when(forecastService.supportedVariables()).thenReturn(TestCatalogs.variables());

        mockMvc.perform(get("/api/v1/weather/variables"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalVariables").value(TestCatalogs.SEED.size()))
                .andExpect(jsonPath("$.endpoints.arc[0]").value("ct"))
                .andExpect(jsonPath("$.variables[0].variableName").value("ambient_temp(K)"))
                .andExpect(jsonPath("$.variables[0].endpointType").value("omega"));
    }

    @Test
    @DisplayName("Should publish pricing with the worked example")
    void pricing() throws Exception {
        when(forecastService.pricingOverview()).thenReturn(new PricingEngine().overview(TestCatalogs.pricing()));

        mockMvc.perform(get("/api/v1/weather/pricing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.baseCurrency").value("INR"))
                .andExpect(jsonPath("$.calculationExample.totalCost").value("4.00"))
                .andExpect(jsonPath("$.calculationExample.taxAmount").value("0.72"))
                .andExpect(jsonPath("$.calculationExample.finalAmount").value("4.72"))
                .andExpect(jsonPath("$.pricing.length()").value(TestCatalogs.SEED.size()));
    }
}
