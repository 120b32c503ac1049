package com.skycaster.forecast.service;

import com.skycaster.common.bulkhead.BulkheadConfiguration;
import com.skycaster.common.bulkhead.BulkheadService;
import com.skycaster.forecast.catalog.InMemoryCatalogStore;
import com.skycaster.forecast.domain.CallerContext;
import com.skycaster.forecast.domain.ForecastInput;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.SubscriptionTier;
import com.skycaster.forecast.exception.AllProvidersFailedException;
import com.skycaster.forecast.exception.ForecastValidationException;
import com.skycaster.forecast.exception.UnknownVariableException;
import com.skycaster.forecast.fanout.FanoutExecutor;
import com.skycaster.forecast.gateway.MockProviderGateway;
import com.skycaster.forecast.ledger.RequestLedger;
import com.skycaster.forecast.ledger.WeatherRequestRecord;
import com.skycaster.forecast.planning.RequestPlanner;
import com.skycaster.forecast.pricing.PricingEngine;
import com.skycaster.forecast.reconcile.ResponseReconciler;
import com.skycaster.forecast.support.TestCatalogs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("WeatherForecastService Tests")
class WeatherForecastServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2030-01-01T00:00:00Z"), ZoneOffset.UTC);

    private BulkheadService bulkheadService;
    private RequestLedger ledger;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        BulkheadConfiguration.BulkheadProperties properties = new BulkheadConfiguration.BulkheadProperties();
        properties.setDefaults(new BulkheadConfiguration.BulkheadProperties.Compartment(2, 4, 5));
        bulkheadService = new BulkheadService(properties);
        ledger = mock(RequestLedger.class);
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        bulkheadService.shutdown();
    }

    private WeatherForecastService service(MockProviderGateway gateway) {
        return new WeatherForecastService(
                new InMemoryCatalogStore(TestCatalogs.variables(), TestCatalogs.pricing(), CLOCK),
                new RequestPlanner(CLOCK, "Asia/Kolkata"),
                new FanoutExecutor(gateway, bulkheadService, meterRegistry),
                new ResponseReconciler(),
                new PricingEngine(),
                ledger,
                meterRegistry,
                CLOCK);
    }

    private static ForecastInput.ForecastInputBuilder input() {
        return ForecastInput.builder()
                .coordinates(List.of(List.of(26.85, 80.95)))
                .variables(List.of("ambient_temp(K)", "ghi(W/m2)"))
                .timestamp("2030-01-02 12:00:00")
                .timezone("Asia/Kolkata");
    }

    private WeatherRequestRecord capturedRecord() {
        ArgumentCaptor<WeatherRequestRecord> captor = ArgumentCaptor.forClass(WeatherRequestRecord.class);
        verify(ledger).record(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Successful Forecasts")
    class SuccessTests {

        @Test
        @DisplayName("Two-group request lists exactly those groups and prices the result")
        void twoGroupRequest() {
            MockProviderGateway gateway = new MockProviderGateway();
            CallerContext caller = CallerContext.builder().userId("user-1").apiKeyId("key-1").build();

            ForecastResult result = service(gateway).forecast(input().build(), caller);

            assertThat(result.getEndpointsCalled()).containsExactly(ProviderGroup.OMEGA, ProviderGroup.NOVA);
            assertThat(gateway.totalCalls()).isEqualTo(2);
            assertThat(result.getLocationData()).containsOnlyKeys("26.85,80.95");
            assertThat(result.getLocationData().get("26.85,80.95"))
                    .containsEntry("ambient_temp(K)", 298.15)
                    .containsEntry("ghi(W/m2)", 800.0);
            assertThat(result.getPricing().displaySubtotal()).isEqualTo("2.00");
            assertThat(result.getPricing().displayFinalAmount()).isEqualTo("2.36");
            assertThat(MDC.get("requestId")).isNull();

            WeatherRequestRecord record = capturedRecord();
            assertThat(record.getRequestId()).isEqualTo(result.getRequestId());
            assertThat(record.getUserId()).isEqualTo("user-1");
            assertThat(record.getStatusCode()).isEqualTo(200);
            assertThat(record.getEndpointsCalled()).containsExactly("omega", "nova");
            assertThat(record.getFinalAmount()).isEqualByComparingTo("2.36");
            assertThat(meterRegistry.counter("skycaster.forecast.requests", "outcome", "success").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("One failed provider still returns every location")
        void partialFailure() {
            MockProviderGateway gateway = new MockProviderGateway(Map.of(), Set.of(ProviderGroup.NOVA));

            ForecastResult result = service(gateway).forecast(input()
                    .coordinates(List.of(List.of(26.85, 80.95), List.of(28.61, 77.2)))
                    .build(), CallerContext.anonymous());

            assertThat(result.getLocationData()).containsOnlyKeys("26.85,80.95", "28.61,77.2");
            assertThat(result.getLocationData().get("28.61,77.2"))
                    .containsOnlyKeys("ambient_temp(K)");
            assertThat(result.getEndpointsCalled()).containsExactly(ProviderGroup.OMEGA);
            assertThat(result.getPricing().displaySubtotal()).isEqualTo("4.00");
        }

        @Test
        @DisplayName("Caller tier and currency flow into pricing")
        void callerPricing() {
            CallerContext caller = CallerContext.builder()
                    .subscriptionTier(SubscriptionTier.ENTERPRISE)
                    .preferredCurrency("USD")
                    .build();

            ForecastResult result = service(new MockProviderGateway()).forecast(input().build(), caller);

            assertThat(result.getPricing().getCurrency()).isEqualTo("USD");
            assertThat(result.getPricing().getSubtotal()).isEqualByComparingTo(new BigDecimal("0.024"));
        }

        @Test
        @DisplayName("Ledger failures never reach the caller")
        void ledgerFailureIsAbsorbed() {
            doThrow(new IllegalStateException("ledger down")).when(ledger).record(any());

            ForecastResult result = service(new MockProviderGateway()).forecast(input().build(), CallerContext.anonymous());

            assertThat(result.getLocationData()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Failed Forecasts")
    class FailureTests {

        @Test
        @DisplayName("Invalid input is rejected before any provider is called and still recorded")
        void invalidInput() {
            MockProviderGateway gateway = new MockProviderGateway();

            assertThatThrownBy(() -> service(gateway).forecast(input().timestamp("yesterday").build(), CallerContext.anonymous()))
                    .isInstanceOf(ForecastValidationException.class);

            assertThat(gateway.totalCalls()).isZero();
            WeatherRequestRecord record = capturedRecord();
            assertThat(record.getStatusCode()).isEqualTo(400);
            assertThat(record.isSuccess()).isFalse();
            assertThat(record.getFinalAmount()).isEqualByComparingTo(BigDecimal.ZERO);
        }

        @Test
        @DisplayName("Unknown variables are rejected before any provider is called")
        void unknownVariables() {
            MockProviderGateway gateway = new MockProviderGateway();

            assertThatThrownBy(() -> service(gateway).forecast(
                    input().variables(List.of("ambient_temp(K)", "snow")).build(), CallerContext.anonymous()))
                    .isInstanceOf(UnknownVariableException.class);
            assertThat(gateway.totalCalls()).isZero();
        }

        @Test
        @DisplayName("All providers failing yields no data and a 502 ledger entry")
        void allProvidersFailed() {
            MockProviderGateway gateway = new MockProviderGateway(Map.of(), EnumSet.allOf(ProviderGroup.class));

            assertThatThrownBy(() -> service(gateway).forecast(input().build(), CallerContext.anonymous()))
                    .isInstanceOf(AllProvidersFailedException.class);

            assertThat(capturedRecord().getStatusCode()).isEqualTo(502);
            assertThat(meterRegistry.counter("skycaster.forecast.requests", "outcome", "FORECAST_003").count())
                    .isEqualTo(1.0);
        }
    }
}
