package com.skycaster.forecast.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skycaster.common.bulkhead.BulkheadService;
import com.skycaster.forecast.catalog.CatalogStore;
import com.skycaster.forecast.catalog.InMemoryCatalogStore;
import com.skycaster.forecast.catalog.VariableCatalog;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.fanout.FanoutExecutor;
import com.skycaster.forecast.gateway.HttpProviderGateway;
import com.skycaster.forecast.gateway.MockProviderGateway;
import com.skycaster.forecast.gateway.ProviderGateway;
import com.skycaster.forecast.gateway.ProviderPayloadParsers;
import com.skycaster.forecast.gateway.ProviderRestTemplates;
import com.skycaster.forecast.ledger.KafkaRequestLedger;
import com.skycaster.forecast.ledger.LoggingRequestLedger;
import com.skycaster.forecast.ledger.RequestLedger;
import com.skycaster.forecast.planning.RequestPlanner;
import com.skycaster.forecast.pricing.PricingEngine;
import com.skycaster.forecast.reconcile.ResponseReconciler;
import com.skycaster.forecast.service.WeatherForecastService;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Wiring for the forecast engine.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({ForecastProperties.class, CatalogProperties.class, LedgerProperties.class})
public class ForecastConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CatalogStore catalogStore(CatalogProperties catalogProperties, Clock clock) {
        VariableCatalog variables = catalogProperties.toVariableCatalog();
        return new InMemoryCatalogStore(variables, catalogProperties.toPricingCatalog(variables), clock);
    }

    @Bean
    public RequestPlanner requestPlanner(Clock clock, ForecastProperties properties) {
        return new RequestPlanner(clock, properties.getDefaultTimezone());
    }

    @Bean
    public ProviderPayloadParsers providerPayloadParsers(ObjectMapper objectMapper) {
        return ProviderPayloadParsers.standard(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "skycaster.forecast", name = "use-mock", havingValue = "false", matchIfMissing = true)
    public ProviderGateway httpProviderGateway(ForecastProperties properties,
                                               ProviderRestTemplates restTemplates,
                                               ProviderPayloadParsers parsers,
                                               CircuitBreakerRegistry circuitBreakerRegistry,
                                               ObjectMapper objectMapper) {
        for (ProviderGroup group : ProviderGroup.values()) {
            if (properties.providerFor(group).isEmpty()) {
                log.warn("No endpoint configured for provider group {}; requests touching it will fail", group);
            }
        }
        return new HttpProviderGateway(properties, restTemplates, parsers, circuitBreakerRegistry, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "skycaster.forecast", name = "use-mock", havingValue = "true")
    public ProviderGateway mockProviderGateway(ForecastProperties properties) {
        Map<ProviderGroup, Long> latencies = new EnumMap<>(ProviderGroup.class);
        properties.getMock().getLatencyMillis().forEach((name, latency) ->
                ProviderGroup.fromWireName(name).ifPresent(group -> latencies.put(group, latency)));

        Set<ProviderGroup> failing = EnumSet.noneOf(ProviderGroup.class);
        properties.getMock().getFailingGroups().forEach(name ->
                ProviderGroup.fromWireName(name).ifPresent(failing::add));

        log.warn("Forecast providers are mocked (latencies={}, failing={})", latencies, failing);
        return new MockProviderGateway(latencies, failing);
    }

    @Bean
    public FanoutExecutor fanoutExecutor(ProviderGateway providerGateway,
                                         BulkheadService bulkheadService,
                                         MeterRegistry meterRegistry) {
        return new FanoutExecutor(providerGateway, bulkheadService, meterRegistry);
    }

    @Bean
    @ConditionalOnProperty(prefix = "skycaster.ledger", name = "kafka-enabled", havingValue = "true")
    public RequestLedger kafkaRequestLedger(KafkaTemplate<String, String> kafkaTemplate,
                                            ObjectMapper objectMapper,
                                            MeterRegistry meterRegistry,
                                            LedgerProperties ledgerProperties) {
        log.info("Request ledger publishing to Kafka topic {}", ledgerProperties.getTopic());
        return new KafkaRequestLedger(kafkaTemplate, objectMapper, meterRegistry, ledgerProperties.getTopic());
    }

    @Bean
    @ConditionalOnProperty(prefix = "skycaster.ledger", name = "kafka-enabled", havingValue = "false", matchIfMissing = true)
    public RequestLedger loggingRequestLedger() {
        return new LoggingRequestLedger();
    }

    @Bean
    public WeatherForecastService weatherForecastService(CatalogStore catalogStore,
                                                         RequestPlanner requestPlanner,
                                                         FanoutExecutor fanoutExecutor,
                                                         ResponseReconciler responseReconciler,
                                                         PricingEngine pricingEngine,
                                                         RequestLedger requestLedger,
                                                         MeterRegistry meterRegistry,
                                                         Clock clock) {
        return new WeatherForecastService(catalogStore, requestPlanner, fanoutExecutor, responseReconciler,
                pricingEngine, requestLedger, meterRegistry, clock);
    }
}
