package com.skycaster.forecast.service;

import com.skycaster.common.exception.BusinessException;
import com.skycaster.forecast.catalog.CatalogSnapshot;
import com.skycaster.forecast.catalog.CatalogStore;
import com.skycaster.forecast.catalog.VariableCatalog;
import com.skycaster.forecast.domain.CallerContext;
import com.skycaster.forecast.domain.Coordinate;
import com.skycaster.forecast.domain.ForecastInput;
import com.skycaster.forecast.domain.ForecastQuery;
import com.skycaster.forecast.domain.ForecastStage;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.ProviderResult;
import com.skycaster.forecast.fanout.FanoutExecutor;
import com.skycaster.forecast.ledger.RequestLedger;
import com.skycaster.forecast.ledger.WeatherRequestRecord;
import com.skycaster.forecast.planning.ForecastPlan;
import com.skycaster.forecast.planning.RequestPlanner;
import com.skycaster.forecast.pricing.PricingEngine;
import com.skycaster.forecast.pricing.PricingOverview;
import com.skycaster.forecast.pricing.PricingResult;
import com.skycaster.forecast.reconcile.ReconciledForecast;
import com.skycaster.forecast.reconcile.ResponseReconciler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Forecast orchestration: validate, plan, fan out, reconcile, price, record.
 */
@Slf4j
@RequiredArgsConstructor
public class WeatherForecastService {

    static final String REQUEST_ID_MDC_KEY = "requestId";

    private final CatalogStore catalogStore;
    private final RequestPlanner planner;
    private final FanoutExecutor fanoutExecutor;
    private final ResponseReconciler reconciler;
    private final PricingEngine pricingEngine;
    private final RequestLedger ledger;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Serve one forecast request.
     *
     * @throws com.skycaster.forecast.exception.ForecastValidationException on malformed input
     * @throws com.skycaster.forecast.exception.UnknownVariableException when variables are not in the catalog
     * @throws com.skycaster.forecast.exception.AllProvidersFailedException when no provider answered
     */
    public ForecastResult forecast(ForecastInput input, CallerContext caller) {
        String requestId = UUID.randomUUID().toString();
        CallerContext effectiveCaller = caller != null ? caller : CallerContext.anonymous();
        long startTime = clock.millis();
        Timer.Sample sample = Timer.start(meterRegistry);
        MDC.put(REQUEST_ID_MDC_KEY, requestId);

        ForecastProgress progress = new ForecastProgress(requestId);
        try {
            ForecastQuery query = planner.validate(input, effectiveCaller, requestId);

            progress.moveTo(ForecastStage.PLANNING);
            CatalogSnapshot snapshot = catalogStore.snapshot();
            ForecastPlan plan = planner.plan(query, snapshot);

            progress.moveTo(ForecastStage.FETCHING);
            List<ProviderResult> results = fanoutExecutor.execute(plan.subRequests());

            progress.moveTo(ForecastStage.RECONCILING);
            ReconciledForecast reconciled = reconciler.reconcile(query.getCoordinates(), results);

            progress.moveTo(ForecastStage.PRICING);
            PricingResult pricing = pricingEngine.price(
                    query.getVariables(), query.getLocationCount(), query.getCaller(), snapshot.getPricing());

            progress.moveTo(ForecastStage.COMPLETED);
            long responseTime = clock.millis() - startTime;

            ForecastResult result = ForecastResult.builder()
                    .requestId(requestId)
                    .query(query)
                    .locationData(reconciled.locationData())
                    .endpointsCalled(reconciled.answeredGroups())
                    .pricing(pricing)
                    .responseTimeMillis(responseTime)
                    .build();

            log.info("Forecast {} completed: {} locations, {} variables, providers {}, {} {} in {}ms",
                    requestId, query.getLocationCount(), query.getVariables().size(),
                    reconciled.answeredGroups(), pricing.displayFinalAmount(), pricing.getCurrency(), responseTime);

            recordOutcome("success");
            recordLedger(successRecord(result, effectiveCaller));
            return result;

        } catch (BusinessException e) {
            progress.fail();
            long responseTime = clock.millis() - startTime;
            log.warn("Forecast {} failed in stage {} after {}ms: {}",
                    requestId, progress.stage(), responseTime, e.getMessage());

            recordOutcome(e.getErrorCode());
            recordLedger(failureRecord(requestId, input, effectiveCaller, e, responseTime));
            throw e;

        } finally {
            sample.stop(meterRegistry.timer("skycaster.forecast.duration"));
            MDC.remove(REQUEST_ID_MDC_KEY);
        }
    }

    public VariableCatalog supportedVariables() {
        return catalogStore.snapshot().getVariables();
    }

    public PricingOverview pricingOverview() {
        return pricingEngine.overview(catalogStore.snapshot().getPricing());
    }

    private void recordOutcome(String outcome) {
        meterRegistry.counter("skycaster.forecast.requests", "outcome", outcome).increment();
    }

    private void recordLedger(WeatherRequestRecord record) {
        try {
            ledger.record(record);
        } catch (RuntimeException e) {
            log.error("Ledger rejected record for request {}", record.getRequestId(), e);
        }
    }

    private WeatherRequestRecord successRecord(ForecastResult result, CallerContext caller) {
        ForecastQuery query = result.getQuery();
        PricingResult pricing = result.getPricing();
        return WeatherRequestRecord.builder()
                .requestId(result.getRequestId())
                .userId(caller.getUserId())
                .apiKeyId(caller.getApiKeyId())
                .coordinates(query.getCoordinates().stream().map(Coordinate::toPair).toList())
                .variables(query.getVariables())
                .requestTimestamp(query.getRawTimestamp())
                .timezone(query.getTimezone().getId())
                .endpointsCalled(result.getEndpointsCalled().stream().map(ProviderGroup::getWireName).toList())
                .statusCode(200)
                .responseTimeMillis(result.getResponseTimeMillis())
                .success(true)
                .totalCost(pricing.getSubtotal())
                .taxAmount(pricing.getTaxAmount())
                .finalAmount(pricing.getFinalAmount())
                .currency(pricing.getCurrency())
                .clientIp(caller.getClientIp())
                .userAgent(caller.getUserAgent())
                .recordedAt(clock.instant())
                .build();
    }

    private WeatherRequestRecord failureRecord(String requestId, ForecastInput input, CallerContext caller,
                                               BusinessException error, long responseTime) {
        return WeatherRequestRecord.builder()
                .requestId(requestId)
                .userId(caller.getUserId())
                .apiKeyId(caller.getApiKeyId())
                .coordinates(input != null ? input.getCoordinates() : null)
                .variables(input != null ? input.getVariables() : null)
                .requestTimestamp(input != null ? input.getTimestamp() : null)
                .timezone(input != null ? input.getTimezone() : null)
                .endpointsCalled(List.of())
                .statusCode(error.getStatus().value())
                .responseTimeMillis(responseTime)
                .success(false)
                .errorMessage(error.getMessage())
                .totalCost(BigDecimal.ZERO)
                .taxAmount(BigDecimal.ZERO)
                .finalAmount(BigDecimal.ZERO)
                .currency(catalogStore.snapshot().getPricing().getBaseCurrency())
                .clientIp(caller.getClientIp())
                .userAgent(caller.getUserAgent())
                .recordedAt(clock.instant())
                .build();
    }
}
