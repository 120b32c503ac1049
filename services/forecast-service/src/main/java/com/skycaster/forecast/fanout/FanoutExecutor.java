package com.skycaster.forecast.fanout;

import com.skycaster.common.bulkhead.BulkheadResult;
import com.skycaster.common.bulkhead.BulkheadService;
import com.skycaster.forecast.domain.ProviderResult;
import com.skycaster.forecast.domain.ProviderSubRequest;
import com.skycaster.forecast.exception.AllProvidersFailedException;
import com.skycaster.forecast.exception.ProviderConfigurationException;
import com.skycaster.forecast.gateway.ProviderGateway;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs all provider calls of a plan concurrently, each in its provider
 * group's bulkhead compartment, and waits for every one of them.
 */
@Slf4j
@RequiredArgsConstructor
public class FanoutExecutor {

    private final ProviderGateway gateway;
    private final BulkheadService bulkheadService;
    private final MeterRegistry meterRegistry;

    /**
     * Results in the same order as {@code subRequests}, whatever order the calls finish in.
     *
     * @throws ProviderConfigurationException if a group has no endpoint; nothing is called
     * @throws AllProvidersFailedException if every call failed
     */
    public List<ProviderResult> execute(List<ProviderSubRequest> subRequests) {
        for (ProviderSubRequest subRequest : subRequests) {
            if (!gateway.supports(subRequest.getGroup())) {
                throw new ProviderConfigurationException(
                        "No endpoint configured for provider group " + subRequest.getGroup());
            }
        }

        long startTime = System.currentTimeMillis();
        List<CompletableFuture<BulkheadResult<ProviderResult>>> futures = new ArrayList<>(subRequests.size());
        for (ProviderSubRequest subRequest : subRequests) {
            futures.add(bulkheadService.execute(
                    subRequest.getGroup().getWireName(),
                    () -> gateway.call(subRequest),
                    subRequest.getRequestId() + ":" + subRequest.getGroup()));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ProviderResult> results = new ArrayList<>(subRequests.size());
        Map<String, String> errors = new LinkedHashMap<>();
        for (int i = 0; i < subRequests.size(); i++) {
            ProviderResult result = toProviderResult(subRequests.get(i), futures.get(i).join());
            record(result);
            if (!result.isSuccess()) {
                errors.put(result.getGroup().getWireName(),
                        result.getError() != null ? result.getError() : "Unknown error");
            }
            results.add(result);
        }

        log.info("Fan-out of {} provider calls finished in {}ms ({} failed)",
                subRequests.size(), System.currentTimeMillis() - startTime, errors.size());

        if (!subRequests.isEmpty() && errors.size() == subRequests.size()) {
            log.error("All {} providers failed: {}", errors.size(), errors);
            throw new AllProvidersFailedException(errors);
        }
        return results;
    }

    private ProviderResult toProviderResult(ProviderSubRequest subRequest, BulkheadResult<ProviderResult> outcome) {
        if (outcome.isSuccess() && outcome.hasResult()) {
            return outcome.getResult();
        }
        log.warn("Provider {} call did not complete: {}", subRequest.getGroup(), outcome.getError());
        return ProviderResult.failure(subRequest,
                outcome.isTimeout() ? "Request timeout" : outcome.getError(),
                outcome.getExecutionTime(),
                outcome.isTimeout());
    }

    private void record(ProviderResult result) {
        String outcome = result.isSuccess() ? "success" : result.isTimedOut() ? "timeout" : "failure";
        meterRegistry.counter("skycaster.provider.calls",
                "group", result.getGroup().getWireName(),
                "outcome", outcome).increment();
    }
}
