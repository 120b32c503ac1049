package com.skycaster.forecast.gateway;

import com.skycaster.forecast.domain.Coordinate;
import com.skycaster.forecast.domain.KeyedPayload;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.ProviderResult;
import com.skycaster.forecast.domain.ProviderSubRequest;
import com.skycaster.forecast.reconcile.CoordinateKey;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic stand-in for the provider endpoints. Values follow
 * {@code base + index * step} per variable family, keyed by "lat,lon".
 */
@Slf4j
public class MockProviderGateway implements ProviderGateway {

    private final Map<ProviderGroup, Long> latencyMillis;
    private final Set<ProviderGroup> failingGroups;
    private final Map<ProviderGroup, AtomicInteger> callCounts = new EnumMap<>(ProviderGroup.class);

    public MockProviderGateway() {
        this(Collections.emptyMap(), Collections.emptySet());
    }

    public MockProviderGateway(Map<ProviderGroup, Long> latencyMillis, Set<ProviderGroup> failingGroups) {
        this.latencyMillis = latencyMillis.isEmpty()
                ? new EnumMap<>(ProviderGroup.class) : new EnumMap<>(latencyMillis);
        this.failingGroups = failingGroups.isEmpty()
                ? EnumSet.noneOf(ProviderGroup.class) : EnumSet.copyOf(failingGroups);
        for (ProviderGroup group : ProviderGroup.values()) {
            callCounts.put(group, new AtomicInteger());
        }
    }

    @Override
    public ProviderResult call(ProviderSubRequest request) {
        ProviderGroup group = request.getGroup();
        callCounts.get(group).incrementAndGet();
        long startTime = System.currentTimeMillis();

        simulateLatency(group);

        if (failingGroups.contains(group)) {
            log.warn("Mock provider {} configured to fail", group);
            return ProviderResult.failure(request, "Simulated failure for provider " + group,
                    System.currentTimeMillis() - startTime, false);
        }

        Map<String, Map<String, Object>> records = new LinkedHashMap<>();
        List<Coordinate> coordinates = request.getCoordinates();
        for (int i = 0; i < coordinates.size(); i++) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (String variable : request.getVariables()) {
                record.put(variable, mockValue(variable, i));
            }
            records.put(CoordinateKey.of(coordinates.get(i)), record);
        }

        log.debug("Mock provider {} generated {} records", group, records.size());
        return ProviderResult.success(request, new KeyedPayload(group, records),
                System.currentTimeMillis() - startTime);
    }

    public int callCount(ProviderGroup group) {
        return callCounts.get(group).get();
    }

    public int totalCalls() {
        return callCounts.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    static double mockValue(String variable, int index) {
        String name = variable.toLowerCase(Locale.ROOT);
        if (name.contains("temp")) {
            return 298.15 + index * 2.0;
        }
        if (name.contains("wind")) {
            return 5.5 + index * 0.5;
        }
        if (name.contains("humidity")) {
            return 65.0 + index * 2.0;
        }
        if (name.contains("pressure")) {
            return 101325.0 + index * 100.0;
        }
        if (name.contains("precipitation")) {
            return 0.5 + index * 0.1;
        }
        if (name.contains("ghi")) {
            return 800.0 + index * 50.0;
        }
        if (name.contains("albedo")) {
            return 0.15 + index * 0.01;
        }
        return 0.8 + index * 0.1;
    }

    private void simulateLatency(ProviderGroup group) {
        long delay = latencyMillis.getOrDefault(group, 0L);
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
