package com.skycaster.forecast.reconcile;

import com.skycaster.forecast.domain.Coordinate;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.ProviderResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges provider payloads into one record per input coordinate. Missing
 * locations and missing fields leave gaps; they are never fatal.
 */
@Slf4j
@Component
public class ResponseReconciler {

    public ReconciledForecast reconcile(List<Coordinate> coordinates, List<ProviderResult> results) {
        Map<String, Map<String, Object>> locationData = new LinkedHashMap<>();
        for (Coordinate coordinate : coordinates) {
            locationData.put(CoordinateKey.of(coordinate), new LinkedHashMap<>());
        }

        List<ProviderGroup> answered = new ArrayList<>();
        for (ProviderResult result : results) {
            if (!result.isSuccess() || result.getPayload() == null) {
                log.debug("Skipping failed provider {}: {}", result.getGroup(), result.getError());
                continue;
            }
            answered.add(result.getGroup());
            merge(coordinates, result, locationData);
        }

        return new ReconciledForecast(Collections.unmodifiableMap(locationData), List.copyOf(answered));
    }

    private void merge(List<Coordinate> coordinates, ProviderResult result,
                       Map<String, Map<String, Object>> locationData) {
        int gaps = 0;
        for (int i = 0; i < coordinates.size(); i++) {
            Coordinate coordinate = coordinates.get(i);
            String key = CoordinateKey.of(coordinate);
            Optional<Map<String, Object>> record = LocationRecordLocator.locateRecord(result.getPayload(), coordinate, i);

            if (record.isEmpty()) {
                log.warn("Provider {} returned no record for location {}", result.getGroup(), key);
                gaps += result.getVariables().size();
                continue;
            }

            Map<String, Object> target = locationData.get(key);
            for (String variable : result.getVariables()) {
                Optional<Object> value = VariableAliases.resolve(record.get(), variable);
                if (value.isPresent()) {
                    target.put(variable, value.get());
                } else {
                    log.debug("Provider {} has no value for {} at {}", result.getGroup(), variable, key);
                    gaps++;
                }
            }
        }
        if (gaps > 0) {
            log.info("Provider {} left {} variable gaps across {} locations", result.getGroup(), gaps, coordinates.size());
        }
    }
}
