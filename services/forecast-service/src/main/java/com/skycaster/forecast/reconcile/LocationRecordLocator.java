package com.skycaster.forecast.reconcile;

import com.skycaster.forecast.domain.Coordinate;
import com.skycaster.forecast.domain.ProviderPayload;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the record for one location inside a provider payload. Providers
 * disagree on shape, so several addressing schemes are tried in order:
 * <ol>
 *   <li>position {@code index} of a record list</li>
 *   <li>the key {@code "lat,lon"}</li>
 *   <li>the keys {@code "lat_lon"}, {@code "lat_{lat}_lon_{lon}"} and the index as a string</li>
 * </ol>
 */
public final class LocationRecordLocator {

    private LocationRecordLocator() {
    }

    public static Optional<Map<String, Object>> locateRecord(ProviderPayload payload, Coordinate coordinate, int index) {
        Optional<Map<String, Object>> positional = payload.recordAt(index);
        if (positional.isPresent()) {
            return positional;
        }

        Optional<Map<String, Object>> primary = payload.recordFor(CoordinateKey.of(coordinate));
        if (primary.isPresent()) {
            return primary;
        }

        for (String key : List.of(
                CoordinateKey.underscored(coordinate),
                CoordinateKey.labelled(coordinate),
                String.valueOf(index))) {
            Optional<Map<String, Object>> record = payload.recordFor(key);
            if (record.isPresent()) {
                return record;
            }
        }
        return Optional.empty();
    }
}
