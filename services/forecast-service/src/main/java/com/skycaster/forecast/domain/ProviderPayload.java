package com.skycaster.forecast.domain;

import java.util.Map;
import java.util.Optional;

/**
 * Parsed provider response. Providers answer either with a list of records in
 * request coordinate order or with records keyed by a location string.
 */
public interface ProviderPayload {

    ProviderGroup getGroup();

    /**
     * Record at the given position, for positional payloads only.
     */
    Optional<Map<String, Object>> recordAt(int index);

    /**
     * Record stored under the given location key, for keyed payloads only.
     */
    Optional<Map<String, Object>> recordFor(String key);

    int size();
}
