package com.skycaster.forecast.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class KeyedPayload implements ProviderPayload {

    private final ProviderGroup group;
    private final Map<String, Map<String, Object>> records;

    public KeyedPayload(ProviderGroup group, Map<String, Map<String, Object>> records) {
        this.group = group;
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }

    @Override
    public ProviderGroup getGroup() {
        return group;
    }

    @Override
    public Optional<Map<String, Object>> recordAt(int index) {
        return Optional.empty();
    }

    @Override
    public Optional<Map<String, Object>> recordFor(String key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public int size() {
        return records.size();
    }

    public Map<String, Map<String, Object>> getRecords() {
        return records;
    }
}
