package com.skycaster.forecast.domain;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class PositionalPayload implements ProviderPayload {

    private final ProviderGroup group;
    private final List<Map<String, Object>> records;

    public PositionalPayload(ProviderGroup group, List<Map<String, Object>> records) {
        this.group = group;
        this.records = List.copyOf(records);
    }

    @Override
    public ProviderGroup getGroup() {
        return group;
    }

    @Override
    public Optional<Map<String, Object>> recordAt(int index) {
        if (index < 0 || index >= records.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(index));
    }

    @Override
    public Optional<Map<String, Object>> recordFor(String key) {
        return Optional.empty();
    }

    @Override
    public int size() {
        return records.size();
    }

    public List<Map<String, Object>> getRecords() {
        return Collections.unmodifiableList(records);
    }
}
