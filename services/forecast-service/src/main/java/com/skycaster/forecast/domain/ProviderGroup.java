package com.skycaster.forecast.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Disjoint upstream forecast backends. Each serves a fixed subset of variables.
 */
public enum ProviderGroup {

    OMEGA("omega"),
    NOVA("nova"),
    ARC("arc");

    private final String wireName;

    ProviderGroup(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<ProviderGroup> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(group -> group.wireName.equalsIgnoreCase(name.trim()))
            .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
