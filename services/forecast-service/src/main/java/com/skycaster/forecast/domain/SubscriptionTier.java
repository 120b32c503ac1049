package com.skycaster.forecast.domain;

import java.util.Arrays;
import java.util.Optional;

public enum SubscriptionTier {
    FREE,
    DEVELOPER,
    BUSINESS,
    ENTERPRISE;

    public static Optional<SubscriptionTier> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(tier -> tier.name().equalsIgnoreCase(value.trim()))
            .findFirst();
    }
}
