package com.skycaster.forecast.reconcile;

import java.util.Map;
import java.util.Optional;

/**
 * Catalog variable names that providers report under a different field name.
 */
public final class VariableAliases {

    private static final Map<String, String> ALIASES = Map.of(
            "wind_10m", "wind_speed_10",
            "wind_100m", "wind_speed_100");

    private VariableAliases() {
    }

    public static Optional<String> aliasFor(String variable) {
        return Optional.ofNullable(ALIASES.get(variable));
    }

    /**
     * Value for a variable in a provider record: the aliased field first, then
     * the literal variable name. Empty when neither is present.
     */
    public static Optional<Object> resolve(Map<String, Object> record, String variable) {
        Optional<String> alias = aliasFor(variable);
        if (alias.isPresent() && record.containsKey(alias.get())) {
            return Optional.ofNullable(record.get(alias.get()));
        }
        if (record.containsKey(variable)) {
            return Optional.ofNullable(record.get(variable));
        }
        return Optional.empty();
    }
}
