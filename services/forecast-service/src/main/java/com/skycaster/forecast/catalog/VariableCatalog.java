package com.skycaster.forecast.catalog;

import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.WeatherVariable;
import com.skycaster.forecast.exception.UnknownVariableException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable variable registry: which provider group serves which variable.
 */
public final class VariableCatalog {

    private final Map<String, WeatherVariable> variables;

    public VariableCatalog(Collection<WeatherVariable> variables) {
        Map<String, WeatherVariable> byName = new LinkedHashMap<>();
        for (WeatherVariable variable : variables) {
            if (byName.putIfAbsent(variable.getName(), variable) != null) {
                throw new IllegalArgumentException("Duplicate variable in catalog: " + variable.getName());
            }
        }
        this.variables = Collections.unmodifiableMap(byName);
    }

    /**
     * Provider group serving the variable, empty if it is unknown or inactive.
     */
    public Optional<ProviderGroup> lookup(String name) {
        return find(name).map(WeatherVariable::getGroup);
    }

    public Optional<WeatherVariable> find(String name) {
        WeatherVariable variable = variables.get(name);
        return variable != null && variable.isActive() ? Optional.of(variable) : Optional.empty();
    }

    /**
     * Partitions variables by provider group. Groups appear in first-seen order and
     * each subset keeps request order.
     *
     * @throws UnknownVariableException listing every unrecognized name
     */
    public Map<ProviderGroup, List<String>> groupsFor(Collection<String> requested) {
        Map<ProviderGroup, List<String>> groups = new LinkedHashMap<>();
        List<String> unknown = new ArrayList<>();

        for (String name : requested) {
            Optional<ProviderGroup> group = lookup(name);
            if (group.isPresent()) {
                groups.computeIfAbsent(group.get(), g -> new ArrayList<>()).add(name);
            } else {
                unknown.add(name);
            }
        }

        if (!unknown.isEmpty()) {
            throw new UnknownVariableException(unknown);
        }
        return groups;
    }

    /**
     * Active variable names grouped by provider, in enum order.
     */
    public Map<ProviderGroup, List<String>> variablesByGroup() {
        Map<ProviderGroup, List<String>> grouped = new EnumMap<>(ProviderGroup.class);
        variables.values().stream()
            .filter(WeatherVariable::isActive)
            .forEach(v -> grouped.computeIfAbsent(v.getGroup(), g -> new ArrayList<>()).add(v.getName()));
        return grouped;
    }

    public List<WeatherVariable> describe() {
        return variables.values().stream()
            .filter(WeatherVariable::isActive)
            .toList();
    }

    Map<String, WeatherVariable> asMap() {
        return variables;
    }
}
