package com.skycaster.forecast.reconcile;

import com.skycaster.forecast.domain.ProviderGroup;

import java.util.List;
import java.util.Map;

/**
 * Unified per-location data plus the provider groups that contributed to it.
 * {@code locationData} has one entry per input coordinate in input order.
 */
public record ReconciledForecast(Map<String, Map<String, Object>> locationData,
                                 List<ProviderGroup> answeredGroups) {
}
