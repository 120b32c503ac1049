package com.skycaster.forecast.planning;

import com.skycaster.forecast.catalog.CatalogSnapshot;
import com.skycaster.forecast.domain.ForecastQuery;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.ProviderSubRequest;

import java.util.List;

/**
 * Sub-requests for one query, one per provider group, in first-seen group order.
 * Carries the catalog snapshot the plan was built from.
 */
public record ForecastPlan(ForecastQuery query, CatalogSnapshot snapshot, List<ProviderSubRequest> subRequests) {

    public List<ProviderGroup> groups() {
        return subRequests.stream().map(ProviderSubRequest::getGroup).toList();
    }
}
