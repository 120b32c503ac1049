package com.skycaster.forecast.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.skycaster.forecast.domain.Coordinate;
import com.skycaster.forecast.domain.ProviderSubRequest;

import java.util.List;

/**
 * Body POSTed to a provider endpoint.
 */
public record ProviderWireRequest(
        @JsonProperty("list_lat_lon") List<List<Double>> listLatLon,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("variables") List<String> variables,
        @JsonProperty("timezone") String timezone) {

    public static ProviderWireRequest from(ProviderSubRequest request) {
        return new ProviderWireRequest(
                request.getCoordinates().stream().map(Coordinate::toPair).toList(),
                request.getTimestamp(),
                request.getVariables(),
                request.getTimezone());
    }
}
