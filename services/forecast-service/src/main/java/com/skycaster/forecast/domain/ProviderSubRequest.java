package com.skycaster.forecast.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The slice of a query sent to one provider group. Always carries every coordinate.
 */
@Value
@Builder
public class ProviderSubRequest {

    String requestId;
    ProviderGroup group;
    List<Coordinate> coordinates;
    List<String> variables;
    String timestamp;
    String timezone;
}
