package com.skycaster.forecast.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Unvalidated forecast request as received from the transport layer.
 */
@Value
@Builder
public class ForecastInput {

    List<List<Double>> coordinates;
    List<String> variables;
    String timestamp;
    String timezone;
}
