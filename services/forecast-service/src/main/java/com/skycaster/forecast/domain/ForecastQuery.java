package com.skycaster.forecast.domain;

import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Validated forecast query. Lives for the duration of one request.
 */
@Value
@Builder
public class ForecastQuery {

    String requestId;
    List<Coordinate> coordinates;
    List<String> variables;
    String rawTimestamp;
    ZonedDateTime timestamp;
    ZoneId timezone;
    CallerContext caller;

    public int getLocationCount() {
        return coordinates.size();
    }
}
