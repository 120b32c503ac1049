package com.skycaster.forecast.domain;

import java.util.List;

/**
 * A (latitude, longitude) location. Range checks happen at request validation.
 */
public record Coordinate(double latitude, double longitude) {

    public List<Double> toPair() {
        return List.of(latitude, longitude);
    }
}
