package com.skycaster.forecast.reconcile;

import com.skycaster.forecast.domain.Coordinate;

import java.math.BigDecimal;

/**
 * Canonical string forms of a coordinate used as location keys.
 * Each component renders like {@link Double#toString(double)} except that
 * exponent notation is replaced by the plain decimal: 26.85, 80.0, 0.0005.
 */
public final class CoordinateKey {

    private CoordinateKey() {
    }

    /**
     * Primary key, "lat,lon". Also the key of the unified response.
     */
    public static String of(Coordinate coordinate) {
        return format(coordinate.latitude()) + "," + format(coordinate.longitude());
    }

    /**
     * "lat_lon"
     */
    public static String underscored(Coordinate coordinate) {
        return format(coordinate.latitude()) + "_" + format(coordinate.longitude());
    }

    /**
     * "lat_{lat}_lon_{lon}"
     */
    public static String labelled(Coordinate coordinate) {
        return "lat_" + format(coordinate.latitude()) + "_lon_" + format(coordinate.longitude());
    }

    static String format(double value) {
        String text = Double.toString(value);
        if (text.indexOf('E') < 0) {
            return text;
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
