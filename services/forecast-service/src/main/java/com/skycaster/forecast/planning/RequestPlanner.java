package com.skycaster.forecast.planning;

import com.skycaster.forecast.catalog.CatalogSnapshot;
import com.skycaster.forecast.domain.CallerContext;
import com.skycaster.forecast.domain.Coordinate;
import com.skycaster.forecast.domain.ForecastInput;
import com.skycaster.forecast.domain.ForecastQuery;
import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.ProviderSubRequest;
import com.skycaster.forecast.exception.ForecastValidationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates raw forecast input and splits the variable set into one
 * sub-request per provider group. Every sub-request carries all coordinates.
 */
@Slf4j
public class RequestPlanner {

    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

    private final Clock clock;
    private final String defaultTimezone;

    public RequestPlanner(Clock clock, String defaultTimezone) {
        this.clock = clock;
        this.defaultTimezone = defaultTimezone;
    }

    /**
     * @throws ForecastValidationException on the first structural problem found
     */
    public ForecastQuery validate(ForecastInput input, CallerContext caller, String requestId) {
        if (input == null) {
            throw new ForecastValidationException("Forecast request is required");
        }

        List<Coordinate> coordinates = validateCoordinates(input.getCoordinates());
        List<String> variables = validateVariables(input.getVariables());
        ZoneId zone = resolveZone(input.getTimezone());
        ZonedDateTime timestamp = parseTimestamp(input.getTimestamp(), zone);

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        if (!timestamp.isAfter(now)) {
            throw new ForecastValidationException(
                    "Timestamp must be in the future: " + input.getTimestamp() + " is not after " + now.format(TIMESTAMP_FORMAT));
        }

        return ForecastQuery.builder()
                .requestId(requestId)
                .coordinates(coordinates)
                .variables(variables)
                .rawTimestamp(input.getTimestamp())
                .timestamp(timestamp)
                .timezone(zone)
                .caller(caller != null ? caller : CallerContext.anonymous())
                .build();
    }

    /**
     * Partition the query's variables by provider group using the snapshot's catalog.
     *
     * @throws com.skycaster.forecast.exception.UnknownVariableException listing every unknown variable
     */
    public ForecastPlan plan(ForecastQuery query, CatalogSnapshot snapshot) {
        Map<ProviderGroup, List<String>> groups = snapshot.getVariables().groupsFor(query.getVariables());

        List<ProviderSubRequest> subRequests = new ArrayList<>(groups.size());
        groups.forEach((group, variables) -> subRequests.add(ProviderSubRequest.builder()
                .requestId(query.getRequestId())
                .group(group)
                .coordinates(query.getCoordinates())
                .variables(List.copyOf(variables))
                .timestamp(query.getRawTimestamp())
                .timezone(query.getTimezone().getId())
                .build()));

        log.info("Planned {} provider calls {} for {} locations (catalog v{})",
                subRequests.size(), groups.keySet(), query.getLocationCount(), snapshot.getVersion());
        return new ForecastPlan(query, snapshot, List.copyOf(subRequests));
    }

    private List<Coordinate> validateCoordinates(List<List<Double>> pairs) {
        if (pairs == null || pairs.isEmpty()) {
            throw new ForecastValidationException("At least one coordinate is required");
        }

        List<Coordinate> coordinates = new ArrayList<>(pairs.size());
        Set<Coordinate> seen = new HashSet<>();
        for (int i = 0; i < pairs.size(); i++) {
            List<Double> pair = pairs.get(i);
            if (pair == null || pair.size() != 2 || pair.get(0) == null || pair.get(1) == null) {
                throw new ForecastValidationException("Coordinate " + i + " must be a [latitude, longitude] pair");
            }
            double latitude = pair.get(0);
            double longitude = pair.get(1);
            if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
                throw new ForecastValidationException("Latitude out of range [-90, 90] at coordinate " + i + ": " + latitude);
            }
            if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
                throw new ForecastValidationException("Longitude out of range [-180, 180] at coordinate " + i + ": " + longitude);
            }
            Coordinate coordinate = new Coordinate(latitude, longitude);
            if (!seen.add(coordinate)) {
                throw new ForecastValidationException("Duplicate coordinate at position " + i + ": " + pair);
            }
            coordinates.add(coordinate);
        }
        return List.copyOf(coordinates);
    }

    private List<String> validateVariables(List<String> variables) {
        if (variables == null || variables.isEmpty()) {
            throw new ForecastValidationException("At least one variable is required");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String variable : variables) {
            if (variable == null || variable.isBlank()) {
                throw new ForecastValidationException("Variable names must not be blank");
            }
            distinct.add(variable.trim());
        }
        return List.copyOf(distinct);
    }

    private ZoneId resolveZone(String timezone) {
        String zoneId = timezone == null || timezone.isBlank() ? defaultTimezone : timezone.trim();
        try {
            return ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            throw new ForecastValidationException("Unknown timezone: " + zoneId, e);
        }
    }

    private ZonedDateTime parseTimestamp(String timestamp, ZoneId zone) {
        if (timestamp == null || timestamp.isBlank()) {
            throw new ForecastValidationException("Timestamp is required");
        }
        try {
            return LocalDateTime.parse(timestamp.trim(), TIMESTAMP_FORMAT).atZone(zone);
        } catch (DateTimeParseException e) {
            throw new ForecastValidationException(
                    "Timestamp must use format yyyy-MM-dd HH:mm:ss: " + timestamp, e);
        }
    }
}
