package com.skycaster.forecast.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * One served (or rejected) forecast request, as written to the usage ledger.
 */
@Value
@Builder
public class WeatherRequestRecord {

    String requestId;
    String userId;
    String apiKeyId;
    List<List<Double>> coordinates;
    List<String> variables;
    String requestTimestamp;
    String timezone;
    List<String> endpointsCalled;
    int statusCode;
    long responseTimeMillis;
    boolean success;
    String errorMessage;
    BigDecimal totalCost;
    BigDecimal taxAmount;
    BigDecimal finalAmount;
    String currency;
    String clientIp;
    String userAgent;
    Instant recordedAt;
}
