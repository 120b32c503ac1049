package com.skycaster.forecast.ledger;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingRequestLedger implements RequestLedger {

    @Override
    public void record(WeatherRequestRecord record) {
        log.info("Weather request {} user={} status={} variables={} locations={} endpoints={} amount={} {} in {}ms",
                record.getRequestId(),
                record.getUserId(),
                record.getStatusCode(),
                record.getVariables(),
                record.getCoordinates() != null ? record.getCoordinates().size() : 0,
                record.getEndpointsCalled(),
                record.getFinalAmount(),
                record.getCurrency(),
                record.getResponseTimeMillis());
    }
}
