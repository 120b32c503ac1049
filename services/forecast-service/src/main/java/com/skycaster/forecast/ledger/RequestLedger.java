package com.skycaster.forecast.ledger;

/**
 * Usage ledger sink. Fire-and-forget: implementations must not throw and must
 * not block the caller on delivery.
 */
public interface RequestLedger {

    void record(WeatherRequestRecord record);
}
