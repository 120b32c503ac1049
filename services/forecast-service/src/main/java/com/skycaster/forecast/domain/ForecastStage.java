package com.skycaster.forecast.domain;

/**
 * Lifecycle of one forecast query. FAILED is only entered from VALIDATING,
 * PLANNING or FETCHING; once RECONCILING starts the query completes.
 */
public enum ForecastStage {
    VALIDATING,
    PLANNING,
    FETCHING,
    RECONCILING,
    PRICING,
    COMPLETED,
    FAILED
}
