package com.skycaster.forecast.service;

import com.skycaster.forecast.domain.ForecastStage;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Tracks the stage of one forecast query and rejects illegal transitions.
 */
@Slf4j
class ForecastProgress {

    private static final Map<ForecastStage, Set<ForecastStage>> ALLOWED = Map.of(
            ForecastStage.VALIDATING, EnumSet.of(ForecastStage.PLANNING, ForecastStage.FAILED),
            ForecastStage.PLANNING, EnumSet.of(ForecastStage.FETCHING, ForecastStage.FAILED),
            ForecastStage.FETCHING, EnumSet.of(ForecastStage.RECONCILING, ForecastStage.FAILED),
            ForecastStage.RECONCILING, EnumSet.of(ForecastStage.PRICING),
            ForecastStage.PRICING, EnumSet.of(ForecastStage.COMPLETED),
            ForecastStage.COMPLETED, EnumSet.noneOf(ForecastStage.class),
            ForecastStage.FAILED, EnumSet.noneOf(ForecastStage.class));

    private final String requestId;
    private ForecastStage stage = ForecastStage.VALIDATING;

    ForecastProgress(String requestId) {
        this.requestId = requestId;
        log.info("Forecast {} entered {}", requestId, stage);
    }

    ForecastStage stage() {
        return stage;
    }

    void moveTo(ForecastStage next) {
        if (!ALLOWED.get(stage).contains(next)) {
            throw new IllegalStateException("Forecast " + requestId + " cannot move from " + stage + " to " + next);
        }
        log.info("Forecast {} {} -> {}", requestId, stage, next);
        stage = next;
    }

    /**
     * Marks the query failed if the current stage allows it.
     */
    boolean fail() {
        if (!ALLOWED.get(stage).contains(ForecastStage.FAILED)) {
            return false;
        }
        moveTo(ForecastStage.FAILED);
        return true;
    }
}
