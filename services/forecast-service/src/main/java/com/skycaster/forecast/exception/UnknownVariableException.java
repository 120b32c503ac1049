package com.skycaster.forecast.exception;

import com.skycaster.common.exception.BusinessException;
import com.skycaster.common.exception.ErrorCode;

import java.util.List;
import java.util.Map;

/**
 * Thrown when one or more requested variables are not in the catalog.
 * Carries every unrecognized name, not just the first.
 */
public class UnknownVariableException extends BusinessException {

    private final List<String> invalidVariables;

    public UnknownVariableException(List<String> invalidVariables) {
        super(ErrorCode.FORECAST_UNKNOWN_VARIABLE,
            "Invalid variables: " + invalidVariables,
            Map.of("invalidVariables", List.copyOf(invalidVariables)));
        this.invalidVariables = List.copyOf(invalidVariables);
    }

    public List<String> getInvalidVariables() {
        return invalidVariables;
    }
}
