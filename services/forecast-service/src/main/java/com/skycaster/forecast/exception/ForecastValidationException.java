package com.skycaster.forecast.exception;

import com.skycaster.common.exception.BusinessException;
import com.skycaster.common.exception.ErrorCode;

/**
 * Thrown when a forecast request is malformed. Raised before any provider is called.
 */
public class ForecastValidationException extends BusinessException {

    public ForecastValidationException(String message) {
        super(ErrorCode.FORECAST_VALIDATION_FAILED, message);
    }

    public ForecastValidationException(String message, Throwable cause) {
        super(ErrorCode.FORECAST_VALIDATION_FAILED, message, cause);
    }
}
