package com.skycaster.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes for the Skycaster platform
 * Format: MODULE_CATEGORY_SPECIFIC_ERROR
 */
public enum ErrorCode {

    // ===== REQUEST VALIDATION ERRORS (VAL_XXX) =====
    VALIDATION_FAILED("VAL_001", "Request validation failed"),
    VALIDATION_MALFORMED_BODY("VAL_002", "Request body could not be read"),

    // ===== FORECAST ERRORS (FORECAST_XXX) =====
    FORECAST_VALIDATION_FAILED("FORECAST_001", "Invalid forecast request"),
    FORECAST_UNKNOWN_VARIABLE("FORECAST_002", "Unknown weather variable"),
    FORECAST_ALL_PROVIDERS_FAILED("FORECAST_003", "All forecast providers failed"),

    // ===== SYSTEM ERRORS (SYS_XXX) =====
    SYS_CONFIGURATION_ERROR("SYS_001", "Service configuration error"),
    SYS_INTERNAL_ERROR("SYS_002", "Internal server error");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * HTTP status derived from the code family
     */
    public HttpStatus getStatus() {
        if (code.startsWith("VAL_")) {
            return HttpStatus.BAD_REQUEST;
        }
        if (code.startsWith("FORECAST_")) {
            return this == FORECAST_ALL_PROVIDERS_FAILED ? HttpStatus.BAD_GATEWAY : HttpStatus.BAD_REQUEST;
        }
        if (code.startsWith("SYS_")) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return HttpStatus.BAD_REQUEST;
    }
}
