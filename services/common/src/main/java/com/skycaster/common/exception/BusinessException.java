package com.skycaster.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base exception for all business-related exceptions.
 *
 * FEATURES:
 * - Error codes with type safety via ErrorCode enum
 * - Metadata support for runtime context enrichment
 * - Unique error IDs for tracking across services
 * - HTTP status code mapping for RESTful APIs
 *
 * USAGE PATTERNS:
 * 1. Simple construction: new BusinessException(ErrorCode.XXX, "message")
 * 2. With cause: new BusinessException(ErrorCode.XXX, "message", cause)
 * 3. With metadata: new BusinessException(ErrorCode.XXX, "message").withMetadata("key", value)
 */
@Getter
public class BusinessException extends RuntimeException {

    private final String errorId;
    private final String errorCode;
    private final Map<String, Object> metadata;
    private final HttpStatus status;
    private final LocalDateTime timestamp;

    /**
     * Create business exception with ErrorCode enum
     */
    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    /**
     * Create business exception with ErrorCode enum and cause
     * Use when wrapping lower-level exceptions with business context
     */
    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, null);
    }

    /**
     * Create business exception with ErrorCode enum and metadata
     *
     * Example:
     * throw new BusinessException(ErrorCode.FORECAST_UNKNOWN_VARIABLE, "Unknown variables",
     *     Map.of("invalidVariables", List.of("foo", "bar")));
     */
    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> metadata) {
        this(errorCode, message, null, metadata);
    }

    /**
     * Most comprehensive constructor for maximum context preservation
     */
    public BusinessException(ErrorCode errorCode, String message, Throwable cause, Map<String, Object> metadata) {
        super(buildMessage(errorCode, message), cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode != null ? errorCode.getCode() : "BUSINESS_ERROR";
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        this.status = errorCode != null ? errorCode.getStatus() : HttpStatus.BAD_REQUEST;
        this.timestamp = LocalDateTime.now();
    }

    /**
     * Add single metadata entry (fluent API)
     *
     * Example:
     * throw new BusinessException(ErrorCode.FORECAST_VALIDATION_FAILED, "Bad coordinate")
     *     .withMetadata("index", 3);
     */
    public BusinessException withMetadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }

    /**
     * Get metadata map (returns unmodifiable view)
     * To modify metadata, use withMetadata()
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    private static String buildMessage(ErrorCode errorCode, String message) {
        if (errorCode == null) {
            return message != null ? message : "Business error occurred";
        }
        return String.format("[%s] %s", errorCode.getCode(),
            message != null ? message : errorCode.getDefaultMessage());
    }

    /**
     * Convert to error response DTO for API responses
     */
    public ErrorResponse toErrorResponse(String path) {
        return ErrorResponse.builder()
            .errorId(errorId)
            .status(status.value())
            .error(errorCode)
            .message(getMessage())
            .path(path)
            .timestamp(timestamp)
            .details(metadata.isEmpty() ? null : getMetadata())
            .build();
    }

    @Override
    public String toString() {
        return String.format("BusinessException[errorId=%s, errorCode=%s, message=%s, metadata=%s, timestamp=%s]",
            errorId, errorCode, getMessage(), metadata, timestamp);
    }
}
