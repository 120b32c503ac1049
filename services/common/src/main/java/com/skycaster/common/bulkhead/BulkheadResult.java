package com.skycaster.common.bulkhead;

import lombok.Builder;
import lombok.Data;

/**
 * Result of bulkhead-protected operation execution
 */
@Data
@Builder
public class BulkheadResult<T> {

    private boolean success;
    private T result;
    private String compartment;
    private String operationId;
    private String error;
    private long executionTime;
    private boolean timeout;
    private boolean rejected;

    public boolean isFailure() {
        return !success;
    }

    public boolean hasResult() {
        return result != null;
    }
}
