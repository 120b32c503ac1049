package com.skycaster.forecast.gateway;

/**
 * A provider answered but the answer is unusable. Converted into a failed
 * result by the gateway; never leaves this package.
 */
class ProviderResponseException extends RuntimeException {

    ProviderResponseException(String message) {
        super(message);
    }

    ProviderResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
