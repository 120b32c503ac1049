package com.skycaster.forecast.exception;

import com.skycaster.common.exception.BusinessException;
import com.skycaster.common.exception.ErrorCode;

/**
 * Programmer or deployment error, e.g. a provider group with no configured endpoint.
 */
public class ProviderConfigurationException extends BusinessException {

    public ProviderConfigurationException(String message) {
        super(ErrorCode.SYS_CONFIGURATION_ERROR, message);
    }
}
