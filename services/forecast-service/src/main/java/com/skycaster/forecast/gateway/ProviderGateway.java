package com.skycaster.forecast.gateway;

import com.skycaster.forecast.domain.ProviderGroup;
import com.skycaster.forecast.domain.ProviderResult;
import com.skycaster.forecast.domain.ProviderSubRequest;

/**
 * Performs one call to one upstream provider group.
 * Remote failures (non-2xx, timeout, malformed body, provider error field) are
 * reported as a failed {@link ProviderResult}, never thrown.
 */
public interface ProviderGateway {

    ProviderResult call(ProviderSubRequest request);

    /**
     * Whether this gateway can reach the given group at all. A group that is
     * not supported is a deployment error rather than a remote failure.
     */
    default boolean supports(ProviderGroup group) {
        return true;
    }
}
