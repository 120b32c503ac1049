package com.skycaster.forecast.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Identity and preferences of the caller, resolved upstream by the API gateway.
 * Every field is optional.
 */
@Value
@Builder
public class CallerContext {

    String userId;
    String apiKeyId;
    SubscriptionTier subscriptionTier;
    String preferredCurrency;
    String countryCode;
    String clientIp;
    String userAgent;

    public static CallerContext anonymous() {
        return CallerContext.builder().build();
    }
}
