package com.skycaster.forecast.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "skycaster.ledger")
public class LedgerProperties {

    private boolean kafkaEnabled = false;
    private String topic = "weather-request-events";
}
