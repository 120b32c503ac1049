package com.skycaster.forecast.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class WeatherVariable {

    String name;
    ProviderGroup group;
    String unit;
    @Builder.Default
    String dataType = "float";
    String description;
    @Builder.Default
    boolean active = true;
}
