package com.skycaster.forecast.dto.response;

import com.skycaster.forecast.domain.WeatherVariable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariableInfo {

    private String variableName;
    private String endpointType;
    private String description;
    private String unit;
    private String dataType;

    public static VariableInfo from(WeatherVariable variable) {
        return VariableInfo.builder()
                .variableName(variable.getName())
                .endpointType(variable.getGroup().getWireName())
                .description(variable.getDescription())
                .unit(variable.getUnit())
                .dataType(variable.getDataType())
                .build();
    }
}
