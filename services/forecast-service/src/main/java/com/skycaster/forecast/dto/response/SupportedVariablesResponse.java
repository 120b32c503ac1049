package com.skycaster.forecast.dto.response;

import com.skycaster.forecast.catalog.VariableCatalog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SupportedVariablesResponse {

    private List<VariableInfo> variables;
    private Map<String, List<String>> endpoints;
    private int totalVariables;

    public static SupportedVariablesResponse from(VariableCatalog catalog) {
        Map<String, List<String>> endpoints = new LinkedHashMap<>();
        catalog.variablesByGroup().forEach((group, names) -> endpoints.put(group.getWireName(), names));

        List<VariableInfo> variables = catalog.describe().stream().map(VariableInfo::from).toList();
        return SupportedVariablesResponse.builder()
                .variables(variables)
                .endpoints(endpoints)
                .totalVariables(variables.size())
                .build();
    }
}
