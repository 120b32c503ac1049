package com.skycaster.forecast.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skycaster.forecast.domain.KeyedPayload;
import com.skycaster.forecast.domain.PositionalPayload;
import com.skycaster.forecast.domain.ProviderPayload;
import com.skycaster.forecast.reconcile.VariableAliases;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shared response handling: {@code data} envelope, {@code Error} field, and
 * list versus keyed shapes. Subclasses declare which fields their provider emits.
 */
@Slf4j
public abstract class AbstractPayloadParser implements ProviderPayloadParser {

    private static final String DATA_ENVELOPE = "data";

    private final ObjectMapper objectMapper;

    protected AbstractPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Fields this provider is known to emit regardless of what was requested.
     */
    protected abstract Set<String> knownFields();

    @Override
    public ProviderPayload parse(JsonNode body, List<String> requestedVariables) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            throw new ProviderResponseException("Empty response body from " + group());
        }

        providerError(body).ifPresent(message -> {
            throw new ProviderResponseException("Skycaster API Error: " + message);
        });

        JsonNode data = body.isObject() && body.has(DATA_ENVELOPE) ? body.get(DATA_ENVELOPE) : body;
        Set<String> accepted = acceptedFields(requestedVariables);

        if (data.isArray()) {
            List<Map<String, Object>> records = new ArrayList<>(data.size());
            for (JsonNode element : data) {
                records.add(toRecord(element, accepted));
            }
            return new PositionalPayload(group(), records);
        }

        if (data.isObject()) {
            Map<String, Map<String, Object>> records = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (entry.getValue().isObject()) {
                    records.put(entry.getKey(), toRecord(entry.getValue(), accepted));
                } else {
                    log.debug("Ignoring non-record field {} in {} response", entry.getKey(), group());
                }
            }
            return new KeyedPayload(group(), records);
        }

        throw new ProviderResponseException("Unexpected " + data.getNodeType() + " response body from " + group());
    }

    /**
     * Provider error message carried in the body, if any.
     */
    static Optional<String> providerError(JsonNode body) {
        if (body != null && body.isObject()) {
            JsonNode error = body.has("Error") ? body.get("Error") : body.get("error");
            if (error != null && !error.isNull()) {
                return Optional.of(error.isTextual() ? error.asText() : error.toString());
            }
        }
        return Optional.empty();
    }

    private Set<String> acceptedFields(List<String> requestedVariables) {
        Set<String> accepted = new HashSet<>(knownFields());
        for (String variable : requestedVariables) {
            accepted.add(variable);
            VariableAliases.aliasFor(variable).ifPresent(accepted::add);
        }
        return Collections.unmodifiableSet(accepted);
    }

    private Map<String, Object> toRecord(JsonNode node, Set<String> accepted) {
        if (node == null || !node.isObject()) {
            return Collections.emptyMap();
        }
        Map<String, Object> record = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (accepted.contains(field.getKey())) {
                record.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
            }
        }
        return record;
    }
}
