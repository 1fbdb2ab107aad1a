package com.example.datadestruction.requests;

import com.example.datadestruction.service.DataDestructionException;
import com.example.datadestruction.service.TargetRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Checks the shape of a raw destruction request body and turns it into a
 * {@link DestructionServiceRequest}. Works on the JSON tree rather than a bound record so that
 * non-string identifiers are rejected instead of being coerced.
 *
 * Rules apply in order and the first failure wins: the body must be an object, {@code protocol}
 * must be a non-empty string naming a registered protocol, {@code connect_ids} must be an array
 * of strings. An unregistered protocol is reported whatever {@code connect_ids} holds. An empty
 * array is valid. Identifiers are kept exactly as supplied.
 */
@Component
public class DestructionRequestValidator {

    static final String PROTOCOL_FIELD = "protocol";
    static final String CONNECT_IDS_FIELD = "connect_ids";

    private final TargetRegistry targetRegistry;

    public DestructionRequestValidator(TargetRegistry targetRegistry) {
        this.targetRegistry = targetRegistry;
    }

    public DestructionServiceRequest validate(JsonNode body, String requestId) {
        if (body == null || !body.isObject()) {
            throw DataDestructionException.malformedBody();
        }

        JsonNode protocol = body.get(PROTOCOL_FIELD);
        if (protocol == null || !protocol.isTextual() || protocol.textValue().isEmpty()) {
            throw DataDestructionException.invalidProtocolParameter();
        }
        targetRegistry.resolve(protocol.textValue());

        JsonNode ids = body.get(CONNECT_IDS_FIELD);
        if (ids == null || !ids.isArray()) {
            throw DataDestructionException.invalidConnectIds();
        }
        List<String> connectIds = new ArrayList<>(ids.size());
        for (JsonNode id : ids) {
            if (!id.isTextual()) {
                throw DataDestructionException.invalidConnectIds();
            }
            connectIds.add(id.textValue());
        }

        return new DestructionServiceRequest(protocol.textValue(), connectIds, requestId);
    }
}
