package com.example.datadestruction.requests;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Service-layer command for destroying the rows of a set of participants through a protocol.
 * Built once per inbound call and never persisted. Duplicate identifiers are allowed here and
 * collapsed by the service.
 */
public record DestructionServiceRequest(
        String protocol,
        List<String> connectIds,
        String requestId
) {

    public DestructionServiceRequest(String protocol, List<String> connectIds) {
        this(protocol, connectIds, null);
    }

    public DestructionServiceRequest {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(connectIds, "connectIds");
        if (connectIds.contains(null)) {
            throw new IllegalArgumentException("connectIds must not contain null");
        }
        connectIds = List.copyOf(connectIds);

        requestId = (requestId == null || requestId.isBlank()) ? UUID.randomUUID().toString() : requestId;
    }
}
