package com.example.datadestruction.service;

import com.example.datadestruction.models.Protocol;
import com.example.datadestruction.models.ProtocolConfig;
import java.util.Arrays;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Read-only lookup from protocol name to deletion target, backed by {@link Protocol}.
 */
@Component
public class TargetRegistry {

    private final List<String> allowedProtocols = Arrays.stream(Protocol.values())
            .map(p -> p.config().name())
            .sorted()
            .toList();

    public ProtocolConfig resolve(String protocol) {
        return Protocol.fromName(protocol)
                .map(Protocol::config)
                .orElseThrow(() -> DataDestructionException.protocolNotSupported(protocol, allowedProtocols));
    }

    /**
     * Registered protocol names, sorted ascending.
     */
    public List<String> allowedProtocols() {
        return allowedProtocols;
    }
}
