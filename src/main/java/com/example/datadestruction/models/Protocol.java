package com.example.datadestruction.models;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of destruction protocols callers may name. Requests can only select a target
 * through one of these entries, never by raw dataset/table coordinates. Adding a protocol means
 * adding a constant here.
 */
public enum Protocol {

    ROI_PHYSICAL_ACTIVITY(new ProtocolConfig(
            "roi_physical_activity", "ForTestingOnly", "physical_activity", "Connect_ID"));

    private final ProtocolConfig config;

    Protocol(ProtocolConfig config) {
        this.config = config;
    }

    public ProtocolConfig config() {
        return config;
    }

    public static Optional<Protocol> fromName(String name) {
        return Arrays.stream(values())
                .filter(p -> p.config.name().equals(name))
                .findFirst();
    }
}
