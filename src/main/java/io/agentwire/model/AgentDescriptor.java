package io.agentwire.model;

import java.util.List;

/**
 * Discovery record served from {@code GET /info}. Built once at agent startup and never
 * mutated afterwards.
 */
public record AgentDescriptor(
        String agentId,
        String name,
        String description,
        String endpoint,
        List<Capability> capabilities,
        String framework,
        String modelProvider,
        String status
) {
    public static final String DEFAULT_STATUS = "active";

    public AgentDescriptor {
        Payloads.requireText(agentId, "agent_id");
        Payloads.requireText(endpoint, "endpoint");
        name = name == null ? agentId : name;
        description = description == null ? "" : description;
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        framework = framework == null ? "" : framework;
        modelProvider = modelProvider == null ? "" : modelProvider;
        status = status == null || status.isBlank() ? DEFAULT_STATUS : status;
    }

    public AgentDescriptor(
            String agentId,
            String name,
            String description,
            String endpoint,
            List<Capability> capabilities,
            String framework,
            String modelProvider
    ) {
        this(agentId, name, description, endpoint, capabilities, framework, modelProvider, DEFAULT_STATUS);
    }
}
