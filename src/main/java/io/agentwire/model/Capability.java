package io.agentwire.model;

import java.util.Map;

/**
 * Named operation an agent exposes. Both schemas are descriptive metadata; nothing in the
 * transport validates payloads against them.
 */
public record Capability(
        String name,
        String description,
        Map<String, Object> inputSchema,
        Map<String, Object> outputSchema
) {
    public Capability {
        Payloads.requireText(name, "capability name");
        description = description == null ? "" : description;
        inputSchema = Payloads.freeze(inputSchema == null ? Map.of() : inputSchema);
        outputSchema = Payloads.freeze(outputSchema == null ? Map.of() : outputSchema);
    }
}
