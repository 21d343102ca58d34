package me.golemcore.calhelper.domain.model;

import me.golemcore.calhelper.domain.component.CapabilityComponent;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable registry entry: the advertised definition plus the executor behind
 * it.
 */
public record CapabilityDescriptor(String name, CapabilityDefinition definition, CapabilityComponent executor) {

    public CapabilityDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(executor, "executor");
    }

    public Map<String, Object> inputSchema() {
        return definition.getInputSchema();
    }

    public static CapabilityDescriptor of(CapabilityComponent component) {
        CapabilityDefinition definition = component.getDefinition();
        return new CapabilityDescriptor(definition.getName(), definition, component);
    }
}
