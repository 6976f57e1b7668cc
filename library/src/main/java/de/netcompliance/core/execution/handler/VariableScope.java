package de.netcompliance.core.execution.handler;

import de.netcompliance.infrastructure.utils.ResolverUtils;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view of the variables a step observes.
 */
public final class VariableScope {

    private final Map<String, Object> variables;

    private VariableScope(final Map<String, Object> variables) {
        this.variables = Collections.unmodifiableMap(variables);
    }

    public static VariableScope of(final Map<String, Object> variables) {
        return new VariableScope(new HashMap<>(Objects.isNull(variables) ? Map.of() : variables));
    }

    public static VariableScope empty() {
        return of(Map.of());
    }

    public Map<String, Object> asMap() {
        return variables;
    }

    public Object get(final String name) {
        return variables.get(name);
    }

    /**
     * Dotted lookup such as {@code device.hostname} or {@code step1.items[0]}.
     */
    public Object lookup(final String keyPath) {
        return ResolverUtils.getNestedValue(variables, keyPath);
    }

    public VariableScope with(final Map<String, Object> additions) {
        var merged = new HashMap<>(variables);
        merged.putAll(additions);
        return new VariableScope(merged);
    }

    @Override
    public String toString() {
        return "VariableScope" + variables.keySet();
    }
}
