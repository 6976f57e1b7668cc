package de.netcompliance.infrastructure.resolving;

import java.util.Map;

/**
 * Rendered text plus the variables the template assigned with {@code set} at top level.
 */
public record RenderResult(String text, Map<String, Object> variables) {
}
