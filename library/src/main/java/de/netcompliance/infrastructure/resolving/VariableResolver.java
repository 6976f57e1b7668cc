package de.netcompliance.infrastructure.resolving;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Resolves templated values inside step payloads. A string consisting of exactly one
 * {@code {{ expr }}} keeps the type of the evaluated value; any other templated string is rendered
 * as text. Maps and lists are resolved element by element.
 */
public class VariableResolver {

    private static final Pattern SINGLE_EXPRESSION = Pattern.compile("^\\{\\{-?(.*?)-?}}$", Pattern.DOTALL);

    private final TemplateRenderer renderer;

    public VariableResolver(final TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    public Object resolve(final Object value, final Map<String, Object> scope) {
        if (Objects.isNull(value)) return null;
        if (value instanceof String text) return resolveString(text, scope);
        if (value instanceof Map<?, ?> map) {
            var resolved = new LinkedHashMap<String, Object>();
            map.forEach((key, entry) -> resolved.put(String.valueOf(key), resolve(entry, scope)));
            return resolved;
        }
        if (value instanceof Collection<?> collection) {
            var resolved = new ArrayList<>(collection.size());
            collection.forEach(entry -> resolved.add(resolve(entry, scope)));
            return resolved;
        }
        return value;
    }

    public String resolveText(final String text, final Map<String, Object> scope) {
        if (!TemplateRenderer.isTemplated(text)) return text;
        return renderer.render(text, scope).text();
    }

    private Object resolveString(final String text, final Map<String, Object> scope) {
        if (!TemplateRenderer.isTemplated(text)) return text;
        var trimmed = text.trim();
        var matcher = SINGLE_EXPRESSION.matcher(trimmed);
        if (matcher.matches() && !matcher.group(1).contains("{{") && !matcher.group(1).contains("}}")) {
            return ExpressionParser.parse(matcher.group(1)).evaluate(scope);
        }
        return renderer.render(text, scope).text();
    }
}
