package de.netcompliance.infrastructure.utils;

import com.google.common.primitives.Ints;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Selects nodes of a normalized configuration tree with an XPath-like location path:
 * {@code /ns:system/ssh/server}, {@code /interfaces/interface[name='Gi0/0']/mtu},
 * {@code /configure/router[router-name=Base]}. Namespace prefixes are ignored and lists are
 * traversed implicitly.
 */
public final class TreePath {

    private static final Pattern SEGMENT = Pattern.compile("^(?<name>[^\\[]+)(?<predicates>(\\[[^\\]]*])*)$");
    private static final Pattern PREDICATE = Pattern.compile("\\[([^\\]]*)]");

    public static Optional<Object> select(final Object tree, final String path) {
        if (Objects.isNull(tree)) return Optional.empty();
        List<Object> current = List.of(tree);
        for (String segment : splitSegments(path)) {
            current = step(current, segment);
            if (current.isEmpty()) return Optional.empty();
        }
        return Optional.of(current.size() == 1 ? current.get(0) : current);
    }

    /**
     * Splits on '/' outside of predicates; {@code /a/b[name='x/y']} yields {@code a}, {@code b[name='x/y']}.
     */
    public static List<String> splitSegments(final String path) {
        var segments = new ArrayList<String>();
        if (Objects.isNull(path)) return segments;
        var current = new StringBuilder();
        int depth = 0;
        for (char c : path.toCharArray()) {
            if (c == '[') depth++;
            if (c == ']') depth--;
            if (c == '/' && depth == 0) {
                addSegment(current, segments);
            } else {
                current.append(c);
            }
        }
        addSegment(current, segments);
        return segments;
    }

    public static String localName(final String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        return colon >= 0 ? qualifiedName.substring(colon + 1) : qualifiedName;
    }

    /**
     * Parses the {@code [key='value']} predicates of a segment into key/value pairs.
     * Positional predicates are returned under the key {@code "#"}.
     */
    public static List<Map.Entry<String, String>> predicates(final String segment) {
        var result = new ArrayList<Map.Entry<String, String>>();
        Matcher matcher = PREDICATE.matcher(segment);
        while (matcher.find()) {
            var expression = matcher.group(1).trim();
            int eq = expression.indexOf('=');
            if (eq < 0) {
                result.add(Map.entry("#", expression));
            } else {
                var key = localName(expression.substring(0, eq).trim());
                var value = ResolverUtils.stripQuotes(expression.substring(eq + 1).trim());
                result.add(Map.entry(key, value));
            }
        }
        return result;
    }

    public static String segmentName(final String segment) {
        Matcher matcher = SEGMENT.matcher(segment);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Malformed path segment '%s'".formatted(segment));
        }
        return localName(matcher.group("name").trim());
    }

    private static List<Object> step(final List<Object> nodes, final String segment) {
        var name = segmentName(segment);
        var predicates = predicates(segment);
        var next = new ArrayList<Object>();
        for (Object node : flatten(nodes)) {
            if (!(node instanceof Map<?, ?> map)) continue;
            var child = map.get(name);
            if (Objects.isNull(child)) continue;
            var candidates = child instanceof List<?> list ? new ArrayList<Object>(list) : new ArrayList<>(List.of(child));
            next.addAll(applyPredicates(candidates, predicates));
        }
        return next;
    }

    private static List<Object> applyPredicates(final List<Object> candidates,
                                                final List<Map.Entry<String, String>> predicates) {
        List<Object> filtered = candidates;
        for (Map.Entry<String, String> predicate : predicates) {
            if ("#".equals(predicate.getKey())) {
                Integer position = Ints.tryParse(predicate.getValue());
                if (Objects.isNull(position)) {
                    throw new IllegalArgumentException("Unsupported position predicate [%s]".formatted(predicate.getValue()));
                }
                filtered = position >= 1 && position <= filtered.size() ? List.of(filtered.get(position - 1)) : List.of();
            } else {
                filtered = filtered.stream()
                        .filter(candidate -> candidate instanceof Map<?, ?> entry
                                && predicate.getValue().equals(CanonicalForm.of(entry.get(predicate.getKey()))))
                        .toList();
            }
        }
        return filtered;
    }

    private static List<Object> flatten(final List<Object> nodes) {
        var flat = new ArrayList<Object>();
        for (Object node : nodes) {
            if (node instanceof List<?> list) {
                flat.addAll(list);
            } else {
                flat.add(node);
            }
        }
        return flat;
    }

    private static void addSegment(final StringBuilder current, final List<String> segments) {
        var segment = current.toString().trim();
        if (!segment.isEmpty()) segments.add(segment);
        current.setLength(0);
    }

    private TreePath() {}
}
