package de.netcompliance.infrastructure.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class ResolverUtils {

    /**
     * Looks up {@code a.b[0].c} style paths in nested maps and lists.
     * Returns {@code null} for any segment that does not resolve.
     */
    public static Object getNestedValue(final Object root, final String keyPath) {
        if (Objects.isNull(keyPath) || keyPath.isBlank()) return root;
        Object current = root;
        for (Object key : splitKeyPath(keyPath)) {
            current = getChild(current, key);
            if (Objects.isNull(current)) return null;
        }
        return current;
    }

    public static Object getChild(final Object parent, final Object key) {
        if (parent instanceof Map<?, ?> map) {
            return map.get(key.toString());
        }
        if (parent instanceof List<?> list && key instanceof Integer index) {
            int effectiveIndex = index < 0 ? list.size() + index : index;
            return effectiveIndex >= 0 && effectiveIndex < list.size() ? list.get(effectiveIndex) : null;
        }
        return null;
    }

    /**
     * Splits {@code a.b[0]['c.d']} into {@code ["a", "b", 0, "c.d"]}.
     */
    public static List<Object> splitKeyPath(final String keyPath) {
        var keys = new ArrayList<Object>();
        var current = new StringBuilder();
        int i = 0;
        while (i < keyPath.length()) {
            char c = keyPath.charAt(i);
            if (c == '.') {
                flush(current, keys);
                i++;
            } else if (c == '[') {
                flush(current, keys);
                int end = keyPath.indexOf(']', i);
                if (end < 0) throw new IllegalArgumentException("Unclosed '[' in '%s'".formatted(keyPath));
                var inner = keyPath.substring(i + 1, end).trim();
                if (inner.matches("-?\\d+")) {
                    keys.add(Integer.parseInt(inner));
                } else {
                    keys.add(stripQuotes(inner));
                }
                i = end + 1;
            } else {
                current.append(c);
                i++;
            }
        }
        flush(current, keys);
        return keys;
    }

    public static String stripQuotes(final String value) {
        if (value.length() >= 2
                && ((value.startsWith("'") && value.endsWith("'")) || (value.startsWith("\"") && value.endsWith("\"")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static void flush(final StringBuilder current, final List<Object> keys) {
        if (!current.isEmpty()) {
            keys.add(current.toString());
            current.setLength(0);
        }
    }

    private ResolverUtils() {}
}
