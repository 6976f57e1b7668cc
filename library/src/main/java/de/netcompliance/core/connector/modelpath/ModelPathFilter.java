package de.netcompliance.core.connector.modelpath;

import de.netcompliance.infrastructure.utils.CanonicalForm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Narrows a subtree already selected by a model path.
 * <ul>
 *     <li>no filter, or an empty one: the whole subtree</li>
 *     <li>{@code key: {}} or {@code key: ""}: keep {@code key} if present</li>
 *     <li>{@code key: {nested}}: keep {@code key}, narrowed by the nested filter</li>
 *     <li>{@code key: value}: keep the node only if {@code key} equals {@code value}; list entries
 *     that do not match are dropped</li>
 * </ul>
 * Nothing left after narrowing means not found.
 */
public final class ModelPathFilter {

    public static Optional<Object> apply(final Object subtree, final Map<String, Object> filter) {
        if (Objects.isNull(filter) || filter.isEmpty()) return Optional.ofNullable(subtree);
        return narrow(subtree, filter);
    }

    private static Optional<Object> narrow(final Object node, final Map<String, Object> filter) {
        if (node instanceof List<?> list) {
            var kept = new ArrayList<>();
            list.forEach(entry -> narrow(entry, filter).ifPresent(kept::add));
            return kept.isEmpty() ? Optional.empty() : Optional.of(kept);
        }
        if (!(node instanceof Map<?, ?> map)) return Optional.empty();

        for (Map.Entry<String, Object> criterion : filter.entrySet()) {
            if (isContentMatch(criterion.getValue())
                    && !CanonicalForm.of(criterion.getValue()).equals(CanonicalForm.of(map.get(criterion.getKey())))) {
                return Optional.empty();
            }
        }

        var result = new LinkedHashMap<String, Object>();
        for (Map.Entry<String, Object> criterion : filter.entrySet()) {
            if (!map.containsKey(criterion.getKey())) continue;
            var child = map.get(criterion.getKey());
            if (criterion.getValue() instanceof Map<?, ?> nested && !nested.isEmpty()) {
                narrow(child, asFilter(nested)).ifPresent(narrowed -> result.put(criterion.getKey(), narrowed));
            } else {
                result.put(criterion.getKey(), child);
            }
        }
        return result.isEmpty() ? Optional.empty() : Optional.of(result);
    }

    private static boolean isContentMatch(final Object criterion) {
        if (Objects.isNull(criterion)) return false;
        if (criterion instanceof Map<?, ?>) return false;
        return !(criterion instanceof String text && text.isEmpty());
    }

    private static Map<String, Object> asFilter(final Map<?, ?> nested) {
        var filter = new LinkedHashMap<String, Object>();
        nested.forEach((key, value) -> filter.put(key.toString(), value));
        return filter;
    }

    private ModelPathFilter() {}
}
