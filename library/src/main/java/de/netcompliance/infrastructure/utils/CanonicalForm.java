package de.netcompliance.infrastructure.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import de.netcompliance.core.exception.ComplianceIllegalStateException;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * String form every comparison works on: scalars as-is, trees as deterministic JSON
 * (map keys sorted).
 */
public final class CanonicalForm {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public static String of(final Object value) {
        if (Objects.isNull(value)) return "";
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ComplianceIllegalStateException("Cannot render value of type %s"
                    .formatted(value.getClass().getSimpleName()), e);
        }
    }

    public static boolean isEmpty(final Object value) {
        if (Objects.isNull(value)) return true;
        if (value instanceof CharSequence text) return text.toString().isBlank();
        if (value instanceof Map<?, ?> map) return map.isEmpty();
        if (value instanceof Collection<?> collection) return collection.isEmpty();
        return false;
    }

    /**
     * Entries of a list, keys of a map, one for any other non-empty value.
     */
    public static int size(final Object value) {
        if (value instanceof Map<?, ?> map) return map.size();
        if (value instanceof Collection<?> collection) return collection.size();
        return isEmpty(value) ? 0 : 1;
    }

    private CanonicalForm() {}
}
