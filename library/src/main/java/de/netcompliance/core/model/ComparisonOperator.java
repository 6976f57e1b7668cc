package de.netcompliance.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ComparisonOperator {
    EXISTS("exists", false),
    NOT_EXISTS("not_exists", false),
    CONTAINS("contains", true),
    NOT_CONTAINS("not_contains", true),
    EQUALS("equals", true),
    REGEX("regex", true),
    COUNT("count", true);

    @JsonValue
    private final String value;
    private final boolean expectedRequired;

    @JsonCreator
    public static ComparisonOperator of(final String value) {
        for (ComparisonOperator candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        // older rule sets use the short "exact" spelling
        if ("exact".equalsIgnoreCase(value)) return EQUALS;
        throw new IllegalArgumentException("Unknown comparison operator '%s'".formatted(value));
    }
}
