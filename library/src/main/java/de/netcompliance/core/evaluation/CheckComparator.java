package de.netcompliance.core.evaluation;

import de.netcompliance.core.model.ComparisonOperator;
import de.netcompliance.infrastructure.utils.CanonicalForm;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Compares a fetched value against a check's expectation on the value's canonical string form.
 */
public class CheckComparator {

    public boolean matches(final ComparisonOperator operator, final Object actual, final String expected) {
        var canonical = CanonicalForm.of(actual);
        return switch (operator) {
            case EXISTS -> !CanonicalForm.isEmpty(actual);
            case NOT_EXISTS -> CanonicalForm.isEmpty(actual);
            case CONTAINS -> canonical.contains(requireExpected(operator, expected));
            case NOT_CONTAINS -> !canonical.contains(requireExpected(operator, expected));
            case EQUALS -> canonical.trim().equals(requireExpected(operator, expected).trim());
            case REGEX -> Pattern.compile(requireExpected(operator, expected), Pattern.CASE_INSENSITIVE | Pattern.MULTILINE)
                    .matcher(canonical)
                    .find();
            case COUNT -> CanonicalForm.size(actual) >= Integer.parseInt(requireExpected(operator, expected).trim());
        };
    }

    private String requireExpected(final ComparisonOperator operator, final String expected) {
        if (Objects.isNull(expected)) {
            throw new IllegalArgumentException("Operator '%s' needs an expected value".formatted(operator.getValue()));
        }
        return expected;
    }
}
