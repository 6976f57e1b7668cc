package de.netcompliance.core.execution.handler;

import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import de.netcompliance.core.evaluation.CheckComparator;
import de.netcompliance.core.model.ComparisonOperator;
import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepType;
import de.netcompliance.core.model.payload.AuditPayload;
import de.netcompliance.infrastructure.resolving.VariableResolver;
import de.netcompliance.infrastructure.utils.CanonicalForm;
import de.netcompliance.infrastructure.utils.ResolverUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compares two values from the scope with the rule comparison operators. With {@code fields} the
 * comparison runs per field and the step reports the share of matching fields; fields starting
 * with {@code $} are JsonPath expressions, others dotted paths.
 */
public class AuditStepHandler implements StepHandler {

    private final VariableResolver resolver;
    private final CheckComparator comparator;

    public AuditStepHandler(final VariableResolver resolver) {
        this(resolver, new CheckComparator());
    }

    public AuditStepHandler(final VariableResolver resolver, final CheckComparator comparator) {
        this.resolver = resolver;
        this.comparator = comparator;
    }

    @Override
    public StepType type() {
        return StepType.AUDIT;
    }

    @Override
    public StepOutcome execute(final Step step, final VariableScope scope, final DeviceContext device) {
        var payload = step.payloadAs(AuditPayload.class);
        var operator = Objects.requireNonNullElse(payload.getOperator(), ComparisonOperator.EQUALS);
        var expected = resolver.resolve(payload.getCompare().getExpected(), scope.asMap());
        var actual = resolver.resolve(payload.getCompare().getActual(), scope.asMap());

        int matched = 0;
        int total;
        List<String> mismatched = new ArrayList<>();
        if (Objects.isNull(payload.getFields()) || payload.getFields().isEmpty()) {
            total = 1;
            if (compare(operator, actual, expected)) {
                matched = 1;
            } else {
                mismatched.add("value");
            }
        } else {
            total = payload.getFields().size();
            for (String field : payload.getFields()) {
                if (compare(operator, lookup(actual, field), lookup(expected, field))) {
                    matched++;
                } else {
                    mismatched.add(field);
                }
            }
        }

        var compliance = BigDecimal.valueOf(matched * 100L)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                .doubleValue();
        var passed = compliance >= payload.getPassThreshold();

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("passed", passed);
        output.put("compliance", compliance);
        output.put("matched", matched);
        output.put("total", total);
        output.put("mismatched_fields", mismatched);
        output.put("expected", expected);
        output.put("actual", actual);

        var message = "%s of %s compared values match (%.2f%%)".formatted(matched, total, compliance);
        if (!passed && payload.isFailOnMismatch()) {
            return StepOutcome.failed("Audit failed: " + message, false, output);
        }
        return StepOutcome.completed(output, message);
    }

    private boolean compare(final ComparisonOperator operator, final Object actual, final Object expected) {
        if (operator.isExpectedRequired() && Objects.isNull(expected)) return false;
        return comparator.matches(operator, actual, Objects.isNull(expected) ? null : CanonicalForm.of(expected));
    }

    private Object lookup(final Object root, final String field) {
        if (Objects.isNull(root)) return null;
        if (field.startsWith("$")) {
            try {
                return JsonPath.read(root, field);
            } catch (PathNotFoundException e) {
                return null;
            }
        }
        return ResolverUtils.getNestedValue(root, field);
    }
}
