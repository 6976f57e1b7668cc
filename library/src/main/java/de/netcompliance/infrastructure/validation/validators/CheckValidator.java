package de.netcompliance.infrastructure.validation.validators;

import com.google.common.base.Strings;
import de.netcompliance.core.model.Check;
import de.netcompliance.core.model.ComparisonOperator;
import de.netcompliance.core.model.Rule;
import de.netcompliance.infrastructure.validation.ValidationOptions;
import de.netcompliance.infrastructure.validation.ValidationResult;
import de.netcompliance.infrastructure.validation.Validator;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class CheckValidator implements Validator<Check> {

    @Override
    public <C> ValidationResult validate(final Check check,
                                         final C context,
                                         final ValidationOptions validationOptions) {
        var result = ValidationResult.empty();
        var ruleId = context instanceof Rule rule ? rule.getId() : null;
        var checkName = Strings.isNullOrEmpty(check.getName()) ? "<unnamed>" : check.getName();
        var location = Objects.isNull(ruleId) ? "check '%s'".formatted(checkName) : "rule '%s' check '%s'".formatted(ruleId, checkName);

        if (Strings.isNullOrEmpty(check.getName())) result.addMissing(location, "name");
        if (Strings.isNullOrEmpty(check.getXpath()) && Strings.isNullOrEmpty(check.getFilterXml())
                && Strings.isNullOrEmpty(check.getPath())) {
            result.addError(location, "needs 'xpath', 'filter_xml' or 'path'");
        }
        var operator = check.getOperator();
        if (Objects.isNull(operator)) {
            result.addMissing(location, "operator");
            return result;
        }
        if (operator.isExpectedRequired() && Objects.isNull(check.getExpected())) {
            result.addMissing(location, "expected");
            return result;
        }
        if (operator == ComparisonOperator.REGEX) {
            try {
                Pattern.compile(check.getExpected());
            } catch (PatternSyntaxException e) {
                result.addError(location, "'expected' is not a valid regular expression: " + e.getDescription());
            }
        }
        if (operator == ComparisonOperator.COUNT) {
            try {
                Integer.parseInt(check.getExpected().trim());
            } catch (NumberFormatException e) {
                result.addError(location, "'expected' must be an integer for 'count'");
            }
        }
        return result;
    }

    @Override
    public boolean supports(final Class<?> clazz) {
        return Check.class.isAssignableFrom(clazz);
    }
}
