package de.netcompliance.infrastructure.validation.validators;

import com.google.common.base.Strings;
import de.netcompliance.core.model.Rule;
import de.netcompliance.infrastructure.validation.ValidationOptions;
import de.netcompliance.infrastructure.validation.ValidationResult;
import de.netcompliance.infrastructure.validation.Validator;

import java.util.Objects;

public class RuleValidator implements Validator<Rule> {

    private final CheckValidator checkValidator;

    public RuleValidator(final CheckValidator checkValidator) {
        this.checkValidator = checkValidator;
    }

    @Override
    public <C> ValidationResult validate(final Rule rule,
                                         final C context,
                                         final ValidationOptions validationOptions) {
        var result = ValidationResult.empty();
        var location = Strings.isNullOrEmpty(rule.getId()) ? "rule" : "rule '%s'".formatted(rule.getId());

        if (Strings.isNullOrEmpty(rule.getId())) result.addMissing(location, "id");
        if (Strings.isNullOrEmpty(rule.getName())) result.addWarning(location, "'name' is not set");
        if (Objects.isNull(rule.getSeverity())) result.addMissing(location, "severity");
        if (validationOptions.isWarnOnEmptyVendorSet() && (Objects.isNull(rule.getVendors()) || rule.getVendors().isEmpty())) {
            result.addWarning(location, "rule applies to every vendor");
        }
        if (Objects.isNull(rule.getChecks()) || rule.getChecks().isEmpty()) {
            result.addError(location, "'checks' at least one check must exist");
        } else {
            rule.getChecks().forEach(check -> result.merge(checkValidator.validate(check, rule, validationOptions)));
        }
        return result;
    }

    @Override
    public boolean supports(final Class<?> clazz) {
        return Rule.class.isAssignableFrom(clazz);
    }
}
