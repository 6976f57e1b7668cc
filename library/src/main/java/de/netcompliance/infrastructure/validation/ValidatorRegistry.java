package de.netcompliance.infrastructure.validation;

import de.netcompliance.core.exception.ComplianceIllegalStateException;
import de.netcompliance.core.model.Rule;
import de.netcompliance.core.model.Workflow;
import de.netcompliance.infrastructure.resolving.TemplateRenderer;
import de.netcompliance.infrastructure.transform.JsltTransformEngine;
import de.netcompliance.infrastructure.validation.validators.CheckValidator;
import de.netcompliance.infrastructure.validation.validators.RuleValidator;
import de.netcompliance.infrastructure.validation.validators.StepValidator;
import de.netcompliance.infrastructure.validation.validators.WorkflowValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class ValidatorRegistry {

    private final List<Validator<?>> validators;

    public ValidatorRegistry() {
        this(new TemplateRenderer(), new JsltTransformEngine());
    }

    public ValidatorRegistry(final TemplateRenderer renderer, final JsltTransformEngine transformEngine) {
        var stepValidator = new StepValidator(renderer, transformEngine);
        var checkValidator = new CheckValidator();
        // register default validators
        this.validators = new ArrayList<>(List.of(
                new WorkflowValidator(stepValidator),
                stepValidator,
                new RuleValidator(checkValidator),
                checkValidator
        ));
    }

    public void register(final Validator<?> validator) {
        validators.add(0, validator);
    }

    public ValidationResult validate(final Workflow workflow, final ValidationOptions options) {
        return validateObject(workflow, null, options);
    }

    public ValidationResult validate(final Rule rule, final ValidationOptions options) {
        return validateObject(rule, null, options);
    }

    @SuppressWarnings("unchecked")
    private <T, C> ValidationResult validateObject(final T target, final C context, final ValidationOptions options) {
        if (Objects.isNull(target)) {
            var result = ValidationResult.empty();
            result.addError("definition", "must not be empty");
            return result;
        }
        Validator<T> validator = (Validator<T>) findValidatorForObject(target);
        if (Objects.isNull(validator)) {
            throw new ComplianceIllegalStateException("No validator registered for %s"
                    .formatted(target.getClass().getSimpleName()));
        }
        return validator.validate(target, context, options);
    }

    private <T> Validator<?> findValidatorForObject(final T target) {
        for (Validator<?> validator : validators) {
            if (validator.supports(target.getClass())) {
                return validator;
            }
        }
        return null;
    }
}
