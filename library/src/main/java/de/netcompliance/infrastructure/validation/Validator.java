package de.netcompliance.infrastructure.validation;

public interface Validator<T> {

    <C> ValidationResult validate(
            final T target,
            final C context,
            final ValidationOptions validationOptions);

    boolean supports(final Class<?> clazz);
}
