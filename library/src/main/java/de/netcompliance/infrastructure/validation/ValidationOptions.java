package de.netcompliance.infrastructure.validation;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ValidationOptions {
    // compile conditions, templates and transform scripts while validating
    private boolean compileExpressions;
    private boolean warnOnEmptyVendorSet;

    public static ValidationOptions ofDefault() {
        return ValidationOptions.builder()
                .compileExpressions(true)
                .warnOnEmptyVendorSet(false)
                .build();
    }
}
