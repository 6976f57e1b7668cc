package de.netcompliance.infrastructure.parsing;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class WorkflowParseOptions {

    private final boolean allowEmptyStrings;
    // run the validator registry on the parsed workflow
    private final boolean mustValidate;
    // unknown keys become errors instead of warnings
    private final boolean strict;

    public static WorkflowParseOptions ofDefault() {
        return WorkflowParseOptions.builder()
                .allowEmptyStrings(false)
                .mustValidate(true)
                .strict(false)
                .build();
    }
}
