package de.netcompliance.infrastructure.parsing;

import de.netcompliance.core.model.Workflow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowParseResult {
    private boolean invalid;
    @Builder.Default
    private List<String> messages = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    private Workflow workflow;

    public static WorkflowParseResult ofError(final String errorMessage) {
        return WorkflowParseResult.builder()
                .workflow(null)
                .messages(Collections.singletonList(errorMessage))
                .invalid(true)
                .build();
    }
}
