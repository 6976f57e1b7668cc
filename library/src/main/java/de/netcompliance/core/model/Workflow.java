package de.netcompliance.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class Workflow {
    private String name;
    private String description;
    @Builder.Default
    private ExecutionMode executionMode = ExecutionMode.SEQUENTIAL;
    @Builder.Default
    private Map<String, Object> variables = new LinkedHashMap<>();
    @Builder.Default
    private WorkflowSettings settings = new WorkflowSettings();
    @Builder.Default
    private List<Step> steps = new ArrayList<>();

    public Optional<Step> findStep(final String stepName) {
        return steps.stream()
                .filter(step -> step.getName().equals(stepName))
                .findFirst();
    }
}
