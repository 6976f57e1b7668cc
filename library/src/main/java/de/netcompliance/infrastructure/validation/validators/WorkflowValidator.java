package de.netcompliance.infrastructure.validation.validators;

import com.google.common.base.Strings;
import de.netcompliance.core.execution.DependencyGraph;
import de.netcompliance.core.model.ExecutionMode;
import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.Workflow;
import de.netcompliance.infrastructure.validation.ValidationOptions;
import de.netcompliance.infrastructure.validation.ValidationResult;
import de.netcompliance.infrastructure.validation.Validator;

import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

public class WorkflowValidator implements Validator<Workflow> {

    private static final String LOCATION = "workflow";

    private final StepValidator stepValidator;

    public WorkflowValidator(final StepValidator stepValidator) {
        this.stepValidator = stepValidator;
    }

    @Override
    public <C> ValidationResult validate(final Workflow workflow,
                                         final C context,
                                         final ValidationOptions validationOptions) {
        var result = ValidationResult.empty();

        if (Strings.isNullOrEmpty(workflow.getName())) {
            result.addMissing(LOCATION, "name");
        } else if (!isRecommendedNameFormat(workflow.getName())) {
            result.addWarning(LOCATION, "name '%s' does not comply to [A-Za-z0-9_\\-]+".formatted(workflow.getName()));
        }
        var location = Strings.isNullOrEmpty(workflow.getName()) ? LOCATION : "workflow '%s'".formatted(workflow.getName());

        if (Objects.isNull(workflow.getSteps()) || workflow.getSteps().isEmpty()) {
            result.addError(location, "'steps' at least one step must exist");
            return result;
        }

        var nameCounts = workflow.getSteps().stream()
                .map(Step::getName)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
        nameCounts.forEach((name, count) -> {
            if (count > 1) result.addError(location, "step name '%s' is not unique".formatted(name));
        });

        workflow.getSteps().forEach(step -> result.merge(stepValidator.validate(step, workflow, validationOptions)));

        var graph = DependencyGraph.of(workflow.getSteps());
        graph.unknownDependencies().forEach((step, unknown) -> unknown.forEach(dependency ->
                result.addError(location, "step '%s' depends on unknown step '%s'".formatted(step, dependency))));
        workflow.getSteps().stream()
                .filter(step -> Objects.nonNull(step.getDependsOn()) && step.getDependsOn().contains(step.getName()))
                .forEach(step -> result.addError(location, "step '%s' depends on itself".formatted(step.getName())));
        graph.findCycle()
                .filter(cycle -> cycle.size() > 2)
                .ifPresent(cycle -> result.addError(location, "dependency cycle: %s".formatted(String.join(" -> ", cycle))));

        if (workflow.getExecutionMode() == ExecutionMode.SEQUENTIAL
                && workflow.getSteps().stream().anyMatch(step -> Objects.nonNull(step.getDependsOn()) && !step.getDependsOn().isEmpty())) {
            result.addWarning(location, "'depends_on' is ignored in sequential mode");
        }

        if (Objects.nonNull(workflow.getSettings())
                && Objects.nonNull(workflow.getSettings().getMaxParallel())
                && workflow.getSettings().getMaxParallel() < 1) {
            result.addError(location, "'settings.max_parallel' must be at least 1");
        }

        return result;
    }

    @Override
    public boolean supports(final Class<?> clazz) {
        return Workflow.class.isAssignableFrom(clazz);
    }

    private boolean isRecommendedNameFormat(final String name) {
        return name.matches("^[A-Za-z0-9_\\-]+$");
    }
}
