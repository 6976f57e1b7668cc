package de.netcompliance.core.execution.handler;

import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepType;
import de.netcompliance.core.model.payload.TransformPayload;
import de.netcompliance.infrastructure.resolving.VariableResolver;
import de.netcompliance.infrastructure.transform.JsltTransformEngine;

import java.util.Objects;

/**
 * Applies a JSLT script to the step scope, or to the resolved {@code input} when given.
 */
public class TransformStepHandler implements StepHandler {

    private final VariableResolver resolver;
    private final JsltTransformEngine transformEngine;

    public TransformStepHandler(final VariableResolver resolver, final JsltTransformEngine transformEngine) {
        this.resolver = resolver;
        this.transformEngine = transformEngine;
    }

    @Override
    public StepType type() {
        return StepType.TRANSFORM;
    }

    @Override
    public StepOutcome execute(final Step step, final VariableScope scope, final DeviceContext device) {
        var payload = step.payloadAs(TransformPayload.class);
        var input = Objects.isNull(payload.getInput())
                ? scope.asMap()
                : resolver.resolve(payload.getInput(), scope.asMap());
        return StepOutcome.completed(transformEngine.transform(payload.getScript(), input));
    }
}
