package de.netcompliance.core.execution.handler;

import de.netcompliance.core.exception.ExpressionException;
import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepType;
import de.netcompliance.core.model.payload.TransformPayload;
import de.netcompliance.infrastructure.resolving.TemplateRenderer;
import de.netcompliance.infrastructure.resolving.VariableResolver;
import de.netcompliance.infrastructure.transform.JsltTransformEngine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransformStepHandlerTest {

    private final TransformStepHandler handler = new TransformStepHandler(
            new VariableResolver(new TemplateRenderer()), new JsltTransformEngine());

    private final DeviceContext context = new DeviceContext("exec-1", "inventory", null, () -> null);

    private static Step transform(final String script, final Object input) {
        return Step.builder()
                .name("summarize")
                .type(StepType.TRANSFORM)
                .payload(TransformPayload.builder().script(script).input(input).build())
                .build();
    }

    @Test
    void testTransformsWholeScopeWithoutInput() {
        // given
        final VariableScope scope = VariableScope.of(Map.of("facts", Map.of("interfaces", List.of("Gi0/0", "Gi0/1"))));

        // when
        final StepOutcome outcome = handler.execute(transform("{\"count\": size(.facts.interfaces)}", null), scope, context);

        // then
        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.getOutput()).isEqualTo(Map.of("count", 2L));
    }

    @Test
    void testTransformsResolvedInput() {
        // given
        final VariableScope scope = VariableScope.of(Map.of("facts", Map.of("hostname", "edge-01", "site", "fra")));

        // when
        final StepOutcome outcome = handler.execute(transform(".hostname", "{{ facts }}"), scope, context);

        // then
        assertThat(outcome.getOutput()).isEqualTo("edge-01");
    }

    @Test
    void testInvalidScriptIsAnExpressionFailure() {
        // when / then
        assertThatThrownBy(() -> handler.execute(transform("{\"a\": ", null), VariableScope.empty(), context))
                .isInstanceOf(ExpressionException.class);
    }
}
