package de.netcompliance.core.execution.handler;

import com.google.common.base.Strings;
import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepType;
import de.netcompliance.core.model.payload.TemplatePayload;
import de.netcompliance.infrastructure.resolving.TemplateRenderer;
import de.netcompliance.infrastructure.resolving.VariableResolver;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public class TemplateStepHandler implements StepHandler {

    private final TemplateRenderer renderer;
    private final VariableResolver resolver;

    public TemplateStepHandler(final TemplateRenderer renderer, final VariableResolver resolver) {
        this.renderer = renderer;
        this.resolver = resolver;
    }

    @Override
    public StepType type() {
        return StepType.TEMPLATE;
    }

    @Override
    public StepOutcome execute(final Step step, final VariableScope scope, final DeviceContext device) {
        var payload = step.payloadAs(TemplatePayload.class);
        var specific = device.vendorTag().map(tag -> payload.getVendorSpecific().get(tag)).orElse(null);

        var template = payload.getTemplate();
        var format = payload.getFormat();
        if (Objects.nonNull(specific)) {
            if (!Strings.isNullOrEmpty(specific.getTemplate())) template = specific.getTemplate();
            if (!Strings.isNullOrEmpty(specific.getFormat())) format = specific.getFormat();
        }
        if (Strings.isNullOrEmpty(template)) {
            return StepOutcome.failed("No template for vendor '%s'".formatted(device.vendorTag().orElse("-")), false);
        }

        var renderScope = new HashMap<>(scope.asMap());
        if (Objects.nonNull(payload.getTemplateVars())) {
            payload.getTemplateVars().forEach((name, value) -> renderScope.put(name, resolver.resolve(value, scope.asMap())));
        }
        var rendered = renderer.render(template, renderScope);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("rendered_config", rendered.text());
        output.put("format", Objects.requireNonNullElse(format, "text"));
        rendered.variables().forEach(output::putIfAbsent);
        return StepOutcome.completed(output);
    }
}
