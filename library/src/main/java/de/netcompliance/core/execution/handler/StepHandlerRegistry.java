package de.netcompliance.core.execution.handler;

import de.netcompliance.core.exception.ComplianceIllegalStateException;
import de.netcompliance.core.model.StepType;
import de.netcompliance.infrastructure.resolving.TemplateRenderer;
import de.netcompliance.infrastructure.resolving.VariableResolver;
import de.netcompliance.infrastructure.transform.JsltTransformEngine;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class StepHandlerRegistry {

    private final Map<StepType, StepHandler> handlers = new EnumMap<>(StepType.class);

    public StepHandlerRegistry(final List<StepHandler> handlers) {
        handlers.forEach(this::register);
    }

    /**
     * Registry with a handler for every step type.
     */
    public static StepHandlerRegistry ofDefault(final NotificationDispatcher notificationDispatcher) {
        var renderer = new TemplateRenderer();
        var resolver = new VariableResolver(renderer);
        return new StepHandlerRegistry(List.of(
                new QueryStepHandler(resolver),
                new TemplateStepHandler(renderer, resolver),
                new AuditStepHandler(resolver),
                new RemediateStepHandler(resolver),
                new TransformStepHandler(resolver, new JsltTransformEngine()),
                new ApiCallStepHandler(resolver),
                new NotificationStepHandler(resolver, notificationDispatcher)
        ));
    }

    public void register(final StepHandler handler) {
        handlers.put(handler.type(), handler);
    }

    public StepHandler find(final StepType type) {
        var handler = handlers.get(type);
        if (Objects.isNull(handler)) {
            throw new ComplianceIllegalStateException("No handler registered for step type '%s'".formatted(type));
        }
        return handler;
    }
}
