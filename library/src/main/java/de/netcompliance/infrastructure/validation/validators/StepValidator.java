package de.netcompliance.infrastructure.validation.validators;

import com.google.common.base.Strings;
import de.netcompliance.core.exception.ExpressionException;
import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.payload.ApiCallPayload;
import de.netcompliance.core.model.payload.AuditPayload;
import de.netcompliance.core.model.payload.NotificationPayload;
import de.netcompliance.core.model.payload.QueryPayload;
import de.netcompliance.core.model.payload.RemediatePayload;
import de.netcompliance.core.model.payload.TemplatePayload;
import de.netcompliance.core.model.payload.TransformPayload;
import de.netcompliance.infrastructure.resolving.ExpressionParser;
import de.netcompliance.infrastructure.resolving.TemplateRenderer;
import de.netcompliance.infrastructure.transform.JsltTransformEngine;
import de.netcompliance.infrastructure.validation.ValidationOptions;
import de.netcompliance.infrastructure.validation.ValidationResult;
import de.netcompliance.infrastructure.validation.Validator;

import java.util.Objects;
import java.util.Set;

public class StepValidator implements Validator<Step> {

    private static final Set<String> HTTP_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");
    private static final Set<String> AUTH_TYPES = Set.of("basic", "bearer");

    private final TemplateRenderer renderer;
    private final JsltTransformEngine transformEngine;

    public StepValidator(final TemplateRenderer renderer, final JsltTransformEngine transformEngine) {
        this.renderer = renderer;
        this.transformEngine = transformEngine;
    }

    @Override
    public <C> ValidationResult validate(final Step step,
                                         final C context,
                                         final ValidationOptions validationOptions) {
        var result = ValidationResult.empty();
        var location = Strings.isNullOrEmpty(step.getName()) ? "step" : "step '%s'".formatted(step.getName());

        if (Strings.isNullOrEmpty(step.getName())) result.addMissing(location, "name");
        if (Objects.isNull(step.getType())) {
            result.addMissing(location, "type");
            return result;
        }
        if (step.getRetryCount() < 0) result.addError(location, "'retry_count' must not be negative");
        if (Objects.nonNull(step.getRetryDelay()) && step.getRetryDelay().isNegative()) {
            result.addError(location, "'retry_delay' must not be negative");
        }
        if (Objects.nonNull(step.getTimeout()) && (step.getTimeout().isNegative() || step.getTimeout().isZero())) {
            result.addError(location, "'timeout' must be positive");
        }
        boolean compile = validationOptions.isCompileExpressions();
        if (!Strings.isNullOrEmpty(step.getCondition()) && compile) {
            compileCondition(step.getCondition(), location, result);
        }

        var payload = step.getPayload();
        if (Objects.isNull(payload) || !step.getType().getPayloadType().isInstance(payload)) {
            result.addError(location, "payload does not match step type '%s'".formatted(step.getType().getValue()));
            return result;
        }

        switch (step.getType()) {
            case QUERY -> validateQuery((QueryPayload) payload, location, result);
            case TEMPLATE -> validateTemplate((TemplatePayload) payload, location, result, compile);
            case AUDIT -> validateAudit((AuditPayload) payload, location, result);
            case REMEDIATE -> validateRemediate((RemediatePayload) payload, location, result);
            case TRANSFORM -> validateTransform((TransformPayload) payload, location, result, compile);
            case API_CALL -> validateApiCall((ApiCallPayload) payload, location, result);
            case NOTIFICATION -> validateNotification((NotificationPayload) payload, location, result);
        }
        return result;
    }

    @Override
    public boolean supports(final Class<?> clazz) {
        return Step.class.isAssignableFrom(clazz);
    }

    private void validateQuery(final QueryPayload payload, final String location, final ValidationResult result) {
        boolean hasGeneric = !Strings.isNullOrEmpty(payload.getPath())
                || !Strings.isNullOrEmpty(payload.getXpath())
                || !Strings.isNullOrEmpty(payload.getFilterXml());
        if (!hasGeneric && payload.getVendorSpecific().isEmpty()) {
            result.addError(location, "query needs 'path', 'xpath', 'filter_xml' or 'vendor_specific'");
        }
    }

    private void validateTemplate(final TemplatePayload payload, final String location,
                                  final ValidationResult result, final boolean compile) {
        if (Strings.isNullOrEmpty(payload.getTemplate()) && payload.getVendorSpecific().isEmpty()) {
            result.addMissing(location, "template");
            return;
        }
        if (!compile) return;
        if (!Strings.isNullOrEmpty(payload.getTemplate())) compileTemplate(payload.getTemplate(), location, result);
        payload.getVendorSpecific().forEach((vendor, variant) -> {
            if (Objects.nonNull(variant) && !Strings.isNullOrEmpty(variant.getTemplate())) {
                compileTemplate(variant.getTemplate(), "%s vendor '%s'".formatted(location, vendor), result);
            }
        });
    }

    private void validateAudit(final AuditPayload payload, final String location, final ValidationResult result) {
        if (Objects.isNull(payload.getCompare())) {
            result.addMissing(location, "compare");
        } else if (Objects.isNull(payload.getCompare().getActual())) {
            result.addMissing(location, "compare.actual");
        }
        if (payload.getPassThreshold() < 0 || payload.getPassThreshold() > 100) {
            result.addError(location, "'pass_threshold' must be between 0 and 100");
        }
    }

    private void validateRemediate(final RemediatePayload payload, final String location, final ValidationResult result) {
        if (Objects.isNull(payload.getConfigSource()) && payload.getVendorSpecific().isEmpty()) {
            result.addError(location, "remediate needs 'config_source' or 'vendor_specific'");
        }
        payload.getVendorSpecific().forEach((vendor, variant) -> {
            if (Objects.isNull(variant)) return;
            variant.getOperations().forEach(operation -> {
                if (Strings.isNullOrEmpty(operation.getPath())) {
                    result.addMissing("%s vendor '%s'".formatted(location, vendor), "operations.path");
                }
            });
        });
    }

    private void validateTransform(final TransformPayload payload, final String location,
                                   final ValidationResult result, final boolean compile) {
        if (Strings.isNullOrEmpty(payload.getScript())) {
            result.addMissing(location, "script");
            return;
        }
        if (!compile) return;
        try {
            transformEngine.compile(payload.getScript());
        } catch (ExpressionException e) {
            result.addError(location, "invalid transform script: " + e.getMessage());
        }
    }

    private void validateApiCall(final ApiCallPayload payload, final String location, final ValidationResult result) {
        if (Strings.isNullOrEmpty(payload.getUrl())) result.addMissing(location, "url");
        if (Strings.isNullOrEmpty(payload.getMethod()) || !HTTP_METHODS.contains(payload.getMethod().toUpperCase())) {
            result.addError(location, "unsupported HTTP method '%s'".formatted(payload.getMethod()));
        }
        var auth = payload.getAuth();
        if (Objects.nonNull(auth)) {
            if (Strings.isNullOrEmpty(auth.getType()) || !AUTH_TYPES.contains(auth.getType().toLowerCase())) {
                result.addError(location, "unsupported auth type '%s'".formatted(auth.getType()));
            }
        }
    }

    private void validateNotification(final NotificationPayload payload, final String location, final ValidationResult result) {
        if (Strings.isNullOrEmpty(payload.getMessage())) result.addMissing(location, "message");
        if (payload.getChannels().isEmpty()) result.addWarning(location, "notification has no channels");
    }

    private void compileCondition(final String condition, final String location, final ValidationResult result) {
        try {
            ExpressionParser.parse(condition);
        } catch (ExpressionException e) {
            result.addError(location, "invalid condition: " + e.getMessage());
        }
    }

    private void compileTemplate(final String template, final String location, final ValidationResult result) {
        try {
            renderer.compile(template);
        } catch (ExpressionException e) {
            result.addError(location, "invalid template: " + e.getMessage());
        }
    }
}
