package de.netcompliance.core.execution.handler;

import com.google.common.base.Strings;
import de.netcompliance.core.connector.ConfigSnapshot;
import de.netcompliance.core.connector.PathEdit;
import de.netcompliance.core.connector.PushRequest;
import de.netcompliance.core.connector.VendorConnector;
import de.netcompliance.core.exception.ConnectorException;
import de.netcompliance.core.exception.StepExecutionException;
import de.netcompliance.core.model.Protocol;
import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepType;
import de.netcompliance.core.model.payload.RemediatePayload;
import de.netcompliance.infrastructure.resolving.VariableResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pushes a configuration change. With {@code rollback_on_error} the affected configuration is
 * captured first and restored by a compensating push when the change fails.
 */
@Slf4j
public class RemediateStepHandler implements StepHandler {

    private static final String RENDERED_CONFIG = "rendered_config";

    private final VariableResolver resolver;

    public RemediateStepHandler(final VariableResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public StepType type() {
        return StepType.REMEDIATE;
    }

    @Override
    public StepOutcome execute(final Step step, final VariableScope scope, final DeviceContext device) {
        var payload = step.payloadAs(RemediatePayload.class);
        var target = device.requireDevice();
        var protocol = target.protocol();
        var request = buildRequest(payload, device.vendorTag().orElse(null), protocol, scope);
        var connector = device.connector();

        ConfigSnapshot snapshot = null;
        if (payload.isRollbackOnError()) {
            snapshot = connector.snapshot(request);
            log.debug("Captured pre-change configuration of {} for step '{}'", target.getHostname(), step.getName());
        }

        try {
            var result = connector.push(request);
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("success", true);
            output.put("protocol", protocol.name().toLowerCase());
            output.put("committed", result.isCommitted());
            output.put("result", result.getMessage());
            return StepOutcome.completed(output, result.getMessage());
        } catch (ConnectorException e) {
            log.warn("Remediation '{}' on {} failed: {}", step.getName(), target.getHostname(), e.getMessage());
            var message = "Remediation failed: " + e.getMessage();
            if (Objects.nonNull(snapshot)) {
                message += "; " + rollback(connector, snapshot, target.getHostname());
            }
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("success", false);
            output.put("protocol", protocol.name().toLowerCase());
            output.put("committed", false);
            output.put("result", message);
            return StepOutcome.failed(message, e.isTransient(), output);
        }
    }

    private String rollback(final VendorConnector connector, final ConfigSnapshot snapshot, final String hostname) {
        try {
            var restored = connector.restore(snapshot);
            log.info("Rolled back {} after failed remediation", hostname);
            return "rollback succeeded: " + restored.getMessage();
        } catch (ConnectorException rollbackFailure) {
            log.error("Rollback on {} failed: {}", hostname, rollbackFailure.getMessage());
            return "rollback failed: " + rollbackFailure.getMessage();
        }
    }

    private PushRequest buildRequest(final RemediatePayload payload,
                                     final String vendorTag,
                                     final Protocol protocol,
                                     final VariableScope scope) {
        var variables = scope.asMap();
        var specific = Objects.isNull(vendorTag) ? null : payload.getVendorSpecific().get(vendorTag);
        var source = unwrap(resolver.resolve(payload.getConfigSource(), variables));
        var builder = PushRequest.builder();

        if (Objects.nonNull(specific)) {
            builder.target(Objects.requireNonNullElse(specific.getTarget(), "candidate"))
                    .defaultOperation(Objects.requireNonNullElse(specific.getDefaultOperation(), "merge"))
                    .commit(specific.isCommit())
                    .commitComment(resolver.resolveText(specific.getCommitComment(), variables));
        }

        if (protocol == Protocol.NETCONF_XML) {
            if (!(source instanceof String xml) || xml.isBlank()) {
                throw new StepExecutionException("Remediation for XML devices needs configuration text in 'config_source'", false);
            }
            return builder.configXml(xml).build();
        }

        var edits = new ArrayList<PathEdit>();
        if (Objects.nonNull(specific)) {
            specific.getOperations().forEach(operation -> edits.add(new PathEdit(
                    resolver.resolveText(operation.getPath(), variables),
                    PathEdit.Action.of(Objects.requireNonNullElse(operation.getAction(), "update")),
                    resolver.resolve(operation.getValue(), variables))));
            if (edits.isEmpty() && !Strings.isNullOrEmpty(specific.getPath()) && Objects.nonNull(source)) {
                edits.add(PathEdit.update(resolver.resolveText(specific.getPath(), variables), source));
            }
        }
        if (edits.isEmpty()) {
            throw new StepExecutionException("Remediation for model-path devices needs 'operations' or a 'path' for vendor '%s'"
                    .formatted(vendorTag), false);
        }
        return builder.edits(List.copyOf(edits)).build();
    }

    // a template step's output carries the text under rendered_config
    private static Object unwrap(final Object source) {
        if (source instanceof Map<?, ?> map && map.containsKey(RENDERED_CONFIG)) {
            return map.get(RENDERED_CONFIG);
        }
        return source;
    }
}
