package de.netcompliance.core.execution.handler;

import com.google.common.base.Strings;
import de.netcompliance.core.model.Protocol;
import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepType;
import de.netcompliance.core.model.payload.QueryPayload;
import de.netcompliance.infrastructure.resolving.VariableResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * Reads configuration from the target device. A vendor-specific query for the device's vendor
 * replaces the generic one.
 */
@Slf4j
public class QueryStepHandler implements StepHandler {

    private final VariableResolver resolver;

    public QueryStepHandler(final VariableResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public StepType type() {
        return StepType.QUERY;
    }

    @Override
    public StepOutcome execute(final Step step, final VariableScope scope, final DeviceContext device) {
        var payload = step.payloadAs(QueryPayload.class);
        var target = device.requireDevice();
        var protocol = target.protocol();
        var query = effectiveQuery(payload, device.vendorTag().orElse(null));

        String path;
        Object filter;
        if (protocol == Protocol.NETCONF_XML) {
            path = !Strings.isNullOrEmpty(query.getXpath()) ? query.getXpath() : query.getPath();
            filter = query.getFilterXml();
        } else {
            path = query.getPath();
            filter = query.getFilter();
        }
        path = resolver.resolveText(path, scope.asMap());
        filter = resolver.resolve(filter, scope.asMap());
        if (Strings.isNullOrEmpty(path) && (Objects.isNull(filter) || filter.toString().isBlank())) {
            return StepOutcome.failed("Query defines no target for %s devices".formatted(protocol), false);
        }

        log.debug("Query '{}' on {}: path={}", step.getName(), target.getHostname(), path);
        var result = device.connector().fetch(path, filter);
        if (!result.isFound()) {
            return StepOutcome.completed(new LinkedHashMap<>(), "Path not found: " + Objects.toString(path, "<filter>"));
        }
        return StepOutcome.completed(result.getValue().orElse(null));
    }

    private QueryPayload.VendorQuery effectiveQuery(final QueryPayload payload, final String vendorTag) {
        var specific = Objects.isNull(vendorTag) ? null : payload.getVendorSpecific().get(vendorTag);
        if (Objects.nonNull(specific)) return specific;
        return QueryPayload.VendorQuery.builder()
                .path(payload.getPath())
                .xpath(payload.getXpath())
                .filter(payload.getFilter())
                .filterXml(payload.getFilterXml())
                .build();
    }
}
