package de.netcompliance.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import de.netcompliance.core.model.payload.ApiCallPayload;
import de.netcompliance.core.model.payload.AuditPayload;
import de.netcompliance.core.model.payload.NotificationPayload;
import de.netcompliance.core.model.payload.QueryPayload;
import de.netcompliance.core.model.payload.RemediatePayload;
import de.netcompliance.core.model.payload.StepPayload;
import de.netcompliance.core.model.payload.TemplatePayload;
import de.netcompliance.core.model.payload.TransformPayload;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum StepType {
    QUERY("query", QueryPayload.class),
    TEMPLATE("template", TemplatePayload.class),
    AUDIT("audit", AuditPayload.class),
    REMEDIATE("remediate", RemediatePayload.class),
    TRANSFORM("transform", TransformPayload.class),
    API_CALL("api_call", ApiCallPayload.class),
    NOTIFICATION("notification", NotificationPayload.class);

    @JsonValue
    private final String value;
    private final Class<? extends StepPayload> payloadType;

    @JsonCreator
    public static StepType of(final String value) {
        for (StepType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown step type '%s'".formatted(value));
    }
}
