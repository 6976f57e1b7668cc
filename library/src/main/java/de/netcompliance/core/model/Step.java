package de.netcompliance.core.model;

import de.netcompliance.core.model.payload.StepPayload;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class Step {

    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(5);

    private String name;
    private StepType type;
    private String description;
    private String outputVar;
    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();
    private String condition;
    private int retryCount;
    private Duration retryDelay;
    private Duration timeout;
    @Builder.Default
    private OnError onError = OnError.FAIL;
    private StepPayload payload;

    /**
     * Variable the step output is bound to; falls back to the step name.
     */
    public String effectiveOutputVar() {
        return Objects.nonNull(outputVar) && !outputVar.isBlank() ? outputVar : name;
    }

    public Duration effectiveRetryDelay() {
        return Objects.nonNull(retryDelay) ? retryDelay : DEFAULT_RETRY_DELAY;
    }

    public boolean isSkippable() {
        return onError == OnError.CONTINUE;
    }

    public <P extends StepPayload> P payloadAs(final Class<P> payloadType) {
        if (!payloadType.isInstance(payload)) {
            throw new IllegalStateException("Step '%s' of type %s carries no %s"
                    .formatted(name, type, payloadType.getSimpleName()));
        }
        return payloadType.cast(payload);
    }
}
