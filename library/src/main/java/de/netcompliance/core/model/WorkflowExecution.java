package de.netcompliance.core.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

@Data
@Builder
public class WorkflowExecution {
    private String id;
    private String workflowName;
    private String deviceId;
    @Builder.Default
    private Trigger trigger = Trigger.MANUAL;
    private String startedBy;
    private Instant createdAt;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    @Builder.Default
    private volatile ExecutionState state = ExecutionState.PENDING;
    private volatile String message;
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @Builder.Default
    private Map<String, Object> variables = Collections.synchronizedMap(new LinkedHashMap<>());
    @Builder.Default
    private List<StepLog> stepLogs = new CopyOnWriteArrayList<>();

    /**
     * Copy of the variables taken under the map's lock; steps running in parallel keep writing
     * to the live map while readers serialize the copy.
     */
    public Map<String, Object> getVariables() {
        synchronized (variables) {
            return new LinkedHashMap<>(variables);
        }
    }

    public void putVariable(final String name, final Object value) {
        variables.put(name, value);
    }

    public void putVariables(final Map<String, Object> values) {
        variables.putAll(values);
    }

    public Optional<StepLog> findStepLog(final String stepName) {
        return stepLogs.stream()
                .filter(log -> log.getStepName().equals(stepName))
                .findFirst();
    }
}
