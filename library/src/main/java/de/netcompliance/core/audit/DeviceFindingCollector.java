package de.netcompliance.core.audit;

import de.netcompliance.core.evaluation.FindingSink;
import de.netcompliance.core.model.Check;
import de.netcompliance.core.model.Device;
import de.netcompliance.core.model.Finding;
import de.netcompliance.core.model.FindingStatus;
import de.netcompliance.core.model.Rule;

import java.time.Clock;
import java.util.List;
import java.util.function.Consumer;

/**
 * Collects the findings of one device. Once sealed (finished, timed out or cancelled) every
 * planned check without a finding receives an error finding and later findings are dropped, so
 * each planned check ends with exactly one finding.
 */
final class DeviceFindingCollector implements FindingSink {

    record PlannedCheck(Rule rule, Check check) {}

    private final String runId;
    private final Device device;
    private final List<PlannedCheck> planned;
    private final Consumer<Finding> downstream;
    private final Clock clock;

    private int offered;
    private boolean started;
    private boolean sealed;
    private boolean errors;

    DeviceFindingCollector(final String runId,
                           final Device device,
                           final List<PlannedCheck> planned,
                           final Consumer<Finding> downstream,
                           final Clock clock) {
        this.runId = runId;
        this.device = device;
        this.planned = List.copyOf(planned);
        this.downstream = downstream;
        this.clock = clock;
    }

    Device getDevice() {
        return device;
    }

    synchronized boolean start() {
        if (sealed) return false;
        started = true;
        return true;
    }

    @Override
    public synchronized boolean offer(final Finding finding) {
        if (sealed || offered >= planned.size()) return false;
        offered++;
        if (finding.getStatus() == FindingStatus.ERROR) errors = true;
        downstream.accept(finding);
        return true;
    }

    /**
     * @return {@code true} if this call sealed the collector
     */
    synchronized boolean seal(final String message) {
        if (sealed) return false;
        sealed = true;
        for (int i = offered; i < planned.size(); i++) {
            var plannedCheck = planned.get(i);
            errors = true;
            downstream.accept(Finding.builder()
                    .runId(runId)
                    .deviceId(device.getId())
                    .ruleId(plannedCheck.rule().getId())
                    .ruleName(plannedCheck.rule().getName())
                    .checkName(plannedCheck.check().getName())
                    .severity(plannedCheck.rule().getSeverity())
                    .status(FindingStatus.ERROR)
                    .expected(plannedCheck.check().getExpected())
                    .message(message)
                    .timestamp(clock.instant())
                    .build());
        }
        offered = planned.size();
        return true;
    }

    synchronized boolean sealIfNotStarted(final String message) {
        if (started) return false;
        return seal(message);
    }

    synchronized boolean hasErrors() {
        return errors;
    }
}
