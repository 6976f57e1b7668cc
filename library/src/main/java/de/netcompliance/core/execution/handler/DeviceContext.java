package de.netcompliance.core.execution.handler;

import de.netcompliance.core.connector.VendorConnector;
import de.netcompliance.core.exception.StepExecutionException;
import de.netcompliance.core.model.Device;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Target device of an execution together with the execution's session. The session is opened on
 * first use and shared by all steps of the execution.
 */
public final class DeviceContext {

    private final String executionId;
    private final String workflowName;
    private final Device device;
    private final Supplier<VendorConnector> connector;

    public DeviceContext(final String executionId,
                         final String workflowName,
                         final Device device,
                         final Supplier<VendorConnector> connector) {
        this.executionId = executionId;
        this.workflowName = workflowName;
        this.device = device;
        this.connector = connector;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public Optional<Device> getDevice() {
        return Optional.ofNullable(device);
    }

    public Device requireDevice() {
        if (Objects.isNull(device)) {
            throw new StepExecutionException("Execution %s has no target device".formatted(executionId), false);
        }
        return device;
    }

    public VendorConnector connector() {
        requireDevice();
        return connector.get();
    }

    /**
     * Vendor tag of the target device, e.g. {@code nokia_sros}; empty without a device.
     */
    public Optional<String> vendorTag() {
        return getDevice().map(d -> Objects.nonNull(d.getVendor()) ? d.getVendor().getValue() : null);
    }
}
