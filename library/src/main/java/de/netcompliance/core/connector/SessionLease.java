package de.netcompliance.core.connector;

import de.netcompliance.core.exception.ConnectorException;
import de.netcompliance.core.model.Device;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive use of a device session. Closing the lease closes the session and frees the device
 * for the next lease holder.
 */
@Slf4j
public class SessionLease implements AutoCloseable {

    private final Device device;
    private final VendorConnector connector;
    private final Runnable release;
    private final AtomicBoolean closed = new AtomicBoolean();

    SessionLease(final Device device, final VendorConnector connector, final Runnable release) {
        this.device = device;
        this.connector = connector;
        this.release = release;
    }

    public Device getDevice() {
        return device;
    }

    public VendorConnector connector() {
        if (closed.get()) {
            throw new IllegalStateException("Session lease for '%s' already closed".formatted(device.getId()));
        }
        return connector;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            connector.closeSession();
        } catch (ConnectorException e) {
            log.warn("Closing session to {} failed: {}", device.getHostname(), e.getMessage());
        } finally {
            release.run();
        }
    }
}
