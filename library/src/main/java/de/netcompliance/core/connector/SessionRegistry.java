package de.netcompliance.core.connector;

import de.netcompliance.core.exception.TransientConnectorException;
import de.netcompliance.core.model.Device;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Hands out at most one open session per device. A second lease for the same device waits for
 * the first to be closed, bounded by the lease timeout.
 */
@Slf4j
public class SessionRegistry {

    public static final Duration DEFAULT_LEASE_TIMEOUT = Duration.ofSeconds(60);

    private final ConnectorFactory connectorFactory;
    private final Duration leaseTimeout;
    private final Map<String, Semaphore> permits = new ConcurrentHashMap<>();

    public SessionRegistry(final ConnectorFactory connectorFactory) {
        this(connectorFactory, DEFAULT_LEASE_TIMEOUT);
    }

    public SessionRegistry(final ConnectorFactory connectorFactory, final Duration leaseTimeout) {
        this.connectorFactory = connectorFactory;
        this.leaseTimeout = leaseTimeout;
    }

    public SessionLease lease(final Device device) {
        var permit = permits.computeIfAbsent(device.getId(), id -> new Semaphore(1, true));
        try {
            if (!permit.tryAcquire(leaseTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TransientConnectorException("Session to '%s' still in use after %d ms"
                        .formatted(device.getHostname(), leaseTimeout.toMillis()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientConnectorException("Interrupted while waiting for session to '%s'"
                    .formatted(device.getHostname()), e);
        }
        try {
            var connector = connectorFactory.open(device);
            log.debug("Leased session to {}", device.getHostname());
            return new SessionLease(device, connector, permit::release);
        } catch (RuntimeException e) {
            permit.release();
            throw e;
        }
    }

    public boolean isLeased(final String deviceId) {
        var permit = permits.get(deviceId);
        return permit != null && permit.availablePermits() == 0;
    }
}
