package de.netcompliance.core.execution;

import de.netcompliance.core.connector.ConfigSnapshot;
import de.netcompliance.core.connector.FetchResult;
import de.netcompliance.core.connector.PushRequest;
import de.netcompliance.core.connector.PushResult;
import de.netcompliance.core.connector.SessionLease;
import de.netcompliance.core.connector.SessionRegistry;
import de.netcompliance.core.connector.VendorConnector;
import de.netcompliance.core.model.Device;

import java.util.Objects;

/**
 * The one device session of a workflow execution. Leased on first use and shared by all steps;
 * calls from concurrently running steps are serialized.
 */
final class ExecutionSession implements AutoCloseable {

    private final SessionRegistry sessionRegistry;
    private final Device device;
    private SessionLease lease;
    private boolean closed;

    ExecutionSession(final SessionRegistry sessionRegistry, final Device device) {
        this.sessionRegistry = sessionRegistry;
        this.device = device;
    }

    synchronized VendorConnector connector() {
        if (closed) {
            throw new IllegalStateException("Session to '%s' already closed".formatted(device.getHostname()));
        }
        if (Objects.isNull(lease)) {
            lease = sessionRegistry.lease(device);
        }
        return new SerializedConnector(lease.connector());
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (Objects.nonNull(lease)) {
            lease.close();
            lease = null;
        }
    }

    private final class SerializedConnector implements VendorConnector {

        private final VendorConnector delegate;

        private SerializedConnector(final VendorConnector delegate) {
            this.delegate = delegate;
        }

        @Override
        public Device getDevice() {
            return delegate.getDevice();
        }

        @Override
        public FetchResult fetch(final String path, final Object filter) {
            synchronized (ExecutionSession.this) {
                return delegate.fetch(path, filter);
            }
        }

        @Override
        public PushResult push(final PushRequest request) {
            synchronized (ExecutionSession.this) {
                return delegate.push(request);
            }
        }

        @Override
        public ConfigSnapshot snapshot(final PushRequest request) {
            synchronized (ExecutionSession.this) {
                return delegate.snapshot(request);
            }
        }

        @Override
        public PushResult restore(final ConfigSnapshot snapshot) {
            synchronized (ExecutionSession.this) {
                return delegate.restore(snapshot);
            }
        }

        // the lease owns the session
        @Override
        public void closeSession() {
            throw new UnsupportedOperationException("Sessions of a workflow execution are closed by the executor");
        }
    }
}
