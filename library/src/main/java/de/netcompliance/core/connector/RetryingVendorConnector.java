package de.netcompliance.core.connector;

import de.netcompliance.core.exception.TransientConnectorException;
import de.netcompliance.core.model.Device;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Retries fetches that fail transiently. Pushes are never retried here; a repeated
 * edit belongs to the caller's retry policy.
 */
@Slf4j
public class RetryingVendorConnector implements VendorConnector {

    private final VendorConnector delegate;
    private final int maxRetries;
    private final Duration retryDelay;

    public RetryingVendorConnector(final VendorConnector delegate, final int maxRetries, final Duration retryDelay) {
        this.delegate = delegate;
        this.maxRetries = maxRetries;
        this.retryDelay = retryDelay;
    }

    @Override
    public Device getDevice() {
        return delegate.getDevice();
    }

    @Override
    public FetchResult fetch(final String path, final Object filter) {
        int attempt = 0;
        while (true) {
            try {
                return delegate.fetch(path, filter);
            } catch (TransientConnectorException e) {
                if (attempt >= maxRetries) throw e;
                attempt++;
                log.warn("Fetch of '{}' on {} failed ({}), retry {}/{}",
                        path, delegate.getDevice().getHostname(), e.getMessage(), attempt, maxRetries);
                pause();
            }
        }
    }

    @Override
    public PushResult push(final PushRequest request) {
        return delegate.push(request);
    }

    @Override
    public ConfigSnapshot snapshot(final PushRequest request) {
        return delegate.snapshot(request);
    }

    @Override
    public PushResult restore(final ConfigSnapshot snapshot) {
        return delegate.restore(snapshot);
    }

    @Override
    public void closeSession() {
        delegate.closeSession();
    }

    private void pause() {
        try {
            Thread.sleep(retryDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientConnectorException("Interrupted while waiting to retry", e);
        }
    }
}
