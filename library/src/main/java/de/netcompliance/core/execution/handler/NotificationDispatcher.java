package de.netcompliance.core.execution.handler;

import java.util.concurrent.CompletableFuture;

/**
 * Delivers notifications. Delivery is asynchronous; the returned future completes once the
 * message was handed to every channel.
 */
public interface NotificationDispatcher {

    CompletableFuture<Void> dispatch(final NotificationRequest request);
}
