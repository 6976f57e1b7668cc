package de.netcompliance.notification;

import de.netcompliance.core.execution.handler.NotificationDispatcher;
import de.netcompliance.core.execution.handler.NotificationRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Writes notifications to the application log. Channel transports are provided by the
 * deployment.
 */
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public CompletableFuture<Void> dispatch(final NotificationRequest request) {
        log.info("Notification from '{}' step '{}' to {}: {}{}", request.getWorkflowName(), request.getStepName(),
                request.getChannels().isEmpty() ? "[log]" : request.getChannels(),
                Objects.isNull(request.getSubject()) ? "" : request.getSubject() + " - ",
                request.getMessage());
        return CompletableFuture.completedFuture(null);
    }
}
