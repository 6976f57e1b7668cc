package de.netcompliance.core.execution;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.netcompliance.core.exception.ConnectorException;
import de.netcompliance.core.exception.ExpressionException;
import de.netcompliance.core.exception.StepExecutionException;
import de.netcompliance.core.execution.handler.DeviceContext;
import de.netcompliance.core.execution.handler.StepHandlerRegistry;
import de.netcompliance.core.execution.handler.StepOutcome;
import de.netcompliance.core.execution.handler.VariableScope;
import de.netcompliance.core.model.Step;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Runs one step with its retry policy. Only retryable failures consume {@code retry_count}; an
 * attempt exceeding the step timeout counts as a retryable failure and is left to finish on its
 * own.
 */
@Slf4j
class StepRunner implements AutoCloseable {

    private final StepHandlerRegistry handlers;
    private final ExecutorService attempts;

    StepRunner(final StepHandlerRegistry handlers) {
        this.handlers = handlers;
        this.attempts = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("step-attempt-%d")
                .setDaemon(true)
                .build());
    }

    StepOutcome run(final Step step,
                    final VariableScope scope,
                    final DeviceContext device,
                    final BooleanSupplier cancelled) {
        var maxAttempts = Math.max(0, step.getRetryCount()) + 1;
        StepOutcome outcome = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            outcome = attempt(step, scope, device).toBuilder().attempts(attempt).build();
            if (outcome.isCompleted() || !outcome.isRetryable() || attempt == maxAttempts) break;
            if (cancelled.getAsBoolean()) {
                log.info("Not retrying step '{}': execution cancelled", step.getName());
                break;
            }
            log.warn("Step '{}' failed ({}), retry {}/{} in {} ms", step.getName(), outcome.getMessage(),
                    attempt, maxAttempts - 1, step.effectiveRetryDelay().toMillis());
            try {
                Thread.sleep(step.effectiveRetryDelay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return StepOutcome.failed("Interrupted while waiting to retry", false).toBuilder().attempts(attempt).build();
            }
        }
        return outcome;
    }

    private StepOutcome attempt(final Step step, final VariableScope scope, final DeviceContext device) {
        var handler = handlers.find(step.getType());
        if (Objects.isNull(step.getTimeout())) {
            return invoke(() -> handler.execute(step, scope, device), step);
        }
        var future = attempts.submit(() -> invoke(() -> handler.execute(step, scope, device), step));
        try {
            return future.get(step.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(false);
            return StepOutcome.failed("Step timed out after %d ms".formatted(step.getTimeout().toMillis()), true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepOutcome.failed("Interrupted while running step", false);
        } catch (ExecutionException e) {
            // invoke() maps every handler failure to an outcome
            log.error("Step '{}' failed unexpectedly", step.getName(), e.getCause());
            return StepOutcome.failed("Step failed: " + e.getCause().getMessage(), false);
        }
    }

    private StepOutcome invoke(final Supplier<StepOutcome> call, final Step step) {
        try {
            return call.get();
        } catch (StepExecutionException e) {
            return StepOutcome.failed(e.getMessage(), e.isRetryable());
        } catch (ConnectorException e) {
            return StepOutcome.failed("Connector failure: " + e.getMessage(), e.isTransient());
        } catch (ExpressionException e) {
            return StepOutcome.failed("Expression failure: " + e.getMessage(), false);
        } catch (RuntimeException e) {
            log.error("Handler of step '{}' failed", step.getName(), e);
            return StepOutcome.failed("Step failed: " + e.getMessage(), false);
        }
    }

    @Override
    public void close() {
        attempts.shutdownNow();
    }
}
