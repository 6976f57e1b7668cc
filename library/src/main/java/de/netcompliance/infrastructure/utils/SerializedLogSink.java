package de.netcompliance.infrastructure.utils;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Append-only writer shared by many workers. Writes run one at a time on a dedicated thread in
 * submission order, so per-device and per-step ordering is kept without locking the records.
 */
@Slf4j
public class SerializedLogSink implements AutoCloseable {

    private final String name;
    private final ExecutorService writer;

    public SerializedLogSink(final String name) {
        this.name = name;
        this.writer = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("log-sink-" + name.replace("%", "%%"))
                .setDaemon(true)
                .build());
    }

    public void append(final Runnable write) {
        try {
            writer.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException e) {
                    log.error("Write to log sink {} failed", name, e);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Log sink %s is closed".formatted(name), e);
        }
    }

    /**
     * Stops accepting writes; pending writes still run. Safe to call from a write itself.
     */
    public void shutdown() {
        writer.shutdown();
    }

    /**
     * Stops accepting writes and waits for pending writes to finish.
     */
    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Log sink {} did not drain within 30 s", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining log sink {}", name);
        }
    }
}
