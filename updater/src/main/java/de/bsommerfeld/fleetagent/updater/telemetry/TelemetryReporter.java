package de.bsommerfeld.fleetagent.updater.telemetry;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Sends telemetry off the update thread. Best effort: failures are logged
 * and never reach the caller.
 */
public class TelemetryReporter implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TelemetryReporter.class);

    private final TelemetrySink sink;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
            .setNameFormat("telemetry-%d")
            .setDaemon(true)
            .build());

    public TelemetryReporter(TelemetrySink sink) {
        this.sink = sink;
    }

    public void submit(TelemetryPayload payload) {
        try {
            executor.execute(() -> send(payload));
        } catch (RejectedExecutionException e) {
            LOG.debug("Telemetry reporter closed, dropping {} report", payload.status());
        }
    }

    private void send(TelemetryPayload payload) {
        try {
            sink.report(payload);
            LOG.debug("Reported {} telemetry for run {}", payload.status(), payload.runId());
        } catch (Exception e) {
            LOG.warn("Failed to report update telemetry: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
