package de.bsommerfeld.fleetagent.updater.telemetry;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TelemetryReporterTest {

    private static TelemetryPayload payload(String status) {
        return new TelemetryPayload("agent-1", "run-1", status, "1.2.3", "1.3.0", "", "", "", Instant.EPOCH);
    }

    @Test
    void submit_shouldDeliverAsynchronously() throws Exception {
        TelemetrySink sink = mock(TelemetrySink.class);
        var reporter = new TelemetryReporter(sink);

        reporter.submit(payload("succeeded"));

        verify(sink, timeout(5000)).report(payload("succeeded"));
        reporter.close();
    }

    @Test
    void submit_shouldSwallowSinkFailures() throws Exception {
        TelemetrySink sink = mock(TelemetrySink.class);
        doThrow(new IOException("offline")).when(sink).report(any());
        var reporter = new TelemetryReporter(sink);

        assertDoesNotThrow(() -> reporter.submit(payload("failed")));
        reporter.submit(payload("cancelled"));

        verify(sink, timeout(5000)).report(payload("cancelled"));
        reporter.close();
    }

    @Test
    void submit_shouldIgnorePayloadsAfterClose() throws Exception {
        TelemetrySink sink = mock(TelemetrySink.class);
        var reporter = new TelemetryReporter(sink);
        reporter.close();

        assertDoesNotThrow(() -> reporter.submit(payload("failed")));
        verifyNoInteractions(sink);
    }
}
