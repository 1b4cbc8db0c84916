package dev.lzrvc.errortracker;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream stream = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void debug_suppressedUnlessEnabled() {
        new Diagnostics.StreamDiagnostics(stream, false).debug("hidden");
        assertEquals("", output());

        new Diagnostics.StreamDiagnostics(stream, true).debug("shown");
        assertEquals("[ErrorTracker] shown", output().trim());
    }

    @Test
    void error_alwaysWrittenWithCause() {
        Diagnostics diagnostics = new Diagnostics.StreamDiagnostics(stream, false);
        diagnostics.error("Failed to send event 1-a", new IllegalStateException("socket closed"));
        diagnostics.error("plain", null);

        String[] lines = output().trim().split("\\R");
        assertEquals("[ErrorTracker] Failed to send event 1-a: java.lang.IllegalStateException: socket closed", lines[0]);
        assertEquals("[ErrorTracker] plain", lines[1]);
    }
}
