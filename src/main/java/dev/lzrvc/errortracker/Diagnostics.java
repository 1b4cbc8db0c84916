package dev.lzrvc.errortracker;

import java.io.PrintStream;

/**
 * Local channel for the library's own failures and debug output. Nothing reported here ever
 * reaches the application as an exception.
 *
 * <p>The default writes {@code [ErrorTracker]} lines to {@code System.err}. Supply your own to
 * route them into the application's logging.
 */
public interface Diagnostics {

    void debug(String message);

    /**
     * @param cause may be {@code null}
     */
    void error(String message, Throwable cause);

    /** Writes to {@code System.err}; debug lines only when {@code debugEnabled}. */
    static Diagnostics stderr(boolean debugEnabled) {
        return new StreamDiagnostics(System.err, debugEnabled);
    }

    final class StreamDiagnostics implements Diagnostics {

        private static final String PREFIX = "[ErrorTracker] ";

        private final PrintStream out;
        private final boolean debugEnabled;

        StreamDiagnostics(PrintStream out, boolean debugEnabled) {
            this.out          = out;
            this.debugEnabled = debugEnabled;
        }

        @Override
        public void debug(String message) {
            if (debugEnabled) {
                out.println(PREFIX + message);
            }
        }

        @Override
        public void error(String message, Throwable cause) {
            if (cause == null) {
                out.println(PREFIX + message);
            } else {
                out.println(PREFIX + message + ": " + cause);
            }
        }
    }
}
