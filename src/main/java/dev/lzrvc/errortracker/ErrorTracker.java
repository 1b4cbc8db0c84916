package dev.lzrvc.errortracker;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Process-wide entry point.
 *
 * <p>Call {@link #init(ErrorTrackerOptions)} once at application startup, then use the static
 * helpers from anywhere in your code:
 *
 * <pre>{@code
 * // Initialise once (e.g. in main() or application context)
 * ErrorTracker.init(new ErrorTrackerOptions.Builder(System.getenv("ERROR_TRACKER_DSN"))
 *     .release(System.getenv("APP_VERSION"))
 *     .environment("production")
 *     .build());
 *
 * // Capture errors
 * try {
 *     riskyOperation();
 * } catch (Exception e) {
 *     ErrorTracker.captureException(e);
 * }
 *
 * // Capture messages
 * ErrorTracker.captureMessage("Payment gateway timed out", Severity.WARNING);
 *
 * // Attach user context
 * ErrorTracker.setUser(new UserContext.Builder().id("u123").email("alice@example.com").build());
 *
 * // Breadcrumbs
 * ErrorTracker.addBreadcrumb(BreadcrumbType.HTTP, BreadcrumbLevel.INFO, "GET /api/orders");
 *
 * // Before shutdown
 * ErrorTracker.flush(Duration.ofSeconds(2));
 * }</pre>
 *
 * <p>Every helper is a silent no-op until {@code init} has been called.
 */
public final class ErrorTracker {

    private ErrorTracker() {}

    private static volatile ErrorTrackerClient instance;

    /**
     * Initialise the SDK. Calling {@code init} again closes the previous client and replaces it.
     *
     * @param options SDK configuration
     * @return the initialized {@link ErrorTrackerClient}
     */
    public static synchronized ErrorTrackerClient init(ErrorTrackerOptions options) {
        if (options == null) throw new IllegalArgumentException("ErrorTrackerOptions must not be null");
        ErrorTrackerClient next = new ErrorTrackerClient(options);
        if (instance != null) {
            instance.close();
        }
        instance = next;
        return instance;
    }

    /**
     * @return the sent {@code event_id}, or {@code null} if not initialized / skipped / dropped
     */
    public static String captureException(Throwable error) {
        ErrorTrackerClient c = instance;
        return c != null ? c.captureException(error) : null;
    }

    public static String captureException(Throwable error, Severity level) {
        ErrorTrackerClient c = instance;
        return c != null ? c.captureException(error, level) : null;
    }

    public static String captureException(Throwable error, Map<String, ?> extra) {
        ErrorTrackerClient c = instance;
        return c != null ? c.captureException(error, extra) : null;
    }

    /**
     * @return the sent {@code event_id}, or {@code null} if not initialized / skipped / dropped
     */
    public static String captureMessage(String message) {
        ErrorTrackerClient c = instance;
        return c != null ? c.captureMessage(message) : null;
    }

    public static String captureMessage(String message, Severity level) {
        ErrorTrackerClient c = instance;
        return c != null ? c.captureMessage(message, level) : null;
    }

    public static String captureMessage(String message, Severity level, Map<String, ?> extra) {
        ErrorTrackerClient c = instance;
        return c != null ? c.captureMessage(message, level, extra) : null;
    }

    public static void addBreadcrumb(BreadcrumbType type, BreadcrumbLevel level, String message) {
        ErrorTrackerClient c = instance;
        if (c != null) c.addBreadcrumb(type, level, message);
    }

    public static void addBreadcrumb(BreadcrumbType type, BreadcrumbLevel level, String message,
                                     String category, Map<String, ?> data) {
        ErrorTrackerClient c = instance;
        if (c != null) c.addBreadcrumb(type, level, message, category, data);
    }

    public static void addBreadcrumb(Breadcrumb crumb) {
        ErrorTrackerClient c = instance;
        if (c != null) c.addBreadcrumb(crumb);
    }

    public static void setUser(UserContext user) {
        ErrorTrackerClient c = instance;
        if (c != null) c.setUser(user);
    }

    public static void clearUser() {
        ErrorTrackerClient c = instance;
        if (c != null) c.clearUser();
    }

    public static void setTag(String key, String value) {
        ErrorTrackerClient c = instance;
        if (c != null) c.setTag(key, value);
    }

    public static void setTags(Map<String, String> tags) {
        ErrorTrackerClient c = instance;
        if (c != null) c.setTags(tags);
    }

    public static void setExtra(String key, Object value) {
        ErrorTrackerClient c = instance;
        if (c != null) c.setExtra(key, value);
    }

    public static void setExtras(Map<String, ?> extras) {
        ErrorTrackerClient c = instance;
        if (c != null) c.setExtras(extras);
    }

    public static void setContext(String name, Object value) {
        ErrorTrackerClient c = instance;
        if (c != null) c.setContext(name, value);
    }

    public static void setLevel(Severity level) {
        ErrorTrackerClient c = instance;
        if (c != null) c.setLevel(level);
    }

    public static void setFingerprint(List<String> fingerprint) {
        ErrorTrackerClient c = instance;
        if (c != null) c.setFingerprint(fingerprint);
    }

    public static void setRequest(RequestContext request) {
        ErrorTrackerClient c = instance;
        if (c != null) c.setRequest(request);
    }

    public static void clearContext() {
        ErrorTrackerClient c = instance;
        if (c != null) c.clearContext();
    }

    /**
     * @return {@code true} if nothing is pending, including when not initialized
     */
    public static boolean flush(Duration timeout) {
        ErrorTrackerClient c = instance;
        return c == null || c.flush(timeout);
    }

    /**
     * Close the current client, removing auto-installed handlers.
     * Useful in tests or when re-initialising the SDK.
     */
    public static synchronized void close() {
        if (instance != null) {
            instance.close();
            instance = null;
        }
    }

    /**
     * @return the current {@link ErrorTrackerClient}, or {@code null} if not yet initialized.
     */
    public static ErrorTrackerClient getClient() {
        return instance;
    }
}
