package dev.lzrvc.errortracker;

import java.net.InetAddress;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Core tracker. Construct one per process (or obtain it via {@link ErrorTracker#init}), or one
 * per unit of work with {@link #forkScope()}.
 *
 * <p>Context mutation and event assembly on one instance are serialized, so an event never
 * observes a half-applied update. Captures never throw: delivery, hook and sanitization failures
 * are reported through {@link Diagnostics} only.
 */
public final class ErrorTrackerClient implements AutoCloseable {

    public static final String SDK_NAME    = "error-tracker-java";
    public static final String SDK_VERSION = "0.1.0";

    static final String PLATFORM            = "java";
    static final String DEFAULT_ENVIRONMENT = "production";
    static final String UNKNOWN_SERVER      = "unknown";
    static final Duration DEFAULT_FLUSH_TIMEOUT = Duration.ofSeconds(2);

    private final ErrorTrackerOptions options;
    private final Diagnostics diagnostics;
    private final Transport transport;
    private final String serverName;
    private final boolean ownsTransport;

    private final Object scopeLock = new Object();
    private final ContextManager context = new ContextManager();
    private final BreadcrumbManager breadcrumbs;

    // Auto-capture: kept so close() can unlink it from the default handler chain
    private volatile CaptureHandler installedHandler;

    /**
     * @throws IllegalArgumentException if {@code options} is null or the DSN is not a valid URL
     */
    public ErrorTrackerClient(ErrorTrackerOptions options) {
        if (options == null) throw new IllegalArgumentException("ErrorTrackerOptions must not be null");
        this.options       = options;
        this.diagnostics   = options.getDiagnostics();
        this.transport     = createTransport(options, diagnostics);
        this.serverName    = options.getServerName() != null ? options.getServerName() : resolveHostName();
        this.breadcrumbs   = new BreadcrumbManager(options.getMaxBreadcrumbs());
        this.ownsTransport = true;

        if (options.isAutoCaptureErrors()) {
            installErrorHandlers();
        }

        diagnostics.debug("ErrorTracker initialized. Transport: " + transport.getClass().getSimpleName());
    }

    private ErrorTrackerClient(ErrorTrackerClient parent) {
        this.options       = parent.options;
        this.diagnostics   = parent.diagnostics;
        this.transport     = parent.transport;
        this.serverName    = parent.serverName;
        this.breadcrumbs   = new BreadcrumbManager(options.getMaxBreadcrumbs());
        this.ownsTransport = false;
    }

    // -------------------------------------------------------------------------
    // Capture
    // -------------------------------------------------------------------------

    /**
     * Capture an exception at {@link Severity#ERROR}.
     *
     * @return the sent {@code event_id}, or {@code null} if the capture was skipped or dropped
     */
    public String captureException(Throwable error) {
        return captureException(error, Severity.ERROR, null);
    }

    public String captureException(Throwable error, Severity level) {
        return captureException(error, level, null);
    }

    /**
     * Capture an exception with extra data for this event only.
     */
    public String captureException(Throwable error, Map<String, ?> extra) {
        return captureException(error, Severity.ERROR, extra);
    }

    public String captureException(Throwable error, Severity level, Map<String, ?> extra) {
        return captureThrowable(error, level, extra, Mechanism.generic());
    }

    /**
     * Capture a plain message at {@link Severity#INFO}.
     *
     * @return the sent {@code event_id}, or {@code null} if the capture was skipped or dropped
     */
    public String captureMessage(String message) {
        return captureMessage(message, Severity.INFO, null);
    }

    public String captureMessage(String message, Severity level) {
        return captureMessage(message, level, null);
    }

    /**
     * Capture a plain message with extra data for this event only.
     */
    public String captureMessage(String message, Severity level, Map<String, ?> extra) {
        if (!shouldCapture()) return null;
        Severity effective = level != null ? level : Severity.INFO;
        return dispatch(() -> createEvent(effective, message, List.of(), extra));
    }

    // -------------------------------------------------------------------------
    // Breadcrumbs
    // -------------------------------------------------------------------------

    public void addBreadcrumb(BreadcrumbType type, BreadcrumbLevel level) {
        addBreadcrumb(new Breadcrumb.Builder(type, level).build());
    }

    public void addBreadcrumb(BreadcrumbType type, BreadcrumbLevel level, String message) {
        addBreadcrumb(new Breadcrumb.Builder(type, level).message(message).build());
    }

    public void addBreadcrumb(BreadcrumbType type, BreadcrumbLevel level, String message,
                              String category, Map<String, ?> data) {
        addBreadcrumb(new Breadcrumb.Builder(type, level)
                .message(message)
                .category(category)
                .data(data)
                .build());
    }

    /** Run the breadcrumb through {@code beforeBreadcrumb} and record what it returns. */
    public void addBreadcrumb(Breadcrumb crumb) {
        if (crumb == null) return;
        Breadcrumb result = crumb;
        BeforeBreadcrumbHook hook = options.getBeforeBreadcrumb();
        if (hook != null) {
            result = runHook("beforeBreadcrumb", crumb, hook::beforeBreadcrumb);
            if (result == null) {
                diagnostics.debug("Breadcrumb dropped by beforeBreadcrumb hook.");
                return;
            }
        }
        synchronized (scopeLock) {
            breadcrumbs.add(result);
        }
    }

    // -------------------------------------------------------------------------
    // Context
    // -------------------------------------------------------------------------

    /** Attach a user to all subsequent events; {@code null} removes it. */
    public void setUser(UserContext user) {
        synchronized (scopeLock) {
            context.setUser(user);
        }
    }

    public void clearUser() {
        setUser(null);
    }

    /** Attach a tag to all subsequent events. A {@code null} value removes the tag. */
    public void setTag(String key, String value) {
        synchronized (scopeLock) {
            context.setTag(key, value);
        }
    }

    /** Merge tags into the current ones. */
    public void setTags(Map<String, String> tags) {
        synchronized (scopeLock) {
            context.setTags(tags);
        }
    }

    public void removeTag(String key) {
        synchronized (scopeLock) {
            context.removeTag(key);
        }
    }

    public void setExtra(String key, Object value) {
        synchronized (scopeLock) {
            context.setExtra(key, value);
        }
    }

    /** Merge extra data into the current entries. */
    public void setExtras(Map<String, ?> extras) {
        synchronized (scopeLock) {
            context.setExtras(extras);
        }
    }

    /** Set a named context sent under {@code contexts}; {@code null} removes it. */
    public void setContext(String name, Object value) {
        synchronized (scopeLock) {
            context.setContext(name, value);
        }
    }

    /** Override the level of every subsequent event; {@code null} restores per-call levels. */
    public void setLevel(Severity level) {
        synchronized (scopeLock) {
            context.setLevel(level);
        }
    }

    public void setFingerprint(List<String> fingerprint) {
        synchronized (scopeLock) {
            context.setFingerprint(fingerprint);
        }
    }

    /** Attach a request snapshot to all subsequent events; {@code null} removes it. */
    public void setRequest(RequestContext request) {
        synchronized (scopeLock) {
            context.setRequest(request);
        }
    }

    /** Reset user, tags, extra, contexts, level, fingerprint, request and breadcrumbs. */
    public void clearContext() {
        synchronized (scopeLock) {
            context.clear();
            breadcrumbs.clear();
        }
    }

    /**
     * A tracker sharing this one's options and transport, with its own empty context and
     * breadcrumbs. Use one per request or job so concurrent work never shares ambient state.
     */
    public ErrorTrackerClient forkScope() {
        return new ErrorTrackerClient(this);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /** Wait up to 2 seconds for pending deliveries. */
    public boolean flush() {
        return flush(DEFAULT_FLUSH_TIMEOUT);
    }

    /**
     * @return {@code true} if the transport has nothing left pending
     */
    public boolean flush(Duration timeout) {
        try {
            return transport.flush(timeout != null ? timeout : DEFAULT_FLUSH_TIMEOUT);
        } catch (RuntimeException e) {
            diagnostics.error("Transport flush failed", e);
            return false;
        }
    }

    /**
     * Remove the auto-installed uncaught exception handler, clear context and, unless this is a
     * {@linkplain #forkScope() fork}, flush and close the transport.
     */
    @Override
    public void close() {
        CaptureHandler ours = installedHandler;
        if (ours != null) {
            CaptureHandler.uninstall(ours);
            installedHandler = null;
        }
        clearContext();
        if (ownsTransport) {
            flush();
            try {
                transport.close();
            } catch (RuntimeException e) {
                diagnostics.error("Transport close failed", e);
            }
        }
        diagnostics.debug("ErrorTracker closed.");
    }

    ErrorTrackerOptions getOptions()     { return options; }
    Transport getTransport()             { return transport; }
    String getServerName()               { return serverName; }
    BreadcrumbManager getBreadcrumbs()   { return breadcrumbs; }

    // -------------------------------------------------------------------------
    // Internal helpers
    // -------------------------------------------------------------------------

    private String captureThrowable(Throwable error, Severity level, Map<String, ?> extra, Mechanism mechanism) {
        if (error == null) return null;
        if (!shouldCapture()) return null;
        if (shouldIgnore(error)) {
            diagnostics.debug("Ignoring exception: " + error.getClass().getName());
            return null;
        }
        Severity effective = level != null ? level : Severity.ERROR;
        return dispatch(() -> createEvent(effective, null, ExceptionValue.chain(error, mechanism), extra));
    }

    /** Enabled check and sample draw, before any context is read. */
    private boolean shouldCapture() {
        if (!options.isEnabled()) return false;
        double rate = options.getSampleRate();
        if (rate >= 1.0) return true;
        return ThreadLocalRandom.current().nextDouble() < rate;
    }

    private boolean shouldIgnore(Throwable error) {
        List<Pattern> patterns = options.getIgnoreErrors();
        if (patterns.isEmpty()) return false;
        String msg = error.getMessage();
        if (msg == null) msg = error.getClass().getName();
        for (Pattern p : patterns) {
            if (p.matcher(msg).find()) return true;
        }
        return false;
    }

    private String dispatch(Supplier<Event> assembly) {
        try {
            return send(assembly.get());
        } catch (RuntimeException e) {
            diagnostics.error("Failed to capture event", e);
            return null;
        }
    }

    private Event createEvent(Severity level, String message, List<ExceptionValue> exceptions, Map<String, ?> extra) {
        long now = System.currentTimeMillis();
        synchronized (scopeLock) {
            Severity override = context.getLevel();
            Map<String, Value> mergedExtra = context.getExtras();
            if (extra != null) mergedExtra.putAll(Value.ofMap(extra));

            return new Event.Builder(newEventId(now), now / 1000.0)
                    .level(override != null ? override : level)
                    .platform(PLATFORM)
                    .serverName(serverName)
                    .release(options.getRelease())
                    .environment(options.getEnvironment() != null ? options.getEnvironment() : DEFAULT_ENVIRONMENT)
                    .message(message)
                    .exceptions(exceptions)
                    .breadcrumbs(breadcrumbs.getAll())
                    .user(context.getUser())
                    .request(context.getRequest())
                    .tags(context.getTags())
                    .extra(mergedExtra)
                    .contexts(context.getContexts())
                    .fingerprint(context.getFingerprint())
                    .sdk(SDK_NAME, SDK_VERSION)
                    .build();
        }
    }

    private String send(Event event) {
        Event finalEvent = event;
        BeforeSendHook hook = options.getBeforeSend();
        if (hook != null) {
            finalEvent = runHook("beforeSend", event, hook::beforeSend);
            if (finalEvent == null) {
                diagnostics.debug("Event dropped by beforeSend hook.");
                return null;
            }
        }

        Event sanitized = Sanitizer.sanitize(finalEvent, options.getSensitiveKeys());
        try {
            transport.send(sanitized);
        } catch (RuntimeException e) {
            diagnostics.error("Failed to send event " + sanitized.getEventId(), e);
        }
        return sanitized.getEventId();
    }

    /**
     * A hook that throws keeps the original value; one that returns {@code null} drops it.
     */
    private <T> T runHook(String name, T value, Function<T, HookResult<T>> hook) {
        HookResult<T> result;
        try {
            result = hook.apply(value);
        } catch (RuntimeException e) {
            diagnostics.error(name + " hook failed, keeping the original", e);
            return value;
        }
        return result != null ? result.resolve(value) : null;
    }

    private void installErrorHandlers() {
        installedHandler = CaptureHandler.install(this);
        diagnostics.debug("Auto-capture: installed uncaught exception handler.");
    }

    private void captureUncaught(Thread thread, Throwable throwable) {
        captureThrowable(throwable, Severity.FATAL, Map.of("thread", thread.getName()),
                new Mechanism(Mechanism.UNCAUGHT_EXCEPTION_HANDLER, false));
        flush();
    }

    /**
     * Default uncaught exception handler of one client. Handlers of several clients form a chain
     * through {@code previous}; closing a client unlinks its handler wherever it sits in the chain.
     */
    private static final class CaptureHandler implements Thread.UncaughtExceptionHandler {

        private final ErrorTrackerClient owner;
        private volatile Thread.UncaughtExceptionHandler previous;

        private CaptureHandler(ErrorTrackerClient owner, Thread.UncaughtExceptionHandler previous) {
            this.owner    = owner;
            this.previous = previous;
        }

        static CaptureHandler install(ErrorTrackerClient owner) {
            synchronized (CaptureHandler.class) {
                CaptureHandler handler = new CaptureHandler(owner, Thread.getDefaultUncaughtExceptionHandler());
                Thread.setDefaultUncaughtExceptionHandler(handler);
                return handler;
            }
        }

        static void uninstall(CaptureHandler handler) {
            synchronized (CaptureHandler.class) {
                Thread.UncaughtExceptionHandler current = Thread.getDefaultUncaughtExceptionHandler();
                if (current == handler) {
                    Thread.setDefaultUncaughtExceptionHandler(handler.previous);
                    return;
                }
                while (current instanceof CaptureHandler link) {
                    if (link.previous == handler) {
                        link.previous = handler.previous;
                        return;
                    }
                    current = link.previous;
                }
            }
        }

        @Override
        public void uncaughtException(Thread thread, Throwable throwable) {
            owner.captureUncaught(thread, throwable);
            Thread.UncaughtExceptionHandler next = previous;
            if (next != null) {
                next.uncaughtException(thread, throwable);
            }
        }
    }

    private static Transport createTransport(ErrorTrackerOptions options, Diagnostics diagnostics) {
        Transport selected;
        if (options.getTransport() != null) {
            selected = options.getTransport();
        } else if (options.isConsoleDsn()) {
            selected = new ConsoleTransport();
        } else {
            selected = new HttpTransport(options.getDsn(), options.getSendTimeout(), options.getHeaders(), diagnostics);
        }
        if (options.isAsyncDelivery()) {
            selected = new QueueingTransport(selected, options.getMaxQueueSize(), diagnostics);
        }
        return selected;
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            return UNKNOWN_SERVER;
        }
    }

    /** Millisecond timestamp prefix plus a random suffix. */
    private static String newEventId(long nowMillis) {
        return nowMillis + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 9);
    }
}
