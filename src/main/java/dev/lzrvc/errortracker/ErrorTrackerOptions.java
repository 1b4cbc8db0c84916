package dev.lzrvc.errortracker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Configuration for an {@link ErrorTrackerClient}.
 *
 * <p>Build via {@link Builder}:
 * <pre>{@code
 * ErrorTrackerOptions options = new ErrorTrackerOptions.Builder("https://ingest.example.com/api/events")
 *     .release("1.2.3")
 *     .environment("staging")
 *     .sampleRate(0.25)
 *     .build();
 * }</pre>
 *
 * <p>Use the DSN {@value #CONSOLE_DSN} to print events locally instead of posting them.
 */
public final class ErrorTrackerOptions {

    public static final String CONSOLE_DSN = "console://";

    private final String dsn;
    private final String release;
    private final String environment;
    private final String serverName;
    private final int maxBreadcrumbs;
    private final int maxQueueSize;
    private final double sampleRate;
    private final boolean enabled;
    private final boolean debug;
    private final boolean autoCaptureErrors;
    private final boolean asyncDelivery;
    private final Duration sendTimeout;
    private final Map<String, String> headers;
    private final List<Pattern> ignoreErrors;
    private final List<String> sensitiveKeys;
    private final BeforeSendHook beforeSend;
    private final BeforeBreadcrumbHook beforeBreadcrumb;
    private final Transport transport;
    private final Diagnostics diagnostics;

    private ErrorTrackerOptions(Builder builder) {
        this.dsn               = builder.dsn;
        this.release           = builder.release;
        this.environment       = builder.environment;
        this.serverName        = builder.serverName;
        this.maxBreadcrumbs    = builder.maxBreadcrumbs;
        this.maxQueueSize      = builder.maxQueueSize;
        this.sampleRate        = builder.sampleRate;
        this.enabled           = builder.enabled;
        this.debug             = builder.debug;
        this.autoCaptureErrors = builder.autoCaptureErrors;
        this.asyncDelivery     = builder.asyncDelivery;
        this.sendTimeout       = builder.sendTimeout;
        this.headers           = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.ignoreErrors      = List.copyOf(builder.ignoreErrors);
        this.sensitiveKeys     = List.copyOf(builder.sensitiveKeys);
        this.beforeSend        = builder.beforeSend;
        this.beforeBreadcrumb  = builder.beforeBreadcrumb;
        this.transport         = builder.transport;
        this.diagnostics       = builder.diagnostics != null ? builder.diagnostics : Diagnostics.stderr(builder.debug);
    }

    public String               getDsn()               { return dsn; }
    public String               getRelease()           { return release; }
    public String               getEnvironment()       { return environment; }
    /** Configured server name, or {@code null} to use the local hostname. */
    public String               getServerName()        { return serverName; }
    public int                  getMaxBreadcrumbs()    { return maxBreadcrumbs; }
    public int                  getMaxQueueSize()      { return maxQueueSize; }
    public double               getSampleRate()        { return sampleRate; }
    public boolean              isEnabled()            { return enabled; }
    public boolean              isDebug()              { return debug; }
    public boolean              isAutoCaptureErrors()  { return autoCaptureErrors; }
    public boolean              isAsyncDelivery()      { return asyncDelivery; }
    public Duration             getSendTimeout()       { return sendTimeout; }
    public Map<String, String>  getHeaders()           { return headers; }
    public List<Pattern>        getIgnoreErrors()      { return ignoreErrors; }
    public List<String>         getSensitiveKeys()     { return sensitiveKeys; }
    public BeforeSendHook       getBeforeSend()        { return beforeSend; }
    public BeforeBreadcrumbHook getBeforeBreadcrumb()  { return beforeBreadcrumb; }
    /** Caller-supplied transport, or {@code null} to select one from the DSN. */
    public Transport            getTransport()         { return transport; }
    public Diagnostics          getDiagnostics()       { return diagnostics; }

    public boolean isConsoleDsn() {
        return CONSOLE_DSN.equals(dsn);
    }

    // -------------------------------------------------------------------------

    public static final class Builder {

        private final String dsn;
        private String release;
        private String environment;
        private String serverName;
        private int maxBreadcrumbs          = 100;
        private int maxQueueSize            = 100;
        private double sampleRate           = 1.0;
        private boolean enabled             = true;
        private boolean debug               = false;
        private boolean autoCaptureErrors   = false;
        private boolean asyncDelivery       = false;
        private Duration sendTimeout        = HttpTransport.DEFAULT_TIMEOUT;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final List<Pattern> ignoreErrors  = new ArrayList<>();
        private final List<String> sensitiveKeys  = new ArrayList<>(Sanitizer.DEFAULT_SENSITIVE_KEYS);
        private BeforeSendHook beforeSend;
        private BeforeBreadcrumbHook beforeBreadcrumb;
        private Transport transport;
        private Diagnostics diagnostics;

        /**
         * @param dsn required destination: an ingest URL, or {@value ErrorTrackerOptions#CONSOLE_DSN}
         */
        public Builder(String dsn) {
            if (dsn == null || dsn.isBlank()) throw new IllegalArgumentException("DSN is required");
            this.dsn = dsn;
        }

        /** Application version, e.g. {@code "1.2.3"}. */
        public Builder release(String release)           { this.release = release;           return this; }

        /** Deployment environment. Default: {@code "production"}. */
        public Builder environment(String environment)   { this.environment = environment;   return this; }

        /** Server name. Default: the local hostname, or {@code "unknown"} if it cannot be resolved. */
        public Builder serverName(String serverName)     { this.serverName = serverName;     return this; }

        /** Maximum breadcrumbs kept in memory. Default: {@code 100}. */
        public Builder maxBreadcrumbs(int max) {
            if (max < 0) throw new IllegalArgumentException("maxBreadcrumbs must not be negative: " + max);
            this.maxBreadcrumbs = max;
            return this;
        }

        /** Capacity of the background send queue used with {@link #asyncDelivery(boolean)}. Default: {@code 100}. */
        public Builder maxQueueSize(int max) {
            if (max < 1) throw new IllegalArgumentException("maxQueueSize must be positive: " + max);
            this.maxQueueSize = max;
            return this;
        }

        /** Fraction of captures to keep, in {@code [0, 1]}. Default: {@code 1.0}. */
        public Builder sampleRate(double rate) {
            if (Double.isNaN(rate) || rate < 0.0 || rate > 1.0) {
                throw new IllegalArgumentException("sampleRate must be within [0, 1]: " + rate);
            }
            this.sampleRate = rate;
            return this;
        }

        /** When {@code false}, every capture is a no-op. Default: {@code true}. */
        public Builder enabled(boolean enabled)          { this.enabled = enabled;           return this; }

        /** Print debug diagnostics to stderr. Default: {@code false}. */
        public Builder debug(boolean debug)              { this.debug = debug;               return this; }

        /**
         * Install a default uncaught exception handler that captures at {@link Severity#FATAL}.
         * Default: {@code false}.
         */
        public Builder autoCaptureErrors(boolean auto)   { this.autoCaptureErrors = auto;    return this; }

        /** Deliver from a background thread through a bounded queue. Default: {@code false}. */
        public Builder asyncDelivery(boolean async)      { this.asyncDelivery = async;       return this; }

        /** Request timeout of the HTTP transport. Default: 5 seconds. */
        public Builder sendTimeout(Duration timeout) {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("sendTimeout must be positive: " + timeout);
            }
            this.sendTimeout = timeout;
            return this;
        }

        /** Extra header sent with every HTTP delivery. */
        public Builder header(String name, String value) {
            if (name != null && value != null) headers.put(name, value);
            return this;
        }

        /**
         * Skip exceptions whose message contains the given literal string.
         * Call multiple times to add more patterns.
         */
        public Builder ignoreError(String literal) {
            this.ignoreErrors.add(Pattern.compile(Pattern.quote(literal)));
            return this;
        }

        /**
         * Skip exceptions whose message matches the given regex pattern.
         * Call multiple times to add more patterns.
         */
        public Builder ignoreErrorPattern(String regex) {
            this.ignoreErrors.add(Pattern.compile(regex));
            return this;
        }

        /**
         * Replace the sanitizer's sensitive-key markers. Default: {@link Sanitizer#DEFAULT_SENSITIVE_KEYS}.
         * Markers apply to every nested key except the event's {@link Sanitizer#ENVELOPE_KEYS}, so a
         * marker such as {@code "id"} redacts {@code user.id} but never {@code event_id}.
         */
        public Builder sensitiveKeys(Collection<String> keys) {
            this.sensitiveKeys.clear();
            if (keys != null) {
                for (String k : keys) {
                    if (k != null) sensitiveKeys.add(k);
                }
            }
            return this;
        }

        public Builder beforeSend(BeforeSendHook hook)               { this.beforeSend = hook;       return this; }
        public Builder beforeBreadcrumb(BeforeBreadcrumbHook hook)   { this.beforeBreadcrumb = hook; return this; }

        /** Use this transport instead of the one the DSN selects. */
        public Builder transport(Transport transport)    { this.transport = transport;       return this; }

        /** Where the library reports its own failures. Default: stderr. */
        public Builder diagnostics(Diagnostics diagnostics) { this.diagnostics = diagnostics; return this; }

        public ErrorTrackerOptions build() { return new ErrorTrackerOptions(this); }
    }
}
