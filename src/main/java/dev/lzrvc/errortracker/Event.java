package dev.lzrvc.errortracker;

import dev.lzrvc.errortracker.internal.EventCodec;
import dev.lzrvc.errortracker.internal.JsonUtil.JsonSerializable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The event handed to a {@link Transport}.
 *
 * <p>Instances are assembled by {@link ErrorTrackerClient} and never change afterwards. A
 * {@link BeforeSendHook} that wants a different event builds one with {@link #toBuilder()} and
 * returns it as a {@link HookResult#replace(Object) replacement}.
 */
public final class Event implements JsonSerializable {

    private final String eventId;
    private final double timestamp;
    private final Severity level;
    private final String platform;
    private final String logger;
    private final String transaction;
    private final String serverName;
    private final String release;
    private final String environment;
    private final String message;
    private final List<ExceptionValue> exceptions;
    private final List<Breadcrumb> breadcrumbs;
    private final UserContext user;
    private final RequestContext request;
    private final Map<String, String> tags;
    private final Map<String, Value> extra;
    private final Map<String, Value> contexts;
    private final List<String> fingerprint;
    private final String sdkName;
    private final String sdkVersion;

    private Event(Builder b) {
        this.eventId     = b.eventId;
        this.timestamp   = b.timestamp;
        this.level       = b.level;
        this.platform    = b.platform;
        this.logger      = b.logger;
        this.transaction = b.transaction;
        this.serverName  = b.serverName;
        this.release     = b.release;
        this.environment = b.environment;
        this.message     = b.message;
        this.exceptions  = List.copyOf(b.exceptions);
        this.breadcrumbs = List.copyOf(b.breadcrumbs);
        this.user        = b.user;
        this.request     = b.request;
        this.tags        = Collections.unmodifiableMap(new LinkedHashMap<>(b.tags));
        this.extra       = Collections.unmodifiableMap(new LinkedHashMap<>(b.extra));
        this.contexts    = Collections.unmodifiableMap(new LinkedHashMap<>(b.contexts));
        this.fingerprint = List.copyOf(b.fingerprint);
        this.sdkName     = b.sdkName;
        this.sdkVersion  = b.sdkVersion;
    }

    public String               getEventId()     { return eventId; }
    /** Epoch seconds. */
    public double               getTimestamp()   { return timestamp; }
    public Severity             getLevel()       { return level; }
    public String               getPlatform()    { return platform; }
    public String               getLogger()      { return logger; }
    public String               getTransaction() { return transaction; }
    public String               getServerName()  { return serverName; }
    public String               getRelease()     { return release; }
    public String               getEnvironment() { return environment; }
    public String               getMessage()     { return message; }
    /** Exception records, outermost first. Empty for message events. */
    public List<ExceptionValue> getExceptions()  { return exceptions; }
    /** Breadcrumb snapshot, oldest first. */
    public List<Breadcrumb>     getBreadcrumbs() { return breadcrumbs; }
    public UserContext          getUser()        { return user; }
    public RequestContext       getRequest()     { return request; }
    public Map<String, String>  getTags()        { return tags; }
    public Map<String, Value>   getExtra()       { return extra; }
    public Map<String, Value>   getContexts()    { return contexts; }
    public List<String>         getFingerprint() { return fingerprint; }
    public String               getSdkName()     { return sdkName; }
    public String               getSdkVersion()  { return sdkVersion; }

    public Builder toBuilder() {
        return new Builder(eventId, timestamp)
                .level(level)
                .platform(platform)
                .logger(logger)
                .transaction(transaction)
                .serverName(serverName)
                .release(release)
                .environment(environment)
                .message(message)
                .exceptions(exceptions)
                .breadcrumbs(breadcrumbs)
                .user(user)
                .request(request)
                .tags(tags)
                .extra(extra)
                .contexts(contexts)
                .fingerprint(fingerprint)
                .sdk(sdkName, sdkVersion);
    }

    @Override
    public String toJson() {
        return EventCodec.toValue(this).toJson();
    }

    // -------------------------------------------------------------------------

    public static final class Builder {

        private final String eventId;
        private final double timestamp;
        private Severity level = Severity.ERROR;
        private String platform = "java";
        private String logger;
        private String transaction;
        private String serverName;
        private String release;
        private String environment;
        private String message;
        private List<ExceptionValue> exceptions = Collections.emptyList();
        private List<Breadcrumb> breadcrumbs = Collections.emptyList();
        private UserContext user;
        private RequestContext request;
        private Map<String, String> tags = Collections.emptyMap();
        private Map<String, Value> extra = Collections.emptyMap();
        private Map<String, Value> contexts = Collections.emptyMap();
        private List<String> fingerprint = Collections.emptyList();
        private String sdkName;
        private String sdkVersion;

        public Builder(String eventId, double timestamp) {
            this.eventId   = Objects.requireNonNull(eventId, "eventId");
            this.timestamp = timestamp;
        }

        public Builder level(Severity level)             { this.level = Objects.requireNonNull(level, "level"); return this; }
        public Builder platform(String platform)         { this.platform = platform;       return this; }
        public Builder logger(String logger)             { this.logger = logger;           return this; }
        public Builder transaction(String transaction)   { this.transaction = transaction; return this; }
        public Builder serverName(String serverName)     { this.serverName = serverName;   return this; }
        public Builder release(String release)           { this.release = release;         return this; }
        public Builder environment(String environment)   { this.environment = environment; return this; }
        public Builder message(String message)           { this.message = message;         return this; }
        public Builder user(UserContext user)            { this.user = user;               return this; }
        public Builder request(RequestContext request)   { this.request = request;         return this; }

        public Builder exceptions(List<ExceptionValue> exceptions) {
            this.exceptions = exceptions != null ? exceptions : Collections.emptyList();
            return this;
        }

        public Builder breadcrumbs(List<Breadcrumb> breadcrumbs) {
            this.breadcrumbs = breadcrumbs != null ? breadcrumbs : Collections.emptyList();
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags != null ? tags : Collections.emptyMap();
            return this;
        }

        public Builder extra(Map<String, Value> extra) {
            this.extra = extra != null ? extra : Collections.emptyMap();
            return this;
        }

        public Builder contexts(Map<String, Value> contexts) {
            this.contexts = contexts != null ? contexts : Collections.emptyMap();
            return this;
        }

        public Builder fingerprint(List<String> fingerprint) {
            this.fingerprint = fingerprint != null ? fingerprint : Collections.emptyList();
            return this;
        }

        public Builder sdk(String name, String version) {
            this.sdkName    = name;
            this.sdkVersion = version;
            return this;
        }

        public Event build() { return new Event(this); }
    }
}
