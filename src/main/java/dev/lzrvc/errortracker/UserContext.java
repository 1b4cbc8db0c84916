package dev.lzrvc.errortracker;

import dev.lzrvc.errortracker.internal.EventCodec;
import dev.lzrvc.errortracker.internal.JsonUtil.JsonSerializable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * User identity to attach to events. Every field is optional; {@code null} means unknown.
 *
 * <pre>{@code
 * tracker.setUser(new UserContext.Builder().id("u123").email("alice@example.com").build());
 * }</pre>
 */
public final class UserContext implements JsonSerializable {

    private final String id;
    private final String email;
    private final String username;
    private final String ipAddress;
    private final Map<String, Value> extra;

    private UserContext(Builder builder) {
        this.id        = builder.id;
        this.email     = builder.email;
        this.username  = builder.username;
        this.ipAddress = builder.ipAddress;
        this.extra     = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extra));
    }

    public String             getId()        { return id; }
    public String             getEmail()     { return email; }
    public String             getUsername()  { return username; }
    public String             getIpAddress() { return ipAddress; }
    public Map<String, Value> getExtra()     { return extra; }

    public Builder toBuilder() {
        return new Builder().id(id).email(email).username(username).ipAddress(ipAddress).extra(extra);
    }

    @Override
    public String toJson() {
        return EventCodec.toValue(this).toJson();
    }

    public static final class Builder {
        private String id;
        private String email;
        private String username;
        private String ipAddress;
        private final Map<String, Value> extra = new LinkedHashMap<>();

        public Builder id(String id)               { this.id = id;               return this; }
        public Builder email(String email)         { this.email = email;         return this; }
        public Builder username(String username)   { this.username = username;   return this; }
        public Builder ipAddress(String ipAddress) { this.ipAddress = ipAddress; return this; }

        /** Additional user attributes, merged into the {@code user} object on the wire. */
        public Builder extra(Map<String, ?> extra) {
            this.extra.clear();
            this.extra.putAll(Value.ofMap(extra));
            return this;
        }

        public Builder extra(String key, Object value) {
            this.extra.put(key, Value.of(value));
            return this;
        }

        public UserContext build() { return new UserContext(this); }
    }
}
