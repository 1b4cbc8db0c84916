package dev.lzrvc.errortracker;

import dev.lzrvc.errortracker.internal.EventCodec;
import dev.lzrvc.errortracker.internal.JsonUtil.JsonSerializable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single breadcrumb that records an event leading up to an error.
 *
 * <pre>{@code
 * tracker.addBreadcrumb(new Breadcrumb.Builder(BreadcrumbType.HTTP, BreadcrumbLevel.INFO)
 *     .category("http.client")
 *     .message("GET /api/orders")
 *     .data("status", 200)
 *     .build());
 * }</pre>
 */
public final class Breadcrumb implements JsonSerializable {

    private final BreadcrumbType type;
    private final BreadcrumbLevel level;
    private final String message;
    private final String category;
    private final Map<String, Value> data;
    private final double timestamp;

    private Breadcrumb(Builder builder) {
        this.type      = builder.type;
        this.level     = builder.level;
        this.message   = builder.message;
        this.category  = builder.category;
        this.data      = Collections.unmodifiableMap(new LinkedHashMap<>(builder.data));
        this.timestamp = builder.timestamp != null ? builder.timestamp : System.currentTimeMillis() / 1000.0;
    }

    public BreadcrumbType     getType()      { return type; }
    public BreadcrumbLevel    getLevel()     { return level; }
    public String             getMessage()   { return message; }
    public String             getCategory()  { return category; }
    public Map<String, Value> getData()      { return data; }

    /** Creation time in epoch seconds. */
    public double getTimestamp() { return timestamp; }

    /** Builder pre-filled with this breadcrumb's fields, for hooks that return a modified copy. */
    public Builder toBuilder() {
        return new Builder(type, level)
                .message(message)
                .category(category)
                .data(data)
                .timestamp(timestamp);
    }

    @Override
    public String toJson() {
        return EventCodec.toValue(this).toJson();
    }

    public static final class Builder {
        private final BreadcrumbType type;
        private final BreadcrumbLevel level;
        private String message;
        private String category;
        private final Map<String, Value> data = new LinkedHashMap<>();
        private Double timestamp;

        public Builder(BreadcrumbType type, BreadcrumbLevel level) {
            this.type  = Objects.requireNonNull(type, "type");
            this.level = Objects.requireNonNull(level, "level");
        }

        public Builder message(String message)   { this.message = message;   return this; }
        public Builder category(String category) { this.category = category; return this; }

        /** Replace the data map. Plain Java values are converted with {@link Value#of(Object)}. */
        public Builder data(Map<String, ?> data) {
            this.data.clear();
            this.data.putAll(Value.ofMap(data));
            return this;
        }

        public Builder data(String key, Object value) {
            this.data.put(key, Value.of(value));
            return this;
        }

        /** Epoch seconds; defaults to the time {@link #build()} is called. */
        public Builder timestamp(double timestamp) { this.timestamp = timestamp; return this; }

        public Breadcrumb build() { return new Breadcrumb(this); }
    }
}
