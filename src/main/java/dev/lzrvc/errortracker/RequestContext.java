package dev.lzrvc.errortracker;

import dev.lzrvc.errortracker.internal.EventCodec;
import dev.lzrvc.errortracker.internal.JsonUtil.JsonSerializable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of the request being served when an event is captured.
 *
 * <p>All maps are copied when {@link Builder#build()} runs, so later changes to the caller's
 * live request objects never reach an already captured event.
 *
 * <pre>{@code
 * tracker.setRequest(new RequestContext.Builder()
 *     .url("https://shop.example.com/checkout")
 *     .method("POST")
 *     .header("User-Agent", userAgent)
 *     .build());
 * }</pre>
 */
public final class RequestContext implements JsonSerializable {

    private final String url;
    private final String method;
    private final Map<String, String> headers;
    private final String queryString;
    private final Value data;
    private final Map<String, String> cookies;

    private RequestContext(Builder builder) {
        this.url         = builder.url;
        this.method      = builder.method;
        this.headers     = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.queryString = builder.queryString;
        this.data        = builder.data;
        this.cookies     = Collections.unmodifiableMap(new LinkedHashMap<>(builder.cookies));
    }

    public String              getUrl()         { return url; }
    public String              getMethod()      { return method; }
    public Map<String, String> getHeaders()     { return headers; }
    public String              getQueryString() { return queryString; }
    public Value               getData()        { return data; }
    public Map<String, String> getCookies()     { return cookies; }

    public Builder toBuilder() {
        return new Builder().url(url).method(method).headers(headers)
                .queryString(queryString).data(data).cookies(cookies);
    }

    @Override
    public String toJson() {
        return EventCodec.toValue(this).toJson();
    }

    public static final class Builder {
        private String url;
        private String method;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String queryString;
        private Value data;
        private final Map<String, String> cookies = new LinkedHashMap<>();

        public Builder url(String url)                 { this.url = url;                 return this; }
        public Builder method(String method)           { this.method = method;           return this; }
        public Builder queryString(String queryString) { this.queryString = queryString; return this; }

        public Builder header(String name, String value) {
            if (name != null && value != null) headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.clear();
            if (headers != null) headers.forEach(this::header);
            return this;
        }

        public Builder cookie(String name, String value) {
            if (name != null && value != null) cookies.put(name, value);
            return this;
        }

        public Builder cookies(Map<String, String> cookies) {
            this.cookies.clear();
            if (cookies != null) cookies.forEach(this::cookie);
            return this;
        }

        /** Request body. Plain Java values are converted with {@link Value#of(Object)}. */
        public Builder data(Object data) {
            this.data = data != null ? Value.of(data) : null;
            return this;
        }

        public RequestContext build() { return new RequestContext(this); }
    }
}
