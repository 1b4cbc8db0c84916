package dev.lzrvc.errortracker.internal;

import dev.lzrvc.errortracker.Breadcrumb;
import dev.lzrvc.errortracker.BreadcrumbLevel;
import dev.lzrvc.errortracker.BreadcrumbType;
import dev.lzrvc.errortracker.Event;
import dev.lzrvc.errortracker.ExceptionValue;
import dev.lzrvc.errortracker.Mechanism;
import dev.lzrvc.errortracker.RequestContext;
import dev.lzrvc.errortracker.Severity;
import dev.lzrvc.errortracker.StackFrame;
import dev.lzrvc.errortracker.UserContext;
import dev.lzrvc.errortracker.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps events to and from their wire tree (snake_case keys, absent fields omitted).
 *
 * <p>{@link #fromValue(Value)} accepts any tree produced by {@link #toValue(Event)}, including
 * one whose values were redacted by the sanitizer.
 */
public final class EventCodec {

    private static final String USER_ID       = "id";
    private static final String USER_EMAIL    = "email";
    private static final String USER_USERNAME = "username";
    private static final String USER_IP       = "ip_address";

    private EventCodec() {}

    // -------------------------------------------------------------------------
    // Event -> tree
    // -------------------------------------------------------------------------

    public static Value.Obj toValue(Event event) {
        Map<String, Value> out = new LinkedHashMap<>();
        out.put("event_id", Value.text(event.getEventId()));
        out.put("timestamp", Value.number(event.getTimestamp()));
        out.put("level", Value.text(event.getLevel().wireName()));
        putText(out, "platform", event.getPlatform());
        putText(out, "logger", event.getLogger());
        putText(out, "transaction", event.getTransaction());
        putText(out, "server_name", event.getServerName());
        putText(out, "release", event.getRelease());
        putText(out, "environment", event.getEnvironment());
        putText(out, "message", event.getMessage());

        if (!event.getExceptions().isEmpty()) {
            List<Value> values = new ArrayList<>();
            for (ExceptionValue exc : event.getExceptions()) values.add(toValue(exc));
            out.put("exception", Value.object(Map.of("values", Value.array(values))));
        }
        if (!event.getBreadcrumbs().isEmpty()) {
            List<Value> crumbs = new ArrayList<>();
            for (Breadcrumb crumb : event.getBreadcrumbs()) crumbs.add(toValue(crumb));
            out.put("breadcrumbs", Value.array(crumbs));
        }
        if (event.getUser() != null)    out.put("user", toValue(event.getUser()));
        if (event.getRequest() != null) out.put("request", toValue(event.getRequest()));
        putStringMap(out, "tags", event.getTags());
        if (!event.getExtra().isEmpty())    out.put("extra", Value.object(event.getExtra()));
        if (!event.getContexts().isEmpty()) out.put("contexts", Value.object(event.getContexts()));
        if (!event.getFingerprint().isEmpty()) out.put("fingerprint", Value.of(event.getFingerprint()));
        if (event.getSdkName() != null) {
            Map<String, Value> sdk = new LinkedHashMap<>();
            sdk.put("name", Value.text(event.getSdkName()));
            putText(sdk, "version", event.getSdkVersion());
            out.put("sdk", Value.object(sdk));
        }
        return Value.object(out);
    }

    public static Value.Obj toValue(ExceptionValue exc) {
        Map<String, Value> out = new LinkedHashMap<>();
        putText(out, "type", exc.getType());
        putText(out, "value", exc.getValue());
        if (!exc.getFrames().isEmpty()) {
            List<Value> frames = new ArrayList<>();
            for (StackFrame frame : exc.getFrames()) frames.add(toValue(frame));
            out.put("stacktrace", Value.object(Map.of("frames", Value.array(frames))));
        }
        if (exc.getMechanism() != null) {
            Map<String, Value> mechanism = new LinkedHashMap<>();
            putText(mechanism, "type", exc.getMechanism().getType());
            mechanism.put("handled", Value.bool(exc.getMechanism().isHandled()));
            out.put("mechanism", Value.object(mechanism));
        }
        return Value.object(out);
    }

    public static Value.Obj toValue(StackFrame frame) {
        Map<String, Value> out = new LinkedHashMap<>();
        putText(out, "filename", frame.getFilename());
        putText(out, "function", frame.getFunction());
        if (frame.getLineno() != null) out.put("lineno", Value.number(frame.getLineno()));
        if (frame.getColno() != null)  out.put("colno", Value.number(frame.getColno()));
        out.put("in_app", Value.bool(frame.isInApp()));
        putText(out, "context_line", frame.getContextLine());
        if (!frame.getPreContext().isEmpty())  out.put("pre_context", Value.of(frame.getPreContext()));
        if (!frame.getPostContext().isEmpty()) out.put("post_context", Value.of(frame.getPostContext()));
        return Value.object(out);
    }

    public static Value.Obj toValue(Breadcrumb crumb) {
        Map<String, Value> out = new LinkedHashMap<>();
        out.put("type", Value.text(crumb.getType().wireName()));
        out.put("level", Value.text(crumb.getLevel().wireName()));
        putText(out, "message", crumb.getMessage());
        putText(out, "category", crumb.getCategory());
        if (!crumb.getData().isEmpty()) out.put("data", Value.object(crumb.getData()));
        out.put("timestamp", Value.number(crumb.getTimestamp()));
        return Value.object(out);
    }

    public static Value.Obj toValue(UserContext user) {
        Map<String, Value> out = new LinkedHashMap<>();
        putText(out, USER_ID, user.getId());
        putText(out, USER_EMAIL, user.getEmail());
        putText(out, USER_USERNAME, user.getUsername());
        putText(out, USER_IP, user.getIpAddress());
        // extra attributes never shadow the named fields
        user.getExtra().forEach(out::putIfAbsent);
        return Value.object(out);
    }

    public static Value.Obj toValue(RequestContext request) {
        Map<String, Value> out = new LinkedHashMap<>();
        putText(out, "url", request.getUrl());
        putText(out, "method", request.getMethod());
        putStringMap(out, "headers", request.getHeaders());
        putText(out, "query_string", request.getQueryString());
        if (request.getData() != null) out.put("data", request.getData());
        putStringMap(out, "cookies", request.getCookies());
        return Value.object(out);
    }

    // -------------------------------------------------------------------------
    // tree -> Event
    // -------------------------------------------------------------------------

    /**
     * Rebuild an event from its wire tree.
     *
     * @throws IllegalArgumentException if {@code tree} is not an object
     */
    public static Event fromValue(Value tree) {
        Value.Obj obj = asObj(tree);
        if (obj == null) throw new IllegalArgumentException("event tree must be an object");

        String eventId = text(obj.get("event_id"));
        Event.Builder b = new Event.Builder(eventId != null ? eventId : "", number(obj.get("timestamp")))
                .level(Severity.fromWireName(text(obj.get("level")), Severity.ERROR))
                .platform(text(obj.get("platform")))
                .logger(text(obj.get("logger")))
                .transaction(text(obj.get("transaction")))
                .serverName(text(obj.get("server_name")))
                .release(text(obj.get("release")))
                .environment(text(obj.get("environment")))
                .message(text(obj.get("message")));

        Value.Obj exception = asObj(obj.get("exception"));
        if (exception != null) {
            List<ExceptionValue> values = new ArrayList<>();
            for (Value v : items(exception.get("values"))) {
                Value.Obj exc = asObj(v);
                if (exc != null) values.add(exceptionFromValue(exc));
            }
            b.exceptions(values);
        }

        List<Breadcrumb> crumbs = new ArrayList<>();
        for (Value v : items(obj.get("breadcrumbs"))) {
            Value.Obj crumb = asObj(v);
            if (crumb != null) crumbs.add(breadcrumbFromValue(crumb));
        }
        b.breadcrumbs(crumbs);

        Value.Obj user = asObj(obj.get("user"));
        if (user != null) b.user(userFromValue(user));
        Value.Obj request = asObj(obj.get("request"));
        if (request != null) b.request(requestFromValue(request));

        b.tags(stringMap(obj.get("tags")));
        b.extra(entries(obj.get("extra")));
        b.contexts(entries(obj.get("contexts")));

        List<String> fingerprint = new ArrayList<>();
        for (Value v : items(obj.get("fingerprint"))) {
            String s = text(v);
            if (s != null) fingerprint.add(s);
        }
        b.fingerprint(fingerprint);

        Value.Obj sdk = asObj(obj.get("sdk"));
        if (sdk != null) b.sdk(text(sdk.get("name")), text(sdk.get("version")));
        return b.build();
    }

    private static ExceptionValue exceptionFromValue(Value.Obj exc) {
        List<StackFrame> frames = new ArrayList<>();
        Value.Obj stacktrace = asObj(exc.get("stacktrace"));
        if (stacktrace != null) {
            for (Value v : items(stacktrace.get("frames"))) {
                Value.Obj frame = asObj(v);
                if (frame != null) frames.add(frameFromValue(frame));
            }
        }
        Mechanism mechanism = null;
        Value.Obj m = asObj(exc.get("mechanism"));
        if (m != null) {
            mechanism = new Mechanism(text(m.get("type")), !(m.get("handled") instanceof Value.Bool h) || h.get());
        }
        return new ExceptionValue(text(exc.get("type")), text(exc.get("value")), frames, mechanism);
    }

    private static StackFrame frameFromValue(Value.Obj frame) {
        Value inApp = frame.get("in_app");
        return new StackFrame.Builder()
                .filename(text(frame.get("filename")))
                .function(text(frame.get("function")))
                .lineno(integer(frame.get("lineno")))
                .colno(integer(frame.get("colno")))
                .inApp(!(inApp instanceof Value.Bool b) || b.get())
                .contextLine(text(frame.get("context_line")))
                .preContext(strings(frame.get("pre_context")))
                .postContext(strings(frame.get("post_context")))
                .build();
    }

    private static Breadcrumb breadcrumbFromValue(Value.Obj crumb) {
        return new Breadcrumb.Builder(
                    BreadcrumbType.fromWireName(text(crumb.get("type")), BreadcrumbType.CUSTOM),
                    BreadcrumbLevel.fromWireName(text(crumb.get("level")), BreadcrumbLevel.INFO))
                .message(text(crumb.get("message")))
                .category(text(crumb.get("category")))
                .data(entries(crumb.get("data")))
                .timestamp(number(crumb.get("timestamp")))
                .build();
    }

    private static UserContext userFromValue(Value.Obj user) {
        UserContext.Builder b = new UserContext.Builder()
                .id(text(user.get(USER_ID)))
                .email(text(user.get(USER_EMAIL)))
                .username(text(user.get(USER_USERNAME)))
                .ipAddress(text(user.get(USER_IP)));
        user.entries().forEach((key, value) -> {
            switch (key) {
                case USER_ID, USER_EMAIL, USER_USERNAME, USER_IP -> { }
                default -> b.extra(key, value);
            }
        });
        return b.build();
    }

    private static RequestContext requestFromValue(Value.Obj request) {
        return new RequestContext.Builder()
                .url(text(request.get("url")))
                .method(text(request.get("method")))
                .headers(stringMap(request.get("headers")))
                .queryString(text(request.get("query_string")))
                .data(request.get("data"))
                .cookies(stringMap(request.get("cookies")))
                .build();
    }

    // -------------------------------------------------------------------------
    // helpers
    // -------------------------------------------------------------------------

    private static void putText(Map<String, Value> out, String key, String value) {
        if (value != null) out.put(key, Value.text(value));
    }

    private static void putStringMap(Map<String, Value> out, String key, Map<String, String> map) {
        if (map == null || map.isEmpty()) return;
        Map<String, Value> entries = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (v != null) entries.put(k, Value.text(v));
        });
        if (!entries.isEmpty()) out.put(key, Value.object(entries));
    }

    private static Value.Obj asObj(Value v) {
        return v instanceof Value.Obj o ? o : null;
    }

    private static List<Value> items(Value v) {
        return v instanceof Value.Arr a ? a.items() : List.of();
    }

    private static Map<String, Value> entries(Value v) {
        return v instanceof Value.Obj o ? o.entries() : Map.of();
    }

    /** Scalars as text; containers and null yield {@code null}. */
    private static String text(Value v) {
        if (v instanceof Value.Text t) return t.get();
        if (v instanceof Value.Num n)  return JsonUtil.numberToJson(n.get());
        if (v instanceof Value.Bool b) return String.valueOf(b.get());
        return null;
    }

    private static double number(Value v) {
        return v instanceof Value.Num n ? n.get().doubleValue() : 0.0;
    }

    private static Integer integer(Value v) {
        return v instanceof Value.Num n ? n.get().intValue() : null;
    }

    private static List<String> strings(Value v) {
        List<String> out = new ArrayList<>();
        for (Value item : items(v)) {
            String s = text(item);
            if (s != null) out.add(s);
        }
        return out;
    }

    private static Map<String, String> stringMap(Value v) {
        Map<String, String> out = new LinkedHashMap<>();
        entries(v).forEach((k, item) -> {
            String s = text(item);
            if (s != null) out.put(k, s);
        });
        return out;
    }
}
