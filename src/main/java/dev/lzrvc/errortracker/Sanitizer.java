package dev.lzrvc.errortracker;

import dev.lzrvc.errortracker.internal.EventCodec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Redacts sensitive fields from nested {@link Value} trees.
 *
 * <p>A mapping key is sensitive when any marker is a substring of the lower-cased key, so
 * {@code "user_password"} matches {@code "password"}. The value of a sensitive key is replaced by
 * a placeholder of the same kind and is not descended into. Inputs are never modified; every
 * call returns a new tree.
 *
 * <p>Depth is counted from the root, which sits at depth 0. A value reached at
 * {@code maxDepth} is replaced by {@link #MAX_DEPTH_MARKER}, whatever it holds.
 */
public final class Sanitizer {

    public static final String REDACTED = "[Sanitized]";
    public static final String MAX_DEPTH_MARKER = "[Max Depth Reached]";
    public static final int DEFAULT_MAX_DEPTH = 10;

    public static final List<String> DEFAULT_SENSITIVE_KEYS = List.of(
            "password",
            "passwd",
            "secret",
            "api_key",
            "apikey",
            "access_token",
            "auth_token",
            "token",
            "credit_card",
            "card_number",
            "cvv",
            "ssn",
            "social_security_number",
            "email",
            "phone",
            "phone_number");

    /** Top-level event fields that identify the event and are never redacted. */
    public static final Set<String> ENVELOPE_KEYS = Set.of(
            "event_id", "timestamp", "level", "platform", "sdk");

    private Sanitizer() {}

    public static Value sanitize(Value value) {
        return sanitize(value, DEFAULT_SENSITIVE_KEYS, DEFAULT_MAX_DEPTH);
    }

    public static Value sanitize(Value value, Collection<String> sensitiveKeys) {
        return sanitize(value, sensitiveKeys, DEFAULT_MAX_DEPTH);
    }

    /**
     * @param sensitiveKeys markers to redact; {@code null} selects {@link #DEFAULT_SENSITIVE_KEYS}
     *                      and an empty collection redacts nothing
     */
    public static Value sanitize(Value value, Collection<String> sensitiveKeys, int maxDepth) {
        List<String> markers = lowerCased(sensitiveKeys != null ? sensitiveKeys : DEFAULT_SENSITIVE_KEYS);
        return sanitize(value, markers, maxDepth, 0);
    }

    /**
     * Sanitize a whole event as its wire tree and rebuild it, so nested user, request, extra,
     * context and breadcrumb data are redacted the same way they would be on the wire.
     *
     * <p>The top-level {@link #ENVELOPE_KEYS} are kept as they are, whatever the markers match.
     */
    public static Event sanitize(Event event, Collection<String> sensitiveKeys) {
        List<String> markers = lowerCased(sensitiveKeys != null ? sensitiveKeys : DEFAULT_SENSITIVE_KEYS);
        Map<String, Value> out = new LinkedHashMap<>();
        Map<String, Value> root = EventCodec.toValue(event).entries();
        for (Map.Entry<String, Value> entry : root.entrySet()) {
            String key = entry.getKey();
            out.put(key, ENVELOPE_KEYS.contains(key)
                    ? entry.getValue()
                    : sanitizeEntry(key, entry.getValue(), markers, DEFAULT_MAX_DEPTH, 0));
        }
        return EventCodec.fromValue(Value.object(out));
    }

    public static boolean isSensitiveKey(String key, Collection<String> sensitiveKeys) {
        if (key == null) return false;
        return matches(key.toLowerCase(Locale.ROOT), lowerCased(sensitiveKeys));
    }

    private static Value sanitize(Value value, List<String> markers, int maxDepth, int depth) {
        if (depth >= maxDepth) {
            return Value.text(MAX_DEPTH_MARKER);
        }
        if (value == null || !value.isContainer()) {
            return value;
        }
        if (value instanceof Value.Arr arr) {
            List<Value> items = new ArrayList<>(arr.items().size());
            for (Value item : arr.items()) {
                items.add(sanitize(item, markers, maxDepth, depth + 1));
            }
            return Value.array(items);
        }

        Value.Obj obj = (Value.Obj) value;
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, Value> entry : obj.entries().entrySet()) {
            out.put(entry.getKey(), sanitizeEntry(entry.getKey(), entry.getValue(), markers, maxDepth, depth));
        }
        return Value.object(out);
    }

    // depth is that of the mapping holding the entry
    private static Value sanitizeEntry(String key, Value v, List<String> markers, int maxDepth, int depth) {
        if (matches(key.toLowerCase(Locale.ROOT), markers)) return placeholder(v);
        if (v.isContainer()) return sanitize(v, markers, maxDepth, depth + 1);
        return v;
    }

    private static Value placeholder(Value original) {
        if (original instanceof Value.Num)  return Value.number(0);
        if (original instanceof Value.Bool) return Value.bool(false);
        return Value.text(REDACTED);
    }

    private static boolean matches(String lowerKey, List<String> markers) {
        for (String marker : markers) {
            if (lowerKey.contains(marker)) return true;
        }
        return false;
    }

    private static List<String> lowerCased(Collection<String> keys) {
        List<String> out = new ArrayList<>();
        if (keys != null) {
            for (String k : keys) {
                if (k != null && !k.isEmpty()) out.add(k.toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }
}
