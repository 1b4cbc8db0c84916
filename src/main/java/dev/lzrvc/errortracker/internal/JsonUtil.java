package dev.lzrvc.errortracker.internal;

import dev.lzrvc.errortracker.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Minimal zero-dependency JSON serializer for event payloads.
 */
public final class JsonUtil {

    private JsonUtil() {}

    /** Escape a string value and wrap it in double quotes. Returns "null" for null input. */
    public static String escape(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder(s.length() + 2);
        appendEscaped(sb, s);
        return sb.toString();
    }

    /** Serialize a {@link Value} tree. Object entries keep their insertion order. */
    public static String valueToJson(Value value) {
        StringBuilder sb = new StringBuilder();
        write(sb, value);
        return sb.toString();
    }

    /** JSON text for a number. Non-finite doubles have no JSON form and become null. */
    public static String numberToJson(Number n) {
        if (n == null) return "null";
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return "null";
            return BigDecimal.valueOf(d).toPlainString();
        }
        return n.toString();
    }

    private static void write(StringBuilder sb, Value value) {
        if (value == null || value instanceof Value.Null) {
            sb.append("null");
        } else if (value instanceof Value.Text t) {
            appendEscaped(sb, t.get());
        } else if (value instanceof Value.Num n) {
            sb.append(numberToJson(n.get()));
        } else if (value instanceof Value.Bool b) {
            sb.append(b.get());
        } else if (value instanceof Value.Obj o) {
            sb.append("{");
            boolean first = true;
            for (Map.Entry<String, Value> entry : o.entries().entrySet()) {
                if (!first) sb.append(",");
                appendEscaped(sb, entry.getKey());
                sb.append(":");
                write(sb, entry.getValue());
                first = false;
            }
            sb.append("}");
        } else if (value instanceof Value.Arr a) {
            sb.append("[");
            boolean first = true;
            for (Value item : a.items()) {
                if (!first) sb.append(",");
                write(sb, item);
                first = false;
            }
            sb.append("]");
        }
    }

    private static void appendEscaped(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"'  -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    /** Implemented by all SDK types that can serialize themselves to JSON. */
    public interface JsonSerializable {
        String toJson();
    }
}
