package dev.lzrvc.errortracker;

import dev.lzrvc.errortracker.internal.JsonUtil;
import dev.lzrvc.errortracker.internal.JsonUtil.JsonSerializable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dynamically typed value used for free-form event data (extra, contexts, breadcrumb data,
 * user extra, request body).
 *
 * <p>The set of variants is closed: {@link Text}, {@link Num}, {@link Bool}, {@link Null},
 * {@link Obj} and {@link Arr}. Instances are immutable.
 *
 * <pre>{@code
 * Value v = Value.of(Map.of("order", 42, "items", List.of("a", "b")));
 * }</pre>
 */
public abstract class Value implements JsonSerializable {

    private Value() {}

    /**
     * Convert a plain Java value. Strings, numbers, booleans, maps, collections, object arrays,
     * {@code int[]}, {@code long[]}, {@code double[]} and {@code null} map to their variants;
     * anything else becomes its {@code toString()} text.
     *
     * <p>Containers nested {@link Sanitizer#DEFAULT_MAX_DEPTH} levels below {@code raw} become
     * {@link Sanitizer#MAX_DEPTH_MARKER}, so self-referencing maps and lists convert safely.
     */
    public static Value of(Object raw) {
        return of(raw, 0);
    }

    /** Convert every entry of a plain map; returns an empty map for {@code null}. */
    public static Map<String, Value> ofMap(Map<String, ?> raw) {
        Map<String, Value> out = new LinkedHashMap<>();
        if (raw != null) {
            for (Map.Entry<String, ?> entry : raw.entrySet()) {
                out.put(entry.getKey(), of(entry.getValue(), 1));
            }
        }
        return out;
    }

    private static Value of(Object raw, int depth) {
        if (raw == null)                 return Null.INSTANCE;
        if (raw instanceof Value v)      return v;
        if (raw instanceof String s)     return new Text(s);
        if (raw instanceof Boolean b)    return Bool.of(b);
        if (raw instanceof Number n)     return new Num(n);
        if (raw instanceof Character c)  return new Text(c.toString());
        if (raw instanceof Enum<?> e)    return new Text(e.toString());

        Collection<?> items = asCollection(raw);
        if (!(raw instanceof Map<?, ?>) && items == null) {
            return new Text(raw.toString());
        }
        if (depth >= Sanitizer.DEFAULT_MAX_DEPTH) {
            return new Text(Sanitizer.MAX_DEPTH_MARKER);
        }
        if (raw instanceof Map<?, ?> m) {
            Map<String, Value> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : m.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), of(entry.getValue(), depth + 1));
            }
            return new Obj(entries);
        }
        List<Value> values = new ArrayList<>(items.size());
        for (Object item : items) values.add(of(item, depth + 1));
        return new Arr(values);
    }

    private static Collection<?> asCollection(Object raw) {
        if (raw instanceof Collection<?> c) return c;
        if (raw instanceof Object[] arr)    return Arrays.asList(arr);
        if (raw instanceof int[] arr)       return Arrays.stream(arr).boxed().toList();
        if (raw instanceof long[] arr)      return Arrays.stream(arr).boxed().toList();
        if (raw instanceof double[] arr)    return Arrays.stream(arr).boxed().toList();
        return null;
    }

    public static Value text(String s)      { return s == null ? Null.INSTANCE : new Text(s); }
    public static Value number(Number n)    { return n == null ? Null.INSTANCE : new Num(n); }
    public static Value bool(boolean b)     { return Bool.of(b); }
    public static Value nullValue()         { return Null.INSTANCE; }
    public static Obj object(Map<String, Value> entries) { return new Obj(entries); }
    public static Arr array(List<Value> items)             { return new Arr(items); }

    /** {@code true} for {@link Obj} and {@link Arr}. */
    public boolean isContainer() { return false; }

    /** Convert back to plain Java objects (String, Number, Boolean, null, Map, List). */
    public abstract Object unwrap();

    @Override
    public String toJson() {
        return JsonUtil.valueToJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    // -------------------------------------------------------------------------

    public static final class Text extends Value {
        private final String value;

        private Text(String value) { this.value = value; }

        public String get()     { return value; }
        @Override public Object unwrap() { return value; }

        @Override public boolean equals(Object o) { return o instanceof Text t && value.equals(t.value); }
        @Override public int hashCode()           { return value.hashCode(); }
    }

    public static final class Num extends Value {
        private final Number value;

        private Num(Number value) { this.value = value; }

        public Number get()     { return value; }
        @Override public Object unwrap() { return value; }

        @Override public boolean equals(Object o) { return o instanceof Num n && value.equals(n.value); }
        @Override public int hashCode()           { return value.hashCode(); }
    }

    public static final class Bool extends Value {
        private static final Bool TRUE  = new Bool(true);
        private static final Bool FALSE = new Bool(false);

        private final boolean value;

        private Bool(boolean value) { this.value = value; }

        static Bool of(boolean b) { return b ? TRUE : FALSE; }

        public boolean get()    { return value; }
        @Override public Object unwrap() { return value; }

        @Override public boolean equals(Object o) { return o instanceof Bool b && value == b.value; }
        @Override public int hashCode()           { return Boolean.hashCode(value); }
    }

    public static final class Null extends Value {
        static final Null INSTANCE = new Null();

        private Null() {}

        @Override public Object unwrap() { return null; }
    }

    public static final class Obj extends Value {
        private final Map<String, Value> entries;

        private Obj(Map<String, Value> entries) {
            Map<String, Value> copy = new LinkedHashMap<>();
            if (entries != null) {
                entries.forEach((k, v) -> copy.put(k, v != null ? v : Null.INSTANCE));
            }
            this.entries = Collections.unmodifiableMap(copy);
        }

        public Map<String, Value> entries() { return entries; }

        /** @return the entry, or {@code null} when absent */
        public Value get(String key) { return entries.get(key); }

        @Override public boolean isContainer() { return true; }

        @Override
        public Object unwrap() {
            Map<String, Object> out = new LinkedHashMap<>();
            entries.forEach((k, v) -> out.put(k, v.unwrap()));
            return out;
        }

        @Override public boolean equals(Object o) { return o instanceof Obj other && entries.equals(other.entries); }
        @Override public int hashCode()           { return entries.hashCode(); }
    }

    public static final class Arr extends Value {
        private final List<Value> items;

        private Arr(List<Value> items) {
            List<Value> copy = new ArrayList<>();
            if (items != null) {
                for (Value item : items) copy.add(item != null ? item : Null.INSTANCE);
            }
            this.items = Collections.unmodifiableList(copy);
        }

        public List<Value> items() { return items; }

        @Override public boolean isContainer() { return true; }

        @Override
        public Object unwrap() {
            List<Object> out = new ArrayList<>(items.size());
            for (Value item : items) out.add(item.unwrap());
            return out;
        }

        @Override public boolean equals(Object o) { return o instanceof Arr other && items.equals(other.items); }
        @Override public int hashCode()           { return Objects.hash(items); }
    }
}
