package dev.lzrvc.errortracker;

import java.util.Locale;

/**
 * Event severity, serialized as its lower-case wire name.
 */
public enum Severity {
    FATAL,
    ERROR,
    WARNING,
    INFO,
    DEBUG;

    /** Lower-case name used on the wire, e.g. {@code "warning"}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a wire name. Unknown or null names yield {@code fallback}.
     */
    public static Severity fromWireName(String name, Severity fallback) {
        if (name == null) return fallback;
        for (Severity s : values()) {
            if (s.wireName().equalsIgnoreCase(name)) return s;
        }
        return fallback;
    }
}
