package dev.lzrvc.errortracker;

import java.util.Locale;

/** Level of a {@link Breadcrumb}. */
public enum BreadcrumbLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    FATAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BreadcrumbLevel fromWireName(String name, BreadcrumbLevel fallback) {
        if (name == null) return fallback;
        for (BreadcrumbLevel l : values()) {
            if (l.wireName().equalsIgnoreCase(name)) return l;
        }
        return fallback;
    }
}
