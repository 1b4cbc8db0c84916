package dev.lzrvc.errortracker;

import java.util.Locale;

/** Kind of activity a {@link Breadcrumb} records. */
public enum BreadcrumbType {
    NAVIGATION,
    USER,
    HTTP,
    CONSOLE,
    CUSTOM;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BreadcrumbType fromWireName(String name, BreadcrumbType fallback) {
        if (name == null) return fallback;
        for (BreadcrumbType t : values()) {
            if (t.wireName().equalsIgnoreCase(name)) return t;
        }
        return fallback;
    }
}
