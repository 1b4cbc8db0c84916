package dev.lzrvc.errortracker;

import java.util.Objects;

/**
 * Outcome of a {@link BeforeSendHook} or {@link BeforeBreadcrumbHook}: keep the value as it is,
 * replace it, or drop it.
 *
 * @param <T> the hooked value type
 */
public final class HookResult<T> {

    private enum Kind { KEEP, REPLACE, DROP }

    private static final HookResult<?> KEEP = new HookResult<>(Kind.KEEP, null);
    private static final HookResult<?> DROP = new HookResult<>(Kind.DROP, null);

    private final Kind kind;
    private final T replacement;

    private HookResult(Kind kind, T replacement) {
        this.kind        = kind;
        this.replacement = replacement;
    }

    @SuppressWarnings("unchecked")
    public static <T> HookResult<T> keep() {
        return (HookResult<T>) KEEP;
    }

    public static <T> HookResult<T> replace(T replacement) {
        return new HookResult<>(Kind.REPLACE, Objects.requireNonNull(replacement, "replacement"));
    }

    @SuppressWarnings("unchecked")
    public static <T> HookResult<T> drop() {
        return (HookResult<T>) DROP;
    }

    public boolean isKeep()    { return kind == Kind.KEEP; }
    public boolean isReplace() { return kind == Kind.REPLACE; }
    public boolean isDrop()    { return kind == Kind.DROP; }

    /**
     * @return the value to continue with, or {@code null} when dropped
     */
    public T resolve(T original) {
        return switch (kind) {
            case REPLACE -> replacement;
            case DROP    -> null;
            case KEEP    -> original;
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case REPLACE -> "Replace(" + replacement + ")";
            case DROP    -> "Drop";
            case KEEP    -> "Keep";
        };
    }
}
