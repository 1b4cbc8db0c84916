package dev.lzrvc.errortracker;

/**
 * How an exception reached the tracker.
 */
public final class Mechanism {

    /** Explicit {@code captureException} calls. */
    public static final String GENERIC = "generic";

    /** JVM default uncaught-exception handler installed by {@code autoCaptureErrors}. */
    public static final String UNCAUGHT_EXCEPTION_HANDLER = "uncaught_exception_handler";

    private final String type;
    private final boolean handled;

    public Mechanism(String type, boolean handled) {
        this.type    = type;
        this.handled = handled;
    }

    public static Mechanism generic() {
        return new Mechanism(GENERIC, true);
    }

    public String  getType()   { return type; }
    public boolean isHandled() { return handled; }
}
