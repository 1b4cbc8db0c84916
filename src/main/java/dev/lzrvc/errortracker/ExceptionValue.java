package dev.lzrvc.errortracker;

import dev.lzrvc.errortracker.internal.EventCodec;
import dev.lzrvc.errortracker.internal.JsonUtil.JsonSerializable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Represents a single exception (or chained cause) within an event.
 */
public final class ExceptionValue implements JsonSerializable {

    /** Longest cause chain recorded for one capture. */
    static final int MAX_CHAIN_LENGTH = 10;

    private final String type;
    private final String value;
    private final List<StackFrame> frames;
    private final Mechanism mechanism;

    public ExceptionValue(String type, String value, List<StackFrame> frames, Mechanism mechanism) {
        this.type      = type;
        this.value     = value;
        this.frames    = frames != null ? List.copyOf(frames) : Collections.emptyList();
        this.mechanism = mechanism;
    }

    /**
     * Build an ExceptionValue from a {@link Throwable}. Frames are ordered oldest call first,
     * the reverse of {@link Throwable#getStackTrace()}.
     */
    public static ExceptionValue from(Throwable t, Mechanism mechanism) {
        StackTraceElement[] trace = t.getStackTrace();
        List<StackFrame> frames = new ArrayList<>(trace.length);
        for (int i = trace.length - 1; i >= 0; i--) {
            frames.add(StackFrame.from(trace[i]));
        }
        String message = t.getMessage();
        return new ExceptionValue(t.getClass().getName(), message != null ? message : "", frames, mechanism);
    }

    /**
     * The throwable followed by its causes, outermost first. Stops at
     * {@link #MAX_CHAIN_LENGTH} records or when a cause repeats.
     */
    public static List<ExceptionValue> chain(Throwable error, Mechanism mechanism) {
        List<ExceptionValue> chain = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = error;
        while (current != null && chain.size() < MAX_CHAIN_LENGTH && seen.add(current)) {
            chain.add(from(current, mechanism));
            current = current.getCause();
        }
        return chain;
    }

    public String           getType()      { return type; }
    public String           getValue()     { return value; }
    public List<StackFrame> getFrames()    { return frames; }
    public Mechanism        getMechanism() { return mechanism; }

    @Override
    public String toJson() {
        return EventCodec.toValue(this).toJson();
    }
}
