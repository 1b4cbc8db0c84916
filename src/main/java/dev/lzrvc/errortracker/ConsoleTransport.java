package dev.lzrvc.errortracker;

import dev.lzrvc.errortracker.internal.JsonUtil;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Development sink selected by the {@code console://} DSN. Prints one line per event with its
 * id, timestamp, level, message and outermost exception.
 */
public final class ConsoleTransport implements Transport {

    private final PrintStream out;

    public ConsoleTransport() {
        this(System.out);
    }

    public ConsoleTransport(PrintStream out) {
        this.out = out;
    }

    @Override
    public void send(Event event) {
        out.println("[ErrorTracker] " + JsonUtil.valueToJson(project(event)));
    }

    static Value project(Event event) {
        Map<String, Value> out = new LinkedHashMap<>();
        out.put("event_id", Value.text(event.getEventId()));
        out.put("timestamp", Value.number(event.getTimestamp()));
        out.put("level", Value.text(event.getLevel().wireName()));
        out.put("message", Value.text(event.getMessage()));
        if (event.getExceptions().isEmpty()) {
            out.put("exception", Value.nullValue());
        } else {
            ExceptionValue outermost = event.getExceptions().get(0);
            Map<String, Value> exc = new LinkedHashMap<>();
            exc.put("type", Value.text(outermost.getType()));
            exc.put("value", Value.text(outermost.getValue()));
            out.put("exception", Value.object(exc));
        }
        return Value.object(out);
    }
}
