package dev.lzrvc.errortracker;

import dev.lzrvc.errortracker.internal.EventCodec;
import dev.lzrvc.errortracker.internal.JsonUtil.JsonSerializable;

import java.util.Collections;
import java.util.List;

/**
 * A single frame in a stack trace.
 */
public final class StackFrame implements JsonSerializable {

    private static final String SDK_PACKAGE = "dev.lzrvc.errortracker.";

    private final String filename;
    private final String function;
    private final Integer lineno;
    private final Integer colno;
    private final boolean inApp;
    private final String contextLine;
    private final List<String> preContext;
    private final List<String> postContext;

    private StackFrame(Builder builder) {
        this.filename    = builder.filename;
        this.function    = builder.function;
        this.lineno      = builder.lineno;
        this.colno       = builder.colno;
        this.inApp       = builder.inApp;
        this.contextLine = builder.contextLine;
        this.preContext  = builder.preContext != null ? List.copyOf(builder.preContext) : Collections.emptyList();
        this.postContext = builder.postContext != null ? List.copyOf(builder.postContext) : Collections.emptyList();
    }

    /** Build a StackFrame from a JVM {@link StackTraceElement}. */
    public static StackFrame from(StackTraceElement element) {
        return new Builder()
                .filename(element.getFileName())
                .function(element.getClassName() + "." + element.getMethodName())
                .lineno(element.getLineNumber() > 0 ? element.getLineNumber() : null)
                .inApp(isInApp(element.getClassName()))
                .build();
    }

    static boolean isInApp(String className) {
        return !className.startsWith("java.")
            && !className.startsWith("javax.")
            && !className.startsWith("jakarta.")
            && !className.startsWith("sun.")
            && !className.startsWith("com.sun.")
            && !className.startsWith("jdk.")
            && !className.startsWith(SDK_PACKAGE);
    }

    public String       getFilename()    { return filename; }
    public String       getFunction()    { return function; }
    public Integer      getLineno()      { return lineno; }
    public Integer      getColno()       { return colno; }
    public boolean      isInApp()        { return inApp; }
    public String       getContextLine() { return contextLine; }
    public List<String> getPreContext()  { return preContext; }
    public List<String> getPostContext() { return postContext; }

    @Override
    public String toJson() {
        return EventCodec.toValue(this).toJson();
    }

    public static final class Builder {
        private String filename;
        private String function;
        private Integer lineno;
        private Integer colno;
        private boolean inApp = true;
        private String contextLine;
        private List<String> preContext;
        private List<String> postContext;

        public Builder filename(String filename)          { this.filename = filename;       return this; }
        public Builder function(String function)          { this.function = function;       return this; }
        public Builder lineno(Integer lineno)             { this.lineno = lineno;           return this; }
        public Builder colno(Integer colno)               { this.colno = colno;             return this; }
        public Builder inApp(boolean inApp)               { this.inApp = inApp;             return this; }
        public Builder contextLine(String contextLine)    { this.contextLine = contextLine; return this; }
        public Builder preContext(List<String> lines)     { this.preContext = lines;        return this; }
        public Builder postContext(List<String> lines)    { this.postContext = lines;       return this; }

        public StackFrame build() { return new StackFrame(this); }
    }
}
