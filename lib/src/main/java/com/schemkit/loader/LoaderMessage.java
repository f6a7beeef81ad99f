package com.schemkit.loader;

/** Diagnostic produced while reading a schematic or resolving its symbols. */
public final class LoaderMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String sourceFilename;
    private final int sourceLineno;

    public LoaderMessage(Level level, String message, String sourceFilename, int sourceLineno) {
        this.level = level;
        this.message = message;
        this.sourceFilename = sourceFilename;
        this.sourceLineno = sourceLineno;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSourceFilename() {
        return sourceFilename;
    }

    /** One-based line of the offending record, or 0 when the message is not tied to a line. */
    public int getSourceLineno() {
        return sourceLineno;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(level).append(": ");
        if (sourceFilename != null) {
            builder.append(sourceFilename);
            if (sourceLineno > 0) {
                builder.append(':').append(sourceLineno);
            }
            builder.append(": ");
        }
        return builder.append(message).toString();
    }
}
