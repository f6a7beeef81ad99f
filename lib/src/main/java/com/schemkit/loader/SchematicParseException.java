package com.schemkit.loader;

/** Structural error that aborts a read: a malformed number or a brace string left open at EOF. */
public final class SchematicParseException extends Exception {
    private final String sourceName;
    private final int lineNumber;

    public SchematicParseException(String message, String sourceName, int lineNumber) {
        super(sourceName + ":" + lineNumber + ": " + message);
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
    }

    public SchematicParseException(String message, String sourceName, int lineNumber, Throwable cause) {
        super(sourceName + ":" + lineNumber + ": " + message, cause);
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
