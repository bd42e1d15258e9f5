package org.sdmodel.mdl;

/**
 * Exception thrown when a model description cannot be parsed at all.
 * Per-line problems are reported as {@link Diagnostic}s instead.
 */
public class MdlParseException extends RuntimeException {

    private final int line;

    public MdlParseException(String message) {
        super(message);
        this.line = -1;
    }

    public MdlParseException(String message, int line) {
        super("line " + line + ": " + message);
        this.line = line;
    }

    public MdlParseException(String message, Throwable cause) {
        super(message, cause);
        this.line = -1;
    }

    public int getLine() {
        return line;
    }

    public boolean hasLocation() {
        return line >= 0;
    }
}
