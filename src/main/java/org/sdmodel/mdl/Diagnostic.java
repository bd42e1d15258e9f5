package org.sdmodel.mdl;

/**
 * A non-fatal problem found while parsing or classifying a model.
 *
 * @param kind       Category of the problem
 * @param lineNumber 1-based source line, or -1 when not tied to a line
 * @param message    Human readable description
 */
public record Diagnostic(Kind kind, int lineNumber, String message) {

    public enum Kind {
        /** A record with too few fields or a non-numeric id; the line was kept verbatim. */
        MALFORMED_RECORD,
        /** The diagram contradicts itself (duplicate ids, a valve receiving material). */
        CONSISTENCY,
        /** A connection discriminator outside the polarity lookup table. */
        UNRECOGNIZED_POLARITY,
        /** A connection whose endpoint does not resolve to any node. */
        DANGLING_REFERENCE
    }

    public static Diagnostic malformed(int lineNumber, String message) {
        return new Diagnostic(Kind.MALFORMED_RECORD, lineNumber, message);
    }

    public static Diagnostic consistency(int lineNumber, String message) {
        return new Diagnostic(Kind.CONSISTENCY, lineNumber, message);
    }

    @Override
    public String toString() {
        return lineNumber >= 0
                ? kind + " at line " + lineNumber + ": " + message
                : kind + ": " + message;
    }
}
