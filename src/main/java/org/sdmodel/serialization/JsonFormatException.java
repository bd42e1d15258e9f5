package org.sdmodel.serialization;

/**
 * Exception thrown when a JSON document is not well-formed.
 */
public class JsonFormatException extends RuntimeException {

    private final int position;

    public JsonFormatException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
