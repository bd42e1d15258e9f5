package org.sdmodel.edit;

/**
 * Exception thrown when an operation list cannot be read.
 */
public class EditOperationException extends RuntimeException {

    private final int index;

    public EditOperationException(String message) {
        super(message);
        this.index = -1;
    }

    public EditOperationException(String message, int index) {
        super("operation " + index + ": " + message);
        this.index = index;
    }

    public EditOperationException(String message, Throwable cause) {
        super(message, cause);
        this.index = -1;
    }

    /**
     * Position of the offending operation in the list, -1 when the whole document is bad.
     */
    public int getIndex() {
        return index;
    }
}
