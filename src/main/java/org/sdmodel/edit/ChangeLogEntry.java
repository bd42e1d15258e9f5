package org.sdmodel.edit;

/**
 * Outcome of one edit operation.
 *
 * @param operation  Operation name
 * @param target     The variable or {@code from -> to} pair the operation addressed
 * @param succeeded  False when the operation was skipped
 * @param message    What was done, or why nothing was
 * @param mdlComment The comment supplied with the operation
 */
public record ChangeLogEntry(String operation, String target, boolean succeeded, String message,
                             String mdlComment) {

    @Override
    public String toString() {
        String status = succeeded ? "OK" : "FAILED";
        String comment = mdlComment == null || mdlComment.isBlank() ? "" : " - " + mdlComment;
        return operation + " " + target + " [" + status + "]: " + message + comment;
    }
}
