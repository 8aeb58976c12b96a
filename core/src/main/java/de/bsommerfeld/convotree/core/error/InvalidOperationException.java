package de.bsommerfeld.convotree.core.error;

/**
 * Thrown when a request is well-formed but violates a tree rule.
 */
public class InvalidOperationException extends ConversationTreeException {

    private final String operation;
    private final String reason;

    public InvalidOperationException(String operation, String reason) {
        super(ErrorCode.INVALID_OPERATION, "Cannot " + operation + ": " + reason);
        this.operation = operation;
        this.reason = reason;
    }

    public String getOperation() {
        return operation;
    }

    public String getReason() {
        return reason;
    }
}
