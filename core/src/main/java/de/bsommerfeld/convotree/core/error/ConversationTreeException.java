package de.bsommerfeld.convotree.core.error;

/**
 * Base type of all business failures raised by the tree engine.
 */
public abstract class ConversationTreeException extends RuntimeException {

    private final ErrorCode code;

    protected ConversationTreeException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
