package de.bsommerfeld.convotree.core.error;

/**
 * Business error categories surfaced to callers. Neither is retryable.
 */
public enum ErrorCode {

    /** A topic, message, parent or cursor does not exist. */
    NOT_FOUND,

    /** The request breaks a tree rule (duplicate root, cycle, ...). */
    INVALID_OPERATION
}
