package de.bsommerfeld.convotree.db;

/**
 * Unchecked wrapper for a storage fault (connection loss, locked database,
 * broken SQL). The original {@link java.sql.SQLException} is kept as cause.
 * Never retried by the engine.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
