package de.bsommerfeld.convotree.db;

/**
 * Entry point to the message and topic tables.
 *
 * <p>
 * All access goes through a {@link StoreSession} handed to a
 * {@link StoreWork}; the session is the transaction scope. Reads run on an
 * auto-commit session, writes in a single transaction that is rolled back if
 * the work throws anything, including business exceptions.
 */
public interface TreeStore {

    /**
     * Runs read-only work. Consecutive statements may observe concurrently
     * committed changes.
     *
     * @throws StoreException on storage failure
     */
    <T> T read(StoreWork<T> work);

    /**
     * Runs work atomically.
     *
     * @throws StoreException on storage failure, after rollback
     */
    <T> T write(StoreWork<T> work);
}
