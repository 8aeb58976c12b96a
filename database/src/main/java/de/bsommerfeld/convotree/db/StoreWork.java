package de.bsommerfeld.convotree.db;

import java.sql.SQLException;

/**
 * A unit of work executed against one {@link StoreSession}. When run through
 * {@link TreeStore#write}, everything the work does commits or rolls back
 * together.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface StoreWork<T> {

    T execute(StoreSession session) throws SQLException;
}
