package de.bsommerfeld.convotree.core.view;

import java.util.List;

/**
 * Outcome of a message deletion.
 *
 * @param deletedIds        the deleted message first, then its removed
 *                          descendants
 * @param reparentedIds     children moved up to the deleted message's parent;
 *                          empty for cascades
 * @param activeNodeChanged whether the topic's active pointer was rewritten
 * @param newActiveNodeId   the new pointer if it changed; may be {@code null}
 *                          when it was cleared
 */
public record DeleteResult(
        List<String> deletedIds,
        List<String> reparentedIds,
        boolean activeNodeChanged,
        String newActiveNodeId) {

    public DeleteResult {
        deletedIds = List.copyOf(deletedIds);
        reparentedIds = List.copyOf(reparentedIds);
    }
}
