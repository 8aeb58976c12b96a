package de.bsommerfeld.convotree.core.view;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.convotree.core.domain.MessageRole;
import de.bsommerfeld.convotree.core.domain.MessageStatus;

/**
 * Lightweight summary of a message for tree rendering.
 *
 * @param role        display role; system messages are shown as assistant
 * @param preview     first text content, truncated
 * @param hasChildren whether the node has at least one child, loaded or not
 */
public record TreeNode(
        String id,
        String parentId,
        MessageRole role,
        String preview,
        String modelId,
        JsonNode modelMeta,
        MessageStatus status,
        long createdAt,
        boolean hasChildren) {

    /** Drops the parent id for use inside a {@link SiblingsGroup}. */
    public GroupMember asGroupMember() {
        return new GroupMember(id, role, preview, modelId, modelMeta, status, createdAt, hasChildren);
    }
}
