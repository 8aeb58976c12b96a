package de.bsommerfeld.convotree.core.view;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.convotree.core.domain.MessageRole;
import de.bsommerfeld.convotree.core.domain.MessageStatus;

/**
 * A {@link TreeNode} inside a {@link SiblingsGroup}. The parent id lives on
 * the group and is not repeated per member.
 */
public record GroupMember(
        String id,
        MessageRole role,
        String preview,
        String modelId,
        JsonNode modelMeta,
        MessageStatus status,
        long createdAt,
        boolean hasChildren) {
}
