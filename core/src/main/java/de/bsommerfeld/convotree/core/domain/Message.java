package de.bsommerfeld.convotree.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A single node of a conversation tree. Records are immutable; mutations
 * produce a new row in the store and a new instance here.
 *
 * @param id              unique id, assigned at creation
 * @param topicId         owning topic, never changes
 * @param parentId        parent message in the same topic, {@code null} for
 *                        the root
 * @param role            author role
 * @param data            opaque payload, by convention {@code {"blocks": [...]}}
 * @param searchableText  text extracted from text-bearing blocks, may be
 *                        {@code null}
 * @param status          content generation status
 * @param siblingsGroupId {@code 0} when ungrouped; compared together with
 *                        {@code parentId}
 * @param assistantId     generating assistant, pass-through
 * @param assistantMeta   assistant snapshot, pass-through
 * @param modelId         generating model, pass-through
 * @param modelMeta       model snapshot, pass-through
 * @param traceId         tracing id, pass-through
 * @param stats           token/timing stats, pass-through
 * @param createdAt       creation time in epoch milliseconds
 * @param updatedAt       last update time in epoch milliseconds
 */
public record Message(
        String id,
        String topicId,
        String parentId,
        MessageRole role,
        JsonNode data,
        String searchableText,
        MessageStatus status,
        int siblingsGroupId,
        String assistantId,
        JsonNode assistantMeta,
        String modelId,
        JsonNode modelMeta,
        String traceId,
        JsonNode stats,
        long createdAt,
        long updatedAt) {

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean isGrouped() {
        return siblingsGroupId != 0;
    }
}
