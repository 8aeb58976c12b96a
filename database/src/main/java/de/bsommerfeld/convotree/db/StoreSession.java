package de.bsommerfeld.convotree.db;

import de.bsommerfeld.convotree.core.domain.Message;
import de.bsommerfeld.convotree.core.domain.Topic;

import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage operations bound to one connection. Instances are created by a
 * {@link TreeStore} and are only valid inside the {@link StoreWork} they were
 * passed to.
 */
public interface StoreSession {

    // -- Topics --

    Optional<Topic> findTopic(String topicId) throws SQLException;

    void insertTopic(Topic topic) throws SQLException;

    void updateActiveNode(String topicId, String activeNodeId, long updatedAt) throws SQLException;

    /**
     * Deletes the topic and every message in it.
     *
     * @return number of deleted messages
     */
    int deleteTopic(String topicId) throws SQLException;

    // -- Messages --

    Optional<Message> findMessage(String id) throws SQLException;

    Optional<String> findRootId(String topicId) throws SQLException;

    boolean hasMessages(String topicId) throws SQLException;

    void insertMessage(Message message) throws SQLException;

    /**
     * Writes the mutable columns of {@code message}: parent, data, searchable
     * text, status, group, trace id, stats and {@code updatedAt}.
     */
    void updateMessage(Message message) throws SQLException;

    /** Direct children in sibling order. */
    List<String> childIds(String parentId) throws SQLException;

    /**
     * Re-points every direct child of {@code oldParentId} to
     * {@code newParentId}.
     *
     * @return number of moved children
     */
    int reparentChildren(String oldParentId, String newParentId, long updatedAt) throws SQLException;

    /** Deletes the given messages in a single batch. */
    void deleteMessages(Collection<String> ids) throws SQLException;

    /**
     * Substring search, newest first. Case is ignored for all Unicode letters,
     * not only ASCII.
     */
    List<Message> searchMessages(String topicId, String query, int limit) throws SQLException;

    // -- Traversal --

    /**
     * Ancestors of {@code nodeId} including itself, root first. Empty if the
     * node does not exist.
     */
    List<Message> pathToRoot(String nodeId) throws SQLException;

    /** Every node below {@code nodeId}, excluding {@code nodeId}. */
    Set<String> descendantIds(String nodeId) throws SQLException;

    /**
     * The subtree at {@code rootId}, expanded {@code maxDepth} levels
     * ({@code < 0} for no limit). Rows are in sibling order.
     */
    List<Message> subtree(String rootId, int maxDepth) throws SQLException;

    /** The given nodes plus all their direct children, in sibling order. */
    List<Message> nodesAndChildren(Collection<String> ids) throws SQLException;

    /** Those of {@code ids} that have at least one child. */
    Set<String> parentsWithChildren(Collection<String> ids) throws SQLException;

    /** Every message belonging to one of the given sibling groups. */
    List<Message> siblingsOf(Collection<SiblingKey> keys) throws SQLException;
}
