package de.bsommerfeld.convotree.db;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.convotree.core.domain.Message;
import de.bsommerfeld.convotree.core.domain.MessageRole;
import de.bsommerfeld.convotree.core.domain.MessageStatus;
import de.bsommerfeld.convotree.core.domain.Topic;
import de.bsommerfeld.convotree.core.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC implementation of {@link StoreSession}. Owns no resources itself; the
 * connection and its transaction state belong to {@link SqlTreeStore}.
 *
 * <p>
 * Batch lookups ({@link #nodesAndChildren}, {@link #parentsWithChildren},
 * {@link #siblingsOf}) bind a JSON array and expand it with SQLite's
 * {@code json_each}, so every lookup is a single statement regardless of how
 * many ids are involved.
 */
class SqlStoreSession implements StoreSession {

    private static final Logger LOG = LoggerFactory.getLogger(SqlStoreSession.class);

    private final Connection conn;

    SqlStoreSession(Connection conn) {
        this.conn = conn;
    }

    // =====================================================================
    // Topics
    // =====================================================================

    @Override
    public Optional<Topic> findTopic(String topicId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-topic"))) {
            ps.setString(1, topicId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapTopic(rs));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public void insertTopic(Topic topic) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-topic"))) {
            ps.setString(1, topic.id());
            ps.setString(2, topic.name());
            ps.setString(3, topic.activeNodeId());
            ps.setLong(4, topic.createdAt());
            ps.setLong(5, topic.updatedAt());
            ps.executeUpdate();
        }
    }

    @Override
    public void updateActiveNode(String topicId, String activeNodeId, long updatedAt) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-topic-active-node"))) {
            ps.setString(1, activeNodeId);
            ps.setLong(2, updatedAt);
            ps.setString(3, topicId);
            ps.executeUpdate();
        }
    }

    /**
     * Messages go first so that a failure half-way never leaves a topic row
     * pointing at nothing; both statements share the caller's transaction.
     */
    @Override
    public int deleteTopic(String topicId) throws SQLException {
        int deletedMessages;
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-topic-messages"))) {
            ps.setString(1, topicId);
            deletedMessages = ps.executeUpdate();
        }
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-topic"))) {
            ps.setString(1, topicId);
            ps.executeUpdate();
        }
        return deletedMessages;
    }

    // =====================================================================
    // Messages
    // =====================================================================

    @Override
    public Optional<Message> findMessage(String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-message"))) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapMessage(rs));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> findRootId(String topicId) throws SQLException {
        return querySingleId("select-root-id", topicId);
    }

    @Override
    public boolean hasMessages(String topicId) throws SQLException {
        return querySingleId("select-any-message-id", topicId).isPresent();
    }

    @Override
    public void insertMessage(Message m) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-message"))) {
            ps.setString(1, m.id());
            ps.setString(2, m.topicId());
            ps.setString(3, m.parentId());
            ps.setString(4, m.role().wireName());
            ps.setString(5, Json.write(m.data()));
            ps.setString(6, m.searchableText());
            ps.setString(7, m.status().wireName());
            ps.setInt(8, m.siblingsGroupId());
            ps.setString(9, m.assistantId());
            ps.setString(10, Json.write(m.assistantMeta()));
            ps.setString(11, m.modelId());
            ps.setString(12, Json.write(m.modelMeta()));
            ps.setString(13, m.traceId());
            ps.setString(14, Json.write(m.stats()));
            ps.setLong(15, m.createdAt());
            ps.setLong(16, m.updatedAt());
            ps.executeUpdate();
        }
    }

    @Override
    public void updateMessage(Message m) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-message"))) {
            ps.setString(1, m.parentId());
            ps.setString(2, Json.write(m.data()));
            ps.setString(3, m.searchableText());
            ps.setString(4, m.status().wireName());
            ps.setInt(5, m.siblingsGroupId());
            ps.setString(6, m.traceId());
            ps.setString(7, Json.write(m.stats()));
            ps.setLong(8, m.updatedAt());
            ps.setString(9, m.id());
            ps.executeUpdate();
        }
    }

    @Override
    public List<String> childIds(String parentId) throws SQLException {
        return queryIds("select-child-ids", parentId);
    }

    @Override
    public int reparentChildren(String oldParentId, String newParentId, long updatedAt) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("reparent-children"))) {
            ps.setString(1, newParentId);
            ps.setLong(2, updatedAt);
            ps.setString(3, oldParentId);
            return ps.executeUpdate();
        }
    }

    @Override
    public void deleteMessages(Collection<String> ids) throws SQLException {
        if (ids.isEmpty())
            return;
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-message"))) {
            for (String id : ids) {
                ps.setString(1, id);
                ps.addBatch();
            }
            ps.executeBatch();
        }
        LOG.debug("[DB] Deleted {} messages.", ids.size());
    }

    @Override
    public List<Message> searchMessages(String topicId, String query, int limit) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("search-messages"))) {
            ps.setString(1, topicId);
            ps.setString(2, "%" + escapeLike(CaseFoldFunction.fold(query)) + "%");
            ps.setInt(3, limit);
            return queryMessages(ps);
        }
    }

    // =====================================================================
    // Traversal
    // =====================================================================

    @Override
    public List<Message> pathToRoot(String nodeId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-path-to-root"))) {
            ps.setString(1, nodeId);
            return queryMessages(ps);
        }
    }

    @Override
    public Set<String> descendantIds(String nodeId) throws SQLException {
        return new LinkedHashSet<>(queryIds("select-descendant-ids", nodeId));
    }

    @Override
    public List<Message> subtree(String rootId, int maxDepth) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-subtree"))) {
            ps.setString(1, rootId);
            ps.setInt(2, maxDepth);
            List<Message> rows = queryMessages(ps);
            LOG.debug("[DB] Subtree at {} (depth {}) loaded {} rows.", rootId, maxDepth, rows.size());
            return rows;
        }
    }

    @Override
    public List<Message> nodesAndChildren(Collection<String> ids) throws SQLException {
        if (ids.isEmpty())
            return new ArrayList<>();
        ArrayNode array = Json.array();
        ids.forEach(array::add);
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-nodes-and-children"))) {
            ps.setString(1, Json.write(array));
            return queryMessages(ps);
        }
    }

    @Override
    public Set<String> parentsWithChildren(Collection<String> ids) throws SQLException {
        Set<String> parents = new LinkedHashSet<>();
        if (ids.isEmpty())
            return parents;
        ArrayNode array = Json.array();
        ids.forEach(array::add);
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-parents-with-children"))) {
            ps.setString(1, Json.write(array));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    parents.add(rs.getString("id"));
            }
        }
        return parents;
    }

    @Override
    public List<Message> siblingsOf(Collection<SiblingKey> keys) throws SQLException {
        if (keys.isEmpty())
            return new ArrayList<>();
        ArrayNode array = Json.array();
        for (SiblingKey key : keys) {
            ObjectNode entry = array.addObject();
            entry.put("parentId", key.parentId());
            entry.put("siblingsGroupId", key.siblingsGroupId());
        }
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-siblings"))) {
            ps.setString(1, Json.write(array));
            return queryMessages(ps);
        }
    }

    // =====================================================================
    // ResultSet -> Domain Mapping
    // =====================================================================

    private List<Message> queryMessages(PreparedStatement ps) throws SQLException {
        List<Message> result = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(mapMessage(rs));
            }
        }
        return result;
    }

    private List<String> queryIds(String sqlName, String param) throws SQLException {
        List<String> ids = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    ids.add(rs.getString("id"));
            }
        }
        return ids;
    }

    private Optional<String> querySingleId(String sqlName, String param) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString("id")) : Optional.empty();
            }
        }
    }

    private static Topic mapTopic(ResultSet rs) throws SQLException {
        return new Topic(
                rs.getString("id"), rs.getString("name"), rs.getString("active_node_id"),
                rs.getLong("created_at"), rs.getLong("updated_at"));
    }

    /**
     * Maps a {@code message} row. Traversal queries append helper columns
     * ({@code seq}, {@code hops}, {@code tree_depth}); they are ignored here.
     */
    private static Message mapMessage(ResultSet rs) throws SQLException {
        return new Message(
                rs.getString("id"),
                rs.getString("topic_id"),
                rs.getString("parent_id"),
                MessageRole.fromWireName(rs.getString("role")),
                Json.read(rs.getString("data")),
                rs.getString("searchable_text"),
                MessageStatus.fromWireName(rs.getString("status")),
                rs.getInt("siblings_group_id"),
                rs.getString("assistant_id"),
                Json.read(rs.getString("assistant_meta")),
                rs.getString("model_id"),
                Json.read(rs.getString("model_meta")),
                rs.getString("trace_id"),
                Json.read(rs.getString("stats")),
                rs.getLong("created_at"),
                rs.getLong("updated_at"));
    }

    /** Escapes LIKE wildcards so user input is matched literally. */
    static String escapeLike(String query) {
        return query.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
