package de.bsommerfeld.convotree.tree;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.convotree.core.config.ConvoTreeConfig;
import de.bsommerfeld.convotree.core.domain.Message;
import de.bsommerfeld.convotree.core.domain.MessageContent;
import de.bsommerfeld.convotree.core.domain.Topic;
import de.bsommerfeld.convotree.core.error.InvalidOperationException;
import de.bsommerfeld.convotree.core.error.NotFoundException;
import de.bsommerfeld.convotree.core.event.TreeEventBus;
import de.bsommerfeld.convotree.core.event.TreeEvents;
import de.bsommerfeld.convotree.core.request.ActiveNodeStrategy;
import de.bsommerfeld.convotree.core.request.BranchQuery;
import de.bsommerfeld.convotree.core.request.CreateMessageRequest;
import de.bsommerfeld.convotree.core.request.ParentSelection;
import de.bsommerfeld.convotree.core.request.TreeQuery;
import de.bsommerfeld.convotree.core.request.UpdateMessageRequest;
import de.bsommerfeld.convotree.core.view.BranchPage;
import de.bsommerfeld.convotree.core.view.DeleteResult;
import de.bsommerfeld.convotree.core.view.TreeView;
import de.bsommerfeld.convotree.db.StoreSession;
import de.bsommerfeld.convotree.db.TreeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Entry point for reading and mutating a topic's message tree.
 *
 * <p>
 * Every mutation runs inside a single {@link TreeStore#write} transaction:
 * structural changes and the topic's active pointer commit together or not at
 * all. Events go out on the {@link TreeEventBus} only after the commit.
 *
 * <p>
 * The one check that runs outside a transaction is the cycle check of
 * {@link #update}: a concurrent writer can make it stale, which at worst
 * rejects a move that would have been valid.
 */
@Singleton
public class MessageTreeService {

    private static final Logger LOG = LoggerFactory.getLogger(MessageTreeService.class);

    private final TreeStore store;
    private final TreeEventBus eventBus;
    private final TreeProjector projector;
    private final BranchMaterializer materializer;
    private final int defaultDepth;
    private final int defaultLimit;

    /**
     * @throws IllegalArgumentException if a configured default is out of range
     */
    @Inject
    public MessageTreeService(TreeStore store, ConvoTreeConfig config, TreeEventBus eventBus) {
        int previewLength = config.tree().previewLength();
        checkArgument(previewLength > 0, "convotree.tree.preview-length must be positive, was %s", previewLength);
        checkArgument(config.tree().defaultDepth() >= TreeQuery.UNLIMITED_DEPTH,
                "convotree.tree.default-depth must be >= %s, was %s", TreeQuery.UNLIMITED_DEPTH,
                config.tree().defaultDepth());
        checkArgument(config.branch().defaultLimit() > 0,
                "convotree.branch.default-limit must be positive, was %s", config.branch().defaultLimit());

        this.store = store;
        this.eventBus = eventBus;
        this.projector = new TreeProjector(previewLength);
        this.materializer = new BranchMaterializer();
        this.defaultDepth = config.tree().defaultDepth();
        this.defaultLimit = config.branch().defaultLimit();
    }

    // =====================================================================
    // Queries
    // =====================================================================

    /**
     * Depth-bounded tree view. The path to the focus node is always included
     * and stays expanded one level past itself.
     *
     * @throws NotFoundException if the topic does not exist
     */
    public TreeView getTree(String topicId, TreeQuery query) {
        checkNotNull(topicId, "topicId");
        TreeQuery q = query != null ? query : TreeQuery.defaults();
        int depth = q.depth() != null ? q.depth() : defaultDepth;

        return store.read(session -> {
            Topic topic = requireTopic(session, topicId);
            String focus = q.nodeId() != null ? q.nodeId() : topic.activeNodeId();
            return projector.project(session, topic, q.rootId(), focus, depth);
        });
    }

    /**
     * One page of the branch ending at the query's node (or the active node).
     *
     * @throws NotFoundException if the topic, the tip or the cursor node does
     *                           not exist
     */
    public BranchPage getBranchMessages(String topicId, BranchQuery query) {
        checkNotNull(topicId, "topicId");
        BranchQuery q = query != null ? query : BranchQuery.defaults();
        int limit = q.limit() != null ? q.limit() : defaultLimit;
        checkArgument(limit > 0, "limit must be positive, was %s", limit);

        return store.read(session -> {
            Topic topic = requireTopic(session, topicId);
            return materializer.materialize(session, topic, q.nodeId(), q.beforeNodeId(), limit,
                    q.includeSiblings());
        });
    }

    /** @throws NotFoundException if no message has this id */
    public Message getById(String id) {
        checkNotNull(id, "id");
        return store.read(session -> requireMessage(session, id));
    }

    /**
     * Every message from the root down to {@code nodeId}, inclusive.
     *
     * @throws NotFoundException if the node does not exist
     */
    public List<Message> getPathToNode(String nodeId) {
        checkNotNull(nodeId, "nodeId");
        List<Message> path = store.read(session -> session.pathToRoot(nodeId));
        if (path.isEmpty()) {
            throw NotFoundException.message(nodeId);
        }
        return path;
    }

    /**
     * Case-insensitive substring search over the text blocks of one topic,
     * newest first. A blank query matches nothing.
     *
     * @throws NotFoundException if the topic does not exist
     */
    public List<Message> searchMessages(String topicId, String query, int limit) {
        checkNotNull(topicId, "topicId");
        checkArgument(limit > 0, "limit must be positive, was %s", limit);

        return store.read(session -> {
            requireTopic(session, topicId);
            if (query == null || query.isBlank()) {
                return List.of();
            }
            List<Message> hits = session.searchMessages(topicId, query.trim(), limit);
            LOG.debug("Search '{}' in topic {} matched {} messages.", query, topicId, hits.size());
            return hits;
        });
    }

    // =====================================================================
    // Mutations
    // =====================================================================

    /**
     * Creates a message and, unless the request opts out, makes it the topic's
     * active node.
     *
     * @throws NotFoundException         if the topic or an explicit parent does
     *                                   not exist
     * @throws InvalidOperationException if the parent cannot be resolved, a
     *                                   second root is requested or the parent
     *                                   belongs to another topic
     */
    public Message create(String topicId, CreateMessageRequest request) {
        checkNotNull(topicId, "topicId");
        checkNotNull(request, "request");

        Created created = store.write(session -> {
            Topic topic = requireTopic(session, topicId);
            String parentId = resolveParent(session, topic, request.parent());

            long now = System.currentTimeMillis();
            Message message = new Message(
                    UUID.randomUUID().toString(),
                    topicId,
                    parentId,
                    request.role(),
                    request.data(),
                    MessageContent.searchableText(request.data()),
                    request.status(),
                    request.siblingsGroupId(),
                    request.assistantId(),
                    request.assistantMeta(),
                    request.modelId(),
                    request.modelMeta(),
                    request.traceId(),
                    request.stats(),
                    now,
                    now);
            session.insertMessage(message);

            if (request.setAsActive()) {
                session.updateActiveNode(topicId, message.id(), now);
            }
            return new Created(message, topic.activeNodeId());
        });

        Message message = created.message();
        LOG.info("Created message {} in topic {} (role {}, parent {}, setAsActive {})",
                message.id(), topicId, message.role().wireName(), message.parentId(), request.setAsActive());

        eventBus.post(new TreeEvents.MessageCreatedEvent(topicId, message.id(), message.parentId()));
        if (request.setAsActive()) {
            eventBus.post(new TreeEvents.ActiveNodeChangedEvent(topicId, created.previousActiveNodeId(),
                    message.id()));
        }
        return message;
    }

    /**
     * Applies the fields present in {@code request}.
     *
     * @throws NotFoundException         if the message or the new parent does
     *                                   not exist
     * @throws InvalidOperationException if the move would create a cycle, cross
     *                                   topics or add a second root
     */
    public Message update(String id, UpdateMessageRequest request) {
        checkNotNull(id, "id");
        checkNotNull(request, "request");

        String newParentId = request.newParentId().orElse(null);
        if (newParentId != null) {
            Set<String> descendants = store.read(session -> session.descendantIds(id));
            if (newParentId.equals(id) || descendants.contains(newParentId)) {
                throw new InvalidOperationException("move message", "would create cycle");
            }
        }

        Message updated = store.write(session -> {
            Message existing = requireMessage(session, id);

            String parentId = existing.parentId();
            if (request.parentChange().isPresent()) {
                parentId = resolveMove(session, existing, request.parentChange().get());
            }

            Message next = new Message(
                    existing.id(),
                    existing.topicId(),
                    parentId,
                    existing.role(),
                    request.data().orElse(existing.data()),
                    request.data().isPresent()
                            ? MessageContent.searchableText(request.data().get())
                            : existing.searchableText(),
                    request.status().orElse(existing.status()),
                    request.siblingsGroupId().orElse(existing.siblingsGroupId()),
                    existing.assistantId(),
                    existing.assistantMeta(),
                    existing.modelId(),
                    existing.modelMeta(),
                    request.isTraceIdSet() ? request.traceId() : existing.traceId(),
                    request.stats().orElse(existing.stats()),
                    existing.createdAt(),
                    System.currentTimeMillis());
            session.updateMessage(next);
            return next;
        });

        LOG.info("Updated message {} (changes: {})", id, request.changedFields());
        eventBus.post(new TreeEvents.MessageUpdatedEvent(updated.topicId(), id, request.changedFields()));
        return updated;
    }

    /**
     * Deletes a message.
     *
     * <p>
     * With {@code cascade} the whole subtree goes; without it only the message
     * is removed and its children move up to its parent. Root messages can only
     * be deleted with {@code cascade}. If the active node is removed the
     * pointer follows {@code strategy} ({@code null} means
     * {@link ActiveNodeStrategy#PARENT}).
     *
     * @throws NotFoundException         if the message or its topic does not
     *                                   exist
     * @throws InvalidOperationException if a root is deleted without cascade
     */
    public DeleteResult delete(String id, boolean cascade, ActiveNodeStrategy strategy) {
        checkNotNull(id, "id");
        ActiveNodeStrategy activeStrategy = strategy != null ? strategy : ActiveNodeStrategy.PARENT;

        Deleted deleted = store.write(session -> {
            Message message = requireMessage(session, id);
            Topic topic = requireTopic(session, message.topicId());

            if (message.isRoot() && !cascade) {
                throw new InvalidOperationException("delete root message", "cascade=true required");
            }

            long now = System.currentTimeMillis();
            List<String> deletedIds = new ArrayList<>();
            List<String> reparentedIds = new ArrayList<>();
            deletedIds.add(id);

            if (cascade) {
                deletedIds.addAll(session.descendantIds(id));
                session.deleteMessages(deletedIds);
                LOG.info("Cascade deleted {} messages from {}", deletedIds.size(), id);
            } else {
                reparentedIds.addAll(session.childIds(id));
                if (!reparentedIds.isEmpty()) {
                    session.reparentChildren(id, message.parentId(), now);
                }
                session.deleteMessages(deletedIds);
                LOG.info("Deleted message {} with reparenting ({} children moved to {})",
                        id, reparentedIds.size(), message.parentId());
            }

            String previousActive = topic.activeNodeId();
            boolean activeChanged = previousActive != null && deletedIds.contains(previousActive);
            String newActive = null;
            if (activeChanged) {
                newActive = activeStrategy == ActiveNodeStrategy.CLEAR ? null : message.parentId();
                session.updateActiveNode(topic.id(), newActive, now);
                LOG.info("Updated active node of topic {} after deletion: {} -> {}",
                        topic.id(), previousActive, newActive);
            }
            return new Deleted(topic.id(), previousActive,
                    new DeleteResult(deletedIds, reparentedIds, activeChanged, newActive));
        });

        DeleteResult result = deleted.result();
        eventBus.post(new TreeEvents.MessagesDeletedEvent(deleted.topicId(), result.deletedIds(),
                result.reparentedIds()));
        if (result.activeNodeChanged()) {
            eventBus.post(new TreeEvents.ActiveNodeChangedEvent(deleted.topicId(), deleted.previousActiveNodeId(),
                    result.newActiveNodeId()));
        }
        return result;
    }

    // =====================================================================
    // Resolution helpers (run inside the caller's transaction)
    // =====================================================================

    private static String resolveParent(StoreSession session, Topic topic, ParentSelection selection)
            throws SQLException {
        switch (selection.kind()) {
            case AUTO:
                if (!session.hasMessages(topic.id())) {
                    return null;
                }
                if (topic.activeNodeId() != null) {
                    return topic.activeNodeId();
                }
                throw new InvalidOperationException("create message",
                        "Topic has messages but no activeNodeId. Please specify parentId explicitly.");
            case ROOT:
                if (session.findRootId(topic.id()).isPresent()) {
                    throw new InvalidOperationException("create root message", "Topic already has a root message");
                }
                return null;
            case PARENT:
                Message parent = requireMessage(session, selection.parentId());
                if (!parent.topicId().equals(topic.id())) {
                    throw new InvalidOperationException("create message",
                            "Parent message does not belong to this topic");
                }
                return parent.id();
            default:
                throw new IllegalStateException("Unhandled parent selection: " + selection);
        }
    }

    private static String resolveMove(StoreSession session, Message existing, ParentSelection target)
            throws SQLException {
        switch (target.kind()) {
            case ROOT:
                if (existing.isRoot()) {
                    return null;
                }
                String rootId = session.findRootId(existing.topicId()).orElse(null);
                if (rootId != null && !rootId.equals(existing.id())) {
                    throw new InvalidOperationException("move message", "Topic already has a root message");
                }
                return null;
            case PARENT:
                if (Objects.equals(target.parentId(), existing.parentId())) {
                    return existing.parentId();
                }
                Message parent = requireMessage(session, target.parentId());
                if (!parent.topicId().equals(existing.topicId())) {
                    throw new InvalidOperationException("move message",
                            "Parent message does not belong to this topic");
                }
                return parent.id();
            default:
                throw new IllegalStateException("Unsupported move target: " + target);
        }
    }

    static Topic requireTopic(StoreSession session, String topicId) throws SQLException {
        return session.findTopic(topicId).orElseThrow(() -> NotFoundException.topic(topicId));
    }

    static Message requireMessage(StoreSession session, String id) throws SQLException {
        return session.findMessage(id).orElseThrow(() -> NotFoundException.message(id));
    }

    private record Created(Message message, String previousActiveNodeId) {
    }

    private record Deleted(String topicId, String previousActiveNodeId, DeleteResult result) {
    }
}
