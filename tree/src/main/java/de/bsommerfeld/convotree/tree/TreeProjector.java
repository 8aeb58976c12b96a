package de.bsommerfeld.convotree.tree;

import de.bsommerfeld.convotree.core.domain.Message;
import de.bsommerfeld.convotree.core.domain.MessageContent;
import de.bsommerfeld.convotree.core.domain.Topic;
import de.bsommerfeld.convotree.core.request.TreeQuery;
import de.bsommerfeld.convotree.core.view.GroupMember;
import de.bsommerfeld.convotree.core.view.SiblingsGroup;
import de.bsommerfeld.convotree.core.view.TreeNode;
import de.bsommerfeld.convotree.core.view.TreeView;
import de.bsommerfeld.convotree.db.SiblingKey;
import de.bsommerfeld.convotree.db.StoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the depth-bounded {@link TreeView} of a topic.
 *
 * <p>
 * Loading takes at most five statements regardless of tree size: the root
 * lookup, the active path, the bounded subtree, one extension query that
 * pulls in active-path nodes beyond the depth bound together with their
 * children, and one lookup of which loaded leaves still have unloaded
 * children. Everything after that is an in-memory depth-first walk.
 */
class TreeProjector {

    private static final Logger LOG = LoggerFactory.getLogger(TreeProjector.class);

    private final int previewLength;

    TreeProjector(int previewLength) {
        this.previewLength = previewLength;
    }

    /**
     * @param depth resolved depth, {@link TreeQuery#UNLIMITED_DEPTH} for no
     *              bound
     */
    TreeView project(StoreSession session, Topic topic, String rootId, String focusId, int depth)
            throws SQLException {
        String root = rootId != null ? rootId : session.findRootId(topic.id()).orElse(null);
        if (root == null) {
            LOG.debug("Topic {} has no root, returning empty tree.", topic.id());
            return TreeView.empty();
        }

        Set<String> activePath = new LinkedHashSet<>();
        if (focusId != null) {
            for (Message m : session.pathToRoot(focusId)) {
                activePath.add(m.id());
            }
        }

        Map<String, Message> loaded = new LinkedHashMap<>();
        for (Message m : session.subtree(root, depth)) {
            loaded.put(m.id(), m);
        }
        if (loaded.isEmpty()) {
            LOG.debug("Root {} not found in topic {}, returning empty tree.", root, topic.id());
            return TreeView.empty();
        }

        if (!activePath.isEmpty()) {
            int before = loaded.size();
            for (Message m : session.nodesAndChildren(activePath)) {
                loaded.putIfAbsent(m.id(), m);
            }
            LOG.debug("Active path extension added {} nodes.", loaded.size() - before);
        }

        Set<String> loadedParents = new HashSet<>();
        for (Message m : loaded.values()) {
            loadedParents.add(m.parentId());
        }
        List<String> frontier = new ArrayList<>();
        for (String id : loaded.keySet()) {
            if (!loadedParents.contains(id)) {
                frontier.add(id);
            }
        }
        Set<String> unloadedParents = session.parentsWithChildren(frontier);

        return build(root, loaded.values(), activePath, depth, focusId, unloadedParents);
    }

    /**
     * Same as {@link #build(String, Collection, Set, int, String, Set)} where
     * every row without a loaded child is a leaf.
     */
    TreeView build(String rootId, Collection<Message> rows, Set<String> activePath, int depth,
            String activeNodeId) {
        return build(rootId, rows, activePath, depth, activeNodeId, Set.of());
    }

    /**
     * Walks {@code rows} depth-first from {@code rootId} and collapses siblings
     * groups. Rows not reachable from the root are ignored.
     *
     * @param unloadedParents ids whose children exist but are not part of
     *                        {@code rows}; they still report children
     */
    TreeView build(String rootId, Collection<Message> rows, Set<String> activePath, int depth,
            String activeNodeId, Set<String> unloadedParents) {
        return new Walk(rows, activePath, depth, unloadedParents).run(rootId, activeNodeId);
    }

    private final class Walk {

        private final Map<String, Message> byId = new HashMap<>();
        private final Map<String, List<Message>> childrenByParent = new HashMap<>();
        private final Set<String> activePath;
        private final int depth;
        private final Set<String> unloadedParents;

        private final List<TreeNode> nodes = new ArrayList<>();
        private final List<SiblingsGroup> groups = new ArrayList<>();
        private final Set<SiblingKey> seenGroups = new HashSet<>();

        Walk(Collection<Message> rows, Set<String> activePath, int depth, Set<String> unloadedParents) {
            this.activePath = activePath;
            this.depth = depth;
            this.unloadedParents = unloadedParents;
            for (Message m : rows) {
                byId.put(m.id(), m);
                childrenByParent.computeIfAbsent(m.parentId(), k -> new ArrayList<>()).add(m);
            }
            // Stable: rows already arrive in insertion order within equal timestamps.
            for (List<Message> children : childrenByParent.values()) {
                children.sort(Comparator.comparingLong(Message::createdAt));
            }
        }

        TreeView run(String rootId, String activeNodeId) {
            visit(rootId, 0);
            return new TreeView(nodes, groups, activeNodeId);
        }

        private void visit(String id, int currentDepth) {
            Message message = byId.get(id);
            if (message == null)
                return;

            if (message.isGrouped()) {
                SiblingKey key = new SiblingKey(message.parentId(), message.siblingsGroupId());
                if (seenGroups.add(key)) {
                    List<Message> members = groupMembers(message);
                    if (members.size() > 1) {
                        List<GroupMember> summaries = new ArrayList<>();
                        for (Message member : members) {
                            summaries.add(toNode(member).asGroupMember());
                        }
                        groups.add(new SiblingsGroup(message.parentId(), message.siblingsGroupId(), summaries));
                    } else {
                        nodes.add(toNode(message));
                    }
                }
            } else {
                nodes.add(toNode(message));
            }

            boolean onActivePath = activePath.contains(id);
            boolean expand = onActivePath || depth == TreeQuery.UNLIMITED_DEPTH || currentDepth < depth;
            if (expand) {
                for (Message child : children(id)) {
                    visit(child.id(), onActivePath ? 0 : currentDepth + 1);
                }
            }
        }

        private List<Message> groupMembers(Message message) {
            List<Message> members = new ArrayList<>();
            for (Message sibling : children(message.parentId())) {
                if (sibling.siblingsGroupId() == message.siblingsGroupId()) {
                    members.add(sibling);
                }
            }
            return members;
        }

        private List<Message> children(String parentId) {
            return childrenByParent.getOrDefault(parentId, List.of());
        }

        private TreeNode toNode(Message m) {
            return new TreeNode(
                    m.id(),
                    m.parentId(),
                    m.role().displayRole(),
                    MessageContent.preview(m.data(), previewLength),
                    m.modelId(),
                    m.modelMeta(),
                    m.status(),
                    m.createdAt(),
                    !children(m.id()).isEmpty() || unloadedParents.contains(m.id()));
        }
    }
}
