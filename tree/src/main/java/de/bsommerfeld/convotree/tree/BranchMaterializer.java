package de.bsommerfeld.convotree.tree;

import de.bsommerfeld.convotree.core.domain.Message;
import de.bsommerfeld.convotree.core.domain.Topic;
import de.bsommerfeld.convotree.core.error.NotFoundException;
import de.bsommerfeld.convotree.core.view.BranchMessage;
import de.bsommerfeld.convotree.core.view.BranchPage;
import de.bsommerfeld.convotree.db.SiblingKey;
import de.bsommerfeld.convotree.db.StoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads one branch as a page of messages, root-most first. A page costs one
 * path query plus at most one batched siblings query.
 */
class BranchMaterializer {

    private static final Logger LOG = LoggerFactory.getLogger(BranchMaterializer.class);

    BranchPage materialize(StoreSession session, Topic topic, String nodeId, String beforeNodeId, int limit,
            boolean includeSiblings) throws SQLException {
        String tip = nodeId != null ? nodeId : topic.activeNodeId();
        if (tip == null) {
            return BranchPage.empty();
        }

        List<Message> path = session.pathToRoot(tip);
        if (path.isEmpty()) {
            throw NotFoundException.message(tip);
        }

        List<Message> window = window(path, beforeNodeId, limit);
        LOG.debug("Branch at {}: path length {}, page size {}.", tip, path.size(), window.size());

        List<BranchMessage> messages = new ArrayList<>(window.size());
        if (!includeSiblings) {
            for (Message m : window) {
                messages.add(new BranchMessage(m));
            }
            return new BranchPage(messages, topic.activeNodeId());
        }

        Map<SiblingKey, List<Message>> groups = loadGroups(session, window);
        for (Message m : window) {
            List<Message> group = m.parentId() != null && m.isGrouped()
                    ? groups.getOrDefault(new SiblingKey(m.parentId(), m.siblingsGroupId()), List.of())
                    : List.of();
            List<Message> others = new ArrayList<>();
            if (group.size() > 1) {
                for (Message sibling : group) {
                    if (!sibling.id().equals(m.id()))
                        others.add(sibling);
                }
            }
            messages.add(new BranchMessage(m, others));
        }
        return new BranchPage(messages, topic.activeNodeId());
    }

    /**
     * Without a cursor the last {@code limit} entries; with one the
     * {@code limit} entries right before it.
     */
    static List<Message> window(List<Message> path, String beforeNodeId, int limit) {
        int start;
        int end;
        if (beforeNodeId != null) {
            int beforeIndex = indexOf(path, beforeNodeId);
            if (beforeIndex < 0) {
                throw NotFoundException.message(beforeNodeId);
            }
            start = Math.max(0, beforeIndex - limit);
            end = beforeIndex;
        } else {
            start = Math.max(0, path.size() - limit);
            end = path.size();
        }
        return path.subList(start, end);
    }

    private static int indexOf(List<Message> path, String id) {
        for (int i = 0; i < path.size(); i++) {
            if (path.get(i).id().equals(id))
                return i;
        }
        return -1;
    }

    private static Map<SiblingKey, List<Message>> loadGroups(StoreSession session, List<Message> window)
            throws SQLException {
        Set<SiblingKey> keys = new LinkedHashSet<>();
        for (Message m : window) {
            if (m.parentId() != null && m.isGrouped()) {
                keys.add(new SiblingKey(m.parentId(), m.siblingsGroupId()));
            }
        }
        Map<SiblingKey, List<Message>> groups = new LinkedHashMap<>();
        if (keys.isEmpty())
            return groups;
        for (Message sibling : session.siblingsOf(keys)) {
            groups.computeIfAbsent(new SiblingKey(sibling.parentId(), sibling.siblingsGroupId()),
                    k -> new ArrayList<>()).add(sibling);
        }
        return groups;
    }
}
