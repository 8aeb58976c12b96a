package de.bsommerfeld.convotree.tree;

import de.bsommerfeld.convotree.core.domain.Message;
import de.bsommerfeld.convotree.core.domain.MessageRole;
import de.bsommerfeld.convotree.core.domain.MessageStatus;
import de.bsommerfeld.convotree.core.request.TreeQuery;
import de.bsommerfeld.convotree.core.util.Json;
import de.bsommerfeld.convotree.core.view.TreeNode;
import de.bsommerfeld.convotree.core.view.TreeView;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * In-memory walk of {@link TreeProjector#build}, independent of storage.
 */
class TreeProjectorTest {

    private final TreeProjector projector = new TreeProjector(10);

    @Test
    void build_shouldOrderChildrenByCreationTime() {
        List<Message> rows = List.of(
                message("r", null, 1, 0),
                message("late", "r", 9, 0),
                message("early", "r", 2, 0));

        TreeView view = projector.build("r", rows, Set.of(), TreeQuery.UNLIMITED_DEPTH, null);

        assertEquals(List.of("r", "early", "late"), ids(view));
    }

    @Test
    void build_shouldStopAtDepthOffThePath() {
        List<Message> rows = List.of(
                message("r", null, 1, 0),
                message("a", "r", 2, 0),
                message("a1", "a", 3, 0));

        TreeView view = projector.build("r", rows, Set.of(), 0, null);

        assertEquals(List.of("r"), ids(view));
        assertTrue(view.nodes().get(0).hasChildren());
    }

    @Test
    void build_unloadedParent_shouldReportChildren() {
        List<Message> rows = List.of(
                message("r", null, 1, 0),
                message("a", "r", 2, 0),
                message("b", "r", 3, 0));

        TreeView view = projector.build("r", rows, Set.of(), 1, null, Set.of("a"));

        assertTrue(node(view, "a").hasChildren());
        assertFalse(node(view, "b").hasChildren());
    }

    @Test
    void build_shouldRestartDepthBelowActivePath() {
        List<Message> rows = List.of(
                message("r", null, 1, 0),
                message("a", "r", 2, 0),
                message("a1", "a", 3, 0),
                message("a2", "a1", 4, 0),
                message("x", "a", 5, 0),
                message("x1", "x", 6, 0));

        TreeView view = projector.build("r", rows, Set.of("r", "a"), 1, "a");

        // x is a child of an active-path node, so it is expanded one more level
        assertEquals(List.of("r", "a", "a1", "a2", "x", "x1"), ids(view));
        assertEquals("a", view.activeNodeId());
    }

    @Test
    void build_shouldIgnoreRowsNotReachableFromRoot() {
        List<Message> rows = List.of(
                message("r", null, 1, 0),
                message("stray", "elsewhere", 2, 0));

        assertEquals(List.of("r"), ids(projector.build("r", rows, Set.of(), 1, null)));
    }

    @Test
    void build_shouldGroupByParentAndGroupIdOnly() {
        List<Message> rows = List.of(
                message("r", null, 1, 0),
                message("q1", "r", 2, 0),
                message("q2", "r", 3, 0),
                message("a", "q1", 4, 3),
                message("b", "q2", 5, 3),
                message("c", "q2", 6, 3));

        TreeView view = projector.build("r", rows, Set.of(), TreeQuery.UNLIMITED_DEPTH, null);

        assertEquals(1, view.siblingsGroups().size());
        assertEquals("q2", view.siblingsGroups().get(0).parentId());
        assertEquals(List.of("r", "q1", "a", "q2"), ids(view));
    }

    @Test
    void build_shouldUsePreviewLength() {
        List<Message> rows = List.of(message("r", null, 1, 0));

        TreeNode node = projector.build("r", rows, Set.of(), 1, null).nodes().get(0);

        assertEquals("text of r", node.preview());
    }

    private static Message message(String id, String parentId, long createdAt, int group) {
        return new Message(id, "t", parentId, MessageRole.USER, Json.textPayload("text of " + id), null,
                MessageStatus.SUCCESS, group, null, null, null, null, null, null, createdAt, createdAt);
    }

    private static TreeNode node(TreeView view, String id) {
        return view.nodes().stream().filter(n -> n.id().equals(id)).findFirst().orElseThrow();
    }

    private static List<String> ids(TreeView view) {
        return view.nodes().stream().map(TreeNode::id).collect(Collectors.toList());
    }
}
