package de.bsommerfeld.convotree.core.view;

import java.util.List;

/**
 * Bounded projection of a topic's tree.
 *
 * @param nodes          ungrouped nodes in depth-first order
 * @param siblingsGroups collapsed alternate-response groups
 * @param activeNodeId   the focus node the view was built around
 */
public record TreeView(List<TreeNode> nodes, List<SiblingsGroup> siblingsGroups, String activeNodeId) {

    public TreeView {
        nodes = List.copyOf(nodes);
        siblingsGroups = List.copyOf(siblingsGroups);
    }

    public static TreeView empty() {
        return new TreeView(List.of(), List.of(), null);
    }
}
