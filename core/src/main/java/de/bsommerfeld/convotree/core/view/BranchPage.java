package de.bsommerfeld.convotree.core.view;

import java.util.List;

/**
 * One page of a branch, root-most message first.
 *
 * @param messages     messages of the page in conversation order
 * @param activeNodeId the topic's stored active node at read time
 */
public record BranchPage(List<BranchMessage> messages, String activeNodeId) {

    public BranchPage {
        messages = List.copyOf(messages);
    }

    public static BranchPage empty() {
        return new BranchPage(List.of(), null);
    }
}
