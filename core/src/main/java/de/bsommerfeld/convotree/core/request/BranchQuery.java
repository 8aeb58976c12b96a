package de.bsommerfeld.convotree.core.request;

/**
 * Options for reading one branch as a list of messages.
 *
 * @param nodeId          branch tip, {@code null} for the topic's active node
 * @param beforeNodeId    page cursor; the page ends right before this node
 * @param limit           page size, {@code null} for the configured default
 * @param includeSiblings whether alternates of each message are attached
 */
public record BranchQuery(String nodeId, String beforeNodeId, Integer limit, boolean includeSiblings) {

    public BranchQuery {
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, was " + limit);
        }
    }

    public static BranchQuery defaults() {
        return new BranchQuery(null, null, null, true);
    }

    public static BranchQuery tip(String nodeId, int limit) {
        return new BranchQuery(nodeId, null, limit, true);
    }
}
