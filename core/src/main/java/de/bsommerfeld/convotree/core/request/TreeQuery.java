package de.bsommerfeld.convotree.core.request;

/**
 * Options for a tree projection.
 *
 * @param rootId subtree root, {@code null} for the topic's root
 * @param nodeId focus node whose path is always shown, {@code null} for the
 *               topic's active node
 * @param depth  levels expanded below the root; {@link #UNLIMITED_DEPTH} for
 *               everything, {@code null} for the configured default
 */
public record TreeQuery(String rootId, String nodeId, Integer depth) {

    public static final int UNLIMITED_DEPTH = -1;

    public TreeQuery {
        if (depth != null && depth < UNLIMITED_DEPTH) {
            throw new IllegalArgumentException("depth must be >= -1, was " + depth);
        }
    }

    public static TreeQuery defaults() {
        return new TreeQuery(null, null, null);
    }

    public static TreeQuery withDepth(int depth) {
        return new TreeQuery(null, null, depth);
    }
}
