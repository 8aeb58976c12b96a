package de.bsommerfeld.convotree.core.request;

import java.util.Objects;

/**
 * Where a new message is attached. Exactly one of three modes:
 * <ul>
 * <li>{@link Kind#AUTO}: append to the topic. The first message of an empty
 * topic becomes the root, otherwise the message goes under the active
 * node.</li>
 * <li>{@link Kind#ROOT}: create the topic's root. Fails if one exists.</li>
 * <li>{@link Kind#PARENT}: attach under {@link #parentId()}, which must live
 * in the same topic.</li>
 * </ul>
 */
public final class ParentSelection {

    public enum Kind {
        AUTO,
        ROOT,
        PARENT
    }

    private static final ParentSelection AUTO = new ParentSelection(Kind.AUTO, null);
    private static final ParentSelection ROOT = new ParentSelection(Kind.ROOT, null);

    private final Kind kind;
    private final String parentId;

    private ParentSelection(Kind kind, String parentId) {
        this.kind = kind;
        this.parentId = parentId;
    }

    public static ParentSelection auto() {
        return AUTO;
    }

    public static ParentSelection root() {
        return ROOT;
    }

    public static ParentSelection of(String parentId) {
        return new ParentSelection(Kind.PARENT, Objects.requireNonNull(parentId, "parentId"));
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the explicit parent id; {@code null} unless {@link #kind()} is
     *         {@link Kind#PARENT}
     */
    public String parentId() {
        return parentId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ParentSelection))
            return false;
        ParentSelection that = (ParentSelection) o;
        return kind == that.kind && Objects.equals(parentId, that.parentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, parentId);
    }

    @Override
    public String toString() {
        return kind == Kind.PARENT ? "PARENT(" + parentId + ")" : kind.name();
    }
}
