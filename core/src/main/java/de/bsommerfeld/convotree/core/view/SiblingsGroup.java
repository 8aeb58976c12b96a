package de.bsommerfeld.convotree.core.view;

import java.util.List;

/**
 * Two or more alternate responses sharing a parent and a non-zero group id.
 */
public record SiblingsGroup(String parentId, int siblingsGroupId, List<GroupMember> nodes) {

    public SiblingsGroup {
        nodes = List.copyOf(nodes);
    }
}
