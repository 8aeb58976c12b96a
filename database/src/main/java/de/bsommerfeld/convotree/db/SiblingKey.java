package de.bsommerfeld.convotree.db;

/**
 * Identity of a siblings group. Group ids are only meaningful together with
 * the parent they hang off.
 */
public record SiblingKey(String parentId, int siblingsGroupId) {
}
