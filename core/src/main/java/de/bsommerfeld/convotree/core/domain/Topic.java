package de.bsommerfeld.convotree.core.domain;

/**
 * A conversation. Owns exactly one message tree and the pointer to the tip of
 * the branch currently on screen.
 *
 * @param id           unique id
 * @param name         display name, may be {@code null}
 * @param activeNodeId tip of the displayed branch, {@code null} when nothing
 *                     is selected
 * @param createdAt    creation time in epoch milliseconds
 * @param updatedAt    last update time in epoch milliseconds
 */
public record Topic(String id, String name, String activeNodeId, long createdAt, long updatedAt) {
}
