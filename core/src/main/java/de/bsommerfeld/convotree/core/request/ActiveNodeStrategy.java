package de.bsommerfeld.convotree.core.request;

/**
 * What happens to a topic's active node pointer when a delete removes the
 * active node.
 */
public enum ActiveNodeStrategy {

    /** Move the pointer to the deleted node's former parent. */
    PARENT,

    /** Clear the pointer. */
    CLEAR
}
