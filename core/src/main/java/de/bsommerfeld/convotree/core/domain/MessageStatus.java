package de.bsommerfeld.convotree.core.domain;

import java.util.Locale;

/**
 * Lifecycle of a message's content generation. Independent of the tree
 * structure: a pending assistant message is a regular node.
 */
public enum MessageStatus {

    PENDING,
    SUCCESS,
    ERROR,
    PAUSED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MessageStatus fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
