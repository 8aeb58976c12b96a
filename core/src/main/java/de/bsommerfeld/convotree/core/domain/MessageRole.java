package de.bsommerfeld.convotree.core.domain;

import java.util.Locale;

/**
 * Author of a message. Persisted as the lowercase {@link #wireName()}.
 */
public enum MessageRole {

    USER,
    ASSISTANT,
    SYSTEM;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Role used when rendering the tree. System messages share the assistant's
     * visual lane; the stored role is left untouched.
     */
    public MessageRole displayRole() {
        return this == SYSTEM ? ASSISTANT : this;
    }

    public static MessageRole fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
