package de.bsommerfeld.convotree.core.view;

import de.bsommerfeld.convotree.core.domain.Message;

import java.util.List;

/**
 * A message on a branch, plus the other members of its siblings group (empty
 * when ungrouped, when siblings were not requested, or when it is alone).
 */
public record BranchMessage(Message message, List<Message> siblings) {

    public BranchMessage {
        siblings = siblings != null ? List.copyOf(siblings) : List.of();
    }

    public BranchMessage(Message message) {
        this(message, List.of());
    }
}
