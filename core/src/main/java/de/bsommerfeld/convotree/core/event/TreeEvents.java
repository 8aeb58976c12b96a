package de.bsommerfeld.convotree.core.event;

import java.util.List;

/**
 * Notifications published on the {@link TreeEventBus} after a mutation has
 * been committed. Listeners never observe events for rolled-back work.
 */
public class TreeEvents {

    private TreeEvents() {
    }

    public record MessageCreatedEvent(String topicId, String messageId, String parentId) implements TreeEvent {
    }

    public record MessageUpdatedEvent(String topicId, String messageId, List<String> changedFields) implements TreeEvent {
    }

    /**
     * @param deletedIds    all removed messages
     * @param reparentedIds children that were moved up, empty for cascades
     */
    public record MessagesDeletedEvent(String topicId, List<String> deletedIds, List<String> reparentedIds) implements TreeEvent {
    }

    /**
     * Fired whenever a topic's active node pointer moves, whether through
     * message creation, deletion or an explicit branch switch.
     */
    public record ActiveNodeChangedEvent(String topicId, String previousNodeId, String activeNodeId) implements TreeEvent {
    }

    public record TopicDeletedEvent(String topicId, int deletedMessages) implements TreeEvent {
    }
}
