package de.bsommerfeld.convotree.core.event;

/**
 * Common type of everything posted on the {@link TreeEventBus}. Every tree
 * change is scoped to exactly one topic.
 *
 * @see TreeEvents
 */
public interface TreeEvent {

    String topicId();
}
