package de.bsommerfeld.convotree.tree;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.convotree.core.domain.Message;
import de.bsommerfeld.convotree.core.domain.Topic;
import de.bsommerfeld.convotree.core.error.InvalidOperationException;
import de.bsommerfeld.convotree.core.error.NotFoundException;
import de.bsommerfeld.convotree.core.event.TreeEventBus;
import de.bsommerfeld.convotree.core.event.TreeEvents;
import de.bsommerfeld.convotree.db.TreeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Topic lifecycle and explicit branch switching.
 */
@Singleton
public class TopicService {

    private static final Logger LOG = LoggerFactory.getLogger(TopicService.class);

    private final TreeStore store;
    private final TreeEventBus eventBus;

    @Inject
    public TopicService(TreeStore store, TreeEventBus eventBus) {
        this.store = store;
        this.eventBus = eventBus;
    }

    /** Creates an empty topic. {@code name} may be {@code null}. */
    public Topic createTopic(String name) {
        long now = System.currentTimeMillis();
        Topic topic = new Topic(UUID.randomUUID().toString(), name, null, now, now);
        store.write(session -> {
            session.insertTopic(topic);
            return topic;
        });
        LOG.info("Created topic {} ({})", topic.id(), name);
        return topic;
    }

    /** @throws NotFoundException if the topic does not exist */
    public Topic getTopic(String topicId) {
        checkNotNull(topicId, "topicId");
        return store.read(session -> MessageTreeService.requireTopic(session, topicId));
    }

    /**
     * Points the topic at another branch tip. {@code null} clears the pointer.
     *
     * @return the topic after the switch
     * @throws NotFoundException         if the topic or node does not exist
     * @throws InvalidOperationException if the node belongs to another topic
     */
    public Topic setActiveNode(String topicId, String nodeId) {
        checkNotNull(topicId, "topicId");

        Switch result = store.write(session -> {
            Topic topic = MessageTreeService.requireTopic(session, topicId);
            if (nodeId != null) {
                Message node = MessageTreeService.requireMessage(session, nodeId);
                if (!node.topicId().equals(topicId)) {
                    throw new InvalidOperationException("set active node",
                            "Message does not belong to this topic");
                }
            }
            if (Objects.equals(topic.activeNodeId(), nodeId)) {
                return new Switch(topic.activeNodeId(), topic);
            }
            long now = System.currentTimeMillis();
            session.updateActiveNode(topicId, nodeId, now);
            return new Switch(topic.activeNodeId(),
                    new Topic(topic.id(), topic.name(), nodeId, topic.createdAt(), now));
        });

        String previous = result.previousActiveNodeId();
        if (!Objects.equals(previous, nodeId)) {
            LOG.info("Switched active node of topic {}: {} -> {}", topicId, previous, nodeId);
            eventBus.post(new TreeEvents.ActiveNodeChangedEvent(topicId, previous, nodeId));
        }
        return result.topic();
    }

    /**
     * Deletes the topic together with all of its messages.
     *
     * @return the number of deleted messages
     * @throws NotFoundException if the topic does not exist
     */
    public int deleteTopic(String topicId) {
        checkNotNull(topicId, "topicId");
        int deletedMessages = store.write(session -> {
            MessageTreeService.requireTopic(session, topicId);
            return session.deleteTopic(topicId);
        });
        LOG.info("Deleted topic {} with {} messages", topicId, deletedMessages);
        eventBus.post(new TreeEvents.TopicDeletedEvent(topicId, deletedMessages));
        return deletedMessages;
    }

    private record Switch(String previousActiveNodeId, Topic topic) {
    }
}
