package de.bsommerfeld.convotree.tree;

import de.bsommerfeld.convotree.core.config.ConvoTreeConfigLoader;
import de.bsommerfeld.convotree.core.domain.Message;
import de.bsommerfeld.convotree.core.domain.MessageRole;
import de.bsommerfeld.convotree.core.domain.Topic;
import de.bsommerfeld.convotree.core.error.InvalidOperationException;
import de.bsommerfeld.convotree.core.error.NotFoundException;
import de.bsommerfeld.convotree.core.event.TreeEventBus;
import de.bsommerfeld.convotree.core.request.CreateMessageRequest;
import de.bsommerfeld.convotree.core.request.ParentSelection;
import de.bsommerfeld.convotree.core.util.Json;
import de.bsommerfeld.convotree.db.SqlTreeStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TopicServiceTest {

    @TempDir
    Path tempDir;

    private TopicService topics;
    private MessageTreeService messages;

    @BeforeEach
    void setUp() {
        SqlTreeStore store = new SqlTreeStore(tempDir.resolve("topics.db"), 5000);
        TreeEventBus eventBus = new TreeEventBus();
        topics = new TopicService(store, eventBus);
        messages = new MessageTreeService(store, ConvoTreeConfigLoader.load(Map.of()), eventBus);
    }

    @Test
    void createTopic_shouldStartWithoutActiveNode() {
        Topic topic = topics.createTopic("Chat");

        assertNotNull(topic.id());
        assertEquals("Chat", topic.name());
        assertNull(topic.activeNodeId());
        assertEquals(topic, topics.getTopic(topic.id()));
    }

    @Test
    void getTopic_unknown_shouldFailNotFound() {
        NotFoundException e = assertThrows(NotFoundException.class, () -> topics.getTopic("ghost"));
        assertEquals("Topic", e.getEntity());
    }

    @Test
    void setActiveNode_shouldSwitchBranch() {
        Topic topic = topics.createTopic(null);
        Message root = append(topic.id(), "root");
        append(topic.id(), "reply");

        Topic switched = topics.setActiveNode(topic.id(), root.id());

        assertEquals(root.id(), switched.activeNodeId());
        assertEquals(root.id(), topics.getTopic(topic.id()).activeNodeId());
    }

    @Test
    void setActiveNode_null_shouldClearPointer() {
        Topic topic = topics.createTopic(null);
        append(topic.id(), "root");

        assertNull(topics.setActiveNode(topic.id(), null).activeNodeId());
        assertNull(topics.getTopic(topic.id()).activeNodeId());
    }

    @Test
    void setActiveNode_nodeOfOtherTopic_shouldFail() {
        Topic topic = topics.createTopic("a");
        Topic other = topics.createTopic("b");
        Message foreign = append(other.id(), "foreign");

        assertThrows(InvalidOperationException.class, () -> topics.setActiveNode(topic.id(), foreign.id()));
    }

    @Test
    void setActiveNode_unknownNode_shouldFailNotFound() {
        Topic topic = topics.createTopic("a");
        assertThrows(NotFoundException.class, () -> topics.setActiveNode(topic.id(), "ghost"));
    }

    @Test
    void deleteTopic_shouldRemoveAllMessages() {
        Topic topic = topics.createTopic("doomed");
        Message root = append(topic.id(), "root");
        messages.create(topic.id(), CreateMessageRequest
                .builder(MessageRole.ASSISTANT, Json.textPayload("a"))
                .parent(ParentSelection.of(root.id()))
                .build());

        assertEquals(2, topics.deleteTopic(topic.id()));
        assertThrows(NotFoundException.class, () -> topics.getTopic(topic.id()));
        assertThrows(NotFoundException.class, () -> messages.getById(root.id()));
    }

    @Test
    void deleteTopic_unknown_shouldFailNotFound() {
        assertThrows(NotFoundException.class, () -> topics.deleteTopic("ghost"));
    }

    private Message append(String topicId, String text) {
        return messages.create(topicId, CreateMessageRequest.builder(MessageRole.USER, Json.textPayload(text)).build());
    }
}
