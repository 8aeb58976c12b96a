package de.bsommerfeld.convotree.core.domain;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.convotree.core.util.Json;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageContentTest {

    @Test
    void preview_shouldReturnTrimmedFirstText() {
        assertEquals("Hello", MessageContent.preview(Json.textPayload("  Hello  "), 50));
    }

    @Test
    void preview_shouldTruncateWithEllipsis() {
        String text = "a".repeat(60);
        String preview = MessageContent.preview(Json.textPayload(text), 50);

        assertEquals("a".repeat(50) + "...", preview);
    }

    @Test
    void preview_shouldNotAppendEllipsisAtExactLength() {
        String text = "b".repeat(50);
        assertEquals(text, MessageContent.preview(Json.textPayload(text), 50));
    }

    @Test
    void preview_shouldSkipBlocksWithoutText() {
        ObjectNode data = Json.object();
        var blocks = data.putArray("blocks");
        blocks.addObject().put("type", "image").put("url", "http://x");
        blocks.addObject().put("type", "main_text").put("content", "   ");
        blocks.addObject().put("type", "main_text").put("content", "second");

        assertEquals("second", MessageContent.preview(data, 50));
    }

    @Test
    void preview_shouldReturnEmptyForMissingBlocks() {
        assertEquals("", MessageContent.preview(Json.object(), 50));
        assertEquals("", MessageContent.preview(null, 50));
    }

    @Test
    void preview_shouldIgnoreNonTextualContent() {
        ObjectNode data = Json.object();
        data.putArray("blocks").addObject().put("type", "main_text").put("content", 42);

        assertEquals("", MessageContent.preview(data, 50));
    }

    @Test
    void searchableText_shouldJoinTextBlocksWithNewline() {
        ObjectNode data = Json.object();
        var blocks = data.putArray("blocks");
        blocks.addObject().put("type", "thinking").put("content", "pondering");
        blocks.addObject().put("type", "main_text").put("content", "answer");
        blocks.addObject().put("type", "tool").put("content", "ignored");
        blocks.addObject().put("type", "code").put("content", "x = 1");

        assertEquals("pondering\nanswer\nx = 1", MessageContent.searchableText(data));
    }

    @Test
    void searchableText_shouldReturnNullWithoutTextBlocks() {
        ObjectNode data = Json.object();
        data.putArray("blocks").addObject().put("type", "image");

        assertNull(MessageContent.searchableText(data));
    }
}
