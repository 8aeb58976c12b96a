package de.bsommerfeld.convotree.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Read-only helpers over the block list inside {@link Message#data()}. The tree
 * engine never interprets payloads beyond what is done here.
 *
 * <p>
 * Expected payload shape:
 *
 * <pre>
 * { "blocks": [ { "type": "main_text", "content": "Hello" }, ... ] }
 * </pre>
 *
 * Anything else (missing array, non-object blocks, non-string content) is
 * tolerated and simply yields no text.
 */
public final class MessageContent {

    private static final String ELLIPSIS = "...";

    /** Block types whose {@code content} is indexed for search. */
    private static final Set<String> SEARCHABLE_TYPES = Set.of("main_text", "thinking", "translation", "code");

    private MessageContent() {
    }

    /**
     * Returns the first non-blank textual {@code content} of any block, trimmed
     * and cut to {@code maxLength} characters with a trailing {@code ...} when
     * it was longer. Returns an empty string when no block carries text.
     */
    public static String preview(JsonNode data, int maxLength) {
        for (JsonNode block : blocks(data)) {
            JsonNode content = block.get("content");
            if (content == null || !content.isTextual())
                continue;
            String text = content.asText().trim();
            if (!text.isEmpty()) {
                return text.length() > maxLength ? text.substring(0, maxLength) + ELLIPSIS : text;
            }
        }
        return "";
    }

    /**
     * Joins the contents of all text-bearing blocks ({@code main_text},
     * {@code thinking}, {@code translation}, {@code code}) with newlines.
     *
     * @return the joined text, or {@code null} if there is none
     */
    public static String searchableText(JsonNode data) {
        List<String> parts = new ArrayList<>();
        for (JsonNode block : blocks(data)) {
            JsonNode type = block.get("type");
            JsonNode content = block.get("content");
            if (type == null || content == null || !content.isTextual())
                continue;
            if (SEARCHABLE_TYPES.contains(type.asText()) && !content.asText().isEmpty()) {
                parts.add(content.asText());
            }
        }
        return parts.isEmpty() ? null : String.join("\n", parts);
    }

    private static List<JsonNode> blocks(JsonNode data) {
        List<JsonNode> result = new ArrayList<>();
        if (data == null)
            return result;
        JsonNode blocks = data.get("blocks");
        if (blocks == null || !blocks.isArray())
            return result;
        for (JsonNode block : blocks) {
            if (block.isObject())
                result.add(block);
        }
        return result;
    }
}
