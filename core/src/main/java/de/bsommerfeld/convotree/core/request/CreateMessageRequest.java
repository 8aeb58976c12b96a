package de.bsommerfeld.convotree.core.request;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.convotree.core.domain.MessageRole;
import de.bsommerfeld.convotree.core.domain.MessageStatus;

import java.util.Objects;

/**
 * Input for creating a message. Built via {@link #builder(MessageRole, JsonNode)};
 * everything except role and payload is optional.
 *
 * @param parent          attachment mode, defaults to
 *                        {@link ParentSelection#auto()}
 * @param role            author role
 * @param data            opaque payload
 * @param status          defaults to {@link MessageStatus#PENDING}
 * @param siblingsGroupId defaults to {@code 0} (ungrouped)
 * @param setAsActive     whether the new message becomes the topic's active
 *                        node, defaults to {@code true}
 */
public record CreateMessageRequest(
        ParentSelection parent,
        MessageRole role,
        JsonNode data,
        MessageStatus status,
        int siblingsGroupId,
        String assistantId,
        JsonNode assistantMeta,
        String modelId,
        JsonNode modelMeta,
        String traceId,
        JsonNode stats,
        boolean setAsActive) {

    public CreateMessageRequest {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(data, "data");
        status = status != null ? status : MessageStatus.PENDING;
    }

    public static Builder builder(MessageRole role, JsonNode data) {
        return new Builder(role, data);
    }

    public static final class Builder {

        private final MessageRole role;
        private final JsonNode data;
        private ParentSelection parent = ParentSelection.auto();
        private MessageStatus status = MessageStatus.PENDING;
        private int siblingsGroupId;
        private String assistantId;
        private JsonNode assistantMeta;
        private String modelId;
        private JsonNode modelMeta;
        private String traceId;
        private JsonNode stats;
        private boolean setAsActive = true;

        private Builder(MessageRole role, JsonNode data) {
            this.role = role;
            this.data = data;
        }

        public Builder parent(ParentSelection parent) {
            this.parent = parent;
            return this;
        }

        public Builder status(MessageStatus status) {
            this.status = status;
            return this;
        }

        public Builder siblingsGroupId(int siblingsGroupId) {
            this.siblingsGroupId = siblingsGroupId;
            return this;
        }

        public Builder assistant(String assistantId, JsonNode assistantMeta) {
            this.assistantId = assistantId;
            this.assistantMeta = assistantMeta;
            return this;
        }

        public Builder model(String modelId, JsonNode modelMeta) {
            this.modelId = modelId;
            this.modelMeta = modelMeta;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder stats(JsonNode stats) {
            this.stats = stats;
            return this;
        }

        public Builder setAsActive(boolean setAsActive) {
            this.setAsActive = setAsActive;
            return this;
        }

        public CreateMessageRequest build() {
            return new CreateMessageRequest(parent, role, data, status, siblingsGroupId, assistantId,
                    assistantMeta, modelId, modelMeta, traceId, stats, setAsActive);
        }
    }
}
