package de.bsommerfeld.convotree.core.request;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.convotree.core.domain.MessageStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Partial update of a message. Only fields that were explicitly set on the
 * builder are applied; unset fields keep their stored value.
 *
 * <p>
 * Moving a message is expressed through {@link Builder#moveTo(String)} (new
 * parent) or {@link Builder#moveToRoot()}; both are reported by
 * {@link #parentChange()} as a {@link ParentSelection} of kind
 * {@code PARENT} or {@code ROOT}.
 */
public final class UpdateMessageRequest {

    private final JsonNode data;
    private final ParentSelection parentChange;
    private final Integer siblingsGroupId;
    private final MessageStatus status;
    private final boolean traceIdSet;
    private final String traceId;
    private final JsonNode stats;

    private UpdateMessageRequest(Builder b) {
        this.data = b.data;
        this.parentChange = b.parentChange;
        this.siblingsGroupId = b.siblingsGroupId;
        this.status = b.status;
        this.traceIdSet = b.traceIdSet;
        this.traceId = b.traceId;
        this.stats = b.stats;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<JsonNode> data() {
        return Optional.ofNullable(data);
    }

    /**
     * @return the requested move, empty if the message stays where it is
     */
    public Optional<ParentSelection> parentChange() {
        return Optional.ofNullable(parentChange);
    }

    /**
     * @return the new parent id if this update moves the message under another
     *         message, empty if it does not move or moves to root
     */
    public Optional<String> newParentId() {
        return parentChange().map(ParentSelection::parentId);
    }

    public Optional<Integer> siblingsGroupId() {
        return Optional.ofNullable(siblingsGroupId);
    }

    public Optional<MessageStatus> status() {
        return Optional.ofNullable(status);
    }

    public boolean isTraceIdSet() {
        return traceIdSet;
    }

    public String traceId() {
        return traceId;
    }

    public Optional<JsonNode> stats() {
        return Optional.ofNullable(stats);
    }

    /** Names of the fields carried by this update, for logging. */
    public List<String> changedFields() {
        List<String> fields = new ArrayList<>();
        if (data != null)
            fields.add("data");
        if (parentChange != null)
            fields.add("parentId");
        if (siblingsGroupId != null)
            fields.add("siblingsGroupId");
        if (status != null)
            fields.add("status");
        if (traceIdSet)
            fields.add("traceId");
        if (stats != null)
            fields.add("stats");
        return Collections.unmodifiableList(fields);
    }

    public static final class Builder {

        private JsonNode data;
        private ParentSelection parentChange;
        private Integer siblingsGroupId;
        private MessageStatus status;
        private boolean traceIdSet;
        private String traceId;
        private JsonNode stats;

        private Builder() {
        }

        public Builder data(JsonNode data) {
            this.data = data;
            return this;
        }

        public Builder moveTo(String parentId) {
            this.parentChange = ParentSelection.of(parentId);
            return this;
        }

        public Builder moveToRoot() {
            this.parentChange = ParentSelection.root();
            return this;
        }

        public Builder siblingsGroupId(int siblingsGroupId) {
            this.siblingsGroupId = siblingsGroupId;
            return this;
        }

        public Builder status(MessageStatus status) {
            this.status = status;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceIdSet = true;
            this.traceId = traceId;
            return this;
        }

        public Builder stats(JsonNode stats) {
            this.stats = stats;
            return this;
        }

        public UpdateMessageRequest build() {
            return new UpdateMessageRequest(this);
        }
    }
}
