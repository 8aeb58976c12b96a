package de.bsommerfeld.convotree.core.error;

/**
 * Thrown when a referenced entity does not exist.
 */
public class NotFoundException extends ConversationTreeException {

    private final String entity;
    private final String id;

    public NotFoundException(String entity, String id) {
        super(ErrorCode.NOT_FOUND, entity + " not found: " + id);
        this.entity = entity;
        this.id = id;
    }

    public static NotFoundException topic(String id) {
        return new NotFoundException("Topic", id);
    }

    public static NotFoundException message(String id) {
        return new NotFoundException("Message", id);
    }

    /** Kind of the missing entity, e.g. {@code Topic} or {@code Message}. */
    public String getEntity() {
        return entity;
    }

    public String getId() {
        return id;
    }
}
