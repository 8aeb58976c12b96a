package de.bsommerfeld.convotree.core.error;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConversationTreeExceptionTest {

    @Test
    void notFound_shouldCarryEntityAndId() {
        NotFoundException e = NotFoundException.topic("t-1");

        assertEquals(ErrorCode.NOT_FOUND, e.getCode());
        assertEquals("Topic", e.getEntity());
        assertEquals("t-1", e.getId());
        assertEquals("Topic not found: t-1", e.getMessage());
    }

    @Test
    void invalidOperation_shouldCarryOperationAndReason() {
        var e = new InvalidOperationException("delete root message", "cascade=true required");

        assertEquals(ErrorCode.INVALID_OPERATION, e.getCode());
        assertEquals("delete root message", e.getOperation());
        assertEquals("cascade=true required", e.getReason());
        assertEquals("Cannot delete root message: cascade=true required", e.getMessage());
    }
}
