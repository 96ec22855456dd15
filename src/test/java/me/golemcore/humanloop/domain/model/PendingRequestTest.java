package me.golemcore.humanloop.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PendingRequestTest {

    private static final Instant CREATED_AT = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void shouldStartOpenWithoutAnswer() {
        PendingRequest request = new PendingRequest("r1", "What size?", Map.of(), CREATED_AT);

        assertTrue(request.isOpen());
        assertEquals(RequestState.OPEN, request.getState());
        assertNull(request.getAnswer());
        assertFalse(request.isDelivered());
        assertFalse(request.getOutcome().isDone());
    }

    @Test
    void shouldResolveOnlyOnce() {
        PendingRequest request = new PendingRequest("r1", "What size?", null, CREATED_AT);

        assertTrue(request.resolve("large"));
        assertFalse(request.resolve("small"));
        assertFalse(request.cancel("late"));

        assertEquals(RequestState.RESOLVED, request.getState());
        assertEquals("large", request.getAnswer());
        assertNull(request.getCancelReason());
    }

    @Test
    void shouldCancelOnlyOnce() {
        PendingRequest request = new PendingRequest("r1", "What size?", null, CREATED_AT);

        assertTrue(request.cancel("timeout"));
        assertFalse(request.resolve("large"));
        assertFalse(request.cancel("shutdown"));

        assertEquals(RequestState.CANCELLED, request.getState());
        assertTrue(request.getState().isTerminal());
        assertEquals("timeout", request.getCancelReason());
        assertNull(request.getAnswer());
    }

    @Test
    void shouldNotCompleteOutcomeOnTransition() {
        PendingRequest request = new PendingRequest("r1", "What size?", null, CREATED_AT);

        request.resolve("large");

        assertFalse(request.getOutcome().isDone());
    }

    @Test
    void shouldSnapshotMetadata() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("tool", "ask_human");
        PendingRequest request = new PendingRequest("r1", "What size?", metadata, CREATED_AT);

        metadata.put("iteration", 3);

        assertEquals(Map.of("tool", "ask_human"), request.getMetadata());
        assertThrows(UnsupportedOperationException.class, () -> request.getMetadata().put("x", "y"));
    }

    @Test
    void shouldExposeViewWithoutAnswer() {
        PendingRequest request = new PendingRequest("r1", "What size?", Map.of("tool", "ask_human"), CREATED_AT);
        request.resolve("large");

        PendingRequestView view = request.toView();

        assertEquals("r1", view.id());
        assertEquals("What size?", view.question());
        assertEquals(Map.of("tool", "ask_human"), view.metadata());
    }

    @Test
    void shouldRejectMissingQuestion() {
        assertThrows(NullPointerException.class, () -> new PendingRequest("r1", null, null, CREATED_AT));
    }
}
