package me.golemcore.orchestrator.domain.pipeline;

import me.golemcore.orchestrator.domain.model.GuardResult;
import me.golemcore.orchestrator.domain.model.InboundRequest;
import me.golemcore.orchestrator.domain.model.OrchestrationError;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.model.SessionValidation;
import me.golemcore.orchestrator.domain.service.SessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionGuardTest {

    private static final InboundRequest REQUEST = InboundRequest.builder()
            .sessionId("session_1")
            .userId("u1")
            .build();

    private SessionManager sessionManager;
    private SessionGuard guard;

    @BeforeEach
    void setUp() {
        sessionManager = mock(SessionManager.class);
        guard = new SessionGuard(sessionManager);
    }

    @Test
    void shouldPassValidSession() {
        when(sessionManager.validate("session_1", "u1"))
                .thenReturn(SessionValidation.valid(Session.builder().id("session_1").build()));

        assertTrue(guard.check(REQUEST).isPassed());
    }

    @Test
    void shouldMapNotFound() {
        when(sessionManager.validate("session_1", "u1")).thenReturn(SessionValidation.notFound());

        GuardResult result = guard.check(REQUEST);

        assertEquals(OrchestrationError.NOT_FOUND, result.getError());
        assertEquals("Session not found", result.getMessage());
    }

    @Test
    void shouldMapUnauthorized() {
        when(sessionManager.validate("session_1", "u1")).thenReturn(SessionValidation.unauthorized());

        GuardResult result = guard.check(REQUEST);

        assertEquals(403, result.getError().getStatus());
        assertEquals("Unauthorized session access", result.getMessage());
    }

    @Test
    void shouldMapExpired() {
        when(sessionManager.validate("session_1", "u1")).thenReturn(SessionValidation.expired());

        GuardResult result = guard.check(REQUEST);

        assertEquals(440, result.getError().getStatus());
        assertEquals("Session expired", result.getMessage());
    }
}
