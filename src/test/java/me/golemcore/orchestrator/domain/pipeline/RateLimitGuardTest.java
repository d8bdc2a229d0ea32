package me.golemcore.orchestrator.domain.pipeline;

import me.golemcore.orchestrator.domain.model.GuardResult;
import me.golemcore.orchestrator.domain.model.InboundRequest;
import me.golemcore.orchestrator.domain.model.OrchestrationError;
import me.golemcore.orchestrator.ratelimit.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RateLimitGuardTest {

    private RateLimiter rateLimiter;
    private RateLimitGuard guard;

    @BeforeEach
    void setUp() {
        rateLimiter = mock(RateLimiter.class);
        guard = new RateLimitGuard(rateLimiter);
    }

    @Test
    void shouldPassAdmittedClient() {
        when(rateLimiter.admit("10.0.0.1")).thenReturn(true);

        assertTrue(guard.check(InboundRequest.builder().clientId("10.0.0.1").build()).isPassed());
    }

    @Test
    void shouldRejectWith429Mapping() {
        when(rateLimiter.admit("10.0.0.1")).thenReturn(false);

        GuardResult result = guard.check(InboundRequest.builder().clientId("10.0.0.1").build());

        assertFalse(result.isPassed());
        assertEquals(OrchestrationError.RATE_LIMITED, result.getError());
        assertEquals(429, result.getError().getStatus());
    }

    @Test
    void shouldBucketAnonymousClients() {
        when(rateLimiter.admit("unknown")).thenReturn(true);

        guard.check(InboundRequest.builder().clientId(" ").build());

        verify(rateLimiter).admit("unknown");
    }
}
