package me.golemcore.orchestrator.ratelimit;

import me.golemcore.orchestrator.domain.model.RateLimitResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.RateLimitBackendPort;
import me.golemcore.orchestrator.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SlidingWindowRateLimiterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String CLIENT = "10.0.0.1";

    private OrchestratorProperties properties;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        properties.getRateLimit().setMaxRequests(3);
        properties.getRateLimit().setWindowSeconds(60);
        clock = new MutableClock(NOW);
    }

    // ===== In-memory =====

    @Test
    void shouldDenyFourthRequestInsideWindow() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(properties, (RateLimitBackendPort) null,
                clock);

        assertTrue(limiter.admit(CLIENT));
        assertTrue(limiter.admit(CLIENT));
        assertTrue(limiter.admit(CLIENT));
        RateLimitResult fourth = limiter.tryAdmit(CLIENT);

        assertFalse(fourth.isAllowed());
        assertEquals("memory", fourth.getBackend());
    }

    @Test
    void shouldAdmitAgainAfterWindowElapses() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(properties, (RateLimitBackendPort) null,
                clock);
        for (int i = 0; i < 3; i++) {
            limiter.admit(CLIENT);
        }
        assertFalse(limiter.admit(CLIENT));

        clock.advance(Duration.ofSeconds(61));

        assertTrue(limiter.admit(CLIENT));
    }

    @Test
    void shouldTrackClientsIndependently() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(properties, (RateLimitBackendPort) null,
                clock);
        for (int i = 0; i < 3; i++) {
            limiter.admit(CLIENT);
        }

        assertFalse(limiter.admit(CLIENT));
        assertTrue(limiter.admit("10.0.0.2"));
    }

    @Test
    void shouldAlwaysAllowWhenDisabled() {
        properties.getRateLimit().setEnabled(false);
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(properties, (RateLimitBackendPort) null,
                clock);

        for (int i = 0; i < 10; i++) {
            RateLimitResult result = limiter.tryAdmit(CLIENT);
            assertTrue(result.isAllowed());
            assertEquals(Long.MAX_VALUE, result.getLimit());
        }
        assertEquals(0, limiter.localWindowCount());
    }

    @Test
    void shouldEvictIdleLocalWindows() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(properties, (RateLimitBackendPort) null,
                clock);
        limiter.admit("a");
        limiter.admit("b");
        clock.advance(Duration.ofSeconds(90));
        limiter.admit("c");

        int evicted = limiter.evictIdleWindows();

        assertEquals(2, evicted);
        assertEquals(1, limiter.localWindowCount());
    }

    @Test
    void shouldReportMemoryBackendAsHealthy() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(properties, (RateLimitBackendPort) null,
                clock);

        assertEquals("memory", limiter.getBackendName());
        assertTrue(limiter.isBackendHealthy());
        assertFalse(limiter.hasSharedBackend());
    }

    // ===== Shared backend =====

    @Test
    void shouldAdmitThroughSharedBackend() {
        RateLimitBackendPort backend = mock(RateLimitBackendPort.class);
        when(backend.getName()).thenReturn("redis");
        when(backend.count("rate_limit:orchestrator:" + CLIENT)).thenReturn(1L);
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(properties, backend, clock);

        RateLimitResult result = limiter.tryAdmit(CLIENT);

        assertTrue(result.isAllowed());
        assertEquals(2, result.getCurrentCount());
        assertEquals("redis", result.getBackend());
        String key = "rate_limit:orchestrator:" + CLIENT;
        verify(backend).removeOlderThan(key, NOW.toEpochMilli() - 60_000L);
        verify(backend).add(key, NOW.toEpochMilli());
        verify(backend).expire(key, Duration.ofSeconds(120));
    }

    @Test
    void shouldDenyWithoutRecordingWhenSharedCountAtLimit() {
        RateLimitBackendPort backend = mock(RateLimitBackendPort.class);
        when(backend.getName()).thenReturn("redis");
        when(backend.count(anyString())).thenReturn(3L);
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(properties, backend, clock);

        RateLimitResult result = limiter.tryAdmit(CLIENT);

        assertFalse(result.isAllowed());
        verify(backend, never()).add(anyString(), anyLong());
    }

    @Test
    void shouldFallBackToMemoryWhenBackendFails() {
        RateLimitBackendPort backend = mock(RateLimitBackendPort.class);
        when(backend.getName()).thenReturn("redis");
        doThrow(new IllegalStateException("connection refused"))
                .when(backend).removeOlderThan(anyString(), anyLong());
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(properties, backend, clock);

        RateLimitResult result = limiter.tryAdmit(CLIENT);

        assertTrue(result.isAllowed());
        assertEquals("memory", result.getBackend());
        assertEquals(1, limiter.localWindowCount());
    }

    @Test
    void shouldReportBackendHealthFromPing() {
        RateLimitBackendPort backend = mock(RateLimitBackendPort.class);
        when(backend.getName()).thenReturn("redis");
        when(backend.ping()).thenReturn(false);
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(properties, backend, clock);

        assertEquals("redis", limiter.getBackendName());
        assertFalse(limiter.isBackendHealthy());
        assertTrue(limiter.hasSharedBackend());
        verify(backend, never()).count(eq(CLIENT));
    }
}
