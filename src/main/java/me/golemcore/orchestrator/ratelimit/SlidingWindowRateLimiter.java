package me.golemcore.orchestrator.ratelimit;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.orchestrator.domain.model.RateLimitResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.RateLimitBackendPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding window rate limiter with a shared remote counter and an in-process
 * fallback.
 *
 * <p>
 * When a {@link RateLimitBackendPort} bean is present (e.g. Redis), every
 * decision is taken against it so that limits hold across instances. If the
 * backend throws, the failure is logged and the decision for that request is
 * taken by a local {@link SlidingWindow}. The fallback only sees this
 * instance's traffic, so the global limit may be exceeded during a backend
 * outage.
 *
 * <p>
 * Can be disabled via {@code orchestrator.rate-limit.enabled=false}.
 */
@Component
@Slf4j
public class SlidingWindowRateLimiter implements RateLimiter {

    private static final long KEY_EXPIRY_GRACE_SECONDS = 60;
    static final int LOCAL_WINDOW_EVICTION_THRESHOLD = 10_000;

    private final OrchestratorProperties properties;
    private final RateLimitBackendPort backend;
    private final Clock clock;

    private final Map<String, SlidingWindow> localWindows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(OrchestratorProperties properties,
            ObjectProvider<RateLimitBackendPort> backendProvider,
            Clock clock) {
        this(properties, backendProvider.getIfAvailable(), clock);
    }

    SlidingWindowRateLimiter(OrchestratorProperties properties, RateLimitBackendPort backend, Clock clock) {
        this.properties = properties;
        this.backend = backend;
        this.clock = clock;
    }

    @Override
    public RateLimitResult tryAdmit(String clientId) {
        OrchestratorProperties.RateLimitProperties config = properties.getRateLimit();
        if (!config.isEnabled()) {
            return RateLimitResult.unlimited();
        }

        long now = clock.millis();
        Duration window = Duration.ofSeconds(config.getWindowSeconds());
        RateLimitResult result;
        if (backend != null) {
            result = tryAdmitRemote(clientId, now, window, config);
        } else {
            result = tryAdmitLocal(clientId, now, window, config.getMaxRequests());
        }

        if (!result.isAllowed()) {
            log.warn("[RateLimit] Rate limit exceeded for client {} ({}/{} in {}s, backend: {})",
                    clientId, result.getCurrentCount(), result.getLimit(), config.getWindowSeconds(),
                    result.getBackend());
        }
        return result;
    }

    /**
     * Name of the backend currently configured for decisions.
     */
    public String getBackendName() {
        return backend != null ? backend.getName() : SlidingWindow.BACKEND;
    }

    /**
     * True when no shared backend is configured or it answers a ping.
     */
    public boolean isBackendHealthy() {
        return backend == null || backend.ping();
    }

    public boolean hasSharedBackend() {
        return backend != null;
    }

    int localWindowCount() {
        return localWindows.size();
    }

    /**
     * Drop local windows with no activity inside the current window.
     */
    int evictIdleWindows() {
        long cutoff = clock.millis() - Duration.ofSeconds(properties.getRateLimit().getWindowSeconds()).toMillis();
        int before = localWindows.size();
        localWindows.entrySet().removeIf(entry -> entry.getValue().isIdleSince(cutoff));
        return before - localWindows.size();
    }

    private RateLimitResult tryAdmitRemote(String clientId, long now, Duration window,
            OrchestratorProperties.RateLimitProperties config) {
        String key = config.getKeyPrefix() + clientId;
        try {
            backend.removeOlderThan(key, now - window.toMillis());
            long count = backend.count(key);
            if (count >= config.getMaxRequests()) {
                return RateLimitResult.denied(count, config.getMaxRequests(), window, backend.getName());
            }
            backend.add(key, now);
            backend.expire(key, window.plusSeconds(KEY_EXPIRY_GRACE_SECONDS));
            return RateLimitResult.allowed(count + 1, config.getMaxRequests(), backend.getName());
        } catch (RuntimeException e) {
            log.warn("[RateLimit] {} backend check failed: {}. Falling back to in-memory.",
                    backend.getName(), e.getMessage());
            return tryAdmitLocal(clientId, now, window, config.getMaxRequests());
        }
    }

    private RateLimitResult tryAdmitLocal(String clientId, long now, Duration window, int maxRequests) {
        if (localWindows.size() >= LOCAL_WINDOW_EVICTION_THRESHOLD) {
            int evicted = evictIdleWindows();
            log.debug("[RateLimit] Evicted {} idle local windows", evicted);
        }
        SlidingWindow slidingWindow = localWindows.computeIfAbsent(clientId, id -> new SlidingWindow());
        return slidingWindow.tryAdmit(now, window, maxRequests);
    }
}
