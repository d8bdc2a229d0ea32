package me.golemcore.orchestrator.domain.service;

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

import me.golemcore.orchestrator.domain.model.HealthReport;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.SessionStorePort;
import me.golemcore.orchestrator.port.outbound.TextGenerationPort;
import me.golemcore.orchestrator.ratelimit.SlidingWindowRateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the health report. The service is degraded when the session store,
 * the shared rate-limit backend or the LLM is unavailable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthService {

    static final String CONNECTED = "connected";
    static final String DISCONNECTED = "disconnected";
    static final String NOT_CONFIGURED = "not_configured";

    private final OrchestratorProperties properties;
    private final SessionStorePort sessionStore;
    private final SlidingWindowRateLimiter rateLimiter;
    private final TextGenerationPort textGeneration;
    private final MonitoringService monitoringService;
    private final Clock clock;

    public HealthReport check() {
        Map<String, String> components = new LinkedHashMap<>();
        components.put("session_store", probeSessionStore());
        components.put("rate_limit_backend", rateLimiter.hasSharedBackend()
                ? (rateLimiter.isBackendHealthy() ? CONNECTED : DISCONNECTED)
                : NOT_CONFIGURED);
        components.put("llm", textGeneration.isAvailable() ? CONNECTED : DISCONNECTED);

        boolean degraded = components.values().stream().anyMatch(DISCONNECTED::equals);
        if (degraded) {
            log.warn("[Health] Degraded: {}", components);
        }

        Map<String, Object> resources = new LinkedHashMap<>();
        resources.put("cpu_usage_percent", monitoringService.cpuUsagePercent());
        resources.put("memory_usage_percent", monitoringService.memoryUsagePercent());

        OrchestratorProperties.RateLimitProperties rateLimit = properties.getRateLimit();
        Map<String, Object> rateLimiting = new LinkedHashMap<>();
        rateLimiting.put("enabled", rateLimit.isEnabled());
        rateLimiting.put("storage", rateLimiter.getBackendName());
        rateLimiting.put("window_seconds", rateLimit.getWindowSeconds());
        rateLimiting.put("max_requests", rateLimit.getMaxRequests());

        OrchestratorProperties.MonitoringProperties monitoringConfig = properties.getMonitoring();
        Map<String, Object> monitoring = new LinkedHashMap<>();
        monitoring.put("enabled", monitoringConfig.isEnabled());
        monitoring.put("retention_hours", monitoringConfig.getRetentionHours());

        return HealthReport.builder()
                .status(degraded ? HealthReport.DEGRADED : HealthReport.HEALTHY)
                .service(properties.getServiceName())
                .timestamp(clock.instant().toString())
                .environment(properties.getEnvironment())
                .version(properties.getVersion())
                .systemResources(resources)
                .components(components)
                .rateLimiting(rateLimiting)
                .monitoring(monitoring)
                .build();
    }

    private String probeSessionStore() {
        try {
            sessionStore.count();
            return CONNECTED;
        } catch (Exception e) { // NOSONAR - health probe
            log.warn("[Health] Session store probe failed: {}", e.getMessage());
            return DISCONNECTED;
        }
    }
}
