package me.golemcore.orchestrator.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the orchestrator, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code orchestrator.*} prefix:
 * <ul>
 * <li>{@link SessionProperties} - session lifetime, caps and history size</li>
 * <li>{@link RateLimitProperties} - sliding window limits and backend</li>
 * <li>{@link ClassifierProperties} - confidence gating</li>
 * <li>{@link LlmProperties} - text-generation provider</li>
 * <li>{@link AgentsProperties} - downstream agent endpoints</li>
 * <li>{@link MonitoringProperties} - metrics and alert thresholds</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    private String environment = "development";
    private String serviceName = "orchestrator";
    private String version = "1.0.0";
    private SessionProperties session = new SessionProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private ClassifierProperties classifier = new ClassifierProperties();
    private LlmProperties llm = new LlmProperties();
    private AgentsProperties agents = new AgentsProperties();
    private MonitoringProperties monitoring = new MonitoringProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class SessionProperties {
        private int timeoutHours = 24;
        private int maxSessionsPerUser = 5;
        private int maxHistory = 50;
        private int sweepIntervalMinutes = 60;
        private int ttlDays = 30;
    }

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        /**
         * "memory" or "redis".
         */
        private String backend = "memory";
        private int maxRequests = 100;
        private int windowSeconds = 3600;
        private String keyPrefix = "rate_limit:orchestrator:";
    }

    @Data
    public static class ClassifierProperties {
        private double confidenceThreshold = 0.7;
        private int contextTurns = 5;
        private long timeoutMs = 30000;
    }

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.3;
        private int maxTokens = 1024;
        private long timeoutMs = 30000;
        private long cacheTtlSeconds = 300;
        private long cacheMaxSize = 500;
        private int maxConcurrency = 32;
    }

    @Data
    public static class AgentsProperties {
        private long timeoutMs = 30000;
        private long connectTimeoutMs = 5000;
        private Map<String, String> endpoints = new HashMap<>(Map.of(
                "tramites", "http://localhost:8082",
                "pqrsd", "http://localhost:8083",
                "programas", "http://localhost:8084",
                "notificaciones", "http://localhost:8085"));
    }

    @Data
    public static class MonitoringProperties {
        private boolean enabled = true;
        private double errorRateThreshold = 0.05;
        private double responseTimeThresholdSeconds = 5.0;
        private double cpuUsageThreshold = 80.0;
        private double memoryUsageThreshold = 80.0;
        private int alertWindowMinutes = 15;
        private int retentionHours = 24;
        private int maxRecentAlerts = 50;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
