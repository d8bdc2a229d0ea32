package me.golemcore.orchestrator.adapter.inbound.web.controller;

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

import me.golemcore.orchestrator.adapter.inbound.web.dto.CreateSessionRequest;
import me.golemcore.orchestrator.adapter.inbound.web.dto.ProcessRequest;
import me.golemcore.orchestrator.domain.model.Alert;
import me.golemcore.orchestrator.domain.model.HealthReport;
import me.golemcore.orchestrator.domain.model.InboundRequest;
import me.golemcore.orchestrator.domain.model.ProcessResult;
import me.golemcore.orchestrator.domain.pipeline.Orchestrator;
import me.golemcore.orchestrator.domain.service.HealthService;
import me.golemcore.orchestrator.domain.service.MonitoringService;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.SessionStorePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP surface of the orchestrator: message processing, session management,
 * health, metrics and alerts.
 *
 * <p>
 * Blocking work runs on the bounded-elastic scheduler, one thread per request.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class OrchestratorController {

    static final String FORWARDED_FOR = "X-Forwarded-For";

    private final Orchestrator orchestrator;
    private final HealthService healthService;
    private final MonitoringService monitoringService;
    private final SessionStorePort sessionStore;
    private final OrchestratorProperties properties;
    private final Clock clock;

    @PostMapping("/process")
    public Mono<ResponseEntity<Map<String, Object>>> process(
            @RequestBody(required = false) ProcessRequest body,
            ServerHttpRequest httpRequest) {
        ProcessRequest payload = body != null ? body : new ProcessRequest();
        InboundRequest request = InboundRequest.builder()
                .sessionId(payload.getSessionId())
                .userId(payload.getUserId())
                .text(payload.getText() != null ? payload.getText() : "")
                .chatId(payload.getChatId())
                .clientId(clientId(httpRequest))
                .build();

        return Mono.fromCallable(() -> {
            long startMs = System.currentTimeMillis();
            ProcessResult result = orchestrator.process(request);
            log.info("[API] /process -> {} in {}ms", result.getStatus(), System.currentTimeMillis() - startMs);
            return toResponse(result);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/sessions")
    public Mono<ResponseEntity<Map<String, Object>>> createSession(
            @RequestBody(required = false) CreateSessionRequest body,
            ServerHttpRequest httpRequest) {
        CreateSessionRequest payload = body != null ? body : new CreateSessionRequest();
        String clientId = clientId(httpRequest);
        InboundRequest request = InboundRequest.builder()
                .userId(payload.getUserId())
                .chatId(payload.getChatId())
                .clientId(clientId)
                .build();

        Map<String, String> clientMetadata = new HashMap<>();
        clientMetadata.put("ip_address", clientId);
        String userAgent = httpRequest.getHeaders().getFirst(HttpHeaders.USER_AGENT);
        clientMetadata.put("user_agent", userAgent != null ? userAgent : "");

        return Mono.fromCallable(() -> toResponse(orchestrator.openSession(request, clientMetadata)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/session/{sessionId}")
    public Mono<ResponseEntity<Map<String, Object>>> getSession(
            @PathVariable String sessionId,
            @RequestParam(name = "user_id", required = false) String userId,
            ServerHttpRequest httpRequest) {
        InboundRequest request = InboundRequest.builder()
                .sessionId(sessionId)
                .userId(userId)
                .clientId(clientId(httpRequest))
                .build();
        return Mono.fromCallable(() -> toResponse(orchestrator.describeSession(request)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthReport>> health() {
        return Mono.fromCallable(() -> {
            HealthReport report = healthService.check();
            HttpStatus status = report.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
            return ResponseEntity.status(status).body(report);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/metrics")
    public Mono<ResponseEntity<Map<String, Object>>> metrics() {
        if (!properties.getMonitoring().isEnabled()) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", "Metrics disabled");
            return Mono.just(ResponseEntity.status(HttpStatus.FORBIDDEN).body(error));
        }

        Map<String, Object> systemMetrics = new LinkedHashMap<>();
        systemMetrics.put("cpu_usage", monitoringService.cpuUsagePercent());
        systemMetrics.put("memory_usage", monitoringService.memoryUsagePercent());

        Map<String, Object> sessionMetrics = new LinkedHashMap<>();
        sessionMetrics.put("active_sessions", sessionStore.count());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", clock.instant().toString());
        body.put("request_metrics", monitoringService.snapshot());
        body.put("system_metrics", systemMetrics);
        body.put("session_metrics", sessionMetrics);
        return Mono.just(ResponseEntity.ok(body));
    }

    @GetMapping("/alerts")
    public Mono<ResponseEntity<Map<String, Object>>> alerts(
            @RequestParam(name = "limit", required = false) Integer limit) {
        int max = properties.getMonitoring().getMaxRecentAlerts();
        int effectiveLimit = limit != null && limit > 0 ? Math.min(limit, max) : max;
        List<Alert> alerts = monitoringService.recentAlerts(effectiveLimit);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("alerts", alerts);
        body.put("total_count", alerts.size());
        body.put("timestamp", clock.instant().toString());
        return Mono.just(ResponseEntity.ok(body));
    }

    static String clientId(ServerHttpRequest request) {
        String forwardedFor = request.getHeaders().getFirst(FORWARDED_FOR);
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote != null && remote.getAddress() != null) {
            return remote.getAddress().getHostAddress();
        }
        return remote != null ? remote.getHostString() : "unknown";
    }

    private static ResponseEntity<Map<String, Object>> toResponse(ProcessResult result) {
        return ResponseEntity.status(result.getStatus()).body(result.getBody());
    }
}
