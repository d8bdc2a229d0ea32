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

import me.golemcore.orchestrator.domain.model.Alert;
import me.golemcore.orchestrator.domain.model.Metric;
import me.golemcore.orchestrator.domain.model.MetricSummary;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.AlertSinkPort;
import me.golemcore.orchestrator.port.outbound.MetricSinkPort;
import me.golemcore.orchestrator.port.outbound.SystemResourcePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * In-process metric accumulator with threshold alerting.
 *
 * <p>
 * Every recorded sample is kept in memory for
 * {@code orchestrator.monitoring.retention-hours} and, when monitoring is
 * enabled, mirrored to the {@link MetricSinkPort}. Sink failures are logged and
 * never reach the caller.
 *
 * <p>
 * {@link #checkAlerts()} evaluates, over the trailing alert window:
 * <ul>
 * <li>error rate - error samples divided by handled turns</li>
 * <li>mean {@code request_processing_time}</li>
 * <li>host CPU and memory usage</li>
 * </ul>
 * and emits one alert per exceeded threshold.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonitoringService {

    public static final String REQUEST_PROCESSING_TIME = "request_processing_time";
    public static final String PROCESSING_ERROR = "processing_error";
    public static final String SECURITY_VIOLATION = "security_violation";
    public static final String SESSION_UPDATE_ERROR = "session_update_error";
    public static final String CLARIFICATION_ERROR = "clarification_error";
    public static final String ESCALATION_ERROR = "escalation_error";
    public static final String AGENT_RESPONSE_TIME = "agent_response_time";

    private static final Set<String> ERROR_METRICS = Set.of(
            PROCESSING_ERROR,
            SESSION_UPDATE_ERROR,
            CLARIFICATION_ERROR,
            ESCALATION_ERROR,
            "agent_timeout",
            "agent_request_error",
            "agent_routing_error");

    private final OrchestratorProperties properties;
    private final MetricSinkPort metricSink;
    private final AlertSinkPort alertSink;
    private final SystemResourcePort systemResources;
    private final Clock clock;

    private final Map<String, Deque<Metric>> metrics = new ConcurrentHashMap<>();
    private final Deque<Alert> recentAlerts = new ConcurrentLinkedDeque<>();

    public void record(String name, double value) {
        record(name, value, Map.of());
    }

    public void record(String name, double value, Map<String, String> tags) {
        Instant now = clock.instant();
        Metric metric = Metric.builder()
                .name(name)
                .value(value)
                .timestamp(now)
                .tags(copyTags(tags))
                .build();
        Deque<Metric> samples = metrics.computeIfAbsent(name, k -> new ConcurrentLinkedDeque<>());
        samples.addLast(metric);
        evictOlderThan(samples, now.minus(retention()));

        if (!properties.getMonitoring().isEnabled()) {
            return;
        }
        try {
            metricSink.record(name, value, metric.getTags());
        } catch (Exception e) { // NOSONAR - metrics are fire-and-forget
            log.warn("[Monitoring] Failed to export metric {}: {}", name, e.getMessage());
        }
    }

    /**
     * Compare recent metrics and host resources against the configured
     * thresholds.
     *
     * @return the alerts emitted by this check
     */
    public List<Alert> checkAlerts() {
        OrchestratorProperties.MonitoringProperties config = properties.getMonitoring();
        List<Alert> emitted = new ArrayList<>();

        double errorRate = recentErrorRate();
        if (errorRate > config.getErrorRateThreshold()) {
            emitted.add(trigger("high_error_rate",
                    String.format(Locale.ROOT, "Error rate: %.2f%%", errorRate * 100)));
        }

        double avgResponseTime = recentAverage(REQUEST_PROCESSING_TIME);
        if (avgResponseTime > config.getResponseTimeThresholdSeconds()) {
            emitted.add(trigger("high_response_time",
                    String.format(Locale.ROOT, "Avg response time: %.2fs", avgResponseTime)));
        }

        double cpuUsage = systemResources.cpuUsagePercent();
        if (cpuUsage > config.getCpuUsageThreshold()) {
            emitted.add(trigger("high_cpu_usage", String.format(Locale.ROOT, "CPU usage: %.1f%%", cpuUsage)));
        }

        double memoryUsage = systemResources.memoryUsagePercent();
        if (memoryUsage > config.getMemoryUsageThreshold()) {
            emitted.add(trigger("high_memory_usage",
                    String.format(Locale.ROOT, "Memory usage: %.1f%%", memoryUsage)));
        }
        return emitted;
    }

    /**
     * Per-metric aggregates over the retained samples, sorted by name.
     */
    public Map<String, MetricSummary> snapshot() {
        Instant cutoff = clock.instant().minus(retention());
        Map<String, MetricSummary> result = new TreeMap<>();
        for (Map.Entry<String, Deque<Metric>> entry : metrics.entrySet()) {
            evictOlderThan(entry.getValue(), cutoff);
            List<Metric> samples = new ArrayList<>(entry.getValue());
            if (samples.isEmpty()) {
                continue;
            }
            double sum = 0;
            for (Metric sample : samples) {
                sum += sample.getValue();
            }
            Metric last = samples.get(samples.size() - 1);
            result.put(entry.getKey(), MetricSummary.builder()
                    .count(samples.size())
                    .mean(sum / samples.size())
                    .last(last.getValue())
                    .lastTimestamp(last.getTimestamp())
                    .lastTags(last.getTags())
                    .build());
        }
        return result;
    }

    public double cpuUsagePercent() {
        return systemResources.cpuUsagePercent();
    }

    public double memoryUsagePercent() {
        return systemResources.memoryUsagePercent();
    }

    /**
     * Newest alerts first.
     */
    public List<Alert> recentAlerts(int limit) {
        List<Alert> result = new ArrayList<>();
        for (Alert alert : recentAlerts) {
            if (result.size() >= limit) {
                break;
            }
            result.add(alert);
        }
        return result;
    }

    double recentErrorRate() {
        Instant since = alertWindowStart();
        long errors = 0;
        for (String name : ERROR_METRICS) {
            errors += countSince(name, since);
        }
        long turns = countSince(REQUEST_PROCESSING_TIME, since) + countSince(PROCESSING_ERROR, since);
        if (turns == 0) {
            return 0.0;
        }
        return (double) errors / turns;
    }

    double recentAverage(String name) {
        Deque<Metric> samples = metrics.get(name);
        if (samples == null) {
            return 0.0;
        }
        Instant since = alertWindowStart();
        double sum = 0;
        long count = 0;
        for (Metric sample : samples) {
            if (!sample.getTimestamp().isBefore(since)) {
                sum += sample.getValue();
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    private long countSince(String name, Instant since) {
        Deque<Metric> samples = metrics.get(name);
        if (samples == null) {
            return 0;
        }
        return samples.stream().filter(sample -> !sample.getTimestamp().isBefore(since)).count();
    }

    private Alert trigger(String alertType, String message) {
        Alert alert = Alert.builder()
                .alertType(alertType)
                .message(message)
                .timestamp(clock.instant())
                .service(properties.getServiceName())
                .build();

        recentAlerts.addFirst(alert);
        int max = properties.getMonitoring().getMaxRecentAlerts();
        while (recentAlerts.size() > max) {
            recentAlerts.pollLast();
        }

        try {
            alertSink.alert(alert);
        } catch (Exception e) { // NOSONAR - alert delivery is best-effort
            log.warn("[Monitoring] Failed to deliver alert {}: {}", alertType, e.getMessage());
        }
        return alert;
    }

    private Instant alertWindowStart() {
        return clock.instant().minus(Duration.ofMinutes(properties.getMonitoring().getAlertWindowMinutes()));
    }

    private Duration retention() {
        return Duration.ofHours(properties.getMonitoring().getRetentionHours());
    }

    private static Map<String, String> copyTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new HashMap<>();
        tags.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Map.copyOf(copy);
    }

    // Appends stay lock-free; only head removal is serialized per deque.
    private static void evictOlderThan(Deque<Metric> samples, Instant cutoff) {
        synchronized (samples) {
            Metric head = samples.peekFirst();
            while (head != null && head.getTimestamp().isBefore(cutoff)) {
                samples.pollFirst();
                head = samples.peekFirst();
            }
        }
    }
}
