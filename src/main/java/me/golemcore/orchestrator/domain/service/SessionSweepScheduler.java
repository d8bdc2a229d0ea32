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

import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link SessionManager#sweep()} at a fixed interval
 * ({@code orchestrator.session.sweep-interval-minutes}).
 *
 * <p>
 * Started on context init and stopped on shutdown. A failed sweep is logged and
 * the next tick retries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionSweepScheduler {

    private final SessionManager sessionManager;
    private final OrchestratorProperties properties;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweepTask;

    @PostConstruct
    public void start() {
        long intervalMinutes = properties.getSession().getSweepIntervalMinutes();
        if (intervalMinutes <= 0) {
            log.info("[SessionSweep] Disabled (interval: {})", intervalMinutes);
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-sweep");
            t.setDaemon(true);
            return t;
        });
        sweepTask = scheduler.scheduleAtFixedRate(this::tick, intervalMinutes, intervalMinutes, TimeUnit.MINUTES);
        log.info("[SessionSweep] Started with interval: {}min", intervalMinutes);
    }

    @PreDestroy
    public void stop() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[SessionSweep] Shut down");
    }

    public boolean isRunning() {
        return sweepTask != null && !sweepTask.isCancelled();
    }

    void tick() {
        try {
            int removed = sessionManager.sweep();
            if (removed > 0) {
                log.info("[SessionSweep] Removed {} inactive sessions", removed);
            }
        } catch (Exception e) { // NOSONAR - keep the schedule alive
            log.error("[SessionSweep] Sweep failed: {}", e.getMessage(), e);
        }
    }
}
