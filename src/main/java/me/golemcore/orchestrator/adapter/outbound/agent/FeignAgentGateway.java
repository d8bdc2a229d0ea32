package me.golemcore.orchestrator.adapter.outbound.agent;

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

import me.golemcore.orchestrator.domain.model.AgentRequest;
import me.golemcore.orchestrator.domain.model.AgentTimeoutException;
import me.golemcore.orchestrator.domain.model.AgentUnavailableException;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.infrastructure.http.FeignClientFactory;
import me.golemcore.orchestrator.port.outbound.AgentGatewayPort;
import com.fasterxml.jackson.databind.JsonNode;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import feign.RetryableException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InterruptedIOException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP gateway to the specialized agents.
 *
 * <p>
 * Posts the {@link AgentRequest} to {@code {endpoint}/process} with the
 * {@code X-Service-Source} and a fresh {@code X-Request-ID} header, on a
 * dedicated executor shut down with the application context. Transport errors
 * are translated: socket timeouts to {@link AgentTimeoutException}, connection
 * failures and non-2xx responses to {@link AgentUnavailableException}.
 */
@Component
@Slf4j
public class FeignAgentGateway implements AgentGatewayPort {

    static final String SERVICE_SOURCE = "orchestrator";

    private final FeignClientFactory feignClientFactory;
    private final OrchestratorProperties properties;
    private final Map<String, AgentServiceApi> clients = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public FeignAgentGateway(FeignClientFactory feignClientFactory, OrchestratorProperties properties) {
        this.feignClientFactory = feignClientFactory;
        this.properties = properties;
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agent-dispatch-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<JsonNode> process(String endpoint, AgentRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String requestId = UUID.randomUUID().toString();
            log.debug("[Router] POST {}/process (request: {})", endpoint, requestId);
            try {
                return clientFor(endpoint).process(SERVICE_SOURCE, requestId, request);
            } catch (RetryableException e) {
                if (isTimeout(e)) {
                    throw new AgentTimeoutException("Agent at " + endpoint + " timed out", e);
                }
                throw new AgentUnavailableException("Agent at " + endpoint + " unreachable", e);
            } catch (FeignException e) {
                throw new AgentUnavailableException("Agent at " + endpoint + " returned HTTP " + e.status(), e);
            }
        }, executor);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Router] Agent dispatch executor shut down");
    }

    private AgentServiceApi clientFor(String endpoint) {
        OrchestratorProperties.AgentsProperties config = properties.getAgents();
        return clients.computeIfAbsent(endpoint, url -> feignClientFactory.create(
                AgentServiceApi.class, url, config.getConnectTimeoutMs(), config.getTimeoutMs()));
    }

    private static boolean isTimeout(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof InterruptedIOException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Agent process endpoint.
     */
    public interface AgentServiceApi {
        @RequestLine("POST /process")
        @Headers({
                "Content-Type: application/json",
                "X-Service-Source: {source}",
                "X-Request-ID: {requestId}"
        })
        JsonNode process(@Param("source") String source, @Param("requestId") String requestId,
                AgentRequest request);
    }
}
