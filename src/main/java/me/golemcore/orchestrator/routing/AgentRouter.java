package me.golemcore.orchestrator.routing;

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

import me.golemcore.orchestrator.domain.model.AgentKind;
import me.golemcore.orchestrator.domain.model.AgentRequest;
import me.golemcore.orchestrator.domain.model.AgentRouteResult;
import me.golemcore.orchestrator.domain.model.AgentRouteResult.RouteError;
import me.golemcore.orchestrator.domain.model.AgentTimeoutException;
import me.golemcore.orchestrator.domain.model.AgentUnavailableException;
import me.golemcore.orchestrator.domain.model.ConversationContext;
import me.golemcore.orchestrator.domain.model.Intent;
import me.golemcore.orchestrator.domain.service.MonitoringService;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.AgentGatewayPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches a classified message to the agent that owns its intent.
 *
 * <p>
 * The intent to agent mapping lives on {@link Intent}; each {@link AgentKind}
 * resolves its endpoint from {@code orchestrator.agents.endpoints}. Every
 * failure is returned in-band as an {@link AgentRouteResult} error and
 * counted:
 * <ul>
 * <li>unknown or agentless intent - {@code agent_routing_error}, no call
 * made</li>
 * <li>no answer within {@code agents.timeout-ms} - {@code agent_timeout}, the
 * pending call is cancelled</li>
 * <li>transport failure or non-2xx status - {@code agent_request_error}</li>
 * <li>anything else - {@code agent_routing_error}</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentRouter {

    static final String RESPONSE_FIELD = "response";

    private final AgentGatewayPort agentGateway;
    private final OrchestratorProperties properties;
    private final MonitoringService monitoringService;
    private final Clock clock;

    public AgentRouteResult dispatch(String intent, String message, ConversationContext context) {
        Optional<AgentKind> agent = Intent.fromCode(intent).flatMap(Intent::getAgent);
        String endpoint = agent.map(kind -> properties.getAgents().getEndpoints().get(kind.getKey()))
                .orElse(null);
        if (endpoint == null || endpoint.isBlank()) {
            log.warn("[Router] No agent available for intent: {}", intent);
            return fail(RouteError.NO_AGENT_AVAILABLE, intent);
        }

        AgentRequest request = AgentRequest.builder()
                .userMessage(message)
                .conversationContext(context)
                .intent(intent)
                .timestamp(clock.instant())
                .sessionId(context.getSessionId() != null ? context.getSessionId() : "unknown")
                .build();

        long timeoutMs = properties.getAgents().getTimeoutMs();
        long startNanos = System.nanoTime();
        CompletableFuture<JsonNode> pending = null;
        try {
            pending = agentGateway.process(endpoint, request);
            JsonNode payload = pending.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (payload == null || payload.isMissingNode() || payload.isNull()) {
                log.error("[Router] Agent {} returned an empty body for intent {}", agent.get().getKey(), intent);
                return fail(RouteError.ROUTING_ERROR, intent);
            }
            if (!payload.isObject()) {
                payload = wrapResponse(payload);
            }

            double seconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
            monitoringService.record(MonitoringService.AGENT_RESPONSE_TIME, seconds, Map.of(
                    "intent", intent,
                    "agent", agent.get().getKey(),
                    "agent_url", endpoint));
            log.info("[Router] Routed intent {} to {} in {}ms", intent, agent.get().getKey(),
                    Math.round(seconds * 1000));
            return AgentRouteResult.success(intent, payload);

        } catch (TimeoutException e) {
            pending.cancel(true);
            log.error("[Router] Timeout calling agent {} for intent {} ({}ms)", agent.get().getKey(), intent,
                    timeoutMs);
            return fail(RouteError.AGENT_TIMEOUT, intent);
        } catch (ExecutionException | CompletionException e) {
            return fail(classify(e.getCause()), intent, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(RouteError.ROUTING_ERROR, intent, e);
        } catch (AgentTimeoutException | AgentUnavailableException e) {
            return fail(classify(e), intent, e);
        } catch (RuntimeException e) {
            return fail(RouteError.ROUTING_ERROR, intent, e);
        }
    }

    // Non-object bodies travel under "response" so turn metadata can be attached.
    static ObjectNode wrapResponse(JsonNode payload) {
        ObjectNode wrapped = JsonNodeFactory.instance.objectNode();
        wrapped.set(RESPONSE_FIELD, payload);
        return wrapped;
    }

    private static RouteError classify(Throwable cause) {
        if (cause instanceof AgentTimeoutException) {
            return RouteError.AGENT_TIMEOUT;
        }
        if (cause instanceof AgentUnavailableException) {
            return RouteError.AGENT_UNAVAILABLE;
        }
        return RouteError.ROUTING_ERROR;
    }

    private AgentRouteResult fail(RouteError error, String intent, Throwable cause) {
        log.error("[Router] {} for intent {}: {}", error.getMessage(), intent,
                cause != null ? cause.getMessage() : "unknown");
        return fail(error, intent);
    }

    private AgentRouteResult fail(RouteError error, String intent) {
        monitoringService.record(error.getMetricName(), 1.0, Map.of("intent", intent != null ? intent : "none"));
        return AgentRouteResult.failure(error, intent);
    }
}
