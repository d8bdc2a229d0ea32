package me.golemcore.orchestrator.domain.model;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Either the verbatim JSON payload of a downstream agent or a structured
 * {@code {error, intent}} failure.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AgentRouteResult {

    private final JsonNode payload;
    private final RouteError error;
    private final String intent;

    public static AgentRouteResult success(String intent, JsonNode payload) {
        return new AgentRouteResult(payload, null, intent);
    }

    public static AgentRouteResult failure(RouteError error, String intent) {
        return new AgentRouteResult(null, error, intent);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Error body as exposed to the caller.
     */
    public Map<String, Object> errorBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error.getMessage());
        body.put("intent", intent);
        return body;
    }

    /**
     * Routing failure taxonomy. Each value carries the caller-facing message and
     * the metric recorded when it happens.
     */
    public enum RouteError {

        NO_AGENT_AVAILABLE("No agent available for intent", "agent_routing_error"),
        AGENT_TIMEOUT("Agent timeout", "agent_timeout"),
        AGENT_UNAVAILABLE("Agent unavailable", "agent_request_error"),
        ROUTING_ERROR("Routing error", "agent_routing_error");

        private final String message;
        private final String metricName;

        RouteError(String message, String metricName) {
            this.message = message;
            this.metricName = metricName;
        }

        public String getMessage() {
            return message;
        }

        public String getMetricName() {
            return metricName;
        }
    }
}
