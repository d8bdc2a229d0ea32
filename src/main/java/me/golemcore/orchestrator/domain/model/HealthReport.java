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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Component and resource status returned by the health endpoint.
 */
@Data
@Builder
public class HealthReport {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    private String status;
    private String service;
    private String timestamp;
    private String environment;
    private String version;

    @JsonProperty("system_resources")
    private Map<String, Object> systemResources;

    private Map<String, String> components;

    @JsonProperty("rate_limiting")
    private Map<String, Object> rateLimiting;

    private Map<String, Object> monitoring;

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
