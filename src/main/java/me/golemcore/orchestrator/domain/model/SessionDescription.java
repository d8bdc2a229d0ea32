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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of a session for introspection, with derived engagement
 * figures.
 */
@Data
@Builder
public class SessionDescription {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("chat_id")
    private String chatId;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("last_active")
    private Instant lastActive;

    @JsonProperty("session_duration_seconds")
    private Double sessionDurationSeconds;

    @JsonProperty("message_count")
    private int messageCount;

    @JsonProperty("memory_summary")
    private String memorySummary;

    @JsonProperty("context_relevance_score")
    private double contextRelevanceScore;

    @JsonProperty("user_preferences")
    private Map<String, Object> userPreferences;

    @JsonProperty("session_metadata")
    private Map<String, String> sessionMetadata;

    @JsonProperty("estimated_session_value")
    private double estimatedSessionValue;
}
