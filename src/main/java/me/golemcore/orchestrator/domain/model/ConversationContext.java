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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded conversation window handed to classification and agents. The last
 * entry of {@code recentMessages} is the incoming user message, which is not
 * persisted until the turn is committed.
 */
@Data
@Builder
public class ConversationContext {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("recent_messages")
    @Builder.Default
    private List<ConversationMessage> recentMessages = new ArrayList<>();

    @JsonProperty("memory_summary")
    @Builder.Default
    private String memorySummary = "";

    @JsonProperty("user_preferences")
    @Builder.Default
    private Map<String, Object> userPreferences = new HashMap<>();

    @JsonProperty("context_relevance_score")
    private double contextRelevanceScore;

    /**
     * Last {@code count} messages of the window, oldest first.
     */
    public List<ConversationMessage> trailing(int count) {
        if (recentMessages == null || recentMessages.isEmpty() || count <= 0) {
            return List.of();
        }
        int from = Math.max(0, recentMessages.size() - count);
        return List.copyOf(recentMessages.subList(from, recentMessages.size()));
    }
}
