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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Server-side record of one ongoing conversation. A session belongs to exactly
 * one user for its whole lifetime; its message list is bounded by the
 * configured history size, oldest turns dropped first.
 */
@Data
@Builder(toBuilder = true)
public class Session {

    private String id;
    private String userId;
    private String chatId;

    private Instant createdAt;
    private Instant lastActive;
    private Instant expiresAt;

    @Builder.Default
    private List<ConversationMessage> messages = new ArrayList<>();

    @Builder.Default
    private String memorySummary = "";

    @Builder.Default
    private Map<String, Object> userPreferences = new HashMap<>();

    private double contextRelevanceScore;

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    /**
     * Detached copy with its own collections, so that a caller mutating the
     * result never touches the stored record.
     */
    public Session copy() {
        return toBuilder()
                .messages(messages != null ? new ArrayList<>(messages) : new ArrayList<>())
                .userPreferences(userPreferences != null ? new HashMap<>(userPreferences) : new HashMap<>())
                .metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>())
                .build();
    }
}
