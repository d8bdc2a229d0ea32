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
 * Field-level partial update of a stored session. Null fields are left
 * untouched; {@code lastActive} only ever moves forward.
 */
@Data
@Builder
public class SessionPatch {

    private Instant lastActive;
    private List<ConversationMessage> messages;
    private String memorySummary;
    private Map<String, Object> userPreferences;
    private Double contextRelevanceScore;

    public static SessionPatch touch(Instant lastActive) {
        return SessionPatch.builder().lastActive(lastActive).build();
    }

    /**
     * Apply the non-null fields of this patch to the given session.
     */
    public void applyTo(Session session) {
        if (lastActive != null
                && (session.getLastActive() == null || lastActive.isAfter(session.getLastActive()))) {
            session.setLastActive(lastActive);
        }
        if (messages != null) {
            session.setMessages(new ArrayList<>(messages));
        }
        if (memorySummary != null) {
            session.setMemorySummary(memorySummary);
        }
        if (userPreferences != null) {
            session.setUserPreferences(new HashMap<>(userPreferences));
        }
        if (contextRelevanceScore != null) {
            session.setContextRelevanceScore(contextRelevanceScore);
        }
    }
}
