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

import me.golemcore.orchestrator.domain.model.ConversationContext;
import me.golemcore.orchestrator.domain.model.ConversationMessage;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.model.SessionPatch;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.SessionStorePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * Loads the conversation window for a turn and writes it back afterwards.
 *
 * <p>
 * {@link #commit} is the only path that mutates message history. Load and
 * commit are not locked against each other, so concurrent turns on the same
 * session resolve as last writer wins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextManager {

    private final SessionStorePort sessionStore;
    private final OrchestratorProperties properties;
    private final Clock clock;

    /**
     * Build the context for an incoming message: the last {@code max-history}
     * stored messages followed by the incoming user message, which is not
     * persisted here.
     */
    public ConversationContext load(String sessionId, String incomingText) {
        List<ConversationMessage> messages = new ArrayList<>();
        ConversationContext.ConversationContextBuilder builder = ConversationContext.builder()
                .sessionId(sessionId);

        try {
            Optional<Session> stored = sessionStore.get(sessionId);
            if (stored.isPresent()) {
                Session session = stored.get();
                messages.addAll(lastMessages(session.getMessages(), properties.getSession().getMaxHistory()));
                builder.memorySummary(session.getMemorySummary() != null ? session.getMemorySummary() : "")
                        .userPreferences(session.getUserPreferences() != null
                                ? new HashMap<>(session.getUserPreferences())
                                : new HashMap<>())
                        .contextRelevanceScore(session.getContextRelevanceScore());
            }
        } catch (Exception e) { // NOSONAR - degrade to an empty window
            log.error("[Context] Failed to load context for session {}: {}", sessionId, e.getMessage());
            messages.clear();
        }

        messages.add(ConversationMessage.user(incomingText, clock.instant()));
        return builder.recentMessages(messages).build();
    }

    /**
     * Persist the updated window, trimmed to {@code max-history}, and bump
     * {@code lastActive}. The memory summary is replaced only when
     * {@code newSummary} is non-blank.
     *
     * @return false if the session no longer exists
     */
    public boolean commit(String sessionId, List<ConversationMessage> updatedMessages, String newSummary) {
        SessionPatch.SessionPatchBuilder patch = SessionPatch.builder()
                .lastActive(clock.instant())
                .messages(lastMessages(updatedMessages, properties.getSession().getMaxHistory()));
        if (newSummary != null && !newSummary.isBlank()) {
            patch.memorySummary(newSummary);
        }

        boolean updated = sessionStore.update(sessionId, patch.build());
        if (!updated) {
            log.warn("[Context] Session {} disappeared before commit", sessionId);
        }
        return updated;
    }

    public boolean commit(String sessionId, List<ConversationMessage> updatedMessages) {
        return commit(sessionId, updatedMessages, null);
    }

    private static List<ConversationMessage> lastMessages(List<ConversationMessage> messages, int limit) {
        if (messages == null || messages.isEmpty()) {
            return new ArrayList<>();
        }
        int from = Math.max(0, messages.size() - limit);
        return new ArrayList<>(messages.subList(from, messages.size()));
    }
}
