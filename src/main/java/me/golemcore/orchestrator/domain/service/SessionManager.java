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

import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.model.SessionDescription;
import me.golemcore.orchestrator.domain.model.SessionPatch;
import me.golemcore.orchestrator.domain.model.SessionValidation;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.SessionStorePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the session lifecycle: creation with a per-user cap, validation with
 * inactivity expiry, and the periodic sweep of inactive sessions.
 *
 * <p>
 * A session belongs to the user that created it for its whole life. Validation
 * refreshes {@code lastActive}; a session idle for longer than
 * {@code orchestrator.session.timeout-hours} is deleted on first contact or by
 * {@link #sweep()}, whichever comes first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionManager {

    private static final String SESSION_ID_PREFIX = "session_";
    private static final double VALUE_PER_MESSAGE = 0.1;
    private static final double MAX_SESSION_VALUE = 10.0;

    private final SessionStorePort sessionStore;
    private final OrchestratorProperties properties;
    private final Clock clock;

    public String create(String userId, String chatId) {
        return create(userId, chatId, Map.of());
    }

    /**
     * Create a session for the user, evicting the user's oldest session first
     * when the per-user cap is reached.
     *
     * @param clientMetadata
     *            client address and user agent, stored alongside the
     *            environment name
     * @return the new session id
     */
    public String create(String userId, String chatId, Map<String, String> clientMetadata) {
        OrchestratorProperties.SessionProperties config = properties.getSession();
        List<Session> userSessions = sessionStore.findByUserId(userId);
        if (userSessions.size() >= config.getMaxSessionsPerUser()) {
            closeOldestSession(userSessions);
        }

        Instant now = clock.instant();
        Map<String, String> metadata = new HashMap<>(clientMetadata);
        metadata.put("environment", properties.getEnvironment());

        Session session = Session.builder()
                .id(SESSION_ID_PREFIX + UUID.randomUUID().toString().replace("-", ""))
                .userId(userId)
                .chatId(chatId)
                .createdAt(now)
                .lastActive(now)
                .expiresAt(now.plus(Duration.ofDays(config.getTtlDays())))
                .metadata(metadata)
                .build();
        sessionStore.save(session);

        log.info("[Session] Created session {} for user {} (chat: {})", session.getId(), userId, chatId);
        return session.getId();
    }

    /**
     * Check that the session exists, belongs to the user and is still active.
     * On success {@code lastActive} is refreshed; an expired session is deleted.
     */
    public SessionValidation validate(String sessionId, String userId) {
        Optional<Session> stored = sessionStore.get(sessionId);
        if (stored.isEmpty()) {
            log.warn("[Session] Session not found: {}", sessionId);
            return SessionValidation.notFound();
        }

        Session session = stored.get();
        if (session.getUserId() == null || !session.getUserId().equals(userId)) {
            log.warn("[Session] Unauthorized session access attempt: {}", sessionId);
            return SessionValidation.unauthorized();
        }

        Instant now = clock.instant();
        if (isExpired(session, now)) {
            sessionStore.delete(sessionId);
            log.info("[Session] Session expired: {}", sessionId);
            return SessionValidation.expired();
        }

        sessionStore.update(sessionId, SessionPatch.touch(now));
        if (session.getLastActive() == null || now.isAfter(session.getLastActive())) {
            session.setLastActive(now);
        }
        return SessionValidation.valid(session);
    }

    /**
     * Read-only lookup; does not refresh activity.
     */
    public Optional<Session> find(String sessionId) {
        return sessionStore.get(sessionId);
    }

    /**
     * Delete every session idle for longer than the timeout.
     *
     * @return number of sessions deleted
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(sessionTimeout());
        List<Session> inactive = sessionStore.findInactiveSince(cutoff);
        for (Session session : inactive) {
            sessionStore.delete(session.getId());
            log.info("[Session] Cleaned up expired session: {}", session.getId());
        }
        return inactive.size();
    }

    public SessionDescription describe(Session session) {
        int messageCount = session.getMessages() != null ? session.getMessages().size() : 0;
        Double duration = null;
        if (session.getCreatedAt() != null && session.getLastActive() != null) {
            duration = Duration.between(session.getCreatedAt(), session.getLastActive()).toMillis() / 1000.0;
        }

        return SessionDescription.builder()
                .sessionId(session.getId())
                .userId(session.getUserId())
                .chatId(session.getChatId())
                .createdAt(session.getCreatedAt())
                .lastActive(session.getLastActive())
                .sessionDurationSeconds(duration)
                .messageCount(messageCount)
                .memorySummary(session.getMemorySummary() != null ? session.getMemorySummary() : "")
                .contextRelevanceScore(session.getContextRelevanceScore())
                .userPreferences(session.getUserPreferences())
                .sessionMetadata(session.getMetadata())
                .estimatedSessionValue(Math.min(messageCount * VALUE_PER_MESSAGE, MAX_SESSION_VALUE))
                .build();
    }

    private boolean isExpired(Session session, Instant now) {
        Instant lastActive = session.getLastActive();
        return lastActive != null && Duration.between(lastActive, now).compareTo(sessionTimeout()) > 0;
    }

    private Duration sessionTimeout() {
        return Duration.ofHours(properties.getSession().getTimeoutHours());
    }

    private void closeOldestSession(List<Session> userSessions) {
        userSessions.stream()
                .filter(session -> session.getCreatedAt() != null)
                .min(Comparator.comparing(Session::getCreatedAt))
                .ifPresent(oldest -> {
                    sessionStore.delete(oldest.getId());
                    log.info("[Session] Closed oldest session {} of user {}", oldest.getId(), oldest.getUserId());
                });
    }
}
