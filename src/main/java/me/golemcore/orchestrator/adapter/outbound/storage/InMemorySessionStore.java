package me.golemcore.orchestrator.adapter.outbound.storage;

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
import me.golemcore.orchestrator.domain.model.SessionPatch;
import me.golemcore.orchestrator.port.outbound.SessionStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local session store.
 *
 * <p>
 * Sessions are copied on the way in and on the way out, so callers never share
 * mutable state with the store and every change goes through
 * {@link #save(Session)} or {@link #update(String, SessionPatch)}, as it would
 * against a document database.
 */
@Component
@Slf4j
public class InMemorySessionStore implements SessionStorePort {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public void save(Session session) {
        sessions.put(session.getId(), session.copy());
        log.debug("[SessionStore] Saved session: {}", session.getId());
    }

    @Override
    public Optional<Session> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        Session session = sessions.get(sessionId);
        return session != null ? Optional.of(session.copy()) : Optional.empty();
    }

    @Override
    public boolean update(String sessionId, SessionPatch patch) {
        Session updated = sessions.computeIfPresent(sessionId, (id, existing) -> {
            Session copy = existing.copy();
            patch.applyTo(copy);
            return copy;
        });
        return updated != null;
    }

    @Override
    public void delete(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            log.debug("[SessionStore] Deleted session: {}", sessionId);
        }
    }

    @Override
    public List<Session> findByUserId(String userId) {
        return sessions.values().stream()
                .filter(session -> session.getUserId() != null && session.getUserId().equals(userId))
                .map(Session::copy)
                .toList();
    }

    @Override
    public List<Session> findInactiveSince(Instant cutoff) {
        return sessions.values().stream()
                .filter(session -> session.getLastActive() != null && session.getLastActive().isBefore(cutoff))
                .map(Session::copy)
                .toList();
    }

    @Override
    public long count() {
        return sessions.size();
    }
}
