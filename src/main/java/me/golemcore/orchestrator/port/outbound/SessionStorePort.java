package me.golemcore.orchestrator.port.outbound;

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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Keyed store for session records. Implementations return detached copies;
 * mutations only happen through {@link #save}, {@link #update} and
 * {@link #delete}.
 */
public interface SessionStorePort {

    /**
     * Create or overwrite the record under {@code session.getId()}.
     */
    void save(Session session);

    Optional<Session> get(String sessionId);

    /**
     * Apply a partial update.
     *
     * @return false if the session does not exist
     */
    boolean update(String sessionId, SessionPatch patch);

    void delete(String sessionId);

    List<Session> findByUserId(String userId);

    /**
     * Sessions whose last activity is strictly before {@code cutoff}.
     */
    List<Session> findInactiveSince(Instant cutoff);

    long count();
}
