package me.golemcore.orchestrator.ratelimit;

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

import me.golemcore.orchestrator.domain.model.RateLimitResult;

/**
 * Per-client admission control using a sliding time window.
 *
 * <p>
 * {@link #tryAdmit(String)} drops timestamps older than the window, admits the
 * request only if fewer than the configured maximum remain, and records the
 * admitted request. The check and the write are not atomic across concurrent
 * callers for the same client, so a small overshoot under concurrency is
 * possible.
 *
 * @see SlidingWindowRateLimiter
 */
public interface RateLimiter {

    /**
     * Check and record a request for the client.
     */
    RateLimitResult tryAdmit(String clientId);

    /**
     * Convenience form of {@link #tryAdmit(String)}.
     *
     * @return true if the request is allowed
     */
    default boolean admit(String clientId) {
        return tryAdmit(clientId).isAllowed();
    }
}
