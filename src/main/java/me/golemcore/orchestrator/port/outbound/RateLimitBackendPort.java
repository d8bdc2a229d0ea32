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

import java.time.Duration;

/**
 * Shared counter backend for sliding-window rate limiting. Timestamps are epoch
 * milliseconds. Operations are individually atomic at best; the sequence used
 * by the limiter is not.
 */
public interface RateLimitBackendPort {

    /**
     * Backend identifier reported in health output (e.g. "redis").
     */
    String getName();

    void removeOlderThan(String key, long cutoffMillis);

    long count(String key);

    void add(String key, long timestampMillis);

    void expire(String key, Duration ttl);

    /**
     * Round-trip to the backend.
     *
     * @return true if the backend answered
     */
    boolean ping();
}
