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

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * In-process sliding window for a single client.
 *
 * <p>
 * Keeps the timestamps (epoch millis) of admitted requests in arrival order.
 * Each check first evicts timestamps at or before {@code now - window}, then
 * admits if the remaining count is below {@code maxRequests}.
 */
public class SlidingWindow {

    static final String BACKEND = "memory";

    private final Deque<Long> timestamps = new ArrayDeque<>();

    public synchronized RateLimitResult tryAdmit(long nowMillis, Duration window, int maxRequests) {
        long cutoff = nowMillis - window.toMillis();
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
            timestamps.pollFirst();
        }

        if (timestamps.size() >= maxRequests) {
            long oldest = timestamps.isEmpty() ? nowMillis : timestamps.peekFirst();
            Duration retryAfter = Duration.ofMillis(Math.max(0, oldest + window.toMillis() - nowMillis));
            return RateLimitResult.denied(timestamps.size(), maxRequests, retryAfter, BACKEND);
        }

        timestamps.addLast(nowMillis);
        return RateLimitResult.allowed(timestamps.size(), maxRequests, BACKEND);
    }

    public synchronized int size() {
        return timestamps.size();
    }

    /**
     * True when no timestamp is newer than {@code cutoffMillis}.
     */
    public synchronized boolean isIdleSince(long cutoffMillis) {
        return timestamps.isEmpty() || timestamps.peekLast() <= cutoffMillis;
    }
}
