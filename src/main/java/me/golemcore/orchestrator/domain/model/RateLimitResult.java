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

import java.time.Duration;

/**
 * Result of a sliding-window admission check.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code allowed} - whether the request was admitted</li>
 * <li>{@code currentCount} - requests counted in the window after the
 * decision</li>
 * <li>{@code limit} - configured maximum for the window</li>
 * <li>{@code retryAfter} - if denied, the window length to wait at most</li>
 * <li>{@code backend} - which counter took the decision</li>
 * </ul>
 */
@Data
@Builder
public class RateLimitResult {

    private boolean allowed;
    private long currentCount;
    private long limit;
    private Duration retryAfter;
    private String backend;
    private String reason;

    public static RateLimitResult allowed(long currentCount, long limit, String backend) {
        return RateLimitResult.builder()
                .allowed(true)
                .currentCount(currentCount)
                .limit(limit)
                .backend(backend)
                .build();
    }

    public static RateLimitResult denied(long currentCount, long limit, Duration retryAfter, String backend) {
        return RateLimitResult.builder()
                .allowed(false)
                .currentCount(currentCount)
                .limit(limit)
                .retryAfter(retryAfter)
                .backend(backend)
                .reason("Rate limit exceeded")
                .build();
    }

    public static RateLimitResult unlimited() {
        return RateLimitResult.builder()
                .allowed(true)
                .currentCount(0)
                .limit(Long.MAX_VALUE)
                .backend("disabled")
                .build();
    }
}
