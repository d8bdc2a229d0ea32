package me.golemcore.orchestrator.adapter.outbound.ratelimit;

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

import me.golemcore.orchestrator.port.outbound.RateLimitBackendPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * Shared sliding-window counters in Redis: one sorted set per client, scored by
 * request time in epoch millis. Active with
 * {@code orchestrator.rate-limit.backend=redis}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "orchestrator.rate-limit.backend", havingValue = "redis")
public class RedisRateLimitBackend implements RateLimitBackendPort {

    private final StringRedisTemplate redisTemplate;

    @Override
    public String getName() {
        return "redis";
    }

    @Override
    public void removeOlderThan(String key, long cutoffMillis) {
        redisTemplate.opsForZSet().removeRangeByScore(key, 0, cutoffMillis);
    }

    @Override
    public long count(String key) {
        Long size = redisTemplate.opsForZSet().zCard(key);
        return size != null ? size : 0;
    }

    @Override
    public void add(String key, long timestampMillis) {
        // Members must be unique, two requests may share a millisecond
        String member = timestampMillis + ":" + UUID.randomUUID();
        redisTemplate.opsForZSet().add(key, member, timestampMillis);
    }

    @Override
    public void expire(String key, Duration ttl) {
        redisTemplate.expire(key, ttl);
    }

    @Override
    public boolean ping() {
        try {
            String reply = redisTemplate.execute(connection -> connection.ping(), true);
            return "PONG".equalsIgnoreCase(reply);
        } catch (Exception e) { // NOSONAR - health probe
            log.warn("[RateLimit] Redis ping failed: {}", e.getMessage());
            return false;
        }
    }
}
