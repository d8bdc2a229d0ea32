package me.golemcore.orchestrator.domain.pipeline;

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

import me.golemcore.orchestrator.domain.model.GuardResult;
import me.golemcore.orchestrator.domain.model.InboundRequest;
import me.golemcore.orchestrator.domain.model.OrchestrationError;
import me.golemcore.orchestrator.ratelimit.RateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Per-client request rate check. Runs first.
 */
@Component
@RequiredArgsConstructor
public class RateLimitGuard implements RequestGuard {

    static final String UNKNOWN_CLIENT = "unknown";

    private final RateLimiter rateLimiter;

    @Override
    public String getName() {
        return "rate-limit";
    }

    @Override
    public int getOrder() {
        return 10;
    }

    @Override
    public GuardResult check(InboundRequest request) {
        String clientId = request.getClientId() != null && !request.getClientId().isBlank()
                ? request.getClientId()
                : UNKNOWN_CLIENT;
        if (!rateLimiter.admit(clientId)) {
            return GuardResult.reject(OrchestrationError.RATE_LIMITED, "Rate limit exceeded");
        }
        return GuardResult.pass();
    }
}
