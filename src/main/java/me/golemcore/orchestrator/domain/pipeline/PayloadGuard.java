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
import me.golemcore.orchestrator.security.InjectionGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Rejects requests whose identifiers are missing or look like injection
 * attempts.
 */
@Component
@RequiredArgsConstructor
public class PayloadGuard implements RequestGuard {

    private final InjectionGuard injectionGuard;

    @Override
    public String getName() {
        return "payload";
    }

    @Override
    public int getOrder() {
        return 20;
    }

    @Override
    public GuardResult check(InboundRequest request) {
        String sessionId = request.getSessionId();
        String userId = request.getUserId();

        if (sessionId != null && !injectionGuard.isSafe(sessionId)) {
            return GuardResult.reject(OrchestrationError.VALIDATION, "Invalid session ID format");
        }
        if (userId != null && !injectionGuard.isSafe(userId)) {
            return GuardResult.reject(OrchestrationError.VALIDATION, "Invalid user ID format");
        }
        if (isBlank(sessionId) || isBlank(userId)) {
            return GuardResult.reject(OrchestrationError.VALIDATION, "Missing session_id or user_id");
        }
        return GuardResult.pass();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
