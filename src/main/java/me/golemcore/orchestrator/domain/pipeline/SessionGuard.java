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
import me.golemcore.orchestrator.domain.model.SessionValidation;
import me.golemcore.orchestrator.domain.service.SessionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Session existence, ownership and expiry. Refreshes the session's activity on
 * success.
 */
@Component
@RequiredArgsConstructor
public class SessionGuard implements RequestGuard {

    private final SessionManager sessionManager;

    @Override
    public String getName() {
        return "session";
    }

    @Override
    public int getOrder() {
        return 30;
    }

    @Override
    public GuardResult check(InboundRequest request) {
        SessionValidation validation = sessionManager.validate(request.getSessionId(), request.getUserId());
        return switch (validation.getStatus()) {
            case VALID -> GuardResult.pass();
            case NOT_FOUND -> GuardResult.reject(OrchestrationError.NOT_FOUND, "Session not found");
            case UNAUTHORIZED -> GuardResult.reject(OrchestrationError.UNAUTHORIZED, "Unauthorized session access");
            case EXPIRED -> GuardResult.reject(OrchestrationError.SESSION_EXPIRED, "Session expired");
        };
    }
}
