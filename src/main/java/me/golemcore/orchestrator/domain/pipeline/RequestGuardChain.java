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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Ordered chain of {@link RequestGuard}s. Stops at the first rejection.
 */
@Component
@Slf4j
public class RequestGuardChain {

    private final List<RequestGuard> guards;

    public RequestGuardChain(List<RequestGuard> guards) {
        this.guards = guards.stream()
                .sorted(Comparator.comparingInt(RequestGuard::getOrder))
                .toList();
        log.info("[Orchestrator] Request guards: {}", this.guards.stream().map(RequestGuard::getName).toList());
    }

    public GuardResult check(InboundRequest request) {
        for (RequestGuard guard : guards) {
            GuardResult result = guard.check(request);
            if (!result.isPassed()) {
                log.warn("[Orchestrator] Request rejected by {} guard: {} (session: {})", guard.getName(),
                        result.getMessage(), request.getSessionId());
                return result;
            }
        }
        return GuardResult.pass();
    }

    List<RequestGuard> getGuards() {
        return guards;
    }
}
