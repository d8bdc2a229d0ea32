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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Verdict of a request guard. A rejection stops the guard chain.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class GuardResult {

    private static final GuardResult PASS = new GuardResult(true, null, null);

    private final boolean passed;
    private final OrchestrationError error;
    private final String message;

    public static GuardResult pass() {
        return PASS;
    }

    public static GuardResult reject(OrchestrationError error, String message) {
        return new GuardResult(false, error, message);
    }
}
