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

/**
 * Caller-facing error taxonomy with the HTTP status each one maps to. 440 for
 * an expired session is nonstandard and kept for client compatibility.
 */
public enum OrchestrationError {

    VALIDATION(400),
    UNAUTHORIZED(403),
    NOT_FOUND(404),
    RATE_LIMITED(429),
    SESSION_EXPIRED(440),
    INTERNAL(500);

    private final int status;

    OrchestrationError(int status) {
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
