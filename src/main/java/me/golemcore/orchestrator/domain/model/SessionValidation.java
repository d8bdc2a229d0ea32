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
 * Outcome of {@code SessionManager.validate}. Carries the refreshed session
 * only when the status is {@link Status#VALID}.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SessionValidation {

    private final Status status;
    private final Session session;

    public static SessionValidation valid(Session session) {
        return new SessionValidation(Status.VALID, session);
    }

    public static SessionValidation notFound() {
        return new SessionValidation(Status.NOT_FOUND, null);
    }

    public static SessionValidation unauthorized() {
        return new SessionValidation(Status.UNAUTHORIZED, null);
    }

    public static SessionValidation expired() {
        return new SessionValidation(Status.EXPIRED, null);
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public enum Status {
        VALID, NOT_FOUND, UNAUTHORIZED, EXPIRED
    }
}
