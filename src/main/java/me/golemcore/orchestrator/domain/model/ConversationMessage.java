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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single turn in a conversation window. Role is either {@code user} or
 * {@code agent}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMessage {

    public static final String ROLE_USER = "user";
    public static final String ROLE_AGENT = "agent";

    private String role;
    private String text;
    private Instant timestamp;

    public static ConversationMessage user(String text, Instant timestamp) {
        return new ConversationMessage(ROLE_USER, text, timestamp);
    }

    public static ConversationMessage agent(String text, Instant timestamp) {
        return new ConversationMessage(ROLE_AGENT, text, timestamp);
    }

    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    @JsonIgnore
    public boolean isAgentMessage() {
        return ROLE_AGENT.equals(role);
    }
}
