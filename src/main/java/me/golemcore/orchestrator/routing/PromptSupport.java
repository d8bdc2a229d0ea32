package me.golemcore.orchestrator.routing;

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

import me.golemcore.orchestrator.domain.model.ConversationMessage;
import me.golemcore.orchestrator.domain.model.IntentClassificationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared plumbing for the prompt-based classifiers: bounded waits, history
 * rendering and JSON extraction from a completion (a fenced {@code ```json}
 * block if there is one, otherwise the outermost braces).
 */
final class PromptSupport {

    private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```",
            Pattern.DOTALL);

    private PromptSupport() {
    }

    static JsonNode extractObject(ObjectMapper objectMapper, String response) {
        if (response == null || response.isBlank()) {
            throw new IntentClassificationException("Empty LLM response");
        }

        String json = extractJson(response);
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IntentClassificationException("Invalid LLM response format", e);
        }
        if (node == null || !node.isObject()) {
            throw new IntentClassificationException("LLM response is not a JSON object");
        }
        return node;
    }

    /**
     * Wait for a completion, cancelling it locally if it does not arrive in
     * time.
     */
    static String await(CompletableFuture<String> pending, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException {
        try {
            return pending.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw e;
        }
    }

    static void appendHistory(StringBuilder sb, List<ConversationMessage> messages, int maxTextLength) {
        if (messages == null || messages.isEmpty()) {
            sb.append("(sin historial)\n");
            return;
        }
        for (ConversationMessage message : messages) {
            sb.append("- ").append(message.getRole()).append(": ")
                    .append(truncate(message.getText(), maxTextLength)).append('\n');
        }
    }

    static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...";
    }

    private static String extractJson(String response) {
        Matcher blockMatcher = JSON_BLOCK_PATTERN.matcher(response);
        if (blockMatcher.find()) {
            return blockMatcher.group(1);
        }

        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return response.substring(start, end + 1);
        }
        return response.trim();
    }
}
