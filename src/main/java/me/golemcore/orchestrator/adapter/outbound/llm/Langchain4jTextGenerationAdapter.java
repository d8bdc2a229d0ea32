package me.golemcore.orchestrator.adapter.outbound.llm;

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

import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.TextGenerationPort;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Text generation through an OpenAI-compatible chat model (langchain4j).
 *
 * <p>
 * The model is created lazily on first use from {@code orchestrator.llm.*}.
 * Completions are cached for {@code cache-ttl-seconds} keyed by the SHA-256 of
 * system prompt and prompt, so identical classification prompts within the TTL
 * reach the provider once. No retries are made here; the caller owns the
 * timeout.
 *
 * <p>
 * Blocking chat calls run on a fixed pool of {@code max-concurrency} threads
 * owned by this adapter and shut down with the application context.
 */
@Component
@Slf4j
public class Langchain4jTextGenerationAdapter implements TextGenerationPort {

    private final OrchestratorProperties properties;
    private final Cache<String, String> responseCache;
    private final ExecutorService executor;
    private volatile ChatModel chatModel;

    @Autowired
    public Langchain4jTextGenerationAdapter(OrchestratorProperties properties) {
        this(properties, null);
    }

    Langchain4jTextGenerationAdapter(OrchestratorProperties properties, ChatModel chatModel) {
        this.properties = properties;
        this.chatModel = chatModel;
        OrchestratorProperties.LlmProperties config = properties.getLlm();
        this.responseCache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(config.getCacheTtlSeconds()))
                .maximumSize(config.getCacheMaxSize())
                .build();
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, config.getMaxConcurrency()), r -> {
            Thread t = new Thread(r, "llm-call-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<String> generate(String prompt, String systemPrompt) {
        return CompletableFuture.supplyAsync(() -> {
            String cacheKey = cacheKey(prompt, systemPrompt);
            String cached = responseCache.getIfPresent(cacheKey);
            if (cached != null) {
                log.debug("[LLM] Cache hit: {}", cacheKey.substring(0, 12));
                return cached;
            }

            List<ChatMessage> messages = new ArrayList<>();
            if (systemPrompt != null && !systemPrompt.isBlank()) {
                messages.add(SystemMessage.from(systemPrompt));
            }
            messages.add(UserMessage.from(prompt));

            long startMs = System.currentTimeMillis();
            ChatResponse response = getChatModel().chat(messages);
            String text = response.aiMessage().text();
            log.debug("[LLM] Completion in {}ms", System.currentTimeMillis() - startMs);

            if (text == null) {
                throw new IllegalStateException("LLM returned an empty completion");
            }
            responseCache.put(cacheKey, text);
            return text;
        }, executor);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[LLM] Completion executor shut down");
    }

    @Override
    public boolean isAvailable() {
        if (chatModel != null) {
            return true;
        }
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    private ChatModel getChatModel() {
        ChatModel model = chatModel;
        if (model != null) {
            return model;
        }
        synchronized (this) {
            if (chatModel == null) {
                chatModel = createModel(properties.getLlm());
            }
            return chatModel;
        }
    }

    private static ChatModel createModel(OrchestratorProperties.LlmProperties config) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("LLM api key is not configured (orchestrator.llm.api-key)");
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .temperature(config.getTemperature())
                .maxTokens(config.getMaxTokens())
                .maxRetries(0)
                .timeout(Duration.ofMillis(config.getTimeoutMs()));
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }

        log.info("[LLM] Initialized chat model: {}", config.getModel());
        return builder.build();
    }

    static String cacheKey(String prompt, String systemPrompt) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update((systemPrompt != null ? systemPrompt : "").getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update((prompt != null ? prompt : "").getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
