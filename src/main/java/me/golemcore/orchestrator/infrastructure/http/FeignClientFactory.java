package me.golemcore.orchestrator.infrastructure.http;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Factory for Feign HTTP clients with OkHttp transport and Jackson JSON
 * encoding.
 *
 * <p>
 * Usage:
 *
 * <pre>{@code
 * AgentServiceApi client = factory.create(AgentServiceApi.class, "http://agent:8082", 5000, 30000);
 * }</pre>
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    /**
     * Create a Feign client with explicit timeouts and no retries.
     */
    public <T> T create(Class<T> apiType, String baseUrl, long connectTimeoutMs, long readTimeoutMs) {
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .options(new Request.Options(
                        connectTimeoutMs, TimeUnit.MILLISECONDS,
                        readTimeoutMs, TimeUnit.MILLISECONDS,
                        true))
                .retryer(Retryer.NEVER_RETRY)
                .target(apiType, baseUrl);
    }
}
