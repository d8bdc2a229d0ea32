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

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response body plus the status code it should be delivered with.
 */
@Data
@Builder
public class ProcessResult {

    private int status;

    @Builder.Default
    private Map<String, Object> body = new LinkedHashMap<>();

    public static ProcessResult ok(Map<String, Object> body) {
        return ProcessResult.builder().status(200).body(body).build();
    }

    public static ProcessResult error(OrchestrationError error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        return ProcessResult.builder().status(error.getStatus()).body(body).build();
    }
}
