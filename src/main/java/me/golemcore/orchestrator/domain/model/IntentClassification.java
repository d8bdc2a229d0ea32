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

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of classifying one inbound message. Produced fresh per request and
 * never persisted.
 */
@Data
@Builder
public class IntentClassification {

    private String intent;
    private double confidence;
    private String reasoning;

    @Builder.Default
    private List<String> detectedKeywords = new ArrayList<>();

    public static IntentClassification fallback(String reasoning) {
        return IntentClassification.builder()
                .intent(Intent.CLARIFICATION.getCode())
                .confidence(0.0)
                .reasoning(reasoning)
                .detectedKeywords(new ArrayList<>())
                .build();
    }
}
