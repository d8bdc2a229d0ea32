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

import me.golemcore.orchestrator.domain.model.Clarification;
import me.golemcore.orchestrator.domain.model.ConversationContext;
import me.golemcore.orchestrator.domain.model.IntentClassificationException;
import me.golemcore.orchestrator.domain.service.MonitoringService;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.TextGenerationPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Generates follow-up questions for messages whose intent could not be
 * determined with enough confidence.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClarificationGenerator {

    static final String FALLBACK_QUESTION = "¿Podría explicar con más detalle lo que necesita?";
    static final String FALLBACK_REASONING = "Error generando preguntas de clarificación";
    private static final int CONTEXT_TURNS = 5;

    static final String SYSTEM_PROMPT = """
            Eres un asistente de atención ciudadana que pide aclaraciones cuando no está
            seguro de la intención del usuario. Haz 1 o 2 preguntas claras y específicas,
            ofrece opciones cuando sea apropiado y no adivines la intención.
            Devuelve ÚNICAMENTE un objeto JSON:

            {"questions": ["Pregunta"], "suggested_intents": ["código"], "reasoning": "explicación breve"}
            """;

    private final TextGenerationPort textGeneration;
    private final OrchestratorProperties properties;
    private final MonitoringService monitoringService;
    private final ObjectMapper objectMapper;

    public Clarification generate(String message, ConversationContext context, double confidence) {
        try {
            StringBuilder prompt = new StringBuilder();
            prompt.append("## Mensaje del usuario:\n\"").append(PromptSupport.truncate(message, 1000))
                    .append("\"\n\n");
            prompt.append(String.format(Locale.ROOT, "## Confianza de la clasificación: %.2f%n%n", confidence));
            prompt.append("## Historial reciente:\n");
            PromptSupport.appendHistory(prompt, context.trailing(CONTEXT_TURNS), 200);
            prompt.append("\nResponde con el JSON solicitado.");

            String response = PromptSupport.await(
                    textGeneration.generate(prompt.toString(), SYSTEM_PROMPT),
                    properties.getClassifier().getTimeoutMs());
            return parse(response);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallback("interrupted");
        } catch (Exception e) {
            return fallback(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Clarification parse(String response) {
        JsonNode node = PromptSupport.extractObject(objectMapper, response);
        List<String> questions = textList(node.get("questions"));
        if (questions.isEmpty()) {
            throw new IntentClassificationException("No clarification questions returned");
        }
        return Clarification.builder()
                .questions(questions)
                .suggestedIntents(textList(node.get("suggested_intents")))
                .reasoning(node.path("reasoning").asText(""))
                .build();
    }

    private Clarification fallback(String reason) {
        log.warn("[Classifier] Clarification generation failed: {}", reason);
        monitoringService.record(MonitoringService.CLARIFICATION_ERROR, 1.0);
        return Clarification.builder()
                .questions(new ArrayList<>(List.of(FALLBACK_QUESTION)))
                .suggestedIntents(new ArrayList<>(List.of("ayuda")))
                .reasoning(FALLBACK_REASONING)
                .build();
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        }
        return values;
    }
}
