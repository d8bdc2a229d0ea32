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
import me.golemcore.orchestrator.domain.model.Intent;
import me.golemcore.orchestrator.domain.model.IntentClassification;
import me.golemcore.orchestrator.domain.model.IntentClassificationException;
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
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * LLM-based intent classifier over the closed {@link Intent} vocabulary.
 *
 * <p>
 * The model must answer with a JSON object holding {@code intent},
 * {@code confidence} (a number in [0, 1]), {@code reasoning} and
 * {@code detected_keywords}. Anything else is a classification error.
 *
 * <p>
 * A confidence strictly below {@code orchestrator.classifier.confidence-threshold}
 * turns the result into {@code clarificacion}, whatever intent was proposed.
 * Errors and timeouts never propagate: the caller gets
 * {@link IntentClassification#fallback(String)}.
 *
 * @see ClarificationGenerator
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IntentClassifier {

    private static final int MAX_HISTORY_TEXT = 200;
    private static final int MAX_MESSAGE_TEXT = 1000;

    static final String SYSTEM_PROMPT = """
            Eres un clasificador de intenciones para un asistente de atención ciudadana municipal.
            Analiza el mensaje del usuario y su contexto y devuelve ÚNICAMENTE un objeto JSON:

            {"intent": "código", "confidence": 0.0-1.0, "reasoning": "explicación breve", "detected_keywords": ["palabra"]}

            ## Códigos de intención
            - Trámites: tramite_buscar, tramite_requisitos, tramite_costo, tramite_plazo, tramite_oficina, tramite_estado
            - PQRSD: pqrsd_crear, pqrsd_estado, pqrsd_tipos
            - Programas sociales: programa_buscar, programa_elegibilidad, programa_inscripcion, programa_beneficios
            - Notificaciones: notificacion_pico_placa, notificacion_cierre_vial, notificacion_evento, notificacion_alerta
            - Interacción general: saludo, despedida, agradecimiento, ayuda, human_escalation, transaccion_completada
            - clarificacion: el mensaje es ambiguo o pide una aclaración

            ## Reglas
            1. Solo clasifica con confianza >= 0.7; si no, usa "clarificacion".
            2. Considera el historial de la conversación.
            3. Si hay varias intenciones, prioriza la más específica.
            4. Redondea confidence a 2 decimales y usa comillas dobles.
            """;

    private final TextGenerationPort textGeneration;
    private final OrchestratorProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Classify a message given the trailing conversation.
     *
     * @param message
     *            the user's message
     * @param trailingContext
     *            recent turns, oldest first; only the last
     *            {@code context-turns} are sent
     * @return the classification, never null
     */
    public IntentClassification classify(String message, List<ConversationMessage> trailingContext) {
        OrchestratorProperties.ClassifierProperties config = properties.getClassifier();
        try {
            String prompt = buildPrompt(message, trailingContext, config.getContextTurns());
            log.debug("[Classifier] Prompt:\n{}", prompt);

            long startMs = System.currentTimeMillis();
            String response = PromptSupport.await(textGeneration.generate(prompt, SYSTEM_PROMPT),
                    config.getTimeoutMs());
            log.debug("[Classifier] LLM responded in {}ms", System.currentTimeMillis() - startMs);

            IntentClassification result = parseResponse(response);
            if (result.getConfidence() < config.getConfidenceThreshold()) {
                result.setIntent(Intent.CLARIFICATION.getCode());
                result.setReasoning(String.format(Locale.ROOT, "Confianza baja (%.2f < %s)",
                        result.getConfidence(), config.getConfidenceThreshold()));
            }

            log.info("[Classifier] Intent: {} (confidence: {})", result.getIntent(),
                    String.format(Locale.ROOT, "%.2f", result.getConfidence()));
            return result;

        } catch (TimeoutException e) {
            log.warn("[Classifier] LLM classification timed out after {}ms", config.getTimeoutMs());
            return IntentClassification.fallback("Error en clasificación: tiempo de espera agotado");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return IntentClassification.fallback("Error en clasificación: interrumpido");
        } catch (Exception e) {
            String reason = describe(e);
            log.warn("[Classifier] LLM classification FAILED: {}", reason);
            return IntentClassification.fallback("Error en clasificación: " + reason);
        }
    }

    IntentClassification parseResponse(String response) {
        JsonNode node = PromptSupport.extractObject(objectMapper, response);

        for (String field : List.of("intent", "confidence", "reasoning", "detected_keywords")) {
            if (!node.hasNonNull(field)) {
                throw new IntentClassificationException("Missing required field: " + field);
            }
        }

        String intent = node.get("intent").asText().trim();
        if (intent.isEmpty()) {
            throw new IntentClassificationException("Empty intent");
        }

        JsonNode confidenceNode = node.get("confidence");
        if (!confidenceNode.isNumber()) {
            throw new IntentClassificationException("Confidence must be numeric");
        }
        double confidence = confidenceNode.asDouble();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IntentClassificationException("Confidence must be between 0.0 and 1.0");
        }

        JsonNode keywordsNode = node.get("detected_keywords");
        if (!keywordsNode.isArray()) {
            throw new IntentClassificationException("detected_keywords must be an array");
        }
        List<String> keywords = new ArrayList<>();
        keywordsNode.forEach(keyword -> keywords.add(keyword.asText()));

        return IntentClassification.builder()
                .intent(intent)
                .confidence(confidence)
                .reasoning(node.get("reasoning").asText())
                .detectedKeywords(keywords)
                .build();
    }

    private String buildPrompt(String message, List<ConversationMessage> context, int contextTurns) {
        StringBuilder sb = new StringBuilder();

        sb.append("## Historial reciente:\n");
        List<ConversationMessage> recent = context;
        if (context != null && context.size() > contextTurns) {
            recent = context.subList(context.size() - contextTurns, context.size());
        }
        PromptSupport.appendHistory(sb, recent, MAX_HISTORY_TEXT);

        sb.append("\n## Mensaje del usuario:\n\"");
        sb.append(PromptSupport.truncate(message, MAX_MESSAGE_TEXT));
        sb.append("\"\n\nClasifica el mensaje y responde solo con el JSON.");
        return sb.toString();
    }

    private static String describe(Exception e) {
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof IntentClassificationException) {
            return cause.getMessage();
        }
        return cause.getClass().getSimpleName();
    }
}
