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

import me.golemcore.orchestrator.domain.model.ConversationContext;
import me.golemcore.orchestrator.domain.model.EscalationAssessment;
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

/**
 * Decides whether a conversation should be handed to a human agent, from the
 * message and the last three turns.
 *
 * <p>
 * When no verdict can be obtained the conversation is escalated with urgency
 * {@code media}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EscalationDetector {

    static final String DEFAULT_URGENCY = "media";
    static final String DEFAULT_REASON = "Solicitud de usuario";
    static final String FALLBACK_REASON = "Error en detección de escalación";
    private static final int CONTEXT_TURNS = 3;

    static final String SYSTEM_PROMPT = """
            Eres un detector de escalación humana para un asistente de atención ciudadana.
            Escala si detectas: solicitud explícita de una persona, frustración, urgencia
            extrema, problemas técnicos repetidos, casos complejos o legales, emociones
            intensas o abuso del sistema. No escales por simple curiosidad.
            Devuelve ÚNICAMENTE un objeto JSON:

            {"escalate": true, "confidence": 0.0-1.0, "reasons": ["razón"], "urgency": "alta|media|baja"}
            """;

    private final TextGenerationPort textGeneration;
    private final OrchestratorProperties properties;
    private final MonitoringService monitoringService;
    private final ObjectMapper objectMapper;

    public EscalationAssessment assess(String message, ConversationContext context) {
        try {
            StringBuilder prompt = new StringBuilder();
            prompt.append("## Mensaje a evaluar:\n\"").append(PromptSupport.truncate(message, 1000))
                    .append("\"\n\n## Historial reciente:\n");
            PromptSupport.appendHistory(prompt, context.trailing(CONTEXT_TURNS), 200);
            prompt.append("\nResponde con el JSON solicitado.");

            String response = PromptSupport.await(
                    textGeneration.generate(prompt.toString(), SYSTEM_PROMPT),
                    properties.getClassifier().getTimeoutMs());
            EscalationAssessment assessment = parse(response);
            log.info("[Classifier] Escalation verdict: escalate={}, urgency={}", assessment.isEscalate(),
                    assessment.getUrgency());
            return assessment;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallback("interrupted");
        } catch (Exception e) {
            return fallback(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private EscalationAssessment parse(String response) {
        JsonNode node = PromptSupport.extractObject(objectMapper, response);
        JsonNode escalate = node.get("escalate");
        if (escalate == null || !escalate.isBoolean()) {
            throw new IntentClassificationException("Missing required field: escalate");
        }

        List<String> reasons = new ArrayList<>();
        JsonNode reasonsNode = node.get("reasons");
        if (reasonsNode != null && reasonsNode.isArray()) {
            reasonsNode.forEach(reason -> reasons.add(reason.asText()));
        }
        if (reasons.isEmpty()) {
            reasons.add(DEFAULT_REASON);
        }

        return EscalationAssessment.builder()
                .escalate(escalate.asBoolean())
                .urgency(node.path("urgency").asText(DEFAULT_URGENCY))
                .reasons(reasons)
                .build();
    }

    private EscalationAssessment fallback(String reason) {
        log.warn("[Classifier] Escalation detection failed, escalating by default: {}", reason);
        monitoringService.record(MonitoringService.ESCALATION_ERROR, 1.0);
        return EscalationAssessment.builder()
                .escalate(true)
                .urgency(DEFAULT_URGENCY)
                .reasons(new ArrayList<>(List.of(FALLBACK_REASON)))
                .degraded(true)
                .build();
    }
}
