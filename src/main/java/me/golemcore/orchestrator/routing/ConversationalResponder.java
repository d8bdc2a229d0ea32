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

import me.golemcore.orchestrator.domain.model.EscalationAssessment;
import me.golemcore.orchestrator.domain.model.Intent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed replies for turns that are answered without an agent: small talk and
 * human hand-off.
 */
@Component
public class ConversationalResponder {

    static final List<String> SUGGESTED_ACTIONS = List.of(
            "tramites", "pqrsd", "programas_sociales", "notificaciones");

    private static final Map<Intent, String> SMALL_TALK_REPLIES = Map.of(
            Intent.GREETING,
            "¡Hola! Bienvenido a MedellínBot, su asistente ciudadano. ¿En qué puedo ayudarle hoy?",
            Intent.FAREWELL,
            "¡Hasta luego! Gracias por usar MedellínBot. Si necesita algo más, no dude en contactarnos.",
            Intent.THANKS,
            "¡De nada! Estoy para servirle. ¿En qué más puedo ayudarle?");

    private static final String DEFAULT_REPLY = "¡Hola! ¿En qué puedo ayudarle?";

    static final String HANDOFF_MESSAGE = "Voy a transferirlo con un agente humano para que lo atienda "
            + "personalmente. Por favor espere unos momentos.";
    static final String DEGRADED_HANDOFF_MESSAGE = "Voy a transferirlo con un agente humano para que lo atienda "
            + "personalmente.";
    static final String NO_HANDOFF_MESSAGE = "Entiendo su situación. Puedo ayudarle con eso. ¿Qué necesita exactamente?";

    public Map<String, Object> smallTalk(Intent intent) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("response", SMALL_TALK_REPLIES.getOrDefault(intent, DEFAULT_REPLY));
        body.put("suggested_actions", SUGGESTED_ACTIONS);
        return body;
    }

    public Map<String, Object> escalation(EscalationAssessment assessment) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (!assessment.isEscalate()) {
            body.put("escalate_to_human", false);
            body.put("message", NO_HANDOFF_MESSAGE);
            return body;
        }

        Map<String, Object> humanAgent = new LinkedHashMap<>();
        humanAgent.put("name", "Agente Humano");
        humanAgent.put("department", "Atención al Ciudadano");
        humanAgent.put("estimated_wait_time", "5 minutos");
        humanAgent.put("contact_method", "chat");

        body.put("escalate_to_human", true);
        body.put("reason", assessment.getReasons());
        body.put("urgency", assessment.getUrgency());
        body.put("human_agent_info", humanAgent);
        body.put("message", assessment.isDegraded() ? DEGRADED_HANDOFF_MESSAGE : HANDOFF_MESSAGE);
        return body;
    }
}
