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

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed vocabulary of intent codes the classifier may produce.
 *
 * <p>
 * Agent-backed intents carry the {@link AgentKind} that serves them; several
 * intents share one agent. Conversational intents are answered in-process and
 * never dispatched.
 */
public enum Intent {

    TRAMITE_BUSCAR("tramite_buscar", AgentKind.TRAMITES),
    TRAMITE_REQUISITOS("tramite_requisitos", AgentKind.TRAMITES),
    TRAMITE_COSTO("tramite_costo", AgentKind.TRAMITES),
    TRAMITE_PLAZO("tramite_plazo", AgentKind.TRAMITES),
    TRAMITE_OFICINA("tramite_oficina", AgentKind.TRAMITES),
    TRAMITE_ESTADO("tramite_estado", AgentKind.TRAMITES),

    PQRSD_CREAR("pqrsd_crear", AgentKind.PQRSD),
    PQRSD_ESTADO("pqrsd_estado", AgentKind.PQRSD),
    PQRSD_TIPOS("pqrsd_tipos", AgentKind.PQRSD),

    PROGRAMA_BUSCAR("programa_buscar", AgentKind.PROGRAMAS),
    PROGRAMA_ELEGIBILIDAD("programa_elegibilidad", AgentKind.PROGRAMAS),
    PROGRAMA_INSCRIPCION("programa_inscripcion", AgentKind.PROGRAMAS),
    PROGRAMA_BENEFICIOS("programa_beneficios", AgentKind.PROGRAMAS),

    NOTIFICACION_PICO_PLACA("notificacion_pico_placa", AgentKind.NOTIFICACIONES),
    NOTIFICACION_CIERRE_VIAL("notificacion_cierre_vial", AgentKind.NOTIFICACIONES),
    NOTIFICACION_EVENTO("notificacion_evento", AgentKind.NOTIFICACIONES),
    NOTIFICACION_ALERTA("notificacion_alerta", AgentKind.NOTIFICACIONES),

    GREETING("saludo", null),
    FAREWELL("despedida", null),
    THANKS("agradecimiento", null),
    HELP("ayuda", null),
    TRANSACTION_COMPLETED("transaccion_completada", null),
    HUMAN_ESCALATION("human_escalation", null),
    CLARIFICATION("clarificacion", null);

    private static final Map<String, Intent> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Intent::getCode, Function.identity()));

    private final String code;
    private final AgentKind agent;

    Intent(String code, AgentKind agent) {
        this.code = code;
        this.agent = agent;
    }

    public String getCode() {
        return code;
    }

    public Optional<AgentKind> getAgent() {
        return Optional.ofNullable(agent);
    }

    /**
     * Greeting, farewell and thanks get a canned reply.
     */
    public boolean isSmallTalk() {
        return this == GREETING || this == FAREWELL || this == THANKS;
    }

    public static Optional<Intent> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE.get(code.trim().toLowerCase(Locale.ROOT)));
    }
}
