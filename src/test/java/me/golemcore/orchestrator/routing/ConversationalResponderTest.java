package me.golemcore.orchestrator.routing;

import me.golemcore.orchestrator.domain.model.EscalationAssessment;
import me.golemcore.orchestrator.domain.model.Intent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationalResponderTest {

    private final ConversationalResponder responder = new ConversationalResponder();

    @Test
    void shouldGreetWithSuggestedActions() {
        Map<String, Object> body = responder.smallTalk(Intent.GREETING);

        assertTrue(((String) body.get("response")).startsWith("¡Hola! Bienvenido"));
        assertEquals(List.of("tramites", "pqrsd", "programas_sociales", "notificaciones"),
                body.get("suggested_actions"));
    }

    @Test
    void shouldUseDistinctRepliesPerSmallTalkIntent() {
        Object farewell = responder.smallTalk(Intent.FAREWELL).get("response");
        Object thanks = responder.smallTalk(Intent.THANKS).get("response");

        assertNotEquals(farewell, thanks);
        assertTrue(((String) thanks).startsWith("¡De nada!"));
    }

    @Test
    void shouldFallBackToDefaultReply() {
        assertEquals("¡Hola! ¿En qué puedo ayudarle?", responder.smallTalk(Intent.HELP).get("response"));
    }

    @Test
    void shouldDescribeHandoff() {
        EscalationAssessment assessment = EscalationAssessment.builder()
                .escalate(true)
                .urgency("alta")
                .reasons(List.of("Frustración"))
                .build();

        Map<String, Object> body = responder.escalation(assessment);

        assertEquals(true, body.get("escalate_to_human"));
        assertEquals(List.of("Frustración"), body.get("reason"));
        assertEquals("alta", body.get("urgency"));
        assertEquals(ConversationalResponder.HANDOFF_MESSAGE, body.get("message"));
        @SuppressWarnings("unchecked")
        Map<String, Object> agent = (Map<String, Object>) body.get("human_agent_info");
        assertEquals("Atención al Ciudadano", agent.get("department"));
        assertEquals("chat", agent.get("contact_method"));
    }

    @Test
    void shouldUseShortMessageForDegradedHandoff() {
        EscalationAssessment assessment = EscalationAssessment.builder()
                .escalate(true)
                .urgency("media")
                .degraded(true)
                .build();

        assertEquals(ConversationalResponder.DEGRADED_HANDOFF_MESSAGE,
                responder.escalation(assessment).get("message"));
    }

    @Test
    void shouldOfferHelpWhenNotEscalating() {
        Map<String, Object> body = responder.escalation(EscalationAssessment.builder().escalate(false).build());

        assertEquals(false, body.get("escalate_to_human"));
        assertFalse(body.containsKey("human_agent_info"));
        assertEquals(ConversationalResponder.NO_HANDOFF_MESSAGE, body.get("message"));
    }
}
