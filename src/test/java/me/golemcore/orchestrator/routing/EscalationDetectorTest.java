package me.golemcore.orchestrator.routing;

import me.golemcore.orchestrator.domain.model.ConversationContext;
import me.golemcore.orchestrator.domain.model.EscalationAssessment;
import me.golemcore.orchestrator.domain.service.MonitoringService;
import me.golemcore.orchestrator.infrastructure.config.AutoConfiguration;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.TextGenerationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class EscalationDetectorTest {

    private TextGenerationPort textGeneration;
    private MonitoringService monitoringService;
    private EscalationDetector detector;
    private ConversationContext context;

    @BeforeEach
    void setUp() {
        textGeneration = mock(TextGenerationPort.class);
        monitoringService = mock(MonitoringService.class);
        detector = new EscalationDetector(textGeneration, new OrchestratorProperties(), monitoringService,
                AutoConfiguration.objectMapper());
        context = ConversationContext.builder().sessionId("s1").build();
    }

    private void llmAnswers(String response) {
        when(textGeneration.generate(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(response));
    }

    @Test
    void shouldEscalateWithReasonsAndUrgency() {
        llmAnswers("""
                {"escalate": true, "confidence": 0.95, "reasons": ["Solicita hablar con una persona"],
                 "urgency": "alta"}
                """);

        EscalationAssessment assessment = detector.assess("Quiero hablar con un humano YA", context);

        assertTrue(assessment.isEscalate());
        assertEquals("alta", assessment.getUrgency());
        assertEquals(List.of("Solicita hablar con una persona"), assessment.getReasons());
        assertFalse(assessment.isDegraded());
        verifyNoInteractions(monitoringService);
    }

    @Test
    void shouldNotEscalateWhenModelSaysNo() {
        llmAnswers("{\"escalate\": false, \"confidence\": 0.8, \"reasons\": [], \"urgency\": \"baja\"}");

        EscalationAssessment assessment = detector.assess("¿un humano podría ayudarme algún día?", context);

        assertFalse(assessment.isEscalate());
        assertEquals("baja", assessment.getUrgency());
    }

    @Test
    void shouldApplyDefaultsForMissingOptionalFields() {
        llmAnswers("{\"escalate\": true}");

        EscalationAssessment assessment = detector.assess("persona por favor", context);

        assertEquals(List.of(EscalationDetector.DEFAULT_REASON), assessment.getReasons());
        assertEquals("media", assessment.getUrgency());
    }

    @Test
    void shouldEscalateByDefaultWhenVerdictMissing() {
        llmAnswers("{\"escalate\": \"quizás\"}");

        EscalationAssessment assessment = detector.assess("persona", context);

        assertTrue(assessment.isEscalate());
        assertTrue(assessment.isDegraded());
        assertEquals("media", assessment.getUrgency());
        assertEquals(List.of(EscalationDetector.FALLBACK_REASON), assessment.getReasons());
        verify(monitoringService).record(MonitoringService.ESCALATION_ERROR, 1.0);
    }

    @Test
    void shouldEscalateByDefaultWhenProviderFails() {
        when(textGeneration.generate(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        EscalationAssessment assessment = detector.assess("persona", context);

        assertTrue(assessment.isEscalate());
        assertTrue(assessment.isDegraded());
    }
}
