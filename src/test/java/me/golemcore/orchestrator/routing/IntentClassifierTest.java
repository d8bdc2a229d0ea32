package me.golemcore.orchestrator.routing;

import me.golemcore.orchestrator.domain.model.ConversationMessage;
import me.golemcore.orchestrator.domain.model.IntentClassification;
import me.golemcore.orchestrator.domain.model.IntentClassificationException;
import me.golemcore.orchestrator.infrastructure.config.AutoConfiguration;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.TextGenerationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IntentClassifierTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private TextGenerationPort textGeneration;
    private OrchestratorProperties properties;
    private IntentClassifier classifier;

    @BeforeEach
    void setUp() {
        textGeneration = mock(TextGenerationPort.class);
        properties = new OrchestratorProperties();
        classifier = new IntentClassifier(textGeneration, properties, AutoConfiguration.objectMapper());
    }

    private void llmAnswers(String response) {
        when(textGeneration.generate(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(response));
    }

    @Test
    void shouldClassifyConfidentResponse() {
        llmAnswers("""
                {"intent": "tramite_requisitos", "confidence": 0.92,
                 "reasoning": "Pregunta por requisitos", "detected_keywords": ["requisitos", "licencia"]}
                """);

        IntentClassification result = classifier.classify("¿Qué requisitos necesito para la licencia?", List.of());

        assertEquals("tramite_requisitos", result.getIntent());
        assertEquals(0.92, result.getConfidence(), 1e-9);
        assertEquals("Pregunta por requisitos", result.getReasoning());
        assertEquals(List.of("requisitos", "licencia"), result.getDetectedKeywords());
    }

    @Test
    void shouldExtractJsonFromFencedBlock() {
        llmAnswers("""
                Claro, aquí está:
                ```json
                {"intent": "saludo", "confidence": 0.99, "reasoning": "Saludo", "detected_keywords": ["hola"]}
                ```
                """);

        assertEquals("saludo", classifier.classify("hola", List.of()).getIntent());
    }

    @Test
    void shouldDowngradeLowConfidenceToClarification() {
        llmAnswers("""
                {"intent": "pqrsd_crear", "confidence": 0.55, "reasoning": "Quizás una queja",
                 "detected_keywords": []}
                """);

        IntentClassification result = classifier.classify("tengo un problema", List.of());

        assertEquals("clarificacion", result.getIntent());
        assertEquals(0.55, result.getConfidence(), 1e-9);
        assertEquals("Confianza baja (0.55 < 0.7)", result.getReasoning());
    }

    @Test
    void shouldKeepIntentAtExactThreshold() {
        llmAnswers("""
                {"intent": "programa_buscar", "confidence": 0.7, "reasoning": "r", "detected_keywords": []}
                """);

        assertEquals("programa_buscar", classifier.classify("programas", List.of()).getIntent());
    }

    @Test
    void shouldFallBackOnTimeout() {
        properties.getClassifier().setTimeoutMs(50);
        CompletableFuture<String> neverCompletes = new CompletableFuture<>();
        when(textGeneration.generate(anyString(), anyString())).thenReturn(neverCompletes);

        IntentClassification result = classifier.classify("hola", List.of());

        assertEquals("clarificacion", result.getIntent());
        assertEquals(0.0, result.getConfidence());
        assertEquals("Error en clasificación: tiempo de espera agotado", result.getReasoning());
        assertTrue(neverCompletes.isCancelled());
    }

    @Test
    void shouldFallBackWhenProviderFails() {
        when(textGeneration.generate(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("quota")));

        IntentClassification result = classifier.classify("hola", List.of());

        assertEquals("clarificacion", result.getIntent());
        assertEquals("Error en clasificación: IllegalStateException", result.getReasoning());
    }

    @Test
    void shouldFallBackWithParseErrorReason() {
        llmAnswers("{\"intent\": \"saludo\", \"confidence\": 0.9, \"reasoning\": \"r\"}");

        IntentClassification result = classifier.classify("hola", List.of());

        assertEquals("clarificacion", result.getIntent());
        assertEquals("Error en clasificación: Missing required field: detected_keywords", result.getReasoning());
        assertTrue(result.getDetectedKeywords().isEmpty());
    }

    @Test
    void shouldSendOnlyConfiguredContextTurns() {
        properties.getClassifier().setContextTurns(2);
        llmAnswers("{\"intent\": \"saludo\", \"confidence\": 0.9, \"reasoning\": \"r\", \"detected_keywords\": []}");
        List<ConversationMessage> history = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            history.add(ConversationMessage.user("turno-" + i, NOW));
        }

        classifier.classify("hola", history);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(textGeneration).generate(prompt.capture(), eq(IntentClassifier.SYSTEM_PROMPT));
        assertFalse(prompt.getValue().contains("turno-2"));
        assertTrue(prompt.getValue().contains("turno-3"));
        assertTrue(prompt.getValue().contains("turno-4"));
        assertTrue(prompt.getValue().contains("\"hola\""));
    }

    @Test
    void shouldRenderEmptyHistory() {
        llmAnswers("{\"intent\": \"saludo\", \"confidence\": 0.9, \"reasoning\": \"r\", \"detected_keywords\": []}");

        classifier.classify("hola", List.of());

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(textGeneration).generate(prompt.capture(), anyString());
        assertTrue(prompt.getValue().contains("(sin historial)"));
    }

    // ===== parseResponse =====

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "no es json",
            "[1, 2]",
            "{\"intent\": \"\", \"confidence\": 0.9, \"reasoning\": \"r\", \"detected_keywords\": []}",
            "{\"intent\": \"saludo\", \"confidence\": \"alta\", \"reasoning\": \"r\", \"detected_keywords\": []}",
            "{\"intent\": \"saludo\", \"confidence\": 1.5, \"reasoning\": \"r\", \"detected_keywords\": []}",
            "{\"intent\": \"saludo\", \"confidence\": -0.1, \"reasoning\": \"r\", \"detected_keywords\": []}",
            "{\"intent\": \"saludo\", \"confidence\": 0.9, \"reasoning\": \"r\", \"detected_keywords\": \"hola\"}",
            "{\"intent\": \"saludo\", \"confidence\": 0.9, \"reasoning\": null, \"detected_keywords\": []}"
    })
    void shouldRejectMalformedResponses(String response) {
        assertThrows(IntentClassificationException.class, () -> classifier.parseResponse(response));
    }

    @Test
    void shouldAcceptBoundaryConfidences() {
        assertEquals(0.0, classifier.parseResponse(
                "{\"intent\": \"ayuda\", \"confidence\": 0, \"reasoning\": \"r\", \"detected_keywords\": []}")
                .getConfidence());
        assertEquals(1.0, classifier.parseResponse(
                "{\"intent\": \"ayuda\", \"confidence\": 1.0, \"reasoning\": \"r\", \"detected_keywords\": []}")
                .getConfidence());
    }
}
