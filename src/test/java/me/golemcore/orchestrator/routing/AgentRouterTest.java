package me.golemcore.orchestrator.routing;

import me.golemcore.orchestrator.domain.model.AgentRequest;
import me.golemcore.orchestrator.domain.model.AgentRouteResult;
import me.golemcore.orchestrator.domain.model.AgentRouteResult.RouteError;
import me.golemcore.orchestrator.domain.model.AgentTimeoutException;
import me.golemcore.orchestrator.domain.model.AgentUnavailableException;
import me.golemcore.orchestrator.domain.model.ConversationContext;
import me.golemcore.orchestrator.domain.service.MonitoringService;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.AgentGatewayPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AgentRouterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String TRAMITES_URL = "http://tramites-agent:8082";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private AgentGatewayPort gateway;
    private OrchestratorProperties properties;
    private MonitoringService monitoringService;
    private AgentRouter router;
    private ConversationContext context;

    @BeforeEach
    void setUp() {
        gateway = mock(AgentGatewayPort.class);
        properties = new OrchestratorProperties();
        properties.getAgents().getEndpoints().put("tramites", TRAMITES_URL);
        monitoringService = mock(MonitoringService.class);
        router = new AgentRouter(gateway, properties, monitoringService, Clock.fixed(NOW, ZoneOffset.UTC));
        context = ConversationContext.builder().sessionId("session_1").build();
    }

    @Test
    void shouldReturnAgentPayloadVerbatim() throws Exception {
        JsonNode payload = objectMapper.readTree("{\"response\": \"Requisitos: cédula\", \"extra\": [1]}");
        when(gateway.process(eq(TRAMITES_URL), any())).thenReturn(CompletableFuture.completedFuture(payload));

        AgentRouteResult result = router.dispatch("tramite_requisitos", "¿Requisitos?", context);

        assertTrue(result.isSuccess());
        assertEquals(payload, result.getPayload());
        ArgumentCaptor<AgentRequest> request = ArgumentCaptor.forClass(AgentRequest.class);
        verify(gateway).process(eq(TRAMITES_URL), request.capture());
        assertEquals("¿Requisitos?", request.getValue().getUserMessage());
        assertEquals("tramite_requisitos", request.getValue().getIntent());
        assertEquals("session_1", request.getValue().getSessionId());
        assertEquals(NOW, request.getValue().getTimestamp());
        verify(monitoringService).record(eq(MonitoringService.AGENT_RESPONSE_TIME), anyDouble(), anyMap());
    }

    @ParameterizedTest
    @ValueSource(strings = { "saludo", "clarificacion", "human_escalation", "desconocido" })
    void shouldNotCallAnyAgentForAgentlessIntent(String intent) {
        AgentRouteResult result = router.dispatch(intent, "hola", context);

        assertFalse(result.isSuccess());
        assertEquals(RouteError.NO_AGENT_AVAILABLE, result.getError());
        assertEquals(Map.of("error", "No agent available for intent", "intent", intent), result.errorBody());
        verifyNoInteractions(gateway);
        verify(monitoringService).record("agent_routing_error", 1.0, Map.of("intent", intent));
    }

    @Test
    void shouldReportMissingEndpointAsNoAgent() {
        properties.getAgents().getEndpoints().remove("pqrsd");

        AgentRouteResult result = router.dispatch("pqrsd_crear", "queja", context);

        assertEquals(RouteError.NO_AGENT_AVAILABLE, result.getError());
        verifyNoInteractions(gateway);
    }

    @Test
    void shouldTimeOutAndCancelPendingCall() {
        properties.getAgents().setTimeoutMs(50);
        CompletableFuture<JsonNode> neverCompletes = new CompletableFuture<>();
        when(gateway.process(anyString(), any())).thenReturn(neverCompletes);

        AgentRouteResult result = router.dispatch("tramite_estado", "estado", context);

        assertEquals(RouteError.AGENT_TIMEOUT, result.getError());
        assertEquals("Agent timeout", result.errorBody().get("error"));
        assertTrue(neverCompletes.isCancelled());
        verify(monitoringService).record("agent_timeout", 1.0, Map.of("intent", "tramite_estado"));
    }

    @Test
    void shouldMapTransportTimeout() {
        when(gateway.process(anyString(), any())).thenReturn(
                CompletableFuture.failedFuture(new AgentTimeoutException("read timed out", null)));

        assertEquals(RouteError.AGENT_TIMEOUT, router.dispatch("tramite_costo", "costo", context).getError());
    }

    @Test
    void shouldMapUnavailableAgent() {
        when(gateway.process(anyString(), any())).thenReturn(
                CompletableFuture.failedFuture(new AgentUnavailableException("HTTP 500", null)));

        AgentRouteResult result = router.dispatch("tramite_costo", "costo", context);

        assertEquals(RouteError.AGENT_UNAVAILABLE, result.getError());
        assertEquals("Agent unavailable", result.errorBody().get("error"));
        verify(monitoringService).record("agent_request_error", 1.0, Map.of("intent", "tramite_costo"));
    }

    @Test
    void shouldMapSynchronousGatewayFailure() {
        when(gateway.process(anyString(), any())).thenThrow(new IllegalStateException("boom"));

        assertEquals(RouteError.ROUTING_ERROR, router.dispatch("tramite_costo", "costo", context).getError());
    }

    @Test
    void shouldWrapNonObjectPayloadUnderResponse() throws Exception {
        when(gateway.process(anyString(), any()))
                .thenReturn(CompletableFuture.completedFuture(objectMapper.readTree("[\"uno\", \"dos\"]")));

        AgentRouteResult result = router.dispatch("tramite_costo", "costo", context);

        assertTrue(result.isSuccess());
        assertTrue(result.getPayload().isObject());
        assertEquals(objectMapper.readTree("[\"uno\", \"dos\"]"), result.getPayload().get("response"));
        verify(monitoringService).record(eq(MonitoringService.AGENT_RESPONSE_TIME), anyDouble(), anyMap());
    }

    @Test
    void shouldRejectEmptyPayload() {
        when(gateway.process(anyString(), any())).thenReturn(CompletableFuture.completedFuture(null));

        AgentRouteResult result = router.dispatch("tramite_costo", "costo", context);

        assertEquals(RouteError.ROUTING_ERROR, result.getError());
        assertNull(result.getPayload());
    }

    @Test
    void shouldUseUnknownSessionIdWhenContextHasNone() {
        when(gateway.process(anyString(), any())).thenReturn(
                CompletableFuture.completedFuture(objectMapper.createObjectNode()));

        router.dispatch("tramite_buscar", "buscar", ConversationContext.builder().build());

        ArgumentCaptor<AgentRequest> request = ArgumentCaptor.forClass(AgentRequest.class);
        verify(gateway).process(anyString(), request.capture());
        assertEquals("unknown", request.getValue().getSessionId());
    }
}
