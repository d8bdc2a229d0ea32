package me.golemcore.orchestrator.domain.pipeline;

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

import me.golemcore.orchestrator.domain.model.AgentRouteResult;
import me.golemcore.orchestrator.domain.model.Clarification;
import me.golemcore.orchestrator.domain.model.ConversationContext;
import me.golemcore.orchestrator.domain.model.ConversationMessage;
import me.golemcore.orchestrator.domain.model.EscalationAssessment;
import me.golemcore.orchestrator.domain.model.GuardResult;
import me.golemcore.orchestrator.domain.model.InboundRequest;
import me.golemcore.orchestrator.domain.model.Intent;
import me.golemcore.orchestrator.domain.model.IntentClassification;
import me.golemcore.orchestrator.domain.model.OrchestrationError;
import me.golemcore.orchestrator.domain.model.ProcessResult;
import me.golemcore.orchestrator.domain.model.ProcessingStage;
import me.golemcore.orchestrator.domain.model.Session;
import me.golemcore.orchestrator.domain.service.ContextManager;
import me.golemcore.orchestrator.domain.service.MonitoringService;
import me.golemcore.orchestrator.domain.service.SessionManager;
import me.golemcore.orchestrator.routing.AgentRouter;
import me.golemcore.orchestrator.routing.ClarificationGenerator;
import me.golemcore.orchestrator.routing.ConversationalResponder;
import me.golemcore.orchestrator.routing.EscalationDetector;
import me.golemcore.orchestrator.routing.IntentClassifier;
import me.golemcore.orchestrator.security.InjectionGuard;
import me.golemcore.orchestrator.security.ResponseSanitizer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one conversational turn end to end.
 *
 * <p>
 * After the {@link RequestGuardChain} admits the request, a turn moves through
 * {@link ProcessingStage}s:
 * <ol>
 * <li>VALIDATING - denylisted text is rejected as a security violation</li>
 * <li>CONTEXT_LOADED - the conversation window is loaded</li>
 * <li>CLASSIFIED - the message is classified against the trailing turns</li>
 * <li>CLARIFYING, ESCALATING, GENERAL_REPLY or ROUTED - depending on the
 * intent</li>
 * <li>CONTEXT_PERSISTED - the window and the reply are committed</li>
 * <li>DONE</li>
 * </ol>
 * Any unexpected exception moves the turn to FAILED and yields a generic 500
 * body. Agent failures are not exceptions here: they come back in-band from the
 * {@link AgentRouter} and are returned with status 200. Every body passes the
 * {@link ResponseSanitizer}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Orchestrator {

    static final String SECURITY_VIOLATION_MESSAGE = "Invalid input detected - potential security threat";
    static final String INTERNAL_ERROR_MESSAGE = "Internal processing error";
    private static final int CLASSIFIER_CONTEXT_TURNS = 5;
    private static final TypeReference<LinkedHashMap<String, Object>> BODY_TYPE = new TypeReference<>() {
    };

    private final RequestGuardChain guardChain;
    private final RateLimitGuard rateLimitGuard;
    private final InjectionGuard injectionGuard;
    private final ResponseSanitizer responseSanitizer;
    private final SessionManager sessionManager;
    private final ContextManager contextManager;
    private final IntentClassifier intentClassifier;
    private final ClarificationGenerator clarificationGenerator;
    private final EscalationDetector escalationDetector;
    private final ConversationalResponder conversationalResponder;
    private final AgentRouter agentRouter;
    private final MonitoringService monitoringService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Admit and process one inbound message.
     */
    public ProcessResult process(InboundRequest request) {
        GuardResult admission = guardChain.check(request);
        if (!admission.isPassed()) {
            return ProcessResult.error(admission.getError(), admission.getMessage());
        }
        return handleTurn(request);
    }

    /**
     * Describe a session for introspection, after the same admission checks as
     * {@link #process(InboundRequest)}.
     */
    public ProcessResult describeSession(InboundRequest request) {
        GuardResult admission = guardChain.check(request);
        if (!admission.isPassed()) {
            return ProcessResult.error(admission.getError(), admission.getMessage());
        }

        Optional<Session> session = sessionManager.find(request.getSessionId());
        if (session.isEmpty()) {
            return ProcessResult.error(OrchestrationError.NOT_FOUND, "Session not found");
        }
        Map<String, Object> body = objectMapper.convertValue(sessionManager.describe(session.get()), BODY_TYPE);
        return ProcessResult.ok(responseSanitizer.sanitize(body));
    }

    /**
     * Open a new session for the user. Rate limited like every other call.
     *
     * @return status 201 with {@code session_id}, or a 4xx error
     */
    public ProcessResult openSession(InboundRequest request, Map<String, String> clientMetadata) {
        GuardResult admission = rateLimitGuard.check(request);
        if (!admission.isPassed()) {
            return ProcessResult.error(admission.getError(), admission.getMessage());
        }

        String userId = request.getUserId();
        if (userId == null || userId.isBlank()) {
            return ProcessResult.error(OrchestrationError.VALIDATION, "Missing user_id");
        }
        if (!injectionGuard.isSafe(userId)) {
            return ProcessResult.error(OrchestrationError.VALIDATION, "Invalid user ID format");
        }
        if (request.getChatId() != null && !injectionGuard.isSafe(request.getChatId())) {
            return ProcessResult.error(OrchestrationError.VALIDATION, "Invalid chat ID format");
        }

        String sessionId = sessionManager.create(userId, request.getChatId(), clientMetadata);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session_id", sessionId);
        return ProcessResult.builder().status(201).body(body).build();
    }

    private ProcessResult handleTurn(InboundRequest request) {
        long startNanos = System.nanoTime();
        String sessionId = request.getSessionId();
        String text = request.getText() != null ? request.getText() : "";
        ProcessingStage stage = ProcessingStage.VALIDATING;

        try {
            if (!injectionGuard.isSafe(text)) {
                log.warn("[Orchestrator] {} (session: {})", SECURITY_VIOLATION_MESSAGE, sessionId);
                monitoringService.record(MonitoringService.SECURITY_VIOLATION, 1.0);
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("error", SECURITY_VIOLATION_MESSAGE);
                body.put("metadata", baseMetadata(startNanos));
                return ProcessResult.builder()
                        .status(OrchestrationError.VALIDATION.getStatus())
                        .body(responseSanitizer.sanitize(body))
                        .build();
            }

            stage = ProcessingStage.CONTEXT_LOADED;
            ConversationContext context = contextManager.load(sessionId, text);

            stage = ProcessingStage.CLASSIFIED;
            IntentClassification classification = intentClassifier.classify(text,
                    context.trailing(CLASSIFIER_CONTEXT_TURNS));
            String intent = classification.getIntent();
            log.info("[Orchestrator] Intent classified: {} (session: {})", intent, sessionId);

            Optional<Intent> known = Intent.fromCode(intent);
            Map<String, Object> body;
            if (known.isPresent() && known.get() == Intent.CLARIFICATION) {
                stage = ProcessingStage.CLARIFYING;
                Clarification clarification = clarificationGenerator.generate(text, context,
                        classification.getConfidence());
                body = objectMapper.convertValue(clarification, BODY_TYPE);
            } else if (known.isPresent() && known.get() == Intent.HUMAN_ESCALATION) {
                stage = ProcessingStage.ESCALATING;
                EscalationAssessment assessment = escalationDetector.assess(text, context);
                body = conversationalResponder.escalation(assessment);
            } else if (known.isPresent() && known.get().isSmallTalk()) {
                stage = ProcessingStage.GENERAL_REPLY;
                body = conversationalResponder.smallTalk(known.get());
            } else {
                stage = ProcessingStage.ROUTED;
                AgentRouteResult routed = agentRouter.dispatch(intent, text, context);
                body = routed.isSuccess()
                        ? objectMapper.convertValue(routed.getPayload(), BODY_TYPE)
                        : routed.errorBody();
            }

            stage = ProcessingStage.CONTEXT_PERSISTED;
            persistTurn(sessionId, context, body);

            double processingSeconds = elapsedSeconds(startNanos);
            monitoringService.record(MonitoringService.REQUEST_PROCESSING_TIME, processingSeconds, Map.of(
                    "intent", intent,
                    "confidence", String.valueOf(classification.getConfidence())));

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("processing_time", round3(processingSeconds));
            metadata.put("intent", intent);
            metadata.put("confidence", classification.getConfidence());
            metadata.put("timestamp", clock.instant().toString());
            metadata.put("session_id", sessionId);
            body.put("metadata", metadata);

            monitoringService.checkAlerts();

            stage = ProcessingStage.DONE;
            log.info("[Orchestrator] Turn done for session {} in {}s", sessionId, round3(processingSeconds));
            return ProcessResult.ok(responseSanitizer.sanitize(body));

        } catch (Exception e) {
            log.error("[Orchestrator] Processing failed for session {} at stage {}: {}", sessionId, stage,
                    e.getMessage(), e);
            monitoringService.record(MonitoringService.PROCESSING_ERROR, 1.0);

            Map<String, Object> metadata = baseMetadata(startNanos);
            metadata.put("session_id", sessionId);
            metadata.put("stage", ProcessingStage.FAILED.name());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", INTERNAL_ERROR_MESSAGE);
            body.put("metadata", metadata);
            return ProcessResult.builder()
                    .status(OrchestrationError.INTERNAL.getStatus())
                    .body(responseSanitizer.sanitize(body))
                    .build();
        }
    }

    private void persistTurn(String sessionId, ConversationContext context, Map<String, Object> body) {
        try {
            List<ConversationMessage> messages = new ArrayList<>(context.getRecentMessages());
            if (body.get("response") instanceof String reply) {
                messages.add(ConversationMessage.agent(reply, clock.instant()));
            }
            if (!contextManager.commit(sessionId, messages)) {
                monitoringService.record(MonitoringService.SESSION_UPDATE_ERROR, 1.0);
            }
        } catch (Exception e) { // NOSONAR - a lost history write does not fail the turn
            log.error("[Orchestrator] Failed to update session {} after response: {}", sessionId, e.getMessage());
            monitoringService.record(MonitoringService.SESSION_UPDATE_ERROR, 1.0);
        }
    }

    private Map<String, Object> baseMetadata(long startNanos) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("processing_time", round3(elapsedSeconds(startNanos)));
        metadata.put("timestamp", clock.instant().toString());
        return metadata;
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
