package me.golemcore.orchestrator.domain.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.MutableClock;
import me.golemcore.orchestrator.domain.agent.AgentRouter;
import me.golemcore.orchestrator.domain.agent.ConversationalAgent;
import me.golemcore.orchestrator.domain.agent.ToolCallingAgent;
import me.golemcore.orchestrator.domain.agent.ToolTurnService;
import me.golemcore.orchestrator.domain.model.ConfirmationStatus;
import me.golemcore.orchestrator.domain.model.InboundMessage;
import me.golemcore.orchestrator.domain.model.InfrastructureCommandResult;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.NormalizedReply;
import me.golemcore.orchestrator.domain.model.ProviderAttempt;
import me.golemcore.orchestrator.domain.model.ProviderUnavailableException;
import me.golemcore.orchestrator.domain.model.StateKind;
import me.golemcore.orchestrator.domain.model.Trace;
import me.golemcore.orchestrator.domain.model.TraceStatus;
import me.golemcore.orchestrator.domain.model.TraceStep;
import me.golemcore.orchestrator.domain.model.TurnReply;
import me.golemcore.orchestrator.domain.service.ConfirmationSessionService;
import me.golemcore.orchestrator.domain.service.ConversationStateService;
import me.golemcore.orchestrator.domain.service.ProviderFallbackExecutor;
import me.golemcore.orchestrator.domain.service.ToolRegistry;
import me.golemcore.orchestrator.domain.service.TraceRecorder;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.InfrastructureCommandPort;
import me.golemcore.orchestrator.tools.DeleteAppTool;
import me.golemcore.orchestrator.tools.EchoTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TurnOrchestratorTest {

    private static final String ADMIN = "42";
    private static final String GUEST = "7";

    private MutableClock clock;
    private ProviderFallbackExecutor providerExecutor;
    private InfrastructureCommandPort commandPort;
    private ConfirmationSessionService confirmationSessions;
    private ConversationStateService conversationStates;
    private TraceRecorder traceRecorder;
    private TurnHistoryStore turnHistory;
    private TurnOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getAgents().setAdminUsers(List.of(ADMIN));
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        providerExecutor = mock(ProviderFallbackExecutor.class);
        commandPort = mock(InfrastructureCommandPort.class);
        when(commandPort.execute(anyString(), anyMap())).thenReturn(CompletableFuture.completedFuture(
                InfrastructureCommandResult.builder().success(true).response("deleted").build()));

        ToolRegistry toolRegistry = new ToolRegistry(List.of(new EchoTool(), new DeleteAppTool(commandPort)),
                properties);
        confirmationSessions = new ConfirmationSessionService(toolRegistry, properties, clock);
        conversationStates = new ConversationStateService(properties, clock);
        traceRecorder = new TraceRecorder(properties, clock);
        turnHistory = new TurnHistoryStore(properties, clock);
        ToolTurnService toolTurnService = new ToolTurnService(providerExecutor, toolRegistry, confirmationSessions,
                conversationStates, traceRecorder, properties, new ObjectMapper(), clock);
        AgentRouter router = new AgentRouter(List.of(new ConversationalAgent(toolTurnService),
                new ToolCallingAgent(toolTurnService, toolRegistry, properties)), traceRecorder, clock);
        orchestrator = new TurnOrchestrator(router, confirmationSessions, conversationStates, traceRecorder,
                turnHistory, clock);
    }

    // ==================== plain turns ====================

    @Test
    void shouldAnswerThroughConversationalAgent() throws Exception {
        when(providerExecutor.complete(any(), any())).thenReturn(new NormalizedReply.Text("openai", "Hello!"));

        TurnReply reply = orchestrator.handle(message(GUEST, "hi")).get(5, TimeUnit.SECONDS);

        assertEquals(ConversationalAgent.NAME, reply.getAgent());
        assertEquals("Hello!", reply.getText());
        Trace trace = traceRecorder.get(reply.getTraceId());
        assertEquals(TraceStatus.COMPLETED, trace.getStatus());
        assertEquals(TraceStep.MESSAGE_RECEIVED, trace.getEvents().get(0).getStep());
        assertEquals(TraceStep.RESPONSE_SENT, trace.getEvents().get(trace.getEvents().size() - 1).getStep());
        assertEquals(List.of("hi", "Hello!"), turnHistory.recent(GUEST).stream().map(Message::getContent).toList());
    }

    @Test
    void shouldApologizeWhenNoProviderAnswers() {
        when(providerExecutor.complete(any(), any())).thenThrow(new ProviderUnavailableException(
                List.of(new ProviderAttempt("openai", false, "provider.rate_limit", "429", 5))));

        TurnReply reply = orchestrator.process(message(GUEST, "hi"));

        assertEquals(TurnOrchestrator.PROVIDER_APOLOGY, reply.getText());
        Trace trace = traceRecorder.get(reply.getTraceId());
        assertEquals(TraceStatus.FAILED, trace.getStatus());
        assertEquals("provider_unavailable", trace.getMetadata().get("reason"));
        assertTrue(turnHistory.recent(GUEST).isEmpty());
    }

    @Test
    void shouldReturnGenericErrorOnUnexpectedFailure() {
        when(providerExecutor.complete(any(), any())).thenThrow(new IllegalStateException("bug"));

        TurnReply reply = orchestrator.process(message(GUEST, "hi"));

        assertEquals(TurnOrchestrator.GENERIC_ERROR, reply.getText());
        assertEquals("internal_error", traceRecorder.get(reply.getTraceId()).getMetadata().get("reason"));
    }

    @Test
    void shouldApologizeWhenNoAgentAccepts() {
        TurnReply reply = orchestrator.process(message(GUEST, "   "));

        assertEquals(AgentRouter.NO_AGENT_REPLY, reply.getText());
        assertEquals(TraceStatus.FAILED, traceRecorder.get(reply.getTraceId()).getStatus());
        verify(providerExecutor, never()).complete(any(), any());
    }

    // ==================== confirmation flow ====================

    @Test
    void shouldExecuteConfirmedToolOnYes() {
        TurnReply prompt = requestDeletion();

        TurnReply reply = orchestrator.process(message(ADMIN, "yes"));

        assertEquals(TurnOrchestrator.CONFIRMATION_AGENT, reply.getAgent());
        assertTrue(reply.getText().startsWith("Done."));
        verify(commandPort).execute("/mcp apps delete shop", Map.of("force", false));
        assertEquals(ConfirmationStatus.CONFIRMED,
                confirmationSessions.get(prompt.getConfirmationSessionId()).getStatus());
        assertNull(conversationStates.get(ADMIN));
    }

    @Test
    void shouldCancelOnNo() {
        TurnReply prompt = requestDeletion();

        TurnReply reply = orchestrator.process(message(ADMIN, "no"));

        assertEquals(TurnOrchestrator.CANCELLED_REPLY, reply.getText());
        verify(commandPort, never()).execute(anyString(), anyMap());
        assertEquals(ConfirmationStatus.CANCELLED,
                confirmationSessions.get(prompt.getConfirmationSessionId()).getStatus());
    }

    @Test
    void shouldAskAgainOnUnrecognizedAnswer() {
        TurnReply prompt = requestDeletion();

        TurnReply reply = orchestrator.process(message(ADMIN, "maybe later"));

        assertEquals(TurnOrchestrator.ASK_YES_NO, reply.getText());
        assertEquals(prompt.getConfirmationSessionId(), reply.getConfirmationSessionId());
        assertEquals(StateKind.CONFIRMATION, conversationStates.get(ADMIN).getKind());
        verify(commandPort, never()).execute(anyString(), anyMap());
    }

    @Test
    void shouldReportExpiredConfirmation() {
        TurnReply prompt = requestDeletion();
        clock.advance(Duration.ofMinutes(6));
        conversationStates.setConfirmation(ADMIN, "/mcp delete app shop", DeleteAppTool.NAME, Map.of(),
                prompt.getConfirmationSessionId());

        TurnReply reply = orchestrator.process(message(ADMIN, "yes"));

        assertEquals(TurnOrchestrator.EXPIRED_REPLY, reply.getText());
        verify(commandPort, never()).execute(anyString(), anyMap());
    }

    @Test
    void shouldRouteNormallyOnceConfirmationStateLapses() {
        requestDeletion();
        clock.advance(Duration.ofMinutes(6));
        when(providerExecutor.complete(any(), any())).thenReturn(new NormalizedReply.Text("openai", "Sure."));

        TurnReply reply = orchestrator.process(message(ADMIN, "yes"));

        assertEquals(ConversationalAgent.NAME, reply.getAgent());
        verify(commandPort, never()).execute(anyString(), anyMap());
    }

    private TurnReply requestDeletion() {
        when(providerExecutor.complete(any(), any())).thenReturn(new NormalizedReply.ToolDirective(
                "openai", "", "call-1", DeleteAppTool.NAME, Map.of("app_name", "shop")));
        TurnReply prompt = orchestrator.process(message(ADMIN, "/mcp delete app shop"));
        assertEquals(ToolCallingAgent.NAME, prompt.getAgent());
        assertNotNull(prompt.getConfirmationSessionId());
        assertEquals(StateKind.CONFIRMATION, conversationStates.get(ADMIN).getKind());
        return prompt;
    }

    private static InboundMessage message(String userId, String text) {
        return InboundMessage.builder().userId(userId).chatId(userId).text(text).build();
    }
}
