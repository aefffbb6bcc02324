package me.golemcore.orchestrator.domain.loop;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.agent.AgentRouter;
import me.golemcore.orchestrator.domain.agent.ToolTurnService;
import me.golemcore.orchestrator.domain.model.ConfirmationResolution;
import me.golemcore.orchestrator.domain.model.ConversationState;
import me.golemcore.orchestrator.domain.model.InboundMessage;
import me.golemcore.orchestrator.domain.model.ProviderUnavailableException;
import me.golemcore.orchestrator.domain.model.RoutedReply;
import me.golemcore.orchestrator.domain.model.StateKind;
import me.golemcore.orchestrator.domain.model.TraceStatus;
import me.golemcore.orchestrator.domain.model.TraceStep;
import me.golemcore.orchestrator.domain.model.TurnContext;
import me.golemcore.orchestrator.domain.model.TurnReply;
import me.golemcore.orchestrator.domain.service.ConfirmationSessionService;
import me.golemcore.orchestrator.domain.service.ConversationStateService;
import me.golemcore.orchestrator.domain.service.TraceRecorder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs one conversational turn end to end.
 *
 * <p>
 * Flow:
 * <ol>
 * <li>begin a trace for the message</li>
 * <li>if the user has a live confirmation state, interpret the text as a
 * yes/no answer and resolve the pending session</li>
 * <li>otherwise route the message through the {@link AgentRouter}</li>
 * <li>append the exchange to the user's turn history and end the trace</li>
 * </ol>
 *
 * <p>
 * A {@link ProviderUnavailableException} ends the turn with a fixed apology;
 * any other failure ends it with a generic error reply. The trace is always
 * ended.
 */
@Service
@Slf4j
public class TurnOrchestrator {

    public static final String COMPONENT = "orchestrator";
    public static final String CONFIRMATION_AGENT = "confirmation";

    static final String PROVIDER_APOLOGY = "Sorry, I can't reach any language model right now. "
            + "Please try again in a few minutes.";
    static final String GENERIC_ERROR = "Something went wrong while processing your message.";
    static final String ASK_YES_NO = "Please answer yes or no.";
    static final String CANCELLED_REPLY = "Cancelled. Nothing was executed.";
    static final String EXPIRED_REPLY = "This confirmation has expired. Please send the request again.";
    static final String INACTIVE_REPLY = "This confirmation is no longer active.";

    private final AgentRouter agentRouter;
    private final ConfirmationSessionService confirmationSessions;
    private final ConversationStateService conversationStates;
    private final TraceRecorder traceRecorder;
    private final TurnHistoryStore turnHistory;
    private final Clock clock;

    public TurnOrchestrator(AgentRouter agentRouter, ConfirmationSessionService confirmationSessions,
            ConversationStateService conversationStates, TraceRecorder traceRecorder,
            TurnHistoryStore turnHistory, Clock clock) {
        this.agentRouter = agentRouter;
        this.confirmationSessions = confirmationSessions;
        this.conversationStates = conversationStates;
        this.traceRecorder = traceRecorder;
        this.turnHistory = turnHistory;
        this.clock = clock;
    }

    public CompletableFuture<TurnReply> handle(InboundMessage message) {
        return CompletableFuture.supplyAsync(() -> process(message));
    }

    public TurnReply process(InboundMessage message) {
        long started = clock.millis();
        String userId = message.getUserId();
        String traceId = traceRecorder.begin(userId, message.getChatId());
        log.info("[Turn] Message from user {} (trace {})", userId, traceId);
        traceRecorder.success(traceId, COMPONENT, TraceStep.MESSAGE_RECEIVED,
                Map.of("length", message.getText() != null ? message.getText().length() : 0), null);

        try {
            ConversationState state = conversationStates.get(userId);
            traceRecorder.success(traceId, COMPONENT, TraceStep.CONFIRMATION_CHECK,
                    Map.of("state", state != null ? state.getKind().getValue() : "none"), null);

            TurnReply reply;
            if (state != null && state.getKind() == StateKind.CONFIRMATION) {
                reply = answerConfirmation(message, state, traceId);
            } else {
                reply = route(message, traceId);
                if (reply == null) {
                    return TurnReply.builder()
                            .agent(RoutedReply.NO_HANDLER)
                            .text(AgentRouter.NO_AGENT_REPLY)
                            .traceId(traceId)
                            .build();
                }
            }

            turnHistory.append(userId, message.getText(), reply.getText());
            traceRecorder.success(traceId, COMPONENT, TraceStep.RESPONSE_SENT,
                    Map.of("agent", reply.getAgent()), clock.millis() - started);
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("agent", reply.getAgent());
            summary.put("confirmation_session_id", reply.getConfirmationSessionId());
            traceRecorder.end(traceId, TraceStatus.COMPLETED, summary);
            return reply;
        } catch (ProviderUnavailableException e) {
            log.error("[Turn] No provider could answer user {}: {}", userId, e.getMessage());
            traceRecorder.failure(traceId, COMPONENT, TraceStep.ERROR_HANDLING, e.getMessage(),
                    clock.millis() - started);
            traceRecorder.end(traceId, TraceStatus.FAILED, Map.of("reason", "provider_unavailable"));
            return TurnReply.builder()
                    .agent(RoutedReply.NO_HANDLER)
                    .text(PROVIDER_APOLOGY)
                    .traceId(traceId)
                    .build();
        } catch (RuntimeException e) { // NOSONAR - the transport always gets a reply
            log.error("[Turn] Failed to process message from user {}", userId, e);
            traceRecorder.failure(traceId, COMPONENT, TraceStep.ERROR_HANDLING, e.getMessage(),
                    clock.millis() - started);
            traceRecorder.end(traceId, TraceStatus.FAILED, Map.of("reason", "internal_error"));
            return TurnReply.builder()
                    .agent(RoutedReply.NO_HANDLER)
                    .text(GENERIC_ERROR)
                    .traceId(traceId)
                    .build();
        }
    }

    /**
     * Route through the agent chain. Returns null when no agent accepted; the
     * router has already ended the trace in that case.
     */
    private TurnReply route(InboundMessage message, String traceId) {
        TurnContext turn = TurnContext.builder()
                .traceId(traceId)
                .userId(message.getUserId())
                .chatId(message.getChatId())
                .text(message.getText())
                .history(turnHistory.recent(message.getUserId()))
                .build();

        RoutedReply routed = agentRouter.route(turn);
        if (!routed.handled()) {
            return null;
        }
        return TurnReply.builder()
                .agent(routed.handlerName())
                .text(routed.reply().getText())
                .traceId(traceId)
                .confirmationSessionId(routed.reply().getConfirmationSessionId())
                .build();
    }

    private TurnReply answerConfirmation(InboundMessage message, ConversationState state, String traceId) {
        String userId = message.getUserId();
        Object sessionRef = state.getParameters().get(ConversationStateService.CONFIRMATION_SESSION_ID);
        String sessionId = sessionRef != null ? sessionRef.toString() : null;

        ConfirmationAnswer answer = ConfirmationAnswer.parse(message.getText());
        if (answer == ConfirmationAnswer.UNRECOGNIZED) {
            log.debug("[Turn] Unrecognized confirmation answer from user {}", userId);
            return TurnReply.builder()
                    .agent(CONFIRMATION_AGENT)
                    .text(ASK_YES_NO)
                    .traceId(traceId)
                    .confirmationSessionId(sessionId)
                    .build();
        }

        conversationStates.clear(userId);
        if (sessionId == null) {
            log.warn("[Turn] Confirmation state of user {} has no session id", userId);
            return confirmationReply(INACTIVE_REPLY, traceId);
        }

        long started = clock.millis();
        ConfirmationResolution resolution = confirmationSessions.resolveDetailed(sessionId,
                answer == ConfirmationAnswer.YES, userId);
        traceRecorder.success(traceId, CONFIRMATION_AGENT, TraceStep.CONFIRMATION_CHECK,
                Map.of("session_id", sessionId, "outcome", resolution.outcome().name()),
                clock.millis() - started);

        String text = switch (resolution.outcome()) {
        case EXECUTED -> {
            traceRecorder.event(traceId, state.getToolToExecute(), TraceStep.TOOL_EXECUTION, null, null,
                    resolution.result().isSuccess(), resolution.result().getError());
            yield ToolTurnService.describe(resolution.result());
        }
        case CANCELLED -> CANCELLED_REPLY;
        case EXPIRED -> EXPIRED_REPLY;
        default -> INACTIVE_REPLY;
        };
        return confirmationReply(text, traceId);
    }

    private TurnReply confirmationReply(String text, String traceId) {
        return TurnReply.builder()
                .agent(CONFIRMATION_AGENT)
                .text(text)
                .traceId(traceId)
                .build();
    }
}
