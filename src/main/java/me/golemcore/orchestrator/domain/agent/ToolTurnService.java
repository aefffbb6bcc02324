package me.golemcore.orchestrator.domain.agent;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.component.ToolComponent;
import me.golemcore.orchestrator.domain.model.AgentReply;
import me.golemcore.orchestrator.domain.model.ConfirmationSession;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.NormalizedReply;
import me.golemcore.orchestrator.domain.model.ProviderUnavailableException;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.model.TraceStep;
import me.golemcore.orchestrator.domain.model.TurnContext;
import me.golemcore.orchestrator.domain.service.ConfirmationSessionService;
import me.golemcore.orchestrator.domain.service.ConversationStateService;
import me.golemcore.orchestrator.domain.service.ProviderFallbackExecutor;
import me.golemcore.orchestrator.domain.service.ToolRegistry;
import me.golemcore.orchestrator.domain.service.TraceRecorder;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared turn logic for agents that talk to the provider cascade.
 *
 * <p>
 * Asks the cascade for a reply. A text reply is returned as is. A tool
 * directive either opens a confirmation session (tools that require
 * confirmation) and answers with the confirmation prompt, or runs the tool
 * through the registry and asks the cascade once more, without tools, to
 * phrase the result for the user.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolTurnService {

    static final String PARAM_USER_ID = "user_id";

    private final ProviderFallbackExecutor providerExecutor;
    private final ToolRegistry toolRegistry;
    private final ConfirmationSessionService confirmationSessions;
    private final ConversationStateService conversationStates;
    private final TraceRecorder traceRecorder;
    private final OrchestratorProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Run one provider turn.
     *
     * @param offerTools
     *            whether the enabled tool catalog is offered to the providers
     * @throws ProviderUnavailableException
     *             when no tier could answer the initial request
     */
    public AgentReply respond(TurnContext turn, boolean offerTools) {
        List<ToolDefinition> tools = offerTools ? toolRegistry.definitions() : List.of();
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(properties.getProviders().getSystemPrompt())
                .messages(buildMessages(turn))
                .tools(new ArrayList<>(tools))
                .build();

        NormalizedReply reply = providerExecutor.complete(request, turn.getTraceId());
        if (reply instanceof NormalizedReply.ToolDirective directive) {
            if (!offerTools) {
                log.warn("[Tools] {} returned a tool directive for '{}' without a catalog, ignoring",
                        directive.provider(), directive.toolName());
                return textReply(directive.provider(), directive.text());
            }
            return handleDirective(turn, request, directive);
        }
        return textReply(reply.provider(), reply.text());
    }

    private AgentReply handleDirective(TurnContext turn, LlmRequest request,
            NormalizedReply.ToolDirective directive) {
        String toolName = directive.toolName();
        Map<String, Object> arguments = new LinkedHashMap<>(directive.arguments());
        arguments.putIfAbsent(PARAM_USER_ID, turn.getUserId());

        log.info("[Tools] {} requested tool '{}' for user {}", directive.provider(), toolName, turn.getUserId());

        ToolComponent tool = toolRegistry.get(toolName);
        if (tool != null && toolRegistry.isEnabled(toolName) && tool.getMetadata().isRequiresConfirmation()
                && toolRegistry.validate(toolName, arguments).isEmpty()) {
            return requestConfirmation(turn, directive, arguments);
        }

        long started = clock.millis();
        ToolResult result = toolRegistry.execute(toolName, arguments);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("failure_kind", result.getFailureKind() != null ? result.getFailureKind().name() : null);
        traceRecorder.event(turn.getTraceId(), toolName, TraceStep.TOOL_EXECUTION, details,
                clock.millis() - started, result.isSuccess(), result.getError());

        String text = phraseResult(turn, request, directive, arguments, result);
        return AgentReply.builder()
                .text(text)
                .provider(directive.provider())
                .toolName(toolName)
                .toolResult(result)
                .build();
    }

    private AgentReply requestConfirmation(TurnContext turn, NormalizedReply.ToolDirective directive,
            Map<String, Object> arguments) {
        String toolName = directive.toolName();
        String sessionId = confirmationSessions.open(turn.getUserId(), toolName, arguments, null, null);
        conversationStates.setConfirmation(turn.getUserId(), turn.getText(), toolName, arguments, sessionId);

        ConfirmationSession session = confirmationSessions.get(sessionId);
        traceRecorder.success(turn.getTraceId(), toolName, TraceStep.CONFIRMATION_REQUEST,
                Map.of("session_id", sessionId), null);

        return AgentReply.builder()
                .text(session != null ? session.getPrompt() : "Confirm running " + toolName + "? (yes/no)")
                .provider(directive.provider())
                .toolName(toolName)
                .confirmationSessionId(sessionId)
                .build();
    }

    private String phraseResult(TurnContext turn, LlmRequest request, NormalizedReply.ToolDirective directive,
            Map<String, Object> arguments, ToolResult result) {
        List<Message> messages = new ArrayList<>(request.getMessages());
        messages.add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(directive.text())
                .toolCalls(List.of(Message.ToolCall.builder()
                        .id(directive.callId())
                        .name(directive.toolName())
                        .arguments(arguments)
                        .build()))
                .build());
        messages.add(Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId(directive.callId())
                .toolName(directive.toolName())
                .content(toJson(result))
                .build());

        LlmRequest followUp = LlmRequest.builder()
                .systemPrompt(request.getSystemPrompt())
                .messages(messages)
                .build();
        try {
            NormalizedReply reply = providerExecutor.complete(followUp, turn.getTraceId());
            String text = reply.text();
            return text != null && !text.isBlank() ? text : describe(result);
        } catch (ProviderUnavailableException e) {
            log.warn("[Tools] Could not phrase '{}' result: {}", directive.toolName(), e.getMessage());
            return describe(result);
        }
    }

    /**
     * Plain rendering of a tool result, used when no provider can phrase it.
     */
    public static String describe(ToolResult result) {
        if (!result.isSuccess()) {
            return "The operation failed: " + result.getError();
        }
        if (result.getData() == null || result.getData().isEmpty()) {
            return "Done.";
        }
        StringBuilder sb = new StringBuilder("Done.");
        result.getData().forEach((key, value) -> sb.append('\n').append(key).append(": ").append(value));
        return sb.toString();
    }

    private List<Message> buildMessages(TurnContext turn) {
        List<Message> messages = new ArrayList<>(turn.getHistory());
        messages.add(Message.user(turn.getText()));
        return messages;
    }

    private String toJson(ToolResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", result.isSuccess());
        payload.put("data", result.getData());
        payload.put("error", result.getError());
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("[Tools] Failed to serialize tool result: {}", e.getMessage());
            return result.isSuccess() ? "{\"success\":true}" : "{\"success\":false}";
        }
    }

    private AgentReply textReply(String provider, String text) {
        return AgentReply.builder().text(text).provider(provider).build();
    }
}
