package me.golemcore.orchestrator.domain.service;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.domain.agent.AgentRouter;
import me.golemcore.orchestrator.domain.loop.TurnHistoryStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only snapshot of the orchestrator for operators: registry contents,
 * trace metrics, confirmation and conversation-state statistics, provider
 * tiers and the agent chain.
 */
@Service
@RequiredArgsConstructor
public class OperatorStatusService {

    private final ToolRegistry toolRegistry;
    private final TraceRecorder traceRecorder;
    private final ConfirmationSessionService confirmationSessions;
    private final ConversationStateService conversationStates;
    private final ProviderFallbackExecutor providerExecutor;
    private final AgentRouter agentRouter;
    private final TurnHistoryStore turnHistory;
    private final Clock clock;

    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("timestamp", Instant.now(clock).toString());
        status.put("tools", toolRegistry.info());
        status.put("traces", traceRecorder.metrics());
        status.put("confirmations", confirmationSessions.stats());

        Map<String, Object> conversations = new LinkedHashMap<>(conversationStates.stats());
        conversations.put("usersWithTurnHistory", turnHistory.users());
        status.put("conversations", conversations);

        status.put("providers", providerExecutor.describeTiers());
        status.put("agents", agentRouter.status());
        return status;
    }
}
