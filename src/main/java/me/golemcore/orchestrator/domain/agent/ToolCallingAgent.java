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

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.domain.model.AgentReply;
import me.golemcore.orchestrator.domain.model.TurnContext;
import me.golemcore.orchestrator.domain.service.ToolRegistry;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handles admin commands ({@code /mcp}, {@code /db}, {@code /docs} by default)
 * with the enabled tool catalog offered to the providers.
 */
@Component
@RequiredArgsConstructor
public class ToolCallingAgent implements Agent {

    public static final String NAME = "tool-calling";
    private static final int PRIORITY = 90;

    private final ToolTurnService toolTurnService;
    private final ToolRegistry toolRegistry;
    private final OrchestratorProperties properties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(TurnContext turn) {
        if (!turn.hasText() || !isAdmin(turn.getUserId())) {
            return false;
        }
        String text = turn.getText().trim();
        return properties.getAgents().getCommandPrefixes().stream().anyMatch(text::startsWith);
    }

    @Override
    public AgentReply process(TurnContext turn) {
        return toolTurnService.respond(turn, true);
    }

    @Override
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("admins", properties.getAgents().getAdminUsers().size());
        status.put("commandPrefixes", properties.getAgents().getCommandPrefixes());
        status.put("tools", toolRegistry.definitions().size());
        return status;
    }

    private boolean isAdmin(String userId) {
        return userId != null && properties.getAgents().getAdminUsers().contains(userId);
    }
}
