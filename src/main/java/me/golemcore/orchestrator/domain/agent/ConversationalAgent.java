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
import org.springframework.stereotype.Component;

/**
 * Catch-all agent: answers any non-blank message with plain text. No tools are
 * offered, so it never triggers a tool action.
 */
@Component
@RequiredArgsConstructor
public class ConversationalAgent implements Agent {

    public static final String NAME = "conversational";
    private static final int PRIORITY = 10;

    private final ToolTurnService toolTurnService;

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
        return turn.hasText();
    }

    @Override
    public AgentReply process(TurnContext turn) {
        return toolTurnService.respond(turn, false);
    }
}
