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

import me.golemcore.orchestrator.domain.model.AgentReply;
import me.golemcore.orchestrator.domain.model.TurnContext;

import java.util.Map;

/**
 * A candidate handler in the routing chain. The router asks agents in
 * descending priority order whether they accept a message and delegates to
 * the first that does.
 */
public interface Agent {

    /**
     * Get the agent name, reported as the handler of routed replies.
     */
    String getName();

    /**
     * Get the routing priority, 0-100 (higher = asked earlier).
     */
    int getPriority();

    /**
     * Check whether this agent accepts the message. Must not change any state.
     */
    boolean canHandle(TurnContext turn);

    /**
     * Handle an accepted message.
     */
    AgentReply process(TurnContext turn);

    default Map<String, Object> status() {
        return Map.of("name", getName(), "priority", getPriority());
    }
}
