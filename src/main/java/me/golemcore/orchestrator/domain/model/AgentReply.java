package me.golemcore.orchestrator.domain.model;

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

import lombok.Builder;
import lombok.Value;

/**
 * Reply produced by an agent for one turn.
 *
 * <p>
 * {@code toolResult} is set when a tool ran during the turn;
 * {@code confirmationSessionId} is set when the turn ended by asking the user
 * to confirm a tool call instead.
 */
@Value
@Builder
public class AgentReply {
    String text;
    String provider;
    String toolName;
    ToolResult toolResult;
    String confirmationSessionId;

    public static AgentReply text(String text) {
        return AgentReply.builder().text(text).build();
    }

    public boolean awaitsConfirmation() {
        return confirmationSessionId != null;
    }
}
