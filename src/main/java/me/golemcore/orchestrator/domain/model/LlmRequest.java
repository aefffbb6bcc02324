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
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Provider-neutral completion request: system prompt, ordered turns and the
 * tool catalog offered to the model (empty for a plain-text turn).
 */
@Data
@Builder
public class LlmRequest {

    private String systemPrompt;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<ToolDefinition> tools = new ArrayList<>();

    /**
     * Content of the most recent user turn, or null when there is none.
     */
    public String lastUserUtterance() {
        int index = lastUserIndex();
        return index < 0 ? null : messages.get(index).getContent();
    }

    /**
     * Single-message rendering for tiers without tool calling: the most recent
     * user turn followed by the tool results recorded after it, or null when
     * there is no user turn.
     */
    public String textOnlyPrompt() {
        int index = lastUserIndex();
        if (index < 0) {
            return null;
        }
        StringBuilder prompt = new StringBuilder(messages.get(index).getContent());
        boolean hasResults = false;
        for (Message message : messages.subList(index + 1, messages.size())) {
            if (Message.ROLE_TOOL.equals(message.getRole()) && message.getContent() != null) {
                prompt.append("\n\nResult of tool '").append(message.getToolName()).append("': ")
                        .append(message.getContent());
                hasResults = true;
            }
        }
        if (hasResults) {
            prompt.append("\n\nAnswer the request above using these tool results.");
        }
        return prompt.toString();
    }

    private int lastUserIndex() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.isUserMessage() && message.getContent() != null && !message.getContent().isBlank()) {
                return i;
            }
        }
        return -1;
    }

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }
}
