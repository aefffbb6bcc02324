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

package me.golemcore.orchestrator.tools;

import me.golemcore.orchestrator.domain.component.ToolComponent;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolMetadata;
import me.golemcore.orchestrator.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Diagnostic tool that echoes a message back, optionally upper-cased.
 *
 * <p>
 * Useful for checking the provider tool-calling path without touching any
 * external system. Always enabled unless disabled by configuration.
 */
@Component
public class EchoTool implements ToolComponent {

    public static final String NAME = "echo";

    private static final ToolMetadata METADATA = ToolMetadata.builder()
            .name(NAME)
            .description("Echo a message back to the user. Useful for testing.")
            .build();

    @Override
    public ToolMetadata getMetadata() {
        return METADATA;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description(METADATA.getDescription())
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "message", Map.of(
                                        "type", "string",
                                        "description", "Message to echo"),
                                "uppercase", Map.of(
                                        "type", "boolean",
                                        "description", "Return the message in upper case")),
                        "required", List.of("message")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String message = String.valueOf(parameters.get("message"));
        boolean uppercase = Boolean.TRUE.equals(parameters.get("uppercase"));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("echo", uppercase ? message.toUpperCase(Locale.ROOT) : message);
        data.put("original", message);
        data.put("uppercase", uppercase);
        return CompletableFuture.completedFuture(ToolResult.success(data));
    }
}
