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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.component.ToolComponent;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolMetadata;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.port.outbound.InfrastructureCommandPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Deletes a deployed application. Destructive, so it always requires user
 * confirmation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeleteAppTool implements ToolComponent {

    public static final String NAME = "delete-app";

    private static final String PARAM_APP_NAME = "app_name";
    private static final String PARAM_FORCE = "force";

    private static final ToolMetadata METADATA = ToolMetadata.builder()
            .name(NAME)
            .description("Delete a deployed application and its resources")
            .requiresConfirmation(true)
            .estimatedTime("10-60 seconds")
            .build();

    private final InfrastructureCommandPort commandPort;

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
                                PARAM_APP_NAME, Map.of(
                                        "type", "string",
                                        "description", "Name of the application to delete"),
                                PARAM_FORCE, Map.of(
                                        "type", "boolean",
                                        "description", "Delete even if the application is running")),
                        "required", List.of(PARAM_APP_NAME)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String appName = (String) parameters.get(PARAM_APP_NAME);
        boolean force = Boolean.TRUE.equals(parameters.get(PARAM_FORCE));
        String command = "/mcp apps delete " + appName;
        log.warn("[Tools] Deleting application {} (force: {})", appName, force);

        return commandPort.execute(command, Map.of(PARAM_FORCE, force))
                .thenApply(result -> {
                    if (!result.isSuccess()) {
                        return ToolResult.failure(result.getError() != null
                                ? result.getError()
                                : "Failed to delete application " + appName);
                    }
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put(PARAM_APP_NAME, appName);
                    data.put("deleted", true);
                    data.put("response", result.getResponse());
                    return ToolResult.success(data);
                });
    }
}
