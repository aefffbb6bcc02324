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
import me.golemcore.orchestrator.domain.model.InfrastructureCommandResult;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolMetadata;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.port.outbound.InfrastructureCommandPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs infrastructure-management commands (applications, databases,
 * deployments) through the {@link InfrastructureCommandPort}.
 *
 * <p>
 * Natural phrasings such as "list apps" or "show databases" are mapped to
 * gateway commands; anything not starting with {@code /} gets the {@code /mcp}
 * prefix. Every call requires user confirmation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class McpCommandTool implements ToolComponent {

    public static final String NAME = "mcp";

    private static final String PARAM_COMMAND = "command";
    private static final String PARAM_FILTERS = "filters";
    private static final String LIST_APPS = "/mcp apps";
    private static final String LIST_DATABASES = "/db SELECT datname FROM pg_database";

    private static final Map<String, String> COMMAND_MAPPINGS = orderedMappings();

    private static final ToolMetadata METADATA = ToolMetadata.builder()
            .name(NAME)
            .description("Execute infrastructure management commands (applications, databases, deployments)")
            .requiresConfirmation(true)
            .estimatedTime("5-30 seconds")
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
                                PARAM_COMMAND, Map.of(
                                        "type", "string",
                                        "description",
                                        "Command, e.g. 'list apps', 'show databases', 'get deployments'"),
                                PARAM_FILTERS, Map.of(
                                        "type", "object",
                                        "description", "Additional command filters")),
                        "required", List.of(PARAM_COMMAND)))
                .build();
    }

    @Override
    @SuppressWarnings("unchecked")
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String command = (String) parameters.get(PARAM_COMMAND);
        Map<String, Object> filters = parameters.get(PARAM_FILTERS) instanceof Map
                ? (Map<String, Object>) parameters.get(PARAM_FILTERS)
                : Map.of();
        String formatted = formatCommand(command);
        String commandType = commandType(command);
        log.info("[Tools] Executing infrastructure command: {}", formatted);

        return commandPort.execute(formatted, filters)
                .thenApply(result -> toToolResult(formatted, commandType, result));
    }

    @Override
    public String confirmationMessage(Map<String, Object> parameters) {
        String command = String.valueOf(parameters.get(PARAM_COMMAND));
        String commandType = commandType(command);
        List<String> details = switch (commandType) {
        case "applications" -> List.of("List applications", "Deployment status", "Service configuration");
        case "databases" -> List.of("List databases", "Usage statistics", "Access information");
        case "deployments" -> List.of("Deployment history", "Rollout status", "Release configuration");
        default -> List.of("Run infrastructure command");
        };

        StringBuilder sb = new StringBuilder();
        sb.append("Infrastructure command confirmation\n\n");
        sb.append("Command: ").append(command).append('\n');
        sb.append("Type: ").append(commandType).append("\n\n");
        sb.append("Will perform:\n");
        details.forEach(detail -> sb.append("- ").append(detail).append('\n'));
        sb.append("\nEstimated time: ").append(METADATA.getEstimatedTime()).append("\n\n");
        sb.append("Proceed? Reply yes or no.");
        return sb.toString();
    }

    static String formatCommand(String command) {
        String lower = command.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> mapping : COMMAND_MAPPINGS.entrySet()) {
            if (lower.contains(mapping.getKey())) {
                return mapping.getValue();
            }
        }
        if (command.startsWith("/")) {
            return command;
        }
        return "/mcp " + command;
    }

    static String commandType(String command) {
        String lower = command.toLowerCase(Locale.ROOT);
        if (lower.contains("app")) {
            return "applications";
        }
        if (lower.contains("database") || lower.contains("db")) {
            return "databases";
        }
        if (lower.contains("deploy")) {
            return "deployments";
        }
        return "general";
    }

    private ToolResult toToolResult(String command, String commandType, InfrastructureCommandResult result) {
        ToolResult toolResult;
        if (result.isSuccess()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put(PARAM_COMMAND, command);
            data.put("response", result.getResponse() != null ? result.getResponse() : "Command executed");
            data.put("mcp_response", result.getPayload());
            toolResult = ToolResult.success(data);
        } else {
            toolResult = ToolResult.failure(result.getError() != null ? result.getError() : "Unknown command error");
        }
        toolResult.getMetadata().put("command_type", commandType);
        toolResult.getMetadata().put("emulated", result.isEmulated());
        if (result.getExecutionTimeMs() != null) {
            toolResult.getMetadata().put("execution_time_ms", result.getExecutionTimeMs());
        }
        return toolResult;
    }

    private static Map<String, String> orderedMappings() {
        Map<String, String> mappings = new LinkedHashMap<>();
        mappings.put("list apps", LIST_APPS);
        mappings.put("show apps", LIST_APPS);
        mappings.put("show databases", LIST_DATABASES);
        mappings.put("list databases", LIST_DATABASES);
        mappings.put("get deployments", LIST_APPS);
        return mappings;
    }
}
