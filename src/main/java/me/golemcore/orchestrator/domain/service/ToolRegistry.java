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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.component.ToolComponent;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolFailureKind;
import me.golemcore.orchestrator.domain.model.ToolMetadata;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Name-indexed catalog of tools with runtime enable/disable flags and a
 * uniform dispatch contract.
 *
 * <p>
 * {@link #execute(String, Map)} never throws for tool-level problems: unknown
 * tools, disabled tools, invalid parameters, tool exceptions and timeouts all
 * come back as failure {@link ToolResult}s. Every result of a known tool is
 * stamped with the tool name and version.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final Map<String, RegisteredTool> tools = new ConcurrentHashMap<>();
    private final Duration executionTimeout;

    public ToolRegistry(List<ToolComponent> toolComponents, OrchestratorProperties properties) {
        OrchestratorProperties.ToolsProperties toolsProperties = properties.getTools();
        this.executionTimeout = toolsProperties.getExecutionTimeout();
        for (ToolComponent tool : toolComponents) {
            register(tool);
        }
        for (String disabled : toolsProperties.getDisabled()) {
            if (!disable(disabled)) {
                log.warn("[Tools] Cannot disable unknown tool from configuration: {}", disabled);
            }
        }
        log.info("[Tools] Registry initialized with {} tools: {}", tools.size(), tools.keySet());
    }

    // ==================== catalog ====================

    public void register(ToolComponent tool) {
        String name = tool.getToolName();
        RegisteredTool previous = tools.put(name, new RegisteredTool(tool, new AtomicBoolean(true)));
        if (previous != null) {
            log.warn("[Tools] Tool {} was already registered, replacing it", name);
        } else {
            log.debug("[Tools] Registered tool: {}", name);
        }
    }

    public boolean unregister(String name) {
        boolean removed = tools.remove(name) != null;
        if (removed) {
            log.info("[Tools] Unregistered tool: {}", name);
        }
        return removed;
    }

    public ToolComponent get(String name) {
        RegisteredTool entry = name != null ? tools.get(name) : null;
        return entry != null ? entry.component() : null;
    }

    public boolean isEnabled(String name) {
        RegisteredTool entry = name != null ? tools.get(name) : null;
        return entry != null && entry.enabled().get();
    }

    public boolean enable(String name) {
        return toggle(name, true);
    }

    public boolean disable(String name) {
        return toggle(name, false);
    }

    public List<ToolComponent> tools(boolean onlyEnabled) {
        return tools.values().stream()
                .filter(entry -> !onlyEnabled || entry.enabled().get())
                .map(RegisteredTool::component)
                .sorted((a, b) -> a.getToolName().compareTo(b.getToolName()))
                .toList();
    }

    /**
     * Provider-facing catalog of the currently enabled tools.
     */
    public List<ToolDefinition> definitions() {
        return tools(true).stream()
                .map(ToolComponent::getDefinition)
                .toList();
    }

    public Map<String, Object> info() {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (ToolComponent tool : tools(false)) {
            ToolMetadata metadata = tool.getMetadata();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", metadata.getName());
            entry.put("description", metadata.getDescription());
            entry.put("version", metadata.getVersion());
            entry.put("enabled", isEnabled(metadata.getName()));
            entry.put("requiresConfirmation", metadata.isRequiresConfirmation());
            entries.add(entry);
        }
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("totalTools", entries.size());
        info.put("enabledTools", tools(true).size());
        info.put("tools", entries);
        return info;
    }

    // ==================== dispatch ====================

    public ToolResult execute(String name, Map<String, Object> parameters) {
        RegisteredTool entry = name != null ? tools.get(name) : null;
        if (entry == null) {
            log.warn("[Tools] Unknown tool requested: {}", name);
            ToolResult notFound = ToolResult.failure(ToolFailureKind.NOT_FOUND,
                    "Unknown tool: " + name + ". Available tools: " + String.join(", ", tools.keySet()));
            notFound.getMetadata().put(ToolResult.META_TOOL_NAME, name);
            return notFound;
        }

        ToolComponent tool = entry.component();
        Map<String, Object> params = parameters != null ? parameters : Map.of();
        ToolResult result;
        if (!entry.enabled().get()) {
            log.info("[Tools] Tool {} is disabled, skipping execution", name);
            result = ToolResult.failure(ToolFailureKind.DISABLED, "Tool is disabled: " + name);
        } else {
            Optional<String> invalid = validate(tool, params);
            if (invalid.isPresent()) {
                log.info("[Tools] Invalid parameters for {}: {}", name, invalid.get());
                result = ToolResult.failure(ToolFailureKind.INVALID_PARAMETERS, invalid.get());
            } else {
                result = invoke(tool, params);
            }
        }
        return stamp(result, tool.getMetadata());
    }

    /**
     * Check parameters against a registered tool without running it.
     *
     * @return the validation error, or empty when the parameters are acceptable
     */
    public Optional<String> validate(String name, Map<String, Object> parameters) {
        RegisteredTool entry = name != null ? tools.get(name) : null;
        if (entry == null) {
            return Optional.of("Unknown tool: " + name);
        }
        return validate(entry.component(), parameters != null ? parameters : Map.of());
    }

    private Optional<String> validate(ToolComponent tool, Map<String, Object> params) {
        try {
            return tool.validate(params);
        } catch (RuntimeException e) { // NOSONAR - a broken validator is reported as invalid input
            return Optional.of("Parameter validation failed: " + safeCauseMessage(e));
        }
    }

    private ToolResult invoke(ToolComponent tool, Map<String, Object> params) {
        String name = tool.getToolName();
        CompletableFuture<ToolResult> future = null;
        try {
            future = tool.execute(params);
            if (future == null) {
                return ToolResult.failure("Tool returned no result: " + name);
            }
            ToolResult result = future.get(executionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolResult.failure("Tool returned no result: " + name);
            }
            if (!result.isSuccess() && result.getFailureKind() == null) {
                result.setFailureKind(ToolFailureKind.EXECUTION_FAILED);
            }
            log.debug("[Tools] Tool {} finished (success: {})", name, result.isSuccess());
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] Tool {} timed out after {}s", name, executionTimeout.toSeconds());
            return ToolResult.failure("Tool execution timed out after " + executionTimeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Tool execution interrupted");
        } catch (ExecutionException | RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", name, e);
            return ToolResult.failure("Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private ToolResult stamp(ToolResult result, ToolMetadata metadata) {
        Map<String, Object> stamped = new LinkedHashMap<>();
        if (result.getMetadata() != null) {
            stamped.putAll(result.getMetadata());
        }
        stamped.put(ToolResult.META_TOOL_NAME, metadata.getName());
        stamped.put(ToolResult.META_TOOL_VERSION, metadata.getVersion());
        result.setMetadata(stamped);
        return result;
    }

    private boolean toggle(String name, boolean enabled) {
        RegisteredTool entry = name != null ? tools.get(name) : null;
        if (entry == null) {
            return false;
        }
        boolean previous = entry.enabled().getAndSet(enabled);
        if (previous != enabled) {
            log.info("[Tools] Tool {} {}", name, enabled ? "enabled" : "disabled");
        }
        return true;
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private record RegisteredTool(ToolComponent component, AtomicBoolean enabled) {
    }
}
