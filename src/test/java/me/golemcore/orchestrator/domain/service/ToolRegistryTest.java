package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.component.ToolComponent;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolFailureKind;
import me.golemcore.orchestrator.domain.model.ToolMetadata;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.tools.EchoTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolRegistryTest {

    private static final String MCP = "mcp";
    private static final String VERSION = "2.1.0";

    private ToolComponent mcpTool;
    private OrchestratorProperties properties;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        mcpTool = mockTool(MCP, false);
        properties = new OrchestratorProperties();
        properties.getTools().setExecutionTimeout(Duration.ofMillis(200));
        registry = new ToolRegistry(List.of(new EchoTool(), mcpTool), properties);
    }

    // ==================== catalog ====================

    @Test
    void shouldRegisterInjectedTools() {
        assertSame(mcpTool, registry.get(MCP));
        assertTrue(registry.isEnabled(EchoTool.NAME));
        assertEquals(List.of(EchoTool.NAME, MCP),
                registry.tools(false).stream().map(ToolComponent::getToolName).toList());
    }

    @Test
    void shouldDisableToolsNamedInConfiguration() {
        properties.getTools().setDisabled(List.of(MCP, "unknown"));

        ToolRegistry configured = new ToolRegistry(List.of(new EchoTool(), mcpTool), properties);

        assertFalse(configured.isEnabled(MCP));
        assertTrue(configured.isEnabled(EchoTool.NAME));
    }

    @Test
    void shouldReplaceToolOnReRegistration() {
        ToolComponent replacement = mockTool(MCP, true);

        registry.register(replacement);

        assertSame(replacement, registry.get(MCP));
        assertEquals(2, registry.tools(false).size());
    }

    @Test
    void shouldToggleEnabledFlag() {
        assertTrue(registry.disable(MCP));
        assertFalse(registry.isEnabled(MCP));
        assertEquals(List.of(EchoTool.NAME),
                registry.definitions().stream().map(ToolDefinition::getName).toList());

        assertTrue(registry.enable(MCP));
        assertTrue(registry.isEnabled(MCP));
        assertFalse(registry.disable("missing"));
    }

    @Test
    void shouldUnregisterTool() {
        assertTrue(registry.unregister(MCP));
        assertNull(registry.get(MCP));
        assertFalse(registry.unregister(MCP));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldDescribeRegistryInInfo() {
        registry.disable(MCP);

        Map<String, Object> info = registry.info();

        assertEquals(2, info.get("totalTools"));
        assertEquals(1, info.get("enabledTools"));
        List<Map<String, Object>> tools = (List<Map<String, Object>>) info.get("tools");
        Map<String, Object> mcp = tools.get(1);
        assertEquals(MCP, mcp.get("name"));
        assertEquals(VERSION, mcp.get("version"));
        assertEquals(false, mcp.get("enabled"));
    }

    // ==================== execute ====================

    @Test
    void shouldEchoUppercasedMessage() {
        ToolResult result = registry.execute(EchoTool.NAME, Map.of("message", "Hello", "uppercase", true));

        assertTrue(result.isSuccess());
        assertEquals("HELLO", result.getData().get("echo"));
        assertEquals("Hello", result.getData().get("original"));
        assertEquals(EchoTool.NAME, result.getMetadata().get(ToolResult.META_TOOL_NAME));
        assertEquals("1.0.0", result.getMetadata().get(ToolResult.META_TOOL_VERSION));
    }

    @Test
    void shouldReturnDisabledWithoutInvokingTool() {
        registry.disable(MCP);

        ToolResult result = registry.execute(MCP, Map.of());

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.DISABLED, result.getFailureKind());
        assertEquals("Tool is disabled: mcp", result.getError());
        assertEquals(MCP, result.getMetadata().get(ToolResult.META_TOOL_NAME));
        assertEquals(VERSION, result.getMetadata().get(ToolResult.META_TOOL_VERSION));
        verify(mcpTool, never()).execute(any());
    }

    @Test
    void shouldReturnNotFoundForUnknownTool() {
        ToolResult result = registry.execute("missing", Map.of());

        assertEquals(ToolFailureKind.NOT_FOUND, result.getFailureKind());
        assertTrue(result.getError().startsWith("Unknown tool: missing. Available tools:"));
        assertEquals("missing", result.getMetadata().get(ToolResult.META_TOOL_NAME));
        assertFalse(result.getMetadata().containsKey(ToolResult.META_TOOL_VERSION));
    }

    @Test
    void shouldReturnInvalidParametersNamingField() {
        ToolResult result = registry.execute(EchoTool.NAME, Map.of("uppercase", true));

        assertEquals(ToolFailureKind.INVALID_PARAMETERS, result.getFailureKind());
        assertEquals("Missing required parameter: message", result.getError());
    }

    @Test
    void shouldReportBrokenValidatorAsInvalidParameters() {
        when(mcpTool.validate(any())).thenThrow(new IllegalArgumentException("schema broken"));

        assertEquals(java.util.Optional.of("Parameter validation failed: schema broken"),
                registry.validate(MCP, Map.of("command", "x")));

        ToolResult result = registry.execute(MCP, Map.of("command", "x"));
        assertEquals(ToolFailureKind.INVALID_PARAMETERS, result.getFailureKind());
        verify(mcpTool, never()).execute(any());
    }

    @Test
    void shouldValidateWithoutExecuting() {
        assertTrue(registry.validate(EchoTool.NAME, Map.of("message", "hi")).isEmpty());
        assertEquals("Missing required parameter: message",
                registry.validate(EchoTool.NAME, null).orElseThrow());
        assertEquals("Unknown tool: ghost", registry.validate("ghost", Map.of()).orElseThrow());
    }

    @Test
    void shouldConvertThrownExceptionToFailure() {
        when(mcpTool.execute(any())).thenThrow(new IllegalStateException("gateway down"));

        ToolResult result = registry.execute(MCP, Map.of("command", "list apps"));

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Tool execution failed: gateway down", result.getError());
        assertEquals(MCP, result.getMetadata().get(ToolResult.META_TOOL_NAME));
    }

    @Test
    void shouldConvertFailedFutureToFailure() {
        when(mcpTool.execute(any())).thenReturn(CompletableFuture.failedFuture(new RuntimeException("refused")));

        ToolResult result = registry.execute(MCP, Map.of("command", "list apps"));

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Tool execution failed: refused", result.getError());
    }

    @Test
    void shouldFailWhenToolExceedsTimeout() {
        when(mcpTool.execute(any())).thenReturn(new CompletableFuture<>());

        ToolResult result = registry.execute(MCP, Map.of("command", "list apps"));

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertTrue(result.getError().contains("timed out"));
    }

    @Test
    void shouldDefaultFailureKindOfToolReportedFailure() {
        ToolResult failed = ToolResult.builder().success(false).error("nope").build();
        when(mcpTool.execute(any())).thenReturn(CompletableFuture.completedFuture(failed));

        ToolResult result = registry.execute(MCP, Map.of("command", "x"));

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("nope", result.getError());
    }

    private ToolComponent mockTool(String name, boolean requiresConfirmation) {
        ToolComponent tool = mock(ToolComponent.class);
        ToolMetadata metadata = ToolMetadata.builder()
                .name(name)
                .description("Infrastructure commands")
                .version(VERSION)
                .requiresConfirmation(requiresConfirmation)
                .build();
        when(tool.getMetadata()).thenReturn(metadata);
        when(tool.getToolName()).thenReturn(name);
        when(tool.getDefinition()).thenReturn(ToolDefinition.simple(name, "Infrastructure commands"));
        when(tool.validate(any())).thenReturn(java.util.Optional.empty());
        return tool;
    }
}
