package me.golemcore.orchestrator.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.NormalizedReply;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Langchain4jMessageMapperTest {

    private final Langchain4jMessageMapper mapper = new Langchain4jMessageMapper(new ObjectMapper());

    @Test
    void shouldConvertConversationWithToolRoundTrip() {
        LlmRequest request = LlmRequest.builder()
                .systemPrompt("be brief")
                .messages(List.of(
                        Message.user("list apps"),
                        Message.builder()
                                .role(Message.ROLE_ASSISTANT)
                                .toolCalls(List.of(Message.ToolCall.builder()
                                        .id("call-1")
                                        .name("mcp")
                                        .arguments(Map.of("command", "list apps"))
                                        .build()))
                                .build(),
                        Message.builder()
                                .role(Message.ROLE_TOOL)
                                .toolCallId("call-1")
                                .toolName("mcp")
                                .content("{\"success\":true}")
                                .build()))
                .build();

        List<ChatMessage> messages = mapper.toChatMessages(request);

        assertEquals(4, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertEquals("list apps", ((UserMessage) messages.get(1)).singleText());
        AiMessage toolCall = (AiMessage) messages.get(2);
        assertTrue(toolCall.hasToolExecutionRequests());
        assertEquals("{\"command\":\"list apps\"}", toolCall.toolExecutionRequests().get(0).arguments());
        ToolExecutionResultMessage result = (ToolExecutionResultMessage) messages.get(3);
        assertEquals("call-1", result.id());
        assertEquals("{\"success\":true}", result.text());
    }

    @Test
    void shouldBuildToolSpecificationsFromSchema() {
        ToolDefinition definition = ToolDefinition.builder()
                .name("deploy")
                .description("Deploy an app")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "env", Map.of("type", "string", "enum", List.of("staging", "prod")),
                                "force", Map.of("type", "boolean")),
                        "required", List.of("env")))
                .build();

        List<ToolSpecification> specs = mapper.toToolSpecifications(LlmRequest.builder()
                .tools(List.of(definition))
                .build());

        assertEquals(1, specs.size());
        ToolSpecification spec = specs.get(0);
        assertEquals("deploy", spec.name());
        JsonObjectSchema parameters = spec.parameters();
        assertInstanceOf(JsonEnumSchema.class, parameters.properties().get("env"));
        assertInstanceOf(JsonBooleanSchema.class, parameters.properties().get("force"));
        assertEquals(List.of("env"), parameters.required());
    }

    @Test
    void shouldReturnNoSpecificationsWithoutTools() {
        assertTrue(mapper.toToolSpecifications(LlmRequest.builder().build()).isEmpty());
    }

    @Test
    void shouldNormalizeTextReply() {
        ChatResponse response = ChatResponse.builder().aiMessage(AiMessage.from("Hello")).build();

        NormalizedReply reply = mapper.normalize("openai", response);

        assertEquals(new NormalizedReply.Text("openai", "Hello"), reply);
    }

    @Test
    void shouldNormalizeFirstToolCallAsDirective() {
        AiMessage message = AiMessage.from(List.of(
                ToolExecutionRequest.builder().id("a").name("mcp").arguments("{\"command\":\"list apps\"}").build(),
                ToolExecutionRequest.builder().id("b").name("echo").arguments("{}").build()));
        ChatResponse response = ChatResponse.builder().aiMessage(message).build();

        NormalizedReply reply = mapper.normalize("anthropic", response);

        NormalizedReply.ToolDirective directive = assertInstanceOf(NormalizedReply.ToolDirective.class, reply);
        assertEquals("anthropic", directive.provider());
        assertEquals("a", directive.callId());
        assertEquals("mcp", directive.toolName());
        assertEquals(Map.of("command", "list apps"), directive.arguments());
        assertEquals("", directive.text());
    }

    @Test
    void shouldTolerateMalformedToolArguments() {
        AiMessage message = AiMessage.from(List.of(
                ToolExecutionRequest.builder().id("a").name("mcp").arguments("{not json").build()));

        NormalizedReply reply = mapper.normalize("openai", ChatResponse.builder().aiMessage(message).build());

        assertTrue(((NormalizedReply.ToolDirective) reply).arguments().isEmpty());
    }
}
