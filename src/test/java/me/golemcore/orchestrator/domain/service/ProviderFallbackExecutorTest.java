package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.NormalizedReply;
import me.golemcore.orchestrator.domain.model.ProviderAttempt;
import me.golemcore.orchestrator.domain.model.ProviderUnavailableException;
import me.golemcore.orchestrator.domain.model.TraceEvent;
import me.golemcore.orchestrator.domain.model.TraceStep;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmProviderPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProviderFallbackExecutorTest {

    private static final String USER_ID = "42";
    private static final LlmRequest REQUEST = LlmRequest.builder()
            .systemPrompt("be brief")
            .messages(List.of(Message.user("hi")))
            .build();

    private OrchestratorProperties properties;
    private TraceRecorder traceRecorder;
    private Clock clock;
    private LlmProviderPort openai;
    private LlmProviderPort anthropic;
    private LlmProviderPort fallback;
    private String traceId;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        traceRecorder = new TraceRecorder(properties, clock);
        openai = provider("openai", true);
        anthropic = provider("anthropic", true);
        fallback = provider("fallback", false);
        traceId = traceRecorder.begin(USER_ID, USER_ID);
    }

    @Test
    void shouldReturnFirstTierReply() {
        when(openai.complete(any())).thenReturn(reply("openai", "hello"));

        NormalizedReply reply = executor().complete(REQUEST, traceId);

        assertEquals("openai", reply.provider());
        assertEquals("hello", reply.text());
        verify(anthropic, never()).complete(any());
        assertEquals(1, providerEvents().size());
    }

    @Test
    void shouldFallThroughToNextTierOnRateLimit() {
        when(openai.complete(any())).thenReturn(
                CompletableFuture.failedFuture(new IllegalStateException("rate limit exceeded")));
        when(anthropic.complete(any())).thenReturn(reply("anthropic", "from claude"));

        NormalizedReply reply = executor().complete(REQUEST, traceId);

        assertEquals("anthropic", reply.provider());
        List<TraceEvent> events = providerEvents();
        assertEquals(2, events.size());
        assertEquals("openai", events.get(0).getComponent());
        assertFalse(events.get(0).isSuccess());
        assertEquals(ProviderErrorClassifier.RATE_LIMIT, events.get(0).getDetails().get("error_code"));
        assertEquals("anthropic", events.get(1).getComponent());
        assertTrue(events.get(1).isSuccess());
        assertEquals("text", events.get(1).getDetails().get("reply"));
    }

    @Test
    void shouldTreatSynchronousThrowAsTierFailure() {
        when(openai.complete(any())).thenThrow(new IllegalStateException("boom"));
        when(anthropic.complete(any())).thenReturn(reply("anthropic", "ok"));

        assertEquals("anthropic", executor().complete(REQUEST, traceId).provider());
    }

    @Test
    void shouldSkipUnavailableTierWithoutCallingIt() {
        when(openai.isAvailable()).thenReturn(false);
        when(anthropic.complete(any())).thenReturn(reply("anthropic", "ok"));

        executor().complete(REQUEST, traceId);

        verify(openai, never()).complete(any());
        TraceEvent skipped = providerEvents().get(0);
        assertEquals(ProviderErrorClassifier.UNAVAILABLE, skipped.getDetails().get("error_code"));
        assertEquals("not configured", skipped.getError());
    }

    @Test
    void shouldRecordToolDirectiveInTrace() {
        when(openai.complete(any())).thenReturn(CompletableFuture.completedFuture(
                new NormalizedReply.ToolDirective("openai", "", "call-1", "mcp", Map.of("command", "list apps"))));

        NormalizedReply reply = executor().complete(REQUEST, traceId);

        assertInstanceOf(NormalizedReply.ToolDirective.class, reply);
        TraceEvent event = providerEvents().get(0);
        assertEquals("tool_directive", event.getDetails().get("reply"));
        assertEquals("mcp", event.getDetails().get("tool"));
    }

    @Test
    void shouldClassifyTimeout() {
        properties.getProviders().setTimeoutMs(50);
        when(openai.complete(any())).thenReturn(new CompletableFuture<>());
        when(anthropic.complete(any())).thenReturn(reply("anthropic", "ok"));

        executor().complete(REQUEST, traceId);

        assertEquals(ProviderErrorClassifier.TIMEOUT, providerEvents().get(0).getDetails().get("error_code"));
    }

    @Test
    void shouldThrowWithAllAttemptsWhenEveryTierFails() {
        when(openai.complete(any())).thenReturn(CompletableFuture.failedFuture(new RuntimeException("down")));
        when(anthropic.complete(any())).thenReturn(CompletableFuture.completedFuture(null));

        ProviderUnavailableException error = assertThrows(ProviderUnavailableException.class,
                () -> executor().complete(REQUEST, traceId));

        List<ProviderAttempt> attempts = error.getAttempts();
        assertEquals(List.of("openai", "anthropic", "fallback"),
                attempts.stream().map(ProviderAttempt::provider).toList());
        assertTrue(attempts.stream().noneMatch(ProviderAttempt::success));
        assertEquals(ProviderErrorClassifier.UNAVAILABLE, attempts.get(2).errorCode());
        assertEquals(3, providerEvents().size());
    }

    @Test
    void shouldHonourConfiguredOrderAndRecordUnknownIds() {
        properties.getProviders().setOrder(List.of("anthropic", "mystery", "anthropic", "openai"));
        when(anthropic.complete(any())).thenReturn(CompletableFuture.failedFuture(new RuntimeException("x")));
        when(openai.complete(any())).thenReturn(reply("openai", "ok"));

        executor().complete(REQUEST, traceId);

        assertEquals(List.of("anthropic", "mystery", "openai"),
                providerEvents().stream().map(TraceEvent::getComponent).toList());
    }

    @Test
    void shouldDescribeTiers() {
        properties.getProviders().setOrder(List.of("openai", "anthropic", "fallback", "mystery"));

        List<Map<String, Object>> tiers = executor().describeTiers();

        assertEquals(4, tiers.size());
        assertEquals(1, tiers.get(0).get("position"));
        assertEquals(true, tiers.get(0).get("toolCalling"));
        assertEquals(false, tiers.get(2).get("available"));
        assertEquals(false, tiers.get(3).get("registered"));
    }

    private ProviderFallbackExecutor executor() {
        return new ProviderFallbackExecutor(List.of(openai, anthropic, fallback), properties, traceRecorder, clock);
    }

    private List<TraceEvent> providerEvents() {
        return traceRecorder.get(traceId).getEvents().stream()
                .filter(event -> event.getStep() == TraceStep.PROVIDER_CALL)
                .toList();
    }

    private static LlmProviderPort provider(String id, boolean available) {
        LlmProviderPort provider = mock(LlmProviderPort.class);
        when(provider.getProviderId()).thenReturn(id);
        when(provider.isAvailable()).thenReturn(available);
        when(provider.supportsTools()).thenReturn(!"fallback".equals(id));
        return provider;
    }

    private static CompletableFuture<NormalizedReply> reply(String provider, String text) {
        return CompletableFuture.completedFuture(new NormalizedReply.Text(provider, text));
    }
}
