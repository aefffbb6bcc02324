package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.MutableClock;
import me.golemcore.orchestrator.domain.model.Trace;
import me.golemcore.orchestrator.domain.model.TraceEvent;
import me.golemcore.orchestrator.domain.model.TraceMetrics;
import me.golemcore.orchestrator.domain.model.TraceStatus;
import me.golemcore.orchestrator.domain.model.TraceStep;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TraceRecorderTest {

    private static final String USER_ID = "user-1";
    private static final String COMPONENT = "openai";

    private MutableClock clock;
    private OrchestratorProperties properties;
    private TraceRecorder recorder;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T12:00:00Z"));
        properties = new OrchestratorProperties();
        properties.getTrace().setMaxTraces(3);
        properties.getTrace().setTtl(Duration.ofHours(1));
        recorder = new TraceRecorder(properties, clock);
    }

    // ==================== lifecycle ====================

    @Test
    void shouldRecordEventsInOrderAndCompleteTrace() {
        String traceId = recorder.begin(USER_ID, "chat-1");
        recorder.success(traceId, "router", TraceStep.AGENT_ROUTING, Map.of("accepted", true), 3L);
        recorder.failure(traceId, COMPONENT, TraceStep.PROVIDER_CALL, "rate limited", 12L);

        clock.advance(Duration.ofMillis(250));
        recorder.end(traceId, TraceStatus.COMPLETED, Map.of("agent", "conversational"));

        Trace trace = recorder.get(traceId);
        assertNotNull(trace);
        assertEquals(8, traceId.length());
        assertEquals(TraceStatus.COMPLETED, trace.getStatus());
        assertEquals(Duration.ofMillis(250), trace.getDuration());
        assertEquals("conversational", trace.getMetadata().get("agent"));

        List<TraceEvent> events = trace.getEvents();
        assertEquals(2, events.size());
        assertEquals(TraceStep.AGENT_ROUTING, events.get(0).getStep());
        assertTrue(events.get(0).isSuccess());
        assertEquals(TraceStep.PROVIDER_CALL, events.get(1).getStep());
        assertFalse(events.get(1).isSuccess());
        assertEquals("rate limited", events.get(1).getError());
    }

    @Test
    void shouldMoveToInProgressOnFirstEvent() {
        String traceId = recorder.begin(USER_ID, null);
        assertEquals(TraceStatus.STARTED, recorder.get(traceId).getStatus());

        recorder.success(traceId, "orchestrator", TraceStep.MESSAGE_RECEIVED, null, null);

        assertEquals(TraceStatus.IN_PROGRESS, recorder.get(traceId).getStatus());
    }

    @Test
    void shouldIgnoreUnknownTraceIds() {
        assertDoesNotThrow(() -> {
            recorder.event("missing", COMPONENT, TraceStep.PROVIDER_CALL, Map.of(), 1L, true, null);
            recorder.end("missing", TraceStatus.COMPLETED, null);
            recorder.event(null, COMPONENT, TraceStep.PROVIDER_CALL, null, null, true, null);
        });
        assertNull(recorder.get("missing"));
    }

    @Test
    void shouldIgnoreEventsAfterEnd() {
        String traceId = recorder.begin(USER_ID, null);
        recorder.end(traceId, TraceStatus.FAILED, null);

        recorder.success(traceId, COMPONENT, TraceStep.PROVIDER_CALL, null, 5L);

        assertTrue(recorder.get(traceId).getEvents().isEmpty());
        assertEquals(TraceStatus.FAILED, recorder.get(traceId).getStatus());
    }

    @Test
    void shouldDropNullDetailValues() {
        String traceId = recorder.begin(USER_ID, null);
        Map<String, Object> details = new HashMap<>();
        details.put("tool", "echo");
        details.put("error_code", null);

        recorder.success(traceId, "echo", TraceStep.TOOL_EXECUTION, details, 1L);

        assertEquals(Map.of("tool", "echo"), recorder.get(traceId).getEvents().get(0).getDetails());
    }

    @Test
    void shouldTreatNonTerminalEndStatusAsCompleted() {
        String traceId = recorder.begin(USER_ID, null);

        recorder.end(traceId, TraceStatus.IN_PROGRESS, null);

        assertEquals(TraceStatus.COMPLETED, recorder.get(traceId).getStatus());
    }

    // ==================== timed ====================

    @Test
    void shouldRecordTimedOperationResult() {
        String traceId = recorder.begin(USER_ID, null);

        String value = recorder.timed(traceId, "echo", TraceStep.TOOL_EXECUTION, () -> "ok");

        assertEquals("ok", value);
        TraceEvent event = recorder.get(traceId).getEvents().get(0);
        assertTrue(event.isSuccess());
        assertEquals(0L, event.getDurationMs());
    }

    @Test
    void shouldRecordAndRethrowTimedFailure() {
        String traceId = recorder.begin(USER_ID, null);
        IllegalStateException failure = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> recorder.timed(traceId, "echo", TraceStep.TOOL_EXECUTION, () -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
        TraceEvent event = recorder.get(traceId).getEvents().get(0);
        assertFalse(event.isSuccess());
        assertEquals("boom", event.getError());
    }

    // ==================== queries and metrics ====================

    @Test
    void shouldListUserTracesNewestFirst() {
        String first = recorder.begin(USER_ID, null);
        clock.advance(Duration.ofSeconds(1));
        String second = recorder.begin(USER_ID, null);
        clock.advance(Duration.ofSeconds(1));
        recorder.begin("other-user", null);

        List<Trace> traces = recorder.userTraces(USER_ID, 10);

        assertEquals(2, traces.size());
        assertEquals(second, traces.get(0).getTraceId());
        assertEquals(first, traces.get(1).getTraceId());
        assertEquals(1, recorder.userTraces(USER_ID, 1).size());
    }

    @Test
    void shouldComputeMetrics() {
        String ok = recorder.begin(USER_ID, null);
        recorder.success(ok, COMPONENT, TraceStep.PROVIDER_CALL, null, 100L);
        recorder.success(ok, COMPONENT, TraceStep.PROVIDER_CALL, null, 300L);
        clock.advance(Duration.ofMillis(400));
        recorder.end(ok, TraceStatus.COMPLETED, null);

        String failed = recorder.begin(USER_ID, null);
        clock.advance(Duration.ofMillis(200));
        recorder.end(failed, TraceStatus.FAILED, null);

        recorder.begin(USER_ID, null);

        TraceMetrics metrics = recorder.metrics();
        assertEquals(3, metrics.getTotalRequests());
        assertEquals(1, metrics.getSuccessfulRequests());
        assertEquals(1, metrics.getFailedRequests());
        assertEquals(1.0 / 3, metrics.getSuccessRate(), 0.0001);
        assertEquals(1, metrics.getActiveTraces());
        assertEquals(2, metrics.getCompletedTraces());
        assertEquals(300.0, metrics.getAverageDurationMs(), 0.0001);

        TraceMetrics.ComponentPerformance performance = metrics.getComponentPerformance().get(COMPONENT);
        assertEquals(400, performance.getTotalMs());
        assertEquals(2, performance.getCount());
        assertEquals(200.0, performance.getAverageMs(), 0.0001);
    }

    // ==================== retention ====================

    @Test
    void shouldEvictOldestCompletedTracesBeyondMax() {
        String oldest = null;
        for (int i = 0; i < 4; i++) {
            String traceId = recorder.begin(USER_ID, null);
            if (i == 0) {
                oldest = traceId;
            }
            clock.advance(Duration.ofSeconds(1));
            recorder.end(traceId, TraceStatus.COMPLETED, null);
        }

        assertNull(recorder.get(oldest));
        assertEquals(3, recorder.metrics().getCompletedTraces());
    }

    @Test
    void shouldTimeOutStaleActiveTracesAndDropExpiredOnCleanup() {
        String completed = recorder.begin(USER_ID, null);
        recorder.end(completed, TraceStatus.COMPLETED, null);
        String stale = recorder.begin(USER_ID, null);

        clock.advance(Duration.ofHours(2));
        int removed = recorder.cleanup();

        assertEquals(1, removed);
        assertNull(recorder.get(completed));
        assertEquals(TraceStatus.TIMEOUT, recorder.get(stale).getStatus());
        assertEquals(0, recorder.metrics().getActiveTraces());
    }
}
