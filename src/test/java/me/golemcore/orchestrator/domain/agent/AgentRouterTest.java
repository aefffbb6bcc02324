package me.golemcore.orchestrator.domain.agent;

import me.golemcore.orchestrator.domain.model.AgentReply;
import me.golemcore.orchestrator.domain.model.RoutedReply;
import me.golemcore.orchestrator.domain.model.Trace;
import me.golemcore.orchestrator.domain.model.TraceEvent;
import me.golemcore.orchestrator.domain.model.TraceStatus;
import me.golemcore.orchestrator.domain.model.TraceStep;
import me.golemcore.orchestrator.domain.model.TurnContext;
import me.golemcore.orchestrator.domain.service.TraceRecorder;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentRouterTest {

    private static final String USER_ID = "42";

    private TraceRecorder traceRecorder;
    private Clock clock;
    private String traceId;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        traceRecorder = new TraceRecorder(new OrchestratorProperties(), clock);
        traceId = traceRecorder.begin(USER_ID, USER_ID);
    }

    @Test
    void shouldPreferHigherPriorityAgent() {
        StubAgent general = new StubAgent("general", 10, turn -> true);
        StubAgent admin = new StubAgent("admin", 90, turn -> turn.getText().startsWith("/mcp"));
        AgentRouter router = new AgentRouter(List.of(general, admin), traceRecorder, clock);

        RoutedReply routed = router.route(turn("/mcp list apps"));

        assertEquals("admin", routed.handlerName());
        assertEquals("admin handled /mcp list apps", routed.reply().getText());
        assertEquals(0, general.processed);
    }

    @Test
    void shouldFallThroughWhenPredicateDeclines() {
        StubAgent general = new StubAgent("general", 10, turn -> true);
        StubAgent admin = new StubAgent("admin", 90, turn -> false);
        AgentRouter router = new AgentRouter(List.of(admin, general), traceRecorder, clock);

        RoutedReply routed = router.route(turn("hello"));

        assertEquals("general", routed.handlerName());
        List<TraceEvent> routing = events(TraceStep.AGENT_ROUTING);
        assertEquals(2, routing.size());
        assertEquals(false, routing.get(0).getDetails().get("accepted"));
        assertEquals(true, routing.get(1).getDetails().get("accepted"));
        assertEquals(1, events(TraceStep.AGENT_PROCESSING).size());
    }

    @Test
    void shouldSkipAgentWhosePredicateThrows() {
        StubAgent broken = new StubAgent("broken", 50, turn -> {
            throw new IllegalStateException("predicate failed");
        });
        StubAgent general = new StubAgent("general", 10, turn -> true);
        AgentRouter router = new AgentRouter(List.of(broken, general), traceRecorder, clock);

        RoutedReply routed = router.route(turn("hello"));

        assertEquals("general", routed.handlerName());
        TraceEvent failed = events(TraceStep.AGENT_ROUTING).get(0);
        assertFalse(failed.isSuccess());
        assertEquals("predicate failed", failed.getError());
    }

    @Test
    void shouldKeepRegistrationOrderForEqualPriorities() {
        StubAgent first = new StubAgent("first", 10, turn -> true);
        StubAgent second = new StubAgent("second", 10, turn -> true);
        AgentRouter router = new AgentRouter(List.of(first, second), traceRecorder, clock);

        assertEquals("first", router.route(turn("hi")).handlerName());
        assertEquals(List.of("first", "second"), router.agents().stream().map(Agent::getName).toList());
    }

    @Test
    void shouldApologizeAndFailTraceWhenNoAgentAccepts() {
        AgentRouter router = new AgentRouter(List.of(new StubAgent("picky", 10, turn -> false)),
                traceRecorder, clock);

        RoutedReply routed = router.route(turn("hello"));

        assertFalse(routed.handled());
        assertEquals(RoutedReply.NO_HANDLER, routed.handlerName());
        assertEquals(AgentRouter.NO_AGENT_REPLY, routed.reply().getText());
        Trace trace = traceRecorder.get(traceId);
        assertEquals(TraceStatus.FAILED, trace.getStatus());
        assertEquals(AgentRouter.NO_AGENT_REASON, trace.getMetadata().get("reason"));
    }

    @Test
    void shouldRecordAndRethrowProcessingFailure() {
        StubAgent failing = new StubAgent("failing", 10, turn -> true) {
            @Override
            public AgentReply process(TurnContext turn) {
                throw new IllegalStateException("agent crashed");
            }
        };
        AgentRouter router = new AgentRouter(List.of(failing), traceRecorder, clock);

        assertThrows(IllegalStateException.class, () -> router.route(turn("hello")));
        TraceEvent processing = events(TraceStep.AGENT_PROCESSING).get(0);
        assertFalse(processing.isSuccess());
        assertEquals("agent crashed", processing.getError());
    }

    @Test
    void shouldFindAgentWithoutProcessing() {
        StubAgent general = new StubAgent("general", 10, turn -> true);
        AgentRouter router = new AgentRouter(List.of(general), traceRecorder, clock);

        assertEquals("general", router.agentFor(turn("hi")).map(Agent::getName).orElseThrow());
        assertEquals(0, general.processed);
        assertTrue(new AgentRouter(List.of(), traceRecorder, clock).agentFor(turn("hi")).isEmpty());
    }

    @Test
    void shouldDescribeAgentsInPriorityOrder() {
        AgentRouter router = new AgentRouter(List.of(new StubAgent("general", 10, turn -> true),
                new StubAgent("admin", 90, turn -> true)), traceRecorder, clock);

        List<Map<String, Object>> status = router.status();

        assertEquals("admin", status.get(0).get("name"));
        assertEquals(90, status.get(0).get("priority"));
        assertEquals("general", status.get(1).get("name"));
    }

    private TurnContext turn(String text) {
        return TurnContext.builder().traceId(traceId).userId(USER_ID).chatId(USER_ID).text(text).build();
    }

    private List<TraceEvent> events(TraceStep step) {
        return traceRecorder.get(traceId).getEvents().stream()
                .filter(event -> event.getStep() == step)
                .toList();
    }

    private static class StubAgent implements Agent {
        private final String name;
        private final int priority;
        private final Predicate<TurnContext> predicate;
        private int processed;

        StubAgent(String name, int priority, Predicate<TurnContext> predicate) {
            this.name = name;
            this.priority = priority;
            this.predicate = predicate;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public int getPriority() {
            return priority;
        }

        @Override
        public boolean canHandle(TurnContext turn) {
            return predicate.test(turn);
        }

        @Override
        public AgentReply process(TurnContext turn) {
            processed++;
            return AgentReply.text(name + " handled " + turn.getText());
        }
    }
}
