package me.golemcore.orchestrator.domain.agent;

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
import me.golemcore.orchestrator.domain.model.AgentReply;
import me.golemcore.orchestrator.domain.model.RoutedReply;
import me.golemcore.orchestrator.domain.model.TraceStatus;
import me.golemcore.orchestrator.domain.model.TraceStep;
import me.golemcore.orchestrator.domain.model.TurnContext;
import me.golemcore.orchestrator.domain.service.TraceRecorder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chain of responsibility over the registered {@link Agent}s.
 *
 * <p>
 * Agents are ordered by descending priority; equal priorities keep
 * registration order. A predicate that throws is logged, recorded as a failed
 * routing event and skipped. When no agent accepts, the trace is ended as
 * failed and a fixed apology is returned under the handler name
 * {@value RoutedReply#NO_HANDLER}.
 */
@Service
@Slf4j
public class AgentRouter {

    public static final String COMPONENT = "router";
    public static final String NO_AGENT_REPLY = "Sorry, I can't handle this message right now.";
    public static final String NO_AGENT_REASON = "no suitable agent";

    private final List<Agent> agents;
    private final TraceRecorder traceRecorder;
    private final Clock clock;

    public AgentRouter(List<Agent> agents, TraceRecorder traceRecorder, Clock clock) {
        List<Agent> sorted = new ArrayList<>(agents);
        sorted.sort(Comparator.comparingInt(Agent::getPriority).reversed());
        this.agents = List.copyOf(sorted);
        this.traceRecorder = traceRecorder;
        this.clock = clock;
        log.info("[Router] Agent chain: {}", this.agents.stream()
                .map(agent -> agent.getName() + "(" + agent.getPriority() + ")")
                .toList());
    }

    public RoutedReply route(TurnContext turn) {
        String traceId = turn.getTraceId();

        for (Agent agent : agents) {
            long checkStart = clock.millis();
            boolean accepted;
            try {
                accepted = agent.canHandle(turn);
            } catch (RuntimeException e) { // NOSONAR - a broken predicate must not stop the chain
                log.warn("[Router] {} canHandle failed: {}", agent.getName(), e.getMessage());
                traceRecorder.event(traceId, agent.getName(), TraceStep.AGENT_ROUTING,
                        Map.of("accepted", false), clock.millis() - checkStart, false, e.getMessage());
                continue;
            }
            traceRecorder.success(traceId, agent.getName(), TraceStep.AGENT_ROUTING,
                    Map.of("accepted", accepted), clock.millis() - checkStart);
            if (!accepted) {
                continue;
            }

            log.debug("[Router] {} accepted message from user {}", agent.getName(), turn.getUserId());
            long processStart = clock.millis();
            try {
                AgentReply reply = agent.process(turn);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("tool", reply.getToolName());
                details.put("provider", reply.getProvider());
                traceRecorder.success(traceId, agent.getName(), TraceStep.AGENT_PROCESSING, details,
                        clock.millis() - processStart);
                return new RoutedReply(agent.getName(), reply);
            } catch (RuntimeException e) {
                traceRecorder.failure(traceId, agent.getName(), TraceStep.AGENT_PROCESSING, e.getMessage(),
                        clock.millis() - processStart);
                throw e;
            }
        }

        log.warn("[Router] No agent accepted message from user {}", turn.getUserId());
        traceRecorder.failure(traceId, COMPONENT, TraceStep.AGENT_ROUTING, NO_AGENT_REASON, null);
        traceRecorder.end(traceId, TraceStatus.FAILED, Map.of("reason", NO_AGENT_REASON));
        return new RoutedReply(RoutedReply.NO_HANDLER, AgentReply.text(NO_AGENT_REPLY));
    }

    /**
     * Find the agent that would handle a message, without processing it.
     */
    public Optional<Agent> agentFor(TurnContext turn) {
        for (Agent agent : agents) {
            try {
                if (agent.canHandle(turn)) {
                    return Optional.of(agent);
                }
            } catch (RuntimeException e) { // NOSONAR - same skip rule as route()
                log.debug("[Router] {} canHandle failed: {}", agent.getName(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    public List<Agent> agents() {
        return agents;
    }

    public List<Map<String, Object>> status() {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Agent agent : agents) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", agent.getName());
            entry.put("priority", agent.getPriority());
            entry.putAll(agent.status());
            result.add(entry);
        }
        return result;
    }
}
