package me.golemcore.orchestrator.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.adapter.inbound.web.dto.TraceDto;
import me.golemcore.orchestrator.domain.service.OperatorStatusService;
import me.golemcore.orchestrator.domain.service.ToolRegistry;
import me.golemcore.orchestrator.domain.service.TraceRecorder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Operator status endpoints.
 */
@RestController
@RequestMapping("/api/status")
@RequiredArgsConstructor
public class StatusController {

    private static final int MAX_TRACE_LIMIT = 100;

    private final OperatorStatusService operatorStatusService;
    private final TraceRecorder traceRecorder;
    private final ToolRegistry toolRegistry;

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> status() {
        return Mono.just(ResponseEntity.ok(operatorStatusService.status()));
    }

    @GetMapping("/traces/{userId}")
    public Mono<ResponseEntity<List<TraceDto>>> userTraces(@PathVariable String userId,
            @RequestParam(defaultValue = "10") int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        List<TraceDto> traces = traceRecorder.userTraces(userId, Math.min(limit, MAX_TRACE_LIMIT)).stream()
                .map(TraceDto::from)
                .toList();
        return Mono.just(ResponseEntity.ok(traces));
    }

    @GetMapping("/tools")
    public Mono<ResponseEntity<Map<String, Object>>> tools() {
        return Mono.just(ResponseEntity.ok(toolRegistry.info()));
    }
}
