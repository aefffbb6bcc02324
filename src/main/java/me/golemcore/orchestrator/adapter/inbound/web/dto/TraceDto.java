package me.golemcore.orchestrator.adapter.inbound.web.dto;

import lombok.Builder;
import lombok.Data;
import me.golemcore.orchestrator.domain.model.Trace;
import me.golemcore.orchestrator.domain.model.TraceEvent;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Trace as exposed on the status endpoints.
 */
@Data
@Builder
public class TraceDto {
    private String traceId;
    private String userId;
    private String sessionId;
    private String status;
    private Instant startTime;
    private Instant endTime;
    private Long durationMs;
    private List<TraceEvent> events;
    private Map<String, Object> metadata;

    public static TraceDto from(Trace trace) {
        return TraceDto.builder()
                .traceId(trace.getTraceId())
                .userId(trace.getUserId())
                .sessionId(trace.getSessionId())
                .status(trace.getStatus().name())
                .startTime(trace.getStartTime())
                .endTime(trace.getEndTime())
                .durationMs(trace.getDuration() != null ? trace.getDuration().toMillis() : null)
                .events(List.copyOf(trace.getEvents()))
                .metadata(Map.copyOf(trace.getMetadata()))
                .build();
    }
}
