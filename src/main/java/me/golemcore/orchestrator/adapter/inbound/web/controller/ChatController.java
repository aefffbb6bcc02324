package me.golemcore.orchestrator.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.adapter.inbound.web.dto.ChatMessageRequest;
import me.golemcore.orchestrator.adapter.inbound.web.dto.ChatMessageResponse;
import me.golemcore.orchestrator.domain.loop.TurnOrchestrator;
import me.golemcore.orchestrator.domain.model.InboundMessage;
import me.golemcore.orchestrator.domain.model.TurnReply;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Chat ingress for transport adapters: one request per inbound user message.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final TurnOrchestrator turnOrchestrator;

    @PostMapping("/messages")
    public Mono<ResponseEntity<ChatMessageResponse>> message(@RequestBody ChatMessageRequest request) {
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (request.getText() == null || request.getText().isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
        log.debug("[API] Chat message from user {}", request.getUserId());

        InboundMessage message = InboundMessage.builder()
                .userId(request.getUserId())
                .chatId(request.getChatId() != null ? request.getChatId() : request.getUserId())
                .text(request.getText())
                .build();
        return Mono.fromFuture(turnOrchestrator.handle(message))
                .map(reply -> ResponseEntity.ok(toResponse(reply)));
    }

    private ChatMessageResponse toResponse(TurnReply reply) {
        return ChatMessageResponse.builder()
                .agent(reply.getAgent())
                .text(reply.getText())
                .traceId(reply.getTraceId())
                .confirmationSessionId(reply.getConfirmationSessionId())
                .build();
    }
}
