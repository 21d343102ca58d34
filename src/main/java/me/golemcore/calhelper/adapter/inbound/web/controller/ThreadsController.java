package me.golemcore.calhelper.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.calhelper.adapter.inbound.web.dto.DecisionRequest;
import me.golemcore.calhelper.adapter.inbound.web.dto.FeedbackRequest;
import me.golemcore.calhelper.adapter.inbound.web.dto.MessageRequest;
import me.golemcore.calhelper.adapter.inbound.web.dto.ThreadDto;
import me.golemcore.calhelper.adapter.inbound.web.dto.TurnResponse;
import me.golemcore.calhelper.domain.model.ApprovalDecision;
import me.golemcore.calhelper.domain.model.ConversationThread;
import me.golemcore.calhelper.domain.model.Message;
import me.golemcore.calhelper.domain.service.CheckpointService;
import me.golemcore.calhelper.domain.service.TurnRunCoordinator;
import me.golemcore.calhelper.domain.turn.TurnController;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Conversation threads: send messages, answer confirmations, resume after a
 * restart. Turns run on the coordinator's executor; thread reads and deletes
 * run on the bounded elastic scheduler because checkpoint I/O blocks.
 */
@RestController
@RequestMapping("/api/threads")
@RequiredArgsConstructor
@Slf4j
public class ThreadsController {

    private final TurnRunCoordinator coordinator;
    private final TurnController turnController;
    private final CheckpointService checkpointService;

    @GetMapping
    public Mono<ResponseEntity<List<String>>> listThreads() {
        return Mono.fromCallable(() -> ResponseEntity.ok(checkpointService.listThreadIds()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/messages")
    public Mono<ResponseEntity<TurnResponse>> startThread(@RequestBody MessageRequest request) {
        return sendMessage(checkpointService.newThreadId(), request);
    }

    @PostMapping("/{threadId}/messages")
    public Mono<ResponseEntity<TurnResponse>> sendMessage(@PathVariable String threadId,
            @RequestBody MessageRequest request) {
        String text = request != null ? request.getText() : null;
        if (text == null || text.isBlank()) {
            return Mono.error(new IllegalArgumentException("text is required"));
        }
        return Mono.fromFuture(() -> coordinator.submitUserMessage(threadId, text))
                .map(result -> ResponseEntity.ok(TurnResponse.from(result)));
    }

    @PostMapping("/{threadId}/decisions")
    public Mono<ResponseEntity<TurnResponse>> submitDecision(@PathVariable String threadId,
            @RequestBody DecisionRequest request) {
        if (request == null || request.getInvocationId() == null || request.getInvocationId().isBlank()) {
            return Mono.error(new IllegalArgumentException("invocationId is required"));
        }
        ApprovalDecision decision = request.isApproved()
                ? ApprovalDecision.approve(request.getInvocationId())
                : ApprovalDecision.reject(request.getInvocationId(), request.getFeedback());
        log.info("[API] Decision for {} on thread {}: {}", request.getInvocationId(), threadId,
                decision.isApproved() ? "approved" : "rejected");
        return Mono.fromFuture(() -> coordinator.submitDecision(threadId, decision))
                .map(result -> ResponseEntity.ok(TurnResponse.from(result)));
    }

    @PostMapping("/{threadId}/feedback")
    public Mono<ResponseEntity<TurnResponse>> submitFeedback(@PathVariable String threadId,
            @RequestBody FeedbackRequest request) {
        String feedback = request != null ? request.getFeedback() : null;
        return Mono.fromFuture(() -> coordinator.submitFeedback(threadId, feedback))
                .map(result -> ResponseEntity.ok(TurnResponse.from(result)));
    }

    @PostMapping("/{threadId}/resume")
    public Mono<ResponseEntity<TurnResponse>> resume(@PathVariable String threadId) {
        return Mono.fromFuture(() -> coordinator.resume(threadId))
                .map(result -> ResponseEntity.ok(TurnResponse.from(result)));
    }

    @PostMapping("/{threadId}/stop")
    public Mono<ResponseEntity<Map<String, Object>>> stop(@PathVariable String threadId) {
        boolean stopped = coordinator.requestStop(threadId);
        return Mono.just(ResponseEntity.ok(Map.of("threadId", threadId, "stopped", stopped)));
    }

    @GetMapping("/{threadId}")
    public Mono<ResponseEntity<ThreadDto>> getThread(@PathVariable String threadId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(toDto(turnController.getThread(threadId))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{threadId}")
    public Mono<ResponseEntity<Void>> deleteThread(@PathVariable String threadId) {
        return Mono.fromCallable(() -> {
            turnController.deleteThread(threadId);
            return ResponseEntity.noContent().<Void>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private ThreadDto toDto(ConversationThread thread) {
        return ThreadDto.builder()
                .threadId(thread.getThreadId())
                .phase(thread.getPhase().name())
                .roundTrips(thread.getRoundTrips())
                .version(thread.getVersion())
                .createdAt(thread.getCreatedAt())
                .updatedAt(thread.getUpdatedAt())
                .messages(thread.getMessages().stream().map(this::toDto).toList())
                .build();
    }

    private ThreadDto.MessageDto toDto(Message message) {
        ThreadDto.MessageDto.MessageDtoBuilder builder = ThreadDto.MessageDto.builder()
                .kind(message.getKind().name())
                .content(message.getContent())
                .invocationId(message.getInvocationId())
                .capabilityName(message.getCapabilityName())
                .failed(message.isFailed())
                .failureKind(message.getFailureKind() != null ? message.getFailureKind().name() : null)
                .timestamp(message.getTimestamp());
        if (message.getInvocation() != null) {
            builder.invocationId(message.getInvocation().getId())
                    .capabilityName(message.getInvocation().getCapabilityName())
                    .arguments(message.getInvocation().getArguments());
        }
        return builder.build();
    }
}
