package me.golemcore.calhelper.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.calhelper.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.calhelper.domain.exception.InvalidArgumentsException;
import me.golemcore.calhelper.domain.exception.LlmGatewayException;
import me.golemcore.calhelper.domain.exception.RunawayLoopException;
import me.golemcore.calhelper.domain.exception.ThreadBusyException;
import me.golemcore.calhelper.domain.exception.ThreadNotFoundException;
import me.golemcore.calhelper.domain.exception.TurnCancelledException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps turn-fatal errors to HTTP statuses. Failures of single invocations never
 * reach this handler: they are part of the conversation.
 */
@ControllerAdvice(basePackages = "me.golemcore.calhelper.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ThreadNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(ThreadNotFoundException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(ThreadBusyException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleBusy(ThreadBusyException ex) {
        log.warn("[API] Busy: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(TurnCancelledException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCancelled(TurnCancelledException ex) {
        log.info("[API] Cancelled: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(RunawayLoopException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleRunaway(RunawayLoopException ex) {
        log.warn("[API] Runaway loop: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler(LlmGatewayException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGateway(LlmGatewayException ex) {
        log.error("[API] Language model unavailable: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(ex.getReason())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler({ IllegalArgumentException.class, InvalidArgumentsException.class })
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(RuntimeException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase())
                .message("Internal server error")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, RuntimeException ex) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
