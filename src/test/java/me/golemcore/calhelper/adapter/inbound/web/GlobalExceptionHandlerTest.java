package me.golemcore.calhelper.adapter.inbound.web;

import me.golemcore.calhelper.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.calhelper.domain.exception.InvalidArgumentsException;
import me.golemcore.calhelper.domain.exception.LlmGatewayException;
import me.golemcore.calhelper.domain.exception.RunawayLoopException;
import me.golemcore.calhelper.domain.exception.ThreadBusyException;
import me.golemcore.calhelper.domain.exception.ThreadNotFoundException;
import me.golemcore.calhelper.domain.exception.TurnCancelledException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import reactor.test.StepVerifier;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldMapMissingThreadToNotFound() {
        expect(handler.handleNotFound(new ThreadNotFoundException("t-1")), HttpStatus.NOT_FOUND);
    }

    @Test
    void shouldMapBusyAndCancelledToConflict() {
        expect(handler.handleBusy(new ThreadBusyException("t-1")), HttpStatus.CONFLICT);
        expect(handler.handleCancelled(new TurnCancelledException("t-1")), HttpStatus.CONFLICT);
        expect(handler.handleIllegalState(new IllegalStateException("not awaiting approval")), HttpStatus.CONFLICT);
    }

    @Test
    void shouldMapRunawayLoopToUnprocessable() {
        expect(handler.handleRunaway(new RunawayLoopException("t-1", 10)), HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void shouldMapModelFailureToBadGateway() {
        expect(handler.handleGateway(new LlmGatewayException("Language model call failed: 503", null)),
                HttpStatus.BAD_GATEWAY);
    }

    @Test
    void shouldMapValidationErrorsToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("text is required")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("text is required", body.getMessage());
                })
                .verifyComplete();
        expect(handler.handleIllegalArgument(new InvalidArgumentsException("createBooking",
                List.of("missing required property 'start'"))), HttpStatus.BAD_REQUEST);
    }

    @Test
    void shouldKeepResponseStatusReason() {
        StepVerifier.create(handler.handleResponseStatus(new ResponseStatusException(HttpStatus.FORBIDDEN, "nope")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
                    assertEquals("nope", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrorDetails() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("NPE at line 42")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    private static void expect(Mono<ResponseEntity<ApiErrorResponse>> mono, HttpStatus status) {
        StepVerifier.create(mono)
                .assertNext(response -> {
                    assertEquals(status, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(status.value(), body.getStatus());
                    assertTrue(body.getMessage() != null && !body.getMessage().isBlank());
                })
                .verifyComplete();
    }
}
