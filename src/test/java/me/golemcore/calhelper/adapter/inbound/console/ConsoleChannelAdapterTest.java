package me.golemcore.calhelper.adapter.inbound.console;

import me.golemcore.calhelper.domain.exception.RunawayLoopException;
import me.golemcore.calhelper.domain.model.TurnPhase;
import me.golemcore.calhelper.domain.model.TurnResult;
import me.golemcore.calhelper.domain.service.CheckpointService;
import me.golemcore.calhelper.domain.service.TurnRunCoordinator;
import me.golemcore.calhelper.infrastructure.console.ConsoleIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConsoleChannelAdapterTest {

    private static final String THREAD_ID = "console-thread";

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private TurnRunCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = mock(TurnRunCoordinator.class);
    }

    @Test
    void shouldPrintAnswersUntilExit() {
        when(coordinator.submitUserMessage(THREAD_ID, "What is on Monday?")).thenReturn(CompletableFuture
                .completedFuture(new TurnResult(THREAD_ID, TurnPhase.DONE, "Nothing booked.", 1, List.of(), false)));
        ConsoleChannelAdapter adapter = adapter("What is on Monday?\n\nexit\nignored\n");

        adapter.runLoop(THREAD_ID);

        String printed = printed();
        assertTrue(printed.startsWith("Calendar assistant. Type 'exit' or 'quit' to leave."));
        assertTrue(printed.contains("Assistant: Nothing booked."));
        assertTrue(printed.contains("Goodbye!"));
        verify(coordinator, times(1)).submitUserMessage(anyString(), anyString());
        assertFalse(adapter.isRunning());
    }

    @Test
    void shouldReportTurnErrorsAndContinue() {
        when(coordinator.submitUserMessage(THREAD_ID, "loop"))
                .thenReturn(CompletableFuture.failedFuture(new RunawayLoopException(THREAD_ID, 10)));
        when(coordinator.submitUserMessage(THREAD_ID, "hello")).thenReturn(CompletableFuture
                .completedFuture(new TurnResult(THREAD_ID, TurnPhase.DONE, "Hi!", 0, List.of(), false)));
        ConsoleChannelAdapter adapter = adapter("loop\nhello\n");

        adapter.runLoop(THREAD_ID);

        assertTrue(printed().contains("Error: "));
        assertTrue(printed().contains("Assistant: Hi!"));
    }

    @Test
    void shouldEndSessionAtEndOfInput() {
        ConsoleChannelAdapter adapter = adapter("");

        adapter.runLoop(THREAD_ID);

        assertTrue(printed().contains("Goodbye!"));
        verify(coordinator, never()).submitUserMessage(anyString(), anyString());
    }

    @Test
    void shouldExposeChannelType() {
        assertEquals("console", adapter("").getChannelType());
    }

    private ConsoleChannelAdapter adapter(String input) {
        ConsoleIO console = new ConsoleIO(new BufferedReader(new StringReader(input)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
        return new ConsoleChannelAdapter(console, coordinator, mock(CheckpointService.class),
                mock(ConfigurableApplicationContext.class));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }
}
