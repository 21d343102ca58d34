package me.golemcore.calhelper.adapter.inbound.console;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.calhelper.domain.model.TurnResult;
import me.golemcore.calhelper.domain.service.CheckpointService;
import me.golemcore.calhelper.domain.service.TurnRunCoordinator;
import me.golemcore.calhelper.infrastructure.console.ConsoleIO;
import me.golemcore.calhelper.port.inbound.ChannelPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutionException;

/**
 * Terminal front end: one conversation thread per session, "You:" and
 * "Assistant:" lines, {@code exit} or {@code quit} to leave. Confirmations are
 * asked inline by the console confirmation port while the turn runs.
 */
@Component
@ConditionalOnProperty(name = "calhelper.frontend", havingValue = "console")
@RequiredArgsConstructor
@Slf4j
public class ConsoleChannelAdapter implements ChannelPort {

    private static final String CHANNEL_TYPE = "console";
    private static final Set<String> EXIT_COMMANDS = Set.of("exit", "quit");

    private final ConsoleIO console;
    private final TurnRunCoordinator coordinator;
    private final CheckpointService checkpointService;
    private final ConfigurableApplicationContext applicationContext;

    private final Object lifecycleLock = new Object();
    private volatile boolean running;
    private Thread loopThread;

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("Console channel already running");
                return;
            }
            running = true;
            // Non-daemon: keeps the process alive until the user leaves
            loopThread = new Thread(this::runSession, "console-channel");
            loopThread.start();
            log.info("Console channel started");
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            running = false;
            if (loopThread != null && loopThread != Thread.currentThread()) {
                loopThread.interrupt();
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void runSession() {
        try {
            runLoop(checkpointService.newThreadId());
        } finally {
            running = false;
            log.info("Console channel stopped");
            applicationContext.close();
        }
    }

    /**
     * Reads lines until exit or end of input. Package-private for testing.
     */
    void runLoop(String threadId) {
        console.println("Calendar assistant. Type 'exit' or 'quit' to leave.");
        running = true;
        while (running) {
            String line = console.prompt("You: ");
            if (line == null || EXIT_COMMANDS.contains(line.trim().toLowerCase(Locale.ROOT))) {
                console.println("Goodbye!");
                break;
            }
            if (line.isBlank()) {
                continue;
            }
            if (!runTurn(threadId, line)) {
                break;
            }
        }
        running = false;
    }

    private boolean runTurn(String threadId, String line) {
        try {
            TurnResult result = coordinator.submitUserMessage(threadId, line).get();
            if (result.finalAnswer() != null) {
                console.println("Assistant: " + result.finalAnswer());
            } else if (result.suspended()) {
                console.println("Assistant: (waiting for your decision)");
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            coordinator.requestStop(threadId);
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Console] Turn failed on thread {}: {}", threadId, cause.getMessage());
            console.println("Error: " + cause.getMessage());
            return true;
        }
    }
}
