package me.golemcore.calhelper.domain.service;

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
import me.golemcore.calhelper.domain.exception.ThreadBusyException;
import me.golemcore.calhelper.domain.exception.TurnCancelledException;
import me.golemcore.calhelper.domain.model.ApprovalDecision;
import me.golemcore.calhelper.domain.model.TurnResult;
import me.golemcore.calhelper.domain.turn.TurnController;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Runs turns on a dedicated executor so a front end can stay responsive and
 * cancel a running turn.
 *
 * <p>
 * At most one turn runs per thread; submitting another one while a turn is
 * running fails with {@link ThreadBusyException}. Different threads run in
 * parallel. {@link #requestStop(String)} interrupts the running task, and the
 * controller stops at its next transition boundary.
 */
@Service
@Slf4j
public class TurnRunCoordinator {

    private final TurnController turnController;
    private final ExecutorService turnRunExecutor;
    private final Map<String, RunningTurn> running = new ConcurrentHashMap<>();

    public TurnRunCoordinator(TurnController turnController,
            @Qualifier("turnRunExecutor") ExecutorService turnRunExecutor) {
        this.turnController = turnController;
        this.turnRunExecutor = turnRunExecutor;
    }

    public CompletableFuture<TurnResult> submitUserMessage(String threadId, String text) {
        return run(threadId, controller -> controller.submitUserMessage(threadId, text));
    }

    public CompletableFuture<TurnResult> submitDecision(String threadId, ApprovalDecision decision) {
        return run(threadId, controller -> controller.submitDecision(threadId, decision));
    }

    public CompletableFuture<TurnResult> submitFeedback(String threadId, String feedback) {
        return run(threadId, controller -> controller.submitFeedback(threadId, feedback));
    }

    public CompletableFuture<TurnResult> resume(String threadId) {
        return run(threadId, controller -> controller.resume(threadId));
    }

    public boolean isRunning(String threadId) {
        RunningTurn turn = running.get(threadId);
        return turn != null && !turn.task().isDone();
    }

    /**
     * Interrupts the running turn of a thread, if any.
     *
     * @return true if a running turn was asked to stop
     */
    public boolean requestStop(String threadId) {
        RunningTurn turn = running.get(threadId);
        if (turn == null || turn.task().isDone()) {
            log.info("[Stop] stop requested while idle: thread={}", threadId);
            return false;
        }
        boolean cancelled = turn.task().cancel(true);
        // A task cancelled before it started never completes its result
        turn.result().completeExceptionally(new TurnCancelledException(threadId));
        log.info("[Stop] cancel requested: thread={} (cancelled={})", threadId, cancelled);
        return cancelled;
    }

    private CompletableFuture<TurnResult> run(String threadId, Function<TurnController, TurnResult> work) {
        CompletableFuture<TurnResult> result = new CompletableFuture<>();
        synchronized (running) {
            if (isRunning(threadId)) {
                result.completeExceptionally(new ThreadBusyException(threadId));
                return result;
            }
            Future<?> task = turnRunExecutor.submit(() -> {
                try {
                    result.complete(work.apply(turnController));
                } catch (TurnCancelledException e) {
                    log.info("[TurnRunCoordinator] run cancelled: thread={}", threadId);
                    result.completeExceptionally(e);
                } catch (RuntimeException e) { // NOSONAR - must not kill executor thread
                    log.debug("[TurnRunCoordinator] run failed: thread={}: {}", threadId, e.getMessage());
                    result.completeExceptionally(e);
                } finally {
                    running.computeIfPresent(threadId, (id, turn) -> turn.result() == result ? null : turn);
                }
            });
            running.put(threadId, new RunningTurn(task, result));
        }
        return result;
    }

    private record RunningTurn(Future<?> task, CompletableFuture<TurnResult> result) {
    }
}
