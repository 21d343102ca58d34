package me.golemcore.calhelper.adapter.outbound.confirmation;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.calhelper.domain.model.ApprovalDecision;
import me.golemcore.calhelper.domain.model.InvocationRequest;
import me.golemcore.calhelper.infrastructure.config.CalHelperProperties;
import me.golemcore.calhelper.port.outbound.ConfirmationPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Confirmation port for request/response front ends (the REST API).
 *
 * <p>
 * Requests never block: the turn controller sees an incomplete future,
 * checkpoints the thread in its suspension phase and returns. The decision or
 * feedback arrives on a later request through {@link #deliverDecision} /
 * {@link #deliverFeedback}, after which the thread is advanced again and picks
 * up the completed future.
 *
 * <p>
 * Entries are keyed by invocation id (decisions) and thread id (feedback). A
 * completed entry is handed out once and then forgotten. A scheduled task
 * expires entries nobody consumed.
 */
@Component
@ConditionalOnProperty(name = "calhelper.frontend", havingValue = "web", matchIfMissing = true)
@Slf4j
public class DeferredConfirmationAdapter implements ConfirmationPort {

    private static final long STALE_GRACE_MILLIS = TimeUnit.MINUTES.toMillis(30);

    private final Map<String, Pending<ApprovalDecision>> decisions = new ConcurrentHashMap<>();
    private final Map<String, Pending<String>> feedback = new ConcurrentHashMap<>();
    private final Duration timeout;

    private ScheduledExecutorService cleanupExecutor;

    public DeferredConfirmationAdapter(CalHelperProperties properties) {
        this.timeout = properties.getApproval().getTimeout();
    }

    @PostConstruct
    public void init() {
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "confirmation-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::expireStale, 1, 1, TimeUnit.MINUTES);
    }

    @PreDestroy
    public void destroy() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
            try {
                cleanupExecutor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public CompletableFuture<ApprovalDecision> requestConfirmation(String threadId, InvocationRequest invocation,
            String description) {
        Pending<ApprovalDecision> entry = decisions.computeIfAbsent(invocation.getId(), id -> {
            log.info("[Approval] Awaiting decision for {} in thread {}: {}", id, threadId, description);
            return new Pending<>(new CompletableFuture<>(), System.currentTimeMillis());
        });
        return handOut(decisions, invocation.getId(), entry);
    }

    @Override
    public CompletableFuture<String> requestFeedback(String threadId, String prompt) {
        Pending<String> entry = feedback.computeIfAbsent(threadId, id -> {
            log.info("[Approval] Awaiting feedback for thread {}", id);
            return new Pending<>(new CompletableFuture<>(), System.currentTimeMillis());
        });
        return handOut(feedback, threadId, entry);
    }

    @Override
    public void deliverDecision(ApprovalDecision decision) {
        Pending<ApprovalDecision> entry = decisions.computeIfAbsent(decision.getInvocationId(),
                id -> new Pending<>(new CompletableFuture<>(), System.currentTimeMillis()));
        if (!entry.future().complete(decision)) {
            log.debug("[Approval] Decision for {} already resolved, ignoring", decision.getInvocationId());
        }
    }

    @Override
    public void deliverFeedback(String threadId, String text) {
        Pending<String> entry = feedback.computeIfAbsent(threadId,
                id -> new Pending<>(new CompletableFuture<>(), System.currentTimeMillis()));
        if (!entry.future().complete(text)) {
            log.debug("[Approval] Feedback for thread {} already resolved, ignoring", threadId);
        }
    }

    @Override
    public boolean isInteractive() {
        return false;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    int pendingCount() {
        return decisions.size() + feedback.size();
    }

    void expireStale() {
        long cutoff = System.currentTimeMillis() - timeout.toMillis() - STALE_GRACE_MILLIS;
        expire(decisions, cutoff);
        expire(feedback, cutoff);
    }

    private <T> void expire(Map<String, Pending<T>> entries, long cutoff) {
        entries.entrySet().removeIf(e -> {
            if (e.getValue().createdAt() < cutoff) {
                e.getValue().future().completeExceptionally(new TimeoutException("Stale confirmation cleaned up"));
                return true;
            }
            return false;
        });
    }

    private static <T> CompletableFuture<T> handOut(Map<String, Pending<T>> entries, String key, Pending<T> entry) {
        if (entry.future().isDone()) {
            entries.remove(key, entry);
        }
        return entry.future();
    }

    private record Pending<T>(CompletableFuture<T> future, long createdAt) {
    }
}
