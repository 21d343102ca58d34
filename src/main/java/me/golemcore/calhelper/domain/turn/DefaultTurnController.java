package me.golemcore.calhelper.domain.turn;

import me.golemcore.calhelper.domain.exception.LlmGatewayException;
import me.golemcore.calhelper.domain.exception.RunawayLoopException;
import me.golemcore.calhelper.domain.exception.TurnCancelledException;
import me.golemcore.calhelper.domain.model.ApprovalDecision;
import me.golemcore.calhelper.domain.model.CapabilityResult;
import me.golemcore.calhelper.domain.model.ConversationThread;
import me.golemcore.calhelper.domain.model.InvocationRequest;
import me.golemcore.calhelper.domain.model.LlmRequest;
import me.golemcore.calhelper.domain.model.LlmResponse;
import me.golemcore.calhelper.domain.model.Message;
import me.golemcore.calhelper.domain.model.PendingApproval;
import me.golemcore.calhelper.domain.model.TurnPhase;
import me.golemcore.calhelper.domain.model.TurnResult;
import me.golemcore.calhelper.domain.service.ApprovalGate;
import me.golemcore.calhelper.domain.service.CapabilityRegistry;
import me.golemcore.calhelper.domain.service.CheckpointService;
import me.golemcore.calhelper.domain.service.ThreadLease;
import me.golemcore.calhelper.port.outbound.ConfirmationPort;
import me.golemcore.calhelper.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Turn state machine.
 *
 * <pre>
 * AWAITING_USER_INPUT -&gt; MODEL_INVOKING -&gt; {DISPATCHING, DONE}
 * DISPATCHING -&gt; {APPROVING, MODEL_INVOKING}
 * APPROVING -&gt; {DISPATCHING, HUMAN_INTERVENING}
 * HUMAN_INTERVENING -&gt; MODEL_INVOKING
 * </pre>
 *
 * <p>
 * The thread is saved after every transition, every capability execution and
 * every recorded decision, so a crash loses at most one in-flight model call.
 * Results of a round are staged in the thread's scratch area and appended to
 * the history in request order only when the whole round is complete.
 *
 * <p>
 * Cancellation is observed through the interrupt flag of the running thread at
 * transition boundaries. A cancelled turn stops without saving its working
 * copy.
 */
public class DefaultTurnController implements TurnController {

    private static final Logger log = LoggerFactory.getLogger(DefaultTurnController.class);

    static final String EMPTY_FEEDBACK = "The user rejected the action without further feedback.";

    private final LlmPort llmPort;
    private final CapabilityRegistry registry;
    private final ApprovalGate approvalGate;
    private final ConfirmationPort confirmationPort;
    private final CheckpointService checkpointService;
    private final HistoryWriter historyWriter;
    private final TurnPrompts prompts;
    private final int maxRoundTrips;

    public DefaultTurnController(LlmPort llmPort, CapabilityRegistry registry, ApprovalGate approvalGate,
            ConfirmationPort confirmationPort, CheckpointService checkpointService, HistoryWriter historyWriter,
            TurnPrompts prompts, int maxRoundTrips) {
        if (maxRoundTrips < 1) {
            throw new IllegalArgumentException("maxRoundTrips must be positive: " + maxRoundTrips);
        }
        this.llmPort = llmPort;
        this.registry = registry;
        this.approvalGate = approvalGate;
        this.confirmationPort = confirmationPort;
        this.checkpointService = checkpointService;
        this.historyWriter = historyWriter;
        this.prompts = prompts;
        this.maxRoundTrips = maxRoundTrips;
    }

    @Override
    public TurnResult submitUserMessage(String threadId, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Message text must not be blank");
        }
        String id = threadId != null && !threadId.isBlank() ? threadId : checkpointService.newThreadId();

        try (ThreadLease lease = checkpointService.acquire(id)) {
            ConversationThread thread = checkpointService.find(id).orElseGet(() -> newThread(id));
            TurnPhase phase = thread.getPhase();

            if (phase == TurnPhase.HUMAN_INTERVENING) {
                log.debug("[Turn] Thread {} awaits feedback, treating user message as feedback", id);
                confirmationPort.deliverFeedback(id, text);
                return advance(lease, thread);
            }
            boolean stalled = phase == TurnPhase.MODEL_INVOKING && thread.getRoundTrips() >= maxRoundTrips;
            if (!phase.acceptsNewTurn() && !stalled) {
                throw new IllegalStateException("Thread " + id + " is in phase " + phase
                        + " and cannot accept a new message");
            }

            startTurn(thread, text);
            save(lease, thread);
            log.info("[Turn] Thread {}: new user turn", id);
            return advance(lease, thread);
        }
    }

    @Override
    public TurnResult submitDecision(String threadId, ApprovalDecision decision) {
        if (decision == null || decision.getInvocationId() == null) {
            throw new IllegalArgumentException("Decision must reference an invocation id");
        }
        try (ThreadLease lease = checkpointService.acquire(threadId)) {
            ConversationThread thread = checkpointService.load(threadId);
            if (thread.getPhase() != TurnPhase.APPROVING) {
                throw new IllegalStateException("Thread " + threadId + " is not awaiting approval (phase "
                        + thread.getPhase() + ")");
            }
            if (thread.findPending(decision.getInvocationId()).isEmpty()) {
                throw new IllegalArgumentException("Invocation " + decision.getInvocationId()
                        + " is not pending in thread " + threadId);
            }
            if (thread.hasDecision(decision.getInvocationId())) {
                throw new IllegalStateException("Invocation " + decision.getInvocationId()
                        + " has already been decided");
            }
            approvalGate.deliver(decision);
            return advance(lease, thread);
        }
    }

    @Override
    public TurnResult submitFeedback(String threadId, String feedback) {
        try (ThreadLease lease = checkpointService.acquire(threadId)) {
            ConversationThread thread = checkpointService.load(threadId);
            if (thread.getPhase() != TurnPhase.HUMAN_INTERVENING) {
                throw new IllegalStateException("Thread " + threadId + " is not awaiting feedback (phase "
                        + thread.getPhase() + ")");
            }
            confirmationPort.deliverFeedback(threadId, feedback != null ? feedback : "");
            return advance(lease, thread);
        }
    }

    @Override
    public TurnResult resume(String threadId) {
        try (ThreadLease lease = checkpointService.acquire(threadId)) {
            ConversationThread thread = checkpointService.load(threadId);
            log.info("[Turn] Resuming thread {} from phase {}", threadId, thread.getPhase());
            return advance(lease, thread);
        }
    }

    @Override
    public ConversationThread getThread(String threadId) {
        return checkpointService.load(threadId);
    }

    @Override
    public void deleteThread(String threadId) {
        checkpointService.delete(threadId);
    }

    // ==================== state machine ====================

    private TurnResult advance(ThreadLease lease, ConversationThread thread) {
        while (true) {
            checkCancelled(thread);
            log.debug("[Turn] Thread {} in phase {}", thread.getThreadId(), thread.getPhase());
            switch (thread.getPhase()) {
            case MODEL_INVOKING -> invokeModel(lease, thread);
            case DISPATCHING -> dispatch(lease, thread);
            case APPROVING -> {
                if (!awaitApprovals(lease, thread)) {
                    return suspended(thread);
                }
            }
            case HUMAN_INTERVENING -> {
                if (!awaitFeedback(lease, thread)) {
                    return suspended(thread);
                }
            }
            case DONE, AWAITING_USER_INPUT -> {
                return finished(thread);
            }
            default -> throw new IllegalStateException("Unexpected phase " + thread.getPhase());
            }
        }
    }

    private void invokeModel(ThreadLease lease, ConversationThread thread) {
        LlmRequest request = LlmRequest.builder()
                .threadId(thread.getThreadId())
                .messages(new ArrayList<>(thread.getMessages()))
                .capabilities(registry.definitions())
                .build();

        LlmResponse response = callModel(thread, request);
        checkCancelled(thread);

        if (response.isFinalAnswer()) {
            historyWriter.appendFinalAnswer(thread, response.getContent());
            thread.setPhase(TurnPhase.DONE);
            save(lease, thread);
            log.info("[Turn] Thread {} done after {} round trip(s)", thread.getThreadId(), thread.getRoundTrips());
            return;
        }

        if (thread.getRoundTrips() >= maxRoundTrips) {
            log.warn("[Turn] Thread {} requested more invocations after {} round trips, stopping",
                    thread.getThreadId(), thread.getRoundTrips());
            throw new RunawayLoopException(thread.getThreadId(), maxRoundTrips);
        }

        List<InvocationRequest> invocations = normalizeInvocations(thread, response.getInvocations());
        thread.setRoundTrips(thread.getRoundTrips() + 1);
        historyWriter.appendInvocationRequests(thread, response.getContent(), invocations);
        thread.clearRound();
        thread.setPendingInvocations(new ArrayList<>(invocations));
        thread.setPhase(TurnPhase.DISPATCHING);
        save(lease, thread);
        log.debug("[Turn] Thread {} round {}: {} invocation(s) requested", thread.getThreadId(),
                thread.getRoundTrips(), invocations.size());
    }

    private void dispatch(ThreadLease lease, ConversationThread thread) {
        for (InvocationRequest invocation : thread.getPendingInvocations()) {
            if (!thread.hasDecision(invocation.getId())
                    && !approvalGate.requiresConfirmation(invocation.getCapabilityName())) {
                thread.recordDecision(decisionFor(invocation,
                        approvalGate.decide(thread.getThreadId(), invocation).join()));
            }
        }

        if (hasUndecided(thread)) {
            thread.setPhase(TurnPhase.APPROVING);
            save(lease, thread);
            return;
        }

        boolean anyRejected = anyRejected(thread);
        executeRound(lease, thread);
        thread.setPhase(anyRejected ? TurnPhase.HUMAN_INTERVENING : TurnPhase.MODEL_INVOKING);
        save(lease, thread);
    }

    /**
     * @return false when the thread must suspend waiting for decisions
     */
    private boolean awaitApprovals(ThreadLease lease, ConversationThread thread) {
        Map<InvocationRequest, CompletableFuture<ApprovalDecision>> requests = new LinkedHashMap<>();
        for (InvocationRequest invocation : thread.getPendingInvocations()) {
            if (!thread.hasDecision(invocation.getId())) {
                requests.put(invocation, approvalGate.decide(thread.getThreadId(), invocation));
            }
        }

        boolean interactive = approvalGate.isInteractive();
        for (Map.Entry<InvocationRequest, CompletableFuture<ApprovalDecision>> entry : requests.entrySet()) {
            InvocationRequest invocation = entry.getKey();
            CompletableFuture<ApprovalDecision> future = entry.getValue();
            if (!interactive && !future.isDone()) {
                continue;
            }
            ApprovalDecision decision = decisionFor(invocation, await(thread, future));
            thread.recordDecision(decision);
            save(lease, thread);
            if (!decision.isApproved()) {
                log.warn("[Turn] Thread {}: '{}' ({}) rejected: {}", thread.getThreadId(),
                        invocation.getCapabilityName(), invocation.getId(), decision.getHumanFeedback());
            }
        }

        if (hasUndecided(thread)) {
            log.info("[Turn] Thread {} suspended awaiting approval", thread.getThreadId());
            return false;
        }

        if (anyRejected(thread)) {
            executeRound(lease, thread);
            thread.setPhase(TurnPhase.HUMAN_INTERVENING);
        } else {
            thread.setPhase(TurnPhase.DISPATCHING);
        }
        save(lease, thread);
        return true;
    }

    /**
     * @return false when the thread must suspend waiting for feedback
     */
    private boolean awaitFeedback(ThreadLease lease, ConversationThread thread) {
        CompletableFuture<String> future = confirmationPort.requestFeedback(thread.getThreadId(),
                feedbackPrompt(thread));
        if (!confirmationPort.isInteractive() && !future.isDone()) {
            log.info("[Turn] Thread {} suspended awaiting feedback", thread.getThreadId());
            return false;
        }

        String feedback;
        try {
            feedback = await(thread, future);
        } catch (CompletionFailure e) {
            log.warn("[Turn] Thread {}: feedback request failed: {}", thread.getThreadId(), e.getMessage());
            feedback = null;
        }
        historyWriter.appendUserMessage(thread, feedback != null && !feedback.isBlank() ? feedback : EMPTY_FEEDBACK);
        thread.setPhase(TurnPhase.MODEL_INVOKING);
        save(lease, thread);
        log.info("[Turn] Thread {}: feedback received", thread.getThreadId());
        return true;
    }

    /**
     * Executes approved invocations and records rejections for the rest, then
     * appends the whole round in request order. Invocations that already have
     * a recorded result are never executed again.
     */
    private void executeRound(ThreadLease lease, ConversationThread thread) {
        for (InvocationRequest invocation : thread.getPendingInvocations()) {
            if (thread.hasResult(invocation.getId())) {
                continue;
            }
            ApprovalDecision decision = thread.getDecisions().get(invocation.getId());
            Message result;
            if (decision != null && decision.isApproved()) {
                checkCancelled(thread);
                CapabilityResult outcome = registry.execute(invocation.getCapabilityName(),
                        invocation.getArguments());
                result = historyWriter.buildResult(invocation, outcome);
            } else {
                result = historyWriter.buildRejection(invocation, decision);
            }
            thread.recordResult(result);
            save(lease, thread);
        }
        historyWriter.appendRoundResults(thread);
    }

    // ==================== helpers ====================

    private LlmResponse callModel(ConversationThread thread, LlmRequest request) {
        CompletableFuture<LlmResponse> future = llmPort.converse(request);
        try {
            LlmResponse response = future.get();
            if (response == null) {
                throw new LlmGatewayException("Language model returned no response", null);
            }
            return response;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TurnCancelledException(thread.getThreadId());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Turn] Thread {}: language model call failed", thread.getThreadId(), cause);
            throw new LlmGatewayException("Language model call failed: " + cause.getMessage(), cause);
        }
    }

    private <T> T await(ConversationThread thread, Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnCancelledException(thread.getThreadId());
        } catch (ExecutionException e) {
            throw new CompletionFailure(e.getCause() != null ? e.getCause() : e);
        }
    }

    private ApprovalDecision decisionFor(InvocationRequest invocation, ApprovalDecision decision) {
        if (decision == null) {
            return ApprovalDecision.noResponse(invocation.getId());
        }
        return new ApprovalDecision(invocation.getId(), decision.isApproved(), decision.getHumanFeedback());
    }

    private List<InvocationRequest> normalizeInvocations(ConversationThread thread,
            List<InvocationRequest> invocations) {
        Set<String> seen = new HashSet<>();
        for (Message message : thread.getMessages()) {
            if (message.getInvocationId() != null) {
                seen.add(message.getInvocationId());
            }
        }
        List<InvocationRequest> normalized = new ArrayList<>();
        for (InvocationRequest invocation : invocations) {
            String id = invocation.getId();
            if (id == null || id.isBlank() || !seen.add(id)) {
                id = "inv-" + UUID.randomUUID();
                seen.add(id);
            }
            normalized.add(InvocationRequest.builder()
                    .id(id)
                    .capabilityName(invocation.getCapabilityName())
                    .arguments(invocation.getArguments() != null
                            ? new LinkedHashMap<>(invocation.getArguments())
                            : new LinkedHashMap<>())
                    .build());
        }
        return normalized;
    }

    private boolean hasUndecided(ConversationThread thread) {
        return thread.getPendingInvocations().stream()
                .anyMatch(invocation -> !thread.hasDecision(invocation.getId()));
    }

    private boolean anyRejected(ConversationThread thread) {
        return thread.getDecisions().values().stream().anyMatch(decision -> !decision.isApproved());
    }

    private String feedbackPrompt(ConversationThread thread) {
        List<String> rejected = new ArrayList<>();
        for (Message message : thread.getMessages()) {
            if (message.isRejection()) {
                rejected.add(message.getCapabilityName());
            }
        }
        String last = rejected.isEmpty() ? "the action" : rejected.get(rejected.size() - 1);
        return "You rejected " + last + ". What should I do instead?";
    }

    private ConversationThread newThread(String threadId) {
        ConversationThread thread = ConversationThread.builder()
                .threadId(threadId)
                .phase(TurnPhase.AWAITING_USER_INPUT)
                .build();
        historyWriter.appendSystemPrompt(thread, prompts.systemPrompt());
        log.info("[Turn] Created thread {}", threadId);
        return thread;
    }

    private void startTurn(ConversationThread thread, String text) {
        thread.setRoundTrips(0);
        thread.clearRound();
        historyWriter.appendUserMessage(thread, prompts.decorateUserMessage(text));
        thread.setPhase(TurnPhase.MODEL_INVOKING);
    }

    private void save(ThreadLease lease, ConversationThread thread) {
        checkpointService.save(lease, thread);
    }

    private void checkCancelled(ConversationThread thread) {
        if (Thread.currentThread().isInterrupted()) {
            log.info("[Turn] Thread {} cancelled in phase {}", thread.getThreadId(), thread.getPhase());
            throw new TurnCancelledException(thread.getThreadId());
        }
    }

    private TurnResult suspended(ConversationThread thread) {
        List<PendingApproval> pending = new ArrayList<>();
        if (thread.getPhase() == TurnPhase.APPROVING) {
            for (InvocationRequest invocation : thread.getPendingInvocations()) {
                if (!thread.hasDecision(invocation.getId())) {
                    pending.add(new PendingApproval(invocation.getId(), invocation.getCapabilityName(),
                            invocation.getArguments(), approvalGate.describeAction(invocation)));
                }
            }
        }
        return new TurnResult(thread.getThreadId(), thread.getPhase(), null, thread.getRoundTrips(), pending, true);
    }

    private TurnResult finished(ConversationThread thread) {
        String answer = thread.getPhase() == TurnPhase.DONE ? thread.lastAnswer().orElse(null) : null;
        return new TurnResult(thread.getThreadId(), thread.getPhase(), answer, thread.getRoundTrips(), List.of(),
                false);
    }

    /**
     * A human-facing future completed exceptionally.
     */
    private static final class CompletionFailure extends RuntimeException {

        private static final long serialVersionUID = 1L;

        CompletionFailure(Throwable cause) {
            super(cause.getMessage(), cause);
        }
    }
}
