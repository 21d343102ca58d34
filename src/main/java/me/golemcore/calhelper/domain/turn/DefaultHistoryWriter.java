package me.golemcore.calhelper.domain.turn;

import me.golemcore.calhelper.domain.model.ApprovalDecision;
import me.golemcore.calhelper.domain.model.CapabilityResult;
import me.golemcore.calhelper.domain.model.ConversationThread;
import me.golemcore.calhelper.domain.model.FailureKind;
import me.golemcore.calhelper.domain.model.InvocationRequest;
import me.golemcore.calhelper.domain.model.Message;
import me.golemcore.calhelper.domain.model.MessageKind;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Default implementation writing typed messages into the thread.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    static final String REJECTED_PREFIX = "Rejected by user";

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendSystemPrompt(ConversationThread thread, String prompt) {
        thread.addMessage(message(MessageKind.SYSTEM).content(prompt).build());
    }

    @Override
    public void appendUserMessage(ConversationThread thread, String text) {
        thread.addMessage(message(MessageKind.USER).content(text).build());
    }

    @Override
    public void appendInvocationRequests(ConversationThread thread, String assistantText,
            List<InvocationRequest> invocations) {
        boolean first = true;
        for (InvocationRequest invocation : invocations) {
            thread.addMessage(message(MessageKind.INVOCATION_REQUEST)
                    .content(first ? assistantText : null)
                    .invocation(invocation)
                    .invocationId(invocation.getId())
                    .capabilityName(invocation.getCapabilityName())
                    .build());
            first = false;
        }
    }

    @Override
    public void appendFinalAnswer(ConversationThread thread, String text) {
        thread.addMessage(message(MessageKind.ASSISTANT_TEXT).content(text != null ? text : "").build());
    }

    @Override
    public Message buildResult(InvocationRequest invocation, CapabilityResult result) {
        String content;
        if (result.isSuccess()) {
            content = result.getOutput();
        } else if (result.getOutput() != null && !result.getOutput().isBlank()) {
            content = result.getOutput();
        } else {
            content = "Error: " + result.getError();
        }
        return message(MessageKind.INVOCATION_RESULT)
                .content(content)
                .invocationId(invocation.getId())
                .capabilityName(invocation.getCapabilityName())
                .failed(!result.isSuccess())
                .failureKind(result.isSuccess() ? null : result.getFailureKind())
                .build();
    }

    @Override
    public Message buildRejection(InvocationRequest invocation, ApprovalDecision decision) {
        String feedback = decision != null ? decision.getHumanFeedback() : null;
        String content = feedback != null && !feedback.isBlank()
                ? REJECTED_PREFIX + ": " + feedback
                : REJECTED_PREFIX;
        return message(MessageKind.INVOCATION_RESULT)
                .content(content)
                .invocationId(invocation.getId())
                .capabilityName(invocation.getCapabilityName())
                .failed(true)
                .failureKind(FailureKind.REJECTED)
                .build();
    }

    @Override
    public void appendRoundResults(ConversationThread thread) {
        List<Message> ordered = new ArrayList<>();
        for (InvocationRequest invocation : thread.getPendingInvocations()) {
            Message result = thread.getCompletedResults().get(invocation.getId());
            if (result == null) {
                throw new IllegalStateException("No result recorded for invocation " + invocation.getId());
            }
            ordered.add(result);
        }
        ordered.forEach(thread::addMessage);
        thread.clearRound();
    }

    private Message.MessageBuilder message(MessageKind kind) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .kind(kind)
                .timestamp(now());
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
