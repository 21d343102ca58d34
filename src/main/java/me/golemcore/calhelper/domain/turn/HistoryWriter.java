package me.golemcore.calhelper.domain.turn;

import me.golemcore.calhelper.domain.model.ApprovalDecision;
import me.golemcore.calhelper.domain.model.CapabilityResult;
import me.golemcore.calhelper.domain.model.ConversationThread;
import me.golemcore.calhelper.domain.model.InvocationRequest;
import me.golemcore.calhelper.domain.model.Message;

import java.util.List;

/**
 * Single point of mutation for thread history during a turn.
 *
 * <p>
 * The turn controller should not write messages directly.
 */
public interface HistoryWriter {

    void appendSystemPrompt(ConversationThread thread, String prompt);

    void appendUserMessage(ConversationThread thread, String text);

    /**
     * Appends one invocation request message per invocation, in request order.
     * Assistant text returned alongside the invocations is kept on the first
     * request message.
     */
    void appendInvocationRequests(ConversationThread thread, String assistantText,
            List<InvocationRequest> invocations);

    void appendFinalAnswer(ConversationThread thread, String text);

    Message buildResult(InvocationRequest invocation, CapabilityResult result);

    Message buildRejection(InvocationRequest invocation, ApprovalDecision decision);

    /**
     * Appends the results of the current round in request order and clears the
     * round's scratch fields.
     *
     * @throws IllegalStateException
     *             if any pending invocation has no result yet
     */
    void appendRoundResults(ConversationThread thread);
}
