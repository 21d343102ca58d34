package me.golemcore.calhelper.domain.turn;

import me.golemcore.calhelper.domain.model.ApprovalDecision;
import me.golemcore.calhelper.domain.model.ConversationThread;
import me.golemcore.calhelper.domain.model.TurnResult;

/**
 * Per-thread conversation loop: model call, optional capability dispatch and
 * approval, model call again, until a final answer or a suspension.
 *
 * <p>
 * Every operation runs under the thread's single-writer lease and returns once
 * the thread reaches {@code DONE} or suspends in {@code APPROVING} /
 * {@code HUMAN_INTERVENING}. Turn-fatal errors (runaway loop, busy thread,
 * checkpoint failure, gateway failure, cancellation) are thrown; the stored
 * thread stays at its last saved state.
 */
public interface TurnController {

    /**
     * Starts a new user turn. Creates the thread on first message.
     *
     * @param threadId
     *            thread identifier, or null to generate one
     * @param text
     *            user input
     */
    TurnResult submitUserMessage(String threadId, String text);

    /**
     * Delivers an approval decision and continues a thread suspended in
     * approval.
     */
    TurnResult submitDecision(String threadId, ApprovalDecision decision);

    /**
     * Delivers free-text feedback and continues a thread suspended for human
     * intervention.
     */
    TurnResult submitFeedback(String threadId, String feedback);

    /**
     * Continues from whatever phase was last checkpointed.
     */
    TurnResult resume(String threadId);

    ConversationThread getThread(String threadId);

    void deleteThread(String threadId);
}
