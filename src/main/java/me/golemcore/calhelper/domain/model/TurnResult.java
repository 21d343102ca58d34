package me.golemcore.calhelper.domain.model;

import java.util.List;

/**
 * Outcome of advancing a thread: either the turn finished ({@link TurnPhase#DONE}
 * with a final answer) or it suspended waiting for a human.
 *
 * @param threadId
 *            thread identifier
 * @param phase
 *            phase the thread was left in
 * @param finalAnswer
 *            assistant answer when the turn finished, otherwise null
 * @param roundTrips
 *            dispatch rounds taken in the current user turn
 * @param pendingApprovals
 *            invocations awaiting a decision when suspended in approval
 * @param suspended
 *            true when the thread waits for a decision or feedback
 */
public record TurnResult(String threadId, TurnPhase phase, String finalAnswer, int roundTrips,
        List<PendingApproval> pendingApprovals, boolean suspended) {

    public TurnResult {
        pendingApprovals = pendingApprovals == null ? List.of() : List.copyOf(pendingApprovals);
    }

    public boolean isDone() {
        return phase == TurnPhase.DONE;
    }

    public boolean awaitsFeedback() {
        return phase == TurnPhase.HUMAN_INTERVENING;
    }
}
