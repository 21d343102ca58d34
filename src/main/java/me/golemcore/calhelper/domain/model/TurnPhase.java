package me.golemcore.calhelper.domain.model;

/**
 * Phases of the per-thread turn state machine.
 *
 * <pre>
 * AWAITING_USER_INPUT -&gt; MODEL_INVOKING -&gt; {DISPATCHING, DONE}
 * DISPATCHING -&gt; {APPROVING, MODEL_INVOKING}
 * APPROVING -&gt; {DISPATCHING, HUMAN_INTERVENING}
 * HUMAN_INTERVENING -&gt; MODEL_INVOKING
 * </pre>
 */
public enum TurnPhase {

    AWAITING_USER_INPUT,

    MODEL_INVOKING,

    DISPATCHING,

    APPROVING,

    HUMAN_INTERVENING,

    DONE;

    /**
     * Phases in which the thread waits for an external signal.
     */
    public boolean isSuspensionPoint() {
        return this == APPROVING || this == HUMAN_INTERVENING;
    }

    /**
     * Phases in which a new user turn may start.
     */
    public boolean acceptsNewTurn() {
        return this == AWAITING_USER_INPUT || this == DONE;
    }
}
