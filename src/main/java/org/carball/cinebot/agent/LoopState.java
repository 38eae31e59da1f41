package org.carball.cinebot.agent;

/**
 * States of one turn. ERROR is reachable from any state and, like FINALIZING, leads to DONE.
 */
public enum LoopState {
    AWAITING_MODEL_DECISION,
    EXECUTING_TOOLS,
    FINALIZING,
    ERROR,
    DONE
}
