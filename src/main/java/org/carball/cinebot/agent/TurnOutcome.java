package org.carball.cinebot.agent;

public enum TurnOutcome {
    ANSWERED,
    ANSWERED_FROM_MEMORY,
    STEP_BUDGET_EXCEEDED,
    FAILED
}
