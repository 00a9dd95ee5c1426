package com.example.mythic.combat;

/**
 * Where a resolution call stopped.
 */
public enum ResolutionState {

    /** No active session to resolve */
    IDLE("Idle"),

    /** Loop still driving steps */
    RESOLVING("Resolving"),

    /** The current actor is a player; an external decision is required */
    AWAITING_PLAYER("Awaiting player"),

    /** Combat has ended (in this call or an earlier one) */
    ENDED("Ended"),

    /** Step budget used up with the session still active */
    BUDGET_EXHAUSTED("Budget exhausted"),

    /** Another resolver or a player action moved the session first; stopped without writing */
    SUPERSEDED("Superseded");

    private final String displayName;

    ResolutionState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
