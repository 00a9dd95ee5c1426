package com.example.mythic.combat;

/**
 * Stored combat state is structurally broken (empty turn order, turn index not in the
 * order, turn actor missing). Never retried and never repaired by guessing.
 */
public class CombatIntegrityException extends RuntimeException {

    private final String combatSessionId;

    public CombatIntegrityException(String combatSessionId, String message) {
        super(message + " (session " + combatSessionId + ")");
        this.combatSessionId = combatSessionId;
    }

    public String getCombatSessionId() {
        return combatSessionId;
    }
}
