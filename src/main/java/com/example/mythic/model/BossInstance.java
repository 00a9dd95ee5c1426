package com.example.mythic.model;

/**
 * Links an NPC combatant to a boss template and tracks its current phase.
 * The phase never decreases within one combat.
 */
public class BossInstance {

    private final String id;
    private final String combatSessionId;
    private final String combatantId;
    private final String templateId;
    private int currentPhase;
    private final Integer enrageTurn;

    public BossInstance(String id, String combatSessionId, String combatantId, String templateId,
                        int currentPhase, Integer enrageTurn) {
        this.id = id;
        this.combatSessionId = combatSessionId;
        this.combatantId = combatantId;
        this.templateId = templateId;
        this.currentPhase = currentPhase;
        this.enrageTurn = enrageTurn;
    }

    public String getId() { return id; }
    public String getCombatSessionId() { return combatSessionId; }
    public String getCombatantId() { return combatantId; }
    public String getTemplateId() { return templateId; }
    public Integer getEnrageTurn() { return enrageTurn; }

    public int getCurrentPhase() { return currentPhase; }

    public void setCurrentPhase(int currentPhase) {
        if (currentPhase < this.currentPhase) {
            throw new IllegalArgumentException("Boss phase cannot regress from " + this.currentPhase + " to " + currentPhase);
        }
        this.currentPhase = currentPhase;
    }

    public BossInstance copy() {
        return new BossInstance(id, combatSessionId, combatantId, templateId, currentPhase, enrageTurn);
    }
}
