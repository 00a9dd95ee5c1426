package com.example.mythic.model;

import com.google.gson.JsonObject;

import java.time.Instant;

/**
 * An event that has been decided but not yet appended to the log.
 */
public final class ActionEventDraft {

    private final String combatSessionId;
    private final int turnIndex;
    private final String actorCombatantId;
    private final EventType type;
    private final JsonObject payload;
    private final Instant createdAt;

    public ActionEventDraft(String combatSessionId, int turnIndex, String actorCombatantId,
                            EventType type, JsonObject payload, Instant createdAt) {
        this.combatSessionId = combatSessionId;
        this.turnIndex = Math.max(0, turnIndex);
        this.actorCombatantId = actorCombatantId;
        this.type = type;
        this.payload = payload == null ? new JsonObject() : payload.deepCopy();
        this.createdAt = createdAt;
    }

    public String getCombatSessionId() { return combatSessionId; }
    public int getTurnIndex() { return turnIndex; }
    public String getActorCombatantId() { return actorCombatantId; }
    public EventType getType() { return type; }
    public JsonObject getPayload() { return payload.deepCopy(); }
    public Instant getCreatedAt() { return createdAt; }

    /**
     * Materialize the draft with the id assigned by the store.
     */
    public ActionEvent toEvent(long id) {
        return new ActionEvent(id, combatSessionId, turnIndex, actorCombatantId, type, payload, createdAt);
    }
}
