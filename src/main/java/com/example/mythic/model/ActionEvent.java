package com.example.mythic.model;

import com.google.gson.JsonObject;

import java.time.Instant;

/**
 * An immutable record of the combat event log. Once appended it is never changed;
 * the payload is copied on the way in and on the way out.
 */
public final class ActionEvent {

    /** Store-assigned sequence number, increasing in append order */
    private final long id;
    private final String combatSessionId;
    private final int turnIndex;
    private final String actorCombatantId;
    private final EventType type;
    private final JsonObject payload;
    private final Instant createdAt;

    public ActionEvent(long id, String combatSessionId, int turnIndex, String actorCombatantId,
                       EventType type, JsonObject payload, Instant createdAt) {
        this.id = id;
        this.combatSessionId = combatSessionId;
        this.turnIndex = turnIndex;
        this.actorCombatantId = actorCombatantId;
        this.type = type;
        this.payload = payload == null ? new JsonObject() : payload.deepCopy();
        this.createdAt = createdAt;
    }

    public long getId() { return id; }
    public String getCombatSessionId() { return combatSessionId; }
    public int getTurnIndex() { return turnIndex; }
    public String getActorCombatantId() { return actorCombatantId; }
    public EventType getType() { return type; }
    public JsonObject getPayload() { return payload.deepCopy(); }
    public Instant getCreatedAt() { return createdAt; }

    /** Payload in its canonical serialized form */
    public String getPayloadJson() {
        return payload.toString();
    }

    @Override
    public String toString() {
        return String.format("#%d [T%d] %s %s %s", id, turnIndex, type.getKey(),
            actorCombatantId == null ? "-" : actorCombatantId, payload);
    }
}
