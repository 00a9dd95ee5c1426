package com.example.mythic.model;

import com.google.gson.JsonObject;

import java.time.Instant;

/**
 * Append-only record of a single reputation change, written before the aggregate is upserted.
 */
public record ReputationEvent(String campaignId, String factionId, String playerId,
                              int severity, int delta, JsonObject evidence, Instant createdAt) {

    public ReputationEvent {
        severity = Math.max(1, Math.min(5, severity));
        delta = FactionReputation.clamp(delta);
        evidence = evidence == null ? new JsonObject() : evidence.deepCopy();
    }
}
