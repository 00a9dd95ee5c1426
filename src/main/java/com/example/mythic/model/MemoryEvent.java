package com.example.mythic.model;

import com.google.gson.JsonObject;

import java.time.Instant;

/**
 * Long-term narrative memory entry consumed by the narration layer.
 */
public record MemoryEvent(String campaignId, String playerId, String category, int severity,
                          JsonObject payload, Instant createdAt) {

    public MemoryEvent {
        severity = Math.max(1, Math.min(5, severity));
        payload = payload == null ? new JsonObject() : payload.deepCopy();
    }
}
