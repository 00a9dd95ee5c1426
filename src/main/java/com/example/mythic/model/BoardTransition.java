package com.example.mythic.model;

import com.google.gson.JsonObject;

import java.time.Instant;

public record BoardTransition(String campaignId, BoardType fromBoardType, BoardType toBoardType,
                              String reason, String animation, JsonObject payload, Instant createdAt) {

    public BoardTransition {
        payload = payload == null ? new JsonObject() : payload.deepCopy();
    }
}
