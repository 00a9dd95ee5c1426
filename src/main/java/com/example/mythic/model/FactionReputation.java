package com.example.mythic.model;

/**
 * Aggregate reputation of one player with one faction in a campaign, clamped to [-1000, 1000].
 */
public record FactionReputation(String campaignId, String factionId, String playerId, int rep) {

    public static final int MIN_REP = -1000;
    public static final int MAX_REP = 1000;

    public FactionReputation {
        rep = clamp(rep);
    }

    public static int clamp(int value) {
        return Math.max(MIN_REP, Math.min(MAX_REP, value));
    }
}
