package com.example.mythic.model;

import java.time.Instant;

/**
 * One combat encounter inside a campaign.
 * The turn pointer and status are the mutual-exclusion anchor for turn resolution.
 */
public class CombatSession {

    private final String id;
    private final String campaignId;
    private final int seed;
    private SessionStatus status;
    private int currentTurnIndex;
    private Instant updatedAt;

    public CombatSession(String id, String campaignId, int seed, SessionStatus status,
                         int currentTurnIndex, Instant updatedAt) {
        this.id = id;
        this.campaignId = campaignId;
        this.seed = seed;
        this.status = status;
        this.currentTurnIndex = currentTurnIndex;
        this.updatedAt = updatedAt;
    }

    public String getId() { return id; }
    public String getCampaignId() { return campaignId; }
    public int getSeed() { return seed; }

    public SessionStatus getStatus() { return status; }
    public void setStatus(SessionStatus status) { this.status = status; }

    public boolean isActive() { return status == SessionStatus.ACTIVE; }

    public int getCurrentTurnIndex() { return currentTurnIndex; }
    public void setCurrentTurnIndex(int currentTurnIndex) { this.currentTurnIndex = currentTurnIndex; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public CombatSession copy() {
        return new CombatSession(id, campaignId, seed, status, currentTurnIndex, updatedAt);
    }

    @Override
    public String toString() {
        return String.format("CombatSession[%s %s turn=%d]", id, status.getKey(), currentTurnIndex);
    }
}
