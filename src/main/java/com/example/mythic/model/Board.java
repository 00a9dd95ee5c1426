package com.example.mythic.model;

import java.time.Instant;

public class Board {

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_ARCHIVED = "archived";

    private final String id;
    private final String campaignId;
    private final BoardType boardType;
    private String status;
    /** Set only for combat boards */
    private final String combatSessionId;
    private Instant updatedAt;

    public Board(String id, String campaignId, BoardType boardType, String status,
                 String combatSessionId, Instant updatedAt) {
        this.id = id;
        this.campaignId = campaignId;
        this.boardType = boardType;
        this.status = status;
        this.combatSessionId = combatSessionId;
        this.updatedAt = updatedAt;
    }

    public String getId() { return id; }
    public String getCampaignId() { return campaignId; }
    public BoardType getBoardType() { return boardType; }
    public String getCombatSessionId() { return combatSessionId; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Board copy() {
        return new Board(id, campaignId, boardType, status, combatSessionId, updatedAt);
    }
}
