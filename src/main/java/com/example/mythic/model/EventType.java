package com.example.mythic.model;

/**
 * Types of records in the append-only combat event log.
 */
public enum EventType {
    COMBAT_START("combat_start"),
    TURN_START("turn_start"),
    SKILL_USED("skill_used"),
    DAMAGE("damage"),
    STATUS_APPLIED("status_applied"),
    STATUS_TICK("status_tick"),
    STATUS_EXPIRED("status_expired"),
    POWER_GAIN("power_gain"),
    PHASE_SHIFT("phase_shift"),
    DEATH("death"),
    XP_GAIN("xp_gain"),
    LOOT_DROP("loot_drop"),
    TURN_END("turn_end"),
    COMBAT_END("combat_end"),
    BOARD_TRANSITION("board_transition");

    private final String key;

    EventType(String key) {
        this.key = key;
    }

    /** Wire name used in the log and by narration consumers */
    public String getKey() {
        return key;
    }

    public static EventType fromKey(String key) {
        for (EventType type : values()) {
            if (type.key.equals(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + key);
    }
}
