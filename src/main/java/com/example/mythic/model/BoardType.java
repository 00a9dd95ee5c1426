package com.example.mythic.model;

/**
 * The broader game-state container a campaign is currently in.
 */
public enum BoardType {
    TOWN("town"),
    TRAVEL("travel"),
    DUNGEON("dungeon"),
    COMBAT("combat");

    private final String key;

    BoardType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static BoardType fromKey(String key) {
        if (key != null) {
            for (BoardType type : values()) {
                if (type.key.equalsIgnoreCase(key.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown board type: " + key);
    }
}
