package com.example.mythic.model;

/**
 * The kind of entity a combatant represents.
 */
public enum EntityKind {

    /** A player character, controlled from outside the engine */
    PLAYER("player"),

    /** A hostile non-player character */
    NPC("npc"),

    /** A summoned companion or minion */
    SUMMON("summon");

    private final String key;

    EntityKind(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Resolve a stored key. Unknown or blank keys are treated as player, which is the
     * only kind the engine never acts for.
     */
    public static EntityKind fromKey(String key) {
        if (key == null) return PLAYER;
        for (EntityKind kind : values()) {
            if (kind.key.equalsIgnoreCase(key.trim())) {
                return kind;
            }
        }
        return PLAYER;
    }
}
