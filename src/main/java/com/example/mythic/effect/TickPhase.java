package com.example.mythic.effect;

/**
 * The two per-turn hook points of the status processor.
 */
public enum TickPhase {
    START("start"),
    END("end");

    private final String key;

    TickPhase(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
