package com.example.mythic.model;

/**
 * Rarity tiers a settlement can award, with their loot budget and item power scale.
 */
public enum LootRarity {
    MAGICAL("magical", 24, 1.8),
    UNIQUE("unique", 24, 1.8),
    LEGENDARY("legendary", 40, 2.6),
    MYTHIC("mythic", 60, 3.4);

    private final String key;
    private final int budgetPoints;
    private final double powerScale;

    LootRarity(String key, int budgetPoints, double powerScale) {
        this.key = key;
        this.budgetPoints = budgetPoints;
        this.powerScale = powerScale;
    }

    public String getKey() { return key; }
    public int getBudgetPoints() { return budgetPoints; }
    public double getPowerScale() { return powerScale; }

    public String getDropTier() {
        switch (this) {
            case MYTHIC: return "mythic";
            case LEGENDARY: return "boss";
            default: return "elite";
        }
    }

    public String getBindPolicy() {
        return this == MAGICAL ? "unbound" : "bind_on_equip";
    }

    public static LootRarity fromKey(String key) {
        for (LootRarity r : values()) {
            if (r.key.equalsIgnoreCase(key)) return r;
        }
        throw new IllegalArgumentException("Unknown loot rarity: " + key);
    }

    public boolean hasDrawback() {
        return this == LEGENDARY || this == MYTHIC;
    }
}
