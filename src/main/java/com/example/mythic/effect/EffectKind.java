package com.example.mythic.effect;

import java.util.Locale;
import java.util.Set;

/**
 * Known status effect kinds. Anything that cannot be classified is {@link #UNKNOWN}
 * and is carried along without being interpreted.
 */
public enum EffectKind {
    DAMAGE_OVER_TIME,
    HEAL_OVER_TIME,
    /** Carries both damage_per_turn and heal_per_turn; both apply on the same tick */
    DAMAGE_AND_HEAL_OVER_TIME,
    /** Defensive or offensive markers with no periodic effect (vulnerable, barrier, guard, ...) */
    MARKER,
    UNKNOWN;

    private static final Set<String> DOT_IDS = Set.of("poison", "bleed", "burn", "burning", "corrode", "dot");
    private static final Set<String> HOT_IDS = Set.of("regen", "regeneration", "renew", "hot");
    private static final Set<String> MARKER_IDS = Set.of(
        "vulnerable", "barrier", "guard", "marked", "exposed", "evasive", "haste", "precision", "focused",
        "stunned", "rooted", "blind");

    /**
     * Classify a status. Periodic fields in its data win over the id, so any status
     * carrying {@code damage_per_turn} or {@code heal_per_turn} ticks.
     */
    public static EffectKind classify(StatusEffect status) {
        boolean damages = status.getDamagePerTurn() > 0;
        boolean heals = status.getHealPerTurn() > 0;
        if (damages && heals) return DAMAGE_AND_HEAL_OVER_TIME;
        if (damages) return DAMAGE_OVER_TIME;
        if (heals) return HEAL_OVER_TIME;
        String id = status.getId().toLowerCase(Locale.ROOT);
        if (DOT_IDS.contains(id)) return DAMAGE_OVER_TIME;
        if (HOT_IDS.contains(id)) return HEAL_OVER_TIME;
        if (MARKER_IDS.contains(id)) return MARKER;
        return UNKNOWN;
    }
}
