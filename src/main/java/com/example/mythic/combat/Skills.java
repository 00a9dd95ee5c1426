package com.example.mythic.combat;

import com.example.mythic.effect.StatusEffect;
import com.google.gson.JsonObject;

import java.util.Map;

/**
 * Skill ids the engine knows how to resolve, and their multipliers.
 */
public final class Skills {

    public static final String NPC_SWIPE = "npc_swipe";
    public static final String BOSS_STRIKE = "boss_strike";
    public static final String BOSS_EXECUTE = "boss_execute";
    public static final String BOSS_CLEAVE = "boss_cleave";
    public static final String BOSS_MARK = "boss_mark";
    public static final String BOSS_VULN = "boss_vuln";
    public static final String BASIC_ATTACK = "basic_attack";
    public static final String BASIC_DEFEND = "basic_defend";
    public static final String BASIC_RECOVER_MP = "basic_recover_mp";

    public static final String VULNERABLE = "vulnerable";

    /** Target HP fraction at or below which boss_execute hits for full weight */
    public static final double EXECUTE_THRESHOLD = 0.4;

    private static final Map<String, String> NAMES = Map.of(
        NPC_SWIPE, "Savage Swipe",
        BOSS_STRIKE, "Crushing Strike",
        BOSS_EXECUTE, "Execute",
        BOSS_CLEAVE, "Cleave",
        BOSS_MARK, "Hunter's Mark",
        BOSS_VULN, "Expose Weakness",
        BASIC_ATTACK, "Attack",
        BASIC_DEFEND, "Defend",
        BASIC_RECOVER_MP, "Focus"
    );

    private Skills() { }

    public static String nameOf(String skillId) {
        return NAMES.getOrDefault(skillId, skillId);
    }

    /**
     * Damage multiplier for a skill against a target at the given HP fraction.
     */
    public static double multiplierFor(String skillId, double targetHpFraction) {
        switch (skillId) {
            case BOSS_EXECUTE:
                return targetHpFraction <= EXECUTE_THRESHOLD ? 2.0 : 1.3;
            case BOSS_CLEAVE:
                return 1.35;
            case BOSS_MARK:
                return 0.85;
            case BOSS_VULN:
                return 0.95;
            case BASIC_ATTACK:
                return 1.0;
            default:
                return 1.1;
        }
    }

    /** Cleave hits every living opponent at full weight */
    public static boolean isMultiTarget(String skillId) {
        return BOSS_CLEAVE.equals(skillId);
    }

    /**
     * Status a skill leaves on each target it hits, or null.
     */
    public static StatusEffect appliedStatus(String skillId, int turnIndex) {
        if (BOSS_MARK.equals(skillId) || BOSS_VULN.equals(skillId)) {
            JsonObject data = new JsonObject();
            data.addProperty("source", skillId);
            return new StatusEffect(VULNERABLE, turnIndex + 2, 1, data);
        }
        return null;
    }
}
