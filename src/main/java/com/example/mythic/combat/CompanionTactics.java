package com.example.mythic.combat;

import com.example.mythic.model.Combatant;

/**
 * Action choice for companions (summons fighting on the players' side).
 */
public final class CompanionTactics {

    public enum Action { DEFEND, RECOVER, ATTACK }

    static final double DEFEND_BELOW_HP = 0.35;
    static final double RECOVER_BELOW_POWER = 0.30;

    private CompanionTactics() { }

    /**
     * Defend when badly hurt, recover power when nearly drained, otherwise attack.
     */
    public static Action choose(Combatant companion) {
        if (companion.getHpFraction() <= DEFEND_BELOW_HP) {
            return Action.DEFEND;
        }
        if (companion.getPowerMax() > 0 && companion.getPowerFraction() <= RECOVER_BELOW_POWER) {
            return Action.RECOVER;
        }
        return Action.ATTACK;
    }

    public static int armorGain(Combatant c) {
        return Math.max(4, (int) Math.floor(c.getDefense() * 0.22) + (int) Math.floor(c.getSupport() * 0.12));
    }

    public static int powerGain(Combatant c) {
        return Math.max(6, (int) Math.floor(c.getUtility() * 0.18) + (int) Math.floor(c.getSupport() * 0.12));
    }

    public static String skillFor(Action action) {
        switch (action) {
            case DEFEND: return Skills.BASIC_DEFEND;
            case RECOVER: return Skills.BASIC_RECOVER_MP;
            default: return Skills.BASIC_ATTACK;
        }
    }
}
