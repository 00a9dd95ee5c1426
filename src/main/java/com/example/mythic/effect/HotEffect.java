package com.example.mythic.effect;

/**
 * Heal-over-time: {@code data.heal_per_turn * stacks} at the start of the bearer's turn.
 */
public class HotEffect implements EffectHandler {

    @Override
    public double periodicHeal(StatusEffect status, TickPhase phase) {
        if (phase != TickPhase.START) return 0;
        double perTurn = status.getHealPerTurn();
        return perTurn > 0 ? perTurn * status.getStacks() : 0;
    }
}
