package com.example.mythic.effect;

/**
 * Damage-over-time: {@code data.damage_per_turn * stacks} at the start of the bearer's turn.
 */
public class DotEffect implements EffectHandler {

    @Override
    public double periodicDamage(StatusEffect status, TickPhase phase) {
        if (phase != TickPhase.START) return 0;
        double perTurn = status.getDamagePerTurn();
        return perTurn > 0 ? perTurn * status.getStacks() : 0;
    }
}
