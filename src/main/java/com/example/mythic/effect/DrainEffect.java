package com.example.mythic.effect;

/**
 * A status with both periodic fields set. Its damage and its healing are reported
 * separately and summed with every other status on the tick.
 */
public class DrainEffect implements EffectHandler {

    private final DotEffect damage = new DotEffect();
    private final HotEffect heal = new HotEffect();

    @Override
    public double periodicDamage(StatusEffect status, TickPhase phase) {
        return damage.periodicDamage(status, phase);
    }

    @Override
    public double periodicHeal(StatusEffect status, TickPhase phase) {
        return heal.periodicHeal(status, phase);
    }
}
