package com.example.mythic.effect;

/**
 * Handles one kind of status effect during a tick.
 */
public interface EffectHandler {

    /**
     * Damage this status deals to its bearer on the given hook (before rounding).
     */
    default double periodicDamage(StatusEffect status, TickPhase phase) { return 0; }

    /**
     * Healing this status grants its bearer on the given hook (before rounding).
     */
    default double periodicHeal(StatusEffect status, TickPhase phase) { return 0; }
}
