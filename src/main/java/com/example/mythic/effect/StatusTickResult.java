package com.example.mythic.effect;

import com.example.mythic.model.ActionEventDraft;
import com.example.mythic.model.Combatant;

import java.util.List;

/**
 * Outcome of one status tick on one combatant. The caller persists {@link #getCombatant()}
 * and appends {@link #getEvents()} in order.
 */
public class StatusTickResult {

    private final Combatant combatant;
    private final int dotDamage;
    private final int hotHeal;
    private final List<StatusEffect> expired;
    private final boolean died;
    private final List<ActionEventDraft> events;

    StatusTickResult(Combatant combatant, int dotDamage, int hotHeal, List<StatusEffect> expired,
                     boolean died, List<ActionEventDraft> events) {
        this.combatant = combatant;
        this.dotDamage = dotDamage;
        this.hotHeal = hotHeal;
        this.expired = List.copyOf(expired);
        this.died = died;
        this.events = List.copyOf(events);
    }

    public Combatant getCombatant() { return combatant; }
    public int getDotDamage() { return dotDamage; }
    public int getHotHeal() { return hotHeal; }
    public List<StatusEffect> getExpired() { return expired; }

    /** True only when the combatant was alive before the tick and is not after it */
    public boolean isDied() { return died; }

    public List<ActionEventDraft> getEvents() { return events; }

    /** True when nothing about the combatant changed */
    public boolean isNoop() {
        return dotDamage == 0 && hotHeal == 0 && expired.isEmpty();
    }
}
