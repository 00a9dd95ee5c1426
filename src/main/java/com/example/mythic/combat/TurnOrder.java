package com.example.mythic.combat;

import com.example.mythic.model.TurnSlot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed cyclic sequence of combatants for one session.
 * Dead combatants stay in the cycle and are skipped when looking for the next actor.
 */
public class TurnOrder {

    private final String combatSessionId;
    private final List<TurnSlot> slots;

    /**
     * @throws CombatIntegrityException if the order is empty or a combatant appears twice
     */
    public TurnOrder(String combatSessionId, List<TurnSlot> slots) {
        this.combatSessionId = combatSessionId;
        if (slots == null || slots.isEmpty()) {
            throw new CombatIntegrityException(combatSessionId, "Turn order is empty");
        }
        List<TurnSlot> sorted = new ArrayList<>(slots);
        sorted.sort(Comparator.comparingInt(TurnSlot::turnIndex));
        Set<Integer> indices = new HashSet<>();
        Set<String> ids = new HashSet<>();
        for (TurnSlot s : sorted) {
            if (!indices.add(s.turnIndex()) || !ids.add(s.combatantId())) {
                throw new CombatIntegrityException(combatSessionId, "Turn order has duplicate entry " + s);
            }
        }
        this.slots = List.copyOf(sorted);
    }

    public int size() {
        return slots.size();
    }

    public boolean contains(int turnIndex) {
        return positionOf(turnIndex) >= 0;
    }

    /**
     * Combatant id at the given turn index.
     * @throws CombatIntegrityException if the index is not part of this order
     */
    public String combatantAt(int turnIndex) {
        int pos = positionOf(turnIndex);
        if (pos < 0) {
            throw new CombatIntegrityException(combatSessionId, "Turn index " + turnIndex + " is not in the turn order");
        }
        return slots.get(pos).combatantId();
    }

    /**
     * Scan the cycle forward from {@code fromIndex} (wrapping) for the next combatant in
     * {@code aliveIds}. The start slot is checked last, so it is returned only when nobody
     * else is alive; if nobody at all is alive, {@code fromIndex} is returned unchanged.
     */
    public int nextAliveIndex(int fromIndex, Set<String> aliveIds) {
        int pos = positionOf(fromIndex);
        if (pos < 0) {
            throw new CombatIntegrityException(combatSessionId, "Turn index " + fromIndex + " is not in the turn order");
        }
        int n = slots.size();
        for (int k = 1; k <= n; k++) {
            TurnSlot candidate = slots.get((pos + k) % n);
            if (aliveIds.contains(candidate.combatantId())) {
                return candidate.turnIndex();
            }
        }
        return fromIndex;
    }

    private int positionOf(int turnIndex) {
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).turnIndex() == turnIndex) {
                return i;
            }
        }
        return -1;
    }
}
