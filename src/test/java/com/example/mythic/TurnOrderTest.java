package com.example.mythic;

import com.example.mythic.combat.CombatIntegrityException;
import com.example.mythic.combat.TurnOrder;
import com.example.mythic.model.TurnSlot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TurnOrder Tests")
class TurnOrderTest {

    private static TurnOrder order(String... ids) {
        List<TurnSlot> slots = new ArrayList<>();
        for (int i = 0; i < ids.length; i++) {
            slots.add(new TurnSlot(i, ids[i]));
        }
        return new TurnOrder("s1", slots);
    }

    @Test
    @DisplayName("Empty turn order is an integrity error")
    void emptyOrderRejected() {
        CombatIntegrityException e = assertThrows(CombatIntegrityException.class, () -> new TurnOrder("s1", List.of()));
        assertEquals("s1", e.getCombatSessionId());
    }

    @Test
    @DisplayName("Duplicate combatants are an integrity error")
    void duplicateRejected() {
        assertThrows(CombatIntegrityException.class,
            () -> new TurnOrder("s1", List.of(new TurnSlot(0, "a"), new TurnSlot(1, "a"))));
    }

    @Test
    @DisplayName("Slots are ordered by turn index regardless of input order")
    void sortsByIndex() {
        TurnOrder order = new TurnOrder("s1", List.of(new TurnSlot(2, "c"), new TurnSlot(0, "a"), new TurnSlot(1, "b")));
        assertEquals("a", order.combatantAt(0));
        assertEquals("c", order.combatantAt(2));
        assertEquals(3, order.size());
    }

    @Test
    @DisplayName("Next alive index skips the dead and wraps around")
    void nextAliveWraps() {
        TurnOrder order = order("a", "b", "c", "d");
        assertEquals(3, order.nextAliveIndex(1, Set.of("a", "d")));
        assertEquals(0, order.nextAliveIndex(3, Set.of("a", "d")));
    }

    @Test
    @DisplayName("Start index is returned only when no one else is alive")
    void startIndexOnlyWhenAlone() {
        TurnOrder order = order("a", "b", "c");
        assertEquals(1, order.nextAliveIndex(1, Set.of("b")));
        assertEquals(1, order.nextAliveIndex(1, Set.of()));
        assertEquals(2, order.nextAliveIndex(1, Set.of("b", "c")));
    }

    @Test
    @DisplayName("Result of nextAliveIndex is always part of the order")
    void closure() {
        TurnOrder order = new TurnOrder("s1", List.of(new TurnSlot(3, "a"), new TurnSlot(7, "b"), new TurnSlot(9, "c")));
        for (int start : new int[] {3, 7, 9}) {
            assertTrue(order.contains(order.nextAliveIndex(start, Set.of("a", "c"))));
            assertTrue(order.contains(order.nextAliveIndex(start, Set.of())));
        }
    }

    @Test
    @DisplayName("Unknown turn index is an integrity error")
    void unknownIndex() {
        TurnOrder order = order("a", "b");
        assertThrows(CombatIntegrityException.class, () -> order.combatantAt(5));
        assertThrows(CombatIntegrityException.class, () -> order.nextAliveIndex(5, Set.of("a")));
        assertFalse(order.contains(5));
    }
}
