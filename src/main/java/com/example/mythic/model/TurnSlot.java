package com.example.mythic.model;

/**
 * One (turn index, combatant) pair of a session's fixed turn order.
 */
public record TurnSlot(int turnIndex, String combatantId) {
}
