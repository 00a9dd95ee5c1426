package com.example.mythic;

import com.example.mythic.model.ActionEvent;
import com.example.mythic.model.Board;
import com.example.mythic.model.BoardType;
import com.example.mythic.model.CombatSession;
import com.example.mythic.model.Combatant;
import com.example.mythic.model.EntityKind;
import com.example.mythic.model.SessionStatus;
import com.example.mythic.persistence.CombatSeeder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * Shared builders for engine and settlement tests.
 */
final class CombatFixtures {

    static final String CAMPAIGN = "camp-1";
    static final String SESSION = "combat-1";
    static final int SEED = 1337;
    static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private CombatFixtures() { }

    static Combatant.Builder player(String id) {
        return Combatant.builder(id, SESSION)
            .kind(EntityKind.PLAYER)
            .playerId("user-" + id)
            .characterId("char-" + id)
            .name(id)
            .level(5)
            .offense(30)
            .defense(20)
            .weaponPower(10)
            .hp(100, 100);
    }

    static Combatant.Builder npc(String id) {
        return Combatant.builder(id, SESSION)
            .kind(EntityKind.NPC)
            .name(id)
            .level(1)
            .offense(10)
            .weaponPower(5)
            .hp(50, 50);
    }

    static Combatant.Builder companion(String id, String ownerPlayerId) {
        return Combatant.builder(id, SESSION)
            .kind(EntityKind.SUMMON)
            .playerId(ownerPlayerId)
            .name(id)
            .level(3)
            .offense(20)
            .defense(30)
            .support(20)
            .utility(25)
            .weaponPower(6)
            .hp(60, 60)
            .power(30, 30);
    }

    /**
     * Seed an active session at turn index 0 with the given combatants, in turn order.
     */
    static void seed(CombatSeeder seeder, Combatant... combatants) {
        seeder.insertSession(new CombatSession(SESSION, CAMPAIGN, SEED, SessionStatus.ACTIVE, 0, NOW));
        for (Combatant c : combatants) {
            seeder.insertCombatant(c);
        }
        seeder.insertTurnOrder(SESSION, Arrays.stream(combatants).map(Combatant::getId).toList());
    }

    /**
     * A town board the campaign left to fight, plus the active combat board.
     */
    static void seedBoards(CombatSeeder seeder) {
        seeder.insertBoard(new Board("board-town", CAMPAIGN, BoardType.TOWN, Board.STATUS_ARCHIVED, null,
            NOW.minusSeconds(600)));
        seeder.insertBoard(new Board("board-combat", CAMPAIGN, BoardType.COMBAT, Board.STATUS_ACTIVE, SESSION,
            NOW.minusSeconds(60)));
    }

    static List<String> types(List<ActionEvent> events) {
        return events.stream().map(e -> e.getType().getKey()).toList();
    }
}
