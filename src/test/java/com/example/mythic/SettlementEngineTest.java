package com.example.mythic;

import com.example.mythic.model.CombatSession;
import com.example.mythic.model.ExperienceAward;
import com.example.mythic.model.Faction;
import com.example.mythic.model.FactionReputation;
import com.example.mythic.model.LootRarity;
import com.example.mythic.model.MemoryEvent;
import com.example.mythic.model.ReputationEvent;
import com.example.mythic.model.SessionStatus;
import com.example.mythic.persistence.CombatStore;
import com.example.mythic.persistence.InMemoryCombatStore;
import com.example.mythic.persistence.StoreException;
import com.example.mythic.settlement.SettlementEngine;
import com.example.mythic.settlement.SettlementResult;
import com.example.mythic.settlement.SideEffectResult;
import com.example.mythic.util.DeterministicRng;
import com.example.mythic.util.EngineConfig;
import com.example.mythic.util.LootGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.mythic.CombatFixtures.CAMPAIGN;
import static com.example.mythic.CombatFixtures.NOW;
import static com.example.mythic.CombatFixtures.SESSION;
import static com.example.mythic.CombatFixtures.npc;
import static com.example.mythic.CombatFixtures.player;
import static com.example.mythic.CombatFixtures.types;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SettlementEngine Tests")
class SettlementEngineTest {

    private InMemoryCombatStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCombatStore();
        store.insertFaction(new Faction("wardens", CAMPAIGN, "Wardens", List.of("order")));
    }

    private SettlementEngine settlementFor(CombatStore target) {
        return new SettlementEngine(target, EngineConfig.defaults(), new LootGenerator(new DeterministicRng()));
    }

    private SettlementResult settle(SettlementEngine engine) {
        CombatSession session = store.getSession(SESSION);
        return engine.settle(session, 0, store.getCombatants(SESSION), NOW);
    }

    @Test
    @DisplayName("Victory grants experience, loot, reputation and memory to the survivor")
    void victoryRewards() {
        CombatFixtures.seed(store, player("hero").build(), npc("goblin").hp(0, 50).build());

        SettlementResult result = settle(settlementFor(store));

        assertTrue(result.isSettled());
        assertTrue(result.isWon());
        assertEquals(1, result.getAlivePlayers());
        assertEquals(0, result.getAliveNpcs());
        assertEquals(List.of("combat_end", "xp_gain", "loot_drop"), types(result.getEvents()));
        assertNull(result.getBoardTransition());

        // 180 base + 35 for each of the two combatants, no boss
        assertEquals(250, result.getExperienceByCharacter().get("char-hero").intValue());
        assertEquals(250, store.getExperience("char-hero"));
        assertNull(result.getEvents().get(1).getActorCombatantId());
        assertNull(result.getEvents().get(2).getActorCombatantId());
        assertEquals(1, result.getLoot().size());
        assertEquals(LootRarity.MAGICAL, result.getLoot().get(0).getRarity());
        assertNull(result.getLoot().get(0).getDrawback());
        assertEquals(6, store.getReputation(CAMPAIGN, "wardens", "user-hero").rep());
        assertTrue(result.getFailedSideEffects().isEmpty());
        assertEquals(SessionStatus.ENDED, store.getSession(SESSION).getStatus());
    }

    @Test
    @DisplayName("Second settlement of the same session writes nothing")
    void settlesOnce() {
        CombatFixtures.seed(store, player("hero").build(), npc("goblin").hp(0, 50).build());
        SettlementEngine engine = settlementFor(store);
        CombatSession session = store.getSession(SESSION);

        SettlementResult first = engine.settle(session, 0, store.getCombatants(SESSION), NOW);
        int events = store.getEvents(SESSION).size();
        SettlementResult second = engine.settle(session, 0, store.getCombatants(SESSION), NOW);

        assertTrue(first.isSettled());
        assertFalse(second.isSettled());
        assertTrue(second.getEvents().isEmpty());
        assertEquals(events, store.getEvents(SESSION).size());
        assertEquals(250, store.getExperience("char-hero"));
        assertEquals(1, store.getInventory("char-hero").size());
        assertEquals(1, store.getReputationEvents(CAMPAIGN).size());
    }

    @Test
    @DisplayName("Existing award for the character is not granted again")
    void existingAwardSkipped() {
        CombatFixtures.seed(store, player("hero").build(), npc("goblin").hp(0, 50).build());
        store.grantExperience(new ExperienceAward("char-hero", SESSION, 50, "combat_victory", NOW));

        SettlementResult result = settle(settlementFor(store));

        assertEquals(List.of("combat_end", "loot_drop"), types(result.getEvents()));
        assertTrue(result.getExperienceByCharacter().isEmpty());
        assertEquals(50, store.getExperience("char-hero"));
    }

    @Test
    @DisplayName("Fallen players on the winning side get no rewards")
    void fallenPlayerUnrewarded() {
        CombatFixtures.seed(store, player("hero").build(), player("scout").hp(0, 100).build(),
            npc("goblin").hp(0, 50).build());

        SettlementResult result = settle(settlementFor(store));

        assertTrue(result.isWon());
        // three combatants, one survivor
        assertEquals(285, store.getExperience("char-hero"));
        assertEquals(0, store.getExperience("char-scout"));
        assertTrue(store.getInventory("char-scout").isEmpty());
        assertNull(store.getReputation(CAMPAIGN, "wardens", "user-scout"));
    }

    @Test
    @DisplayName("Fallen enemies count toward experience and lift the loot tier")
    void fallenEnemiesCountAsParticipants() {
        CombatFixtures.seed(store, player("hero").build(), npc("goblin").hp(0, 50).build(),
            npc("kobold").hp(0, 40).build());

        SettlementResult result = settle(settlementFor(store));

        // 180 base + 35 for each of the three combatants, above the 280 unique threshold
        assertEquals(285, result.getExperienceByCharacter().get("char-hero").intValue());
        assertEquals(LootRarity.UNIQUE, result.getLoot().get(0).getRarity());
        assertNull(result.getLoot().get(0).getDrawback());
    }

    @Test
    @DisplayName("Defeat costs reputation and records a setback for every player")
    void defeatConsequences() {
        CombatFixtures.seed(store, player("hero").hp(0, 100).build(), npc("goblin").build());
        store.upsertReputation(new FactionReputation(CAMPAIGN, "wardens", "user-hero", 10));

        SettlementResult result = settle(settlementFor(store));

        assertFalse(result.isWon());
        assertEquals(List.of("combat_end"), types(result.getEvents()));
        assertEquals(6, store.getReputation(CAMPAIGN, "wardens", "user-hero").rep());
        ReputationEvent event = store.getReputationEvents(CAMPAIGN).get(0);
        assertEquals(-4, event.delta());
        assertEquals("defeat", event.evidence().get("outcome").getAsString());
        MemoryEvent memory = store.getMemoryEvents(CAMPAIGN).get(0);
        assertEquals("combat_setback", memory.payload().get("type").getAsString());
        assertFalse(memory.payload().get("survived").getAsBoolean());
        assertEquals(0, store.getExperience("char-hero"));
    }

    @Test
    @DisplayName("Failed reputation write is reported without undoing rewards")
    void reputationFailureIsBestEffort() {
        CombatFixtures.seed(store, player("hero").build(), npc("goblin").hp(0, 50).build());
        ForwardingCombatStore failing = new ForwardingCombatStore(store) {
            @Override
            public void appendReputationEvent(ReputationEvent event) {
                throw new StoreException("reputation table locked");
            }
        };

        SettlementResult result = settle(settlementFor(failing));

        assertTrue(result.isSettled());
        List<SideEffectResult> failed = result.getFailedSideEffects();
        assertEquals(1, failed.size());
        assertEquals("reputation:user-hero", failed.get(0).getName());
        assertEquals("reputation table locked", failed.get(0).getReason());
        assertEquals(250, store.getExperience("char-hero"));
        assertEquals(1, store.getInventory("char-hero").size());
        assertEquals(1, store.getMemoryEvents(CAMPAIGN).size());
        assertNull(store.getReputation(CAMPAIGN, "wardens", "user-hero"));
    }

    @Test
    @DisplayName("Campaign without factions skips reputation")
    void noFactions() {
        InMemoryCombatStore bare = new InMemoryCombatStore();
        CombatFixtures.seed(bare, player("hero").build(), npc("goblin").hp(0, 50).build());
        SettlementEngine engine = settlementFor(bare);

        SettlementResult result = engine.settle(bare.getSession(SESSION), 0, bare.getCombatants(SESSION), NOW);

        assertTrue(result.getFailedSideEffects().isEmpty());
        assertTrue(bare.getReputationEvents(CAMPAIGN).isEmpty());
        assertEquals(1, bare.getMemoryEvents(CAMPAIGN).size());
    }

    @Test
    @DisplayName("Board transition reactivates the last board and archives the combat board")
    void boardTransition() {
        CombatFixtures.seed(store, player("hero").build(), npc("goblin").hp(0, 50).build());
        CombatFixtures.seedBoards(store);

        SettlementResult result = settle(settlementFor(store));

        assertEquals("board_transition", types(result.getEvents()).get(result.getEvents().size() - 1));
        assertNotNull(result.getBoardTransition());
        assertEquals("town", result.getBoardTransition().toBoardType().getKey());
        assertEquals("page_turn", result.getBoardTransition().animation());
        assertTrue(result.getBoardTransition().payload().getAsJsonObject("outcome").get("won").getAsBoolean());
        assertEquals(1, store.getBoardTransitions(CAMPAIGN).size());
        assertEquals("active", store.getBoard("board-town").getStatus());
        assertEquals("archived", store.getBoard("board-combat").getStatus());
    }
}
