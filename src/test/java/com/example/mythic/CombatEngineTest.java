package com.example.mythic;

import com.example.mythic.combat.AdvanceResult;
import com.example.mythic.combat.CombatEngine;
import com.example.mythic.combat.CombatIntegrityException;
import com.example.mythic.combat.CombatValidationException;
import com.example.mythic.combat.ResolutionState;
import com.example.mythic.combat.Skills;
import com.example.mythic.effect.StatusEffect;
import com.example.mythic.model.ActionEvent;
import com.example.mythic.model.Board;
import com.example.mythic.model.BossInstance;
import com.example.mythic.model.BossPhase;
import com.example.mythic.model.BossTemplate;
import com.example.mythic.model.CombatSession;
import com.example.mythic.model.Combatant;
import com.example.mythic.model.Faction;
import com.example.mythic.model.LootItem;
import com.example.mythic.model.LootRarity;
import com.example.mythic.model.MemoryEvent;
import com.example.mythic.model.ReputationEvent;
import com.example.mythic.model.SessionStatus;
import com.example.mythic.model.TurnSlot;
import com.example.mythic.persistence.CombatStore;
import com.example.mythic.persistence.InMemoryCombatStore;
import com.example.mythic.util.EngineConfig;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.example.mythic.CombatFixtures.CAMPAIGN;
import static com.example.mythic.CombatFixtures.CLOCK;
import static com.example.mythic.CombatFixtures.NOW;
import static com.example.mythic.CombatFixtures.SEED;
import static com.example.mythic.CombatFixtures.SESSION;
import static com.example.mythic.CombatFixtures.companion;
import static com.example.mythic.CombatFixtures.npc;
import static com.example.mythic.CombatFixtures.player;
import static com.example.mythic.CombatFixtures.types;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CombatEngine Tests")
class CombatEngineTest {

    private static final List<BossPhase> PHASES = List.of(
        new BossPhase(1, 1.0, List.of(Skills.BOSS_STRIKE, Skills.BOSS_MARK)),
        new BossPhase(2, 0.4, List.of(Skills.BOSS_CLEAVE, Skills.BOSS_VULN))
    );

    private InMemoryCombatStore store;
    private CombatEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryCombatStore();
        engine = new CombatEngine(store, EngineConfig.defaults(), CLOCK);
    }

    private void addBoss(InMemoryCombatStore target, String combatantId) {
        target.insertBossTemplate(new BossTemplate("tmpl-warden", "Warden", PHASES));
        target.insertBossInstance(new BossInstance("bi-" + combatantId, SESSION, combatantId, "tmpl-warden", 1, null));
    }

    // ==================== SCENARIOS ====================

    @Test
    @DisplayName("NPC acts first, then the engine waits for the player")
    void npcThenAwaitPlayer() {
        CombatFixtures.seed(store, npc("goblin").build(), player("hero").armor(0).build());

        AdvanceResult result = engine.advance(CAMPAIGN, SESSION, 1);

        assertEquals(List.of("skill_used", "damage", "turn_end", "turn_start"), types(result.getEvents()));
        assertFalse(result.isEnded());
        assertTrue(result.isRequiresPlayerAction());
        assertEquals(ResolutionState.AWAITING_PLAYER, result.getState());
        assertEquals(1, result.getTicks());
        assertEquals(1, result.getCurrentTurnIndex());
        assertEquals("hero", result.getNextActorCombatantId());

        JsonObject damage = result.getEvents().get(1).getPayload();
        assertEquals("goblin", damage.get("source_combatant_id").getAsString());
        assertEquals("hero", damage.get("target_combatant_id").getAsString());
        assertEquals(Skills.NPC_SWIPE, damage.get("skill_id").getAsString());
        int hpLoss = damage.get("damage_to_hp").getAsInt();
        assertTrue(hpLoss >= 1);
        assertEquals(100 - hpLoss, store.getCombatant(SESSION, "hero").getHp());
        assertEquals("hero", result.getEvents().get(3).getActorCombatantId());
        assertEquals(1, store.getSession(SESSION).getCurrentTurnIndex());
    }

    @Test
    @DisplayName("Killing the last player ends combat as a defeat in the same call")
    void lastPlayerKilled() {
        CombatFixtures.seed(store, npc("goblin").build(), player("hero").hp(1, 100).build());
        CombatFixtures.seedBoards(store);
        store.insertFaction(new Faction("wardens", CAMPAIGN, "Wardens", List.of()));

        AdvanceResult result = engine.advance(CAMPAIGN, SESSION, 1);

        assertEquals(List.of("skill_used", "damage", "death", "combat_end", "board_transition"), types(result.getEvents()));
        assertTrue(result.isEnded());
        assertFalse(result.isRequiresPlayerAction());
        assertEquals(ResolutionState.ENDED, result.getState());
        assertNull(result.getNextActorCombatantId());

        Combatant hero = store.getCombatant(SESSION, "hero");
        assertEquals(0, hero.getHp());
        assertFalse(hero.isAlive());

        JsonObject end = result.getEvents().get(3).getPayload();
        assertFalse(end.get("won").getAsBoolean());
        assertEquals(0, end.get("alive_players").getAsInt());
        assertEquals(1, end.get("alive_npcs").getAsInt());

        assertEquals(0, store.getExperience("char-hero"));
        assertTrue(store.getInventory("char-hero").isEmpty());
        List<ReputationEvent> rep = store.getReputationEvents(CAMPAIGN);
        assertEquals(1, rep.size());
        assertEquals(-4, rep.get(0).delta());
        assertEquals(-4, store.getReputation(CAMPAIGN, "wardens", "user-hero").rep());
        List<MemoryEvent> memories = store.getMemoryEvents(CAMPAIGN);
        assertEquals(1, memories.size());
        assertEquals("combat_setback", memories.get(0).payload().get("type").getAsString());
        assertEquals(SessionStatus.ENDED, store.getSession(SESSION).getStatus());
    }

    @Test
    @DisplayName("Companion finishing the last NPC wins and settles rewards once")
    void companionWinsWithBossBonus() {
        CombatFixtures.seed(store, companion("wolf", "user-hero").build(),
            npc("warden").hp(1, 200).build(), player("hero").build());
        addBoss(store, "warden");
        CombatFixtures.seedBoards(store);
        store.insertFaction(new Faction("wardens", CAMPAIGN, "Wardens", List.of()));

        AdvanceResult result = engine.advance(CAMPAIGN, SESSION, 3);

        assertEquals(List.of("skill_used", "damage", "death", "combat_end", "xp_gain", "loot_drop", "board_transition"),
            types(result.getEvents()));
        assertEquals(Skills.BASIC_ATTACK, result.getEvents().get(0).getPayload().get("skill_id").getAsString());
        assertTrue(result.isEnded());
        assertTrue(result.getSettlement().isWon());

        // 180 base + 35 for each of the three combatants + 220 boss bonus
        assertEquals(505, store.getExperience("char-hero"));
        List<LootItem> loot = store.getInventory("char-hero");
        assertEquals(1, loot.size());
        assertEquals(LootRarity.LEGENDARY, loot.get(0).getRarity());
        assertNotNull(loot.get(0).getDrawback());

        assertEquals(6, store.getReputation(CAMPAIGN, "wardens", "user-hero").rep());
        assertEquals("combat_victory", store.getMemoryEvents(CAMPAIGN).get(0).payload().get("type").getAsString());
        assertEquals(Board.STATUS_ACTIVE, store.getBoard("board-town").getStatus());
        assertEquals(Board.STATUS_ARCHIVED, store.getBoard("board-combat").getStatus());

        int eventCount = store.getEvents(SESSION).size();
        AdvanceResult again = engine.advance(CAMPAIGN, SESSION, 5);
        assertTrue(again.isEnded());
        assertEquals(0, again.getTicks());
        assertTrue(again.getEvents().isEmpty());
        assertNull(again.getSettlement());
        assertEquals(eventCount, store.getEvents(SESSION).size());
        assertEquals(505, store.getExperience("char-hero"));
        assertEquals(1, store.getInventory("char-hero").size());
    }

    @Test
    @DisplayName("Boss below its threshold shifts phase before choosing a skill")
    void bossPhaseShift() {
        CombatFixtures.seed(store, npc("warden").hp(35, 100).build(), player("hero").hp(500, 500).build());
        addBoss(store, "warden");

        AdvanceResult result = engine.advance(CAMPAIGN, SESSION, 1);

        List<ActionEvent> events = result.getEvents();
        assertEquals("phase_shift", events.get(0).getType().getKey());
        assertEquals(2, events.get(0).getPayload().get("phase").getAsInt());
        assertEquals("skill_used", events.get(1).getType().getKey());
        String skill = events.get(1).getPayload().get("skill_id").getAsString();
        assertTrue(List.of(Skills.BOSS_CLEAVE, Skills.BOSS_VULN).contains(skill), skill);
        assertEquals(2, store.getBossInstance(SESSION, "warden").getCurrentPhase());
        if (Skills.BOSS_VULN.equals(skill)) {
            assertTrue(store.getCombatant(SESSION, "hero").hasStatus(Skills.VULNERABLE));
        }
    }

    @Test
    @DisplayName("Cleave hits every living opponent")
    void cleaveHitsAll() {
        List<BossPhase> cleaveOnly = List.of(new BossPhase(1, 1.0, List.of(Skills.BOSS_CLEAVE)));
        CombatFixtures.seed(store, npc("warden").hp(300, 300).build(),
            player("hero").hp(400, 400).build(), companion("wolf", "user-hero").hp(400, 400).build());
        store.insertBossTemplate(new BossTemplate("tmpl-cleave", "Cleaver", cleaveOnly));
        store.insertBossInstance(new BossInstance("bi-warden", SESSION, "warden", "tmpl-cleave", 1, null));

        AdvanceResult result = engine.advance(CAMPAIGN, SESSION, 1);

        assertEquals(List.of("skill_used", "damage", "damage", "turn_end", "turn_start"), types(result.getEvents()));
        assertEquals(2, result.getEvents().get(0).getPayload().get("target_count").getAsInt());
        // opponents are resolved in id order
        assertEquals("hero", result.getEvents().get(1).getPayload().get("target_combatant_id").getAsString());
        assertEquals("wolf", result.getEvents().get(2).getPayload().get("target_combatant_id").getAsString());
    }

    // ==================== COMPANIONS ====================

    @Test
    @DisplayName("Badly hurt companion defends and gains armor, barrier and guard")
    void companionDefends() {
        CombatFixtures.seed(store, companion("wolf", "user-hero").hp(10, 60).build(),
            npc("goblin").build(), player("hero").build());

        AdvanceResult result = engine.advance(CAMPAIGN, SESSION, 1);

        assertEquals(List.of("skill_used", "status_applied", "status_applied", "turn_end", "turn_start"),
            types(result.getEvents()));
        assertEquals(Skills.BASIC_DEFEND, result.getEvents().get(0).getPayload().get("skill_id").getAsString());
        Combatant wolf = store.getCombatant(SESSION, "wolf");
        // max(4, floor(30 * 0.22) + floor(20 * 0.12))
        assertEquals(8, wolf.getArmor());
        assertTrue(wolf.hasStatus("barrier"));
        assertTrue(wolf.hasStatus("guard"));
    }

    @Test
    @DisplayName("Drained companion recovers power")
    void companionRecovers() {
        CombatFixtures.seed(store, companion("wolf", "user-hero").power(5, 30).build(),
            npc("goblin").build(), player("hero").build());

        AdvanceResult result = engine.advance(CAMPAIGN, SESSION, 1);

        assertEquals(List.of("skill_used", "power_gain", "turn_end", "turn_start"), types(result.getEvents()));
        JsonObject gain = result.getEvents().get(1).getPayload();
        assertEquals(6, gain.get("amount").getAsInt());
        assertEquals(11, gain.get("power_after").getAsInt());
        assertEquals(11, store.getCombatant(SESSION, "wolf").getPower());
    }

    // ==================== TURN FLOW ====================

    @Test
    @DisplayName("Player at the pointer pauses resolution without acting")
    void playerTurnPauses() {
        CombatFixtures.seed(store, player("hero").build(), npc("goblin").build());

        AdvanceResult result = engine.advance(CAMPAIGN, SESSION, 5);

        assertEquals(0, result.getTicks());
        assertTrue(result.isRequiresPlayerAction());
        assertEquals(ResolutionState.AWAITING_PLAYER, result.getState());
        assertTrue(result.getEvents().isEmpty());
        assertEquals(0, store.getSession(SESSION).getCurrentTurnIndex());
    }

    @Test
    @DisplayName("Dead actor is skipped without events")
    void deadActorSkipped() {
        CombatFixtures.seed(store, npc("corpse").hp(0, 50).build(), npc("goblin").build(), player("hero").build());

        AdvanceResult result = engine.advance(CAMPAIGN, SESSION, 1);

        assertEquals(1, result.getTicks());
        assertTrue(result.getEvents().isEmpty());
        assertEquals(ResolutionState.BUDGET_EXHAUSTED, result.getState());
        assertFalse(result.isRequiresPlayerAction());
        assertEquals(1, result.getCurrentTurnIndex());
        assertEquals("goblin", result.getNextActorCombatantId());
    }

    @Test
    @DisplayName("Actor killed by its start tick loses its turn")
    void startTickDeath() {
        JsonObject poison = new JsonObject();
        poison.addProperty("damage_per_turn", 100);
        CombatFixtures.seed(store,
            npc("imp").statuses(List.of(new StatusEffect("poison", null, 1, poison))).build(),
            npc("goblin").build(), player("hero").build());

        AdvanceResult result = engine.advance(CAMPAIGN, SESSION, 2);

        assertEquals(List.of("status_tick", "death", "skill_used", "damage", "turn_end", "turn_start"),
            types(result.getEvents()));
        assertEquals("status_tick", result.getEvents().get(1).getPayload().get("reason").getAsString());
        assertEquals(2, result.getTicks());
        assertTrue(result.isRequiresPlayerAction());
        assertEquals("hero", result.getNextActorCombatantId());
        assertEquals("goblin", result.getEvents().get(2).getActorCombatantId());
    }

    @Test
    @DisplayName("Budget stops the loop before the next NPC")
    void budgetExhausted() {
        CombatFixtures.seed(store, npc("a").build(), npc("b").build(), player("hero").build());

        AdvanceResult result = engine.advance(CAMPAIGN, SESSION, 1);

        assertEquals(ResolutionState.BUDGET_EXHAUSTED, result.getState());
        assertFalse(result.isRequiresPlayerAction());
        assertEquals("b", result.getNextActorCombatantId());

        AdvanceResult next = engine.advance(CAMPAIGN, SESSION, 10);
        assertEquals(1, next.getTicks());
        assertTrue(next.isRequiresPlayerAction());
        assertEquals(2, next.getCurrentTurnIndex());
    }

    // ==================== DETERMINISM / INVARIANTS ====================

    private InMemoryCombatStore seededEncounter() {
        InMemoryCombatStore s = new InMemoryCombatStore();
        JsonObject burn = new JsonObject();
        burn.addProperty("damage_per_turn", 4);
        CombatFixtures.seed(s,
            npc("warden").level(6).offense(40).mobility(30).utility(30).weaponPower(15).hp(90, 200).build(),
            companion("wolf", "user-hero").build(),
            npc("imp").statuses(List.of(new StatusEffect("burning", 3, 2, burn))).build(),
            player("hero").armor(15).build());
        addBoss(s, "warden");
        return s;
    }

    @Test
    @DisplayName("Identical snapshots and seed give identical events and state")
    void deterministic() {
        InMemoryCombatStore first = seededEncounter();
        InMemoryCombatStore second = seededEncounter();
        new CombatEngine(first, EngineConfig.defaults(), CLOCK).advance(CAMPAIGN, SESSION, 10);
        new CombatEngine(second, EngineConfig.defaults(), CLOCK).advance(CAMPAIGN, SESSION, 10);

        List<String> a = first.getEvents(SESSION).stream().map(e -> e.getType().getKey() + e.getPayloadJson()).toList();
        List<String> b = second.getEvents(SESSION).stream().map(e -> e.getType().getKey() + e.getPayloadJson()).toList();
        assertFalse(a.isEmpty());
        assertEquals(a, b);
        for (Combatant c : first.getCombatants(SESSION)) {
            assertEquals(c.getHp(), second.getCombatant(SESSION, c.getId()).getHp());
            assertEquals(c.getArmor(), second.getCombatant(SESSION, c.getId()).getArmor());
        }
    }

    @Test
    @DisplayName("Alive flag and HP bounds hold after every call")
    void aliveHpInvariant() {
        store = seededEncounter();
        engine = new CombatEngine(store, EngineConfig.defaults(), CLOCK);
        for (int call = 0; call < 3; call++) {
            engine.advance(CAMPAIGN, SESSION, 10);
            for (Combatant c : store.getCombatants(SESSION)) {
                assertTrue(c.getHp() >= 0 && c.getHp() <= c.getHpMax(), c.toString());
                assertEquals(c.getHp() > 0, c.isAlive(), c.toString());
            }
        }
        long ids = store.getEvents(SESSION).stream().mapToLong(ActionEvent::getId).distinct().count();
        assertEquals(store.getEvents(SESSION).size(), ids);
    }

    // ==================== VALIDATION / INTEGRITY ====================

    @Test
    @DisplayName("Step budget outside 1..10 is rejected")
    void badBudget() {
        CombatFixtures.seed(store, npc("goblin").build(), player("hero").build());
        assertThrows(CombatValidationException.class, () -> engine.advance(CAMPAIGN, SESSION, 0));
        assertThrows(CombatValidationException.class, () -> engine.advance(CAMPAIGN, SESSION, 11));
        assertTrue(store.getEvents(SESSION).isEmpty());
    }

    @Test
    @DisplayName("Unknown session or wrong campaign is rejected")
    void unknownSession() {
        CombatFixtures.seed(store, npc("goblin").build(), player("hero").build());
        assertThrows(CombatValidationException.class, () -> engine.advance(CAMPAIGN, "nope", 1));
        assertThrows(CombatValidationException.class, () -> engine.advance("other-campaign", SESSION, 1));
        assertThrows(CombatValidationException.class, () -> engine.advance(" ", SESSION, 1));
    }

    @Test
    @DisplayName("Empty turn order is fatal")
    void emptyTurnOrder() {
        store.insertSession(new CombatSession(SESSION, CAMPAIGN, SEED, SessionStatus.ACTIVE, 0, NOW));
        store.insertCombatant(npc("goblin").build());
        assertThrows(CombatIntegrityException.class, () -> engine.advance(CAMPAIGN, SESSION, 1));
    }

    @Test
    @DisplayName("Turn pointer outside the order or pointing at a missing actor is fatal")
    void brokenPointer() {
        store.insertSession(new CombatSession(SESSION, CAMPAIGN, SEED, SessionStatus.ACTIVE, 7, NOW));
        store.insertCombatant(npc("goblin").build());
        store.insertTurnOrder(SESSION, List.of("goblin"));
        assertThrows(CombatIntegrityException.class, () -> engine.advance(CAMPAIGN, SESSION, 1));

        InMemoryCombatStore other = new InMemoryCombatStore();
        other.insertSession(new CombatSession(SESSION, CAMPAIGN, SEED, SessionStatus.ACTIVE, 0, NOW));
        other.insertTurnOrder(SESSION, List.of("ghost"));
        CombatEngine e = new CombatEngine(other, EngineConfig.defaults(), CLOCK);
        assertThrows(CombatIntegrityException.class, () -> e.advance(CAMPAIGN, SESSION, 1));
    }

    // ==================== CONCURRENCY ====================

    @Test
    @DisplayName("Pointer moved by someone else stops the loop as superseded")
    void pointerRace() {
        CombatFixtures.seed(store, npc("a").build(), npc("b").build(), player("hero").build());
        CombatStore racing = new ForwardingCombatStore(store) {
            @Override
            public boolean advanceTurnPointer(String id, int expected, int next, Instant at) {
                return false;
            }
        };
        AdvanceResult result = new CombatEngine(racing, EngineConfig.defaults(), CLOCK).advance(CAMPAIGN, SESSION, 5);

        assertEquals(ResolutionState.SUPERSEDED, result.getState());
        assertEquals(1, result.getTicks());
        assertFalse(types(result.getEvents()).contains("turn_end"));
        assertEquals(0, store.getSession(SESSION).getCurrentTurnIndex());
    }

    @Test
    @DisplayName("Second call for a session already resolving returns a snapshot")
    void concurrentCallSuperseded() throws Exception {
        CombatFixtures.seed(store, npc("a").build(), player("hero").build());
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean blockOnce = new AtomicBoolean(true);
        CombatStore slow = new ForwardingCombatStore(store) {
            @Override
            public List<TurnSlot> getTurnOrder(String id) {
                if (blockOnce.compareAndSet(true, false)) {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.getTurnOrder(id);
            }
        };
        CombatEngine shared = new CombatEngine(slow, EngineConfig.defaults(), CLOCK);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<AdvanceResult> first = pool.submit(() -> shared.advance(CAMPAIGN, SESSION, 1));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            AdvanceResult second = shared.advance(CAMPAIGN, SESSION, 1);
            assertEquals(ResolutionState.SUPERSEDED, second.getState());
            assertEquals(0, second.getTicks());
            assertTrue(second.getEvents().isEmpty());

            release.countDown();
            AdvanceResult done = first.get(5, TimeUnit.SECONDS);
            assertEquals(1, done.getTicks());
            assertTrue(done.isRequiresPlayerAction());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }
}
