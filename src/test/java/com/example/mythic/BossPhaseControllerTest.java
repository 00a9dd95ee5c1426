package com.example.mythic;

import com.example.mythic.combat.BossPhaseController;
import com.example.mythic.combat.BossTurn;
import com.example.mythic.combat.Skills;
import com.example.mythic.model.BossInstance;
import com.example.mythic.model.BossPhase;
import com.example.mythic.model.BossTemplate;
import com.example.mythic.model.Combatant;
import com.example.mythic.model.EventType;
import com.example.mythic.persistence.InMemoryCombatStore;
import com.example.mythic.util.DeterministicRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.mythic.CombatFixtures.NOW;
import static com.example.mythic.CombatFixtures.SEED;
import static com.example.mythic.CombatFixtures.SESSION;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BossPhaseController Tests")
class BossPhaseControllerTest {

    private static final List<BossPhase> PHASES = List.of(
        new BossPhase(1, 1.0, List.of(Skills.BOSS_STRIKE, Skills.BOSS_MARK)),
        new BossPhase(2, 0.4, List.of(Skills.BOSS_CLEAVE, Skills.BOSS_VULN)),
        new BossPhase(3, 0.15, List.of(Skills.BOSS_EXECUTE))
    );

    private InMemoryCombatStore store;
    private BossPhaseController controller;

    @BeforeEach
    void setUp() {
        store = new InMemoryCombatStore();
        store.insertBossTemplate(new BossTemplate("tmpl", "Warden", PHASES));
        store.insertBossInstance(new BossInstance("bi-1", SESSION, "boss", "tmpl", 1, null));
        controller = new BossPhaseController(store, new DeterministicRng());
    }

    private static Combatant boss(int hp) {
        return CombatFixtures.npc("boss").hp(hp, 100).build();
    }

    @Test
    @DisplayName("Phase follows the HP thresholds")
    void resolvePhaseByHp() {
        assertEquals(1, BossPhaseController.resolvePhase(1, 0.9, PHASES));
        assertEquals(2, BossPhaseController.resolvePhase(1, 0.4, PHASES));
        assertEquals(2, BossPhaseController.resolvePhase(1, 0.35, PHASES));
        assertEquals(3, BossPhaseController.resolvePhase(1, 0.1, PHASES));
    }

    @Test
    @DisplayName("Phase never goes back down when HP recovers")
    void phaseMonotonic() {
        assertEquals(3, BossPhaseController.resolvePhase(3, 0.9, PHASES));
        assertEquals(2, BossPhaseController.resolvePhase(2, 1.0, PHASES));
    }

    @Test
    @DisplayName("Boss at 35% moves to phase 2, emits phase_shift and uses a phase 2 skill")
    void shiftsAtThreshold() {
        BossInstance instance = store.getBossInstance(SESSION, "boss");
        BossTurn turn = controller.planTurn(SEED, 4, boss(35), instance, NOW);

        assertEquals(2, turn.phase());
        assertTrue(turn.isPhaseShifted());
        assertEquals(EventType.PHASE_SHIFT, turn.phaseShift().getType());
        assertEquals(2, turn.phaseShift().getPayload().get("phase").getAsInt());
        assertEquals(0.35, turn.phaseShift().getPayload().get("hp_pct").getAsDouble(), 1e-9);
        assertTrue(List.of(Skills.BOSS_CLEAVE, Skills.BOSS_VULN).contains(turn.skillId()));
        assertEquals(Skills.BOSS_CLEAVE.equals(turn.skillId()), turn.multiTarget());
        assertEquals(2, store.getBossInstance(SESSION, "boss").getCurrentPhase());
    }

    @Test
    @DisplayName("No shift is reported while the boss stays in its phase")
    void noShiftAboveThreshold() {
        BossTurn turn = controller.planTurn(SEED, 0, boss(90), store.getBossInstance(SESSION, "boss"), NOW);
        assertFalse(turn.isPhaseShifted());
        assertEquals(1, turn.phase());
        assertTrue(List.of(Skills.BOSS_STRIKE, Skills.BOSS_MARK).contains(turn.skillId()));
    }

    @Test
    @DisplayName("Skill choice is deterministic for the same seed, turn and boss")
    void deterministicSkill() {
        String first = controller.planTurn(SEED, 7, boss(90), store.getBossInstance(SESSION, "boss"), NOW).skillId();
        for (int i = 0; i < 5; i++) {
            assertEquals(first, controller.planTurn(SEED, 7, boss(90), store.getBossInstance(SESSION, "boss"), NOW).skillId());
        }
    }

    @Test
    @DisplayName("Unknown template falls back to boss_strike")
    void unknownTemplateFallback() {
        BossInstance orphan = new BossInstance("bi-2", SESSION, "boss", "missing", 1, null);
        BossTurn turn = controller.planTurn(SEED, 0, boss(10), orphan, NOW);
        assertEquals(Skills.BOSS_STRIKE, turn.skillId());
        assertFalse(turn.isPhaseShifted());
    }

    @Test
    @DisplayName("Lowering a boss instance's phase is refused")
    void instanceRejectsRegression() {
        BossInstance instance = new BossInstance("bi-3", SESSION, "boss", "tmpl", 2, null);
        assertThrows(IllegalArgumentException.class, () -> instance.setCurrentPhase(1));
    }
}
