package com.example.mythic.combat;

import com.example.mythic.model.ActionEventDraft;
import com.example.mythic.model.BossInstance;
import com.example.mythic.model.BossPhase;
import com.example.mythic.model.BossTemplate;
import com.example.mythic.model.Combatant;
import com.example.mythic.model.EventType;
import com.example.mythic.persistence.CombatStore;
import com.example.mythic.util.DeterministicRng;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Drives boss phases and skill choice.
 *
 * The phase is the highest {@code phase} among template rows whose {@code hp_below_pct} is at
 * least the boss's current HP fraction, and never lower than the phase the boss is already in.
 * A phase change is written to the store before the skill is chosen from the new phase's pool.
 */
public class BossPhaseController {

    private static final Logger logger = LoggerFactory.getLogger(BossPhaseController.class);

    private final CombatStore store;
    private final DeterministicRng rng;

    public BossPhaseController(CombatStore store, DeterministicRng rng) {
        this.store = store;
        this.rng = rng;
    }

    /**
     * Phase the boss should be in at {@code hpFraction}. Never below {@code currentPhase}.
     */
    public static int resolvePhase(int currentPhase, double hpFraction, List<BossPhase> phases) {
        int next = currentPhase;
        for (BossPhase row : phases) {
            if (row.hpBelowPct() >= hpFraction && row.phase() > next) {
                next = row.phase();
            }
        }
        return next;
    }

    /**
     * Skill pool of the given phase; empty if the template has no row for it.
     */
    public static List<String> poolFor(int phase, List<BossPhase> phases) {
        for (BossPhase row : phases) {
            if (row.phase() == phase) {
                return row.skillPool();
            }
        }
        return List.of();
    }

    /**
     * Advance the boss's phase if its HP calls for it, then choose its skill.
     */
    public BossTurn planTurn(int seed, int turnIndex, Combatant boss, BossInstance instance, Instant now) {
        BossTemplate template = store.getBossTemplate(instance.getTemplateId());
        List<BossPhase> phases = template == null ? List.of() : template.getPhases();
        if (template == null) {
            logger.warn("[BossPhaseController] Boss {} references unknown template {}", boss.getId(), instance.getTemplateId());
        }

        double hpFraction = boss.getHpFraction();
        int current = instance.getCurrentPhase();
        int phase = resolvePhase(current, hpFraction, phases);

        ActionEventDraft shift = null;
        if (phase != current) {
            instance.setCurrentPhase(phase);
            store.updateBossPhase(instance.getId(), phase);
            JsonObject payload = new JsonObject();
            payload.addProperty("combatant_id", boss.getId());
            payload.addProperty("phase", phase);
            payload.addProperty("hp_pct", hpFraction);
            shift = new ActionEventDraft(boss.getCombatSessionId(), turnIndex, boss.getId(), EventType.PHASE_SHIFT, payload, now);
            logger.debug("[BossPhaseController] {} shifted to phase {} at {} hp", boss.getId(), phase, hpFraction);
        }

        List<String> pool = poolFor(phase, phases);
        String skillId = pool.isEmpty()
            ? Skills.BOSS_STRIKE
            : rng.pick(seed, "tick:" + boss.getCombatSessionId() + ":turn:" + turnIndex + ":actor:" + boss.getId() + ":boss_skill", pool);
        return new BossTurn(skillId, phase, Skills.isMultiTarget(skillId), shift);
    }
}
