package com.example.mythic.combat;

import com.example.mythic.effect.StatusEffect;
import com.example.mythic.effect.StatusEffectProcessor;
import com.example.mythic.effect.StatusTickResult;
import com.example.mythic.effect.TickPhase;
import com.example.mythic.model.ActionEvent;
import com.example.mythic.model.ActionEventDraft;
import com.example.mythic.model.BossInstance;
import com.example.mythic.model.CombatSession;
import com.example.mythic.model.Combatant;
import com.example.mythic.model.EventType;
import com.example.mythic.persistence.CombatStore;
import com.example.mythic.settlement.SettlementEngine;
import com.example.mythic.settlement.SettlementResult;
import com.example.mythic.util.DeterministicRng;
import com.example.mythic.util.EngineConfig;
import com.example.mythic.util.LootGenerator;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the turns of a combat session, one step at a time.
 *
 * Each step reloads the session, its turn order and its combatants from the store, resolves
 * the current actor's turn, writes every mutation and event, and only then moves the turn
 * pointer. Nothing is kept between steps or between calls. A step stops the loop when:
 *  - the current actor is a living player (the engine never acts for players)
 *  - one side has no living members (combat ends and is settled in the same call)
 *  - the session is no longer active, or its turn pointer moved under us
 *
 * At most one call resolves a given session at a time in this process; the conditional
 * pointer advance and end transition in the store cover concurrent resolvers elsewhere.
 */
public class CombatEngine {

    private static final Logger logger = LoggerFactory.getLogger(CombatEngine.class);

    private final CombatStore store;
    private final EngineConfig config;
    private final Clock clock;
    private final DeterministicRng rng;
    private final DamageResolver damageResolver;
    private final StatusEffectProcessor statusProcessor;
    private final BossPhaseController bossPhaseController;
    private final SettlementEngine settlementEngine;

    /** Sessions currently being resolved by this engine */
    private final Set<String> resolving = ConcurrentHashMap.newKeySet();

    public CombatEngine(CombatStore store, EngineConfig config, Clock clock) {
        this(store, config, clock, new DeterministicRng());
    }

    private CombatEngine(CombatStore store, EngineConfig config, Clock clock, DeterministicRng rng) {
        this(store, config, clock, rng, new SettlementEngine(store, config, new LootGenerator(rng)));
    }

    public CombatEngine(CombatStore store, EngineConfig config, Clock clock, DeterministicRng rng,
                        SettlementEngine settlementEngine) {
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.rng = rng;
        this.damageResolver = new DamageResolver(rng, config.getDamageSpreadPct());
        this.statusProcessor = new StatusEffectProcessor();
        this.bossPhaseController = new BossPhaseController(store, rng);
        this.settlementEngine = settlementEngine;
    }

    /**
     * Resolve up to {@code maxSteps} turns of a session.
     * @throws CombatValidationException for a bad step budget, blank ids or an unknown session
     * @throws CombatIntegrityException if the stored turn order or turn actor is broken
     */
    public AdvanceResult advance(String campaignId, String combatSessionId, int maxSteps) {
        if (campaignId == null || campaignId.isBlank()) {
            throw new CombatValidationException("campaignId is required");
        }
        if (combatSessionId == null || combatSessionId.isBlank()) {
            throw new CombatValidationException("combatSessionId is required");
        }
        if (maxSteps < 1 || maxSteps > config.getMaxStepsCap()) {
            throw new CombatValidationException("maxSteps must be between 1 and " + config.getMaxStepsCap());
        }
        if (loadSession(campaignId, combatSessionId) == null) {
            throw new CombatValidationException("Combat session not found");
        }

        if (!resolving.add(combatSessionId)) {
            logger.info("[CombatEngine] Session {} is already being resolved; returning current state", combatSessionId);
            return snapshot(campaignId, combatSessionId, 0, ResolutionState.SUPERSEDED, List.of(), null);
        }
        try {
            return run(campaignId, combatSessionId, maxSteps);
        } finally {
            resolving.remove(combatSessionId);
        }
    }

    private AdvanceResult run(String campaignId, String combatSessionId, int maxSteps) {
        List<ActionEvent> events = new ArrayList<>();
        ResolutionState state = ResolutionState.RESOLVING;
        SettlementResult settlement = null;
        Integer expectedIndex = null;
        int ticks = 0;

        for (int step = 0; step < maxSteps && state == ResolutionState.RESOLVING; step++) {
            CombatSession session = loadSession(campaignId, combatSessionId);
            if (session == null) {
                state = ResolutionState.IDLE;
                break;
            }
            if (!session.isActive()) {
                state = ResolutionState.ENDED;
                break;
            }
            if (expectedIndex != null && session.getCurrentTurnIndex() != expectedIndex) {
                logger.info("[CombatEngine] Session {} turn moved to {} (expected {}); stopping",
                    combatSessionId, session.getCurrentTurnIndex(), expectedIndex);
                state = ResolutionState.SUPERSEDED;
                break;
            }

            StepOutcome outcome = resolveStep(session, events);
            switch (outcome.kind) {
                case AWAITING_PLAYER:
                    state = ResolutionState.AWAITING_PLAYER;
                    break;
                case ADVANCED:
                    ticks++;
                    expectedIndex = outcome.nextIndex;
                    break;
                case ENDED:
                    ticks++;
                    settlement = outcome.settlement;
                    state = ResolutionState.ENDED;
                    break;
                case SUPERSEDED:
                default:
                    ticks++;
                    state = ResolutionState.SUPERSEDED;
                    break;
            }
        }
        if (state == ResolutionState.RESOLVING) {
            state = ResolutionState.BUDGET_EXHAUSTED;
        }

        AdvanceResult result = snapshot(campaignId, combatSessionId, ticks, state, events, settlement);
        logger.info("[CombatEngine] Session {} advanced: {}", combatSessionId, result);
        return result;
    }

    // === Single step ===

    private StepOutcome resolveStep(CombatSession session, List<ActionEvent> events) {
        String sessionId = session.getId();
        int turn = session.getCurrentTurnIndex();
        int seed = session.getSeed();
        Instant now = clock.instant();

        TurnOrder order = new TurnOrder(sessionId, store.getTurnOrder(sessionId));
        String actorId = order.combatantAt(turn);
        Combatant actor = store.getCombatant(sessionId, actorId);
        if (actor == null) {
            throw new CombatIntegrityException(sessionId, "Turn actor " + actorId + " not found");
        }

        if (actor.isPlayer() && actor.isAlive()) {
            return StepOutcome.awaitingPlayer();
        }

        if (actor.isAlive()) {
            actor = applyTick(actor, turn, TickPhase.START, now, events);
        }
        if (!actor.isAlive()) {
            List<Combatant> all = store.getCombatants(sessionId);
            if (isOneSideDefeated(all)) {
                return endCombat(session, turn, all, now, events);
            }
            int next = order.nextAliveIndex(turn, aliveIds(all));
            logger.debug("[CombatEngine] Session {} turn {}: {} is down, skipping to turn {}", sessionId, turn, actor.getId(), next);
            if (!store.advanceTurnPointer(sessionId, turn, next, now)) {
                return supersededAfterWrite(sessionId, turn);
            }
            return StepOutcome.advanced(next);
        }

        List<Combatant> all = store.getCombatants(sessionId);
        List<Combatant> opponents = new ArrayList<>();
        for (Combatant c : all) {
            if (c.isAlive() && actor.isOpponentOf(c)) {
                opponents.add(c);
            }
        }
        if (opponents.isEmpty()) {
            return endCombat(session, turn, all, now, events);
        }
        opponents.sort(Comparator.comparing(Combatant::getId));

        String labelPrefix = "tick:" + sessionId + ":turn:" + turn + ":actor:" + actor.getId();
        Combatant target = rng.pick(seed, labelPrefix + ":target", opponents);

        if (actor.isSummon() && actor.isPlayerSide()) {
            CompanionTactics.Action action = CompanionTactics.choose(actor);
            if (action == CompanionTactics.Action.DEFEND) {
                actor = defend(actor, turn, now, events);
            } else if (action == CompanionTactics.Action.RECOVER) {
                actor = recover(actor, turn, now, events);
            } else {
                attack(seed, turn, actor, CompanionTactics.skillFor(action), List.of(target), now, events);
            }
        } else {
            String skillId = Skills.NPC_SWIPE;
            boolean multiTarget = false;
            BossInstance boss = actor.isNpc() ? store.getBossInstance(sessionId, actor.getId()) : null;
            if (boss != null) {
                BossTurn bossTurn = bossPhaseController.planTurn(seed, turn, actor, boss, now);
                if (bossTurn.isPhaseShifted()) {
                    emit(bossTurn.phaseShift(), events);
                }
                skillId = bossTurn.skillId();
                multiTarget = bossTurn.multiTarget();
            }
            attack(seed, turn, actor, skillId, multiTarget ? opponents : List.of(target), now, events);
        }

        if (actor.isAlive()) {
            applyTick(actor, turn, TickPhase.END, now, events);
        }

        all = store.getCombatants(sessionId);
        if (isOneSideDefeated(all)) {
            return endCombat(session, turn, all, now, events);
        }

        int next = order.nextAliveIndex(turn, aliveIds(all));
        if (!store.advanceTurnPointer(sessionId, turn, next, now)) {
            return supersededAfterWrite(sessionId, turn);
        }
        emit(turnMarker(sessionId, turn, actor.getId(), EventType.TURN_END, now), events);
        emit(turnMarker(sessionId, next, order.combatantAt(next), EventType.TURN_START, now), events);
        return StepOutcome.advanced(next);
    }

    // === Actions ===

    private void attack(int seed, int turn, Combatant actor, String skillId, List<Combatant> targets,
                        Instant now, List<ActionEvent> events) {
        String sessionId = actor.getCombatSessionId();
        emit(skillUsed(sessionId, turn, actor.getId(), skillId, targets.size(), now), events);

        for (Combatant target : targets) {
            double multiplier = Skills.multiplierFor(skillId, target.getHpFraction());
            String label = "tick:" + sessionId + ":turn:" + turn + ":actor:" + actor.getId() + ":target:" + target.getId();
            DamageRoll roll = damageResolver.roll(seed, label, actor, multiplier, target.getResist() + target.getArmor());
            ArmorAbsorption absorption = ArmorAbsorption.of(target.getArmor(), roll.getFinalDamage());

            Combatant hit = target.copy();
            boolean wasAlive = hit.isAlive();
            hit.setArmor(absorption.armorAfter());
            hit.setHp(hit.getHp() - absorption.hpLoss());

            StatusEffect applied = hit.isAlive() ? Skills.appliedStatus(skillId, turn) : null;
            if (applied != null) {
                hit.setStatuses(StatusEffectProcessor.withStatus(hit.getStatuses(), applied));
            }
            store.updateCombatant(hit);

            JsonObject damage = new JsonObject();
            damage.addProperty("source_combatant_id", actor.getId());
            damage.addProperty("target_combatant_id", hit.getId());
            damage.addProperty("skill_id", skillId);
            damage.add("roll", roll.toJson());
            damage.addProperty("shield_absorbed", absorption.absorbed());
            damage.addProperty("damage_to_hp", absorption.hpLoss());
            damage.addProperty("hp_after", hit.getHp());
            damage.addProperty("armor_after", hit.getArmor());
            emit(new ActionEventDraft(sessionId, turn, actor.getId(), EventType.DAMAGE, damage, now), events);

            if (applied != null) {
                emit(statusApplied(sessionId, turn, actor.getId(), hit.getId(), applied, now), events);
            }
            if (wasAlive && !hit.isAlive()) {
                JsonObject by = new JsonObject();
                by.addProperty("combatant_id", actor.getId());
                by.addProperty("skill_id", skillId);
                JsonObject death = new JsonObject();
                death.addProperty("target_combatant_id", hit.getId());
                death.add("by", by);
                emit(new ActionEventDraft(sessionId, turn, actor.getId(), EventType.DEATH, death, now), events);
                logger.debug("[CombatEngine] {} killed {} with {}", actor.getId(), hit.getId(), skillId);
            }
        }
    }

    private Combatant defend(Combatant actor, int turn, Instant now, List<ActionEvent> events) {
        String sessionId = actor.getCombatSessionId();
        int gain = CompanionTactics.armorGain(actor);
        emit(skillUsed(sessionId, turn, actor.getId(), Skills.BASIC_DEFEND, 1, now), events);

        Combatant next = actor.copy();
        next.setArmor(next.getArmor() + gain);
        List<StatusEffect> applied = new ArrayList<>();
        for (String id : List.of("barrier", "guard")) {
            JsonObject data = new JsonObject();
            data.addProperty("source", Skills.BASIC_DEFEND);
            data.addProperty("armor_gain", gain);
            StatusEffect status = new StatusEffect(id, turn + 1, 1, data);
            next.setStatuses(StatusEffectProcessor.withStatus(next.getStatuses(), status));
            applied.add(status);
        }
        store.updateCombatant(next);
        for (StatusEffect status : applied) {
            emit(statusApplied(sessionId, turn, actor.getId(), actor.getId(), status, now), events);
        }
        return next;
    }

    private Combatant recover(Combatant actor, int turn, Instant now, List<ActionEvent> events) {
        String sessionId = actor.getCombatSessionId();
        emit(skillUsed(sessionId, turn, actor.getId(), Skills.BASIC_RECOVER_MP, 1, now), events);

        Combatant next = actor.copy();
        next.setPower(next.getPower() + CompanionTactics.powerGain(actor));
        store.updateCombatant(next);

        JsonObject payload = new JsonObject();
        payload.addProperty("target_combatant_id", actor.getId());
        payload.addProperty("amount", next.getPower() - actor.getPower());
        payload.addProperty("power_after", next.getPower());
        emit(new ActionEventDraft(sessionId, turn, actor.getId(), EventType.POWER_GAIN, payload, now), events);
        return next;
    }

    // === Helpers ===

    private Combatant applyTick(Combatant combatant, int turn, TickPhase phase, Instant now, List<ActionEvent> events) {
        StatusTickResult result = statusProcessor.tick(combatant, turn, phase, now);
        if (!result.isNoop()) {
            store.updateCombatant(result.getCombatant());
        }
        for (ActionEventDraft draft : result.getEvents()) {
            emit(draft, events);
        }
        return result.getCombatant();
    }

    private StepOutcome endCombat(CombatSession session, int turn, List<Combatant> all, Instant now, List<ActionEvent> events) {
        SettlementResult settlement = settlementEngine.settle(session, turn, all, now);
        events.addAll(settlement.getEvents());
        return StepOutcome.ended(settlement);
    }

    private StepOutcome supersededAfterWrite(String sessionId, int turn) {
        logger.warn("[CombatEngine] Session {} turn {} was resolved but the pointer had already moved; stopping", sessionId, turn);
        return StepOutcome.superseded();
    }

    /**
     * Combat is over when no player or no NPC is left standing. Summons never keep a side alive.
     */
    static boolean isOneSideDefeated(List<Combatant> combatants) {
        boolean playerAlive = false;
        boolean npcAlive = false;
        for (Combatant c : combatants) {
            if (!c.isAlive()) continue;
            if (c.isPlayer()) playerAlive = true;
            if (c.isNpc()) npcAlive = true;
        }
        return !playerAlive || !npcAlive;
    }

    private static Set<String> aliveIds(List<Combatant> combatants) {
        Set<String> ids = new HashSet<>();
        for (Combatant c : combatants) {
            if (c.isAlive()) ids.add(c.getId());
        }
        return ids;
    }

    private void emit(ActionEventDraft draft, List<ActionEvent> events) {
        events.add(store.appendEvent(draft));
    }

    private static ActionEventDraft skillUsed(String sessionId, int turn, String actorId, String skillId, int targets, Instant now) {
        JsonObject payload = new JsonObject();
        payload.addProperty("skill_id", skillId);
        payload.addProperty("skill_name", Skills.nameOf(skillId));
        payload.addProperty("target_count", targets);
        return new ActionEventDraft(sessionId, turn, actorId, EventType.SKILL_USED, payload, now);
    }

    private static ActionEventDraft statusApplied(String sessionId, int turn, String actorId, String targetId,
                                                  StatusEffect status, Instant now) {
        JsonObject s = new JsonObject();
        s.addProperty("id", status.getId());
        if (status.getExpiresTurn() != null) {
            s.addProperty("duration_turns", status.getExpiresTurn() - turn);
            s.addProperty("expires_turn", status.getExpiresTurn());
        }
        if (status.getSource() != null) {
            s.addProperty("source", status.getSource());
        }
        JsonObject payload = new JsonObject();
        payload.addProperty("target_combatant_id", targetId);
        payload.add("status", s);
        return new ActionEventDraft(sessionId, turn, actorId, EventType.STATUS_APPLIED, payload, now);
    }

    private static ActionEventDraft turnMarker(String sessionId, int turn, String actorId, EventType type, Instant now) {
        JsonObject payload = new JsonObject();
        payload.addProperty("actor_combatant_id", actorId);
        return new ActionEventDraft(sessionId, turn, actorId, type, payload, now);
    }

    private CombatSession loadSession(String campaignId, String combatSessionId) {
        CombatSession session = store.getSession(combatSessionId);
        if (session == null || !campaignId.equals(session.getCampaignId())) {
            return null;
        }
        return session;
    }

    /**
     * Build the call result from the session as it is now stored.
     */
    private AdvanceResult snapshot(String campaignId, String combatSessionId, int ticks, ResolutionState state,
                                   List<ActionEvent> events, SettlementResult settlement) {
        CombatSession session = loadSession(campaignId, combatSessionId);
        if (session == null) {
            return new AdvanceResult(ticks, ResolutionState.IDLE, false, false, 0, null, events, settlement);
        }
        int index = session.getCurrentTurnIndex();
        if (!session.isActive()) {
            return new AdvanceResult(ticks, ResolutionState.ENDED, true, false, index, null, events, settlement);
        }

        TurnOrder order = new TurnOrder(combatSessionId, store.getTurnOrder(combatSessionId));
        String nextActorId = order.combatantAt(index);
        Combatant next = store.getCombatant(combatSessionId, nextActorId);
        boolean playerTurn = next != null && next.isPlayer() && next.isAlive();
        ResolutionState finalState = state;
        if (playerTurn && state == ResolutionState.BUDGET_EXHAUSTED) {
            finalState = ResolutionState.AWAITING_PLAYER;
        }
        return new AdvanceResult(ticks, finalState, false, playerTurn, index, nextActorId, events, settlement);
    }

    // === Step outcome ===

    private enum StepKind { ADVANCED, AWAITING_PLAYER, ENDED, SUPERSEDED }

    private static final class StepOutcome {
        final StepKind kind;
        final int nextIndex;
        final SettlementResult settlement;

        private StepOutcome(StepKind kind, int nextIndex, SettlementResult settlement) {
            this.kind = kind;
            this.nextIndex = nextIndex;
            this.settlement = settlement;
        }

        static StepOutcome advanced(int nextIndex) {
            return new StepOutcome(StepKind.ADVANCED, nextIndex, null);
        }

        static StepOutcome awaitingPlayer() {
            return new StepOutcome(StepKind.AWAITING_PLAYER, -1, null);
        }

        static StepOutcome ended(SettlementResult settlement) {
            return new StepOutcome(StepKind.ENDED, -1, settlement);
        }

        static StepOutcome superseded() {
            return new StepOutcome(StepKind.SUPERSEDED, -1, null);
        }
    }
}
