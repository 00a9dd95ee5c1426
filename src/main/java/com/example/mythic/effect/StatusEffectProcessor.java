package com.example.mythic.effect;

import com.example.mythic.model.ActionEventDraft;
import com.example.mythic.model.Combatant;
import com.example.mythic.model.EventType;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies start-of-turn and end-of-turn status ticks to a single combatant.
 *
 * Periodic damage and healing are summed over all statuses, applied once, rounded and
 * clamped to [0, hpMax]. Statuses whose {@code expires_turn <= turnIndex} are removed on
 * either hook. The processor never touches the store; it returns the mutated copy and the
 * events to append.
 */
public class StatusEffectProcessor {

    private static final Logger logger = LoggerFactory.getLogger(StatusEffectProcessor.class);

    private final EffectRegistry registry;

    public StatusEffectProcessor() {
        this(new EffectRegistry());
    }

    public StatusEffectProcessor(EffectRegistry registry) {
        this.registry = registry;
    }

    public StatusTickResult tick(Combatant combatant, int turnIndex, TickPhase phase, Instant now) {
        Combatant next = combatant.copy();
        boolean aliveBefore = combatant.isAlive();

        double dot = 0;
        double hot = 0;
        List<StatusEffect> kept = new ArrayList<>();
        List<StatusEffect> expired = new ArrayList<>();

        for (StatusEffect status : combatant.getStatuses()) {
            if (status.getId().isEmpty()) {
                continue;
            }
            EffectHandler handler = registry.handlerFor(status);
            dot += handler.periodicDamage(status, phase);
            hot += handler.periodicHeal(status, phase);

            if (status.isExpired(turnIndex)) {
                expired.add(status);
            } else {
                kept.add(status);
            }
        }

        int hpAfter = (int) Math.round(Math.max(0, Math.min(combatant.getHpMax(), combatant.getHp() - dot + hot)));
        next.setHp(hpAfter);
        next.setStatuses(kept);
        boolean died = aliveBefore && !next.isAlive();

        int dotFloor = (int) Math.floor(Math.max(0, dot));
        int hotFloor = (int) Math.floor(Math.max(0, hot));

        List<ActionEventDraft> events = new ArrayList<>();
        String sessionId = combatant.getCombatSessionId();
        if (dot > 0 || hot > 0) {
            JsonObject payload = new JsonObject();
            payload.addProperty("target_combatant_id", combatant.getId());
            payload.addProperty("phase", phase.getKey());
            payload.addProperty("dot_damage", dotFloor);
            payload.addProperty("hot_heal", hotFloor);
            payload.addProperty("hp_after", hpAfter);
            payload.addProperty("is_alive", next.isAlive());
            events.add(new ActionEventDraft(sessionId, turnIndex, combatant.getId(), EventType.STATUS_TICK, payload, now));
        }
        if (!expired.isEmpty()) {
            JsonArray list = new JsonArray();
            for (StatusEffect s : expired) {
                list.add(s.toJson());
            }
            JsonObject payload = new JsonObject();
            payload.addProperty("target_combatant_id", combatant.getId());
            payload.addProperty("phase", phase.getKey());
            payload.add("expired", list);
            events.add(new ActionEventDraft(sessionId, turnIndex, combatant.getId(), EventType.STATUS_EXPIRED, payload, now));
            logger.debug("[StatusEffectProcessor] {} status(es) expired on {} at turn {}", expired.size(), combatant.getId(), turnIndex);
        }
        if (died) {
            JsonObject payload = new JsonObject();
            payload.addProperty("target_combatant_id", combatant.getId());
            payload.addProperty("reason", "status_tick");
            payload.addProperty("hp_after", hpAfter);
            events.add(new ActionEventDraft(sessionId, turnIndex, combatant.getId(), EventType.DEATH, payload, now));
        }

        return new StatusTickResult(next, dotFloor, hotFloor, expired, died, events);
    }

    /**
     * Return a copy of {@code statuses} with any status of the same id replaced by {@code status}.
     */
    public static List<StatusEffect> withStatus(List<StatusEffect> statuses, StatusEffect status) {
        List<StatusEffect> next = new ArrayList<>();
        for (StatusEffect s : statuses) {
            if (!s.getId().equalsIgnoreCase(status.getId())) {
                next.add(s);
            }
        }
        next.add(status);
        return next;
    }
}
