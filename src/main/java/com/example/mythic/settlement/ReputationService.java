package com.example.mythic.settlement;

import com.example.mythic.model.Faction;
import com.example.mythic.model.FactionReputation;
import com.example.mythic.model.MemoryEvent;
import com.example.mythic.model.ReputationEvent;
import com.example.mythic.persistence.CombatStore;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Reputation and narrative memory writes made at settlement.
 * Both are best effort: any failure is caught and returned as a {@link SideEffectResult}.
 */
public class ReputationService {

    private static final Logger logger = LoggerFactory.getLogger(ReputationService.class);

    public static final String MEMORY_CATEGORY = "quest_thread";

    private final CombatStore store;

    public ReputationService(CombatStore store) {
        this.store = store;
    }

    /**
     * Apply {@code delta} toward the campaign's primary (first) faction: append the event,
     * then upsert the clamped aggregate. Campaigns without factions are left untouched.
     */
    public SideEffectResult applyDelta(String campaignId, String playerId, int delta, int severity,
                                       JsonObject evidence, Instant now) {
        String name = "reputation:" + playerId;
        try {
            List<Faction> factions = store.getFactions(campaignId);
            if (factions.isEmpty()) {
                logger.debug("[ReputationService] Campaign {} has no factions; skipping reputation for {}", campaignId, playerId);
                return SideEffectResult.ok(name);
            }
            Faction primary = factions.get(0);
            ReputationEvent event = new ReputationEvent(campaignId, primary.id(), playerId, severity, delta, evidence, now);
            store.appendReputationEvent(event);

            FactionReputation current = store.getReputation(campaignId, primary.id(), playerId);
            int before = current == null ? 0 : current.rep();
            store.upsertReputation(new FactionReputation(campaignId, primary.id(), playerId, before + event.delta()));
            return SideEffectResult.ok(name);
        } catch (RuntimeException e) {
            logger.warn("[ReputationService] Reputation update failed for player {} in campaign {}: {}",
                playerId, campaignId, e.getMessage(), e);
            return SideEffectResult.failed(name, e.getMessage());
        }
    }

    /**
     * Append a long-term memory entry in the quest thread category.
     */
    public SideEffectResult remember(String campaignId, String playerId, int severity, JsonObject payload, Instant now) {
        String name = "memory:" + playerId;
        try {
            store.appendMemoryEvent(new MemoryEvent(campaignId, playerId, MEMORY_CATEGORY, severity, payload, now));
            return SideEffectResult.ok(name);
        } catch (RuntimeException e) {
            logger.warn("[ReputationService] Memory write failed for player {} in campaign {}: {}",
                playerId, campaignId, e.getMessage(), e);
            return SideEffectResult.failed(name, e.getMessage());
        }
    }
}
