package com.example.mythic.settlement;

import com.example.mythic.model.ActionEvent;
import com.example.mythic.model.ActionEventDraft;
import com.example.mythic.model.BoardTransition;
import com.example.mythic.model.CombatSession;
import com.example.mythic.model.Combatant;
import com.example.mythic.model.EventType;
import com.example.mythic.model.ExperienceAward;
import com.example.mythic.model.LootDrop;
import com.example.mythic.model.LootItem;
import com.example.mythic.model.LootRarity;
import com.example.mythic.persistence.CombatStore;
import com.example.mythic.util.EngineConfig;
import com.example.mythic.util.Json;
import com.example.mythic.util.LootGenerator;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * End-of-combat pass: ends the session, announces the outcome, grants rewards and
 * consequences, and returns the campaign to its previous board.
 *
 * Order:
 *  1. mark the session ended (only the call that wins this transition continues)
 *  2. append combat_end
 *  3. on victory, per surviving player with a character: experience, loot, reputation, memory
 *     on defeat, per player: negative reputation and a setback memory
 *  4. board transition
 *
 * Experience and loot are granted at most once per character and session. Reputation and
 * memory writes are best effort.
 */
public class SettlementEngine {

    private static final Logger logger = LoggerFactory.getLogger(SettlementEngine.class);

    static final int VICTORY_REPUTATION_SEVERITY = 2;
    static final int DEFEAT_REPUTATION_SEVERITY = 2;
    static final int VICTORY_MEMORY_SEVERITY = 2;
    static final int SETBACK_MEMORY_SEVERITY = 3;

    private final CombatStore store;
    private final EngineConfig config;
    private final LootGenerator lootGenerator;
    private final ReputationService reputationService;
    private final BoardTransitioner boardTransitioner;

    public SettlementEngine(CombatStore store, EngineConfig config, LootGenerator lootGenerator) {
        this(store, config, lootGenerator, new ReputationService(store), new BoardTransitioner(store));
    }

    public SettlementEngine(CombatStore store, EngineConfig config, LootGenerator lootGenerator,
                            ReputationService reputationService, BoardTransitioner boardTransitioner) {
        this.store = store;
        this.config = config;
        this.lootGenerator = lootGenerator;
        this.reputationService = reputationService;
        this.boardTransitioner = boardTransitioner;
    }

    /**
     * Settle a session whose alive sets show one side wiped out.
     * @param turnIndex turn the combat ended on
     * @param combatants final combatant state of the session
     */
    public SettlementResult settle(CombatSession session, int turnIndex, List<Combatant> combatants, Instant now) {
        String sessionId = session.getId();
        String campaignId = session.getCampaignId();

        if (!store.markSessionEnded(sessionId, now)) {
            logger.info("[Settlement] Session {} was already ended; skipping settlement", sessionId);
            return SettlementResult.alreadySettled();
        }

        int alivePlayers = 0;
        int aliveNpcs = 0;
        int participants = combatants.size();
        boolean bossPresent = false;
        for (Combatant c : combatants) {
            if (c.isPlayer()) {
                if (c.isAlive()) alivePlayers++;
            } else if (c.isNpc()) {
                if (c.isAlive()) aliveNpcs++;
                if (!bossPresent && store.getBossInstance(sessionId, c.getId()) != null) {
                    bossPresent = true;
                }
            }
        }
        boolean won = alivePlayers > 0 && aliveNpcs == 0;

        List<ActionEvent> events = new ArrayList<>();
        JsonObject endPayload = new JsonObject();
        endPayload.addProperty("alive_players", alivePlayers);
        endPayload.addProperty("alive_npcs", aliveNpcs);
        endPayload.addProperty("won", won);
        events.add(store.appendEvent(new ActionEventDraft(sessionId, turnIndex, null, EventType.COMBAT_END, endPayload, now)));
        logger.info("[Settlement] Session {} ended: won={} alivePlayers={} aliveNpcs={}", sessionId, won, alivePlayers, aliveNpcs);

        Map<String, Integer> xpByCharacter = new LinkedHashMap<>();
        List<LootItem> loot = new ArrayList<>();
        List<SideEffectResult> sideEffects = new ArrayList<>();

        if (won) {
            int xp = config.getXpBase() + participants * config.getXpPerParticipant()
                + (bossPresent ? config.getXpBossBonus() : 0);
            for (Combatant player : combatants) {
                if (!player.isPlayer() || !player.isAlive() || isBlank(player.getCharacterId())) {
                    continue;
                }
                boolean granted = false;
                if (!store.hasExperienceAward(player.getCharacterId(), sessionId)) {
                    int total = store.grantExperience(new ExperienceAward(player.getCharacterId(), sessionId, xp, "combat_victory", now));
                    xpByCharacter.put(player.getCharacterId(), xp);
                    granted = true;
                    JsonObject payload = new JsonObject();
                    payload.addProperty("character_id", player.getCharacterId());
                    payload.addProperty("amount", xp);
                    payload.addProperty("total_xp", total);
                    events.add(store.appendEvent(new ActionEventDraft(sessionId, turnIndex, null, EventType.XP_GAIN, payload, now)));
                }
                if (!store.hasLootDrop(player.getCharacterId(), sessionId)) {
                    LootRarity rarity = LootGenerator.rarityForXp(xp, config.getLootUniqueAboveXp(), config.getLootLegendaryAboveXp());
                    LootItem item = lootGenerator.generate(session.getSeed(), campaignId, sessionId,
                        player.getCharacterId(), player.getLevel(), rarity);
                    store.grantLoot(item, new LootDrop(campaignId, sessionId, player.getCharacterId(), item.getId(),
                        rarity, rarity.getBudgetPoints(), "combat_settlement", now));
                    loot.add(item);
                    granted = true;
                    events.add(store.appendEvent(new ActionEventDraft(sessionId, turnIndex, null, EventType.LOOT_DROP, lootPayload(item), now)));
                }
                if (granted && !isBlank(player.getPlayerId())) {
                    JsonObject evidence = new JsonObject();
                    evidence.addProperty("combat_session_id", sessionId);
                    evidence.addProperty("outcome", "victory");
                    sideEffects.add(reputationService.applyDelta(campaignId, player.getPlayerId(),
                        config.getReputationVictoryDelta(), VICTORY_REPUTATION_SEVERITY, evidence, now));

                    JsonObject memory = new JsonObject();
                    memory.addProperty("type", "combat_victory");
                    memory.addProperty("combat_session_id", sessionId);
                    memory.addProperty("character_id", player.getCharacterId());
                    memory.addProperty("xp", xp);
                    sideEffects.add(reputationService.remember(campaignId, player.getPlayerId(), VICTORY_MEMORY_SEVERITY, memory, now));
                }
            }
        } else {
            Set<String> seenPlayers = new LinkedHashSet<>();
            for (Combatant player : combatants) {
                if (!player.isPlayer() || isBlank(player.getPlayerId()) || !seenPlayers.add(player.getPlayerId())) {
                    continue;
                }
                JsonObject evidence = new JsonObject();
                evidence.addProperty("combat_session_id", sessionId);
                evidence.addProperty("outcome", "defeat");
                sideEffects.add(reputationService.applyDelta(campaignId, player.getPlayerId(),
                    config.getReputationDefeatDelta(), DEFEAT_REPUTATION_SEVERITY, evidence, now));

                JsonObject memory = new JsonObject();
                memory.addProperty("type", "combat_setback");
                memory.addProperty("combat_session_id", sessionId);
                memory.addProperty("survived", player.isAlive());
                sideEffects.add(reputationService.remember(campaignId, player.getPlayerId(), SETBACK_MEMORY_SEVERITY, memory, now));
            }
        }

        for (SideEffectResult r : sideEffects) {
            if (!r.isOk()) {
                logger.warn("[Settlement] Side effect {} failed for session {}: {}", r.getName(), sessionId, r.getReason());
            }
        }

        JsonObject outcome = new JsonObject();
        outcome.addProperty("won", won);
        outcome.addProperty("xp_gained", xpByCharacter.values().stream().mapToInt(Integer::intValue).sum());
        JsonArray lootSummary = new JsonArray();
        for (LootItem item : loot) {
            JsonObject o = new JsonObject();
            o.addProperty("item_id", item.getId());
            o.addProperty("name", item.getName());
            o.addProperty("rarity", item.getRarity().getKey());
            lootSummary.add(o);
        }
        outcome.add("loot", lootSummary);

        BoardTransition transition = boardTransitioner.returnFromCombat(campaignId, sessionId, outcome, now);
        if (transition != null) {
            JsonObject payload = new JsonObject();
            payload.addProperty("from", transition.fromBoardType().getKey());
            payload.addProperty("to", transition.toBoardType().getKey());
            payload.addProperty("reason", transition.reason());
            payload.addProperty("animation", transition.animation());
            events.add(store.appendEvent(new ActionEventDraft(sessionId, turnIndex, null, EventType.BOARD_TRANSITION, payload, now)));
        }

        return new SettlementResult(true, won, alivePlayers, aliveNpcs, xpByCharacter, loot, sideEffects, transition, events);
    }

    private static JsonObject lootPayload(LootItem item) {
        JsonObject payload = new JsonObject();
        payload.addProperty("character_id", item.getOwnerCharacterId());
        payload.addProperty("item_id", item.getId());
        payload.addProperty("name", item.getName());
        payload.addProperty("rarity", item.getRarity().getKey());
        payload.addProperty("slot", item.getSlot());
        payload.addProperty("item_power", item.getItemPower());
        payload.addProperty("required_level", item.getRequiredLevel());
        payload.addProperty("drop_tier", item.getDropTier());
        payload.addProperty("bind_policy", item.getBindPolicy());
        payload.add("stat_mods", Json.GSON.toJsonTree(item.getStatMods()));
        if (item.getDrawback() != null) {
            payload.addProperty("drawback", item.getDrawback());
        }
        return payload;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
