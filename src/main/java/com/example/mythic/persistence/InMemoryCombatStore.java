package com.example.mythic.persistence;

import com.example.mythic.model.ActionEvent;
import com.example.mythic.model.ActionEventDraft;
import com.example.mythic.model.Board;
import com.example.mythic.model.BoardTransition;
import com.example.mythic.model.BoardType;
import com.example.mythic.model.BossInstance;
import com.example.mythic.model.BossTemplate;
import com.example.mythic.model.CombatSession;
import com.example.mythic.model.Combatant;
import com.example.mythic.model.ExperienceAward;
import com.example.mythic.model.Faction;
import com.example.mythic.model.FactionReputation;
import com.example.mythic.model.LootDrop;
import com.example.mythic.model.LootItem;
import com.example.mythic.model.MemoryEvent;
import com.example.mythic.model.ReputationEvent;
import com.example.mythic.model.SessionStatus;
import com.example.mythic.model.TurnSlot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Map-backed store for tests and the simulation tool.
 * All methods synchronize on the store, so each call is atomic.
 */
public class InMemoryCombatStore implements CombatStore, CombatSeeder {

    private final Map<String, CombatSession> sessions = new HashMap<>();
    private final Map<String, List<TurnSlot>> turnOrders = new HashMap<>();
    /** sessionId -> combatantId -> combatant, in insertion order */
    private final Map<String, Map<String, Combatant>> combatants = new HashMap<>();
    private final List<ActionEvent> events = new ArrayList<>();
    private long nextEventId = 1;

    private final Map<String, BossTemplate> bossTemplates = new HashMap<>();
    private final Map<String, BossInstance> bossInstances = new LinkedHashMap<>();

    private final List<Faction> factions = new ArrayList<>();
    private final Map<String, FactionReputation> reputations = new HashMap<>();
    private final List<ReputationEvent> reputationEvents = new ArrayList<>();
    private final List<MemoryEvent> memoryEvents = new ArrayList<>();

    private final List<ExperienceAward> experienceAwards = new ArrayList<>();
    private final Map<String, Integer> experience = new HashMap<>();
    private final List<LootDrop> lootDrops = new ArrayList<>();
    private final Map<String, List<LootItem>> inventories = new HashMap<>();

    private final Map<String, Board> boards = new LinkedHashMap<>();
    private final List<BoardTransition> boardTransitions = new ArrayList<>();

    // === Sessions ===

    @Override
    public synchronized CombatSession getSession(String combatSessionId) {
        CombatSession s = sessions.get(combatSessionId);
        return s == null ? null : s.copy();
    }

    @Override
    public synchronized boolean advanceTurnPointer(String combatSessionId, int expectedIndex, int nextIndex, Instant at) {
        CombatSession s = sessions.get(combatSessionId);
        if (s == null || !s.isActive() || s.getCurrentTurnIndex() != expectedIndex) {
            return false;
        }
        s.setCurrentTurnIndex(nextIndex);
        s.setUpdatedAt(at);
        return true;
    }

    @Override
    public synchronized boolean markSessionEnded(String combatSessionId, Instant at) {
        CombatSession s = sessions.get(combatSessionId);
        if (s == null || !s.isActive()) {
            return false;
        }
        s.setStatus(SessionStatus.ENDED);
        s.setUpdatedAt(at);
        return true;
    }

    // === Turn order and combatants ===

    @Override
    public synchronized List<TurnSlot> getTurnOrder(String combatSessionId) {
        List<TurnSlot> slots = new ArrayList<>(turnOrders.getOrDefault(combatSessionId, List.of()));
        slots.sort(Comparator.comparingInt(TurnSlot::turnIndex));
        return slots;
    }

    @Override
    public synchronized Combatant getCombatant(String combatSessionId, String combatantId) {
        Combatant c = combatants.getOrDefault(combatSessionId, Map.of()).get(combatantId);
        return c == null ? null : c.copy();
    }

    @Override
    public synchronized List<Combatant> getCombatants(String combatSessionId) {
        List<Combatant> out = new ArrayList<>();
        for (Combatant c : combatants.getOrDefault(combatSessionId, Map.of()).values()) {
            out.add(c.copy());
        }
        return out;
    }

    @Override
    public synchronized void updateCombatant(Combatant combatant) {
        Map<String, Combatant> bySession = combatants.get(combatant.getCombatSessionId());
        if (bySession == null || !bySession.containsKey(combatant.getId())) {
            throw new StoreException("Combatant " + combatant.getId() + " does not exist");
        }
        bySession.put(combatant.getId(), combatant.copy());
    }

    // === Event log ===

    @Override
    public synchronized ActionEvent appendEvent(ActionEventDraft draft) {
        ActionEvent event = draft.toEvent(nextEventId++);
        events.add(event);
        return event;
    }

    @Override
    public synchronized List<ActionEvent> getEvents(String combatSessionId) {
        List<ActionEvent> out = new ArrayList<>();
        for (ActionEvent e : events) {
            if (e.getCombatSessionId().equals(combatSessionId)) {
                out.add(e);
            }
        }
        return out;
    }

    // === Bosses ===

    @Override
    public synchronized BossInstance getBossInstance(String combatSessionId, String combatantId) {
        for (BossInstance b : bossInstances.values()) {
            if (b.getCombatSessionId().equals(combatSessionId) && b.getCombatantId().equals(combatantId)) {
                return b.copy();
            }
        }
        return null;
    }

    @Override
    public synchronized BossTemplate getBossTemplate(String templateId) {
        return bossTemplates.get(templateId);
    }

    @Override
    public synchronized void updateBossPhase(String bossInstanceId, int phase) {
        BossInstance b = bossInstances.get(bossInstanceId);
        if (b == null) {
            throw new StoreException("Boss instance " + bossInstanceId + " does not exist");
        }
        b.setCurrentPhase(phase);
    }

    // === Factions, reputation and memory ===

    @Override
    public synchronized List<Faction> getFactions(String campaignId) {
        return factions.stream().filter(f -> f.campaignId().equals(campaignId)).toList();
    }

    @Override
    public synchronized FactionReputation getReputation(String campaignId, String factionId, String playerId) {
        return reputations.get(reputationKey(campaignId, factionId, playerId));
    }

    @Override
    public synchronized void appendReputationEvent(ReputationEvent event) {
        reputationEvents.add(event);
    }

    @Override
    public synchronized void upsertReputation(FactionReputation reputation) {
        reputations.put(reputationKey(reputation.campaignId(), reputation.factionId(), reputation.playerId()), reputation);
    }

    @Override
    public synchronized void appendMemoryEvent(MemoryEvent event) {
        memoryEvents.add(event);
    }

    private static String reputationKey(String campaignId, String factionId, String playerId) {
        return campaignId + "|" + factionId + "|" + playerId;
    }

    // === Rewards ===

    @Override
    public synchronized boolean hasExperienceAward(String characterId, String combatSessionId) {
        return experienceAwards.stream().anyMatch(a -> a.characterId().equals(characterId)
            && a.combatSessionId().equals(combatSessionId));
    }

    @Override
    public synchronized int grantExperience(ExperienceAward award) {
        experienceAwards.add(award);
        return experience.merge(award.characterId(), award.amount(), Integer::sum);
    }

    @Override
    public synchronized boolean hasLootDrop(String characterId, String combatSessionId) {
        return lootDrops.stream().anyMatch(d -> d.characterId().equals(characterId)
            && d.combatSessionId().equals(combatSessionId));
    }

    @Override
    public synchronized void grantLoot(LootItem item, LootDrop drop) {
        inventories.computeIfAbsent(item.getOwnerCharacterId(), k -> new ArrayList<>()).add(item);
        lootDrops.add(drop);
    }

    // === Boards ===

    @Override
    public synchronized Board findLatestNonCombatBoard(String campaignId) {
        Board latest = null;
        for (Board b : boards.values()) {
            if (!b.getCampaignId().equals(campaignId) || b.getBoardType() == BoardType.COMBAT) continue;
            if (latest == null || b.getUpdatedAt().isAfter(latest.getUpdatedAt())) {
                latest = b;
            }
        }
        return latest == null ? null : latest.copy();
    }

    @Override
    public synchronized Board findCombatBoard(String campaignId, String combatSessionId) {
        for (Board b : boards.values()) {
            if (b.getCampaignId().equals(campaignId) && b.getBoardType() == BoardType.COMBAT
                && combatSessionId.equals(b.getCombatSessionId())) {
                return b.copy();
            }
        }
        return null;
    }

    @Override
    public synchronized void updateBoardStatus(String boardId, String status, Instant at) {
        Board b = boards.get(boardId);
        if (b == null) {
            throw new StoreException("Board " + boardId + " does not exist");
        }
        b.setStatus(status);
        b.setUpdatedAt(at);
    }

    @Override
    public synchronized void recordBoardTransition(BoardTransition transition) {
        boardTransitions.add(transition);
    }

    // === Seeding ===

    @Override
    public synchronized void insertSession(CombatSession session) {
        sessions.put(session.getId(), session.copy());
    }

    @Override
    public synchronized void insertCombatant(Combatant combatant) {
        combatants.computeIfAbsent(combatant.getCombatSessionId(), k -> new LinkedHashMap<>())
            .put(combatant.getId(), combatant.copy());
    }

    @Override
    public synchronized void insertTurnOrder(String combatSessionId, List<String> combatantIds) {
        List<TurnSlot> slots = new ArrayList<>();
        for (int i = 0; i < combatantIds.size(); i++) {
            slots.add(new TurnSlot(i, combatantIds.get(i)));
        }
        turnOrders.put(combatSessionId, slots);
    }

    @Override
    public synchronized void insertBossTemplate(BossTemplate template) {
        bossTemplates.put(template.getId(), template);
    }

    @Override
    public synchronized void insertBossInstance(BossInstance instance) {
        bossInstances.put(instance.getId(), instance.copy());
    }

    @Override
    public synchronized void insertFaction(Faction faction) {
        factions.add(faction);
    }

    @Override
    public synchronized void insertBoard(Board board) {
        boards.put(board.getId(), board.copy());
    }

    @Override
    public synchronized Board getBoard(String boardId) {
        Board b = boards.get(boardId);
        return b == null ? null : b.copy();
    }

    @Override
    public synchronized int getExperience(String characterId) {
        return experience.getOrDefault(characterId, 0);
    }

    @Override
    public synchronized List<LootItem> getInventory(String characterId) {
        return List.copyOf(inventories.getOrDefault(characterId, List.of()));
    }

    @Override
    public synchronized List<ReputationEvent> getReputationEvents(String campaignId) {
        return reputationEvents.stream().filter(e -> e.campaignId().equals(campaignId)).toList();
    }

    @Override
    public synchronized List<MemoryEvent> getMemoryEvents(String campaignId) {
        return memoryEvents.stream().filter(e -> e.campaignId().equals(campaignId)).toList();
    }

    @Override
    public synchronized List<BoardTransition> getBoardTransitions(String campaignId) {
        return boardTransitions.stream().filter(t -> t.campaignId().equals(campaignId)).toList();
    }
}
