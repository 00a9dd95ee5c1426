package com.example.mythic.persistence;

import com.example.mythic.model.Board;
import com.example.mythic.model.BoardTransition;
import com.example.mythic.model.BossInstance;
import com.example.mythic.model.BossTemplate;
import com.example.mythic.model.CombatSession;
import com.example.mythic.model.Combatant;
import com.example.mythic.model.Faction;
import com.example.mythic.model.LootItem;
import com.example.mythic.model.MemoryEvent;
import com.example.mythic.model.ReputationEvent;

import java.util.List;

/**
 * Inserts and inspection reads used to set up encounters (simulation tool, tests).
 * The engine itself never sees this interface.
 */
public interface CombatSeeder {

    void insertSession(CombatSession session);

    void insertCombatant(Combatant combatant);

    /** Assign turn indices 0..n-1 in the given order */
    void insertTurnOrder(String combatSessionId, List<String> combatantIds);

    void insertBossTemplate(BossTemplate template);

    void insertBossInstance(BossInstance instance);

    void insertFaction(Faction faction);

    void insertBoard(Board board);

    Board getBoard(String boardId);

    int getExperience(String characterId);

    List<LootItem> getInventory(String characterId);

    List<ReputationEvent> getReputationEvents(String campaignId);

    List<MemoryEvent> getMemoryEvents(String campaignId);

    List<BoardTransition> getBoardTransitions(String campaignId);
}
