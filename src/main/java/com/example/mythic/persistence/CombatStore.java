package com.example.mythic.persistence;

import com.example.mythic.model.ActionEvent;
import com.example.mythic.model.ActionEventDraft;
import com.example.mythic.model.Board;
import com.example.mythic.model.BoardTransition;
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
import com.example.mythic.model.TurnSlot;

import java.time.Instant;
import java.util.List;

/**
 * Everything the engine and settlement read or write goes through this interface.
 *
 * Lookups return null when the row does not exist. Implementations hand out copies, so
 * callers must write changes back explicitly. Any storage failure surfaces as an unchecked
 * {@link StoreException}.
 */
public interface CombatStore {

    // === Sessions ===

    CombatSession getSession(String combatSessionId);

    /**
     * Move the turn pointer, but only if it still points at {@code expectedIndex} and the
     * session is active.
     * @return false if another writer moved the pointer or ended the session first
     */
    boolean advanceTurnPointer(String combatSessionId, int expectedIndex, int nextIndex, Instant at);

    /**
     * Transition the session to ended.
     * @return true only for the call that performed the transition
     */
    boolean markSessionEnded(String combatSessionId, Instant at);

    // === Turn order and combatants ===

    /** Slots ordered by turn index */
    List<TurnSlot> getTurnOrder(String combatSessionId);

    Combatant getCombatant(String combatSessionId, String combatantId);

    /** All combatants of the session in creation order */
    List<Combatant> getCombatants(String combatSessionId);

    void updateCombatant(Combatant combatant);

    // === Event log ===

    /**
     * Append an event and return it with its store-assigned sequence id.
     */
    ActionEvent appendEvent(ActionEventDraft draft);

    /** Events of the session in append order */
    List<ActionEvent> getEvents(String combatSessionId);

    // === Bosses ===

    BossInstance getBossInstance(String combatSessionId, String combatantId);

    BossTemplate getBossTemplate(String templateId);

    void updateBossPhase(String bossInstanceId, int phase);

    // === Factions, reputation and memory ===

    /** Factions of the campaign in creation order */
    List<Faction> getFactions(String campaignId);

    FactionReputation getReputation(String campaignId, String factionId, String playerId);

    void appendReputationEvent(ReputationEvent event);

    void upsertReputation(FactionReputation reputation);

    void appendMemoryEvent(MemoryEvent event);

    // === Rewards ===

    boolean hasExperienceAward(String characterId, String combatSessionId);

    /**
     * Record the award and add it to the character's experience.
     * @return the character's experience total after the award
     */
    int grantExperience(ExperienceAward award);

    boolean hasLootDrop(String characterId, String combatSessionId);

    /** Store the item in the owner's inventory and record the drop */
    void grantLoot(LootItem item, LootDrop drop);

    // === Boards ===

    /** Most recently updated board of the campaign whose type is not combat, or null */
    Board findLatestNonCombatBoard(String campaignId);

    /** Board hosting the given combat session, or null */
    Board findCombatBoard(String campaignId, String combatSessionId);

    void updateBoardStatus(String boardId, String status, Instant at);

    void recordBoardTransition(BoardTransition transition);
}
