package com.example.mythic.settlement;

import com.example.mythic.model.ActionEvent;
import com.example.mythic.model.BoardTransition;
import com.example.mythic.model.LootItem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one settlement pass did. Side-effect outcomes are reported separately and never
 * change the authoritative fields.
 */
public class SettlementResult {

    private final boolean settled;
    private final boolean won;
    private final int alivePlayers;
    private final int aliveNpcs;
    private final Map<String, Integer> experienceByCharacter;
    private final List<LootItem> loot;
    private final List<SideEffectResult> sideEffects;
    private final BoardTransition boardTransition;
    private final List<ActionEvent> events;

    SettlementResult(boolean settled, boolean won, int alivePlayers, int aliveNpcs,
                     Map<String, Integer> experienceByCharacter, List<LootItem> loot,
                     List<SideEffectResult> sideEffects, BoardTransition boardTransition,
                     List<ActionEvent> events) {
        this.settled = settled;
        this.won = won;
        this.alivePlayers = alivePlayers;
        this.aliveNpcs = aliveNpcs;
        this.experienceByCharacter = Collections.unmodifiableMap(new LinkedHashMap<>(experienceByCharacter));
        this.loot = List.copyOf(loot);
        this.sideEffects = List.copyOf(sideEffects);
        this.boardTransition = boardTransition;
        this.events = List.copyOf(events);
    }

    /**
     * Result for a session some other call already ended; nothing was written.
     */
    static SettlementResult alreadySettled() {
        return new SettlementResult(false, false, 0, 0, Map.of(), List.of(), List.of(), null, List.of());
    }

    /** False when the session had already been ended by another call */
    public boolean isSettled() { return settled; }
    public boolean isWon() { return won; }
    public int getAlivePlayers() { return alivePlayers; }
    public int getAliveNpcs() { return aliveNpcs; }

    /** Experience granted in this pass, by character id */
    public Map<String, Integer> getExperienceByCharacter() { return experienceByCharacter; }
    public List<LootItem> getLoot() { return loot; }
    public List<SideEffectResult> getSideEffects() { return sideEffects; }

    public List<SideEffectResult> getFailedSideEffects() {
        return sideEffects.stream().filter(r -> !r.isOk()).toList();
    }

    /** Null if there was no board to return to */
    public BoardTransition getBoardTransition() { return boardTransition; }

    /** Events appended by this pass, in order */
    public List<ActionEvent> getEvents() { return events; }
}
