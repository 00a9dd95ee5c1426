package com.example.mythic.combat;

import com.example.mythic.model.ActionEvent;
import com.example.mythic.settlement.SettlementResult;

import java.util.List;

/**
 * Outcome of one resolution call.
 */
public class AdvanceResult {

    private final int ticks;
    private final ResolutionState state;
    private final boolean ended;
    private final boolean requiresPlayerAction;
    private final int currentTurnIndex;
    private final String nextActorCombatantId;
    private final List<ActionEvent> events;
    private final SettlementResult settlement;

    AdvanceResult(int ticks, ResolutionState state, boolean ended, boolean requiresPlayerAction,
                  int currentTurnIndex, String nextActorCombatantId, List<ActionEvent> events,
                  SettlementResult settlement) {
        this.ticks = ticks;
        this.state = state;
        this.ended = ended;
        this.requiresPlayerAction = requiresPlayerAction;
        this.currentTurnIndex = currentTurnIndex;
        this.nextActorCombatantId = nextActorCombatantId;
        this.events = List.copyOf(events);
        this.settlement = settlement;
    }

    /** Turns resolved (acted or skipped) during this call */
    public int getTicks() { return ticks; }
    public ResolutionState getState() { return state; }
    public boolean isEnded() { return ended; }
    public boolean isRequiresPlayerAction() { return requiresPlayerAction; }
    public int getCurrentTurnIndex() { return currentTurnIndex; }

    /** Combatant whose turn it is now; null once combat has ended */
    public String getNextActorCombatantId() { return nextActorCombatantId; }

    /** Events appended during this call, in order */
    public List<ActionEvent> getEvents() { return events; }

    /** Present only when this call ended the combat */
    public SettlementResult getSettlement() { return settlement; }

    @Override
    public String toString() {
        return String.format("AdvanceResult[ticks=%d state=%s ended=%s requiresPlayerAction=%s turn=%d next=%s]",
            ticks, state, ended, requiresPlayerAction, currentTurnIndex, nextActorCombatantId);
    }
}
