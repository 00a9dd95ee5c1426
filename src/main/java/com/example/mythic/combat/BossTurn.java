package com.example.mythic.combat;

import com.example.mythic.model.ActionEventDraft;

/**
 * What a boss does this turn: the selected skill, the phase it acts in, and the
 * {@code phase_shift} event to append when the phase just changed (null otherwise).
 */
public record BossTurn(String skillId, int phase, boolean multiTarget, ActionEventDraft phaseShift) {

    public boolean isPhaseShifted() {
        return phaseShift != null;
    }
}
