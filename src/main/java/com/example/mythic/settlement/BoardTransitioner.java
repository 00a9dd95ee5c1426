package com.example.mythic.settlement;

import com.example.mythic.model.Board;
import com.example.mythic.model.BoardTransition;
import com.example.mythic.model.BoardType;
import com.example.mythic.persistence.CombatStore;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Returns a campaign from its combat board to the board it was on before the fight.
 */
public class BoardTransitioner {

    private static final Logger logger = LoggerFactory.getLogger(BoardTransitioner.class);

    public static final String REASON = "combat_end";
    public static final String ANIMATION = "page_turn";

    private final CombatStore store;

    public BoardTransitioner(CombatStore store) {
        this.store = store;
    }

    /**
     * Re-activate the most recently updated non-combat board, archive the combat board and
     * record the transition.
     * @param outcome outcome summary stored in the transition payload
     * @return the recorded transition, or null if the campaign has no non-combat board
     */
    public BoardTransition returnFromCombat(String campaignId, String combatSessionId, JsonObject outcome, Instant now) {
        Board target = store.findLatestNonCombatBoard(campaignId);
        if (target == null) {
            logger.info("[BoardTransitioner] Campaign {} has no board to return to after combat {}", campaignId, combatSessionId);
            return null;
        }

        store.updateBoardStatus(target.getId(), Board.STATUS_ACTIVE, now);
        Board combatBoard = store.findCombatBoard(campaignId, combatSessionId);
        if (combatBoard != null) {
            store.updateBoardStatus(combatBoard.getId(), Board.STATUS_ARCHIVED, now);
        }

        JsonObject payload = new JsonObject();
        payload.addProperty("combat_session_id", combatSessionId);
        payload.add("outcome", outcome == null ? new JsonObject() : outcome.deepCopy());
        BoardTransition transition = new BoardTransition(campaignId, BoardType.COMBAT, target.getBoardType(),
            REASON, ANIMATION, payload, now);
        store.recordBoardTransition(transition);
        logger.info("[BoardTransitioner] Campaign {} returned from combat {} to {} board {}",
            campaignId, combatSessionId, target.getBoardType().getKey(), target.getId());
        return transition;
    }
}
