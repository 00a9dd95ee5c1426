package com.example.mythic.net;

import com.example.mythic.combat.AdvanceResult;
import com.google.gson.JsonObject;

/**
 * Sanitized result returned to callers. A rejected response carries only an error code
 * and a generic message; exception detail stays in the server log.
 */
public final class AdvanceCombatResponse {

    public static final String INVALID_REQUEST = "invalid_request";
    public static final String FORBIDDEN = "forbidden";
    public static final String COMBAT_TICK_FAILED = "combat_tick_failed";

    private final boolean ok;
    private final String errorCode;
    private final String message;
    private final int ticks;
    private final boolean ended;
    private final boolean requiresPlayerAction;
    private final int currentTurnIndex;
    private final String nextActorCombatantId;

    private AdvanceCombatResponse(boolean ok, String errorCode, String message, int ticks, boolean ended,
                                  boolean requiresPlayerAction, int currentTurnIndex, String nextActorCombatantId) {
        this.ok = ok;
        this.errorCode = errorCode;
        this.message = message;
        this.ticks = ticks;
        this.ended = ended;
        this.requiresPlayerAction = requiresPlayerAction;
        this.currentTurnIndex = currentTurnIndex;
        this.nextActorCombatantId = nextActorCombatantId;
    }

    public static AdvanceCombatResponse ok(AdvanceResult result) {
        return new AdvanceCombatResponse(true, null, null, result.getTicks(), result.isEnded(),
            result.isRequiresPlayerAction(), result.getCurrentTurnIndex(), result.getNextActorCombatantId());
    }

    public static AdvanceCombatResponse rejected(String errorCode, String message) {
        return new AdvanceCombatResponse(false, errorCode, message, 0, false, false, -1, null);
    }

    public boolean isOk() { return ok; }
    public String getErrorCode() { return errorCode; }
    public String getMessage() { return message; }
    public int getTicks() { return ticks; }
    public boolean isEnded() { return ended; }
    public boolean isRequiresPlayerAction() { return requiresPlayerAction; }
    public int getCurrentTurnIndex() { return currentTurnIndex; }
    public String getNextActorCombatantId() { return nextActorCombatantId; }

    /**
     * Wire form: {@code {ok, ticks, ended, requires_player_action, current_turn_index, next_actor_combatant_id}}
     * on success, {@code {ok, code, message}} on rejection.
     */
    public JsonObject toJson() {
        JsonObject o = new JsonObject();
        o.addProperty("ok", ok);
        if (!ok) {
            o.addProperty("code", errorCode);
            o.addProperty("message", message);
            return o;
        }
        o.addProperty("ticks", ticks);
        o.addProperty("ended", ended);
        o.addProperty("requires_player_action", requiresPlayerAction);
        o.addProperty("current_turn_index", currentTurnIndex);
        o.addProperty("next_actor_combatant_id", nextActorCombatantId);
        return o;
    }

    @Override
    public String toString() {
        return ok
            ? String.format("AdvanceCombatResponse[ok ticks=%d ended=%s awaitingPlayer=%s turn=%d next=%s]",
                ticks, ended, requiresPlayerAction, currentTurnIndex, nextActorCombatantId)
            : String.format("AdvanceCombatResponse[%s: %s]", errorCode, message);
    }
}
