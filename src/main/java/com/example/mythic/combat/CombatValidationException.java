package com.example.mythic.combat;

/**
 * A call was rejected before any state was touched: bad step budget, blank ids,
 * or a session that does not exist in the given campaign.
 */
public class CombatValidationException extends RuntimeException {

    public CombatValidationException(String message) {
        super(message);
    }
}
