package com.example.mythic.net;

/**
 * Inbound advance call. {@code maxSteps} may be null, in which case the configured default applies.
 * {@code idempotencyKey} is optional; without it every call resolves.
 */
public record AdvanceCombatRequest(String userId, String campaignId, String combatSessionId,
                                   Integer maxSteps, String idempotencyKey) {
}
