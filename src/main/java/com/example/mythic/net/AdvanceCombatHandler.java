package com.example.mythic.net;

import com.example.mythic.combat.AdvanceResult;
import com.example.mythic.combat.CombatEngine;
import com.example.mythic.combat.CombatValidationException;
import com.example.mythic.util.EngineConfig;
import com.example.mythic.util.IdempotencyCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Boundary for the advance-combat call.
 *
 * Order of work: validate the request shape, check campaign membership, consult the
 * idempotency cache, resolve, cache the response. Every failure is mapped to a
 * sanitized {@link AdvanceCombatResponse}; exception detail is only logged.
 */
public class AdvanceCombatHandler {
    private static final Logger logger = LoggerFactory.getLogger(AdvanceCombatHandler.class);

    private final CombatEngine engine;
    private final CampaignAccessChecker accessChecker;
    private final EngineConfig config;
    private final IdempotencyCache<AdvanceCombatResponse> cache;

    public AdvanceCombatHandler(CombatEngine engine, CampaignAccessChecker accessChecker,
                                EngineConfig config, Clock clock) {
        this.engine = engine;
        this.accessChecker = accessChecker;
        this.config = config;
        this.cache = new IdempotencyCache<>(config.getIdempotencyTtlMs(), clock);
    }

    public AdvanceCombatResponse handle(AdvanceCombatRequest request) {
        if (request == null || isBlank(request.userId()) || isBlank(request.campaignId())
                || isBlank(request.combatSessionId())) {
            return AdvanceCombatResponse.rejected(AdvanceCombatResponse.INVALID_REQUEST, "Missing required fields");
        }
        int maxSteps = request.maxSteps() == null ? config.getDefaultMaxSteps() : request.maxSteps();
        if (maxSteps < 1 || maxSteps > config.getMaxStepsCap()) {
            return AdvanceCombatResponse.rejected(AdvanceCombatResponse.INVALID_REQUEST,
                "maxSteps must be between 1 and " + config.getMaxStepsCap());
        }

        try {
            accessChecker.requireParticipant(request.userId(), request.campaignId());
        } catch (CampaignAccessException e) {
            logger.info("[AdvanceCombat] Denied user {} on campaign {}: {}",
                request.userId(), request.campaignId(), e.getMessage());
            return AdvanceCombatResponse.rejected(AdvanceCombatResponse.FORBIDDEN, "Not a participant of this campaign");
        }

        String cacheKey = isBlank(request.idempotencyKey()) ? null : request.userId() + ":" + request.idempotencyKey();
        AdvanceCombatResponse cached = cache.get(cacheKey);
        if (cached != null) {
            logger.debug("[AdvanceCombat] Replaying cached response for {}", cacheKey);
            return cached;
        }

        try {
            AdvanceResult result = engine.advance(request.campaignId(), request.combatSessionId(), maxSteps);
            AdvanceCombatResponse response = AdvanceCombatResponse.ok(result);
            cache.put(cacheKey, response);
            return response;
        } catch (CombatValidationException e) {
            logger.info("[AdvanceCombat] Rejected advance for session {}: {}", request.combatSessionId(), e.getMessage());
            return AdvanceCombatResponse.rejected(AdvanceCombatResponse.INVALID_REQUEST, "Invalid combat request");
        } catch (RuntimeException e) {
            logger.error("[AdvanceCombat] Advance failed for session {} (campaign {})",
                request.combatSessionId(), request.campaignId(), e);
            return AdvanceCombatResponse.rejected(AdvanceCombatResponse.COMBAT_TICK_FAILED, "Failed to advance combat");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
