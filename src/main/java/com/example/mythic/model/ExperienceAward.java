package com.example.mythic.model;

import java.time.Instant;

/**
 * Experience granted to a character for one combat session.
 */
public record ExperienceAward(String characterId, String combatSessionId, int amount,
                              String reason, Instant createdAt) {
}
