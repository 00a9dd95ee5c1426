package com.example.mythic.model;

import java.time.Instant;

/**
 * Record that a combat session dropped an item for a character.
 */
public record LootDrop(String campaignId, String combatSessionId, String characterId, String itemId,
                       LootRarity rarity, int budgetPoints, String source, Instant createdAt) {
}
