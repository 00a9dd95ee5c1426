package com.example.mythic.util;

import com.example.mythic.model.LootRarity;
import com.example.mythic.model.LootItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Generates the reward item granted to a surviving player at settlement.
 *
 * Slot: one of weapon, armor, ring, trinket.
 * Name: one word from each of two fixed lists ("Storm Maw", "Ash Halo").
 * Stat mods: offense and defense 1-8, plus a slot mod
 *   - weapon: weapon_power 2-12
 *   - armor:  armor_power 2-10
 *   - ring/trinket: utility 2-10
 * Item power: floor(level * rarity power scale). Required level: max(1, level - 1).
 * Legendary and mythic items carry a drawback.
 *
 * Every roll goes through {@link DeterministicRng} with labels built from
 * the session id and character id, so the same settlement always yields the same item.
 */
public class LootGenerator {
    private static final Logger logger = LoggerFactory.getLogger(LootGenerator.class);

    static final List<String> SLOTS = List.of("weapon", "armor", "ring", "trinket");

    private static final List<String> NAME_FIRST = List.of(
        "Ash", "Iron", "Dread", "Storm", "Velvet", "Blood", "Wyrm", "Night"
    );

    private static final List<String> NAME_SECOND = List.of(
        "Edge", "Ward", "Pulse", "Maw", "Spur", "Bite", "Halo", "Crown"
    );

    private static final String DRAWBACK = "volatile_reverb";

    private final DeterministicRng rng;

    public LootGenerator(DeterministicRng rng) {
        this.rng = rng;
    }

    /**
     * Roll an item for one character.
     * @param seed the combat session seed
     * @param campaignId owning campaign
     * @param combatSessionId session the item was earned in
     * @param characterId receiving character
     * @param level character level (clamped to at least 1)
     * @param rarity rarity tier chosen from the experience awarded
     */
    public LootItem generate(int seed, String campaignId, String combatSessionId, String characterId,
                             int level, LootRarity rarity) {
        String prefix = "loot:" + combatSessionId + ":" + characterId;
        int lvl = Math.max(1, level);

        String slot = rng.pick(seed, prefix + ":slot", SLOTS);
        String name = rng.pick(seed, prefix + ":name_a", NAME_FIRST) + " "
            + rng.pick(seed, prefix + ":name_b", NAME_SECOND);

        Map<String, Integer> mods = new LinkedHashMap<>();
        mods.put("offense", rng.nextInt(seed, prefix + ":offense", 1, 8));
        mods.put("defense", rng.nextInt(seed, prefix + ":defense", 1, 8));
        switch (slot) {
            case "weapon":
                mods.put("weapon_power", rng.nextInt(seed, prefix + ":weapon_power", 2, 12));
                break;
            case "armor":
                mods.put("armor_power", rng.nextInt(seed, prefix + ":armor_power", 2, 10));
                break;
            default:
                mods.put("utility", rng.nextInt(seed, prefix + ":utility", 2, 10));
                break;
        }

        int itemPower = (int) Math.floor(lvl * rarity.getPowerScale());
        int requiredLevel = Math.max(1, lvl - 1);
        String drawback = rarity.hasDrawback() ? DRAWBACK : null;
        String itemId = UUID.nameUUIDFromBytes((prefix + ":item").getBytes(StandardCharsets.UTF_8)).toString();

        LootItem item = new LootItem(itemId, campaignId, characterId, name, rarity, slot, mods,
            itemPower, requiredLevel, drawback, "Claimed from the field after combat " + combatSessionId);
        logger.debug("[LootGenerator] Rolled {} {} '{}' (power {}) for {}", rarity.getKey(), slot, name, itemPower, characterId);
        return item;
    }

    /**
     * Rarity tier for an experience award: legendary above {@code legendaryAbove}, unique above
     * {@code uniqueAbove}, magical otherwise.
     */
    public static LootRarity rarityForXp(int xp, int uniqueAbove, int legendaryAbove) {
        if (xp > legendaryAbove) return LootRarity.LEGENDARY;
        if (xp > uniqueAbove) return LootRarity.UNIQUE;
        return LootRarity.MAGICAL;
    }
}
