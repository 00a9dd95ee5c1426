package com.example.mythic.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A generated gear item granted to a character at settlement.
 */
public class LootItem {

    private final String id;
    private final String campaignId;
    private final String ownerCharacterId;
    private final String name;
    private final LootRarity rarity;
    private final String slot;
    private final Map<String, Integer> statMods;
    private final int itemPower;
    private final int requiredLevel;
    /** Null when the item carries no drawback */
    private final String drawback;
    private final String narrativeHook;

    public LootItem(String id, String campaignId, String ownerCharacterId, String name, LootRarity rarity,
                    String slot, Map<String, Integer> statMods, int itemPower, int requiredLevel,
                    String drawback, String narrativeHook) {
        this.id = id;
        this.campaignId = campaignId;
        this.ownerCharacterId = ownerCharacterId;
        this.name = name;
        this.rarity = rarity;
        this.slot = slot;
        this.statMods = new LinkedHashMap<>(statMods);
        this.itemPower = itemPower;
        this.requiredLevel = requiredLevel;
        this.drawback = drawback;
        this.narrativeHook = narrativeHook;
    }

    public String getId() { return id; }
    public String getCampaignId() { return campaignId; }
    public String getOwnerCharacterId() { return ownerCharacterId; }
    public String getName() { return name; }
    public LootRarity getRarity() { return rarity; }
    public String getSlot() { return slot; }
    public Map<String, Integer> getStatMods() { return Collections.unmodifiableMap(statMods); }
    public int getItemPower() { return itemPower; }
    public int getRequiredLevel() { return requiredLevel; }
    public String getDrawback() { return drawback; }
    public String getNarrativeHook() { return narrativeHook; }
    public String getDropTier() { return rarity.getDropTier(); }
    public String getBindPolicy() { return rarity.getBindPolicy(); }
}
