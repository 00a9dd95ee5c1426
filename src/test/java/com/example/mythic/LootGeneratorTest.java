package com.example.mythic;

import com.example.mythic.model.LootItem;
import com.example.mythic.model.LootRarity;
import com.example.mythic.util.DeterministicRng;
import com.example.mythic.util.LootGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LootGenerator Tests")
class LootGeneratorTest {

    private final LootGenerator generator = new LootGenerator(new DeterministicRng());

    @Test
    @DisplayName("Same seed, session and character roll the same item")
    void deterministic() {
        LootItem a = generator.generate(1337, "camp-1", "combat-1", "char-kael", 5, LootRarity.UNIQUE);
        LootItem b = generator.generate(1337, "camp-1", "combat-1", "char-kael", 5, LootRarity.UNIQUE);

        assertEquals(a.getId(), b.getId());
        assertEquals(a.getName(), b.getName());
        assertEquals(a.getSlot(), b.getSlot());
        assertEquals(a.getStatMods(), b.getStatMods());
    }

    @Test
    @DisplayName("Different characters get different item ids")
    void idsPerCharacter() {
        LootItem a = generator.generate(1337, "camp-1", "combat-1", "char-kael", 5, LootRarity.UNIQUE);
        LootItem b = generator.generate(1337, "camp-1", "combat-1", "char-mira", 5, LootRarity.UNIQUE);
        assertNotEquals(a.getId(), b.getId());
        assertEquals("char-mira", b.getOwnerCharacterId());
    }

    @Test
    @DisplayName("Stat mods stay in range and carry the slot mod")
    void statModRanges() {
        for (int i = 0; i < 30; i++) {
            LootItem item = generator.generate(i, "camp-1", "combat-" + i, "char-kael", 4, LootRarity.MAGICAL);
            Map<String, Integer> mods = item.getStatMods();
            assertTrue(mods.get("offense") >= 1 && mods.get("offense") <= 8);
            assertTrue(mods.get("defense") >= 1 && mods.get("defense") <= 8);
            assertEquals(3, mods.size());
            switch (item.getSlot()) {
                case "weapon":
                    assertTrue(mods.get("weapon_power") >= 2 && mods.get("weapon_power") <= 12);
                    break;
                case "armor":
                    assertTrue(mods.get("armor_power") >= 2 && mods.get("armor_power") <= 10);
                    break;
                default:
                    assertTrue(List.of("ring", "trinket").contains(item.getSlot()), item.getSlot());
                    assertTrue(mods.get("utility") >= 2 && mods.get("utility") <= 10);
                    break;
            }
            assertEquals(2, item.getName().split(" ").length);
        }
    }

    @ParameterizedTest
    @CsvSource({
        "5, magical, 9, 4",
        "7, legendary, 18, 6",
        "0, unique, 1, 1",
        "3, mythic, 10, 2"
    })
    @DisplayName("Item power scales with level and rarity")
    void itemPowerAndLevel(int level, String rarityKey, int expectedPower, int expectedRequired) {
        LootItem item = generator.generate(1, "camp-1", "combat-1", "char-kael", level, LootRarity.fromKey(rarityKey));
        assertEquals(expectedPower, item.getItemPower());
        assertEquals(expectedRequired, item.getRequiredLevel());
    }

    @Test
    @DisplayName("Only legendary and mythic items carry a drawback")
    void drawbacks() {
        assertNull(generator.generate(1, "c", "s", "ch", 5, LootRarity.MAGICAL).getDrawback());
        assertNull(generator.generate(1, "c", "s", "ch", 5, LootRarity.UNIQUE).getDrawback());
        assertNotNull(generator.generate(1, "c", "s", "ch", 5, LootRarity.LEGENDARY).getDrawback());
        assertNotNull(generator.generate(1, "c", "s", "ch", 5, LootRarity.MYTHIC).getDrawback());
    }

    @ParameterizedTest
    @CsvSource({
        "0, magical",
        "280, magical",
        "281, unique",
        "420, unique",
        "421, legendary",
        "900, legendary"
    })
    @DisplayName("Rarity follows the experience thresholds")
    void rarityForXp(int xp, String expected) {
        assertEquals(LootRarity.fromKey(expected), LootGenerator.rarityForXp(xp, 280, 420));
    }

    @Test
    @DisplayName("Rarity metadata matches the drop tables")
    void rarityMetadata() {
        assertEquals("bind_on_equip", LootRarity.LEGENDARY.getBindPolicy());
        assertEquals("unbound", LootRarity.MAGICAL.getBindPolicy());
        assertEquals("boss", LootRarity.LEGENDARY.getDropTier());
        assertEquals(40, LootRarity.LEGENDARY.getBudgetPoints());
        assertThrows(IllegalArgumentException.class, () -> LootRarity.fromKey("common"));
    }
}
