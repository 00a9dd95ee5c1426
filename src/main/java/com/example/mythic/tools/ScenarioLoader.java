package com.example.mythic.tools;

import com.example.mythic.effect.StatusEffect;
import com.example.mythic.model.Board;
import com.example.mythic.model.BoardType;
import com.example.mythic.model.BossInstance;
import com.example.mythic.model.BossPhase;
import com.example.mythic.model.BossTemplate;
import com.example.mythic.model.CombatSession;
import com.example.mythic.model.Combatant;
import com.example.mythic.model.EntityKind;
import com.example.mythic.model.Faction;
import com.example.mythic.model.SessionStatus;
import com.example.mythic.persistence.CombatSeeder;
import com.example.mythic.util.Json;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Seeds a store from a YAML encounter description.
 *
 * Top-level keys: campaign_id, session_id, seed, turn_index, combatants, turn_order,
 * boss_templates, bosses, factions, boards. Only campaign_id, session_id, combatants
 * and turn_order are required.
 */
public final class ScenarioLoader {
    private static final Logger logger = LoggerFactory.getLogger(ScenarioLoader.class);

    private ScenarioLoader() { }

    /** Identifies the seeded encounter. */
    public record Scenario(String campaignId, String combatSessionId, int combatantCount) { }

    public static Scenario loadResource(String resource, CombatSeeder seeder, Instant now) {
        try (InputStream in = ScenarioLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Scenario resource not found: " + resource);
            }
            return load(in, seeder, now);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read scenario " + resource, e);
        }
    }

    @SuppressWarnings("unchecked")
    public static Scenario load(InputStream in, CombatSeeder seeder, Instant now) {
        Object parsed = new Yaml().load(in);
        if (!(parsed instanceof Map)) {
            throw new IllegalArgumentException("Scenario root must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) parsed;

        String campaignId = requireString(root, "campaign_id");
        String sessionId = requireString(root, "session_id");
        int seed = getInt(root, "seed", 0);

        seeder.insertSession(new CombatSession(sessionId, campaignId, seed, SessionStatus.ACTIVE,
            getInt(root, "turn_index", 0), now));

        List<Map<String, Object>> combatants = listOfMaps(root.get("combatants"));
        if (combatants.isEmpty()) {
            throw new IllegalArgumentException("Scenario has no combatants");
        }
        for (Map<String, Object> data : combatants) {
            seeder.insertCombatant(toCombatant(sessionId, data));
        }

        List<String> order = new ArrayList<>();
        Object orderObj = root.get("turn_order");
        if (orderObj instanceof List) {
            for (Object o : (List<?>) orderObj) {
                order.add(String.valueOf(o));
            }
        }
        if (order.isEmpty()) {
            throw new IllegalArgumentException("Scenario has no turn_order");
        }
        seeder.insertTurnOrder(sessionId, order);

        for (Map<String, Object> data : listOfMaps(root.get("boss_templates"))) {
            List<BossPhase> phases = new ArrayList<>();
            for (Map<String, Object> p : listOfMaps(data.get("phases"))) {
                phases.add(new BossPhase(getInt(p, "phase", 1), getDouble(p, "hp_below_pct", 1.0), stringList(p.get("skill_pool"))));
            }
            seeder.insertBossTemplate(new BossTemplate(requireString(data, "id"), getString(data, "name", ""), phases));
        }

        for (Map<String, Object> data : listOfMaps(root.get("bosses"))) {
            Object enrage = data.get("enrage_turn");
            seeder.insertBossInstance(new BossInstance(requireString(data, "id"), sessionId,
                requireString(data, "combatant_id"), requireString(data, "template_id"),
                getInt(data, "current_phase", 1), enrage == null ? null : getInt(data, "enrage_turn", 0)));
        }

        for (Map<String, Object> data : listOfMaps(root.get("factions"))) {
            seeder.insertFaction(new Faction(requireString(data, "id"), campaignId,
                getString(data, "name", ""), stringList(data.get("tags"))));
        }

        for (Map<String, Object> data : listOfMaps(root.get("boards"))) {
            BoardType type = BoardType.fromKey(getString(data, "type", "town"));
            seeder.insertBoard(new Board(requireString(data, "id"), campaignId, type,
                getString(data, "status", Board.STATUS_ARCHIVED),
                type == BoardType.COMBAT ? sessionId : null,
                getInstant(data, "updated_at", now)));
        }

        logger.info("[ScenarioLoader] Seeded session {} ({} combatants, {} turn slots)", sessionId, combatants.size(), order.size());
        return new Scenario(campaignId, sessionId, combatants.size());
    }

    private static Combatant toCombatant(String sessionId, Map<String, Object> data) {
        int hpMax = getInt(data, "hp_max", getInt(data, "hp", 1));
        int powerMax = getInt(data, "power_max", 0);
        List<StatusEffect> statuses = new ArrayList<>();
        for (Map<String, Object> s : listOfMaps(data.get("statuses"))) {
            Object expires = s.get("expires_turn");
            JsonObject statusData = s.get("data") instanceof Map
                ? Json.GSON.toJsonTree(s.get("data")).getAsJsonObject()
                : new JsonObject();
            statuses.add(new StatusEffect(getString(s, "id", ""),
                expires == null ? null : getInt(s, "expires_turn", 0), getInt(s, "stacks", 1), statusData));
        }
        return Combatant.builder(requireString(data, "id"), sessionId)
            .kind(EntityKind.fromKey(getString(data, "kind", "npc")))
            .playerId(getString(data, "player_id", null))
            .characterId(getString(data, "character_id", null))
            .name(getString(data, "name", requireString(data, "id")))
            .level(getInt(data, "level", 1))
            .offense(getInt(data, "offense", 0))
            .defense(getInt(data, "defense", 0))
            .control(getInt(data, "control", 0))
            .support(getInt(data, "support", 0))
            .mobility(getInt(data, "mobility", 0))
            .utility(getInt(data, "utility", 0))
            .weaponPower(getInt(data, "weapon_power", 0))
            .armor(getInt(data, "armor", 0))
            .resist(getInt(data, "resist", 0))
            .hp(getInt(data, "hp", hpMax), hpMax)
            .power(getInt(data, "power", powerMax), powerMax)
            .position(getInt(data, "x", 0), getInt(data, "y", 0))
            .statuses(statuses)
            .build();
    }

    // ==================== YAML HELPERS ====================

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listOfMaps(Object value) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (value instanceof List) {
            for (Object o : (List<?>) value) {
                if (o instanceof Map) out.add((Map<String, Object>) o);
            }
        }
        return out;
    }

    private static List<String> stringList(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof List) {
            for (Object o : (List<?>) value) out.add(String.valueOf(o));
        }
        return out;
    }

    private static String requireString(Map<String, Object> map, String key) {
        String value = getString(map, key, null);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Scenario field '" + key + "' is required");
        }
        return value;
    }

    private static String getString(Map<String, Object> map, String key, String def) {
        Object v = map.get(key);
        return v == null ? def : String.valueOf(v);
    }

    private static int getInt(Map<String, Object> map, String key, int def) {
        Object v = map.get(key);
        if (v == null) return def;
        if (v instanceof Number) return ((Number) v).intValue();
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Scenario field '" + key + "' is not an integer: " + v, e);
        }
    }

    private static double getDouble(Map<String, Object> map, String key, double def) {
        Object v = map.get(key);
        if (v == null) return def;
        if (v instanceof Number) return ((Number) v).doubleValue();
        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Scenario field '" + key + "' is not a number: " + v, e);
        }
    }

    private static Instant getInstant(Map<String, Object> map, String key, Instant def) {
        Object v = map.get(key);
        if (v == null) return def;
        // unquoted ISO timestamps come back from SnakeYAML as java.util.Date
        if (v instanceof Date) return ((Date) v).toInstant();
        return Instant.parse(String.valueOf(v));
    }
}
