package com.example.mythic.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Tunable engine and settlement constants.
 *
 * Values come from the classpath YAML file {@code /config/combat.yaml}; any key can be
 * overridden by the environment variable {@code MYTHIC_<KEY>} or the system property
 * {@code mythic.<key>}, environment first. Missing keys keep their defaults.
 */
public class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_RESOURCE = "/config/combat.yaml";

    private int maxStepsCap = 10;
    private int defaultMaxSteps = 1;
    private double damageSpreadPct = 0.10;
    private long idempotencyTtlMs = 15_000;
    private int xpBase = 180;
    private int xpPerParticipant = 35;
    private int xpBossBonus = 220;
    private int lootUniqueAboveXp = 280;
    private int lootLegendaryAboveXp = 420;
    private int reputationVictoryDelta = 6;
    private int reputationDefeatDelta = -4;
    private String dbUrl = "jdbc:h2:file:./data/mythic;AUTO_SERVER=TRUE;DB_CLOSE_DELAY=-1";

    /**
     * Defaults only; no file or environment lookup.
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Load from {@link #DEFAULT_RESOURCE} and apply environment/system property overrides.
     */
    public static EngineConfig load() {
        return load(DEFAULT_RESOURCE, System.getenv(), System.getProperties());
    }

    /**
     * Load from a classpath resource with explicit override sources. Either source may be null.
     */
    public static EngineConfig load(String resource, Map<String, String> env, Properties props) {
        Map<String, Object> values = new HashMap<>();
        try (InputStream in = EngineConfig.class.getResourceAsStream(resource)) {
            if (in == null) {
                logger.info("[EngineConfig] {} not found on classpath, using defaults", resource);
            } else {
                Object root = new Yaml().load(in);
                if (root instanceof Map) {
                    for (Map.Entry<?, ?> e : ((Map<?, ?>) root).entrySet()) {
                        values.put(String.valueOf(e.getKey()), e.getValue());
                    }
                }
            }
        } catch (IOException e) {
            logger.warn("[EngineConfig] Failed to read {}: {}", resource, e.getMessage(), e);
        }

        EngineConfig cfg = new EngineConfig();
        for (String key : KEYS) {
            String envValue = env == null ? null : env.get("MYTHIC_" + key.toUpperCase(Locale.ROOT));
            String propValue = props == null ? null : props.getProperty("mythic." + key);
            if (envValue != null && !envValue.isEmpty()) {
                values.put(key, envValue);
            } else if (propValue != null && !propValue.isEmpty()) {
                values.put(key, propValue);
            }
        }
        cfg.apply(values);
        return cfg;
    }

    private static final String[] KEYS = {
        "max_steps_cap", "default_max_steps", "damage_spread_pct", "idempotency_ttl_ms",
        "xp_base", "xp_per_participant", "xp_boss_bonus", "loot_unique_above_xp",
        "loot_legendary_above_xp", "reputation_victory_delta", "reputation_defeat_delta", "db_url"
    };

    private void apply(Map<String, Object> values) {
        maxStepsCap = intValue(values, "max_steps_cap", maxStepsCap);
        defaultMaxSteps = intValue(values, "default_max_steps", defaultMaxSteps);
        damageSpreadPct = doubleValue(values, "damage_spread_pct", damageSpreadPct);
        idempotencyTtlMs = longValue(values, "idempotency_ttl_ms", idempotencyTtlMs);
        xpBase = intValue(values, "xp_base", xpBase);
        xpPerParticipant = intValue(values, "xp_per_participant", xpPerParticipant);
        xpBossBonus = intValue(values, "xp_boss_bonus", xpBossBonus);
        lootUniqueAboveXp = intValue(values, "loot_unique_above_xp", lootUniqueAboveXp);
        lootLegendaryAboveXp = intValue(values, "loot_legendary_above_xp", lootLegendaryAboveXp);
        reputationVictoryDelta = intValue(values, "reputation_victory_delta", reputationVictoryDelta);
        reputationDefeatDelta = intValue(values, "reputation_defeat_delta", reputationDefeatDelta);
        Object url = values.get("db_url");
        if (url != null && !String.valueOf(url).isBlank()) {
            dbUrl = String.valueOf(url);
        }
        if (defaultMaxSteps < 1) defaultMaxSteps = 1;
        if (maxStepsCap < defaultMaxSteps) maxStepsCap = defaultMaxSteps;
    }

    private static int intValue(Map<String, Object> values, String key, int fallback) {
        Object v = values.get(key);
        if (v == null) return fallback;
        try {
            return v instanceof Number ? ((Number) v).intValue() : Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            logger.warn("[EngineConfig] Ignoring non-integer value for {}: {}", key, v);
            return fallback;
        }
    }

    private static long longValue(Map<String, Object> values, String key, long fallback) {
        Object v = values.get(key);
        if (v == null) return fallback;
        try {
            return v instanceof Number ? ((Number) v).longValue() : Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            logger.warn("[EngineConfig] Ignoring non-integer value for {}: {}", key, v);
            return fallback;
        }
    }

    private static double doubleValue(Map<String, Object> values, String key, double fallback) {
        Object v = values.get(key);
        if (v == null) return fallback;
        try {
            return v instanceof Number ? ((Number) v).doubleValue() : Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            logger.warn("[EngineConfig] Ignoring non-numeric value for {}: {}", key, v);
            return fallback;
        }
    }

    public int getMaxStepsCap() { return maxStepsCap; }
    public int getDefaultMaxSteps() { return defaultMaxSteps; }
    public double getDamageSpreadPct() { return damageSpreadPct; }
    public long getIdempotencyTtlMs() { return idempotencyTtlMs; }
    public int getXpBase() { return xpBase; }
    public int getXpPerParticipant() { return xpPerParticipant; }
    public int getXpBossBonus() { return xpBossBonus; }
    public int getLootUniqueAboveXp() { return lootUniqueAboveXp; }
    public int getLootLegendaryAboveXp() { return lootLegendaryAboveXp; }
    public int getReputationVictoryDelta() { return reputationVictoryDelta; }
    public int getReputationDefeatDelta() { return reputationDefeatDelta; }
    public String getDbUrl() { return dbUrl; }
}
