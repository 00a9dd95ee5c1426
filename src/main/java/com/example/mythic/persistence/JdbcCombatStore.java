package com.example.mythic.persistence;

import com.example.mythic.model.ActionEvent;
import com.example.mythic.model.ActionEventDraft;
import com.example.mythic.model.Board;
import com.example.mythic.model.BoardTransition;
import com.example.mythic.model.BoardType;
import com.example.mythic.model.BossInstance;
import com.example.mythic.model.BossPhase;
import com.example.mythic.model.BossTemplate;
import com.example.mythic.model.CombatSession;
import com.example.mythic.model.Combatant;
import com.example.mythic.model.EntityKind;
import com.example.mythic.model.EventType;
import com.example.mythic.model.ExperienceAward;
import com.example.mythic.model.Faction;
import com.example.mythic.model.FactionReputation;
import com.example.mythic.model.LootDrop;
import com.example.mythic.model.LootItem;
import com.example.mythic.model.LootRarity;
import com.example.mythic.model.MemoryEvent;
import com.example.mythic.model.ReputationEvent;
import com.example.mythic.model.SessionStatus;
import com.example.mythic.model.TurnSlot;
import com.example.mythic.util.Json;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * H2-backed combat store over plain JDBC. Every operation opens its own connection.
 * JSON columns (statuses, payloads, phase tables) are stored as CLOB text written with Gson.
 * Timestamps are stored as epoch milliseconds.
 */
public class JdbcCombatStore implements CombatStore, CombatSeeder {
    private static final Logger logger = LoggerFactory.getLogger(JdbcCombatStore.class);

    private static final String USER = "sa";
    private static final String PASS = "";

    private final String url;

    public JdbcCombatStore(String url) {
        this.url = url;
        MigrationManager.ensureMigration("JdbcCombatStore:" + url, this::ensureTables);
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(url, USER, PASS);
    }

    private void ensureTables() {
        try (Connection c = connect();
             Statement s = c.createStatement()) {

            s.execute("CREATE TABLE IF NOT EXISTS combat_session (" +
                "id VARCHAR(64) PRIMARY KEY, " +
                "campaign_id VARCHAR(64) NOT NULL, " +
                "seed INT NOT NULL, " +
                "status VARCHAR(16) NOT NULL, " +
                "current_turn_index INT NOT NULL, " +
                "updated_at BIGINT" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS combat_turn_order (" +
                "session_id VARCHAR(64) NOT NULL, " +
                "turn_index INT NOT NULL, " +
                "combatant_id VARCHAR(64) NOT NULL, " +
                "PRIMARY KEY(session_id, turn_index)" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS combatant (" +
                "id VARCHAR(64) NOT NULL, " +
                "session_id VARCHAR(64) NOT NULL, " +
                "created_order INT NOT NULL, " +
                "entity_kind VARCHAR(16) NOT NULL, " +
                "player_id VARCHAR(64), " +
                "character_id VARCHAR(64), " +
                "name VARCHAR(128), " +
                "level INT DEFAULT 1, " +
                "offense INT DEFAULT 0, " +
                "defense INT DEFAULT 0, " +
                "control INT DEFAULT 0, " +
                "support INT DEFAULT 0, " +
                "mobility INT DEFAULT 0, " +
                "utility INT DEFAULT 0, " +
                "weapon_power INT DEFAULT 0, " +
                "armor INT DEFAULT 0, " +
                "resist INT DEFAULT 0, " +
                "hp INT NOT NULL, " +
                "hp_max INT NOT NULL, " +
                "power INT DEFAULT 0, " +
                "power_max INT DEFAULT 0, " +
                "x INT DEFAULT 0, " +
                "y INT DEFAULT 0, " +
                "is_alive BOOLEAN NOT NULL, " +
                "statuses CLOB, " +
                "PRIMARY KEY(session_id, id)" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS action_event (" +
                "id BIGINT AUTO_INCREMENT PRIMARY KEY, " +
                "session_id VARCHAR(64) NOT NULL, " +
                "turn_index INT NOT NULL, " +
                "actor_combatant_id VARCHAR(64), " +
                "event_type VARCHAR(32) NOT NULL, " +
                "payload CLOB, " +
                "created_at BIGINT" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS boss_template (" +
                "id VARCHAR(64) PRIMARY KEY, " +
                "name VARCHAR(128), " +
                "phases CLOB" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS boss_instance (" +
                "id VARCHAR(64) PRIMARY KEY, " +
                "session_id VARCHAR(64) NOT NULL, " +
                "combatant_id VARCHAR(64) NOT NULL, " +
                "template_id VARCHAR(64) NOT NULL, " +
                "current_phase INT DEFAULT 1, " +
                "enrage_turn INT" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS faction (" +
                "id VARCHAR(64) PRIMARY KEY, " +
                "campaign_id VARCHAR(64) NOT NULL, " +
                "name VARCHAR(128), " +
                "tags CLOB, " +
                "created_order INT NOT NULL" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS faction_reputation (" +
                "campaign_id VARCHAR(64) NOT NULL, " +
                "faction_id VARCHAR(64) NOT NULL, " +
                "player_id VARCHAR(64) NOT NULL, " +
                "rep INT NOT NULL, " +
                "PRIMARY KEY(campaign_id, faction_id, player_id)" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS reputation_event (" +
                "id BIGINT AUTO_INCREMENT PRIMARY KEY, " +
                "campaign_id VARCHAR(64) NOT NULL, " +
                "faction_id VARCHAR(64) NOT NULL, " +
                "player_id VARCHAR(64) NOT NULL, " +
                "severity INT NOT NULL, " +
                "delta INT NOT NULL, " +
                "evidence CLOB, " +
                "created_at BIGINT" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS memory_event (" +
                "id BIGINT AUTO_INCREMENT PRIMARY KEY, " +
                "campaign_id VARCHAR(64) NOT NULL, " +
                "player_id VARCHAR(64) NOT NULL, " +
                "category VARCHAR(64) NOT NULL, " +
                "severity INT NOT NULL, " +
                "payload CLOB, " +
                "created_at BIGINT" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS experience_award (" +
                "character_id VARCHAR(64) NOT NULL, " +
                "session_id VARCHAR(64) NOT NULL, " +
                "amount INT NOT NULL, " +
                "reason VARCHAR(64), " +
                "created_at BIGINT, " +
                "PRIMARY KEY(character_id, session_id)" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS character_experience (" +
                "character_id VARCHAR(64) PRIMARY KEY, " +
                "xp INT NOT NULL" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS loot_item (" +
                "id VARCHAR(64) PRIMARY KEY, " +
                "campaign_id VARCHAR(64) NOT NULL, " +
                "owner_character_id VARCHAR(64) NOT NULL, " +
                "name VARCHAR(128), " +
                "rarity VARCHAR(16) NOT NULL, " +
                "slot VARCHAR(16), " +
                "stat_mods CLOB, " +
                "item_power INT, " +
                "required_level INT, " +
                "drawback VARCHAR(64), " +
                "narrative_hook VARCHAR(512), " +
                "created_order INT NOT NULL" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS loot_drop (" +
                "campaign_id VARCHAR(64) NOT NULL, " +
                "session_id VARCHAR(64) NOT NULL, " +
                "character_id VARCHAR(64) NOT NULL, " +
                "item_id VARCHAR(64) NOT NULL, " +
                "rarity VARCHAR(16) NOT NULL, " +
                "budget_points INT, " +
                "source VARCHAR(64), " +
                "created_at BIGINT, " +
                "PRIMARY KEY(character_id, session_id)" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS board (" +
                "id VARCHAR(64) PRIMARY KEY, " +
                "campaign_id VARCHAR(64) NOT NULL, " +
                "board_type VARCHAR(16) NOT NULL, " +
                "status VARCHAR(16) NOT NULL, " +
                "combat_session_id VARCHAR(64), " +
                "updated_at BIGINT" +
            ")");

            s.execute("CREATE TABLE IF NOT EXISTS board_transition (" +
                "id BIGINT AUTO_INCREMENT PRIMARY KEY, " +
                "campaign_id VARCHAR(64) NOT NULL, " +
                "from_board_type VARCHAR(16) NOT NULL, " +
                "to_board_type VARCHAR(16) NOT NULL, " +
                "reason VARCHAR(64), " +
                "animation VARCHAR(64), " +
                "payload CLOB, " +
                "created_at BIGINT" +
            ")");

            s.execute("CREATE INDEX IF NOT EXISTS idx_action_event_session ON action_event(session_id, id)");

            logger.info("[JdbcCombatStore] Ensured combat tables at {}", url);
        } catch (SQLException e) {
            throw new StoreException("Failed to create combat tables", e);
        }
    }

    // ==================== SESSIONS ====================

    @Override
    public CombatSession getSession(String combatSessionId) {
        String sql = "SELECT id, campaign_id, seed, status, current_turn_index, updated_at FROM combat_session WHERE id = ?";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, combatSessionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return null;
                return new CombatSession(rs.getString("id"), rs.getString("campaign_id"), rs.getInt("seed"),
                    SessionStatus.fromKey(rs.getString("status")), rs.getInt("current_turn_index"),
                    toInstant(rs, "updated_at"));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load combat session " + combatSessionId, e);
        }
    }

    @Override
    public boolean advanceTurnPointer(String combatSessionId, int expectedIndex, int nextIndex, Instant at) {
        String sql = "UPDATE combat_session SET current_turn_index = ?, updated_at = ? " +
            "WHERE id = ? AND status = ? AND current_turn_index = ?";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, nextIndex);
            ps.setLong(2, at.toEpochMilli());
            ps.setString(3, combatSessionId);
            ps.setString(4, SessionStatus.ACTIVE.getKey());
            ps.setInt(5, expectedIndex);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to advance turn pointer for " + combatSessionId, e);
        }
    }

    @Override
    public boolean markSessionEnded(String combatSessionId, Instant at) {
        String sql = "UPDATE combat_session SET status = ?, updated_at = ? WHERE id = ? AND status = ?";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, SessionStatus.ENDED.getKey());
            ps.setLong(2, at.toEpochMilli());
            ps.setString(3, combatSessionId);
            ps.setString(4, SessionStatus.ACTIVE.getKey());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to end combat session " + combatSessionId, e);
        }
    }

    // ==================== TURN ORDER / COMBATANTS ====================

    @Override
    public List<TurnSlot> getTurnOrder(String combatSessionId) {
        String sql = "SELECT turn_index, combatant_id FROM combat_turn_order WHERE session_id = ? ORDER BY turn_index";
        List<TurnSlot> out = new ArrayList<>();
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, combatSessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new TurnSlot(rs.getInt("turn_index"), rs.getString("combatant_id")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load turn order for " + combatSessionId, e);
        }
        return out;
    }

    @Override
    public Combatant getCombatant(String combatSessionId, String combatantId) {
        String sql = "SELECT * FROM combatant WHERE session_id = ? AND id = ?";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, combatSessionId);
            ps.setString(2, combatantId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapCombatant(rs) : null;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load combatant " + combatantId, e);
        }
    }

    @Override
    public List<Combatant> getCombatants(String combatSessionId) {
        String sql = "SELECT * FROM combatant WHERE session_id = ? ORDER BY created_order";
        List<Combatant> out = new ArrayList<>();
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, combatSessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapCombatant(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load combatants for " + combatSessionId, e);
        }
        return out;
    }

    @Override
    public void updateCombatant(Combatant combatant) {
        String sql = "UPDATE combatant SET hp = ?, armor = ?, power = ?, is_alive = ?, statuses = ? " +
            "WHERE session_id = ? AND id = ?";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, combatant.getHp());
            ps.setInt(2, combatant.getArmor());
            ps.setInt(3, combatant.getPower());
            ps.setBoolean(4, combatant.isAlive());
            ps.setString(5, Json.statusesToJson(combatant.getStatuses()));
            ps.setString(6, combatant.getCombatSessionId());
            ps.setString(7, combatant.getId());
            if (ps.executeUpdate() != 1) {
                throw new StoreException("Combatant " + combatant.getId() + " does not exist");
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update combatant " + combatant.getId(), e);
        }
    }

    private Combatant mapCombatant(ResultSet rs) throws SQLException {
        return Combatant.builder(rs.getString("id"), rs.getString("session_id"))
            .kind(EntityKind.fromKey(rs.getString("entity_kind")))
            .playerId(rs.getString("player_id"))
            .characterId(rs.getString("character_id"))
            .name(rs.getString("name"))
            .level(rs.getInt("level"))
            .offense(rs.getInt("offense"))
            .defense(rs.getInt("defense"))
            .control(rs.getInt("control"))
            .support(rs.getInt("support"))
            .mobility(rs.getInt("mobility"))
            .utility(rs.getInt("utility"))
            .weaponPower(rs.getInt("weapon_power"))
            .armor(rs.getInt("armor"))
            .resist(rs.getInt("resist"))
            .hp(rs.getInt("hp"), rs.getInt("hp_max"))
            .power(rs.getInt("power"), rs.getInt("power_max"))
            .position(rs.getInt("x"), rs.getInt("y"))
            .statuses(Json.statusesFromJson(rs.getString("statuses")))
            .build();
    }

    // ==================== EVENTS ====================

    @Override
    public ActionEvent appendEvent(ActionEventDraft draft) {
        String sql = "INSERT INTO action_event (session_id, turn_index, actor_combatant_id, event_type, payload, created_at) " +
            "VALUES (?,?,?,?,?,?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, draft.getCombatSessionId());
            ps.setInt(2, draft.getTurnIndex());
            ps.setString(3, draft.getActorCombatantId());
            ps.setString(4, draft.getType().getKey());
            ps.setString(5, Json.GSON.toJson(draft.getPayload()));
            ps.setLong(6, draft.getCreatedAt().toEpochMilli());
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new StoreException("No id generated for " + draft.getType().getKey() + " event");
                }
                return draft.toEvent(keys.getLong(1));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to append " + draft.getType().getKey() + " event", e);
        }
    }

    @Override
    public List<ActionEvent> getEvents(String combatSessionId) {
        String sql = "SELECT id, session_id, turn_index, actor_combatant_id, event_type, payload, created_at " +
            "FROM action_event WHERE session_id = ? ORDER BY id";
        List<ActionEvent> out = new ArrayList<>();
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, combatSessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ActionEvent(rs.getLong("id"), rs.getString("session_id"), rs.getInt("turn_index"),
                        rs.getString("actor_combatant_id"), EventType.fromKey(rs.getString("event_type")),
                        Json.parseObject(rs.getString("payload")), toInstant(rs, "created_at")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load events for " + combatSessionId, e);
        }
        return out;
    }

    // ==================== BOSSES ====================

    @Override
    public BossInstance getBossInstance(String combatSessionId, String combatantId) {
        String sql = "SELECT id, session_id, combatant_id, template_id, current_phase, enrage_turn " +
            "FROM boss_instance WHERE session_id = ? AND combatant_id = ?";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, combatSessionId);
            ps.setString(2, combatantId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return null;
                int enrage = rs.getInt("enrage_turn");
                Integer enrageTurn = rs.wasNull() ? null : enrage;
                return new BossInstance(rs.getString("id"), rs.getString("session_id"), rs.getString("combatant_id"),
                    rs.getString("template_id"), rs.getInt("current_phase"), enrageTurn);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load boss instance for " + combatantId, e);
        }
    }

    @Override
    public BossTemplate getBossTemplate(String templateId) {
        String sql = "SELECT id, name, phases FROM boss_template WHERE id = ?";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, templateId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return null;
                return new BossTemplate(rs.getString("id"), rs.getString("name"), phasesFromJson(rs.getString("phases")));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load boss template " + templateId, e);
        }
    }

    @Override
    public void updateBossPhase(String bossInstanceId, int phase) {
        String sql = "UPDATE boss_instance SET current_phase = ? WHERE id = ?";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, phase);
            ps.setString(2, bossInstanceId);
            if (ps.executeUpdate() != 1) {
                throw new StoreException("Boss instance " + bossInstanceId + " does not exist");
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update boss phase for " + bossInstanceId, e);
        }
    }

    static String phasesToJson(List<BossPhase> phases) {
        JsonArray arr = new JsonArray();
        for (BossPhase p : phases) {
            JsonObject o = new JsonObject();
            o.addProperty("phase", p.phase());
            o.addProperty("hp_below_pct", p.hpBelowPct());
            o.add("skill_pool", Json.stringArray(p.skillPool()));
            arr.add(o);
        }
        return Json.GSON.toJson(arr);
    }

    static List<BossPhase> phasesFromJson(String raw) {
        List<BossPhase> out = new ArrayList<>();
        for (JsonElement e : Json.parseArray(raw)) {
            if (!e.isJsonObject()) continue;
            JsonObject o = e.getAsJsonObject();
            if (!o.has("phase") || !o.has("hp_below_pct")) continue;
            List<String> pool = new ArrayList<>();
            if (o.has("skill_pool") && o.get("skill_pool").isJsonArray()) {
                for (JsonElement s : o.getAsJsonArray("skill_pool")) {
                    pool.add(s.getAsString());
                }
            }
            out.add(new BossPhase(o.get("phase").getAsInt(), o.get("hp_below_pct").getAsDouble(), pool));
        }
        return out;
    }

    // ==================== FACTIONS / REPUTATION / MEMORY ====================

    @Override
    public List<Faction> getFactions(String campaignId) {
        String sql = "SELECT id, campaign_id, name, tags FROM faction WHERE campaign_id = ? ORDER BY created_order";
        List<Faction> out = new ArrayList<>();
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaignId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    List<String> tags = new ArrayList<>();
                    for (JsonElement t : Json.parseArray(rs.getString("tags"))) {
                        tags.add(t.getAsString());
                    }
                    out.add(new Faction(rs.getString("id"), rs.getString("campaign_id"), rs.getString("name"), tags));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load factions for campaign " + campaignId, e);
        }
        return out;
    }

    @Override
    public FactionReputation getReputation(String campaignId, String factionId, String playerId) {
        String sql = "SELECT rep FROM faction_reputation WHERE campaign_id = ? AND faction_id = ? AND player_id = ?";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaignId);
            ps.setString(2, factionId);
            ps.setString(3, playerId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? new FactionReputation(campaignId, factionId, playerId, rs.getInt("rep")) : null;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load reputation for player " + playerId, e);
        }
    }

    @Override
    public void appendReputationEvent(ReputationEvent event) {
        String sql = "INSERT INTO reputation_event (campaign_id, faction_id, player_id, severity, delta, evidence, created_at) " +
            "VALUES (?,?,?,?,?,?,?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, event.campaignId());
            ps.setString(2, event.factionId());
            ps.setString(3, event.playerId());
            ps.setInt(4, event.severity());
            ps.setInt(5, event.delta());
            ps.setString(6, Json.GSON.toJson(event.evidence()));
            ps.setLong(7, event.createdAt().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to append reputation event for player " + event.playerId(), e);
        }
    }

    @Override
    public void upsertReputation(FactionReputation reputation) {
        String sql = "MERGE INTO faction_reputation (campaign_id, faction_id, player_id, rep) " +
            "KEY(campaign_id, faction_id, player_id) VALUES (?,?,?,?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, reputation.campaignId());
            ps.setString(2, reputation.factionId());
            ps.setString(3, reputation.playerId());
            ps.setInt(4, reputation.rep());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to upsert reputation for player " + reputation.playerId(), e);
        }
    }

    @Override
    public void appendMemoryEvent(MemoryEvent event) {
        String sql = "INSERT INTO memory_event (campaign_id, player_id, category, severity, payload, created_at) VALUES (?,?,?,?,?,?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, event.campaignId());
            ps.setString(2, event.playerId());
            ps.setString(3, event.category());
            ps.setInt(4, event.severity());
            ps.setString(5, Json.GSON.toJson(event.payload()));
            ps.setLong(6, event.createdAt().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to append memory event for player " + event.playerId(), e);
        }
    }

    // ==================== REWARDS ====================

    @Override
    public boolean hasExperienceAward(String characterId, String combatSessionId) {
        return exists("SELECT 1 FROM experience_award WHERE character_id = ? AND session_id = ?", characterId, combatSessionId);
    }

    @Override
    public int grantExperience(ExperienceAward award) {
        try (Connection c = connect()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO experience_award (character_id, session_id, amount, reason, created_at) VALUES (?,?,?,?,?)")) {
                    ps.setString(1, award.characterId());
                    ps.setString(2, award.combatSessionId());
                    ps.setInt(3, award.amount());
                    ps.setString(4, award.reason());
                    ps.setLong(5, award.createdAt().toEpochMilli());
                    ps.executeUpdate();
                }
                int total = award.amount();
                try (PreparedStatement ps = c.prepareStatement("SELECT xp FROM character_experience WHERE character_id = ?")) {
                    ps.setString(1, award.characterId());
                    try (ResultSet rs = ps.executeQuery()) {
                        if (rs.next()) total += rs.getInt("xp");
                    }
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "MERGE INTO character_experience (character_id, xp) KEY(character_id) VALUES (?,?)")) {
                    ps.setString(1, award.characterId());
                    ps.setInt(2, total);
                    ps.executeUpdate();
                }
                c.commit();
                return total;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to grant experience to " + award.characterId(), e);
        }
    }

    @Override
    public boolean hasLootDrop(String characterId, String combatSessionId) {
        return exists("SELECT 1 FROM loot_drop WHERE character_id = ? AND session_id = ?", characterId, combatSessionId);
    }

    @Override
    public void grantLoot(LootItem item, LootDrop drop) {
        try (Connection c = connect()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO loot_item (id, campaign_id, owner_character_id, name, rarity, slot, stat_mods, " +
                        "item_power, required_level, drawback, narrative_hook, created_order) " +
                        "VALUES (?,?,?,?,?,?,?,?,?,?,?, (SELECT COALESCE(MAX(created_order), 0) + 1 FROM loot_item))")) {
                    ps.setString(1, item.getId());
                    ps.setString(2, item.getCampaignId());
                    ps.setString(3, item.getOwnerCharacterId());
                    ps.setString(4, item.getName());
                    ps.setString(5, item.getRarity().getKey());
                    ps.setString(6, item.getSlot());
                    ps.setString(7, Json.GSON.toJson(item.getStatMods()));
                    ps.setInt(8, item.getItemPower());
                    ps.setInt(9, item.getRequiredLevel());
                    ps.setString(10, item.getDrawback());
                    ps.setString(11, item.getNarrativeHook());
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO loot_drop (campaign_id, session_id, character_id, item_id, rarity, budget_points, source, created_at) " +
                        "VALUES (?,?,?,?,?,?,?,?)")) {
                    ps.setString(1, drop.campaignId());
                    ps.setString(2, drop.combatSessionId());
                    ps.setString(3, drop.characterId());
                    ps.setString(4, drop.itemId());
                    ps.setString(5, drop.rarity().getKey());
                    ps.setInt(6, drop.budgetPoints());
                    ps.setString(7, drop.source());
                    ps.setLong(8, drop.createdAt().toEpochMilli());
                    ps.executeUpdate();
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to grant loot " + item.getId() + " to " + item.getOwnerCharacterId(), e);
        }
    }

    // ==================== BOARDS ====================

    @Override
    public Board findLatestNonCombatBoard(String campaignId) {
        String sql = "SELECT * FROM board WHERE campaign_id = ? AND board_type <> ? ORDER BY updated_at DESC, id DESC LIMIT 1";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaignId);
            ps.setString(2, BoardType.COMBAT.getKey());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapBoard(rs) : null;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find board for campaign " + campaignId, e);
        }
    }

    @Override
    public Board findCombatBoard(String campaignId, String combatSessionId) {
        String sql = "SELECT * FROM board WHERE campaign_id = ? AND board_type = ? AND combat_session_id = ?";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaignId);
            ps.setString(2, BoardType.COMBAT.getKey());
            ps.setString(3, combatSessionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapBoard(rs) : null;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find combat board for " + combatSessionId, e);
        }
    }

    @Override
    public void updateBoardStatus(String boardId, String status, Instant at) {
        String sql = "UPDATE board SET status = ?, updated_at = ? WHERE id = ?";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, status);
            ps.setLong(2, at.toEpochMilli());
            ps.setString(3, boardId);
            if (ps.executeUpdate() != 1) {
                throw new StoreException("Board " + boardId + " does not exist");
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update board " + boardId, e);
        }
    }

    @Override
    public void recordBoardTransition(BoardTransition transition) {
        String sql = "INSERT INTO board_transition (campaign_id, from_board_type, to_board_type, reason, animation, payload, created_at) " +
            "VALUES (?,?,?,?,?,?,?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, transition.campaignId());
            ps.setString(2, transition.fromBoardType().getKey());
            ps.setString(3, transition.toBoardType().getKey());
            ps.setString(4, transition.reason());
            ps.setString(5, transition.animation());
            ps.setString(6, Json.GSON.toJson(transition.payload()));
            ps.setLong(7, transition.createdAt().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to record board transition for campaign " + transition.campaignId(), e);
        }
    }

    private Board mapBoard(ResultSet rs) throws SQLException {
        return new Board(rs.getString("id"), rs.getString("campaign_id"), BoardType.fromKey(rs.getString("board_type")),
            rs.getString("status"), rs.getString("combat_session_id"), toInstant(rs, "updated_at"));
    }

    // ==================== SEEDING ====================

    @Override
    public void insertSession(CombatSession session) {
        String sql = "INSERT INTO combat_session (id, campaign_id, seed, status, current_turn_index, updated_at) VALUES (?,?,?,?,?,?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, session.getId());
            ps.setString(2, session.getCampaignId());
            ps.setInt(3, session.getSeed());
            ps.setString(4, session.getStatus().getKey());
            ps.setInt(5, session.getCurrentTurnIndex());
            setInstant(ps, 6, session.getUpdatedAt());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert combat session " + session.getId(), e);
        }
    }

    @Override
    public void insertCombatant(Combatant cb) {
        String sql = "INSERT INTO combatant (id, session_id, created_order, entity_kind, player_id, character_id, name, level, " +
            "offense, defense, control, support, mobility, utility, weapon_power, armor, resist, hp, hp_max, power, power_max, " +
            "x, y, is_alive, statuses) VALUES (?,?,(SELECT COALESCE(MAX(created_order), 0) + 1 FROM combatant),?,?,?,?,?," +
            "?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            ps.setString(i++, cb.getId());
            ps.setString(i++, cb.getCombatSessionId());
            ps.setString(i++, cb.getKind().getKey());
            ps.setString(i++, cb.getPlayerId());
            ps.setString(i++, cb.getCharacterId());
            ps.setString(i++, cb.getName());
            ps.setInt(i++, cb.getLevel());
            ps.setInt(i++, cb.getOffense());
            ps.setInt(i++, cb.getDefense());
            ps.setInt(i++, cb.getControl());
            ps.setInt(i++, cb.getSupport());
            ps.setInt(i++, cb.getMobility());
            ps.setInt(i++, cb.getUtility());
            ps.setInt(i++, cb.getWeaponPower());
            ps.setInt(i++, cb.getArmor());
            ps.setInt(i++, cb.getResist());
            ps.setInt(i++, cb.getHp());
            ps.setInt(i++, cb.getHpMax());
            ps.setInt(i++, cb.getPower());
            ps.setInt(i++, cb.getPowerMax());
            ps.setInt(i++, cb.getX());
            ps.setInt(i++, cb.getY());
            ps.setBoolean(i++, cb.isAlive());
            ps.setString(i, Json.statusesToJson(cb.getStatuses()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert combatant " + cb.getId(), e);
        }
    }

    @Override
    public void insertTurnOrder(String combatSessionId, List<String> combatantIds) {
        String sql = "INSERT INTO combat_turn_order (session_id, turn_index, combatant_id) VALUES (?,?,?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < combatantIds.size(); i++) {
                ps.setString(1, combatSessionId);
                ps.setInt(2, i);
                ps.setString(3, combatantIds.get(i));
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert turn order for " + combatSessionId, e);
        }
    }

    @Override
    public void insertBossTemplate(BossTemplate template) {
        String sql = "MERGE INTO boss_template (id, name, phases) KEY(id) VALUES (?,?,?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, template.getId());
            ps.setString(2, template.getName());
            ps.setString(3, phasesToJson(template.getPhases()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert boss template " + template.getId(), e);
        }
    }

    @Override
    public void insertBossInstance(BossInstance instance) {
        String sql = "INSERT INTO boss_instance (id, session_id, combatant_id, template_id, current_phase, enrage_turn) VALUES (?,?,?,?,?,?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, instance.getId());
            ps.setString(2, instance.getCombatSessionId());
            ps.setString(3, instance.getCombatantId());
            ps.setString(4, instance.getTemplateId());
            ps.setInt(5, instance.getCurrentPhase());
            if (instance.getEnrageTurn() == null) {
                ps.setNull(6, Types.INTEGER);
            } else {
                ps.setInt(6, instance.getEnrageTurn());
            }
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert boss instance " + instance.getId(), e);
        }
    }

    @Override
    public void insertFaction(Faction faction) {
        String sql = "INSERT INTO faction (id, campaign_id, name, tags, created_order) " +
            "VALUES (?,?,?,?,(SELECT COALESCE(MAX(created_order), 0) + 1 FROM faction))";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, faction.id());
            ps.setString(2, faction.campaignId());
            ps.setString(3, faction.name());
            ps.setString(4, Json.GSON.toJson(Json.stringArray(faction.tags())));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert faction " + faction.id(), e);
        }
    }

    @Override
    public void insertBoard(Board board) {
        String sql = "INSERT INTO board (id, campaign_id, board_type, status, combat_session_id, updated_at) VALUES (?,?,?,?,?,?)";
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, board.getId());
            ps.setString(2, board.getCampaignId());
            ps.setString(3, board.getBoardType().getKey());
            ps.setString(4, board.getStatus());
            ps.setString(5, board.getCombatSessionId());
            setInstant(ps, 6, board.getUpdatedAt());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert board " + board.getId(), e);
        }
    }

    @Override
    public Board getBoard(String boardId) {
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement("SELECT * FROM board WHERE id = ?")) {
            ps.setString(1, boardId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapBoard(rs) : null;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load board " + boardId, e);
        }
    }

    @Override
    public int getExperience(String characterId) {
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement("SELECT xp FROM character_experience WHERE character_id = ?")) {
            ps.setString(1, characterId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt("xp") : 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load experience for " + characterId, e);
        }
    }

    @Override
    public List<LootItem> getInventory(String characterId) {
        String sql = "SELECT * FROM loot_item WHERE owner_character_id = ? ORDER BY created_order";
        List<LootItem> out = new ArrayList<>();
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, characterId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Map<String, Integer> mods = new LinkedHashMap<>();
                    JsonObject raw = Json.parseObject(rs.getString("stat_mods"));
                    for (Map.Entry<String, JsonElement> e : raw.entrySet()) {
                        mods.put(e.getKey(), e.getValue().getAsInt());
                    }
                    LootRarity rarity = LootRarity.fromKey(rs.getString("rarity"));
                    out.add(new LootItem(rs.getString("id"), rs.getString("campaign_id"), rs.getString("owner_character_id"),
                        rs.getString("name"), rarity, rs.getString("slot"), mods, rs.getInt("item_power"),
                        rs.getInt("required_level"), rs.getString("drawback"), rs.getString("narrative_hook")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load inventory for " + characterId, e);
        }
        return out;
    }

    @Override
    public List<ReputationEvent> getReputationEvents(String campaignId) {
        String sql = "SELECT * FROM reputation_event WHERE campaign_id = ? ORDER BY id";
        List<ReputationEvent> out = new ArrayList<>();
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaignId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ReputationEvent(rs.getString("campaign_id"), rs.getString("faction_id"),
                        rs.getString("player_id"), rs.getInt("severity"), rs.getInt("delta"),
                        Json.parseObject(rs.getString("evidence")), toInstant(rs, "created_at")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load reputation events for campaign " + campaignId, e);
        }
        return out;
    }

    @Override
    public List<MemoryEvent> getMemoryEvents(String campaignId) {
        String sql = "SELECT * FROM memory_event WHERE campaign_id = ? ORDER BY id";
        List<MemoryEvent> out = new ArrayList<>();
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaignId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new MemoryEvent(rs.getString("campaign_id"), rs.getString("player_id"),
                        rs.getString("category"), rs.getInt("severity"),
                        Json.parseObject(rs.getString("payload")), toInstant(rs, "created_at")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load memory events for campaign " + campaignId, e);
        }
        return out;
    }

    @Override
    public List<BoardTransition> getBoardTransitions(String campaignId) {
        String sql = "SELECT * FROM board_transition WHERE campaign_id = ? ORDER BY id";
        List<BoardTransition> out = new ArrayList<>();
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, campaignId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new BoardTransition(rs.getString("campaign_id"),
                        BoardType.fromKey(rs.getString("from_board_type")), BoardType.fromKey(rs.getString("to_board_type")),
                        rs.getString("reason"), rs.getString("animation"),
                        Json.parseObject(rs.getString("payload")), toInstant(rs, "created_at")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load board transitions for campaign " + campaignId, e);
        }
        return out;
    }

    // ==================== HELPERS ====================

    private boolean exists(String sql, String first, String second) {
        try (Connection c = connect();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, first);
            ps.setString(2, second);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed existence check: " + sql, e);
        }
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value.toEpochMilli());
        }
    }
}
