package com.example.mythic.model;

import com.example.mythic.effect.StatusEffect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A participant of a combat session (player, NPC or summon).
 *
 * Hit points are always kept in [0, hpMax] and the alive flag follows them:
 * a combatant is alive exactly while its hp is above zero. Armor never goes negative.
 */
public class Combatant {

    /** Unique identifier of this combatant */
    private final String id;

    /** Session this combatant belongs to */
    private final String combatSessionId;

    private final EntityKind kind;

    /** Linked player (user) id; non-null puts the combatant on the player side */
    private final String playerId;

    /** Linked character id, used for settlement rewards */
    private final String characterId;

    private final String name;
    private final int level;

    // Combat stats
    private final int offense;
    private final int defense;
    private final int control;
    private final int support;
    private final int mobility;
    private final int utility;

    private final int weaponPower;
    private int armor;
    private final int resist;

    private int hp;
    private final int hpMax;
    private int power;
    private final int powerMax;

    /** Arena position */
    private final int x;
    private final int y;

    private boolean alive;

    private List<StatusEffect> statuses = new ArrayList<>();

    private Combatant(Builder b) {
        this.id = b.id;
        this.combatSessionId = b.combatSessionId;
        this.kind = b.kind;
        this.playerId = b.playerId;
        this.characterId = b.characterId;
        this.name = b.name;
        this.level = b.level;
        this.offense = b.offense;
        this.defense = b.defense;
        this.control = b.control;
        this.support = b.support;
        this.mobility = b.mobility;
        this.utility = b.utility;
        this.weaponPower = b.weaponPower;
        this.armor = Math.max(0, b.armor);
        this.resist = b.resist;
        this.hpMax = Math.max(0, b.hpMax);
        this.powerMax = Math.max(0, b.powerMax);
        this.power = Math.max(0, Math.min(this.powerMax, b.power));
        this.x = b.x;
        this.y = b.y;
        this.statuses = new ArrayList<>(b.statuses);
        setHp(b.hp);
    }

    public static Builder builder(String id, String combatSessionId) {
        return new Builder(id, combatSessionId);
    }

    // Identification

    public String getId() { return id; }
    public String getCombatSessionId() { return combatSessionId; }
    public EntityKind getKind() { return kind; }
    public String getPlayerId() { return playerId; }
    public String getCharacterId() { return characterId; }
    public String getName() { return name; }
    public int getLevel() { return level; }

    public boolean isPlayer() { return kind == EntityKind.PLAYER; }
    public boolean isNpc() { return kind == EntityKind.NPC; }
    public boolean isSummon() { return kind == EntityKind.SUMMON; }

    /**
     * Check whether this combatant fights on the players' side.
     * Anything linked to a player (characters and their companions) is on that side.
     */
    public boolean isPlayerSide() {
        return playerId != null && !playerId.isBlank();
    }

    public boolean isOpponentOf(Combatant other) {
        return isPlayerSide() != other.isPlayerSide();
    }

    // Stats

    public int getOffense() { return offense; }
    public int getDefense() { return defense; }
    public int getControl() { return control; }
    public int getSupport() { return support; }
    public int getMobility() { return mobility; }
    public int getUtility() { return utility; }
    public int getWeaponPower() { return weaponPower; }
    public int getResist() { return resist; }

    public int getArmor() { return armor; }
    public void setArmor(int armor) { this.armor = Math.max(0, armor); }

    public int getPower() { return power; }
    public int getPowerMax() { return powerMax; }
    public void setPower(int power) { this.power = Math.max(0, Math.min(powerMax, power)); }

    public int getX() { return x; }
    public int getY() { return y; }

    // Vitals

    public int getHp() { return hp; }
    public int getHpMax() { return hpMax; }

    /**
     * Set hit points, clamped to [0, hpMax]. The alive flag is derived from the result.
     */
    public void setHp(int hp) {
        this.hp = Math.max(0, Math.min(hpMax, hp));
        this.alive = this.hp > 0;
    }

    public boolean isAlive() { return alive; }

    /**
     * Current HP as a fraction of max HP, in [0, 1]. A combatant without max HP counts as full.
     */
    public double getHpFraction() {
        if (hpMax <= 0) return 1.0;
        return Math.max(0.0, Math.min(1.0, (double) hp / hpMax));
    }

    /**
     * Current power as a fraction of max power. Combatants without a power pool count as full.
     */
    public double getPowerFraction() {
        if (powerMax <= 0) return 1.0;
        return Math.max(0.0, Math.min(1.0, (double) power / powerMax));
    }

    // Statuses

    public List<StatusEffect> getStatuses() {
        return Collections.unmodifiableList(statuses);
    }

    public void setStatuses(List<StatusEffect> statuses) {
        this.statuses = new ArrayList<>(statuses);
    }

    public boolean hasStatus(String statusId) {
        return statuses.stream().anyMatch(s -> s.getId().equalsIgnoreCase(statusId));
    }

    /**
     * Deep copy, so stores can hand out rows without aliasing their own state.
     */
    public Combatant copy() {
        Builder b = toBuilder();
        List<StatusEffect> copied = new ArrayList<>();
        for (StatusEffect s : statuses) {
            copied.add(s.copy());
        }
        b.statuses = copied;
        return b.build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(id, combatSessionId);
        b.kind = kind;
        b.playerId = playerId;
        b.characterId = characterId;
        b.name = name;
        b.level = level;
        b.offense = offense;
        b.defense = defense;
        b.control = control;
        b.support = support;
        b.mobility = mobility;
        b.utility = utility;
        b.weaponPower = weaponPower;
        b.armor = armor;
        b.resist = resist;
        b.hp = hp;
        b.hpMax = hpMax;
        b.power = power;
        b.powerMax = powerMax;
        b.x = x;
        b.y = y;
        b.statuses = new ArrayList<>(statuses);
        return b;
    }

    @Override
    public String toString() {
        return String.format("Combatant[%s %s %s hp=%d/%d armor=%d%s]",
            id, kind.getKey(), name, hp, hpMax, armor, alive ? "" : " dead");
    }

    /**
     * Builder for combatants; the stat list is long enough that positional constructors get misread.
     */
    public static class Builder {
        private final String id;
        private final String combatSessionId;
        private EntityKind kind = EntityKind.NPC;
        private String playerId;
        private String characterId;
        private String name = "Unknown";
        private int level = 1;
        private int offense;
        private int defense;
        private int control;
        private int support;
        private int mobility;
        private int utility;
        private int weaponPower;
        private int armor;
        private int resist;
        private int hp = 1;
        private int hpMax = 1;
        private int power;
        private int powerMax;
        private int x;
        private int y;
        private List<StatusEffect> statuses = new ArrayList<>();

        private Builder(String id, String combatSessionId) {
            this.id = id;
            this.combatSessionId = combatSessionId;
        }

        public Builder kind(EntityKind kind) { this.kind = kind; return this; }
        public Builder playerId(String playerId) { this.playerId = playerId; return this; }
        public Builder characterId(String characterId) { this.characterId = characterId; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder level(int level) { this.level = level; return this; }
        public Builder offense(int offense) { this.offense = offense; return this; }
        public Builder defense(int defense) { this.defense = defense; return this; }
        public Builder control(int control) { this.control = control; return this; }
        public Builder support(int support) { this.support = support; return this; }
        public Builder mobility(int mobility) { this.mobility = mobility; return this; }
        public Builder utility(int utility) { this.utility = utility; return this; }
        public Builder weaponPower(int weaponPower) { this.weaponPower = weaponPower; return this; }
        public Builder armor(int armor) { this.armor = armor; return this; }
        public Builder resist(int resist) { this.resist = resist; return this; }
        public Builder hp(int hp, int hpMax) { this.hp = hp; this.hpMax = hpMax; return this; }
        public Builder power(int power, int powerMax) { this.power = power; this.powerMax = powerMax; return this; }
        public Builder position(int x, int y) { this.x = x; this.y = y; return this; }
        public Builder statuses(List<StatusEffect> statuses) { this.statuses = new ArrayList<>(statuses); return this; }

        public Combatant build() {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Combatant id is required");
            }
            return new Combatant(this);
        }
    }
}
