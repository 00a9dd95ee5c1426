package com.example.mythic.combat;

import com.google.gson.JsonObject;

/**
 * Full breakdown of one damage roll, carried verbatim in the {@code damage} event.
 */
public class DamageRoll {

    private final int attackRating;
    private final double baseBeforeSpread;
    private final double spread;
    private final double preMitigation;
    private final int resist;
    private final boolean crit;
    private final double critChance;
    private final double critMult;
    private final int finalDamage;

    DamageRoll(int attackRating, double baseBeforeSpread, double spread, double preMitigation, int resist,
               boolean crit, double critChance, double critMult, int finalDamage) {
        this.attackRating = attackRating;
        this.baseBeforeSpread = baseBeforeSpread;
        this.spread = spread;
        this.preMitigation = preMitigation;
        this.resist = resist;
        this.crit = crit;
        this.critChance = critChance;
        this.critMult = critMult;
        this.finalDamage = finalDamage;
    }

    public int getAttackRating() { return attackRating; }
    public double getBaseBeforeSpread() { return baseBeforeSpread; }
    public double getSpread() { return spread; }
    public double getPreMitigation() { return preMitigation; }
    public int getResist() { return resist; }
    public boolean isCrit() { return crit; }
    public double getCritChance() { return critChance; }
    public double getCritMult() { return critMult; }

    /** Never negative */
    public int getFinalDamage() { return finalDamage; }

    public JsonObject toJson() {
        JsonObject o = new JsonObject();
        o.addProperty("attack_rating", attackRating);
        o.addProperty("base_before_spread", baseBeforeSpread);
        o.addProperty("spread", spread);
        o.addProperty("pre_mitigation", preMitigation);
        o.addProperty("resist", resist);
        o.addProperty("is_crit", crit);
        o.addProperty("crit_chance", critChance);
        o.addProperty("crit_mult", critMult);
        o.addProperty("final_damage", finalDamage);
        return o;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
