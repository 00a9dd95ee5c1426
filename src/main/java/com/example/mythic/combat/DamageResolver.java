package com.example.mythic.combat;

import com.example.mythic.model.Combatant;
import com.example.mythic.util.DeterministicRng;

/**
 * Seeded damage roll.
 *
 * Attack rating: round(14 + level * 1.55 + offense * 0.32 + weapon_power * 0.40)
 *   with level clamped to 1-99, stats to 0-100, weapon power to at least 0.
 * Base: rating * max(multiplier, 0), then a spread of +/- spread_pct (capped at 0.5).
 * Crit: chance clamp(0.02 + (mobility + utility) / 400, 0.02, 0.60),
 *   multiplier clamp(1.5 + (offense + utility) / 200, 1.5, 3.0).
 * Mitigation: pre * 100 / (100 + resist). Any positive hit deals at least 1.
 *
 * The caller passes the target's resist plus its current armor as {@code resist} and is
 * responsible for armor absorption afterwards (see {@link ArmorAbsorption}).
 */
public class DamageResolver {

    private final DeterministicRng rng;
    private final double spreadPct;

    public DamageResolver(DeterministicRng rng, double spreadPct) {
        this.rng = rng;
        this.spreadPct = spreadPct;
    }

    /**
     * Attack rating for the given stats.
     */
    public static int attackRating(int level, int offense, int weaponPower) {
        int lvl = clamp(level, 1, 99);
        int off = clamp(offense, 0, 100);
        int wp = Math.max(0, weaponPower);
        return (int) Math.round(14 + lvl * 1.55 + off * 0.32 + wp * 0.40);
    }

    /**
     * Roll damage for an attacker against a target mitigation value.
     */
    public DamageRoll roll(int seed, String label, Combatant attacker, double multiplier, int resist) {
        return roll(seed, label, attacker.getLevel(), attacker.getOffense(), attacker.getMobility(),
            attacker.getUtility(), attacker.getWeaponPower(), multiplier, resist);
    }

    public DamageRoll roll(int seed, String label, int level, int offense, int mobility, int utility,
                           int weaponPower, double multiplier, int resist) {
        int off = clamp(offense, 0, 100);
        int mob = clamp(mobility, 0, 100);
        int util = clamp(utility, 0, 100);
        int res = Math.max(0, resist);

        int rating = attackRating(level, offense, weaponPower);
        double base = rating * Math.max(multiplier, 0);
        double pct = Math.max(0, Math.min(0.5, spreadPct));
        double spread = (rng.next01(seed, label + ":spread") - 0.5) * 2 * pct;
        double pre = base * (1 + spread);

        double critChance = Math.max(0.02, Math.min(0.60, 0.02 + (mob + util) / 400.0));
        boolean crit = rng.next01(seed, label + ":crit") < critChance;
        double critMult = Math.max(1.5, Math.min(3.0, 1.5 + (off + util) / 200.0));
        if (crit) {
            pre *= critMult;
        }

        double mitigated = pre * 100.0 / (100.0 + res);
        int finalDamage = pre <= 0 ? 0 : Math.max(1, (int) Math.round(mitigated));
        return new DamageRoll(rating, base, spread, pre, res, crit, critChance, critMult, finalDamage);
    }

    private static int clamp(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
