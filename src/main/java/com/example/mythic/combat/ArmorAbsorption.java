package com.example.mythic.combat;

/**
 * Split of one hit between armor and hit points.
 * Armor soaks first, up to its current value; the rest goes to HP.
 */
public record ArmorAbsorption(int absorbed, int hpLoss, int armorAfter) {

    public static ArmorAbsorption of(int armor, int damage) {
        int a = Math.max(0, armor);
        int d = Math.max(0, damage);
        int absorbed = Math.min(a, d);
        return new ArmorAbsorption(absorbed, d - absorbed, a - absorbed);
    }
}
