package com.example.mythic.model;

import java.util.List;

/**
 * One row of a boss template's phase table: the phase becomes eligible once the
 * boss's HP fraction is at or below {@code hpBelowPct}.
 */
public record BossPhase(int phase, double hpBelowPct, List<String> skillPool) {

    public BossPhase {
        skillPool = skillPool == null ? List.of() : List.copyOf(skillPool);
    }
}
