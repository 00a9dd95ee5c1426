package com.example.mythic.model;

import java.util.List;

/**
 * Phase-bearing template shared by boss instances.
 */
public class BossTemplate {

    private final String id;
    private final String name;
    private final List<BossPhase> phases;

    public BossTemplate(String id, String name, List<BossPhase> phases) {
        this.id = id;
        this.name = name;
        this.phases = phases == null ? List.of() : List.copyOf(phases);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public List<BossPhase> getPhases() { return phases; }
}
