package com.example.mythic.model;

import java.util.List;

public record Faction(String id, String campaignId, String name, List<String> tags) {

    public Faction {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
