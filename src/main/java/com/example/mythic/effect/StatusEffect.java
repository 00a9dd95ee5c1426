package com.example.mythic.effect;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.Map;
import java.util.Set;

/**
 * A status entry carried on a combatant: {@code {id, expires_turn, stacks, data}}.
 *
 * Only the declared fields are interpreted; anything else, inside {@code data} or next to
 * the declared fields, is carried through untouched so statuses written by other producers
 * survive a round trip.
 */
public class StatusEffect {

    private static final Set<String> DECLARED_FIELDS = Set.of("id", "expires_turn", "stacks", "data");

    private final String id;
    /** Turn index at or after which the status expires; null means no expiry */
    private final Integer expiresTurn;
    private final int stacks;
    private final JsonObject data;
    /** Top-level fields other than id, expires_turn, stacks and data */
    private final JsonObject extras;

    public StatusEffect(String id, Integer expiresTurn, int stacks, JsonObject data) {
        this(id, expiresTurn, stacks, data, null);
    }

    public StatusEffect(String id, Integer expiresTurn, int stacks, JsonObject data, JsonObject extras) {
        this.id = id == null ? "" : id.trim();
        this.expiresTurn = expiresTurn;
        this.stacks = Math.max(1, stacks);
        this.data = data == null ? new JsonObject() : data.deepCopy();
        this.extras = extras == null ? new JsonObject() : extras.deepCopy();
    }

    public String getId() { return id; }
    public Integer getExpiresTurn() { return expiresTurn; }
    public int getStacks() { return stacks; }
    public JsonObject getData() { return data.deepCopy(); }
    public JsonObject getExtras() { return extras.deepCopy(); }

    public boolean isExpired(int turnIndex) {
        return expiresTurn != null && expiresTurn <= turnIndex;
    }

    public double getDamagePerTurn() {
        return numberOrZero("damage_per_turn");
    }

    public double getHealPerTurn() {
        return numberOrZero("heal_per_turn");
    }

    public String getSource() {
        JsonElement e = data.get("source");
        return e != null && e.isJsonPrimitive() ? e.getAsString() : null;
    }

    private double numberOrZero(String key) {
        JsonElement e = data.get(key);
        if (e == null || !e.isJsonPrimitive()) return 0;
        JsonPrimitive p = e.getAsJsonPrimitive();
        double value;
        try {
            if (p.isNumber()) {
                value = p.getAsDouble();
            } else if (p.isString()) {
                value = Double.parseDouble(p.getAsString());
            } else {
                return 0;
            }
        } catch (NumberFormatException ex) {
            return 0;
        }
        // "NaN" and "Infinity" parse but carry no usable amount
        return Double.isFinite(value) ? value : 0;
    }

    public StatusEffect copy() {
        return new StatusEffect(id, expiresTurn, stacks, data, extras);
    }

    public JsonObject toJson() {
        JsonObject o = new JsonObject();
        for (Map.Entry<String, JsonElement> entry : extras.entrySet()) {
            o.add(entry.getKey(), entry.getValue().deepCopy());
        }
        o.addProperty("id", id);
        if (expiresTurn != null) {
            o.addProperty("expires_turn", expiresTurn);
        }
        o.addProperty("stacks", stacks);
        o.add("data", data.deepCopy());
        return o;
    }

    /**
     * Read a status from its stored form. Returns null for entries without a usable id.
     */
    public static StatusEffect fromJson(JsonElement element) {
        if (element == null || !element.isJsonObject()) return null;
        JsonObject o = element.getAsJsonObject();
        JsonElement idEl = o.get("id");
        if (idEl == null || !idEl.isJsonPrimitive()) return null;
        String id = idEl.getAsString().trim();
        if (id.isEmpty()) return null;

        Integer expires = null;
        JsonElement expEl = o.get("expires_turn");
        if (expEl != null && expEl.isJsonPrimitive()) {
            try {
                expires = (int) Math.floor(expEl.getAsDouble());
            } catch (NumberFormatException ignored) {
                // unparseable expiry is treated as no expiry
                expires = null;
            }
        }
        int stacks = 1;
        JsonElement stEl = o.get("stacks");
        if (stEl != null && stEl.isJsonPrimitive()) {
            try {
                stacks = stEl.getAsInt();
            } catch (NumberFormatException ignored) {
                stacks = 1;
            }
        }
        JsonElement dataEl = o.get("data");
        JsonObject data = dataEl != null && dataEl.isJsonObject() ? dataEl.getAsJsonObject() : new JsonObject();
        JsonObject extras = new JsonObject();
        for (Map.Entry<String, JsonElement> entry : o.entrySet()) {
            if (!DECLARED_FIELDS.contains(entry.getKey())) {
                extras.add(entry.getKey(), entry.getValue());
            }
        }
        return new StatusEffect(id, expires, stacks, data, extras);
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
