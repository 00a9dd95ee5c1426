package com.example.mythic.util;

import com.example.mythic.effect.StatusEffect;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Gson helpers for the JSON columns (statuses, event payloads, phase tables).
 */
public final class Json {

    public static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private Json() { }

    public static JsonObject parseObject(String raw) {
        if (raw == null || raw.isBlank()) return new JsonObject();
        try {
            JsonElement e = JsonParser.parseString(raw);
            return e.isJsonObject() ? e.getAsJsonObject() : new JsonObject();
        } catch (JsonSyntaxException e) {
            throw new IllegalArgumentException("Malformed JSON object: " + e.getMessage(), e);
        }
    }

    public static JsonArray parseArray(String raw) {
        if (raw == null || raw.isBlank()) return new JsonArray();
        try {
            JsonElement e = JsonParser.parseString(raw);
            return e.isJsonArray() ? e.getAsJsonArray() : new JsonArray();
        } catch (JsonSyntaxException e) {
            throw new IllegalArgumentException("Malformed JSON array: " + e.getMessage(), e);
        }
    }

    /**
     * Decode a stored status list. Entries that are not objects or have no id are dropped.
     */
    public static List<StatusEffect> statusesFromJson(String raw) {
        List<StatusEffect> out = new ArrayList<>();
        for (JsonElement e : parseArray(raw)) {
            StatusEffect s = StatusEffect.fromJson(e);
            if (s != null) {
                out.add(s);
            }
        }
        return out;
    }

    public static String statusesToJson(List<StatusEffect> statuses) {
        JsonArray arr = new JsonArray();
        for (StatusEffect s : statuses) {
            arr.add(s.toJson());
        }
        return GSON.toJson(arr);
    }

    public static JsonArray stringArray(List<String> values) {
        JsonArray arr = new JsonArray();
        for (String v : values) {
            arr.add(v);
        }
        return arr;
    }
}
