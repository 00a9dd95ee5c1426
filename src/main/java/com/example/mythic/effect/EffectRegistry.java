package com.example.mythic.effect;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps effect kinds to their handlers.
 */
public class EffectRegistry {

    private final Map<EffectKind, EffectHandler> handlers = new EnumMap<>(EffectKind.class);
    private final EffectHandler fallback = new MarkerEffect();

    public EffectRegistry() {
        handlers.put(EffectKind.DAMAGE_OVER_TIME, new DotEffect());
        handlers.put(EffectKind.HEAL_OVER_TIME, new HotEffect());
        handlers.put(EffectKind.DAMAGE_AND_HEAL_OVER_TIME, new DrainEffect());
        handlers.put(EffectKind.MARKER, fallback);
        handlers.put(EffectKind.UNKNOWN, fallback);
    }

    public void register(EffectKind kind, EffectHandler handler) {
        handlers.put(kind, handler);
    }

    public EffectHandler handlerFor(StatusEffect status) {
        return handlers.getOrDefault(EffectKind.classify(status), fallback);
    }
}
