package com.example.mythic.effect;

/**
 * Markers only matter while present; they have no periodic effect and simply expire.
 * Also used for unknown statuses, which must be carried but never interpreted.
 */
public class MarkerEffect implements EffectHandler {
}
