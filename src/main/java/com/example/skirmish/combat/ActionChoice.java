package com.example.skirmish.combat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One legal option offered to a combatant at the start of its turn.
 * 
 * {@code uiKey} and {@code uiArgs} let a presentation layer localize the
 * option; {@link #label()} gives a plain English rendering.
 */
public record ActionChoice(String uiKey, Map<String, String> uiArgs, ActionIntent intent) {
    
    public static final String ATTACK_TARGET = "attack_target";
    public static final String RANGED_ATTACK_TARGET = "ranged_attack_target";
    public static final String CAST_SPELL = "cast_spell";
    public static final String USE_ITEM = "use_item";
    public static final String FLEE = "flee";
    
    public ActionChoice {
        if (uiKey == null || intent == null) {
            throw new IllegalArgumentException("uiKey and intent are required");
        }
        // LinkedHashMap keeps argument order stable for serialization
        uiArgs = uiArgs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(uiArgs));
    }
    
    public String label() {
        String target = uiArgs.get("target");
        switch (uiKey) {
            case ATTACK_TARGET:
                return "Attack " + target;
            case RANGED_ATTACK_TARGET:
                return "Ranged: " + target;
            case CAST_SPELL:
                return target != null
                        ? "Cast " + uiArgs.get("spell") + " on " + target
                        : "Cast " + uiArgs.get("spell");
            case USE_ITEM:
                return target != null
                        ? "Throw " + uiArgs.get("item") + " at " + target
                        : "Use " + uiArgs.get("item");
            case FLEE:
                return "Flee";
            default:
                return uiKey;
        }
    }
}
