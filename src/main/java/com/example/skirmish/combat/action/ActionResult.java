package com.example.skirmish.combat.action;

import com.example.skirmish.combat.Effect;
import com.example.skirmish.combat.EncounterEvent;

import java.util.List;

/**
 * Events observed while resolving an action plus the effects to apply, in order.
 */
public record ActionResult(List<EncounterEvent> events, List<Effect> effects) {
    
    public ActionResult {
        events = List.copyOf(events);
        effects = List.copyOf(effects);
    }
}
