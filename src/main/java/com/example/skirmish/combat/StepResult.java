package com.example.skirmish.combat;

import java.util.List;

/**
 * Outcome of one or more engine steps.
 * 
 * @param state              engine state after the step
 * @param needsIntent        true when the engine is waiting for an externally supplied intent
 * @param pendingCombatantId the combatant the intent must be for, or null
 * @param events             events emitted by the step, in order
 */
public record StepResult(EncounterState state, boolean needsIntent, String pendingCombatantId,
                         List<EncounterEvent> events) {
    
    public StepResult {
        events = List.copyOf(events);
    }
    
    public boolean isEnded() {
        return state == EncounterState.ENDED;
    }
}
