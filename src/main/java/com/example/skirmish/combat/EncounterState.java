package com.example.skirmish.combat;

/**
 * Position of an encounter in its resolution state machine.
 * 
 * INIT -> ROUND_START -> TURN_START -> AWAIT_INTENT -> VALIDATE_INTENT ->
 * EXECUTE_ACTION -> CHECK_DEATHS -> CHECK_MORALE -> CHECK_VICTORY, which
 * loops back to TURN_START or ROUND_START until the encounter is ENDED.
 */
public enum EncounterState {
    
    /** Roster assembled, nothing has happened yet */
    INIT("Initializing"),
    
    /** Advance the round counter and build the turn queue */
    ROUND_START("Round start"),
    
    /** Take the next combatant from the turn queue */
    TURN_START("Turn start"),
    
    /** Waiting for the current combatant's intent */
    AWAIT_INTENT("Awaiting intent"),
    
    VALIDATE_INTENT("Validating intent"),
    
    EXECUTE_ACTION("Executing action"),
    
    CHECK_DEATHS("Checking deaths"),
    
    CHECK_MORALE("Checking morale"),
    
    CHECK_VICTORY("Checking victory"),
    
    /** Terminal; an outcome has been recorded */
    ENDED("Ended");
    
    private final String displayName;
    
    EncounterState(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
}
