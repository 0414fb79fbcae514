package com.example.skirmish.combat;

public enum EncounterOutcome {
    PARTY_VICTORY("The party is victorious"),
    OPPOSITION_VICTORY("The party has been defeated"),
    /** The engine aborted because of an internal error or an exhausted step budget */
    FAULTED("The encounter was aborted");
    
    private final String displayName;
    
    EncounterOutcome(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
}
