package com.example.skirmish.model;

/**
 * The two opposing sides of an encounter.
 */
public enum CombatSide {
    PARTY("Party"),
    MONSTER("Opposition");
    
    private final String displayName;
    
    CombatSide(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    public CombatSide opposite() {
        return this == PARTY ? MONSTER : PARTY;
    }
}
