package com.example.skirmish.combat;

import java.util.Locale;
import java.util.Optional;

/**
 * Conditions spells can place on a combatant.
 */
public enum ConditionType {
    HELD("held", true, false, 0),
    ASLEEP("asleep", true, true, 0),
    BLINDED("blinded", false, false, -4);
    
    private final String id;
    private final boolean skipTurn;
    private final boolean breakOnDamage;
    private final int attackPenalty;
    
    ConditionType(String id, boolean skipTurn, boolean breakOnDamage, int attackPenalty) {
        this.id = id;
        this.skipTurn = skipTurn;
        this.breakOnDamage = breakOnDamage;
        this.attackPenalty = attackPenalty;
    }
    
    public String getId() { return id; }
    public boolean isSkipTurn() { return skipTurn; }
    public boolean isBreakOnDamage() { return breakOnDamage; }
    public int getAttackPenalty() { return attackPenalty; }
    
    public static Optional<ConditionType> fromId(String id) {
        if (id == null) return Optional.empty();
        String key = id.trim().toLowerCase(Locale.ROOT);
        for (ConditionType type : values()) {
            if (type.id.equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
