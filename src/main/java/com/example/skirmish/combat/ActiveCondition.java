package com.example.skirmish.combat;

/**
 * A condition currently affecting a combatant. Null remaining rounds lasts
 * until the condition is removed (or broken by damage).
 */
public class ActiveCondition {
    private final ConditionType type;
    private final String sourceId;
    private Integer remainingRounds;
    
    public ActiveCondition(ConditionType type, String sourceId, Integer remainingRounds) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        this.type = type;
        this.sourceId = sourceId;
        this.remainingRounds = remainingRounds;
    }
    
    public ConditionType getType() { return type; }
    public String getConditionId() { return type.getId(); }
    public String getSourceId() { return sourceId; }
    public Integer getRemainingRounds() { return remainingRounds; }
    
    boolean tick() {
        if (remainingRounds == null) {
            return false;
        }
        remainingRounds = remainingRounds - 1;
        return remainingRounds <= 0;
    }
    
    public ActiveCondition copy() {
        return new ActiveCondition(type, sourceId, remainingRounds);
    }
}
