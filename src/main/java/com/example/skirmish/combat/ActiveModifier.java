package com.example.skirmish.combat;

import com.example.skirmish.model.ModifiedStat;

/**
 * A temporary (or permanent) adjustment to one combat stat of one combatant.
 * Remaining duration is counted in rounds; null means permanent.
 */
public class ActiveModifier {
    private final String modifierId;
    private final String sourceId;
    private final ModifiedStat stat;
    private final int value;
    private Integer remainingRounds;
    
    public ActiveModifier(String modifierId, String sourceId, ModifiedStat stat, int value, Integer remainingRounds) {
        if (modifierId == null || stat == null) {
            throw new IllegalArgumentException("modifierId and stat are required");
        }
        this.modifierId = modifierId;
        this.sourceId = sourceId;
        this.stat = stat;
        this.value = value;
        this.remainingRounds = remainingRounds;
    }
    
    /** Modifier that lasts until explicitly removed. */
    public static ActiveModifier permanent(String modifierId, String sourceId, ModifiedStat stat, int value) {
        return new ActiveModifier(modifierId, sourceId, stat, value, null);
    }
    
    public String getModifierId() { return modifierId; }
    public String getSourceId() { return sourceId; }
    public ModifiedStat getStat() { return stat; }
    public int getValue() { return value; }
    public Integer getRemainingRounds() { return remainingRounds; }
    
    public boolean isPermanent() {
        return remainingRounds == null;
    }
    
    /**
     * Count down one round.
     * @return true if the modifier has now expired
     */
    boolean tick() {
        if (remainingRounds == null) {
            return false;
        }
        remainingRounds = remainingRounds - 1;
        return remainingRounds <= 0;
    }
    
    /** Detached copy for callers outside the tracker. */
    public ActiveModifier copy() {
        return new ActiveModifier(modifierId, sourceId, stat, value, remainingRounds);
    }
    
    @Override
    public String toString() {
        String sign = value >= 0 ? "+" : "";
        return modifierId + "(" + stat + " " + sign + value
                + (remainingRounds == null ? ", permanent)" : ", " + remainingRounds + " rounds)");
    }
}
