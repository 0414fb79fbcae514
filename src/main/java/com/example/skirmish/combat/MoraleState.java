package com.example.skirmish.combat;

import java.util.EnumSet;
import java.util.Set;

/**
 * Group morale bookkeeping for the opposition.
 * Each trigger fires at most once; two passed checks make the group immune.
 */
public class MoraleState {
    
    public static final int CHECKS_FOR_IMMUNITY = 2;
    public static final int FEARLESS_MORALE = 12;
    
    /** Group morale score, null when no opposition combatant has one */
    private final Integer morale;
    private final Set<MoraleTrigger> firedTriggers = EnumSet.noneOf(MoraleTrigger.class);
    private int checksPassed;
    private boolean immune;
    private boolean broken;
    
    public MoraleState(Integer morale) {
        this.morale = morale;
        this.immune = morale != null && morale >= FEARLESS_MORALE;
    }
    
    public Integer getMorale() { return morale; }
    public int getChecksPassed() { return checksPassed; }
    public boolean isImmune() { return immune; }
    /** True once a check has failed and the group has fled. */
    public boolean isBroken() { return broken; }
    
    /** Whether this group ever checks morale. */
    public boolean isApplicable() {
        return morale != null && !immune && !broken;
    }
    
    public boolean hasFired(MoraleTrigger trigger) {
        return firedTriggers.contains(trigger);
    }
    
    void markFired(MoraleTrigger trigger) {
        firedTriggers.add(trigger);
    }
    
    void recordPass() {
        checksPassed++;
        if (checksPassed >= CHECKS_FOR_IMMUNITY) {
            immune = true;
        }
    }
    
    void recordFailure() {
        broken = true;
    }
}
