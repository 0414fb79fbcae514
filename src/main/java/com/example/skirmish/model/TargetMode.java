package com.example.skirmish.model;

/**
 * How a spell or item selects the combatants it affects.
 */
public enum TargetMode {
    SINGLE_ENEMY(1),
    ALL_ENEMIES(-1),
    SELF(1),
    SINGLE_ALLY(1),
    ALL_ALLIES(-1),
    /** A random group of enemies, sized by a dice roll */
    ENEMY_GROUP(-1),
    /** Weakest enemies first until a rolled hit-dice budget is spent */
    HD_POOL(-1);
    
    private final int targetCount;
    
    TargetMode(int targetCount) {
        this.targetCount = targetCount;
    }
    
    /** 1 for a single chosen target, -1 for every eligible combatant or a resolved group. */
    public int getTargetCount() {
        return targetCount;
    }
    
    public boolean isSingleTarget() {
        return targetCount == 1;
    }
    
    public boolean targetsEnemies() {
        return this == SINGLE_ENEMY || this == ALL_ENEMIES || this == ENEMY_GROUP || this == HD_POOL;
    }
    
    public boolean targetsAllies() {
        return this == SINGLE_ALLY || this == ALL_ALLIES;
    }
}
