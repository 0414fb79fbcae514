package com.example.skirmish.spell;

import com.example.skirmish.model.TargetMode;

/**
 * A consumable item usable in combat: thrown at an enemy or used on oneself.
 */
public record ItemDefinition(String name, TargetMode targetMode, String damageDie, String healDie) {
    
    public ItemDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Item name must not be blank");
        }
        if (targetMode != TargetMode.SINGLE_ENEMY && targetMode != TargetMode.SELF) {
            throw new IllegalArgumentException("Items target SINGLE_ENEMY or SELF: " + name);
        }
        if (damageDie == null && healDie == null) {
            throw new IllegalArgumentException("Item has no effect: " + name);
        }
    }
    
    /** Thrown items need an enemy target. */
    public boolean isThrowable() {
        return targetMode == TargetMode.SINGLE_ENEMY;
    }
}
