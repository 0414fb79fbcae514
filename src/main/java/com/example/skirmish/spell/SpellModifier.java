package com.example.skirmish.spell;

import com.example.skirmish.model.ModifiedStat;

/**
 * Template for a temporary modifier a spell grants to each affected combatant.
 * A null duration is permanent for the rest of the encounter.
 */
public record SpellModifier(String modifierId, ModifiedStat stat, int value, Integer duration) {
    
    public SpellModifier {
        if (modifierId == null || modifierId.isBlank()) {
            throw new IllegalArgumentException("modifierId must not be blank");
        }
        if (stat == null) {
            throw new IllegalArgumentException("stat must not be null for " + modifierId);
        }
        if (duration != null && duration < 1) {
            throw new IllegalArgumentException("duration must be positive for " + modifierId);
        }
    }
}
