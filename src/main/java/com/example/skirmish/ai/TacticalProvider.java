package com.example.skirmish.ai;

import com.example.skirmish.combat.ActionChoice;
import com.example.skirmish.combat.ActionIntent;
import com.example.skirmish.combat.CombatContext;

import java.util.List;

/**
 * Chooses actions on behalf of a combatant that is not driven by a player.
 */
public interface TacticalProvider {
    
    /**
     * Pick an intent for the combatant's turn.
     * @param combatantId the combatant whose turn it is
     * @param choices legal options, never empty, in the engine's order
     * @param context read-only view of the encounter
     */
    ActionIntent chooseIntent(String combatantId, List<ActionChoice> choices, CombatContext context);
}
