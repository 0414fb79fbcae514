package com.example.skirmish.ai;

import com.example.skirmish.combat.ActionChoice;
import com.example.skirmish.combat.ActionIntent;
import com.example.skirmish.combat.CombatContext;

import java.util.List;

/**
 * Always takes the first offered choice (the melee attack on the first
 * opponent, when one is available). Consumes no dice.
 */
public class FirstChoiceTacticalProvider implements TacticalProvider {
    
    @Override
    public ActionIntent chooseIntent(String combatantId, List<ActionChoice> choices, CombatContext context) {
        return choices.get(0).intent();
    }
}
