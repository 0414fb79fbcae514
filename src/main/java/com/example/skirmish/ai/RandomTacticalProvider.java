package com.example.skirmish.ai;

import com.example.skirmish.combat.ActionChoice;
import com.example.skirmish.combat.ActionIntent;
import com.example.skirmish.combat.CombatContext;
import com.example.skirmish.util.DiceService;

import java.util.List;

/**
 * Picks uniformly among the offered choices using the encounter's dice,
 * so scripted dice make its decisions reproducible.
 */
public class RandomTacticalProvider implements TacticalProvider {
    
    private final DiceService dice;
    
    public RandomTacticalProvider(DiceService dice) {
        if (dice == null) {
            throw new IllegalArgumentException("dice must not be null");
        }
        this.dice = dice;
    }
    
    @Override
    public ActionIntent chooseIntent(String combatantId, List<ActionChoice> choices, CombatContext context) {
        return dice.choice(choices).intent();
    }
}
