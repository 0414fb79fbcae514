package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CombatContext;
import com.example.skirmish.combat.Effect;
import com.example.skirmish.combat.Rejection;

import java.util.ArrayList;
import java.util.List;

/**
 * Leave the encounter. Always succeeds for a combatant that can act.
 */
public class FleeAction extends AbstractCombatAction {
    
    public FleeAction(String actorId) {
        super(actorId);
    }
    
    @Override
    public List<Rejection> validate(CombatContext ctx) {
        List<Rejection> rejections = new ArrayList<>();
        validateActor(ctx, rejections);
        return rejections;
    }
    
    @Override
    public ActionResult execute(CombatContext ctx) {
        return new ActionResult(List.of(), List.of(new Effect.Flee(actorId)));
    }
}
