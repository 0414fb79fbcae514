package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CombatContext;
import com.example.skirmish.combat.Rejection;

import java.util.List;

/**
 * Executable form of an intent.
 * 
 * {@link #validate} must not consume dice or change state. {@link #execute}
 * may roll dice but only describes state changes as effects; the engine
 * applies them afterwards.
 */
public interface CombatAction {
    
    /**
     * Id of the combatant performing the action.
     */
    String getActorId();
    
    /**
     * Check whether this action can be performed right now.
     * @return reasons it cannot, empty when the action is legal
     */
    List<Rejection> validate(CombatContext ctx);
    
    /**
     * Resolve the action. Only called after {@link #validate} returned no rejections.
     */
    ActionResult execute(CombatContext ctx);
}
