package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CombatContext;
import com.example.skirmish.combat.Combatant;
import com.example.skirmish.combat.Rejection;
import com.example.skirmish.combat.RejectionCode;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Validation shared by every action.
 */
abstract class AbstractCombatAction implements CombatAction {
    
    protected final String actorId;
    
    protected AbstractCombatAction(String actorId) {
        this.actorId = actorId;
    }
    
    @Override
    public String getActorId() {
        return actorId;
    }
    
    /**
     * Checks that the actor exists, is the combatant whose turn it is, and can act.
     * @return the actor if no rejection was added
     */
    protected Optional<Combatant> validateActor(CombatContext ctx, List<Rejection> rejections) {
        Optional<Combatant> actor = ctx.find(actorId);
        if (actor.isEmpty() || !actorId.equals(ctx.getCurrentCombatantId())) {
            rejections.add(new Rejection(RejectionCode.NOT_CURRENT_COMBATANT,
                    actorId + " is not the current combatant (expected " + ctx.getCurrentCombatantId() + ")"));
            return Optional.empty();
        }
        if (!actor.get().isActive()) {
            rejections.add(new Rejection(RejectionCode.ACTOR_DEAD, actorId + " cannot act"));
            return Optional.empty();
        }
        return actor;
    }
    
    /**
     * Checks that a single target exists, is on the field and opposes the actor.
     */
    protected void validateOpponent(CombatContext ctx, Combatant actor, String targetId, List<Rejection> rejections) {
        Optional<Combatant> target = ctx.find(targetId);
        if (target.isEmpty() || !target.get().isActive()) {
            rejections.add(new Rejection(RejectionCode.INVALID_TARGET, "Target " + targetId + " is dead or invalid"));
        } else if (!ctx.areOpponents(actor, target.get())) {
            rejections.add(new Rejection(RejectionCode.TARGET_NOT_OPPONENT, "Target " + targetId + " is not an opponent"));
        }
    }
    
    protected void validateAlly(CombatContext ctx, Combatant actor, String targetId, List<Rejection> rejections) {
        Optional<Combatant> target = ctx.find(targetId);
        if (target.isEmpty() || !target.get().isActive()) {
            rejections.add(new Rejection(RejectionCode.INVALID_TARGET, "Target " + targetId + " is dead or invalid"));
        } else if (ctx.areOpponents(actor, target.get())) {
            rejections.add(new Rejection(RejectionCode.TARGET_NOT_ALLY, "Target " + targetId + " is not an ally"));
        }
    }
    
    /**
     * Rejects a target list that names the same combatant more than once.
     * @return true if every id is distinct
     */
    protected boolean validateDistinct(List<String> targetIds, List<Rejection> rejections) {
        Set<String> seen = new HashSet<>();
        for (String id : targetIds) {
            if (!seen.add(id)) {
                rejections.add(new Rejection(RejectionCode.DUPLICATE_TARGET, "Target " + id + " is named more than once"));
                return false;
            }
        }
        return true;
    }
}
