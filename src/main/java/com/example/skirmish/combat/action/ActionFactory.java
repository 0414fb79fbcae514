package com.example.skirmish.combat.action;

import com.example.skirmish.combat.ActionIntent;

/**
 * Maps each intent variant to the action that resolves it.
 */
public class ActionFactory implements ActionIntent.Visitor<CombatAction> {
    
    public CombatAction create(ActionIntent intent) {
        return intent.accept(this);
    }
    
    @Override
    public CombatAction visitMeleeAttack(ActionIntent.MeleeAttack intent) {
        return new MeleeAttackAction(intent.actorId(), intent.targetId());
    }
    
    @Override
    public CombatAction visitRangedAttack(ActionIntent.RangedAttack intent) {
        return new RangedAttackAction(intent.actorId(), intent.targetId());
    }
    
    @Override
    public CombatAction visitCastSpell(ActionIntent.CastSpell intent) {
        return new CastSpellAction(intent.actorId(), intent.spellId(), intent.slotLevel(), intent.targetIds());
    }
    
    @Override
    public CombatAction visitUseItem(ActionIntent.UseItem intent) {
        return new UseItemAction(intent.actorId(), intent.itemName(), intent.targetIds());
    }
    
    @Override
    public CombatAction visitFlee(ActionIntent.Flee intent) {
        return new FleeAction(intent.actorId());
    }
}
