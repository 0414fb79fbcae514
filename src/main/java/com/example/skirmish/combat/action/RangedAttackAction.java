package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CombatCalculator;
import com.example.skirmish.combat.CombatContext;
import com.example.skirmish.combat.Combatant;
import com.example.skirmish.combat.Effect;
import com.example.skirmish.combat.EncounterEvent;
import com.example.skirmish.combat.Rejection;
import com.example.skirmish.combat.RejectionCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Single missile attack with the combatant's ranged weapon.
 */
public class RangedAttackAction extends AbstractCombatAction {
    
    private final String targetId;
    
    public RangedAttackAction(String actorId, String targetId) {
        super(actorId);
        this.targetId = targetId;
    }
    
    @Override
    public List<Rejection> validate(CombatContext ctx) {
        List<Rejection> rejections = new ArrayList<>();
        Optional<Combatant> actor = validateActor(ctx, rejections);
        if (actor.isPresent()) {
            if (!actor.get().hasRangedWeapon()) {
                rejections.add(new Rejection(RejectionCode.NO_RANGED_WEAPON, actorId + " has no ranged weapon"));
            }
            validateOpponent(ctx, actor.get(), targetId, rejections);
        }
        return rejections;
    }
    
    @Override
    public ActionResult execute(CombatContext ctx) {
        Combatant attacker = ctx.get(actorId);
        Combatant defender = ctx.get(targetId);
        CombatCalculator calc = ctx.getCalculator();
        
        CombatCalculator.AttackRoll attack = calc.rollAttack(ctx, attacker, defender);
        List<EncounterEvent> events = List.of(new EncounterEvent.AttackRolled(actorId, targetId,
                attack.roll(), attack.total(), attack.needed(), attack.hit(), attack.critical()));
        List<Effect> effects = new ArrayList<>();
        if (attack.hit()) {
            int damage = calc.rollDamage(ctx, attacker, attacker.getRangedDamageDie(), attack.critical());
            effects.add(new Effect.Damage(actorId, targetId, damage));
        }
        return new ActionResult(events, effects);
    }
}
