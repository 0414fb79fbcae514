package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CombatCalculator;
import com.example.skirmish.combat.CombatContext;
import com.example.skirmish.combat.Combatant;
import com.example.skirmish.combat.Effect;
import com.example.skirmish.combat.EncounterEvent;
import com.example.skirmish.combat.Rejection;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Hand-to-hand attack. Creatures with several attacks per round make them
 * all against the same target, stopping once it would be down.
 */
public class MeleeAttackAction extends AbstractCombatAction {
    
    private final String targetId;
    
    public MeleeAttackAction(String actorId, String targetId) {
        super(actorId);
        this.targetId = targetId;
    }
    
    public String getTargetId() {
        return targetId;
    }
    
    @Override
    public List<Rejection> validate(CombatContext ctx) {
        List<Rejection> rejections = new ArrayList<>();
        Optional<Combatant> actor = validateActor(ctx, rejections);
        actor.ifPresent(a -> validateOpponent(ctx, a, targetId, rejections));
        return rejections;
    }
    
    @Override
    public ActionResult execute(CombatContext ctx) {
        Combatant attacker = ctx.get(actorId);
        Combatant defender = ctx.get(targetId);
        CombatCalculator calc = ctx.getCalculator();
        
        List<EncounterEvent> events = new ArrayList<>();
        List<Effect> effects = new ArrayList<>();
        int projectedHp = defender.getHp();
        
        for (int i = 0; i < attacker.getAttacksPerRound() && projectedHp > 0; i++) {
            CombatCalculator.AttackRoll attack = calc.rollAttack(ctx, attacker, defender);
            events.add(new EncounterEvent.AttackRolled(actorId, targetId,
                    attack.roll(), attack.total(), attack.needed(), attack.hit(), attack.critical()));
            if (attack.hit()) {
                int damage = calc.rollDamage(ctx, attacker, attacker.getDamageDie(), attack.critical());
                effects.add(new Effect.Damage(actorId, targetId, damage));
                projectedHp -= damage;
            }
        }
        return new ActionResult(events, effects);
    }
}
