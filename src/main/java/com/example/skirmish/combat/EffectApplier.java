package com.example.skirmish.combat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies effects to the combat context, reporting each change as events.
 */
class EffectApplier implements Effect.Visitor<List<EncounterEvent>> {
    
    private static final Logger logger = LoggerFactory.getLogger(EffectApplier.class);
    
    private final CombatContext ctx;
    
    EffectApplier(CombatContext ctx) {
        this.ctx = ctx;
    }
    
    List<EncounterEvent> apply(Effect effect) {
        logger.debug("[EffectApplier] Applying {}", effect);
        return effect.accept(this);
    }
    
    @Override
    public List<EncounterEvent> visitDamage(Effect.Damage effect) {
        Combatant target = ctx.get(effect.targetId());
        List<EncounterEvent> events = new ArrayList<>();
        int hpAfter = target.applyDamage(effect.amount());
        events.add(new EncounterEvent.DamageApplied(effect.sourceId(), effect.targetId(), effect.amount(), hpAfter));
        if (effect.amount() > 0) {
            for (String conditionId : ctx.getConditions().removeBrokenByDamage(target.getId())) {
                events.add(new EncounterEvent.ConditionExpired(target.getId(), conditionId, "damage"));
            }
        }
        return events;
    }
    
    @Override
    public List<EncounterEvent> visitHeal(Effect.Heal effect) {
        Combatant target = ctx.get(effect.targetId());
        int healed = target.applyHealing(effect.amount());
        return List.of(new EncounterEvent.HealingApplied(effect.sourceId(), effect.targetId(), healed, target.getHp()));
    }
    
    @Override
    public List<EncounterEvent> visitConsumeSlot(Effect.ConsumeSlot effect) {
        int remaining = ctx.get(effect.casterId()).consumeSlot(effect.level());
        return List.of(new EncounterEvent.SpellSlotConsumed(effect.casterId(), effect.level(), remaining));
    }
    
    @Override
    public List<EncounterEvent> visitConsumeItem(Effect.ConsumeItem effect) {
        int remaining = ctx.get(effect.actorId()).consumeItem(effect.itemName());
        return List.of(new EncounterEvent.ItemConsumed(effect.actorId(), effect.itemName(), remaining));
    }
    
    @Override
    public List<EncounterEvent> visitApplyCondition(Effect.ApplyCondition effect) {
        ConditionType type = ConditionType.fromId(effect.conditionId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown condition: " + effect.conditionId()));
        Combatant target = ctx.get(effect.targetId());
        if (!target.isActive()) {
            return List.of();
        }
        ctx.getConditions().add(target.getId(), new ActiveCondition(type, effect.sourceId(), effect.duration()));
        return List.of(new EncounterEvent.ConditionApplied(effect.sourceId(), effect.targetId(),
                type.getId(), effect.duration()));
    }
    
    @Override
    public List<EncounterEvent> visitApplyModifier(Effect.ApplyModifier effect) {
        Combatant target = ctx.get(effect.targetId());
        ctx.getModifiers().add(target.getId(), new ActiveModifier(effect.modifierId(), effect.sourceId(),
                effect.stat(), effect.value(), effect.duration()));
        return List.of(new EncounterEvent.ModifierApplied(effect.sourceId(), effect.targetId(),
                effect.modifierId(), effect.stat(), effect.value(), effect.duration()));
    }
    
    @Override
    public List<EncounterEvent> visitFlee(Effect.Flee effect) {
        Combatant combatant = ctx.get(effect.combatantId());
        if (combatant.hasFled()) {
            return List.of();
        }
        combatant.markFled();
        return List.of(new EncounterEvent.EntityFled(combatant.getId(), combatant.getSide()));
    }
}
