package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CombatCalculator;
import com.example.skirmish.combat.CombatContext;
import com.example.skirmish.combat.Combatant;
import com.example.skirmish.combat.Effect;
import com.example.skirmish.combat.EncounterEvent;
import com.example.skirmish.combat.Rejection;
import com.example.skirmish.combat.RejectionCode;
import com.example.skirmish.combat.TargetingResolver;
import com.example.skirmish.model.SaveType;
import com.example.skirmish.model.TargetMode;
import com.example.skirmish.spell.SpellDefinition;
import com.example.skirmish.spell.SpellModifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Cast a spell from a slot of the matching level.
 * 
 * For single-target modes the intent names the target. For group and
 * area modes the intent's targets (or, when empty, every eligible
 * combatant) form the candidate pool that the spell resolves from.
 */
public class CastSpellAction extends AbstractCombatAction {
    
    private final String spellId;
    private final int slotLevel;
    private final List<String> targetIds;
    
    public CastSpellAction(String actorId, String spellId, int slotLevel, List<String> targetIds) {
        super(actorId);
        this.spellId = spellId;
        this.slotLevel = slotLevel;
        this.targetIds = List.copyOf(targetIds);
    }
    
    @Override
    public List<Rejection> validate(CombatContext ctx) {
        List<Rejection> rejections = new ArrayList<>();
        Optional<Combatant> maybeCaster = validateActor(ctx, rejections);
        if (maybeCaster.isEmpty()) {
            return rejections;
        }
        Combatant caster = maybeCaster.get();
        
        Optional<SpellDefinition> maybeSpell = ctx.getSpells().find(spellId);
        if (maybeSpell.isEmpty()) {
            rejections.add(new Rejection(RejectionCode.UNKNOWN_SPELL, "Unknown spell: " + spellId));
            return rejections;
        }
        SpellDefinition spell = maybeSpell.get();
        
        if (!caster.knowsSpell(spell.getSpellId())) {
            rejections.add(new Rejection(RejectionCode.SPELL_NOT_KNOWN, caster.getName() + " does not know " + spell.getName()));
        }
        if (!spell.isUsableBy(caster.getCharacterClass())) {
            rejections.add(new Rejection(RejectionCode.INELIGIBLE_CASTER,
                    spell.getName() + " cannot be cast by a " + caster.getCharacterClass().getDisplayName()));
        }
        if (slotLevel != spell.getLevel()) {
            rejections.add(new Rejection(RejectionCode.SLOT_LEVEL_MISMATCH,
                    spell.getName() + " needs a level " + spell.getLevel() + " slot, not level " + slotLevel));
        } else if (caster.getSpellSlots(slotLevel) <= 0) {
            rejections.add(new Rejection(RejectionCode.NO_SPELL_SLOT, "No level " + slotLevel + " slots remaining"));
        }
        validateTargets(ctx, caster, spell.getTargetMode(), rejections);
        return rejections;
    }
    
    private void validateTargets(CombatContext ctx, Combatant caster, TargetMode mode, List<Rejection> rejections) {
        if (!validateDistinct(targetIds, rejections)) {
            return;
        }
        switch (mode) {
            case SELF:
                if (!targetIds.isEmpty() && !(targetIds.size() == 1 && targetIds.get(0).equals(actorId))) {
                    rejections.add(new Rejection(RejectionCode.INVALID_TARGET, "This spell can only target the caster"));
                }
                break;
            case SINGLE_ENEMY:
            case SINGLE_ALLY:
                if (targetIds.size() != 1) {
                    rejections.add(new Rejection(RejectionCode.INVALID_TARGET, "Exactly one target is required"));
                } else if (mode == TargetMode.SINGLE_ENEMY) {
                    validateOpponent(ctx, caster, targetIds.get(0), rejections);
                } else {
                    validateAlly(ctx, caster, targetIds.get(0), rejections);
                }
                break;
            case ALL_ALLIES:
                for (String id : targetIds) {
                    validateAlly(ctx, caster, id, rejections);
                }
                break;
            default:
                for (String id : targetIds) {
                    validateOpponent(ctx, caster, id, rejections);
                }
                break;
        }
    }
    
    @Override
    public ActionResult execute(CombatContext ctx) {
        Combatant caster = ctx.get(actorId);
        SpellDefinition spell = ctx.getSpells().get(spellId);
        CombatCalculator calc = ctx.getCalculator();
        
        List<EncounterEvent> events = new ArrayList<>();
        List<Effect> effects = new ArrayList<>();
        
        List<Combatant> targets = resolveTargets(ctx, caster, spell, events);
        events.add(new EncounterEvent.SpellCast(actorId, spell.getSpellId(), spell.getName(),
                targets.stream().map(Combatant::getId).collect(Collectors.toList())));
        effects.add(new Effect.ConsumeSlot(actorId, slotLevel));
        
        for (Combatant target : targets) {
            boolean hostile = ctx.areOpponents(caster, target);
            
            if (hostile && !spell.isAutoHit()) {
                CombatCalculator.AttackRoll attack = calc.rollAttack(ctx, caster, target);
                events.add(new EncounterEvent.AttackRolled(actorId, target.getId(),
                        attack.roll(), attack.total(), attack.needed(), attack.hit(), attack.critical()));
                if (!attack.hit()) {
                    continue;
                }
            }
            
            boolean saved = false;
            if (hostile && spell.getSave() != SaveType.NONE) {
                CombatCalculator.SaveRoll save = calc.rollSave(ctx, target);
                events.add(new EncounterEvent.SavingThrowRolled(target.getId(), spell.getName(),
                        save.roll(), save.total(), save.targetNumber(), save.success()));
                saved = save.success();
                if (saved && spell.getSave() == SaveType.NEGATES) {
                    continue;
                }
            }
            
            if (spell.dealsDamage()) {
                int damage = Math.max(0, ctx.getDice().roll(spell.getDamageDie()));
                if (saved) {
                    damage = damage / 2;
                }
                effects.add(new Effect.Damage(actorId, target.getId(), damage));
            }
            if (spell.heals()) {
                effects.add(new Effect.Heal(actorId, target.getId(), Math.max(0, ctx.getDice().roll(spell.getHealDie()))));
            }
            if (spell.getConditionId() != null) {
                effects.add(new Effect.ApplyCondition(actorId, target.getId(),
                        spell.getConditionId(), spell.getConditionDuration()));
            }
            for (SpellModifier mod : spell.getModifiers()) {
                effects.add(new Effect.ApplyModifier(actorId, target.getId(),
                        mod.modifierId(), mod.stat(), mod.value(), mod.duration()));
            }
        }
        return new ActionResult(events, effects);
    }
    
    private List<Combatant> resolveTargets(CombatContext ctx, Combatant caster, SpellDefinition spell,
                                           List<EncounterEvent> events) {
        TargetMode mode = spell.getTargetMode();
        if (mode == TargetMode.SELF) {
            return List.of(caster);
        }
        if (mode.isSingleTarget()) {
            return List.of(ctx.get(targetIds.get(0)));
        }
        
        List<Combatant> pool = targetIds.isEmpty()
                ? TargetingResolver.candidatesFor(mode, caster, ctx)
                : targetIds.stream().map(ctx::get).collect(Collectors.toList());
        
        if (mode == TargetMode.HD_POOL) {
            int poolRoll = ctx.getDice().roll(spell.getPoolDice());
            List<String> ids = TargetingResolver.resolveHdPool(TargetingResolver.toHdCandidates(pool), poolRoll);
            events.add(new EncounterEvent.GroupTargetsResolved(spell.getName(), poolRoll, ids));
            return ids.stream().map(ctx::get).collect(Collectors.toList());
        }
        if (mode == TargetMode.ENEMY_GROUP) {
            int count = ctx.getDice().roll(spell.getGroupDice());
            List<String> candidateIds = pool.stream().map(Combatant::getId).collect(Collectors.toList());
            List<String> ids = TargetingResolver.resolveRandomGroup(candidateIds, count, ctx.getDice());
            events.add(new EncounterEvent.GroupTargetsResolved(spell.getName(), null, ids));
            return ids.stream().map(ctx::get).collect(Collectors.toList());
        }
        return pool;
    }
}
