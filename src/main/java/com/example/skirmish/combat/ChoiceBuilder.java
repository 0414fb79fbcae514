package com.example.skirmish.combat;

import com.example.skirmish.model.TargetMode;
import com.example.skirmish.spell.ItemDefinition;
import com.example.skirmish.spell.SpellDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Enumerates the legal actions for a combatant's turn.
 * 
 * Order: melee attacks, ranged attacks, spells, items, and flee last.
 * Within each group targets follow roster order.
 */
public class ChoiceBuilder {
    
    public List<ActionChoice> build(CombatContext ctx, Combatant actor) {
        List<ActionChoice> choices = new ArrayList<>();
        List<Combatant> opponents = ctx.getActiveOpponents(actor);
        
        for (Combatant target : opponents) {
            choices.add(new ActionChoice(ActionChoice.ATTACK_TARGET,
                    args("target", ctx.displayName(target.getId())),
                    new ActionIntent.MeleeAttack(actor.getId(), target.getId())));
        }
        
        if (actor.hasRangedWeapon()) {
            for (Combatant target : opponents) {
                choices.add(new ActionChoice(ActionChoice.RANGED_ATTACK_TARGET,
                        args("target", ctx.displayName(target.getId())),
                        new ActionIntent.RangedAttack(actor.getId(), target.getId())));
            }
        }
        
        for (String spellId : actor.getKnownSpells()) {
            Optional<SpellDefinition> spell = ctx.getSpells().find(spellId);
            if (spell.isPresent() && canCast(actor, spell.get())) {
                addSpellChoices(ctx, actor, spell.get(), choices);
            }
        }
        
        for (Map.Entry<String, Integer> entry : actor.getInventory().entrySet()) {
            Optional<ItemDefinition> item = ctx.getItems().find(entry.getKey());
            if (entry.getValue() > 0 && item.isPresent()) {
                addItemChoices(ctx, actor, item.get(), choices);
            }
        }
        
        choices.add(new ActionChoice(ActionChoice.FLEE, Map.of(), new ActionIntent.Flee(actor.getId())));
        return choices;
    }
    
    private boolean canCast(Combatant actor, SpellDefinition spell) {
        return spell.isUsableBy(actor.getCharacterClass()) && actor.getSpellSlots(spell.getLevel()) > 0;
    }
    
    private void addSpellChoices(CombatContext ctx, Combatant actor, SpellDefinition spell, List<ActionChoice> choices) {
        TargetMode mode = spell.getTargetMode();
        if (mode == TargetMode.SELF) {
            choices.add(new ActionChoice(ActionChoice.CAST_SPELL, args("spell", spell.getName()),
                    new ActionIntent.CastSpell(actor.getId(), spell.getSpellId(), spell.getLevel(), List.of())));
            return;
        }
        
        List<Combatant> candidates = TargetingResolver.candidatesFor(mode, actor, ctx);
        if (candidates.isEmpty()) {
            return;
        }
        if (mode.isSingleTarget()) {
            for (Combatant target : candidates) {
                Map<String, String> uiArgs = args("spell", spell.getName());
                uiArgs.put("target", ctx.displayName(target.getId()));
                choices.add(new ActionChoice(ActionChoice.CAST_SPELL, uiArgs,
                        new ActionIntent.CastSpell(actor.getId(), spell.getSpellId(), spell.getLevel(),
                                List.of(target.getId()))));
            }
        } else {
            List<String> ids = candidates.stream().map(Combatant::getId).collect(Collectors.toList());
            choices.add(new ActionChoice(ActionChoice.CAST_SPELL, args("spell", spell.getName()),
                    new ActionIntent.CastSpell(actor.getId(), spell.getSpellId(), spell.getLevel(), ids)));
        }
    }
    
    private void addItemChoices(CombatContext ctx, Combatant actor, ItemDefinition item, List<ActionChoice> choices) {
        if (item.isThrowable()) {
            for (Combatant target : ctx.getActiveOpponents(actor)) {
                Map<String, String> uiArgs = args("item", item.name());
                uiArgs.put("target", ctx.displayName(target.getId()));
                choices.add(new ActionChoice(ActionChoice.USE_ITEM, uiArgs,
                        new ActionIntent.UseItem(actor.getId(), item.name(), List.of(target.getId()))));
            }
        } else {
            choices.add(new ActionChoice(ActionChoice.USE_ITEM, args("item", item.name()),
                    new ActionIntent.UseItem(actor.getId(), item.name(), List.of())));
        }
    }
    
    private static Map<String, String> args(String key, String value) {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(key, value);
        return map;
    }
}
