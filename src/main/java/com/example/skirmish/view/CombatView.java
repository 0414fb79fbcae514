package com.example.skirmish.view;

import com.example.skirmish.combat.ActiveCondition;
import com.example.skirmish.combat.CombatContext;
import com.example.skirmish.combat.Combatant;
import com.example.skirmish.combat.EncounterOutcome;
import com.example.skirmish.combat.EncounterState;
import com.example.skirmish.model.CombatSide;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable point-in-time snapshot of an encounter.
 * 
 * Building a view has no side effects, and a view never shares mutable
 * state with the engine: later changes to the encounter do not show up in
 * a view already taken.
 */
public record CombatView(
    int roundNumber,
    EncounterState state,
    EncounterOutcome outcome,
    String currentCombatantId,
    List<CombatantView> combatants,
    Set<String> announcedDeaths
) {
    public CombatView {
        combatants = List.copyOf(combatants);
        // Keep announcement order
        announcedDeaths = Collections.unmodifiableSet(new LinkedHashSet<>(announcedDeaths));
    }
    
    public static CombatView of(CombatContext ctx, EncounterState state, EncounterOutcome outcome) {
        List<CombatantView> combatants = new ArrayList<>();
        for (Combatant c : ctx.getCombatants()) {
            List<String> conditions = ctx.getConditions().getAll(c.getId()).stream()
                    .map(ActiveCondition::getConditionId)
                    .collect(Collectors.toList());
            combatants.add(new CombatantView(
                    c.getId(),
                    ctx.displayName(c.getId()),
                    c.getSide(),
                    Math.max(0, c.getHp()),
                    c.getMaxHp(),
                    c.getArmorClass(),
                    ctx.getEffectiveArmorClass(c.getId()),
                    c.isAlive(),
                    c.hasFled(),
                    conditions,
                    c.getSpellSlots()));
        }
        return new CombatView(ctx.getRoundNumber(), state, outcome, ctx.getCurrentCombatantId(),
                combatants, ctx.getAnnouncedDeaths());
    }
    
    public Optional<CombatantView> find(String combatantId) {
        return combatants.stream().filter(c -> c.id().equals(combatantId)).findFirst();
    }
    
    public List<CombatantView> side(CombatSide side) {
        return combatants.stream().filter(c -> c.side() == side).collect(Collectors.toList());
    }
    
    public boolean isEnded() {
        return state == EncounterState.ENDED;
    }
}
