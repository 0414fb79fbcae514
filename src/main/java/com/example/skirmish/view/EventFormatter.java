package com.example.skirmish.view;

import com.example.skirmish.combat.ActionChoice;
import com.example.skirmish.combat.EncounterEvent;
import com.example.skirmish.combat.EncounterEvent.*;
import com.example.skirmish.combat.Rejection;
import com.example.skirmish.model.CombatSide;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders events as human-readable combat log lines.
 */
public class EventFormatter implements EncounterEvent.Visitor<String> {
    
    private final Function<String, String> nameLookup;
    
    /** Derives names from combatant ids ("pc:Aldric" is Aldric, "monster:Goblin:0" is Goblin #1). */
    public EventFormatter() {
        this(EventFormatter::nameFromId);
    }
    
    /** Uses the display names of a snapshot, falling back to the id. */
    public EventFormatter(CombatView view) {
        this(namesOf(view));
    }
    
    public EventFormatter(Function<String, String> names) {
        this.nameLookup = names;
    }
    
    private static Function<String, String> namesOf(CombatView view) {
        Map<String, String> byId = new HashMap<>();
        for (CombatantView c : view.combatants()) {
            byId.put(c.id(), c.name());
        }
        return id -> byId.getOrDefault(id, nameFromId(id));
    }
    
    static String nameFromId(String id) {
        if (id == null) return "someone";
        String[] parts = id.split(":");
        if (parts.length == 3 && "monster".equals(parts[0])) {
            try {
                return parts[1] + " #" + (Integer.parseInt(parts[2]) + 1);
            } catch (NumberFormatException e) {
                return parts[1];
            }
        }
        if (parts.length == 2) {
            return parts[1];
        }
        return id;
    }
    
    public String format(EncounterEvent event) {
        return event.accept(this);
    }
    
    public List<String> formatAll(List<EncounterEvent> events) {
        return events.stream().map(this::format).collect(Collectors.toList());
    }
    
    private String name(String id) {
        return nameLookup.apply(id);
    }
    
    private String names(List<String> ids) {
        return ids.stream().map(this::name).collect(Collectors.joining(", "));
    }
    
    @Override
    public String visitEncounterStarted(EncounterStarted event) {
        return "Combat begins!";
    }
    
    @Override
    public String visitRoundStarted(RoundStarted event) {
        return "Round " + event.round() + " begins.";
    }
    
    @Override
    public String visitInitiativeRolled(InitiativeRolled event) {
        return "Initiative: " + event.order().stream()
                .map(e -> name(e.combatantId()) + " " + e.roll())
                .collect(Collectors.joining(", ")) + ".";
    }
    
    @Override
    public String visitTurnQueueBuilt(TurnQueueBuilt event) {
        return "Turn order: " + names(event.queue()) + ".";
    }
    
    @Override
    public String visitTurnStarted(TurnStarted event) {
        return "It is " + name(event.combatantId()) + "'s turn.";
    }
    
    @Override
    public String visitTurnSkipped(TurnSkipped event) {
        return name(event.combatantId()) + "'s turn is skipped (" + event.reason() + ").";
    }
    
    @Override
    public String visitNeedAction(NeedAction event) {
        return name(event.combatantId()) + " must choose: "
                + event.choices().stream().map(ActionChoice::label).collect(Collectors.joining(", ")) + ".";
    }
    
    @Override
    public String visitActionRejected(ActionRejected event) {
        return name(event.combatantId()) + "'s action was rejected: "
                + event.reasons().stream().map(Rejection::message).collect(Collectors.joining("; ")) + ".";
    }
    
    @Override
    public String visitAttackRolled(AttackRolled event) {
        String result = event.critical() ? "critical hit!" : event.hit() ? "hit." : "miss.";
        return name(event.attackerId()) + " attacks " + name(event.defenderId()) + ": rolled " + event.roll()
                + " (" + event.total() + " vs " + event.needed() + "), " + result;
    }
    
    @Override
    public String visitDamageApplied(DamageApplied event) {
        return name(event.targetId()) + " takes " + event.amount() + " damage ("
                + Math.max(0, event.hpAfter()) + " HP left).";
    }
    
    @Override
    public String visitHealingApplied(HealingApplied event) {
        return name(event.targetId()) + " recovers " + event.amount() + " hit points (" + event.hpAfter() + " HP).";
    }
    
    @Override
    public String visitSpellCast(SpellCast event) {
        if (event.targetIds().isEmpty()) {
            return name(event.casterId()) + " casts " + event.spellName() + ".";
        }
        return name(event.casterId()) + " casts " + event.spellName() + " at " + names(event.targetIds()) + ".";
    }
    
    @Override
    public String visitSpellSlotConsumed(SpellSlotConsumed event) {
        return name(event.casterId()) + " has " + event.remaining() + " level " + event.level() + " slot(s) left.";
    }
    
    @Override
    public String visitSavingThrowRolled(SavingThrowRolled event) {
        return name(event.targetId()) + (event.success() ? " saves against " : " fails to save against ")
                + event.spellName() + " (" + event.total() + " vs " + event.targetNumber() + ").";
    }
    
    @Override
    public String visitGroupTargetsResolved(GroupTargetsResolved event) {
        String pool = event.poolRoll() != null ? " (" + event.poolRoll() + " hit dice)" : "";
        if (event.targetIds().isEmpty()) {
            return event.spellName() + pool + " affects no one.";
        }
        return event.spellName() + pool + " affects " + names(event.targetIds()) + ".";
    }
    
    @Override
    public String visitConditionApplied(ConditionApplied event) {
        return name(event.targetId()) + " is " + event.conditionId() + ".";
    }
    
    @Override
    public String visitConditionExpired(ConditionExpired event) {
        return name(event.combatantId()) + " is no longer " + event.conditionId() + ".";
    }
    
    @Override
    public String visitModifierApplied(ModifierApplied event) {
        String sign = event.value() >= 0 ? "+" : "";
        return name(event.targetId()) + " gains " + event.modifierId() + " (" + event.stat() + " " + sign + event.value() + ").";
    }
    
    @Override
    public String visitModifierExpired(ModifierExpired event) {
        return event.modifierId() + " on " + name(event.combatantId()) + " wears off.";
    }
    
    @Override
    public String visitItemUsed(ItemUsed event) {
        if (event.targetIds().isEmpty() || event.targetIds().equals(List.of(event.actorId()))) {
            return name(event.actorId()) + " uses " + event.itemName() + ".";
        }
        return name(event.actorId()) + " throws " + event.itemName() + " at " + names(event.targetIds()) + ".";
    }
    
    @Override
    public String visitItemConsumed(ItemConsumed event) {
        return name(event.actorId()) + " has " + event.remaining() + " " + event.itemName() + " left.";
    }
    
    @Override
    public String visitMoraleChecked(MoraleChecked event) {
        if (event.passed()) {
            return "The opposition holds its nerve (" + event.roll() + " vs morale " + event.morale() + ").";
        }
        return "The opposition's morale breaks (" + event.roll() + " vs morale " + event.morale() + ")!";
    }
    
    @Override
    public String visitEntityDied(EntityDied event) {
        return name(event.combatantId()) + " falls!";
    }
    
    @Override
    public String visitEntityFled(EntityFled event) {
        return event.side() == CombatSide.PARTY
                ? name(event.combatantId()) + " flees the battle!"
                : name(event.combatantId()) + " flees!";
    }
    
    @Override
    public String visitVictoryDetermined(VictoryDetermined event) {
        switch (event.outcome()) {
            case PARTY_VICTORY:
                return "The party is victorious!";
            case OPPOSITION_VICTORY:
                return "The party has been defeated.";
            default:
                return "The encounter was aborted.";
        }
    }
    
    @Override
    public String visitEncounterFaulted(EncounterFaulted event) {
        return "Encounter aborted during " + event.state().getDisplayName() + ": "
                + event.errorType() + " - " + event.message();
    }
}
