package com.example.skirmish.combat;

import com.example.skirmish.model.CombatSide;
import com.example.skirmish.model.ModifiedStat;

import java.util.List;

/**
 * Everything observable that happens during an encounter.
 * 
 * Events are immutable and appended to the encounter's log in the order they
 * occur; a consumer that replays the log sees the whole encounter.
 */
public sealed interface EncounterEvent
        permits EncounterEvent.EncounterStarted, EncounterEvent.RoundStarted, EncounterEvent.InitiativeRolled,
                EncounterEvent.TurnQueueBuilt, EncounterEvent.TurnStarted, EncounterEvent.TurnSkipped,
                EncounterEvent.NeedAction, EncounterEvent.ActionRejected, EncounterEvent.AttackRolled,
                EncounterEvent.DamageApplied, EncounterEvent.HealingApplied, EncounterEvent.SpellCast,
                EncounterEvent.SpellSlotConsumed, EncounterEvent.SavingThrowRolled,
                EncounterEvent.GroupTargetsResolved, EncounterEvent.ConditionApplied,
                EncounterEvent.ConditionExpired, EncounterEvent.ModifierApplied, EncounterEvent.ModifierExpired,
                EncounterEvent.ItemUsed, EncounterEvent.ItemConsumed, EncounterEvent.MoraleChecked,
                EncounterEvent.EntityDied, EncounterEvent.EntityFled, EncounterEvent.VictoryDetermined,
                EncounterEvent.EncounterFaulted {
    
    <R> R accept(Visitor<R> visitor);
    
    interface Visitor<R> {
        R visitEncounterStarted(EncounterStarted event);
        R visitRoundStarted(RoundStarted event);
        R visitInitiativeRolled(InitiativeRolled event);
        R visitTurnQueueBuilt(TurnQueueBuilt event);
        R visitTurnStarted(TurnStarted event);
        R visitTurnSkipped(TurnSkipped event);
        R visitNeedAction(NeedAction event);
        R visitActionRejected(ActionRejected event);
        R visitAttackRolled(AttackRolled event);
        R visitDamageApplied(DamageApplied event);
        R visitHealingApplied(HealingApplied event);
        R visitSpellCast(SpellCast event);
        R visitSpellSlotConsumed(SpellSlotConsumed event);
        R visitSavingThrowRolled(SavingThrowRolled event);
        R visitGroupTargetsResolved(GroupTargetsResolved event);
        R visitConditionApplied(ConditionApplied event);
        R visitConditionExpired(ConditionExpired event);
        R visitModifierApplied(ModifierApplied event);
        R visitModifierExpired(ModifierExpired event);
        R visitItemUsed(ItemUsed event);
        R visitItemConsumed(ItemConsumed event);
        R visitMoraleChecked(MoraleChecked event);
        R visitEntityDied(EntityDied event);
        R visitEntityFled(EntityFled event);
        R visitVictoryDetermined(VictoryDetermined event);
        R visitEncounterFaulted(EncounterFaulted event);
    }
    
    // Encounter lifecycle
    
    record EncounterStarted(String encounterId, List<String> combatantIds) implements EncounterEvent {
        public EncounterStarted {
            combatantIds = List.copyOf(combatantIds);
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitEncounterStarted(this); }
    }
    
    record RoundStarted(int round) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitRoundStarted(this); }
    }
    
    record InitiativeRolled(List<InitiativeEntry> order) implements EncounterEvent {
        public InitiativeRolled {
            order = List.copyOf(order);
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitInitiativeRolled(this); }
    }
    
    record TurnQueueBuilt(List<String> queue) implements EncounterEvent {
        public TurnQueueBuilt {
            queue = List.copyOf(queue);
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitTurnQueueBuilt(this); }
    }
    
    record TurnStarted(String combatantId, int round) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitTurnStarted(this); }
    }
    
    /** reason is "dead", "fled" or the id of a turn-skipping condition. */
    record TurnSkipped(String combatantId, String reason) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitTurnSkipped(this); }
    }
    
    record VictoryDetermined(EncounterOutcome outcome) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitVictoryDetermined(this); }
    }
    
    record EncounterFaulted(EncounterState state, String errorType, String message) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitEncounterFaulted(this); }
    }
    
    // Intent handling
    
    record NeedAction(String combatantId, List<ActionChoice> choices) implements EncounterEvent {
        public NeedAction {
            choices = List.copyOf(choices);
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitNeedAction(this); }
    }
    
    record ActionRejected(String combatantId, List<Rejection> reasons) implements EncounterEvent {
        public ActionRejected {
            reasons = List.copyOf(reasons);
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitActionRejected(this); }
    }
    
    // Action resolution
    
    record AttackRolled(String attackerId, String defenderId, int roll, int total, int needed,
                        boolean hit, boolean critical) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitAttackRolled(this); }
    }
    
    record SpellCast(String casterId, String spellId, String spellName, List<String> targetIds) implements EncounterEvent {
        public SpellCast {
            targetIds = List.copyOf(targetIds);
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSpellCast(this); }
    }
    
    record SavingThrowRolled(String targetId, String spellName, int roll, int total, int targetNumber,
                             boolean success) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSavingThrowRolled(this); }
    }
    
    /** poolRoll is null for random groups, which roll a group size instead. */
    record GroupTargetsResolved(String spellName, Integer poolRoll, List<String> targetIds) implements EncounterEvent {
        public GroupTargetsResolved {
            targetIds = List.copyOf(targetIds);
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitGroupTargetsResolved(this); }
    }
    
    record ItemUsed(String actorId, String itemName, List<String> targetIds) implements EncounterEvent {
        public ItemUsed {
            targetIds = List.copyOf(targetIds);
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitItemUsed(this); }
    }
    
    // Effect application
    
    record DamageApplied(String sourceId, String targetId, int amount, int hpAfter) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitDamageApplied(this); }
    }
    
    record HealingApplied(String sourceId, String targetId, int amount, int hpAfter) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitHealingApplied(this); }
    }
    
    record SpellSlotConsumed(String casterId, int level, int remaining) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSpellSlotConsumed(this); }
    }
    
    record ItemConsumed(String actorId, String itemName, int remaining) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitItemConsumed(this); }
    }
    
    record ConditionApplied(String sourceId, String targetId, String conditionId, Integer duration) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitConditionApplied(this); }
    }
    
    /** reason is "duration" or "damage". */
    record ConditionExpired(String combatantId, String conditionId, String reason) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitConditionExpired(this); }
    }
    
    record ModifierApplied(String sourceId, String targetId, String modifierId, ModifiedStat stat, int value,
                           Integer duration) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitModifierApplied(this); }
    }
    
    record ModifierExpired(String combatantId, String modifierId) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitModifierExpired(this); }
    }
    
    // Checks
    
    record MoraleChecked(int morale, int roll, boolean passed, MoraleTrigger trigger, int checksPassed,
                         boolean immune) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitMoraleChecked(this); }
    }
    
    record EntityDied(String combatantId) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitEntityDied(this); }
    }
    
    record EntityFled(String combatantId, CombatSide side) implements EncounterEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitEntityFled(this); }
    }
}
