package com.example.skirmish.combat;

import com.example.skirmish.model.ModifiedStat;

/**
 * A single state change produced by executing an action.
 * Effects are the only way combat state is mutated; the engine applies
 * them in the order the action produced them.
 */
public sealed interface Effect
        permits Effect.Damage, Effect.Heal, Effect.ConsumeSlot, Effect.ConsumeItem,
                Effect.ApplyCondition, Effect.ApplyModifier, Effect.Flee {
    
    <R> R accept(Visitor<R> visitor);
    
    interface Visitor<R> {
        R visitDamage(Damage effect);
        R visitHeal(Heal effect);
        R visitConsumeSlot(ConsumeSlot effect);
        R visitConsumeItem(ConsumeItem effect);
        R visitApplyCondition(ApplyCondition effect);
        R visitApplyModifier(ApplyModifier effect);
        R visitFlee(Flee effect);
    }
    
    record Damage(String sourceId, String targetId, int amount) implements Effect {
        public Damage {
            if (amount < 0) throw new IllegalArgumentException("Damage amount must not be negative: " + amount);
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDamage(this);
        }
    }
    
    record Heal(String sourceId, String targetId, int amount) implements Effect {
        public Heal {
            if (amount < 0) throw new IllegalArgumentException("Heal amount must not be negative: " + amount);
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitHeal(this);
        }
    }
    
    record ConsumeSlot(String casterId, int level) implements Effect {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConsumeSlot(this);
        }
    }
    
    record ConsumeItem(String actorId, String itemName) implements Effect {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConsumeItem(this);
        }
    }
    
    /** A null duration lasts until removed. */
    record ApplyCondition(String sourceId, String targetId, String conditionId, Integer duration) implements Effect {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitApplyCondition(this);
        }
    }
    
    record ApplyModifier(String sourceId, String targetId, String modifierId, ModifiedStat stat,
                         int value, Integer duration) implements Effect {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitApplyModifier(this);
        }
    }
    
    record Flee(String combatantId) implements Effect {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFlee(this);
        }
    }
}
