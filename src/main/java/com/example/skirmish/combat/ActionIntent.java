package com.example.skirmish.combat;

import java.util.List;

/**
 * A combatant's declared action for its turn, before validation.
 * Intents are immutable values; submitting one never changes combat state
 * until the engine has validated and executed it.
 */
public sealed interface ActionIntent
        permits ActionIntent.MeleeAttack, ActionIntent.RangedAttack, ActionIntent.CastSpell,
                ActionIntent.UseItem, ActionIntent.Flee {
    
    String actorId();
    
    <R> R accept(Visitor<R> visitor);
    
    /** Exhaustive dispatch over every intent variant. */
    interface Visitor<R> {
        R visitMeleeAttack(MeleeAttack intent);
        R visitRangedAttack(RangedAttack intent);
        R visitCastSpell(CastSpell intent);
        R visitUseItem(UseItem intent);
        R visitFlee(Flee intent);
    }
    
    record MeleeAttack(String actorId, String targetId) implements ActionIntent {
        public MeleeAttack {
            requireId(actorId, "actorId");
            requireId(targetId, "targetId");
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMeleeAttack(this);
        }
    }
    
    record RangedAttack(String actorId, String targetId) implements ActionIntent {
        public RangedAttack {
            requireId(actorId, "actorId");
            requireId(targetId, "targetId");
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRangedAttack(this);
        }
    }
    
    /**
     * @param targetIds chosen targets; for multi-target spells the candidate
     *                  pool the engine resolves from, empty for self spells
     */
    record CastSpell(String actorId, String spellId, int slotLevel, List<String> targetIds) implements ActionIntent {
        public CastSpell {
            requireId(actorId, "actorId");
            requireId(spellId, "spellId");
            targetIds = copyTargets(targetIds);
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCastSpell(this);
        }
    }
    
    record UseItem(String actorId, String itemName, List<String> targetIds) implements ActionIntent {
        public UseItem {
            requireId(actorId, "actorId");
            requireId(itemName, "itemName");
            targetIds = copyTargets(targetIds);
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUseItem(this);
        }
    }
    
    record Flee(String actorId) implements ActionIntent {
        public Flee {
            requireId(actorId, "actorId");
        }
        
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFlee(this);
        }
    }
    
    private static void requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
    
    private static List<String> copyTargets(List<String> targetIds) {
        if (targetIds == null) {
            throw new IllegalArgumentException("targetIds must not be null");
        }
        return List.copyOf(targetIds);
    }
}
