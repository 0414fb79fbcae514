package com.example.skirmish.combat;

import com.example.skirmish.model.ModifiedStat;

/**
 * Attack, damage and saving throw arithmetic.
 * 
 * To-hit: the attacker needs {@code thac0 - defenderAC} or better, where the
 * defender's armor class includes ARMOR_CLASS modifiers. The attack total is
 * d20 + attack bonus + ATTACK modifiers + condition penalties.
 * A natural 20 always hits and is critical; a natural 1 always misses.
 * 
 * Damage: damage die + DAMAGE modifiers, at least 1 on a hit, multiplied and
 * rounded up on a critical.
 */
public class CombatCalculator {
    
    /** Natural roll that always hits and scores a critical */
    public static final int CRIT_THRESHOLD = 20;
    
    /** Natural roll that always misses */
    public static final int FUMBLE_THRESHOLD = 1;
    
    /** Result of one attack roll. */
    public record AttackRoll(int roll, int total, int needed, boolean hit, boolean critical) {}
    
    /** Result of one saving throw. */
    public record SaveRoll(int roll, int total, int targetNumber, boolean success) {}
    
    private final double criticalMultiplier;
    
    public CombatCalculator(double criticalMultiplier) {
        this.criticalMultiplier = criticalMultiplier;
    }
    
    /**
     * Roll needed on the attack total to hit the given armor class.
     */
    public int neededToHit(int thac0, int armorClass) {
        return thac0 - armorClass;
    }
    
    public boolean isHit(int naturalRoll, int total, int needed) {
        if (naturalRoll >= CRIT_THRESHOLD) return true;
        if (naturalRoll <= FUMBLE_THRESHOLD) return false;
        return total >= needed;
    }
    
    public boolean isCritical(int naturalRoll) {
        return naturalRoll >= CRIT_THRESHOLD;
    }
    
    /**
     * Apply the critical multiplier, rounding up.
     */
    public int criticalDamage(int damage) {
        return (int) Math.ceil(damage * criticalMultiplier);
    }
    
    /**
     * Roll an attack from one combatant against another, consuming one d20.
     */
    public AttackRoll rollAttack(CombatContext ctx, Combatant attacker, Combatant defender) {
        int needed = neededToHit(attacker.getThac0(), ctx.getEffectiveArmorClass(defender.getId()));
        int roll = ctx.getDice().d20();
        int total = roll
                + attacker.getAttackBonus()
                + ctx.getModifiers().getTotal(attacker.getId(), ModifiedStat.ATTACK)
                + ctx.getConditions().attackPenalty(attacker.getId());
        return new AttackRoll(roll, total, needed, isHit(roll, total, needed), isCritical(roll));
    }
    
    /**
     * Roll damage for a successful hit.
     */
    public int rollDamage(CombatContext ctx, Combatant attacker, String damageDie, boolean critical) {
        int damage = ctx.getDice().roll(damageDie)
                + ctx.getModifiers().getTotal(attacker.getId(), ModifiedStat.DAMAGE);
        damage = Math.max(1, damage);
        return critical ? criticalDamage(damage) : damage;
    }
    
    /**
     * Roll a saving throw: d20 + SAVING_THROW modifiers against the target's save number.
     */
    public SaveRoll rollSave(CombatContext ctx, Combatant target) {
        int roll = ctx.getDice().d20();
        int total = roll + ctx.getModifiers().getTotal(target.getId(), ModifiedStat.SAVING_THROW);
        return new SaveRoll(roll, total, target.getSaveTarget(), total >= target.getSaveTarget());
    }
}
