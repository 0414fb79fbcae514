package com.example.skirmish.combat;

import com.example.skirmish.model.Creature;
import com.example.skirmish.model.ModifiedStat;
import com.example.skirmish.util.FixedDiceService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.example.skirmish.TestEncounters.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CombatCalculator to-hit, damage and saving throw arithmetic.
 */
public class CombatCalculatorTest {

    private final CombatCalculator calculator = new CombatCalculator(1.5);

    private static CombatContext contextWithDice(int... values) {
        EncounterEngine engine = engine(List.of(fighter("Aldric", 10)),
                List.of(Creature.monster("Orc", 1).hp(8).build()), new FixedDiceService(values));
        return engine.getContext();
    }

    // === To-hit Tests ===

    @Test
    void testNeededToHit() {
        // THAC0 19 against AC 9 needs 10
        assertEquals(10, calculator.neededToHit(19, 9));
        assertEquals(14, calculator.neededToHit(19, 5));
        // Negative armor class raises the target
        assertEquals(21, calculator.neededToHit(19, -2));
    }

    @ParameterizedTest(name = "natural {0}, total {1} vs {2} -> {3}")
    @CsvSource({
        "20, 20, 30, true",
        "1, 25, 5, false",
        "10, 10, 10, true",
        "10, 9, 10, false",
        "2, 14, 14, true"
    })
    void testIsHit(int natural, int total, int needed, boolean expected) {
        assertEquals(expected, calculator.isHit(natural, total, needed));
    }

    @Test
    void testOnlyNatural20IsCritical() {
        assertTrue(calculator.isCritical(20));
        assertFalse(calculator.isCritical(19));
    }

    // === Damage Tests ===

    @Test
    void testCriticalDamageRoundsUp() {
        assertEquals(8, calculator.criticalDamage(5));   // 7.5
        assertEquals(6, calculator.criticalDamage(4));
        assertEquals(2, calculator.criticalDamage(1));   // 1.5
        assertEquals(10, new CombatCalculator(2.0).criticalDamage(5));
    }

    @Test
    void testDamageNeverBelowOne() {
        CombatContext ctx = contextWithDice(1);
        Combatant aldric = ctx.get("pc:Aldric");
        ctx.getModifiers().add("pc:Aldric", ActiveModifier.permanent("weak", null, ModifiedStat.DAMAGE, -10));

        assertEquals(1, ctx.getCalculator().rollDamage(ctx, aldric, "1d6", false));
    }

    @Test
    void testCriticalDamageAppliesAfterModifiers() {
        CombatContext ctx = contextWithDice(4);
        Combatant aldric = ctx.get("pc:Aldric");
        ctx.getModifiers().add("pc:Aldric", ActiveModifier.permanent("strong", null, ModifiedStat.DAMAGE, 1));

        // (4 + 1) * 1.5 = 7.5, rounded up
        assertEquals(8, ctx.getCalculator().rollDamage(ctx, aldric, "1d6", true));
    }

    // === Attack roll Tests ===

    @Test
    void testAttackRollUsesModifiersAndArmor() {
        CombatContext ctx = contextWithDice(12);
        Combatant aldric = ctx.get("pc:Aldric");
        Combatant orc = ctx.get("monster:Orc:0");
        ctx.getModifiers().add("monster:Orc:0", ActiveModifier.permanent("shield_ac", null, ModifiedStat.ARMOR_CLASS, -2));

        CombatCalculator.AttackRoll roll = ctx.getCalculator().rollAttack(ctx, aldric, orc);
        assertEquals(new CombatCalculator.AttackRoll(12, 12, 12, true, false), roll);

        ctx.getModifiers().add("pc:Aldric", new ActiveModifier("bless_atk", null, ModifiedStat.ATTACK, 1, 6));
        assertEquals(13, ctx.getCalculator().rollAttack(ctx, aldric, orc).total());
    }

    @Test
    void testBlindedAttackerPenalty() {
        CombatContext ctx = contextWithDice(12);
        Combatant aldric = ctx.get("pc:Aldric");
        ctx.getConditions().add("pc:Aldric", new ActiveCondition(ConditionType.BLINDED, "monster:Orc:0", 12));

        CombatCalculator.AttackRoll roll = ctx.getCalculator().rollAttack(ctx, aldric, ctx.get("monster:Orc:0"));
        assertEquals(8, roll.total());
        assertFalse(roll.hit());
    }

    @Test
    void testNatural20AlwaysHitsNatural1AlwaysMisses() {
        CombatContext ctx = contextWithDice(20, 1);
        Combatant aldric = ctx.get("pc:Aldric");
        Combatant orc = ctx.get("monster:Orc:0");
        ctx.getModifiers().add("monster:Orc:0", ActiveModifier.permanent("plate", null, ModifiedStat.ARMOR_CLASS, -20));

        CombatCalculator.AttackRoll twenty = ctx.getCalculator().rollAttack(ctx, aldric, orc);
        assertEquals(30, twenty.needed());
        assertTrue(twenty.hit());
        assertTrue(twenty.critical());

        ctx.getModifiers().add("pc:Aldric", ActiveModifier.permanent("luck", null, ModifiedStat.ATTACK, 50));
        CombatCalculator.AttackRoll one = ctx.getCalculator().rollAttack(ctx, aldric, orc);
        assertFalse(one.hit());
    }

    // === Saving throw Tests ===

    @Test
    void testSavingThrow() {
        CombatContext ctx = contextWithDice(15, 15);
        Combatant orc = ctx.get("monster:Orc:0");

        assertEquals(new CombatCalculator.SaveRoll(15, 15, 16, false), ctx.getCalculator().rollSave(ctx, orc));

        ctx.getModifiers().add("monster:Orc:0", ActiveModifier.permanent("bless_save", null, ModifiedStat.SAVING_THROW, 1));
        assertEquals(new CombatCalculator.SaveRoll(15, 16, 16, true), ctx.getCalculator().rollSave(ctx, orc));
    }
}
