package com.example.skirmish;

import com.example.skirmish.ai.FirstChoiceTacticalProvider;
import com.example.skirmish.combat.ActionIntent;
import com.example.skirmish.combat.EncounterEngine;
import com.example.skirmish.combat.EncounterEvent;
import com.example.skirmish.combat.EncounterOutcome;
import com.example.skirmish.combat.MoraleState;
import com.example.skirmish.combat.MoraleTrigger;
import com.example.skirmish.combat.StepResult;
import com.example.skirmish.model.CombatSide;
import com.example.skirmish.model.Creature;
import com.example.skirmish.util.FixedDiceService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.example.skirmish.TestEncounters.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Opposition morale tests")
class MoraleTest {

    private static final String ALDRIC = "pc:Aldric";
    private static final String GOBLIN_1 = "monster:Goblin:0";
    private static final String GOBLIN_2 = "monster:Goblin:1";

    private static Creature goblin(int morale) {
        return Creature.monster("Goblin", 1).hp(1).morale(morale).build();
    }

    private static EncounterEngine twoGoblins(int morale, FixedDiceService dice) {
        return engine(List.of(fighter("Aldric", 10)), List.of(goblin(morale), goblin(morale)), dice);
    }

    // === State ===

    @ParameterizedTest(name = "morale {0} applicable={1} immune={2}")
    @CsvSource({
        "7, true, false",
        "2, true, false",
        "12, false, true"
    })
    @DisplayName("Fearless groups never check")
    void applicability(int morale, boolean applicable, boolean immune) {
        MoraleState state = new MoraleState(morale);
        assertEquals(applicable, state.isApplicable());
        assertEquals(immune, state.isImmune());
    }

    @Test
    @DisplayName("A group without morale scores never checks")
    void noMoraleScore() {
        assertFalse(new MoraleState(null).isApplicable());
    }

    @Test
    @DisplayName("Group morale is the lowest score among the opposition")
    void groupMoraleIsLowest() {
        EncounterEngine engine = engine(List.of(fighter("Aldric", 10)),
                List.of(goblin(9), goblin(6), Creature.monster("Rat", 1).hp(1).build()),
                new FixedDiceService(10));
        assertEquals(Integer.valueOf(6), engine.getContext().getMorale().getMorale());
    }

    // === Checks during an encounter ===

    @Test
    @DisplayName("Failed check on the first death routs the survivors")
    void failedCheckRouts() {
        FixedDiceService dice = new FixedDiceService(15, 5, 6, 6);
        EncounterEngine engine = twoGoblins(7, dice);
        engine.stepUntilDecision();

        StepResult result = engine.stepUntilDecision(new ActionIntent.MeleeAttack(ALDRIC, GOBLIN_1));

        List<EncounterEvent.MoraleChecked> checks = eventsOf(result.events(), EncounterEvent.MoraleChecked.class);
        assertEquals(List.of(new EncounterEvent.MoraleChecked(7, 12, false, MoraleTrigger.FIRST_DEATH, 0, false)),
                checks);
        assertEquals(List.of(new EncounterEvent.EntityFled(GOBLIN_2, CombatSide.MONSTER)),
                eventsOf(result.events(), EncounterEvent.EntityFled.class));
        assertEquals(EncounterOutcome.PARTY_VICTORY, engine.getOutcome());
        assertTrue(engine.getContext().getMorale().isBroken());
    }

    @Test
    @DisplayName("Passed check lets the survivors fight on")
    void passedCheckContinues() {
        FixedDiceService dice = new FixedDiceService(15, 5, 3, 3);
        EncounterEngine engine = twoGoblins(7, dice);
        engine.assignProvider(CombatSide.MONSTER, new FirstChoiceTacticalProvider());
        engine.stepUntilDecision();

        StepResult result = engine.stepUntilDecision(new ActionIntent.MeleeAttack(ALDRIC, GOBLIN_1));

        assertEquals(List.of(new EncounterEvent.MoraleChecked(7, 6, true, MoraleTrigger.FIRST_DEATH, 1, false)),
                eventsOf(result.events(), EncounterEvent.MoraleChecked.class));
        assertTrue(eventsOf(result.events(), EncounterEvent.EntityFled.class).isEmpty());
        assertTrue(result.events().contains(new EncounterEvent.TurnSkipped(GOBLIN_1, "dead")));
        assertTrue(result.events().contains(new EncounterEvent.DamageApplied(GOBLIN_2, ALDRIC, 5, 5)));
        assertTrue(result.needsIntent());
        assertEquals(ALDRIC, result.pendingCombatantId());
        assertEquals(2, engine.getRound());
    }

    @Test
    @DisplayName("Each trigger fires at most once")
    void triggersFireOnce() {
        FixedDiceService dice = new FixedDiceService(15, 5, 3, 3);
        EncounterEngine engine = engine(List.of(fighter("Aldric", 10)),
                List.of(goblin(7), goblin(7), goblin(7), goblin(7)), dice);
        engine.assignProvider(CombatSide.MONSTER, new FirstChoiceTacticalProvider());
        engine.stepUntilDecision();
        engine.stepUntilDecision(new ActionIntent.MeleeAttack(ALDRIC, GOBLIN_1));

        List<EncounterEvent.MoraleChecked> checks =
                eventsOf(engine.getEvents(), EncounterEvent.MoraleChecked.class);
        assertEquals(1, checks.size());
        assertEquals(MoraleTrigger.FIRST_DEATH, checks.get(0).trigger());
        assertTrue(engine.getContext().getMorale().hasFired(MoraleTrigger.FIRST_DEATH));
        assertFalse(engine.getContext().getMorale().hasFired(MoraleTrigger.HALF_INCAPACITATED));
    }

    @Test
    @DisplayName("Morale 12 never checks")
    void fearlessNeverChecks() {
        EncounterEngine engine = twoGoblins(12, new FixedDiceService(15, 5));
        engine.stepUntilDecision();

        StepResult result = engine.stepUntilDecision(new ActionIntent.MeleeAttack(ALDRIC, GOBLIN_1));

        assertTrue(eventsOf(engine.getEvents(), EncounterEvent.MoraleChecked.class).isEmpty());
        assertEquals(GOBLIN_2, result.pendingCombatantId());
    }

    @Test
    @DisplayName("Disabled morale never checks")
    void disabledNeverChecks() {
        FixedDiceService dice = new FixedDiceService(15, 5);
        EncounterEngine engine = engine(List.of(fighter("Aldric", 10)), List.of(goblin(2), goblin(2)), dice,
                config().withMoraleEnabled(false));
        engine.stepUntilDecision();
        engine.stepUntilDecision(new ActionIntent.MeleeAttack(ALDRIC, GOBLIN_1));

        assertTrue(eventsOf(engine.getEvents(), EncounterEvent.MoraleChecked.class).isEmpty());
        assertEquals(2, dice.consumed());
    }
}
