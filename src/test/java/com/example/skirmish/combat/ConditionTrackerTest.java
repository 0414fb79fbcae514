package com.example.skirmish.combat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Condition tracker tests")
class ConditionTrackerTest {

    private final ConditionTracker tracker = new ConditionTracker();

    @Test
    @DisplayName("Held and asleep skip turns; blinded does not")
    void turnSkipping() {
        tracker.add("monster:Orc:0", new ActiveCondition(ConditionType.BLINDED, "pc:Brina", 12));
        assertEquals(Optional.empty(), tracker.turnSkippingCondition("monster:Orc:0"));
        assertEquals(-4, tracker.attackPenalty("monster:Orc:0"));

        tracker.add("monster:Orc:0", new ActiveCondition(ConditionType.HELD, "pc:Brina", 9));
        assertEquals(Optional.of(ConditionType.HELD), tracker.turnSkippingCondition("monster:Orc:0"));
    }

    @Test
    @DisplayName("Damage breaks sleep but not hold")
    void damageBreaksSleep() {
        tracker.add("monster:Orc:0", new ActiveCondition(ConditionType.ASLEEP, "pc:Mage", null));
        tracker.add("monster:Orc:0", new ActiveCondition(ConditionType.HELD, "pc:Brina", 9));

        assertEquals(List.of("asleep"), tracker.removeBrokenByDamage("monster:Orc:0"));
        assertFalse(tracker.has("monster:Orc:0", ConditionType.ASLEEP));
        assertTrue(tracker.has("monster:Orc:0", ConditionType.HELD));
    }

    @Test
    @DisplayName("Reapplying a condition replaces its duration")
    void reapplyReplaces() {
        tracker.add("pc:Aldric", new ActiveCondition(ConditionType.HELD, "monster:Ghoul:0", 1));
        tracker.add("pc:Aldric", new ActiveCondition(ConditionType.HELD, "monster:Ghoul:0", 3));

        assertEquals(1, tracker.getAll("pc:Aldric").size());
        assertTrue(tracker.tickRound().isEmpty());
        assertTrue(tracker.tickRound().isEmpty());
        assertEquals(List.of(new ConditionTracker.Expired("pc:Aldric", "held")), tracker.tickRound());
    }

    @Test
    @DisplayName("Conditions without duration last until removed")
    void indefiniteConditions() {
        tracker.add("pc:Aldric", new ActiveCondition(ConditionType.ASLEEP, "monster:Harpy:0", null));
        for (int i = 0; i < 20; i++) {
            assertTrue(tracker.tickRound().isEmpty());
        }
        assertTrue(tracker.remove("pc:Aldric", ConditionType.ASLEEP));
        assertFalse(tracker.remove("pc:Aldric", ConditionType.ASLEEP));
    }

    @Test
    void testFromIdIsCaseInsensitive() {
        assertEquals(Optional.of(ConditionType.ASLEEP), ConditionType.fromId("Asleep"));
        assertEquals(Optional.empty(), ConditionType.fromId("petrified"));
        assertEquals(Optional.empty(), ConditionType.fromId(null));
    }
}
