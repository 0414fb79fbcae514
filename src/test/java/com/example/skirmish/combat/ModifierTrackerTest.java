package com.example.skirmish.combat;

import com.example.skirmish.model.ModifiedStat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Modifier tracker tests")
class ModifierTrackerTest {

    private final ModifierTracker tracker = new ModifierTracker();

    @Test
    @DisplayName("Total is zero for a combatant with no modifiers")
    void totalZeroWhenEmpty() {
        assertEquals(0, tracker.getTotal("pc:Aldric", ModifiedStat.ATTACK));
        assertTrue(tracker.getAll("pc:Aldric").isEmpty());
    }

    @Test
    @DisplayName("Modifiers with the same id stack and only matching stats count")
    void stackingAndStatFiltering() {
        tracker.add("pc:Aldric", new ActiveModifier("bless_atk", "pc:Brina", ModifiedStat.ATTACK, 1, 6));
        tracker.add("pc:Aldric", new ActiveModifier("bless_atk", "pc:Brina", ModifiedStat.ATTACK, 1, 6));
        tracker.add("pc:Aldric", new ActiveModifier("shield_ac", "pc:Aldric", ModifiedStat.ARMOR_CLASS, -2, 12));

        assertEquals(2, tracker.getTotal("pc:Aldric", ModifiedStat.ATTACK));
        assertEquals(-2, tracker.getTotal("pc:Aldric", ModifiedStat.ARMOR_CLASS));
        assertEquals(0, tracker.getTotal("pc:Aldric", ModifiedStat.DAMAGE));
        assertEquals(0, tracker.getTotal("pc:Brina", ModifiedStat.ATTACK));
    }

    @ParameterizedTest(name = "duration {0}")
    @ValueSource(ints = {1, 2, 3, 6})
    @DisplayName("A modifier with duration k expires on exactly the k-th tick")
    void expiresOnKthTick(int duration) {
        tracker.add("monster:Orc:0", new ActiveModifier("curse", "pc:Mage", ModifiedStat.ATTACK, -1, duration));

        for (int tick = 1; tick < duration; tick++) {
            assertTrue(tracker.tickRound().isEmpty(), "expired early on tick " + tick);
            assertEquals(-1, tracker.getTotal("monster:Orc:0", ModifiedStat.ATTACK));
        }
        List<ModifierTracker.Expired> expired = tracker.tickRound();
        assertEquals(List.of(new ModifierTracker.Expired("monster:Orc:0", "curse")), expired);
        assertEquals(0, tracker.getTotal("monster:Orc:0", ModifiedStat.ATTACK));
    }

    @Test
    @DisplayName("Permanent modifiers never expire from ticks")
    void permanentNeverExpires() {
        tracker.add("pc:Aldric", ActiveModifier.permanent("ring", "pc:Aldric", ModifiedStat.SAVING_THROW, 1));
        for (int i = 0; i < 100; i++) {
            assertTrue(tracker.tickRound().isEmpty());
        }
        assertEquals(1, tracker.getTotal("pc:Aldric", ModifiedStat.SAVING_THROW));
    }

    @Test
    @DisplayName("Explicit removal drops every instance with the id")
    void explicitRemoval() {
        tracker.add("pc:Aldric", ActiveModifier.permanent("ring", "pc:Aldric", ModifiedStat.SAVING_THROW, 1));
        tracker.add("pc:Aldric", ActiveModifier.permanent("ring", "pc:Aldric", ModifiedStat.SAVING_THROW, 1));
        assertTrue(tracker.has("pc:Aldric", "ring"));

        assertEquals(2, tracker.remove("pc:Aldric", "ring"));
        assertFalse(tracker.has("pc:Aldric", "ring"));
        assertEquals(0, tracker.remove("pc:Aldric", "ring"));
    }

    @Test
    @DisplayName("Expiries are reported in insertion order")
    void expiryOrder() {
        tracker.add("pc:Aldric", new ActiveModifier("a", null, ModifiedStat.ATTACK, 1, 1));
        tracker.add("pc:Brina", new ActiveModifier("b", null, ModifiedStat.ATTACK, 1, 1));
        tracker.add("pc:Aldric", new ActiveModifier("c", null, ModifiedStat.DAMAGE, 1, 1));

        assertEquals(List.of(
                new ModifierTracker.Expired("pc:Aldric", "a"),
                new ModifierTracker.Expired("pc:Aldric", "c"),
                new ModifierTracker.Expired("pc:Brina", "b")), tracker.tickRound());
    }

    @Test
    @DisplayName("getAll returns copies that do not affect the tracker")
    void getAllReturnsCopies() {
        tracker.add("pc:Aldric", new ActiveModifier("bless_atk", null, ModifiedStat.ATTACK, 1, 2));
        List<ActiveModifier> copy = tracker.getAll("pc:Aldric");
        copy.clear();

        assertEquals(1, tracker.getAll("pc:Aldric").size());
        assertEquals(Integer.valueOf(2), tracker.getAll("pc:Aldric").get(0).getRemainingRounds());
    }
}
