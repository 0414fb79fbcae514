package com.example.skirmish;

import com.example.skirmish.model.CharacterClassType;
import com.example.skirmish.model.ModifiedStat;
import com.example.skirmish.model.SaveType;
import com.example.skirmish.model.TargetMode;
import com.example.skirmish.spell.CatalogException;
import com.example.skirmish.spell.ItemCatalog;
import com.example.skirmish.spell.ItemDefinition;
import com.example.skirmish.spell.SpellCatalog;
import com.example.skirmish.spell.SpellDefinition;
import com.example.skirmish.spell.SpellModifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the YAML-backed spell and item catalogs.
 */
public class SpellCatalogTest {

    private final SpellCatalog spells = SpellCatalog.loadDefault();
    private final ItemCatalog items = ItemCatalog.loadDefault();

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    // === Bundled spells ===

    @Test
    void testDefaultCatalogContents() {
        assertEquals(10, spells.size());
        for (String id : List.of("magic_missile", "sleep", "hold_person", "light_offensive", "cure_light_wounds",
                "cause_light_wounds", "bless", "shield", "fireball", "lightning_bolt")) {
            assertTrue(spells.contains(id), id);
        }
    }

    @Test
    void testLookupIsCaseInsensitive() {
        assertEquals("sleep", spells.find("SLEEP").orElseThrow().getSpellId());
        assertTrue(spells.find("wish").isEmpty());
        assertTrue(spells.find(null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> spells.get("wish"));
    }

    @Test
    void testSleepDefinition() {
        SpellDefinition sleep = spells.get("sleep");
        assertEquals("Sleep", sleep.getName());
        assertEquals(1, sleep.getLevel());
        assertEquals(TargetMode.HD_POOL, sleep.getTargetMode());
        assertEquals("2d8", sleep.getPoolDice());
        assertEquals("asleep", sleep.getConditionId());
        assertNull(sleep.getConditionDuration());
        assertTrue(sleep.isAutoHit());
        assertFalse(sleep.dealsDamage());
        assertEquals(-1, sleep.getTargetCount());
    }

    @Test
    void testHoldPersonDefinition() {
        SpellDefinition hold = spells.get("hold_person");
        assertEquals(2, hold.getLevel());
        assertEquals(TargetMode.ENEMY_GROUP, hold.getTargetMode());
        assertEquals("1d4", hold.getGroupDice());
        assertEquals(SaveType.NEGATES, hold.getSave());
        assertEquals(Integer.valueOf(9), hold.getConditionDuration());
        assertTrue(hold.isUsableBy(CharacterClassType.CLERIC));
        assertFalse(hold.isUsableBy(CharacterClassType.MAGIC_USER));
        // monsters have no class and are limited only by what they know
        assertTrue(hold.isUsableBy(null));
    }

    @Test
    void testBlessModifiers() {
        assertEquals(List.of(
                new SpellModifier("bless_atk", ModifiedStat.ATTACK, 1, 6),
                new SpellModifier("bless_save", ModifiedStat.SAVING_THROW, 1, 6)),
                spells.get("bless").getModifiers());
    }

    @Test
    void testSingleTargetSpells() {
        assertEquals(1, spells.get("magic_missile").getTargetCount());
        assertTrue(spells.get("cure_light_wounds").heals());
        assertFalse(spells.get("cause_light_wounds").isAutoHit());
        assertEquals(SaveType.HALVES, spells.get("fireball").getSave());
    }

    // === Malformed spell data ===

    @Test
    void testInlineYaml() {
        SpellCatalog catalog = SpellCatalog.fromYaml(yaml(
                "spells:\n"
                + "  - id: frost\n"
                + "    level: 1\n"
                + "    target: single_enemy\n"
                + "    damage: 1d4\n"), "inline");
        SpellDefinition frost = catalog.get("frost");
        assertEquals("frost", frost.getName());
        assertEquals(TargetMode.SINGLE_ENEMY, frost.getTargetMode());
        assertFalse(frost.isAutoHit());
        assertEquals(SaveType.NONE, frost.getSave());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "spells:\n  - id: frost\n    target: SINGLE_ENEMY\n",
        "spells:\n  - id: frost\n    level: 1\n",
        "spells:\n  - level: 1\n    target: SINGLE_ENEMY\n",
        "spells:\n  - id: frost\n    level: 1\n    target: SIDEWAYS\n",
        "spells:\n  - id: frost\n    level: 1\n    target: SINGLE_ENEMY\n    damage: lots\n",
        "spells:\n  - id: frost\n    level: 1\n    target: SINGLE_ENEMY\n    usable_by: [bard]\n",
        "spells:\n  - id: frost\n    level: 1\n    target: HD_POOL\n",
        "spells:\n  - id: a\n    level: 1\n    target: SELF\n  - id: A\n    level: 1\n    target: SELF\n",
        "spells: nothing\n",
        "just text",
        "spells: [\n"
    })
    void testMalformedSpellDataIsRejected(String text) {
        assertThrows(CatalogException.class, () -> SpellCatalog.fromYaml(yaml(text), "inline"));
    }

    @Test
    void testMissingResource() {
        assertThrows(CatalogException.class, () -> SpellCatalog.fromResource("/data/no-such-file.yaml"));
    }

    // === Items ===

    @Test
    void testDefaultItems() {
        assertEquals(3, items.size());
        ItemDefinition oil = items.find("flask of oil").orElseThrow();
        assertEquals("Flask of Oil", oil.name());
        assertTrue(oil.isThrowable());
        assertEquals("1d8", oil.damageDie());

        ItemDefinition potion = items.find("Potion of Healing").orElseThrow();
        assertFalse(potion.isThrowable());
        assertEquals(TargetMode.SELF, potion.targetMode());
        assertEquals("1d6+1", potion.healDie());

        assertTrue(items.find("Rope").isEmpty());
        assertTrue(items.find(null).isEmpty());
    }

    @Test
    void testDuplicateItemsRejected() {
        ItemDefinition oil = new ItemDefinition("Oil", TargetMode.SINGLE_ENEMY, "1d8", null);
        ItemDefinition oil2 = new ItemDefinition("OIL", TargetMode.SINGLE_ENEMY, "1d8", null);
        assertThrows(CatalogException.class, () -> new ItemCatalog(List.of(oil, oil2)));
    }
}
