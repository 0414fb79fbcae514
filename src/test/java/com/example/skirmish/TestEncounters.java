package com.example.skirmish;

import com.example.skirmish.combat.EncounterEngine;
import com.example.skirmish.combat.EncounterEvent;
import com.example.skirmish.config.EngineConfig;
import com.example.skirmish.model.CharacterClassType;
import com.example.skirmish.model.Creature;
import com.example.skirmish.spell.ItemCatalog;
import com.example.skirmish.spell.SpellCatalog;
import com.example.skirmish.util.DiceService;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Shared fixtures for encounter tests. Opposition AI is off by default so
 * every combatant is externally driven unless a test assigns a provider.
 */
public final class TestEncounters {

    public static final SpellCatalog SPELLS = SpellCatalog.loadDefault();
    public static final ItemCatalog ITEMS = ItemCatalog.loadDefault();

    private TestEncounters() {}

    public static EngineConfig config() {
        return EngineConfig.defaults().withAutoAssignOppositionAi(false);
    }

    public static EncounterEngine engine(List<Creature> party, List<Creature> opposition, DiceService dice) {
        return engine(party, opposition, dice, config());
    }

    public static EncounterEngine engine(List<Creature> party, List<Creature> opposition, DiceService dice,
                                  EngineConfig config) {
        return new EncounterEngine("test-encounter", party, opposition, dice, config, SPELLS, ITEMS);
    }

    /** Level 1 fighter with AC 5. */
    public static Creature fighter(String name, int hp) {
        return Creature.character(name, CharacterClassType.FIGHTER, 1).hp(hp).armorClass(5).build();
    }

    /** One hit die, AC 9, 1d6 damage. */
    public static Creature goblin(int hp) {
        return Creature.monster("Goblin", 1).hp(hp).build();
    }

    public static <T extends EncounterEvent> List<T> eventsOf(List<EncounterEvent> events, Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }
}
