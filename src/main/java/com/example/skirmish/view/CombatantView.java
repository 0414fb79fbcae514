package com.example.skirmish.view;

import com.example.skirmish.model.CombatSide;

import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of one combatant. Hit points are clamped at zero.
 */
public record CombatantView(
    String id,
    String name,
    CombatSide side,
    int hp,
    int maxHp,
    int armorClass,
    int effectiveArmorClass,
    boolean alive,
    boolean fled,
    List<String> conditions,
    Map<Integer, Integer> spellSlots
) {
    public CombatantView {
        conditions = List.copyOf(conditions);
        spellSlots = Map.copyOf(spellSlots);
    }
}
