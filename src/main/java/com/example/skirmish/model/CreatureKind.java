package com.example.skirmish.model;

/**
 * Whether a creature is a leveled character or a hit-dice monster.
 * Determines how its hit dice are counted for HD-pool effects.
 */
public enum CreatureKind {
    CHARACTER,
    MONSTER
}
