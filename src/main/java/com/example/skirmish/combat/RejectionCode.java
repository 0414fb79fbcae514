package com.example.skirmish.combat;

/**
 * Why an intent failed validation.
 */
public enum RejectionCode {
    NOT_CURRENT_COMBATANT,
    ACTOR_DEAD,
    INVALID_TARGET,
    DUPLICATE_TARGET,
    TARGET_NOT_OPPONENT,
    TARGET_NOT_ALLY,
    NO_RANGED_WEAPON,
    UNKNOWN_SPELL,
    SPELL_NOT_KNOWN,
    INELIGIBLE_CASTER,
    SLOT_LEVEL_MISMATCH,
    NO_SPELL_SLOT,
    UNKNOWN_ITEM,
    ITEM_NOT_IN_INVENTORY,
    ITEM_NOT_THROWABLE
}
