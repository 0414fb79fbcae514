package com.example.skirmish.combat;

/**
 * Events that prompt a monster group morale check.
 */
public enum MoraleTrigger {
    /** The first opposition combatant has died */
    FIRST_DEATH,
    /** Half or more of the opposition is dead or fled */
    HALF_INCAPACITATED
}
