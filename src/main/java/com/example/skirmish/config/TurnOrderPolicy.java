package com.example.skirmish.config;

/**
 * How the turn queue for each round is ordered.
 */
public enum TurnOrderPolicy {
    /** Party first, then opposition, each in the order they were supplied */
    ROSTER,
    /** Each combatant rolls 1d6, highest first; ties keep roster order */
    INITIATIVE
}
