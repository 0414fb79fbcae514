package com.example.skirmish.model;

/**
 * What a successful saving throw does to a spell's effect on that target.
 */
public enum SaveType {
    NONE,
    NEGATES,
    HALVES
}
