package com.example.skirmish.model;

/**
 * Combat statistics that temporary modifiers can adjust.
 */
public enum ModifiedStat {
    /** Added to attack roll totals */
    ATTACK,
    /** Added to damage dealt on a hit */
    DAMAGE,
    /** Added to armor class (descending, so negative values are better) */
    ARMOR_CLASS,
    /** Added to saving throw totals */
    SAVING_THROW
}
