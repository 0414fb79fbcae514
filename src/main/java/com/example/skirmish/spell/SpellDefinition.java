package com.example.skirmish.spell;

import com.example.skirmish.model.CharacterClassType;
import com.example.skirmish.model.SaveType;
import com.example.skirmish.model.TargetMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Static definition of a castable spell.
 * 
 * A spell can deal damage, heal, apply a condition and grant modifiers; any
 * combination of those is allowed. Multi-target modes resolve their final
 * targets at cast time (see {@link com.example.skirmish.combat.TargetingResolver}).
 */
public class SpellDefinition {
    private final String spellId;
    private final String name;
    private final int level;
    private final TargetMode targetMode;
    private final String damageDie;
    private final String healDie;
    private final boolean autoHit;
    private final String conditionId;
    private final Integer conditionDuration;
    private final SaveType save;
    private final String groupDice;         // ENEMY_GROUP size
    private final String poolDice;          // HD_POOL budget
    private final List<SpellModifier> modifiers;
    private final Set<CharacterClassType> usableBy;
    
    public SpellDefinition(String spellId, String name, int level, TargetMode targetMode,
                           String damageDie, String healDie, boolean autoHit,
                           String conditionId, Integer conditionDuration, SaveType save,
                           String groupDice, String poolDice,
                           List<SpellModifier> modifiers, Set<CharacterClassType> usableBy) {
        if (spellId == null || spellId.isBlank()) {
            throw new IllegalArgumentException("spellId must not be blank");
        }
        if (level < 1) {
            throw new IllegalArgumentException("Spell level must be at least 1: " + spellId);
        }
        if (targetMode == null) {
            throw new IllegalArgumentException("targetMode must not be null: " + spellId);
        }
        if (targetMode == TargetMode.HD_POOL && poolDice == null) {
            throw new IllegalArgumentException("HD_POOL spell needs pool dice: " + spellId);
        }
        if (targetMode == TargetMode.ENEMY_GROUP && groupDice == null) {
            throw new IllegalArgumentException("ENEMY_GROUP spell needs group dice: " + spellId);
        }
        this.spellId = spellId;
        this.name = name != null ? name : spellId;
        this.level = level;
        this.targetMode = targetMode;
        this.damageDie = damageDie;
        this.healDie = healDie;
        this.autoHit = autoHit;
        this.conditionId = conditionId;
        this.conditionDuration = conditionDuration;
        this.save = save != null ? save : SaveType.NONE;
        this.groupDice = groupDice;
        this.poolDice = poolDice;
        this.modifiers = modifiers != null ? new ArrayList<>(modifiers) : new ArrayList<>();
        this.usableBy = usableBy == null || usableBy.isEmpty()
                ? EnumSet.noneOf(CharacterClassType.class) : EnumSet.copyOf(usableBy);
    }
    
    public String getSpellId() { return spellId; }
    public String getName() { return name; }
    public int getLevel() { return level; }
    public TargetMode getTargetMode() { return targetMode; }
    /** 1 for a single target, -1 for all opposing or a resolved group. */
    public int getTargetCount() { return targetMode.getTargetCount(); }
    public String getDamageDie() { return damageDie; }
    public String getHealDie() { return healDie; }
    public boolean isAutoHit() { return autoHit; }
    public String getConditionId() { return conditionId; }
    public Integer getConditionDuration() { return conditionDuration; }
    public SaveType getSave() { return save; }
    public String getGroupDice() { return groupDice; }
    public String getPoolDice() { return poolDice; }
    public List<SpellModifier> getModifiers() { return Collections.unmodifiableList(modifiers); }
    public Set<CharacterClassType> getUsableBy() { return Collections.unmodifiableSet(usableBy); }
    
    public boolean dealsDamage() {
        return damageDie != null;
    }
    
    public boolean heals() {
        return healDie != null;
    }
    
    /**
     * Whether a caster of this class may cast the spell. Casters without a
     * class (monsters) are limited only by the spells they know.
     */
    public boolean isUsableBy(CharacterClassType characterClass) {
        return characterClass == null || usableBy.contains(characterClass);
    }
    
    @Override
    public String toString() {
        return name + " (L" + level + ", " + targetMode + ")";
    }
}
