package com.example.skirmish.combat;

import com.example.skirmish.model.CharacterClassType;
import com.example.skirmish.model.CombatSide;
import com.example.skirmish.model.Creature;
import com.example.skirmish.model.CreatureKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A creature participating in one encounter.
 * Holds the mutable per-encounter state (hit points, slots, inventory,
 * fled flag) on top of the immutable {@link Creature} template.
 */
public class Combatant {
    
    /** Unique identifier within the encounter */
    private final String id;
    
    /** The template this combatant was created from */
    private final Creature creature;
    
    /** Which side this combatant fights for */
    private final CombatSide side;
    
    /** Current hit points; may drop below zero, displayed clamped to zero */
    private int hp;
    
    /** Remaining spell slots by spell level */
    private final Map<Integer, Integer> spellSlots;
    
    /** Remaining consumables by item name */
    private final Map<String, Integer> inventory;
    
    /** Whether this combatant has left the encounter */
    private boolean fled;
    
    public Combatant(String id, Creature creature, CombatSide side) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Combatant id must not be blank");
        }
        if (creature == null || side == null) {
            throw new IllegalArgumentException("creature and side are required: " + id);
        }
        this.id = id;
        this.creature = creature;
        this.side = side;
        this.hp = creature.getHp();
        this.spellSlots = new TreeMap<>(creature.getSpellSlots());
        this.inventory = new LinkedHashMap<>(creature.getInventory());
    }
    
    // Identification
    
    public String getId() { return id; }
    public Creature getCreature() { return creature; }
    public String getName() { return creature.getName(); }
    public CombatSide getSide() { return side; }
    public CreatureKind getKind() { return creature.getKind(); }
    public CharacterClassType getCharacterClass() { return creature.getCharacterClass(); }
    
    // Vital state
    
    public int getHp() { return hp; }
    public int getMaxHp() { return creature.getMaxHp(); }
    
    public boolean isAlive() {
        return hp > 0;
    }
    
    public boolean isDead() {
        return hp <= 0;
    }
    
    public boolean hasFled() {
        return fled;
    }
    
    /** Alive and still on the field: can act and be targeted. */
    public boolean isActive() {
        return isAlive() && !fled;
    }
    
    /**
     * Subtract hit points.
     * @return hit points after the damage
     */
    int applyDamage(int amount) {
        hp -= Math.max(0, amount);
        return hp;
    }
    
    /**
     * Restore hit points, never above maximum.
     * @return hit points actually restored
     */
    int applyHealing(int amount) {
        int before = hp;
        hp = Math.min(getMaxHp(), hp + Math.max(0, amount));
        return hp - before;
    }
    
    void markFled() {
        this.fled = true;
    }
    
    // Combat stats
    
    public int getArmorClass() { return creature.getArmorClass(); }
    public int getThac0() { return creature.getThac0(); }
    public int getAttackBonus() { return creature.getAttackBonus(); }
    public String getDamageDie() { return creature.getDamageDie(); }
    public int getAttacksPerRound() { return creature.getAttacksPerRound(); }
    public boolean hasRangedWeapon() { return creature.hasRangedWeapon(); }
    public String getRangedDamageDie() { return creature.getRangedDamageDie(); }
    public int getSaveTarget() { return creature.getSaveTarget(); }
    public Integer getMorale() { return creature.getMorale(); }
    
    // Resources
    
    public List<String> getKnownSpells() { return creature.getKnownSpells(); }
    
    public boolean knowsSpell(String spellId) {
        return creature.getKnownSpells().stream().anyMatch(s -> s.equalsIgnoreCase(spellId));
    }
    
    public int getSpellSlots(int level) {
        return spellSlots.getOrDefault(level, 0);
    }
    
    public Map<Integer, Integer> getSpellSlots() {
        return Collections.unmodifiableMap(spellSlots);
    }
    
    /**
     * Use up one slot of the given level.
     * @return slots remaining at that level
     * @throws IllegalStateException if none remain
     */
    int consumeSlot(int level) {
        int remaining = getSpellSlots(level);
        if (remaining <= 0) {
            throw new IllegalStateException(id + " has no level " + level + " slot to consume");
        }
        spellSlots.put(level, remaining - 1);
        return remaining - 1;
    }
    
    public int getItemCount(String itemName) {
        for (Map.Entry<String, Integer> entry : inventory.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(itemName)) {
                return entry.getValue();
            }
        }
        return 0;
    }
    
    public Map<String, Integer> getInventory() {
        return Collections.unmodifiableMap(inventory);
    }
    
    /**
     * @return count remaining after use
     * @throws IllegalStateException if the item is not carried
     */
    int consumeItem(String itemName) {
        for (Map.Entry<String, Integer> entry : inventory.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(itemName) && entry.getValue() > 0) {
                entry.setValue(entry.getValue() - 1);
                return entry.getValue();
            }
        }
        throw new IllegalStateException(id + " does not carry " + itemName);
    }
    
    @Override
    public String toString() {
        return id + " [" + side + ", " + hp + "/" + getMaxHp() + " HP"
                + (fled ? ", fled" : "") + (isDead() ? ", dead" : "") + "]";
    }
}
