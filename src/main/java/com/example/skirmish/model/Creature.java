package com.example.skirmish.model;

import com.example.skirmish.util.DiceExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable description of one encounter participant, supplied by the caller.
 * 
 * The engine copies the mutable parts (hit points, spell slots, inventory)
 * into its own combatant state, so a Creature can be reused across encounters.
 */
public final class Creature {
    
    public static final int DEFAULT_THAC0 = 19;
    public static final int DEFAULT_SAVE_TARGET = 16;
    public static final String DEFAULT_DAMAGE_DIE = "1d6";
    
    private final String id;
    private final String name;
    private final CreatureKind kind;
    private final CharacterClassType characterClass;
    private final int level;
    private final int hitDice;
    private final int hp;
    private final int maxHp;
    private final int armorClass;
    private final int thac0;
    private final int attackBonus;
    private final String damageDie;
    private final int attacksPerRound;
    private final String rangedDamageDie;
    private final List<String> knownSpells;
    private final Map<Integer, Integer> spellSlots;
    private final Map<String, Integer> inventory;
    private final Integer morale;
    private final int saveTarget;
    
    private Creature(Builder b) {
        this.id = b.id;
        this.name = b.name;
        this.kind = b.kind;
        this.characterClass = b.characterClass;
        this.level = b.level;
        this.hitDice = b.hitDice;
        this.maxHp = b.maxHp;
        this.hp = b.hp != null ? b.hp : b.maxHp;
        this.armorClass = b.armorClass;
        this.thac0 = b.thac0;
        this.attackBonus = b.attackBonus;
        this.damageDie = b.damageDie;
        this.attacksPerRound = b.attacksPerRound;
        this.rangedDamageDie = b.rangedDamageDie;
        this.knownSpells = Collections.unmodifiableList(new ArrayList<>(b.knownSpells));
        this.spellSlots = Collections.unmodifiableMap(new TreeMap<>(b.spellSlots));
        this.inventory = Collections.unmodifiableMap(new LinkedHashMap<>(b.inventory));
        this.morale = b.morale;
        this.saveTarget = b.saveTarget;
    }
    
    public static Builder character(String name, CharacterClassType characterClass, int level) {
        return new Builder(name, CreatureKind.CHARACTER).characterClass(characterClass).level(level);
    }
    
    public static Builder monster(String name, int hitDice) {
        return new Builder(name, CreatureKind.MONSTER).hitDice(hitDice);
    }
    
    /** Explicit id, or null to let the engine assign one. */
    public String getId() { return id; }
    public String getName() { return name; }
    public CreatureKind getKind() { return kind; }
    public CharacterClassType getCharacterClass() { return characterClass; }
    public int getLevel() { return level; }
    public int getHitDice() { return hitDice; }
    public int getHp() { return hp; }
    public int getMaxHp() { return maxHp; }
    public int getArmorClass() { return armorClass; }
    public int getThac0() { return thac0; }
    public int getAttackBonus() { return attackBonus; }
    public String getDamageDie() { return damageDie; }
    public int getAttacksPerRound() { return attacksPerRound; }
    public String getRangedDamageDie() { return rangedDamageDie; }
    public boolean hasRangedWeapon() { return rangedDamageDie != null; }
    public List<String> getKnownSpells() { return knownSpells; }
    public Map<Integer, Integer> getSpellSlots() { return spellSlots; }
    public Map<String, Integer> getInventory() { return inventory; }
    /** Morale score 2-12, or null for creatures that never check morale. */
    public Integer getMorale() { return morale; }
    public int getSaveTarget() { return saveTarget; }
    
    @Override
    public String toString() {
        return name + " (" + kind + ", " + hp + "/" + maxHp + " HP)";
    }
    
    public static final class Builder {
        private String id;
        private final String name;
        private final CreatureKind kind;
        private CharacterClassType characterClass;
        private int level = 1;
        private int hitDice = 1;
        private Integer hp;
        private int maxHp = 1;
        private int armorClass = 9;
        private int thac0 = DEFAULT_THAC0;
        private int attackBonus;
        private String damageDie = DEFAULT_DAMAGE_DIE;
        private int attacksPerRound = 1;
        private String rangedDamageDie;
        private final List<String> knownSpells = new ArrayList<>();
        private final Map<Integer, Integer> spellSlots = new TreeMap<>();
        private final Map<String, Integer> inventory = new LinkedHashMap<>();
        private Integer morale;
        private int saveTarget = DEFAULT_SAVE_TARGET;
        
        public Builder(String name, CreatureKind kind) {
            this.name = name;
            this.kind = kind;
        }
        
        public Builder id(String id) { this.id = id; return this; }
        public Builder characterClass(CharacterClassType characterClass) { this.characterClass = characterClass; return this; }
        public Builder level(int level) { this.level = level; return this; }
        public Builder hitDice(int hitDice) { this.hitDice = hitDice; return this; }
        public Builder armorClass(int armorClass) { this.armorClass = armorClass; return this; }
        public Builder thac0(int thac0) { this.thac0 = thac0; return this; }
        public Builder attackBonus(int attackBonus) { this.attackBonus = attackBonus; return this; }
        public Builder damageDie(String damageDie) { this.damageDie = damageDie; return this; }
        public Builder attacksPerRound(int attacksPerRound) { this.attacksPerRound = attacksPerRound; return this; }
        public Builder rangedDamageDie(String rangedDamageDie) { this.rangedDamageDie = rangedDamageDie; return this; }
        public Builder morale(Integer morale) { this.morale = morale; return this; }
        public Builder saveTarget(int saveTarget) { this.saveTarget = saveTarget; return this; }
        
        /** Sets both current and maximum hit points. */
        public Builder hp(int maxHp) {
            this.maxHp = maxHp;
            this.hp = maxHp;
            return this;
        }
        
        public Builder hp(int hp, int maxHp) {
            this.hp = hp;
            this.maxHp = maxHp;
            return this;
        }
        
        public Builder knownSpell(String spellId) {
            this.knownSpells.add(spellId);
            return this;
        }
        
        public Builder spellSlots(int spellLevel, int count) {
            this.spellSlots.put(spellLevel, count);
            return this;
        }
        
        public Builder item(String itemName, int count) {
            this.inventory.merge(itemName, count, Integer::sum);
            return this;
        }
        
        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public Creature build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Creature name must not be blank");
            }
            if (kind == null) {
                throw new IllegalArgumentException("Creature kind must not be null: " + name);
            }
            if (maxHp < 1) {
                throw new IllegalArgumentException("maxHp must be at least 1: " + name);
            }
            if (hp != null && hp < 1) {
                throw new IllegalArgumentException("hp must be at least 1 to join an encounter: " + name);
            }
            if (hp != null && hp > maxHp) {
                throw new IllegalArgumentException("hp exceeds maxHp: " + name);
            }
            if (attacksPerRound < 1) {
                throw new IllegalArgumentException("attacksPerRound must be at least 1: " + name);
            }
            if (morale != null && (morale < 2 || morale > 12)) {
                throw new IllegalArgumentException("morale must be 2-12: " + name);
            }
            for (Map.Entry<Integer, Integer> slot : spellSlots.entrySet()) {
                if (slot.getKey() < 1 || slot.getValue() < 0) {
                    throw new IllegalArgumentException("Invalid spell slots " + slot + ": " + name);
                }
            }
            for (Map.Entry<String, Integer> item : inventory.entrySet()) {
                if (item.getValue() < 0) {
                    throw new IllegalArgumentException("Negative item count " + item + ": " + name);
                }
            }
            // Fail on bad notation now rather than mid-encounter
            DiceExpression.parse(damageDie);
            if (rangedDamageDie != null) {
                DiceExpression.parse(rangedDamageDie);
            }
            return new Creature(this);
        }
    }
}
