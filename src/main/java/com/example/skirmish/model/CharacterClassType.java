package com.example.skirmish.model;

import java.util.Locale;

public enum CharacterClassType {
    FIGHTER("Fighter"),
    CLERIC("Cleric"),
    MAGIC_USER("Magic-User"),
    ELF("Elf"),
    DWARF("Dwarf"),
    HALFLING("Halfling"),
    THIEF("Thief");
    
    private final String displayName;
    
    CharacterClassType(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    /**
     * Parse a class name as written in data files ("magic_user", "Magic-User", "ELF").
     * @throws IllegalArgumentException if no class matches
     */
    public static CharacterClassType fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Class name is null");
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return CharacterClassType.valueOf(normalized);
    }
}
