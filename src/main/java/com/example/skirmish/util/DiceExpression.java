package com.example.skirmish.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed dice notation: {@code [N]dM[+/-K]} or a bare integer constant.
 */
public record DiceExpression(int count, int sides, int modifier) {
    
    private static final Pattern DICE_PATTERN = Pattern.compile("(\\d*)d(\\d+)([+-]\\d+)?");
    private static final Pattern CONSTANT_PATTERN = Pattern.compile("[+-]?\\d+");
    
    public DiceExpression {
        if (count < 0 || (count > 0 && sides < 1)) {
            throw new IllegalArgumentException("Invalid dice: " + count + "d" + sides);
        }
    }
    
    /**
     * Parse dice notation. Whitespace is ignored and the "d" is case-insensitive.
     * @throws IllegalArgumentException if the expression is empty or malformed
     */
    public static DiceExpression parse(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("Dice expression is null");
        }
        String normalized = expression.replaceAll("\\s+", "").toLowerCase();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Dice expression is empty");
        }
        
        try {
            if (CONSTANT_PATTERN.matcher(normalized).matches()) {
                return new DiceExpression(0, 0, Integer.parseInt(normalized));
            }
            
            Matcher matcher = DICE_PATTERN.matcher(normalized);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Invalid dice format: '" + expression + "'");
            }
            
            int count = matcher.group(1).isEmpty() ? 1 : Integer.parseInt(matcher.group(1));
            int sides = Integer.parseInt(matcher.group(2));
            int modifier = matcher.group(3) != null ? Integer.parseInt(matcher.group(3)) : 0;
            
            if (count < 1) {
                throw new IllegalArgumentException("Dice count must be at least 1: '" + expression + "'");
            }
            if (sides < 1) {
                throw new IllegalArgumentException("Dice must have at least 1 side: '" + expression + "'");
            }
            return new DiceExpression(count, sides, modifier);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Dice value out of range: '" + expression + "'", e);
        }
    }
    
    /** True for a bare integer with no dice. */
    public boolean isConstant() {
        return count == 0;
    }
    
    public int minimum() {
        return count + modifier;
    }
    
    public int maximum() {
        return count * sides + modifier;
    }
    
    @Override
    public String toString() {
        if (isConstant()) {
            return Integer.toString(modifier);
        }
        String base = count + "d" + sides;
        if (modifier > 0) return base + "+" + modifier;
        if (modifier < 0) return base + modifier;
        return base;
    }
}
