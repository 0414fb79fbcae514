package com.example.skirmish.util;

import java.util.List;

/**
 * Replays a scripted sequence of values, cycling back to the start when
 * the sequence runs out.
 * 
 * {@code roll("NdM+K")} consumes N values and returns their sum plus K,
 * {@code d20()} consumes one value and {@code choice} consumes one value
 * and uses it as an index modulo the list size. Constants consume nothing.
 * Scripted values are not clamped to the die's faces.
 */
public class FixedDiceService implements DiceService {
    
    private final int[] values;
    private int position;
    
    public FixedDiceService(int... values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("FixedDiceService needs at least one value");
        }
        this.values = values.clone();
    }
    
    public FixedDiceService(List<Integer> values) {
        this(values == null ? null : values.stream().mapToInt(Integer::intValue).toArray());
    }
    
    private int next() {
        int value = values[position % values.length];
        position++;
        return value;
    }
    
    /** Number of values consumed so far (not wrapped). */
    public int consumed() {
        return position;
    }
    
    @Override
    public int roll(String expression) {
        DiceExpression dice = DiceExpression.parse(expression);
        int total = dice.modifier();
        for (int i = 0; i < dice.count(); i++) {
            total += next();
        }
        return total;
    }
    
    @Override
    public int d20() {
        return next();
    }
    
    @Override
    public <T> T choice(List<T> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose from an empty list");
        }
        return items.get(Math.floorMod(next(), items.size()));
    }
}
