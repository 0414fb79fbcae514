package com.example.skirmish.util;

import java.util.List;

/**
 * Single source of randomness for an encounter.
 * 
 * The engine never calls any other random source, so replaying the same
 * sequence of outcomes through a {@link FixedDiceService} reproduces an
 * encounter exactly.
 */
public interface DiceService {
    
    /**
     * Roll a dice expression such as "1d8", "2d6+1", "d20" or "3".
     * @param expression dice notation
     * @return total of all dice plus the modifier
     * @throws IllegalArgumentException if the notation is malformed
     */
    int roll(String expression);
    
    /**
     * Roll a single unmodified twenty-sided die.
     */
    int d20();
    
    /**
     * Pick one element uniformly from a non-empty list.
     * @throws IllegalArgumentException if items is empty
     */
    <T> T choice(List<T> items);
}
