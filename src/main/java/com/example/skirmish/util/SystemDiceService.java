package com.example.skirmish.util;

import java.security.SecureRandom;
import java.util.List;
import java.util.Random;

/**
 * Production dice backed by a cryptographically strong random source.
 */
public class SystemDiceService implements DiceService {
    
    private final Random random;
    
    public SystemDiceService() {
        this(new SecureRandom());
    }
    
    /** Seeded source for reproducible simulations. */
    public SystemDiceService(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }
        this.random = random;
    }
    
    @Override
    public int roll(String expression) {
        DiceExpression dice = DiceExpression.parse(expression);
        int total = dice.modifier();
        for (int i = 0; i < dice.count(); i++) {
            total += random.nextInt(dice.sides()) + 1;
        }
        return total;
    }
    
    @Override
    public int d20() {
        return random.nextInt(20) + 1;
    }
    
    @Override
    public <T> T choice(List<T> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose from an empty list");
        }
        return items.get(random.nextInt(items.size()));
    }
}
