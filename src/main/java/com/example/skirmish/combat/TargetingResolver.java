package com.example.skirmish.combat;

import com.example.skirmish.model.CreatureKind;
import com.example.skirmish.model.TargetMode;
import com.example.skirmish.util.DiceService;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Pure target selection for multi-target spells and effects.
 */
public final class TargetingResolver {
    
    /** A candidate for hit-dice pool selection. */
    public record HdCandidate(String combatantId, int hitDice) {}
    
    private TargetingResolver() {}
    
    /**
     * Select the weakest candidates whose combined hit dice fit within the pool.
     * 
     * Candidates are sorted ascending by hit dice (stable, so ties keep their
     * input order) and taken greedily while the running total stays within
     * {@code poolTotal}. Selection stops at the first candidate that does not
     * fit. Hit dice below 1 count as 1. A combatant listed twice is
     * considered once.
     */
    public static List<String> resolveHdPool(List<HdCandidate> candidates, int poolTotal) {
        List<String> selected = new ArrayList<>();
        if (poolTotal <= 0 || candidates == null || candidates.isEmpty()) {
            return selected;
        }
        // first occurrence of each combatant wins
        Map<String, HdCandidate> unique = new LinkedHashMap<>();
        for (HdCandidate candidate : candidates) {
            unique.putIfAbsent(candidate.combatantId(), candidate);
        }
        List<HdCandidate> sorted = new ArrayList<>(unique.values());
        sorted.sort(Comparator.comparingInt(c -> Math.max(1, c.hitDice())));
        
        int remaining = poolTotal;
        for (HdCandidate candidate : sorted) {
            int cost = Math.max(1, candidate.hitDice());
            if (cost > remaining) {
                break;
            }
            selected.add(candidate.combatantId());
            remaining -= cost;
        }
        return selected;
    }
    
    /**
     * Pick {@code min(count, distinct candidates)} candidates at random, without
     * replacement, using the dice service for every pick.
     */
    public static List<String> resolveRandomGroup(List<String> candidateIds, int count, DiceService dice) {
        List<String> selected = new ArrayList<>();
        if (count <= 0 || candidateIds == null || candidateIds.isEmpty()) {
            return selected;
        }
        List<String> pool = new ArrayList<>(new LinkedHashSet<>(candidateIds));
        int picks = Math.min(count, pool.size());
        for (int i = 0; i < picks; i++) {
            String pick = dice.choice(pool);
            pool.remove(pick);
            selected.add(pick);
        }
        return selected;
    }
    
    /**
     * Hit dice used for pool effects: monsters count their hit dice,
     * characters their level, anything else 1. Never less than 1.
     */
    public static int hitDiceOf(CreatureKind kind, int hitDice, int level) {
        if (kind == null) {
            return 1;
        }
        switch (kind) {
            case MONSTER:
                return Math.max(1, hitDice);
            case CHARACTER:
                return Math.max(1, level);
            default:
                return 1;
        }
    }
    
    public static int hitDiceOf(Combatant combatant) {
        return hitDiceOf(combatant.getKind(), combatant.getCreature().getHitDice(), combatant.getCreature().getLevel());
    }
    
    public static List<HdCandidate> toHdCandidates(List<Combatant> combatants) {
        return combatants.stream()
                .map(c -> new HdCandidate(c.getId(), hitDiceOf(c)))
                .collect(Collectors.toList());
    }
    
    /**
     * Active combatants a target mode can affect for this actor, in roster order.
     * Dead and fled combatants are never candidates.
     */
    public static List<Combatant> candidatesFor(TargetMode mode, Combatant actor, CombatContext ctx) {
        if (mode == TargetMode.SELF) {
            return actor.isActive() ? List.of(actor) : List.of();
        }
        if (mode.targetsAllies()) {
            return ctx.getActiveAllies(actor);
        }
        return ctx.getActiveOpponents(actor);
    }
}
