package com.example.skirmish.combat;

import com.example.skirmish.model.ModifiedStat;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks active stat modifiers per combatant.
 * 
 * Modifiers with the same id stack; each instance counts and expires on its
 * own. The engine calls {@link #tickRound()} once per completed round.
 */
public class ModifierTracker {
    
    /** A modifier removed by {@link #tickRound()}. */
    public record Expired(String combatantId, String modifierId) {}
    
    // combatant id -> modifiers in the order they were added
    private final Map<String, List<ActiveModifier>> modifiers = new LinkedHashMap<>();
    
    void add(String combatantId, ActiveModifier modifier) {
        if (combatantId == null || modifier == null) {
            throw new IllegalArgumentException("combatantId and modifier are required");
        }
        modifiers.computeIfAbsent(combatantId, k -> new ArrayList<>()).add(modifier);
    }
    
    /**
     * Sum of all active modifiers for the stat, 0 if there are none.
     */
    public int getTotal(String combatantId, ModifiedStat stat) {
        List<ActiveModifier> list = modifiers.get(combatantId);
        if (list == null) return 0;
        int total = 0;
        for (ActiveModifier mod : list) {
            if (mod.getStat() == stat) {
                total += mod.getValue();
            }
        }
        return total;
    }
    
    /**
     * Copies of the combatant's active modifiers; changing them does not affect the tracker.
     */
    public List<ActiveModifier> getAll(String combatantId) {
        List<ActiveModifier> list = modifiers.get(combatantId);
        List<ActiveModifier> copy = new ArrayList<>();
        if (list != null) {
            for (ActiveModifier mod : list) {
                copy.add(mod.copy());
            }
        }
        return copy;
    }
    
    public boolean has(String combatantId, String modifierId) {
        List<ActiveModifier> list = modifiers.get(combatantId);
        return list != null && list.stream().anyMatch(m -> m.getModifierId().equals(modifierId));
    }
    
    /**
     * Remove every instance of a modifier from a combatant.
     * @return number of instances removed
     */
    int remove(String combatantId, String modifierId) {
        List<ActiveModifier> list = modifiers.get(combatantId);
        if (list == null) return 0;
        int before = list.size();
        list.removeIf(m -> m.getModifierId().equals(modifierId));
        if (list.isEmpty()) {
            modifiers.remove(combatantId);
        }
        return before - list.size();
    }
    
    /**
     * Count down every finite modifier by one round and drop those that reach zero.
     * @return removed modifiers in insertion order
     */
    List<Expired> tickRound() {
        List<Expired> expired = new ArrayList<>();
        Iterator<Map.Entry<String, List<ActiveModifier>>> entries = modifiers.entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<String, List<ActiveModifier>> entry = entries.next();
            Iterator<ActiveModifier> it = entry.getValue().iterator();
            while (it.hasNext()) {
                ActiveModifier mod = it.next();
                if (mod.tick()) {
                    expired.add(new Expired(entry.getKey(), mod.getModifierId()));
                    it.remove();
                }
            }
            if (entry.getValue().isEmpty()) {
                entries.remove();
            }
        }
        return expired;
    }
}
