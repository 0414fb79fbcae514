package com.example.skirmish.combat;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks conditions per combatant. A combatant holds at most one instance
 * of each condition; reapplying replaces the remaining duration.
 */
public class ConditionTracker {
    
    public record Expired(String combatantId, String conditionId) {}
    
    private final Map<String, List<ActiveCondition>> conditions = new LinkedHashMap<>();
    
    void add(String combatantId, ActiveCondition condition) {
        if (combatantId == null || condition == null) {
            throw new IllegalArgumentException("combatantId and condition are required");
        }
        List<ActiveCondition> list = conditions.computeIfAbsent(combatantId, k -> new ArrayList<>());
        list.removeIf(c -> c.getType() == condition.getType());
        list.add(condition);
    }
    
    public boolean has(String combatantId, ConditionType type) {
        List<ActiveCondition> list = conditions.get(combatantId);
        return list != null && list.stream().anyMatch(c -> c.getType() == type);
    }
    
    boolean remove(String combatantId, ConditionType type) {
        List<ActiveCondition> list = conditions.get(combatantId);
        if (list == null) return false;
        boolean removed = list.removeIf(c -> c.getType() == type);
        if (list.isEmpty()) {
            conditions.remove(combatantId);
        }
        return removed;
    }
    
    public List<ActiveCondition> getAll(String combatantId) {
        List<ActiveCondition> copy = new ArrayList<>();
        List<ActiveCondition> list = conditions.get(combatantId);
        if (list != null) {
            for (ActiveCondition c : list) {
                copy.add(c.copy());
            }
        }
        return copy;
    }
    
    /**
     * The first turn-skipping condition on the combatant, if any.
     */
    public Optional<ConditionType> turnSkippingCondition(String combatantId) {
        List<ActiveCondition> list = conditions.get(combatantId);
        if (list == null) return Optional.empty();
        return list.stream().map(ActiveCondition::getType).filter(ConditionType::isSkipTurn).findFirst();
    }
    
    /** Total attack penalty from conditions such as blindness. */
    public int attackPenalty(String combatantId) {
        List<ActiveCondition> list = conditions.get(combatantId);
        if (list == null) return 0;
        return list.stream().mapToInt(c -> c.getType().getAttackPenalty()).sum();
    }
    
    /**
     * Remove conditions that end when the combatant takes damage.
     * @return ids of the removed conditions
     */
    List<String> removeBrokenByDamage(String combatantId) {
        List<String> removed = new ArrayList<>();
        List<ActiveCondition> list = conditions.get(combatantId);
        if (list == null) return removed;
        Iterator<ActiveCondition> it = list.iterator();
        while (it.hasNext()) {
            ActiveCondition c = it.next();
            if (c.getType().isBreakOnDamage()) {
                removed.add(c.getConditionId());
                it.remove();
            }
        }
        if (list.isEmpty()) {
            conditions.remove(combatantId);
        }
        return removed;
    }
    
    List<Expired> tickRound() {
        List<Expired> expired = new ArrayList<>();
        Iterator<Map.Entry<String, List<ActiveCondition>>> entries = conditions.entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<String, List<ActiveCondition>> entry = entries.next();
            Iterator<ActiveCondition> it = entry.getValue().iterator();
            while (it.hasNext()) {
                ActiveCondition c = it.next();
                if (c.tick()) {
                    expired.add(new Expired(entry.getKey(), c.getConditionId()));
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
