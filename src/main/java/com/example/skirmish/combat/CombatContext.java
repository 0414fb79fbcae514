package com.example.skirmish.combat;

import com.example.skirmish.config.EngineConfig;
import com.example.skirmish.model.CombatSide;
import com.example.skirmish.model.ModifiedStat;
import com.example.skirmish.spell.ItemCatalog;
import com.example.skirmish.spell.SpellCatalog;
import com.example.skirmish.util.DiceService;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shared state of one encounter: roster, round and turn bookkeeping,
 * trackers, and the collaborators actions read from.
 * 
 * Only the engine mutates a context; actions and tactical providers read it.
 */
public class CombatContext {
    
    /** All combatants, party first then opposition, in the order supplied */
    private final Map<String, Combatant> combatants = new LinkedHashMap<>();
    
    private final DiceService dice;
    private final SpellCatalog spells;
    private final ItemCatalog items;
    private final EngineConfig config;
    private final CombatCalculator calculator;
    
    private final ModifierTracker modifiers = new ModifierTracker();
    private final ConditionTracker conditions = new ConditionTracker();
    private final MoraleState morale;
    
    // Round Management
    private int roundNumber;
    private final Deque<String> turnQueue = new ArrayDeque<>();
    private String currentCombatantId;
    
    /** Ids already reported dead, in the order they were reported */
    private final Set<String> announcedDeaths = new LinkedHashSet<>();
    
    CombatContext(Collection<Combatant> roster, DiceService dice, SpellCatalog spells,
                  ItemCatalog items, EngineConfig config) {
        for (Combatant c : roster) {
            if (combatants.putIfAbsent(c.getId(), c) != null) {
                throw new IllegalArgumentException("Duplicate combatant id: " + c.getId());
            }
        }
        this.dice = dice;
        this.spells = spells;
        this.items = items;
        this.config = config;
        this.calculator = new CombatCalculator(config.getCriticalMultiplier());
        this.morale = new MoraleState(roster.stream()
                .filter(c -> c.getSide() == CombatSide.MONSTER)
                .map(Combatant::getMorale)
                .filter(Objects::nonNull)
                .min(Integer::compare)
                .orElse(null));
    }
    
    // Collaborators
    
    public DiceService getDice() { return dice; }
    public SpellCatalog getSpells() { return spells; }
    public ItemCatalog getItems() { return items; }
    public EngineConfig getConfig() { return config; }
    public CombatCalculator getCalculator() { return calculator; }
    public ModifierTracker getModifiers() { return modifiers; }
    public ConditionTracker getConditions() { return conditions; }
    public MoraleState getMorale() { return morale; }
    
    // Roster
    
    public Optional<Combatant> find(String id) {
        return Optional.ofNullable(id == null ? null : combatants.get(id));
    }
    
    /**
     * @throws IllegalArgumentException if no combatant has the id
     */
    public Combatant get(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("Unknown combatant id: " + id));
    }
    
    public boolean contains(String id) {
        return combatants.containsKey(id);
    }
    
    public Collection<Combatant> getCombatants() {
        return Collections.unmodifiableCollection(combatants.values());
    }
    
    public List<Combatant> getSide(CombatSide side) {
        return combatants.values().stream()
                .filter(c -> c.getSide() == side)
                .collect(Collectors.toList());
    }
    
    /** Alive, not fled combatants on a side, in roster order. */
    public List<Combatant> getActive(CombatSide side) {
        return combatants.values().stream()
                .filter(c -> c.getSide() == side && c.isActive())
                .collect(Collectors.toList());
    }
    
    public List<Combatant> getActiveOpponents(Combatant actor) {
        return getActive(actor.getSide().opposite());
    }
    
    /** Active combatants on the actor's side, the actor included. */
    public List<Combatant> getActiveAllies(Combatant actor) {
        return getActive(actor.getSide());
    }
    
    public boolean areOpponents(Combatant a, Combatant b) {
        return a.getSide() != b.getSide();
    }
    
    /**
     * Name for display, numbered when several combatants share it
     * ("Goblin #1", "Goblin #2").
     */
    public String displayName(String id) {
        Combatant target = combatants.get(id);
        if (target == null) return id;
        int index = 0;
        int sameName = 0;
        for (Combatant c : combatants.values()) {
            if (c.getName().equals(target.getName())) {
                sameName++;
                if (c == target) {
                    index = sameName;
                }
            }
        }
        return sameName > 1 ? target.getName() + " #" + index : target.getName();
    }
    
    // Derived stats
    
    public int getEffectiveArmorClass(String id) {
        return get(id).getArmorClass() + modifiers.getTotal(id, ModifiedStat.ARMOR_CLASS);
    }
    
    // Round Management
    
    public int getRoundNumber() { return roundNumber; }
    
    int nextRound() {
        return ++roundNumber;
    }
    
    public String getCurrentCombatantId() { return currentCombatantId; }
    
    void setCurrentCombatantId(String id) {
        this.currentCombatantId = id;
    }
    
    public Combatant getCurrentCombatant() {
        return currentCombatantId == null ? null : combatants.get(currentCombatantId);
    }
    
    public List<String> getTurnQueue() {
        return new ArrayList<>(turnQueue);
    }
    
    void setTurnQueue(List<String> ids) {
        turnQueue.clear();
        turnQueue.addAll(ids);
    }
    
    String pollTurnQueue() {
        return turnQueue.pollFirst();
    }
    
    boolean hasQueuedTurns() {
        return !turnQueue.isEmpty();
    }
    
    // Deaths
    
    public Set<String> getAnnouncedDeaths() {
        return Collections.unmodifiableSet(announcedDeaths);
    }
    
    boolean announceDeath(String id) {
        return announcedDeaths.add(id);
    }
}
