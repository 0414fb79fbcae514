package com.example.skirmish.ai;

import com.example.skirmish.combat.ActionChoice;
import com.example.skirmish.combat.ActionIntent;
import com.example.skirmish.combat.CombatContext;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Replays a fixed list of intents, one per turn.
 * Intents are returned as given, even if they are not among the choices,
 * so an illegal entry shows up as a rejection.
 */
public class ScriptedTacticalProvider implements TacticalProvider {
    
    private final Deque<ActionIntent> script;
    
    public ScriptedTacticalProvider(List<ActionIntent> script) {
        if (script == null) {
            throw new IllegalArgumentException("script must not be null");
        }
        this.script = new ArrayDeque<>(script);
    }
    
    public int remaining() {
        return script.size();
    }
    
    /**
     * @throws IllegalStateException when the script is exhausted
     */
    @Override
    public ActionIntent chooseIntent(String combatantId, List<ActionChoice> choices, CombatContext context) {
        ActionIntent next = script.pollFirst();
        if (next == null) {
            throw new IllegalStateException("Script exhausted for " + combatantId);
        }
        return next;
    }
}
