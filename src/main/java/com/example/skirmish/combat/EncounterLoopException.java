package com.example.skirmish.combat;

/**
 * The engine cannot make progress: it was stepped after ending, or it ran
 * out of its step budget before reaching a decision point.
 */
public class EncounterLoopException extends RuntimeException {
    
    public EncounterLoopException(String message) {
        super(message);
    }
}
