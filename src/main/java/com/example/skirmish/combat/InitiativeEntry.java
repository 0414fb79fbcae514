package com.example.skirmish.combat;

public record InitiativeEntry(String combatantId, int roll) {
}
