package com.example.skirmish;

import com.example.skirmish.combat.ActionChoice;
import com.example.skirmish.combat.ActionIntent;
import com.example.skirmish.combat.EncounterEngine;
import com.example.skirmish.combat.EncounterEvent;
import com.example.skirmish.combat.EncounterOutcome;
import com.example.skirmish.combat.EncounterState;
import com.example.skirmish.combat.InitiativeEntry;
import com.example.skirmish.combat.MoraleTrigger;
import com.example.skirmish.combat.Rejection;
import com.example.skirmish.combat.RejectionCode;
import com.example.skirmish.config.TurnOrderPolicy;
import com.example.skirmish.model.CombatSide;
import com.example.skirmish.util.FixedDiceService;
import com.example.skirmish.view.EventSerializer;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.skirmish.TestEncounters.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Event serialization tests")
class EventSerializerTest {

    private final EventSerializer serializer = new EventSerializer();

    @Test
    @DisplayName("Fields become snake_case keys after the kind")
    void recordFieldsInOrder() {
        Map<String, Object> map = serializer.toMap(
                new EncounterEvent.AttackRolled("pc:Aldric", "monster:Goblin:0", 15, 17, 10, true, false));

        assertEquals(List.of("kind", "attacker_id", "defender_id", "roll", "total", "needed", "hit", "critical"),
                List.copyOf(map.keySet()));
        assertEquals("AttackRolled", map.get("kind"));
        assertEquals(15, map.get("roll"));
        assertEquals(true, map.get("hit"));
    }

    @Test
    @DisplayName("Enums serialize as their names")
    void enumsAsNames() {
        assertEquals("PARTY_VICTORY",
                serializer.toMap(new EncounterEvent.VictoryDetermined(EncounterOutcome.PARTY_VICTORY)).get("outcome"));
        assertEquals("MONSTER",
                serializer.toMap(new EncounterEvent.EntityFled("monster:Goblin:0", CombatSide.MONSTER)).get("side"));
        assertEquals("HALF_INCAPACITATED", serializer.toMap(
                new EncounterEvent.MoraleChecked(7, 9, false, MoraleTrigger.HALF_INCAPACITATED, 0, false))
                .get("trigger"));
    }

    @Test
    @DisplayName("Nulls are kept")
    void nullsKept() {
        Map<String, Object> map = serializer.toMap(
                new EncounterEvent.GroupTargetsResolved("Hold Person", null, List.of("monster:Gnoll:0")));
        assertTrue(map.containsKey("pool_roll"));
        assertNull(map.get("pool_roll"));
        assertTrue(serializer.toJson(new EncounterEvent.GroupTargetsResolved("Hold Person", null, List.of()))
                .contains("\"pool_roll\":null"));
    }

    @Test
    @DisplayName("Choices carry their intent kind and a label")
    @SuppressWarnings("unchecked")
    void nestedChoices() {
        ActionChoice choice = new ActionChoice(ActionChoice.ATTACK_TARGET, Map.of("target", "Goblin"),
                new ActionIntent.MeleeAttack("pc:Aldric", "monster:Goblin:0"));
        Map<String, Object> map = serializer.toMap(new EncounterEvent.NeedAction("pc:Aldric", List.of(choice)));

        List<Object> choices = (List<Object>) map.get("choices");
        Map<String, Object> first = (Map<String, Object>) choices.get(0);
        assertEquals("attack_target", first.get("ui_key"));
        assertEquals(Map.of("target", "Goblin"), first.get("ui_args"));
        assertEquals("Attack Goblin", first.get("label"));
        assertFalse(first.containsKey("kind"));

        Map<String, Object> intent = (Map<String, Object>) first.get("intent");
        assertEquals("MeleeAttack", intent.get("kind"));
        assertEquals("monster:Goblin:0", intent.get("target_id"));
    }

    @Test
    @DisplayName("Normalizing serialized output changes nothing")
    void normalizeIdempotent() {
        FixedDiceService dice = new FixedDiceService(15, 5);
        EncounterEngine engine = engine(List.of(fighter("Aldric", 10)), List.of(goblin(1)), dice);
        engine.stepUntilDecision();
        engine.stepUntilDecision(new ActionIntent.MeleeAttack("pc:Aldric", "monster:Goblin:0"));

        for (EncounterEvent event : engine.getEvents()) {
            Map<String, Object> once = serializer.toMap(event);
            assertEquals(once, serializer.normalize(once), event.toString());
        }
    }

    @Test
    @DisplayName("Equal events give identical JSON")
    void deterministicJson() {
        EncounterEvent a = new EncounterEvent.DamageApplied("pc:Aldric", "monster:Goblin:0", 5, -4);
        EncounterEvent b = new EncounterEvent.DamageApplied("pc:Aldric", "monster:Goblin:0", 5, -4);
        assertEquals(serializer.toJson(a), serializer.toJson(b));

        JsonObject json = JsonParser.parseString(serializer.toJson(a)).getAsJsonObject();
        assertEquals("DamageApplied", json.get("kind").getAsString());
        assertEquals(-4, json.get("hp_after").getAsInt());
    }

    @Test
    void testEventListToJsonArray() {
        JsonArray array = JsonParser.parseString(serializer.toJson(List.of(
                new EncounterEvent.RoundStarted(1),
                new EncounterEvent.TurnSkipped("monster:Goblin:0", "held")))).getAsJsonArray();

        assertEquals(2, array.size());
        assertEquals("RoundStarted", array.get(0).getAsJsonObject().get("kind").getAsString());
        assertEquals("held", array.get(1).getAsJsonObject().get("reason").getAsString());
    }

    @Test
    @DisplayName("Every event of an encounter maps with its own kind")
    void kindMatchesEventType() {
        FixedDiceService dice = new FixedDiceService(6, 1, 15, 5);
        EncounterEngine engine = engine(List.of(fighter("Aldric", 10)), List.of(goblin(1)), dice,
                config().withTurnOrder(TurnOrderPolicy.INITIATIVE));
        engine.stepUntilDecision();
        engine.stepUntilDecision(new ActionIntent.MeleeAttack("pc:Aldric", "monster:Goblin:0"));

        assertTrue(engine.getEvents().size() > 5);
        for (EncounterEvent event : engine.getEvents()) {
            assertEquals(event.getClass().getSimpleName(), serializer.toMap(event).get("kind"));
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void testNestedValueRecords() {
        Map<String, Object> rejected = serializer.toMap(new EncounterEvent.ActionRejected("pc:Aldric",
                List.of(new Rejection(RejectionCode.DUPLICATE_TARGET, "twice"))));
        assertEquals(List.of(Map.of("code", "DUPLICATE_TARGET", "message", "twice")), rejected.get("reasons"));

        Map<String, Object> initiative = serializer.toMap(new EncounterEvent.InitiativeRolled(
                List.of(new InitiativeEntry("pc:Aldric", 6))));
        assertEquals(List.of(Map.of("combatant_id", "pc:Aldric", "roll", 6)), initiative.get("order"));

        Map<String, Object> faulted = serializer.toMap(
                new EncounterEvent.EncounterFaulted(EncounterState.VALIDATE_INTENT, "IllegalStateException", "boom"));
        assertEquals(List.of("kind", "state", "error_type", "message"), List.copyOf(faulted.keySet()));
        assertEquals("VALIDATE_INTENT", faulted.get("state"));

        Map<String, Object> intent = serializer.intentToMap(new ActionIntent.CastSpell("pc:Mage", "sleep", 1, List.of()));
        assertEquals("CastSpell", intent.get("kind"));
        assertEquals(1, intent.get("slot_level"));
        assertEquals(List.of(), intent.get("target_ids"));
    }

    @Test
    void testNullEventRejected() {
        assertThrows(IllegalArgumentException.class, () -> serializer.toMap(null));
    }
}
