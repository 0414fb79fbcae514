package com.example.skirmish.view;

import com.example.skirmish.combat.ActionChoice;
import com.example.skirmish.combat.ActionIntent;
import com.example.skirmish.combat.EncounterEvent;
import com.example.skirmish.combat.InitiativeEntry;
import com.example.skirmish.combat.Rejection;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts events into plain maps and JSON for logs, replays and UIs.
 *
 * Each event becomes a map with a {@code kind} discriminator (the event's
 * simple name) followed by its fields in snake_case. Enums become their
 * names, nested intents carry their own {@code kind}, and action choices get
 * a derived {@code label}. {@link #normalize} is idempotent, so serializing
 * already-serialized output changes nothing.
 */
public class EventSerializer {

    public static final String KIND = "kind";

    private final Gson gson = new GsonBuilder().serializeNulls().create();
    private final EventMapper eventMapper = new EventMapper();
    private final IntentMapper intentMapper = new IntentMapper();

    public Map<String, Object> toMap(EncounterEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        return event.accept(eventMapper);
    }

    public List<Map<String, Object>> toMaps(List<EncounterEvent> events) {
        List<Map<String, Object>> maps = new ArrayList<>();
        for (EncounterEvent event : events) {
            maps.add(toMap(event));
        }
        return maps;
    }

    public String toJson(EncounterEvent event) {
        return gson.toJson(toMap(event));
    }

    public String toJson(List<EncounterEvent> events) {
        return gson.toJson(toMaps(events));
    }

    public Map<String, Object> intentToMap(ActionIntent intent) {
        return intent.accept(intentMapper);
    }

    /**
     * Reduce a value to strings, numbers, booleans, nulls, lists and
     * string-keyed maps.
     */
    public Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof EncounterEvent event) {
            return toMap(event);
        }
        if (value instanceof ActionIntent intent) {
            return intentToMap(intent);
        }
        if (value instanceof ActionChoice choice) {
            return choiceMap(choice);
        }
        if (value instanceof Rejection rejection) {
            return new Fields().put("code", rejection.code()).put("message", rejection.message()).map;
        }
        if (value instanceof InitiativeEntry entry) {
            return new Fields().put("combatant_id", entry.combatantId()).put("roll", entry.roll()).map;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                out.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
            }
            return out;
        }
        if (value instanceof Collection<?> items) {
            List<Object> out = new ArrayList<>();
            for (Object item : items) {
                out.add(normalize(item));
            }
            return out;
        }
        return value.toString();
    }

    private Map<String, Object> choiceMap(ActionChoice choice) {
        return new Fields()
                .put("ui_key", choice.uiKey())
                .put("ui_args", choice.uiArgs())
                .put("intent", choice.intent())
                .put("label", choice.label())
                .map;
    }

    /** Ordered field map; values are normalized as they are added. */
    private final class Fields {

        private final Map<String, Object> map = new LinkedHashMap<>();

        Fields() {}

        Fields(String kind) {
            map.put(KIND, kind);
        }

        Fields put(String key, Object value) {
            map.put(key, normalize(value));
            return this;
        }
    }

    private final class IntentMapper implements ActionIntent.Visitor<Map<String, Object>> {

        @Override
        public Map<String, Object> visitMeleeAttack(ActionIntent.MeleeAttack intent) {
            return new Fields("MeleeAttack").put("actor_id", intent.actorId()).put("target_id", intent.targetId()).map;
        }

        @Override
        public Map<String, Object> visitRangedAttack(ActionIntent.RangedAttack intent) {
            return new Fields("RangedAttack").put("actor_id", intent.actorId()).put("target_id", intent.targetId()).map;
        }

        @Override
        public Map<String, Object> visitCastSpell(ActionIntent.CastSpell intent) {
            return new Fields("CastSpell")
                    .put("actor_id", intent.actorId())
                    .put("spell_id", intent.spellId())
                    .put("slot_level", intent.slotLevel())
                    .put("target_ids", intent.targetIds())
                    .map;
        }

        @Override
        public Map<String, Object> visitUseItem(ActionIntent.UseItem intent) {
            return new Fields("UseItem")
                    .put("actor_id", intent.actorId())
                    .put("item_name", intent.itemName())
                    .put("target_ids", intent.targetIds())
                    .map;
        }

        @Override
        public Map<String, Object> visitFlee(ActionIntent.Flee intent) {
            return new Fields("Flee").put("actor_id", intent.actorId()).map;
        }
    }

    private final class EventMapper implements EncounterEvent.Visitor<Map<String, Object>> {

        @Override
        public Map<String, Object> visitEncounterStarted(EncounterEvent.EncounterStarted e) {
            return new Fields("EncounterStarted")
                    .put("encounter_id", e.encounterId())
                    .put("combatant_ids", e.combatantIds())
                    .map;
        }

        @Override
        public Map<String, Object> visitRoundStarted(EncounterEvent.RoundStarted e) {
            return new Fields("RoundStarted").put("round", e.round()).map;
        }

        @Override
        public Map<String, Object> visitInitiativeRolled(EncounterEvent.InitiativeRolled e) {
            return new Fields("InitiativeRolled").put("order", e.order()).map;
        }

        @Override
        public Map<String, Object> visitTurnQueueBuilt(EncounterEvent.TurnQueueBuilt e) {
            return new Fields("TurnQueueBuilt").put("queue", e.queue()).map;
        }

        @Override
        public Map<String, Object> visitTurnStarted(EncounterEvent.TurnStarted e) {
            return new Fields("TurnStarted").put("combatant_id", e.combatantId()).put("round", e.round()).map;
        }

        @Override
        public Map<String, Object> visitTurnSkipped(EncounterEvent.TurnSkipped e) {
            return new Fields("TurnSkipped").put("combatant_id", e.combatantId()).put("reason", e.reason()).map;
        }

        @Override
        public Map<String, Object> visitNeedAction(EncounterEvent.NeedAction e) {
            return new Fields("NeedAction").put("combatant_id", e.combatantId()).put("choices", e.choices()).map;
        }

        @Override
        public Map<String, Object> visitActionRejected(EncounterEvent.ActionRejected e) {
            return new Fields("ActionRejected").put("combatant_id", e.combatantId()).put("reasons", e.reasons()).map;
        }

        @Override
        public Map<String, Object> visitAttackRolled(EncounterEvent.AttackRolled e) {
            return new Fields("AttackRolled")
                    .put("attacker_id", e.attackerId())
                    .put("defender_id", e.defenderId())
                    .put("roll", e.roll())
                    .put("total", e.total())
                    .put("needed", e.needed())
                    .put("hit", e.hit())
                    .put("critical", e.critical())
                    .map;
        }

        @Override
        public Map<String, Object> visitDamageApplied(EncounterEvent.DamageApplied e) {
            return new Fields("DamageApplied")
                    .put("source_id", e.sourceId())
                    .put("target_id", e.targetId())
                    .put("amount", e.amount())
                    .put("hp_after", e.hpAfter())
                    .map;
        }

        @Override
        public Map<String, Object> visitHealingApplied(EncounterEvent.HealingApplied e) {
            return new Fields("HealingApplied")
                    .put("source_id", e.sourceId())
                    .put("target_id", e.targetId())
                    .put("amount", e.amount())
                    .put("hp_after", e.hpAfter())
                    .map;
        }

        @Override
        public Map<String, Object> visitSpellCast(EncounterEvent.SpellCast e) {
            return new Fields("SpellCast")
                    .put("caster_id", e.casterId())
                    .put("spell_id", e.spellId())
                    .put("spell_name", e.spellName())
                    .put("target_ids", e.targetIds())
                    .map;
        }

        @Override
        public Map<String, Object> visitSpellSlotConsumed(EncounterEvent.SpellSlotConsumed e) {
            return new Fields("SpellSlotConsumed")
                    .put("caster_id", e.casterId())
                    .put("level", e.level())
                    .put("remaining", e.remaining())
                    .map;
        }

        @Override
        public Map<String, Object> visitSavingThrowRolled(EncounterEvent.SavingThrowRolled e) {
            return new Fields("SavingThrowRolled")
                    .put("target_id", e.targetId())
                    .put("spell_name", e.spellName())
                    .put("roll", e.roll())
                    .put("total", e.total())
                    .put("target_number", e.targetNumber())
                    .put("success", e.success())
                    .map;
        }

        @Override
        public Map<String, Object> visitGroupTargetsResolved(EncounterEvent.GroupTargetsResolved e) {
            return new Fields("GroupTargetsResolved")
                    .put("spell_name", e.spellName())
                    .put("pool_roll", e.poolRoll())
                    .put("target_ids", e.targetIds())
                    .map;
        }

        @Override
        public Map<String, Object> visitConditionApplied(EncounterEvent.ConditionApplied e) {
            return new Fields("ConditionApplied")
                    .put("source_id", e.sourceId())
                    .put("target_id", e.targetId())
                    .put("condition_id", e.conditionId())
                    .put("duration", e.duration())
                    .map;
        }

        @Override
        public Map<String, Object> visitConditionExpired(EncounterEvent.ConditionExpired e) {
            return new Fields("ConditionExpired")
                    .put("combatant_id", e.combatantId())
                    .put("condition_id", e.conditionId())
                    .put("reason", e.reason())
                    .map;
        }

        @Override
        public Map<String, Object> visitModifierApplied(EncounterEvent.ModifierApplied e) {
            return new Fields("ModifierApplied")
                    .put("source_id", e.sourceId())
                    .put("target_id", e.targetId())
                    .put("modifier_id", e.modifierId())
                    .put("stat", e.stat())
                    .put("value", e.value())
                    .put("duration", e.duration())
                    .map;
        }

        @Override
        public Map<String, Object> visitModifierExpired(EncounterEvent.ModifierExpired e) {
            return new Fields("ModifierExpired")
                    .put("combatant_id", e.combatantId())
                    .put("modifier_id", e.modifierId())
                    .map;
        }

        @Override
        public Map<String, Object> visitItemUsed(EncounterEvent.ItemUsed e) {
            return new Fields("ItemUsed")
                    .put("actor_id", e.actorId())
                    .put("item_name", e.itemName())
                    .put("target_ids", e.targetIds())
                    .map;
        }

        @Override
        public Map<String, Object> visitItemConsumed(EncounterEvent.ItemConsumed e) {
            return new Fields("ItemConsumed")
                    .put("actor_id", e.actorId())
                    .put("item_name", e.itemName())
                    .put("remaining", e.remaining())
                    .map;
        }

        @Override
        public Map<String, Object> visitMoraleChecked(EncounterEvent.MoraleChecked e) {
            return new Fields("MoraleChecked")
                    .put("morale", e.morale())
                    .put("roll", e.roll())
                    .put("passed", e.passed())
                    .put("trigger", e.trigger())
                    .put("checks_passed", e.checksPassed())
                    .put("immune", e.immune())
                    .map;
        }

        @Override
        public Map<String, Object> visitEntityDied(EncounterEvent.EntityDied e) {
            return new Fields("EntityDied").put("combatant_id", e.combatantId()).map;
        }

        @Override
        public Map<String, Object> visitEntityFled(EncounterEvent.EntityFled e) {
            return new Fields("EntityFled").put("combatant_id", e.combatantId()).put("side", e.side()).map;
        }

        @Override
        public Map<String, Object> visitVictoryDetermined(EncounterEvent.VictoryDetermined e) {
            return new Fields("VictoryDetermined").put("outcome", e.outcome()).map;
        }

        @Override
        public Map<String, Object> visitEncounterFaulted(EncounterEvent.EncounterFaulted e) {
            return new Fields("EncounterFaulted")
                    .put("state", e.state())
                    .put("error_type", e.errorType())
                    .put("message", e.message())
                    .map;
        }
    }
}
