package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CombatContext;
import com.example.skirmish.combat.Combatant;
import com.example.skirmish.combat.Effect;
import com.example.skirmish.combat.EncounterEvent;
import com.example.skirmish.combat.Rejection;
import com.example.skirmish.combat.RejectionCode;
import com.example.skirmish.spell.ItemDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Throw a consumable at an enemy or use it on oneself. Thrown items always hit.
 */
public class UseItemAction extends AbstractCombatAction {
    
    private final String itemName;
    private final List<String> targetIds;
    
    public UseItemAction(String actorId, String itemName, List<String> targetIds) {
        super(actorId);
        this.itemName = itemName;
        this.targetIds = List.copyOf(targetIds);
    }
    
    @Override
    public List<Rejection> validate(CombatContext ctx) {
        List<Rejection> rejections = new ArrayList<>();
        Optional<Combatant> maybeActor = validateActor(ctx, rejections);
        if (maybeActor.isEmpty()) {
            return rejections;
        }
        Combatant actor = maybeActor.get();
        
        Optional<ItemDefinition> item = ctx.getItems().find(itemName);
        if (item.isEmpty()) {
            rejections.add(new Rejection(RejectionCode.UNKNOWN_ITEM, itemName + " cannot be used in combat"));
            return rejections;
        }
        if (actor.getItemCount(itemName) <= 0) {
            rejections.add(new Rejection(RejectionCode.ITEM_NOT_IN_INVENTORY, actor.getName() + " has no " + itemName));
        }
        
        if (item.get().isThrowable()) {
            if (targetIds.size() != 1) {
                rejections.add(new Rejection(RejectionCode.INVALID_TARGET, itemName + " needs exactly one target"));
            } else {
                validateOpponent(ctx, actor, targetIds.get(0), rejections);
            }
        } else if (!targetIds.isEmpty() && !(targetIds.size() == 1 && targetIds.get(0).equals(actorId))) {
            rejections.add(new Rejection(RejectionCode.ITEM_NOT_THROWABLE, itemName + " can only be used on oneself"));
        }
        return rejections;
    }
    
    @Override
    public ActionResult execute(CombatContext ctx) {
        ItemDefinition item = ctx.getItems().find(itemName)
                .orElseThrow(() -> new IllegalStateException("Item vanished from catalog: " + itemName));
        String targetId = item.isThrowable() ? targetIds.get(0) : actorId;
        
        List<EncounterEvent> events = List.of(new EncounterEvent.ItemUsed(actorId, item.name(), List.of(targetId)));
        List<Effect> effects = new ArrayList<>();
        effects.add(new Effect.ConsumeItem(actorId, item.name()));
        if (item.damageDie() != null) {
            effects.add(new Effect.Damage(actorId, targetId, Math.max(0, ctx.getDice().roll(item.damageDie()))));
        }
        if (item.healDie() != null) {
            effects.add(new Effect.Heal(actorId, targetId, Math.max(0, ctx.getDice().roll(item.healDie()))));
        }
        return new ActionResult(events, effects);
    }
}
