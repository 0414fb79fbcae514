package com.example.skirmish.combat;

import com.example.skirmish.ai.RandomTacticalProvider;
import com.example.skirmish.ai.TacticalProvider;
import com.example.skirmish.combat.action.ActionFactory;
import com.example.skirmish.combat.action.ActionResult;
import com.example.skirmish.combat.action.CombatAction;
import com.example.skirmish.config.EngineConfig;
import com.example.skirmish.config.TurnOrderPolicy;
import com.example.skirmish.model.CombatSide;
import com.example.skirmish.model.Creature;
import com.example.skirmish.spell.ItemCatalog;
import com.example.skirmish.spell.SpellCatalog;
import com.example.skirmish.util.DiceService;
import com.example.skirmish.view.CombatView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turn-based encounter state machine.
 *
 * Each call to {@link #step} runs exactly one state handler and returns the
 * events it produced. The engine suspends in {@link EncounterState#AWAIT_INTENT}
 * whenever a combatant without a {@link TacticalProvider} has to act; the
 * caller then submits that combatant's intent with the next step.
 *
 * All randomness comes from the injected {@link DiceService}, so the same
 * dice sequence and the same submitted intents reproduce the same encounter.
 *
 * Not thread-safe: one encounter is driven by one caller.
 */
public class EncounterEngine {

    private static final Logger logger = LoggerFactory.getLogger(EncounterEngine.class);

    public static final String PARTY_ID_PREFIX = "pc:";
    public static final String MONSTER_ID_PREFIX = "monster:";

    private final String encounterId;
    private final CombatContext ctx;
    private final EffectApplier effectApplier;
    private final ActionFactory actionFactory = new ActionFactory();
    private final ChoiceBuilder choiceBuilder = new ChoiceBuilder();
    private final Map<String, TacticalProvider> providers = new HashMap<>();

    /** Every event emitted so far, append-only */
    private final List<EncounterEvent> eventLog = new ArrayList<>();

    private EncounterState state = EncounterState.INIT;
    private EncounterOutcome outcome;

    /** Submitted or provider-chosen intent awaiting validation */
    private ActionIntent pendingIntent;

    /** Validated action awaiting execution */
    private CombatAction validatedAction;

    /**
     * Create an encounter with configuration and catalogs loaded from the classpath.
     */
    public EncounterEngine(List<Creature> party, List<Creature> opposition, DiceService dice) {
        this(UUID.randomUUID().toString(), party, opposition, dice,
                EngineConfig.load(), SpellCatalog.loadDefault(), ItemCatalog.loadDefault());
    }

    /**
     * @throws IllegalArgumentException if a side is empty or combatant ids collide
     */
    public EncounterEngine(String encounterId, List<Creature> party, List<Creature> opposition, DiceService dice,
                           EngineConfig config, SpellCatalog spells, ItemCatalog items) {
        if (dice == null || config == null || spells == null || items == null) {
            throw new IllegalArgumentException("dice, config and catalogs are required");
        }
        if (party == null || party.isEmpty() || opposition == null || opposition.isEmpty()) {
            throw new IllegalArgumentException("An encounter needs at least one combatant on each side");
        }
        this.encounterId = encounterId != null ? encounterId : UUID.randomUUID().toString();

        List<Combatant> roster = new ArrayList<>();
        for (Creature creature : party) {
            String id = creature.getId() != null ? creature.getId() : PARTY_ID_PREFIX + creature.getName();
            roster.add(new Combatant(id, creature, CombatSide.PARTY));
        }
        for (int i = 0; i < opposition.size(); i++) {
            Creature creature = opposition.get(i);
            String id = creature.getId() != null ? creature.getId()
                    : MONSTER_ID_PREFIX + creature.getName() + ":" + i;
            roster.add(new Combatant(id, creature, CombatSide.MONSTER));
        }
        this.ctx = new CombatContext(roster, dice, spells, items, config);
        this.effectApplier = new EffectApplier(ctx);

        if (config.isAutoAssignOppositionAi()) {
            assignProvider(CombatSide.MONSTER, new RandomTacticalProvider(dice));
        }
    }

    // Provider assignment

    /**
     * Let a provider choose this combatant's actions. A null provider makes
     * the combatant externally driven again.
     * @throws IllegalArgumentException if the id is not in the roster
     */
    public void assignProvider(String combatantId, TacticalProvider provider) {
        ctx.get(combatantId);
        if (provider == null) {
            providers.remove(combatantId);
        } else {
            providers.put(combatantId, provider);
        }
    }

    public void assignProvider(CombatSide side, TacticalProvider provider) {
        for (Combatant c : ctx.getSide(side)) {
            assignProvider(c.getId(), provider);
        }
    }

    public boolean hasProvider(String combatantId) {
        return providers.containsKey(combatantId);
    }

    // Stepping

    public StepResult step() {
        return step(null);
    }

    /**
     * Run one state handler.
     *
     * @param intent intent for the pending combatant, only allowed while the
     *               engine awaits an externally driven combatant; null otherwise
     * @throws EncounterLoopException if the encounter has already ended
     * @throws IllegalStateException if an intent is given when none is awaited
     * @throws IllegalArgumentException if the intent is for another combatant or names an unknown spell
     */
    public StepResult step(ActionIntent intent) {
        if (state == EncounterState.ENDED) {
            throw new EncounterLoopException("Encounter " + encounterId + " has already ended (" + outcome + ")");
        }
        if (intent != null) {
            submit(intent);
        }

        List<EncounterEvent> events = new ArrayList<>();
        EncounterState from = state;
        try {
            switch (state) {
                case INIT:
                    handleInit(events);
                    break;
                case ROUND_START:
                    handleRoundStart(events);
                    break;
                case TURN_START:
                    handleTurnStart(events);
                    break;
                case AWAIT_INTENT:
                    handleAwaitIntent();
                    break;
                case VALIDATE_INTENT:
                    handleValidateIntent(events);
                    break;
                case EXECUTE_ACTION:
                    handleExecuteAction(events);
                    break;
                case CHECK_DEATHS:
                    handleCheckDeaths(events);
                    break;
                case CHECK_MORALE:
                    handleCheckMorale(events);
                    break;
                case CHECK_VICTORY:
                    handleCheckVictory(events);
                    break;
                default:
                    throw new IllegalStateException("No handler for state " + state);
            }
        } catch (RuntimeException e) {
            logger.error("[EncounterEngine] {} faulted in {}: {}", encounterId, from, e.getMessage(), e);
            events.add(new EncounterEvent.EncounterFaulted(from, e.getClass().getSimpleName(), e.getMessage()));
            outcome = EncounterOutcome.FAULTED;
            state = EncounterState.ENDED;
            pendingIntent = null;
            validatedAction = null;
        }

        eventLog.addAll(events);
        if (from != state) {
            logger.debug("[EncounterEngine] {} -> {}", from, state);
        }
        return currentResult(events);
    }

    /**
     * Step until the engine needs an external intent or the encounter ends,
     * using the configured step budget.
     */
    public StepResult stepUntilDecision(ActionIntent intent) {
        return stepUntilDecision(intent, ctx.getConfig().getMaxSteps());
    }

    public StepResult stepUntilDecision() {
        return stepUntilDecision(null);
    }

    /**
     * Step until the engine needs an external intent or the encounter ends.
     * The intent, if any, is applied to the first step only.
     *
     * @return the final state with all events emitted along the way
     * @throws EncounterLoopException if {@code maxSteps} steps pass without reaching a
     *         decision point; the encounter is then ended as FAULTED
     */
    public StepResult stepUntilDecision(ActionIntent intent, int maxSteps) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1: " + maxSteps);
        }
        List<EncounterEvent> collected = new ArrayList<>();
        for (int i = 0; i < maxSteps; i++) {
            StepResult result = step(i == 0 ? intent : null);
            collected.addAll(result.events());
            if (result.needsIntent() || result.isEnded()) {
                return new StepResult(result.state(), result.needsIntent(), result.pendingCombatantId(), collected);
            }
        }

        String message = "No decision point reached within " + maxSteps + " steps (state " + state + ")";
        logger.warn("[EncounterEngine] {} aborted: {}", encounterId, message);
        eventLog.add(new EncounterEvent.EncounterFaulted(state, EncounterLoopException.class.getSimpleName(), message));
        outcome = EncounterOutcome.FAULTED;
        state = EncounterState.ENDED;
        throw new EncounterLoopException(message);
    }

    private void submit(ActionIntent intent) {
        if (!isAwaitingExternalIntent()) {
            throw new IllegalStateException("Engine is not awaiting an intent (state " + state + ")");
        }
        if (!intent.actorId().equals(ctx.getCurrentCombatantId())) {
            throw new IllegalArgumentException("Intent is for " + intent.actorId()
                    + " but the engine awaits " + ctx.getCurrentCombatantId());
        }
        if (intent instanceof ActionIntent.CastSpell cast && !ctx.getSpells().contains(cast.spellId())) {
            throw new IllegalArgumentException("Unknown spell id: " + cast.spellId());
        }
        pendingIntent = intent;
    }

    private boolean isAwaitingExternalIntent() {
        return state == EncounterState.AWAIT_INTENT
                && pendingIntent == null
                && !providers.containsKey(ctx.getCurrentCombatantId());
    }

    private StepResult currentResult(List<EncounterEvent> events) {
        boolean needsIntent = isAwaitingExternalIntent();
        return new StepResult(state, needsIntent, needsIntent ? ctx.getCurrentCombatantId() : null, events);
    }

    // State handlers

    private void handleInit(List<EncounterEvent> events) {
        List<String> ids = ctx.getCombatants().stream().map(Combatant::getId).collect(Collectors.toList());
        events.add(new EncounterEvent.EncounterStarted(encounterId, ids));
        logger.info("[EncounterEngine] Encounter {} started with {} combatants", encounterId, ids.size());
        state = EncounterState.ROUND_START;
    }

    private void handleRoundStart(List<EncounterEvent> events) {
        int round = ctx.nextRound();
        events.add(new EncounterEvent.RoundStarted(round));

        List<Combatant> active = ctx.getCombatants().stream()
                .filter(Combatant::isActive)
                .collect(Collectors.toList());

        List<String> queue;
        if (ctx.getConfig().getTurnOrder() == TurnOrderPolicy.INITIATIVE) {
            List<InitiativeEntry> rolls = new ArrayList<>();
            for (Combatant c : active) {
                rolls.add(new InitiativeEntry(c.getId(), ctx.getDice().roll("1d6")));
            }
            // List.sort is stable, so ties keep roster order
            rolls.sort(Comparator.comparingInt(InitiativeEntry::roll).reversed());
            events.add(new EncounterEvent.InitiativeRolled(rolls));
            queue = rolls.stream().map(InitiativeEntry::combatantId).collect(Collectors.toList());
        } else {
            queue = active.stream().map(Combatant::getId).collect(Collectors.toList());
        }

        ctx.setTurnQueue(queue);
        events.add(new EncounterEvent.TurnQueueBuilt(queue));
        state = EncounterState.TURN_START;
    }

    private void handleTurnStart(List<EncounterEvent> events) {
        String cid = ctx.pollTurnQueue();
        if (cid == null) {
            ctx.setCurrentCombatantId(null);
            state = EncounterState.CHECK_VICTORY;
            return;
        }
        ctx.setCurrentCombatantId(cid);
        Combatant combatant = ctx.get(cid);

        if (combatant.isDead()) {
            events.add(new EncounterEvent.TurnSkipped(cid, "dead"));
            return;
        }
        if (combatant.hasFled()) {
            events.add(new EncounterEvent.TurnSkipped(cid, "fled"));
            return;
        }
        Optional<ConditionType> skip = ctx.getConditions().turnSkippingCondition(cid);
        if (skip.isPresent()) {
            events.add(new EncounterEvent.TurnSkipped(cid, skip.get().getId()));
            return;
        }

        events.add(new EncounterEvent.TurnStarted(cid, ctx.getRoundNumber()));

        if (ctx.getActiveOpponents(combatant).isEmpty()) {
            state = EncounterState.CHECK_VICTORY;
            return;
        }
        requestIntent(combatant, events);
    }

    private void requestIntent(Combatant combatant, List<EncounterEvent> events) {
        List<ActionChoice> choices = choiceBuilder.build(ctx, combatant);
        TacticalProvider provider = providers.get(combatant.getId());
        if (provider != null) {
            pendingIntent = provider.chooseIntent(combatant.getId(), Collections.unmodifiableList(choices), ctx);
            if (pendingIntent == null) {
                throw new IllegalStateException("Provider returned no intent for " + combatant.getId());
            }
            state = EncounterState.VALIDATE_INTENT;
        } else {
            events.add(new EncounterEvent.NeedAction(combatant.getId(), choices));
            state = EncounterState.AWAIT_INTENT;
        }
    }

    private void handleAwaitIntent() {
        if (pendingIntent != null) {
            state = EncounterState.VALIDATE_INTENT;
            return;
        }
        Combatant current = ctx.getCurrentCombatant();
        if (current != null && providers.containsKey(current.getId())) {
            // Provider-driven combatant whose previous choice was rejected
            requestIntent(current, new ArrayList<>());
        }
    }

    private void handleValidateIntent(List<EncounterEvent> events) {
        ActionIntent intent = pendingIntent;
        pendingIntent = null;
        if (intent == null) {
            state = EncounterState.AWAIT_INTENT;
            return;
        }

        CombatAction action = actionFactory.create(intent);
        List<Rejection> reasons = action.validate(ctx);
        if (!reasons.isEmpty()) {
            logger.warn("[EncounterEngine] Rejected {}: {}", intent, reasons);
            events.add(new EncounterEvent.ActionRejected(intent.actorId(), reasons));
            Combatant current = ctx.getCurrentCombatant();
            if (current != null && !providers.containsKey(current.getId())) {
                events.add(new EncounterEvent.NeedAction(current.getId(), choiceBuilder.build(ctx, current)));
            }
            state = EncounterState.AWAIT_INTENT;
            return;
        }
        validatedAction = action;
        state = EncounterState.EXECUTE_ACTION;
    }

    private void handleExecuteAction(List<EncounterEvent> events) {
        CombatAction action = validatedAction;
        validatedAction = null;
        if (action == null) {
            throw new IllegalStateException("No validated action to execute");
        }

        ActionResult result = action.execute(ctx);
        events.addAll(result.events());
        for (Effect effect : result.effects()) {
            events.addAll(effectApplier.apply(effect));
        }
        state = EncounterState.CHECK_DEATHS;
    }

    private void handleCheckDeaths(List<EncounterEvent> events) {
        for (Combatant c : ctx.getCombatants()) {
            if (c.isDead() && ctx.announceDeath(c.getId())) {
                events.add(new EncounterEvent.EntityDied(c.getId()));
            }
        }
        state = EncounterState.CHECK_MORALE;
    }

    private void handleCheckMorale(List<EncounterEvent> events) {
        state = EncounterState.CHECK_VICTORY;
        MoraleState morale = ctx.getMorale();
        if (!ctx.getConfig().isMoraleEnabled() || !morale.isApplicable()) {
            return;
        }
        List<Combatant> monsters = ctx.getSide(CombatSide.MONSTER);
        List<Combatant> active = ctx.getActive(CombatSide.MONSTER);
        if (active.isEmpty()) {
            return;
        }

        long dead = monsters.stream().filter(Combatant::isDead).count();
        long outOfAction = monsters.size() - active.size();
        boolean firstDeath = !morale.hasFired(MoraleTrigger.FIRST_DEATH) && dead > 0;
        boolean halfDown = !morale.hasFired(MoraleTrigger.HALF_INCAPACITATED) && outOfAction * 2 >= monsters.size();
        if (!firstDeath && !halfDown) {
            return;
        }
        // Both thresholds crossed by the same action call for a single check
        MoraleTrigger trigger = firstDeath ? MoraleTrigger.FIRST_DEATH : MoraleTrigger.HALF_INCAPACITATED;
        if (firstDeath) {
            morale.markFired(MoraleTrigger.FIRST_DEATH);
        }
        if (halfDown) {
            morale.markFired(MoraleTrigger.HALF_INCAPACITATED);
        }

        int roll = ctx.getDice().roll("2d6");
        boolean passed = roll <= morale.getMorale();
        if (passed) {
            morale.recordPass();
        } else {
            morale.recordFailure();
        }
        events.add(new EncounterEvent.MoraleChecked(morale.getMorale(), roll, passed, trigger,
                morale.getChecksPassed(), morale.isImmune()));

        if (!passed) {
            logger.info("[EncounterEngine] Opposition morale broke ({} vs {})", roll, morale.getMorale());
            for (Combatant c : active) {
                events.addAll(effectApplier.apply(new Effect.Flee(c.getId())));
            }
        }
    }

    private void handleCheckVictory(List<EncounterEvent> events) {
        if (ctx.getActive(CombatSide.MONSTER).isEmpty()) {
            end(EncounterOutcome.PARTY_VICTORY, events);
        } else if (ctx.getActive(CombatSide.PARTY).isEmpty()) {
            end(EncounterOutcome.OPPOSITION_VICTORY, events);
        } else if (ctx.hasQueuedTurns()) {
            state = EncounterState.TURN_START;
        } else {
            for (ModifierTracker.Expired expired : ctx.getModifiers().tickRound()) {
                events.add(new EncounterEvent.ModifierExpired(expired.combatantId(), expired.modifierId()));
            }
            for (ConditionTracker.Expired expired : ctx.getConditions().tickRound()) {
                events.add(new EncounterEvent.ConditionExpired(expired.combatantId(), expired.conditionId(), "duration"));
            }
            state = EncounterState.ROUND_START;
        }
    }

    private void end(EncounterOutcome result, List<EncounterEvent> events) {
        outcome = result;
        state = EncounterState.ENDED;
        ctx.setCurrentCombatantId(null);
        events.add(new EncounterEvent.VictoryDetermined(result));
        logger.info("[EncounterEngine] Encounter {} ended after {} rounds: {}",
                encounterId, ctx.getRoundNumber(), result);
    }

    // Queries

    public String getEncounterId() { return encounterId; }
    public EncounterState getState() { return state; }

    /** The recorded outcome, or null while the encounter is running. */
    public EncounterOutcome getOutcome() { return outcome; }

    public int getRound() { return ctx.getRoundNumber(); }
    public String getCurrentCombatantId() { return ctx.getCurrentCombatantId(); }

    /** Read access for tactical providers and observers. */
    public CombatContext getContext() { return ctx; }

    /** Copy of every event emitted so far. */
    public List<EncounterEvent> getEvents() {
        return List.copyOf(eventLog);
    }

    /** Immutable snapshot of the encounter as it stands now. */
    public CombatView getView() {
        return CombatView.of(ctx, state, outcome);
    }
}
