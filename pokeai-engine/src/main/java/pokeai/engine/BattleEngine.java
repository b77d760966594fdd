package pokeai.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pokeai.data.Dex;
import pokeai.data.EffectTable;
import pokeai.data.FormatRegistry;
import pokeai.data.FormatRules;
import pokeai.data.Ids;
import pokeai.engine.action.BattleAction;
import pokeai.engine.action.LegalAction;
import pokeai.engine.action.LegalActionGenerator;
import pokeai.engine.calc.CalcResult;
import pokeai.engine.calc.OutcomeCalculator;
import pokeai.engine.effect.BattleContext;
import pokeai.engine.effect.EffectLookup;
import pokeai.engine.error.InvalidActionException;
import pokeai.engine.error.MissingEntityException;
import pokeai.engine.error.UnsupportedFormatException;
import pokeai.engine.turn.TurnResolver;
import pokeai.model.BattlePhase;
import pokeai.model.BattleState;
import pokeai.model.EventType;
import pokeai.model.SideId;

import java.util.Collections;
import java.util.List;

/**
 * Entry point of the engine: Evaluate scores candidate actions without side effects, Advance
 * resolves a turn on a copy of the state. Both check the format first and fail closed.
 * Instances are immutable and may be shared between threads.
 */
public final class BattleEngine {
    private static final Logger log = LoggerFactory.getLogger(BattleEngine.class);

    private final Dex dex;
    private final FormatRegistry formats;
    private final EffectLookup effects;
    private final LegalActionGenerator legalActions;
    private final OutcomeCalculator calculator;
    private final TurnResolver resolver;

    public BattleEngine() {
        this(Dex.standard(), EffectTable.standard(), FormatRegistry.standard());
    }

    public BattleEngine(Dex dex, EffectTable effectTable, FormatRegistry formats) {
        this.dex = dex;
        this.formats = formats;
        this.effects = new EffectLookup(effectTable);
        this.legalActions = new LegalActionGenerator(dex, effects);
        this.calculator = new OutcomeCalculator(dex, effects);
        this.resolver = new TurnResolver(dex, effects);
    }

    public Dex getDex() {
        return dex;
    }

    public FormatRegistry getFormats() {
        return formats;
    }

    public OutcomeCalculator getCalculator() {
        return calculator;
    }

    /** The rules of a supported format. */
    public FormatRules format(String formatId) {
        FormatRules rules = formats.find(formatId);
        if (rules == null) {
            throw new UnsupportedFormatException("Unsupported format: " + formatId);
        }
        return rules;
    }

    public List<CalcResult> evaluate(EvaluateRequest request) {
        FormatRules format = gate(request.getFormat(), request.getState());
        List<BattleAction> actions = request.getActions();
        if (actions.isEmpty()) {
            try {
                actions = legalActions.enabledActions(request.getState(), request.getSide(), format);
            } catch (MissingEntityException e) {
                return Collections.singletonList(CalcResult.error("", format.getId(), e.getKind(), e.getMessage()));
            }
        }
        return calculator.evaluateAll(request.getState(), request.getSide(), actions, format, request.getBelief());
    }

    public List<LegalAction> legalActions(String formatId, BattleState state, SideId side) {
        FormatRules format = gate(formatId, state);
        return legalActions.generate(state, side, format);
    }

    public List<BattleAction> enabledActions(String formatId, BattleState state, SideId side) {
        FormatRules format = gate(formatId, state);
        return legalActions.enabledActions(state, side, format);
    }

    /**
     * Resolves one turn. The request's state is left untouched.
     *
     * @throws InvalidActionException when the battle is over or an action is not currently legal
     */
    public AdvanceResult advance(AdvanceRequest request) {
        BattleState state = request.getState();
        FormatRules format = gate(request.getFormat(), state);
        if (state.isFinished()) {
            throw new InvalidActionException("Battle " + state.getId() + " is already finished");
        }
        if (state.getPhase() != BattlePhase.BATTLE) {
            throw new InvalidActionException("Battle " + state.getId() + " has not started");
        }
        requireLegal(state, SideId.P1, request.getP1Action(), format);
        requireLegal(state, SideId.P2, request.getP2Action(), format);

        BattleState next = state.copy();
        BattleContext ctx = new BattleContext(next, effects);
        resolver.resolve(ctx, format, request.getP1Action(), request.getP2Action());
        next.appendLog(ctx.getEvents());
        Invariants.check(next);
        log.debug("Battle {} advanced to turn {} with {} events", next.getId(), next.getTurn(), ctx.getEvents().size());
        return new AdvanceResult(next, ctx.getEvents());
    }

    /**
     * Sends out both leads and applies their switch-in effects. The state must be fresh.
     */
    public AdvanceResult start(BattleState state) {
        gate(state.getFormat(), state);
        if (state.getPhase() != BattlePhase.PREPARATION && state.getPhase() != BattlePhase.TEAM_PREVIEW) {
            throw new InvalidActionException("Battle " + state.getId() + " has already started");
        }
        Invariants.check(state);
        BattleState next = state.copy();
        next.setPhase(BattlePhase.BATTLE);
        BattleContext ctx = new BattleContext(next, effects);
        ctx.emit(EventType.TURN_START, null, null, null, 0);
        resolver.sendOutLeads(ctx);
        next.appendLog(ctx.getEvents());
        Invariants.check(next);
        log.debug("Battle {} started in {}", next.getId(), next.getFormat());
        return new AdvanceResult(next, ctx.getEvents());
    }

    private void requireLegal(BattleState state, SideId side, BattleAction action, FormatRules format) {
        List<BattleAction> enabled = legalActions.enabledActions(state, side, format);
        if (!enabled.contains(action)) {
            throw new InvalidActionException(side + " action " + action.notation() + " is not legal; expected one of "
                    + enabled);
        }
    }

    private FormatRules gate(String formatId, BattleState state) {
        FormatRules format = format(formatId);
        if (state != null && !Ids.same(state.getFormat(), format.getId())) {
            throw new UnsupportedFormatException("Request format " + formatId + " does not match battle format "
                    + state.getFormat());
        }
        return format;
    }
}
