package pokeai.engine.turn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pokeai.data.Dex;
import pokeai.data.FormatRules;
import pokeai.data.Move;
import pokeai.data.Species;
import pokeai.data.VolatileKind;
import pokeai.engine.action.ActionVisitor;
import pokeai.engine.action.BattleAction;
import pokeai.engine.action.DynamaxAction;
import pokeai.engine.action.MegaAction;
import pokeai.engine.action.MoveAction;
import pokeai.engine.action.MoveBasedAction;
import pokeai.engine.action.PassAction;
import pokeai.engine.action.SwitchAction;
import pokeai.engine.action.TeraAction;
import pokeai.engine.action.ZMoveAction;
import pokeai.engine.calc.AttackProfile;
import pokeai.engine.calc.MoveMode;
import pokeai.engine.calc.PriorityRules;
import pokeai.engine.calc.StatCalculator;
import pokeai.engine.effect.BattleContext;
import pokeai.engine.effect.EffectLookup;
import pokeai.engine.effect.EndOfTurnProcessor;
import pokeai.engine.effect.FieldMachine;
import pokeai.engine.effect.FormeChanges;
import pokeai.engine.effect.StatChanges;
import pokeai.engine.effect.StatusMachine;
import pokeai.engine.effect.VolatileMachine;
import pokeai.engine.error.InvalidActionException;
import pokeai.model.BattlePhase;
import pokeai.model.BattleState;
import pokeai.model.EventType;
import pokeai.model.Pokemon;
import pokeai.model.Side;
import pokeai.model.SideId;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves one turn, or one forced-switch window, on a working copy of the battle state.
 * Switches go first, then transformations, then moves by priority and speed, then end of turn.
 */
public final class TurnResolver {
    private static final Logger log = LoggerFactory.getLogger(TurnResolver.class);

    private final Dex dex;
    private final StatCalculator stats;
    private final PriorityRules priorities;
    private final SwitchHandler switches;
    private final MoveExecutor moves;
    private final EndOfTurnProcessor endOfTurn;

    public TurnResolver(Dex dex, EffectLookup effects) {
        this.dex = dex;
        this.stats = new StatCalculator(effects);
        this.priorities = new PriorityRules(effects);
        StatusMachine status = new StatusMachine(effects);
        VolatileMachine volatiles = new VolatileMachine(effects);
        FieldMachine field = new FieldMachine(effects);
        StatChanges statChanges = new StatChanges(effects);
        this.switches = new SwitchHandler(effects, status, volatiles, field, statChanges);
        this.moves = new MoveExecutor(dex, effects, status, volatiles,
                new MoveEffectApplier(status, volatiles, field, statChanges));
        this.endOfTurn = new EndOfTurnProcessor(effects, status, volatiles, field);
    }

    public void resolve(BattleContext ctx, FormatRules format, BattleAction p1Action, BattleAction p2Action) {
        Map<SideId, BattleAction> actions = new EnumMap<>(SideId.class);
        actions.put(SideId.P1, p1Action);
        actions.put(SideId.P2, p2Action);
        BattleState state = ctx.getState();
        if (state.isAwaitingReplacement()) {
            replace(ctx, actions);
        } else {
            playTurn(ctx, format, actions);
        }
        for (SideId side : SideId.values()) {
            state.setLastAction(side, actions.get(side).notation());
        }
        decideWinner(ctx);
        ctx.commitRandom();
    }

    /** Sends out both leads, faster first, with their switch-in effects. */
    public void sendOutLeads(BattleContext ctx) {
        List<QueuedAction> leads = new ArrayList<>();
        for (SideId side : SideId.values()) {
            Side own = ctx.side(side);
            Pokemon lead = own.getActive();
            leads.add(new QueuedAction(side, BattleAction.switchTo(own.getActiveIndex()), QueuedAction.BRACKET_SWITCH,
                    PriorityRules.SWITCH_PRIORITY, stats.speed(ctx.getState(), own, lead), ctx.getRandom().nextLong()));
        }
        for (QueuedAction queued : ActionOrdering.order(leads, ctx.getState().isTrickRoom())) {
            switches.sendOut(ctx, queued.getSide());
        }
        ctx.commitRandom();
    }

    /** The forced-switch window: replacements only, no end-of-turn effects. */
    private void replace(BattleContext ctx, Map<SideId, BattleAction> actions) {
        for (SideId side : SideId.values()) {
            BattleAction action = actions.get(side);
            if (!ctx.side(side).needsReplacement()) {
                if (!(action instanceof PassAction)) {
                    throw new InvalidActionException(side + " has no replacement to make; only pass is allowed");
                }
                continue;
            }
            if (!(action instanceof SwitchAction)) {
                throw new InvalidActionException(side + " must switch in a replacement");
            }
            switches.switchTo(ctx, side, ((SwitchAction) action).getSlot(), true);
        }
        log.debug("Replacement window resolved on turn {}", ctx.getState().getTurn());
    }

    private void playTurn(BattleContext ctx, FormatRules format, Map<SideId, BattleAction> actions) {
        BattleState state = ctx.getState();
        state.setTurn(state.getTurn() + 1);
        ctx.emit(EventType.TURN_START, null, null, null, state.getTurn());
        ResolutionPhase phase = ResolutionPhase.QUEUED;

        Map<SideId, Long> tieBreaks = new EnumMap<>(SideId.class);
        for (SideId side : SideId.values()) {
            tieBreaks.put(side, ctx.getRandom().nextLong());
        }

        List<QueuedAction> switchQueue = new ArrayList<>();
        for (SideId side : SideId.values()) {
            if (actions.get(side) instanceof SwitchAction) {
                switchQueue.add(queue(ctx, side, actions.get(side), tieBreaks.get(side)));
            }
        }
        Set<SideId> acted = EnumSet.noneOf(SideId.class);
        phase = logPhase(phase, ResolutionPhase.PRIORITY_SORTED);
        for (QueuedAction queued : ActionOrdering.order(switchQueue, state.isTrickRoom())) {
            switches.switchTo(ctx, queued.getSide(), ((SwitchAction) queued.getAction()).getSlot(), false);
            acted.add(queued.getSide());
        }

        phase = logPhase(phase, ResolutionPhase.RESOLVING);
        List<QueuedAction> transformQueue = new ArrayList<>();
        for (SideId side : SideId.values()) {
            if (actions.get(side) instanceof MoveBasedAction) {
                transformQueue.add(queue(ctx, side, actions.get(side), tieBreaks.get(side)));
            }
        }
        for (QueuedAction queued : ActionOrdering.order(transformQueue, state.isTrickRoom())) {
            queued.getAction().accept(new Transformer(ctx, queued.getSide(), format));
        }

        List<QueuedAction> moveQueue = new ArrayList<>();
        for (SideId side : SideId.values()) {
            BattleAction action = actions.get(side);
            if (action instanceof MoveBasedAction || action instanceof PassAction) {
                moveQueue.add(queue(ctx, side, action, tieBreaks.get(side)));
            }
        }
        for (QueuedAction queued : ActionOrdering.order(moveQueue, state.isTrickRoom())) {
            SideId side = queued.getSide();
            BattleAction action = queued.getAction();
            if (action instanceof MoveBasedAction) {
                MoveMode mode = action instanceof ZMoveAction ? MoveMode.Z_MOVE : MoveMode.NORMAL;
                moves.execute(ctx, side, ((MoveBasedAction) action).getMoveId(), mode, format,
                        acted.contains(side.opponent()));
            } else {
                Pokemon active = ctx.side(side).getActive();
                if (active != null && active.getVolatiles().has(VolatileKind.RECHARGE)) {
                    ctx.emit(EventType.CANT_MOVE, side, active, "recharge");
                }
            }
            acted.add(side);
        }

        if (!anySideDefeated(state)) {
            phase = logPhase(phase, ResolutionPhase.END_OF_TURN);
            endOfTurn.run(ctx);
        }
        logPhase(phase, ResolutionPhase.ADVANCED);
    }

    private ResolutionPhase logPhase(ResolutionPhase from, ResolutionPhase to) {
        log.trace("{} -> {}", from, to);
        return to;
    }

    private QueuedAction queue(BattleContext ctx, SideId side, BattleAction action, long tieBreak) {
        Side own = ctx.side(side);
        Pokemon active = own.getActive();
        int speed = active == null || active.isFainted() ? 0 : stats.speed(ctx.getState(), own, active);
        if (action instanceof SwitchAction) {
            return new QueuedAction(side, action, QueuedAction.BRACKET_SWITCH, PriorityRules.SWITCH_PRIORITY, speed,
                    tieBreak);
        }
        if (action instanceof MoveBasedAction && active != null && !active.isFainted()) {
            Move move = dex.move(((MoveBasedAction) action).getMoveId());
            if (move == null) {
                throw new InvalidActionException("Unknown move " + ((MoveBasedAction) action).getMoveId());
            }
            MoveMode mode = active.isDynamaxed() ? MoveMode.MAX_MOVE
                    : action instanceof ZMoveAction ? MoveMode.Z_MOVE : MoveMode.NORMAL;
            int priority = priorities.priority(ctx.getState(), active, ctx.foeOf(side), AttackProfile.of(move, mode));
            return new QueuedAction(side, action, QueuedAction.BRACKET_MOVE, priority, speed, tieBreak);
        }
        return new QueuedAction(side, action, QueuedAction.BRACKET_PASS, 0, speed, tieBreak);
    }

    private static boolean anySideDefeated(BattleState state) {
        return state.getP1().allFainted() || state.getP2().allFainted();
    }

    private void decideWinner(BattleContext ctx) {
        BattleState state = ctx.getState();
        boolean p1Out = state.getP1().allFainted();
        boolean p2Out = state.getP2().allFainted();
        if (!p1Out && !p2Out) {
            return;
        }
        state.setPhase(BattlePhase.FINISHED);
        if (p1Out && p2Out) {
            state.setWinner(null);
            ctx.emit(EventType.TIE, null, null);
        } else {
            SideId winner = p1Out ? SideId.P2 : SideId.P1;
            state.setWinner(winner);
            ctx.emit(EventType.WIN, winner, state.getSide(winner).getName());
        }
        log.debug("Battle {} finished on turn {}, winner {}", state.getId(), state.getTurn(), state.getWinner());
    }

    /** Terastallization, mega evolution and dynamax, applied before any move of the turn. */
    private final class Transformer implements ActionVisitor<Void> {
        private final BattleContext ctx;
        private final SideId sideId;
        private final Side side;
        private final FormatRules format;

        Transformer(BattleContext ctx, SideId sideId, FormatRules format) {
            this.ctx = ctx;
            this.sideId = sideId;
            this.side = ctx.side(sideId);
            this.format = format;
        }

        @Override
        public Void visitTera(TeraAction action) {
            Pokemon active = active();
            if (!format.allowsTera() || side.isTeraUsed() || !active.getTera().isAvailable()) {
                throw new InvalidActionException(active.getName() + " cannot terastallize");
            }
            active.terastallize();
            side.setTeraUsed(true);
            for (Pokemon member : side.getTeam()) {
                if (member != active) {
                    member.getTera().forfeit();
                }
            }
            ctx.emit(EventType.TERASTALLIZE, sideId, active, active.getTera().getType().name().toLowerCase());
            return null;
        }

        @Override
        public Void visitMega(MegaAction action) {
            Pokemon active = active();
            Species mega = dex.megaForme(active.getSpecies(), active.getItem());
            if (!format.allowsMega() || side.isMegaUsed() || mega == null) {
                throw new InvalidActionException(active.getName() + " cannot mega evolve");
            }
            FormeChanges.megaEvolve(active, mega);
            side.setMegaUsed(true);
            ctx.emit(EventType.MEGA_EVOLVE, sideId, active, mega.getId());
            return null;
        }

        @Override
        public Void visitDynamax(DynamaxAction action) {
            Pokemon active = active();
            if (!format.allowsDynamax() || side.isDynamaxUsed() || active.isDynamaxed()) {
                throw new InvalidActionException(active.getName() + " cannot dynamax");
            }
            active.getVolatiles().remove(VolatileKind.CHOICE_LOCK);
            FormeChanges.dynamax(active);
            side.setDynamaxUsed(true);
            ctx.emit(EventType.DYNAMAX, sideId, active, null, active.getMaxHp());
            return null;
        }

        @Override
        public Void visitMove(MoveAction action) {
            return null;
        }

        @Override
        public Void visitZMove(ZMoveAction action) {
            return null;
        }

        @Override
        public Void visitSwitch(SwitchAction action) {
            return null;
        }

        @Override
        public Void visitPass(PassAction action) {
            return null;
        }

        private Pokemon active() {
            Pokemon active = side.getActive();
            if (active == null || active.isFainted()) {
                throw new InvalidActionException(side.getName() + " has no active Pokemon to transform");
            }
            return active;
        }
    }
}
