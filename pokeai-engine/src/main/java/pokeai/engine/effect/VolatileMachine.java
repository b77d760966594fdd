package pokeai.engine.effect;

import pokeai.data.Capability;
import pokeai.data.Move;
import pokeai.data.PokemonType;
import pokeai.data.Stat;
import pokeai.data.VolatileKind;
import pokeai.engine.BattleRandom;
import pokeai.engine.calc.StatCalculator;
import pokeai.model.EventType;
import pokeai.model.Pokemon;
import pokeai.model.SideId;
import pokeai.model.VolatileState;

import java.util.List;

/**
 * Per-Pokemon temporary conditions: starting them, the gates they impose before a move, their
 * residual effects and their expiry.
 */
public final class VolatileMachine {
    static final double CONFUSION_SELF_HIT_CHANCE = 1.0 / 3;
    static final int CONFUSION_POWER = 40;
    static final double PROTECT_DECAY = 1.0 / 3;

    private final EffectLookup effects;

    public VolatileMachine(EffectLookup effects) {
        this.effects = effects;
    }

    /**
     * Starts a volatile condition on {@code target}.
     *
     * @param source the Pokemon that caused it
     * @return true when the condition was started
     */
    public boolean start(BattleContext ctx, SideId side, Pokemon target, VolatileKind kind, Pokemon source) {
        if (target.isFainted()) {
            return false;
        }
        String failure = null;
        VolatileState state = new VolatileState(kind, kind.getDefaultTurns());
        switch (kind) {
            case CONFUSION:
                state.setCounter(ctx.getRandom().nextInt(2, 5));
                break;
            case ENCORE:
            case DISABLE:
                if (target.getLastMove() == null || Move.STRUGGLE.equals(target.getLastMove())) {
                    failure = "no move to bind";
                } else {
                    state.withMove(target.getLastMove());
                }
                break;
            case LEECH_SEED:
                if (target.hasType(PokemonType.GRASS)) {
                    failure = "grass types cannot be seeded";
                }
                break;
            case SUBSTITUTE:
                int cost = target.getMaxHp() / 4;
                if (target.getHp() <= cost) {
                    failure = "not enough HP";
                } else if (!target.getVolatiles().has(VolatileKind.SUBSTITUTE)) {
                    target.setHp(target.getHp() - cost);
                    ctx.emit(EventType.DAMAGE, side, target, "substitute", cost);
                    state.setCounter(cost);
                }
                break;
            case FLINCH:
                if (effects.has(target, Capability.FLINCH_IMMUNE, ctx.context(target, source))) {
                    return false;
                }
                break;
            default:
                break;
        }
        if (failure == null && target.getVolatiles().has(kind)) {
            failure = "already " + kind.name().toLowerCase();
        }
        if (failure != null) {
            ctx.emit(EventType.FAIL, side, target, failure);
            return false;
        }
        target.getVolatiles().add(state);
        if (kind != VolatileKind.FLINCH) {
            ctx.emit(EventType.VOLATILE_START, side, target, kind.name().toLowerCase());
        }
        return true;
    }

    /** Protect and its relatives; each consecutive success divides the next chance by three. */
    public boolean protect(BattleContext ctx, SideId side, Pokemon user, boolean movesLast) {
        VolatileState streak = user.getVolatiles().get(VolatileKind.PROTECT_STREAK);
        int count = streak == null ? 0 : streak.getCounter();
        double chance = movesLast ? 0 : Math.pow(PROTECT_DECAY, count);
        if (!ctx.getRandom().chance(chance)) {
            user.getVolatiles().remove(VolatileKind.PROTECT_STREAK);
            ctx.emit(EventType.FAIL, side, user, "protect");
            return false;
        }
        user.getVolatiles().put(new VolatileState(VolatileKind.PROTECT, VolatileKind.PROTECT.getDefaultTurns()));
        user.getVolatiles().put(new VolatileState(VolatileKind.PROTECT_STREAK, -1).withCounter(count + 1));
        ctx.emit(EventType.PROTECT, side, user, "protect");
        return true;
    }

    /** Any other move breaks the protect chain. */
    public void resetProtectStreak(Pokemon user) {
        user.getVolatiles().remove(VolatileKind.PROTECT_STREAK);
    }

    /**
     * Flinch, taunt, disable and confusion checks made before a move, after the status checks.
     *
     * @return true when the move goes ahead
     */
    public boolean beforeMove(BattleContext ctx, SideId side, Pokemon user, Move move) {
        if (user.getVolatiles().has(VolatileKind.FLINCH)) {
            ctx.emit(EventType.CANT_MOVE, side, user, "flinch");
            return false;
        }
        if (move.isStatus() && user.getVolatiles().has(VolatileKind.TAUNT)) {
            ctx.emit(EventType.CANT_MOVE, side, user, "taunt");
            return false;
        }
        VolatileState disable = user.getVolatiles().get(VolatileKind.DISABLE);
        if (disable != null && move.getId().equals(disable.getMoveId())) {
            ctx.emit(EventType.CANT_MOVE, side, user, "disabled");
            return false;
        }
        VolatileState confusion = user.getVolatiles().get(VolatileKind.CONFUSION);
        if (confusion != null) {
            int left = confusion.getCounter() - 1;
            if (left <= 0) {
                user.getVolatiles().remove(VolatileKind.CONFUSION);
                ctx.emit(EventType.VOLATILE_END, side, user, "confusion");
                return true;
            }
            confusion.setCounter(left);
            if (ctx.getRandom().chance(CONFUSION_SELF_HIT_CHANCE)) {
                ctx.emit(EventType.CANT_MOVE, side, user, "confusion");
                ctx.damage(side, user, confusionDamage(ctx.getRandom(), user), "confusion");
                return false;
            }
        }
        return true;
    }

    /** A 40 power typeless physical hit against itself, without crits or modifiers. */
    static int confusionDamage(BattleRandom random, Pokemon user) {
        int attack = StatCalculator.applyStage(user.getStat(Stat.ATK), user.getBoosts().get(Stat.ATK));
        int defense = Math.max(1, StatCalculator.applyStage(user.getStat(Stat.DEF), user.getBoosts().get(Stat.DEF)));
        long base = (2L * user.getLevel() / 5 + 2) * CONFUSION_POWER * attack / defense / 50 + 2;
        int roll = random.nextInt(85, 100);
        return Math.max(1, (int) (base * roll / 100));
    }

    /** Leech seed drain and the perish count. */
    public void endOfTurn(BattleContext ctx, SideId side, Pokemon pokemon) {
        if (pokemon.isFainted()) {
            return;
        }
        Pokemon foe = ctx.foeOf(side);
        if (pokemon.getVolatiles().has(VolatileKind.LEECH_SEED)
                && !effects.has(pokemon, Capability.MAGIC_GUARD, ctx.context(pokemon, foe))) {
            int drained = ctx.damageFraction(side, pokemon, 1.0 / 8, "leech seed");
            if (foe != null && !foe.isFainted()) {
                ctx.heal(side.opponent(), foe, drained, "leech seed");
            }
        }
        VolatileState perish = pokemon.getVolatiles().get(VolatileKind.PERISH_SONG);
        if (perish != null && !pokemon.isFainted()) {
            int count = perish.getTurnsLeft() - 1;
            ctx.emit(EventType.VOLATILE_START, side, pokemon, "perish" + count, count);
            if (count <= 0) {
                ctx.faint(side, pokemon);
            }
        }
    }

    /** Counts every volatile down; an expiring dynamax restores max HP. */
    public void decay(BattleContext ctx, SideId side, Pokemon pokemon) {
        VolatileState dynamax = pokemon.getVolatiles().get(VolatileKind.DYNAMAX);
        int originalMax = dynamax == null ? 0 : dynamax.getCounter();
        List<VolatileKind> expired = pokemon.getVolatiles().decay();
        for (VolatileKind kind : expired) {
            switch (kind) {
                case DYNAMAX:
                    FormeChanges.endDynamax(pokemon, originalMax);
                    ctx.emit(EventType.DYNAMAX_END, side, pokemon, null);
                    break;
                case PROTECT:
                case FLINCH:
                case RECHARGE:
                case CHARGING:
                    break;
                default:
                    ctx.emit(EventType.VOLATILE_END, side, pokemon, kind.name().toLowerCase());
                    break;
            }
        }
    }

    /** Switching out clears every volatile and stage change, ending dynamax. */
    public void clearOnSwitchOut(BattleContext ctx, SideId side, Pokemon pokemon) {
        VolatileState dynamax = pokemon.getVolatiles().get(VolatileKind.DYNAMAX);
        if (dynamax != null) {
            FormeChanges.endDynamax(pokemon, dynamax.getCounter());
            ctx.emit(EventType.DYNAMAX_END, side, pokemon, null);
        }
        pokemon.getVolatiles().clear();
        pokemon.getBoosts().clear();
    }

    /**
     * Absorbs a hit with the substitute.
     *
     * @return the damage the substitute took
     */
    public int hitSubstitute(BattleContext ctx, SideId side, Pokemon target, int damage) {
        VolatileState sub = target.getVolatiles().get(VolatileKind.SUBSTITUTE);
        int absorbed = Math.min(damage, sub.getCounter());
        sub.setCounter(sub.getCounter() - absorbed);
        if (sub.getCounter() <= 0) {
            target.getVolatiles().remove(VolatileKind.SUBSTITUTE);
            ctx.emit(EventType.VOLATILE_END, side, target, "substitute");
        }
        return absorbed;
    }
}
