package pokeai.engine.effect;

import pokeai.data.Capability;
import pokeai.data.Effect;
import pokeai.data.EffectCondition;
import pokeai.data.EffectKind;
import pokeai.data.FormatRules;
import pokeai.data.Move;
import pokeai.data.PokemonType;
import pokeai.data.StatusCondition;
import pokeai.data.TriggerPhase;
import pokeai.engine.BattleRandom;
import pokeai.model.EventType;
import pokeai.model.Pokemon;
import pokeai.model.SideId;

/**
 * Primary status lifecycle: infliction, the checks made before a Pokemon moves, and residual
 * damage at the end of the turn.
 */
public final class StatusMachine {
    static final double FULL_PARALYSIS_CHANCE = 0.25;
    static final double WAKE_CHANCE = 1.0 / 3;
    static final double THAW_CHANCE = 0.2;

    private final EffectLookup effects;
    private final StatusRules rules;

    public StatusMachine(EffectLookup effects) {
        this.effects = effects;
        this.rules = new StatusRules(effects);
    }

    public StatusRules getRules() {
        return rules;
    }

    /**
     * Inflicts {@code status} when nothing prevents it.
     *
     * @param source the Pokemon responsible, or null for items, hazards and the field
     * @return true when the status was applied
     */
    public boolean inflict(BattleContext ctx, SideId targetSide, Pokemon target, StatusCondition status,
                           Pokemon source, FormatRules format) {
        String blocked = rules.blockReason(ctx.getState(), target, status, source);
        if (blocked == null && status == StatusCondition.SLEEP && source != null && source != target
                && format != null && format.hasSleepClause()
                && rules.sleepClauseBlocks(ctx.side(targetSide))) {
            blocked = "sleep clause";
        }
        if (blocked != null) {
            ctx.emit(EventType.FAIL, targetSide, target, blocked);
            return false;
        }
        target.setStatus(status);
        if (status == StatusCondition.SLEEP) {
            target.setSleepTurns(ctx.getRandom().nextInt(1, 3));
        }
        ctx.emit(EventType.STATUS, targetSide, target, status.name().toLowerCase());
        return true;
    }

    /** Rest: full heal and exactly two turns of sleep, replacing any other status. */
    public boolean rest(BattleContext ctx, SideId side, Pokemon user) {
        if (user.isFullHp() || user.getStatus() == StatusCondition.SLEEP) {
            ctx.emit(EventType.FAIL, side, user, "rest");
            return false;
        }
        user.setStatus(StatusCondition.SLEEP);
        user.setSleepTurns(2);
        user.setSelfInflictedSleep(true);
        ctx.emit(EventType.STATUS, side, user, "sleep");
        ctx.heal(side, user, user.getMaxHp(), "rest");
        return true;
    }

    public void cure(BattleContext ctx, SideId side, Pokemon pokemon) {
        StatusCondition previous = pokemon.getStatus();
        if (!previous.isAilment()) {
            return;
        }
        pokemon.setStatus(StatusCondition.NONE);
        ctx.emit(EventType.CURE, side, pokemon, previous.name().toLowerCase());
    }

    /**
     * Sleep, freeze and paralysis checks made before a move. The sleep counter is the number of
     * turns still to be spent asleep; Rest sleep never ends early.
     *
     * @return true when the Pokemon may act
     */
    public boolean beforeMove(BattleContext ctx, SideId side, Pokemon pokemon) {
        BattleRandom random = ctx.getRandom();
        switch (pokemon.getStatus()) {
            case SLEEP:
                int turns = pokemon.getSleepTurns();
                if (turns <= 0 || !pokemon.isSelfInflictedSleep() && random.chance(WAKE_CHANCE)) {
                    cure(ctx, side, pokemon);
                    return true;
                }
                pokemon.setSleepTurns(turns - 1);
                ctx.emit(EventType.CANT_MOVE, side, pokemon, "asleep");
                return false;
            case FREEZE:
                if (random.chance(THAW_CHANCE)) {
                    cure(ctx, side, pokemon);
                    return true;
                }
                ctx.emit(EventType.CANT_MOVE, side, pokemon, "frozen");
                return false;
            case PARALYSIS:
                if (random.chance(FULL_PARALYSIS_CHANCE)) {
                    ctx.emit(EventType.CANT_MOVE, side, pokemon, "paralyzed");
                    return false;
                }
                return true;
            default:
                return true;
        }
    }

    /** A frozen Pokemon hit by a damaging Fire move thaws immediately. */
    public void onHitBy(BattleContext ctx, SideId side, Pokemon target, Move move) {
        if (target.getStatus() == StatusCondition.FREEZE && move.getType() == PokemonType.FIRE && move.isDamaging()) {
            cure(ctx, side, target);
        }
    }

    /** Burn and poison damage. Magic Guard prevents it. */
    public void endOfTurn(BattleContext ctx, SideId side, Pokemon pokemon) {
        if (pokemon.isFainted()) {
            return;
        }
        StatusCondition status = pokemon.getStatus();
        if (status != StatusCondition.BURN && !status.isPoison()) {
            return;
        }
        EffectContext ectx = ctx.context(pokemon, ctx.foeOf(side));
        if (effects.has(pokemon, Capability.MAGIC_GUARD, ectx) || healsFromPoison(pokemon, ectx)) {
            return;
        }
        switch (status) {
            case BURN:
                ctx.damageFraction(side, pokemon, 1.0 / 16, "burn");
                break;
            case POISON:
                ctx.damageFraction(side, pokemon, 1.0 / 8, "poison");
                break;
            case TOXIC:
                int counter = Math.min(15, pokemon.getToxicCounter() + 1);
                pokemon.setToxicCounter(counter);
                ctx.damageFraction(side, pokemon, counter / 16.0, "toxic");
                break;
            default:
                break;
        }
    }

    /** Poison Heal turns poison damage into healing, which the item phase applies. */
    private boolean healsFromPoison(Pokemon pokemon, EffectContext ectx) {
        for (Effect effect : effects.getTable().abilityEffects(TriggerPhase.END_OF_TURN, pokemon.getAbility())) {
            if (effect.getKind() == EffectKind.HEAL && effect.getConditions().contains(EffectCondition.HAS_STATUS)
                    && effects.matches(effect, pokemon, ectx)) {
                return true;
            }
        }
        return false;
    }
}
