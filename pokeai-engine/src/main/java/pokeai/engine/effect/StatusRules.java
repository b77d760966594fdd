package pokeai.engine.effect;

import pokeai.data.PokemonType;
import pokeai.data.StatusCondition;
import pokeai.data.Terrain;
import pokeai.data.VolatileKind;
import pokeai.data.Weather;
import pokeai.model.BattleState;
import pokeai.model.Pokemon;
import pokeai.model.Side;

/**
 * Whether a primary status can be inflicted. Shared by the calculator, which only predicts, and
 * the status state machine, which applies.
 */
public final class StatusRules {
    private final EffectLookup effects;

    public StatusRules(EffectLookup effects) {
        this.effects = effects;
    }

    /**
     * Why {@code status} cannot be inflicted on {@code target}, or null when it can.
     *
     * @param source the Pokemon causing it, or null for hazards, items and the field
     */
    public String blockReason(BattleState state, Pokemon target, StatusCondition status, Pokemon source) {
        if (target.isFainted()) {
            return "fainted";
        }
        if (target.getStatus() != StatusCondition.NONE) {
            return "already " + target.getStatus().name().toLowerCase();
        }
        switch (status) {
            case BURN:
                if (target.hasType(PokemonType.FIRE)) {
                    return "fire types cannot be burned";
                }
                break;
            case PARALYSIS:
                if (target.hasType(PokemonType.ELECTRIC)) {
                    return "electric types cannot be paralyzed";
                }
                break;
            case POISON:
            case TOXIC:
                if (target.hasType(PokemonType.POISON) || target.hasType(PokemonType.STEEL)) {
                    return "poison and steel types cannot be poisoned";
                }
                break;
            case FREEZE:
                if (target.hasType(PokemonType.ICE)) {
                    return "ice types cannot be frozen";
                }
                if (state.getField().getWeather() == Weather.SUN) {
                    return "cannot freeze in sun";
                }
                break;
            case SLEEP:
                if (state.getField().getTerrain() == Terrain.ELECTRIC && isGrounded(state, target, source)) {
                    return "electric terrain prevents sleep";
                }
                break;
            default:
                break;
        }
        if (state.getField().getTerrain() == Terrain.MISTY && isGrounded(state, target, source)) {
            return "misty terrain prevents status";
        }
        if (source != null && source != target && target.getVolatiles().has(VolatileKind.SUBSTITUTE)) {
            return "behind a substitute";
        }
        return null;
    }

    public boolean canInflict(BattleState state, Pokemon target, StatusCondition status, Pokemon source) {
        return blockReason(state, target, status, source) == null;
    }

    /** Sleep clause: a side may not have a second member put to sleep by the opponent. */
    public boolean sleepClauseBlocks(Side targetSide) {
        for (Pokemon p : targetSide.getTeam()) {
            if (p.getStatus() == StatusCondition.SLEEP && !p.isSelfInflictedSleep()) {
                return true;
            }
        }
        return false;
    }

    private boolean isGrounded(BattleState state, Pokemon target, Pokemon source) {
        return effects.isGrounded(target, EffectContext.of(state, target, source));
    }
}
