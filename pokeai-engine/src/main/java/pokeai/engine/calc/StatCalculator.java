package pokeai.engine.calc;

import pokeai.data.Nature;
import pokeai.data.SideConditionKind;
import pokeai.data.Species;
import pokeai.data.Stat;
import pokeai.data.StatusCondition;
import pokeai.data.TriggerPhase;
import pokeai.engine.effect.EffectContext;
import pokeai.engine.effect.EffectLookup;
import pokeai.model.BattleState;
import pokeai.model.Pokemon;
import pokeai.model.Side;
import pokeai.model.StatBoosts;

/**
 * Stat formulas and effective in-battle stats.
 */
public final class StatCalculator {
    private final EffectLookup effects;

    public StatCalculator(EffectLookup effects) {
        this.effects = effects;
    }

    public static int hp(int base, int iv, int ev, int level) {
        if (base == 1) {
            return 1;
        }
        return (2 * base + iv + ev / 4) * level / 100 + level + 10;
    }

    public static int stat(int base, int iv, int ev, int level, double natureMultiplier) {
        int raw = (2 * base + iv + ev / 4) * level / 100 + 5;
        return (int) Math.floor(raw * natureMultiplier);
    }

    /** Recomputes the five non-HP stats of {@code pokemon} from {@code species}, keeping its spread. */
    public static void applySpecies(Pokemon pokemon, Species species) {
        Nature nature = pokemon.getNature();
        for (Stat stat : Stat.values()) {
            if (!stat.isCoreStat()) {
                continue;
            }
            pokemon.setStat(stat, stat(species.getBaseStat(stat), pokemon.getIv(stat), pokemon.getEv(stat),
                    pokemon.getLevel(), nature.multiplier(stat)));
        }
    }

    public static int applyStage(int raw, int stage) {
        return (int) Math.floor(raw * StatBoosts.statMultiplier(stage));
    }

    /**
     * Speed used for turn order: stage, ability/item modifiers, tailwind and paralysis. Trick Room is
     * not applied here; it inverts the comparison, not the stat.
     */
    public int speed(BattleState state, Side side, Pokemon pokemon) {
        Pokemon foe = state.getSide(side.getId().opponent()).getActive();
        EffectContext ctx = EffectContext.of(state, pokemon, foe);
        double speed = applyStage(pokemon.getStat(Stat.SPE), pokemon.getBoosts().get(Stat.SPE));
        speed *= effects.multiplier(TriggerPhase.SPEED_STAT, pokemon, ctx);
        if (side.hasCondition(SideConditionKind.TAILWIND)) {
            speed *= 2;
        }
        if (pokemon.getStatus() == StatusCondition.PARALYSIS) {
            speed *= 0.5;
        }
        return (int) Math.floor(speed);
    }
}
