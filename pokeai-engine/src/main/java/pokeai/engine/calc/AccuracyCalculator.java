package pokeai.engine.calc;

import pokeai.data.Capability;
import pokeai.data.PokemonType;
import pokeai.data.SideConditionKind;
import pokeai.data.Stat;
import pokeai.data.TriggerPhase;
import pokeai.data.Weather;
import pokeai.engine.effect.EffectContext;
import pokeai.engine.effect.EffectLookup;
import pokeai.model.BattleState;
import pokeai.model.Pokemon;
import pokeai.model.StatBoosts;

/**
 * Probability that a move hits, in [0, 1].
 */
public final class AccuracyCalculator {
    private final EffectLookup effects;

    public AccuracyCalculator(EffectLookup effects) {
        this.effects = effects;
    }

    public double accuracy(BattleState state, Pokemon attacker, Pokemon defender, AttackProfile attack) {
        if (attack.bypassesAccuracy() || !attack.getMove().getTarget().targetsFoe()) {
            return 1.0;
        }
        String id = attack.getMoveId();
        Weather weather = state.getField().getWeather();
        double base = attack.getMove().getAccuracy();
        if ("thunder".equals(id) || "hurricane".equals(id)) {
            if (weather == Weather.RAIN) {
                return 1.0;
            }
            if (weather == Weather.SUN) {
                base = 0.5;
            }
        }
        if ("blizzard".equals(id) && weather.isHailOrSnow()) {
            return 1.0;
        }
        if ("toxic".equals(id) && attacker.hasType(PokemonType.POISON)) {
            return 1.0;
        }

        EffectContext attackerCtx = EffectContext.of(state, attacker, defender)
                .withMove(attack.getMove(), attack.getType(), 1.0);
        EffectContext defenderCtx = EffectContext.of(attackerCtx, defender);
        int accuracyStage = effects.has(defender, Capability.IGNORE_FOE_BOOSTS, defenderCtx)
                ? 0 : attacker.getBoosts().get(Stat.ACCURACY);
        int evasionStage = effects.has(attacker, Capability.IGNORE_FOE_BOOSTS, attackerCtx)
                ? 0 : defender.getBoosts().get(Stat.EVASION);

        double accuracy = base * StatBoosts.accuracyMultiplier(accuracyStage - evasionStage);
        if (state.isFieldConditionActive(SideConditionKind.GRAVITY)) {
            accuracy *= 5.0 / 3.0;
        }
        accuracy *= effects.multiplier(TriggerPhase.ACCURACY, attacker, attackerCtx);
        return clamp(accuracy);
    }

    static double clamp(double p) {
        if (Double.isNaN(p)) {
            return 0;
        }
        return Math.max(0.0, Math.min(1.0, p));
    }
}
