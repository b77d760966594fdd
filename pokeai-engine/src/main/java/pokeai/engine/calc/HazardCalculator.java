package pokeai.engine.calc;

import pokeai.data.Capability;
import pokeai.data.HazardKind;
import pokeai.data.PokemonType;
import pokeai.data.StatusCondition;
import pokeai.data.TypeChart;
import pokeai.engine.effect.EffectContext;
import pokeai.engine.effect.EffectLookup;
import pokeai.model.BattleState;
import pokeai.model.Hazards;
import pokeai.model.Pokemon;
import pokeai.model.Side;

/**
 * Entry hazard effects for a Pokemon switching into {@code side}.
 */
public final class HazardCalculator {
    private static final double[] SPIKES_FRACTION = {0, 1.0 / 8, 1.0 / 6, 1.0 / 4};

    private final EffectLookup effects;

    public HazardCalculator(EffectLookup effects) {
        this.effects = effects;
    }

    public HazardOutcome onEntry(BattleState state, Side side, Pokemon incoming) {
        Hazards hazards = side.getHazards();
        if (hazards.isEmpty()) {
            return HazardOutcome.none();
        }
        Pokemon foe = state.getSide(side.getId().opponent()).getActive();
        EffectContext ctx = EffectContext.of(state, incoming, foe);
        if (effects.has(incoming, Capability.HAZARD_IMMUNE, ctx)) {
            return HazardOutcome.none();
        }
        boolean grounded = effects.isGrounded(incoming, ctx);
        boolean magicGuard = effects.has(incoming, Capability.MAGIC_GUARD, ctx);

        double fraction = 0;
        if (!magicGuard) {
            if (hazards.has(HazardKind.STEALTH_ROCK)) {
                fraction += TypeChart.effectiveness(PokemonType.ROCK, incoming.getTypes()) / 8.0;
            }
            if (grounded) {
                fraction += SPIKES_FRACTION[hazards.layers(HazardKind.SPIKES)];
            }
        }

        StatusCondition status = StatusCondition.NONE;
        boolean absorbs = false;
        int toxicLayers = hazards.layers(HazardKind.TOXIC_SPIKES);
        if (toxicLayers > 0 && grounded) {
            if (incoming.hasType(PokemonType.POISON)) {
                absorbs = true;
            } else if (!incoming.hasType(PokemonType.STEEL) && incoming.getStatus() == StatusCondition.NONE) {
                status = toxicLayers >= 2 ? StatusCondition.TOXIC : StatusCondition.POISON;
            }
        }
        boolean web = grounded && hazards.has(HazardKind.STICKY_WEB);
        return new HazardOutcome(Math.min(1.0, fraction), status, web, absorbs);
    }
}
