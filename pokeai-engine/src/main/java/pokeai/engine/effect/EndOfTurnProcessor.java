package pokeai.engine.effect;

import pokeai.data.Capability;
import pokeai.data.Effect;
import pokeai.data.TriggerPhase;
import pokeai.model.Pokemon;
import pokeai.model.SideId;

/**
 * Residual effects in their fixed category order: weather, grassy terrain, status, volatiles,
 * items, then every countdown. Within a category p1 goes before p2.
 */
public final class EndOfTurnProcessor {
    private final EffectLookup effects;
    private final StatusMachine status;
    private final VolatileMachine volatiles;
    private final FieldMachine field;

    public EndOfTurnProcessor(EffectLookup effects, StatusMachine status, VolatileMachine volatiles,
                              FieldMachine field) {
        this.effects = effects;
        this.status = status;
        this.volatiles = volatiles;
        this.field = field;
    }

    public void run(BattleContext ctx) {
        for (SideId side : SideId.values()) {
            field.weatherDamage(ctx, side, ctx.side(side).getActive());
        }
        for (SideId side : SideId.values()) {
            field.grassyHeal(ctx, side, ctx.side(side).getActive());
        }
        for (SideId side : SideId.values()) {
            Pokemon active = ctx.side(side).getActive();
            if (active != null) {
                status.endOfTurn(ctx, side, active);
            }
        }
        for (SideId side : SideId.values()) {
            Pokemon active = ctx.side(side).getActive();
            if (active != null) {
                volatiles.endOfTurn(ctx, side, active);
            }
        }
        for (SideId side : SideId.values()) {
            items(ctx, side, ctx.side(side).getActive());
        }
        field.decay(ctx);
        for (SideId side : SideId.values()) {
            Pokemon active = ctx.side(side).getActive();
            if (active != null && !active.isFainted()) {
                volatiles.decay(ctx, side, active);
            }
        }
    }

    /** Leftovers, Black Sludge, berries, the orbs and Poison Heal. */
    void items(BattleContext ctx, SideId side, Pokemon holder) {
        if (holder == null || holder.isFainted()) {
            return;
        }
        EffectContext ectx = ctx.context(holder, ctx.foeOf(side));
        for (Effect effect : effects.active(TriggerPhase.END_OF_TURN, holder, ectx)) {
            if (holder.isFainted()) {
                return;
            }
            String source = sourceName(holder, effect);
            switch (effect.getKind()) {
                case HEAL:
                    if (holder.isFullHp()) {
                        continue;
                    }
                    ctx.healFraction(side, holder, effect.getValue(), source);
                    break;
                case DAMAGE:
                    if (effects.has(holder, Capability.MAGIC_GUARD, ectx)) {
                        continue;
                    }
                    ctx.damageFraction(side, holder, effect.getValue(), source);
                    break;
                case INFLICT_STATUS:
                    if (!status.getRules().canInflict(ctx.getState(), holder, effect.getStatus(), null)) {
                        continue;
                    }
                    status.inflict(ctx, side, holder, effect.getStatus(), null, null);
                    break;
                default:
                    continue;
            }
            if (effect.isConsumed()) {
                ctx.consumeItem(side, holder);
            }
        }
    }

    private String sourceName(Pokemon holder, Effect effect) {
        boolean fromAbility = effects.getTable().abilityEffects(TriggerPhase.END_OF_TURN, holder.getAbility())
                .contains(effect);
        return fromAbility ? holder.getAbility() : holder.getItem();
    }
}
