package pokeai.engine.effect;

import pokeai.data.Capability;
import pokeai.data.Stat;
import pokeai.data.VolatileKind;
import pokeai.model.EventType;
import pokeai.model.Pokemon;
import pokeai.model.SideId;

import java.util.Map;

/**
 * Applies stage changes. Drops caused by an opponent are blocked by Clear Body and by a substitute.
 */
public final class StatChanges {
    private final EffectLookup effects;

    public StatChanges(EffectLookup effects) {
        this.effects = effects;
    }

    /** @return true when at least one stage changed */
    public boolean apply(BattleContext ctx, SideId side, Pokemon target, Map<Stat, Integer> changes, Pokemon source) {
        boolean changed = false;
        for (Map.Entry<Stat, Integer> entry : changes.entrySet()) {
            changed |= apply(ctx, side, target, entry.getKey(), entry.getValue(), source);
        }
        return changed;
    }

    public boolean apply(BattleContext ctx, SideId side, Pokemon target, Stat stat, int delta, Pokemon source) {
        if (target.isFainted() || delta == 0) {
            return false;
        }
        boolean fromFoe = source != null && source != target;
        if (delta < 0 && fromFoe) {
            if (effects.has(target, Capability.BLOCK_STAT_DROPS, ctx.context(target, source))) {
                ctx.emit(EventType.ABILITY, side, target, target.getAbility());
                return false;
            }
            if (target.getVolatiles().has(VolatileKind.SUBSTITUTE)) {
                ctx.emit(EventType.FAIL, side, target, "substitute");
                return false;
            }
        }
        int actual = target.getBoosts().apply(stat, delta);
        if (actual == 0) {
            ctx.emit(EventType.FAIL, side, target, stat.name().toLowerCase() + (delta > 0 ? " won't go higher" : " won't go lower"));
            return false;
        }
        ctx.emit(EventType.STAT_CHANGE, side, target, stat.name().toLowerCase(), actual);
        return true;
    }
}
