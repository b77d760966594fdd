package pokeai.engine.effect;

import com.google.common.collect.ImmutableList;
import pokeai.data.Capability;
import pokeai.data.Effect;
import pokeai.data.EffectCondition;
import pokeai.data.EffectKind;
import pokeai.data.EffectTable;
import pokeai.data.MoveCategory;
import pokeai.data.PokemonType;
import pokeai.data.Stat;
import pokeai.data.StatusCondition;
import pokeai.data.Terrain;
import pokeai.data.TriggerPhase;
import pokeai.data.Weather;
import pokeai.model.Pokemon;

import java.util.List;

/**
 * Resolves which ability and item effects of a Pokemon apply in a given context.
 */
public final class EffectLookup {
    private final EffectTable table;

    public EffectLookup(EffectTable table) {
        this.table = table;
    }

    public EffectTable getTable() {
        return table;
    }

    /** Ability effects first, then item effects; item effects are skipped under Magic Room. */
    public List<Effect> active(TriggerPhase phase, Pokemon holder, EffectContext ctx) {
        if (holder == null) {
            return ImmutableList.of();
        }
        ImmutableList.Builder<Effect> result = ImmutableList.builder();
        for (Effect effect : table.abilityEffects(phase, holder.getAbility())) {
            if (matches(effect, holder, ctx)) {
                result.add(effect);
            }
        }
        if (!ctx.isItemsSuppressed()) {
            for (Effect effect : table.itemEffects(phase, holder.getItem())) {
                if (matches(effect, holder, ctx)) {
                    result.add(effect);
                }
            }
        }
        return result.build();
    }

    /** Product of the matching MULTIPLIER effects; {@code stat} filters stat-specific ones. */
    public double multiplier(TriggerPhase phase, Pokemon holder, EffectContext ctx, Stat stat) {
        double product = 1.0;
        for (Effect effect : active(phase, holder, ctx)) {
            if (effect.getKind() != EffectKind.MULTIPLIER) {
                continue;
            }
            if (effect.getStat() != null && stat != null && effect.getStat() != stat) {
                continue;
            }
            product *= effect.getValue();
        }
        return product;
    }

    public double multiplier(TriggerPhase phase, Pokemon holder, EffectContext ctx) {
        return multiplier(phase, holder, ctx, null);
    }

    /** The effect granting {@code capability}, or null. */
    public Effect capability(Pokemon holder, Capability capability, EffectContext ctx) {
        for (Effect effect : active(TriggerPhase.PASSIVE, holder, ctx)) {
            if (effect.getKind() == EffectKind.CAPABILITY && effect.getCapability() == capability) {
                return effect;
            }
        }
        return null;
    }

    public boolean has(Pokemon holder, Capability capability, EffectContext ctx) {
        return capability(holder, capability, ctx) != null;
    }

    /** True when the item, not the ability, grants the capability. */
    public boolean grantedByItem(Pokemon holder, Capability capability, EffectContext ctx) {
        for (Effect effect : table.abilityEffects(TriggerPhase.PASSIVE, holder.getAbility())) {
            if (effect.getCapability() == capability && matches(effect, holder, ctx)) {
                return false;
            }
        }
        return has(holder, capability, ctx);
    }

    /** Affected by ground moves, hazards and terrain. */
    public boolean isGrounded(Pokemon pokemon, EffectContext ctx) {
        if (ctx.isGravity()) {
            return true;
        }
        if (pokemon.hasType(PokemonType.FLYING)) {
            return false;
        }
        return !has(pokemon, Capability.UNGROUNDED, ctx);
    }

    boolean matches(Effect effect, Pokemon holder, EffectContext ctx) {
        for (EffectCondition condition : effect.getConditions()) {
            if (!holds(condition, effect, holder, ctx)) {
                return false;
            }
        }
        return true;
    }

    private boolean holds(EffectCondition condition, Effect effect, Pokemon holder, EffectContext ctx) {
        switch (condition) {
            case ALWAYS:
                return true;
            case PHYSICAL_MOVE:
                return ctx.getMove() != null && ctx.getMove().getCategory() == MoveCategory.PHYSICAL;
            case SPECIAL_MOVE:
                return ctx.getMove() != null && ctx.getMove().getCategory() == MoveCategory.SPECIAL;
            case STATUS_MOVE:
                return ctx.getMove() != null && ctx.getMove().isStatus();
            case MOVE_TYPE:
                return ctx.getMove() != null && ctx.getMoveType() == effect.getType();
            case CONTACT_MOVE:
                return ctx.getMove() != null && ctx.getMove().isContact();
            case SUPER_EFFECTIVE:
                return ctx.getEffectiveness() > 1.0;
            case BASE_POWER_AT_MOST:
                return ctx.getMove() != null && ctx.getMove().getBasePower() <= effect.getThreshold();
            case WEATHER:
                return weatherMatches(ctx.getField().getWeather(), effect.getWeather());
            case TERRAIN:
                return terrainMatches(ctx.getField().getTerrain(), effect.getTerrain());
            case FULL_HP:
                return holder.isFullHp();
            case HP_AT_MOST:
                return holder.getHpFraction() <= effect.getThreshold();
            case HAS_STATUS:
                return statusMatches(holder.getStatus(), effect.getStatus());
            case HOLDER_TYPE:
                return holder.hasType(effect.getType());
            case NOT_HOLDER_TYPE:
                return !holder.hasType(effect.getType());
            case FOE_TYPE:
                return ctx.getFoe() != null && ctx.getFoe().hasType(effect.getType());
            case FOE_GROUNDED:
                return ctx.getFoe() != null && isGrounded(ctx.getFoe(), ctx);
            case SETTING_WEATHER:
                return ctx.getSettingWeather() != null && weatherMatches(ctx.getSettingWeather(), effect.getWeather());
            case SETTING_TERRAIN:
                return ctx.getSettingTerrain() != null && terrainMatches(ctx.getSettingTerrain(), effect.getTerrain());
            case SETTING_SCREEN:
                return ctx.isSettingScreen();
            default:
                throw new IllegalStateException("Unhandled effect condition " + condition);
        }
    }

    private static boolean weatherMatches(Weather actual, Weather wanted) {
        if (actual == null || actual == Weather.NONE) {
            return false;
        }
        if (wanted == null) {
            return true;
        }
        return actual == wanted || (actual.isHailOrSnow() && wanted.isHailOrSnow());
    }

    private static boolean terrainMatches(Terrain actual, Terrain wanted) {
        if (actual == null || actual == Terrain.NONE) {
            return false;
        }
        return wanted == null || actual == wanted;
    }

    private static boolean statusMatches(StatusCondition actual, StatusCondition wanted) {
        if (wanted == null) {
            return actual.isAilment();
        }
        if (wanted.isPoison()) {
            return actual.isPoison();
        }
        return actual == wanted;
    }
}
