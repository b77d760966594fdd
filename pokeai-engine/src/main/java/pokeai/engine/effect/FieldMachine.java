package pokeai.engine.effect;

import pokeai.data.Capability;
import pokeai.data.Effect;
import pokeai.data.EffectKind;
import pokeai.data.HazardKind;
import pokeai.data.PokemonType;
import pokeai.data.ScreenKind;
import pokeai.data.SideConditionKind;
import pokeai.data.Terrain;
import pokeai.data.TriggerPhase;
import pokeai.data.Weather;
import pokeai.model.EventType;
import pokeai.model.Field;
import pokeai.model.Pokemon;
import pokeai.model.Side;
import pokeai.model.SideId;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Weather, terrain, screens, side conditions and entry hazards, with their countdowns.
 */
public final class FieldMachine {
    public static final int DEFAULT_WEATHER_TURNS = 5;
    public static final int DEFAULT_TERRAIN_TURNS = 5;
    public static final int DEFAULT_SCREEN_TURNS = 5;

    private final EffectLookup effects;

    public FieldMachine(EffectLookup effects) {
        this.effects = effects;
    }

    /**
     * Sets the weather. Abilities make it last until replaced; moves last five turns, or longer with
     * the matching rock.
     *
     * @return false when the same weather is already up
     */
    public boolean setWeather(BattleContext ctx, SideId side, Pokemon setter, Weather weather, boolean fromAbility) {
        Field field = ctx.getState().getField();
        if (field.getWeather() == weather) {
            if (!fromAbility) {
                ctx.emit(EventType.FAIL, side, setter, weather.name().toLowerCase());
            }
            return false;
        }
        int turns = duration(setter, ctx.context(setter, ctx.foeOf(side)).settingWeather(weather), DEFAULT_WEATHER_TURNS);
        field.setWeather(weather, turns, fromAbility);
        ctx.emit(EventType.WEATHER, side, setter, weather.name().toLowerCase(), fromAbility ? 0 : turns);
        return true;
    }

    public boolean setTerrain(BattleContext ctx, SideId side, Pokemon setter, Terrain terrain, boolean fromAbility) {
        Field field = ctx.getState().getField();
        if (field.getTerrain() == terrain) {
            if (!fromAbility) {
                ctx.emit(EventType.FAIL, side, setter, terrain.name().toLowerCase());
            }
            return false;
        }
        int turns = duration(setter, ctx.context(setter, ctx.foeOf(side)).settingTerrain(terrain), DEFAULT_TERRAIN_TURNS);
        field.setTerrain(terrain, turns, fromAbility);
        ctx.emit(EventType.TERRAIN, side, setter, terrain.name().toLowerCase(), fromAbility ? 0 : turns);
        return true;
    }

    /** Aurora Veil needs hail or snow at the moment it is used. */
    public boolean setScreen(BattleContext ctx, SideId sideId, Pokemon setter, ScreenKind kind) {
        Side side = ctx.side(sideId);
        String failure = null;
        if (side.hasScreen(kind)) {
            failure = "already up";
        } else if (kind == ScreenKind.AURORA_VEIL && !ctx.getState().getField().getWeather().isHailOrSnow()) {
            failure = "aurora veil needs hail or snow";
        }
        if (failure != null) {
            ctx.emit(EventType.FAIL, sideId, setter, failure);
            return false;
        }
        int turns = duration(setter, ctx.context(setter, ctx.foeOf(sideId)).settingScreen(), DEFAULT_SCREEN_TURNS);
        side.setScreen(kind, turns);
        ctx.emit(EventType.SCREEN_START, sideId, setter, kind.name().toLowerCase(), turns);
        return true;
    }

    /**
     * Starts a side condition. Using a room or gravity while it is active ends it instead.
     */
    public boolean setSideCondition(BattleContext ctx, SideId sideId, Pokemon setter, SideConditionKind kind) {
        if (kind.isFieldWide() && ctx.getState().isFieldConditionActive(kind)) {
            for (SideId id : SideId.values()) {
                ctx.side(id).setCondition(kind, 0);
            }
            ctx.emit(EventType.SIDE_CONDITION_END, sideId, setter, kind.name().toLowerCase());
            return true;
        }
        Side side = ctx.side(sideId);
        if (side.hasCondition(kind)) {
            ctx.emit(EventType.FAIL, sideId, setter, kind.name().toLowerCase());
            return false;
        }
        side.setCondition(kind, kind.getDefaultTurns());
        ctx.emit(EventType.SIDE_CONDITION_START, sideId, setter, kind.name().toLowerCase(), kind.getDefaultTurns());
        return true;
    }

    public boolean setHazard(BattleContext ctx, SideId targetSide, Pokemon setter, HazardKind kind) {
        Side side = ctx.side(targetSide);
        if (!side.getHazards().add(kind)) {
            ctx.emit(EventType.FAIL, targetSide, setter, kind.name().toLowerCase());
            return false;
        }
        ctx.emit(EventType.HAZARD_SET, targetSide, setter, kind.name().toLowerCase(), side.getHazards().layers(kind));
        return true;
    }

    /** Clears hazards from a side; with {@code screensToo} its screens go as well. */
    public void clearHazards(BattleContext ctx, SideId sideId, Pokemon source, boolean screensToo) {
        Side side = ctx.side(sideId);
        if (!side.getHazards().isEmpty()) {
            side.getHazards().clear();
            ctx.emit(EventType.HAZARDS_CLEARED, sideId, source, null);
        }
        if (screensToo) {
            for (ScreenKind kind : new ArrayList<>(side.getScreens().keySet())) {
                side.setScreen(kind, 0);
                ctx.emit(EventType.SCREEN_END, sideId, kind.name().toLowerCase());
            }
        }
    }

    /** Sand and hail chip each active Pokemon that is not immune by type or ability. */
    public void weatherDamage(BattleContext ctx, SideId side, Pokemon pokemon) {
        Weather weather = ctx.getState().getField().getWeather();
        if (pokemon == null || pokemon.isFainted()) {
            return;
        }
        boolean hurts;
        switch (weather) {
            case SAND:
                hurts = !pokemon.hasType(PokemonType.ROCK) && !pokemon.hasType(PokemonType.GROUND)
                        && !pokemon.hasType(PokemonType.STEEL);
                break;
            case HAIL:
                hurts = !pokemon.hasType(PokemonType.ICE);
                break;
            default:
                hurts = false;
                break;
        }
        if (!hurts) {
            return;
        }
        EffectContext ectx = ctx.context(pokemon, ctx.foeOf(side));
        if (effects.has(pokemon, Capability.MAGIC_GUARD, ectx)
                || effects.has(pokemon, Capability.WEATHER_DAMAGE_IMMUNE, ectx)) {
            return;
        }
        ctx.damageFraction(side, pokemon, 1.0 / 16, weather.name().toLowerCase());
    }

    public void grassyHeal(BattleContext ctx, SideId side, Pokemon pokemon) {
        if (ctx.getState().getField().getTerrain() != Terrain.GRASSY || pokemon == null || pokemon.isFainted()) {
            return;
        }
        if (effects.isGrounded(pokemon, ctx.context(pokemon, ctx.foeOf(side)))) {
            ctx.healFraction(side, pokemon, 1.0 / 16, "grassy terrain");
        }
    }

    /** Counts weather, terrain, screens and side conditions down by one turn. */
    public void decay(BattleContext ctx) {
        Field field = ctx.getState().getField();
        Weather weather = field.getWeather();
        if (field.tickWeather()) {
            ctx.emit(EventType.WEATHER_END, null, weather.name().toLowerCase());
        }
        Terrain terrain = field.getTerrain();
        if (field.tickTerrain()) {
            ctx.emit(EventType.TERRAIN_END, null, terrain.name().toLowerCase());
        }
        for (SideId id : SideId.values()) {
            Side side = ctx.side(id);
            for (Map.Entry<ScreenKind, Integer> entry : new ArrayList<>(side.getScreens().entrySet())) {
                side.setScreen(entry.getKey(), entry.getValue() - 1);
                if (!side.hasScreen(entry.getKey())) {
                    ctx.emit(EventType.SCREEN_END, id, entry.getKey().name().toLowerCase());
                }
            }
            for (Map.Entry<SideConditionKind, Integer> entry : new ArrayList<>(side.getConditions().entrySet())) {
                side.setCondition(entry.getKey(), entry.getValue() - 1);
                if (!side.hasCondition(entry.getKey())) {
                    ctx.emit(EventType.SIDE_CONDITION_END, id, entry.getKey().name().toLowerCase());
                }
            }
        }
    }

    /** Switch-in weather and terrain abilities. */
    public void onSwitchIn(BattleContext ctx, SideId side, Pokemon pokemon) {
        List<Effect> switchIn = effects.active(TriggerPhase.SWITCH_IN, pokemon, ctx.context(pokemon, ctx.foeOf(side)));
        for (Effect effect : switchIn) {
            if (effect.getKind() == EffectKind.SET_WEATHER) {
                if (setWeather(ctx, side, pokemon, effect.getWeather(), true)) {
                    ctx.emit(EventType.ABILITY, side, pokemon, pokemon.getAbility());
                }
            } else if (effect.getKind() == EffectKind.SET_TERRAIN) {
                if (setTerrain(ctx, side, pokemon, effect.getTerrain(), true)) {
                    ctx.emit(EventType.ABILITY, side, pokemon, pokemon.getAbility());
                }
            }
        }
    }

    private int duration(Pokemon setter, EffectContext ectx, int defaultTurns) {
        int turns = defaultTurns;
        for (Effect effect : effects.active(TriggerPhase.DURATION, setter, ectx)) {
            if (effect.getKind() == EffectKind.EXTEND_DURATION) {
                turns = Math.max(turns, (int) effect.getValue());
            }
        }
        return turns;
    }
}
