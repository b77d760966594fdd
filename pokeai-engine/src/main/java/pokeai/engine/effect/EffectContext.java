package pokeai.engine.effect;

import pokeai.data.Move;
import pokeai.data.PokemonType;
import pokeai.data.SideConditionKind;
import pokeai.data.Terrain;
import pokeai.data.Weather;
import pokeai.model.BattleState;
import pokeai.model.Field;
import pokeai.model.Pokemon;

/**
 * Everything an effect condition may look at. Built fresh for each lookup; never stored.
 */
public final class EffectContext {
    private final Pokemon holder;
    private final Pokemon foe;
    private final Field field;
    private final boolean gravity;
    private final boolean itemsSuppressed;
    private Move move;
    private PokemonType moveType;
    private double effectiveness = 1.0;
    private Weather settingWeather;
    private Terrain settingTerrain;
    private boolean settingScreen;

    private EffectContext(Pokemon holder, Pokemon foe, Field field, boolean gravity, boolean itemsSuppressed) {
        this.holder = holder;
        this.foe = foe;
        this.field = field;
        this.gravity = gravity;
        this.itemsSuppressed = itemsSuppressed;
    }

    public static EffectContext of(BattleState state, Pokemon holder, Pokemon foe) {
        return new EffectContext(holder, foe, state.getField(),
                state.isFieldConditionActive(SideConditionKind.GRAVITY),
                state.isFieldConditionActive(SideConditionKind.MAGIC_ROOM));
    }

    /** Same battle conditions seen from {@code holder}, facing the original holder. */
    public static EffectContext of(EffectContext base, Pokemon holder) {
        return new EffectContext(holder, base.holder, base.field, base.gravity, base.itemsSuppressed);
    }

    public EffectContext withMove(Move move, PokemonType moveType, double effectiveness) {
        this.move = move;
        this.moveType = moveType;
        this.effectiveness = effectiveness;
        return this;
    }

    public EffectContext settingWeather(Weather weather) {
        this.settingWeather = weather;
        return this;
    }

    public EffectContext settingTerrain(Terrain terrain) {
        this.settingTerrain = terrain;
        return this;
    }

    public EffectContext settingScreen() {
        this.settingScreen = true;
        return this;
    }

    public Pokemon getHolder() {
        return holder;
    }

    public Pokemon getFoe() {
        return foe;
    }

    public Field getField() {
        return field;
    }

    public boolean isGravity() {
        return gravity;
    }

    public boolean isItemsSuppressed() {
        return itemsSuppressed;
    }

    public Move getMove() {
        return move;
    }

    public PokemonType getMoveType() {
        return moveType != null ? moveType : move == null ? null : move.getType();
    }

    public double getEffectiveness() {
        return effectiveness;
    }

    public Weather getSettingWeather() {
        return settingWeather;
    }

    public Terrain getSettingTerrain() {
        return settingTerrain;
    }

    public boolean isSettingScreen() {
        return settingScreen;
    }
}
