package pokeai.engine.calc;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import pokeai.data.EffectTarget;
import pokeai.data.Move;
import pokeai.data.MoveCategory;
import pokeai.data.MoveEffect;
import pokeai.data.MoveEffectKind;
import pokeai.data.PokemonType;
import pokeai.data.Stat;
import pokeai.data.Terrain;
import pokeai.data.Weather;

import java.util.List;

/**
 * A move as it is actually used this turn: plain, Z-powered or as a max move. Z and max moves
 * replace base power and priority and never miss.
 */
public final class AttackProfile {
    private final Move move;
    private final MoveMode mode;
    private final PokemonType type;
    private final int basePower;
    private final int priority;

    private AttackProfile(Move move, MoveMode mode, PokemonType type, int basePower, int priority) {
        this.move = move;
        this.mode = mode;
        this.type = type;
        this.basePower = basePower;
        this.priority = priority;
    }

    public static AttackProfile of(Move move) {
        return of(move, MoveMode.NORMAL);
    }

    public static AttackProfile of(Move move, MoveMode mode) {
        PokemonType type = move.isStruggle() ? null : move.getType();
        switch (mode) {
            case Z_MOVE:
                if (move.isStatus()) {
                    return new AttackProfile(move, mode, type, 0, move.getPriority());
                }
                return new AttackProfile(move, mode, type, zPower(move.getBasePower()), 0);
            case MAX_MOVE:
                if (move.isStatus()) {
                    // Max Guard
                    return new AttackProfile(move, mode, type, 0, 4);
                }
                return new AttackProfile(move, mode, type, maxPower(move.getType(), move.getBasePower()), 0);
            case NORMAL:
            default:
                return new AttackProfile(move, MoveMode.NORMAL, type, move.getBasePower(), move.getPriority());
        }
    }

    public Move getMove() {
        return move;
    }

    public String getMoveId() {
        return move.getId();
    }

    public MoveMode getMode() {
        return mode;
    }

    /** Null for typeless attacks (Struggle). */
    public PokemonType getType() {
        return type;
    }

    public MoveCategory getCategory() {
        return move.getCategory();
    }

    public boolean isPhysical() {
        return move.getCategory() == MoveCategory.PHYSICAL;
    }

    public int getBasePower() {
        return basePower;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isDamaging() {
        return !move.isStatus() && basePower > 0;
    }

    public boolean isMaxGuard() {
        return mode == MoveMode.MAX_MOVE && move.isStatus();
    }

    public boolean bypassesAccuracy() {
        return move.isAlwaysHits() || mode != MoveMode.NORMAL;
    }

    public boolean isContact() {
        return move.isContact() && mode != MoveMode.MAX_MOVE;
    }

    /** Effects applied on hit: the move's own, or the typed side effect of a max move. */
    public List<MoveEffect> effects() {
        if (mode != MoveMode.MAX_MOVE || !isDamaging()) {
            return move.getEffects();
        }
        MoveEffect effect = maxMoveEffect(move.getType());
        return effect == null ? ImmutableList.of() : ImmutableList.of(effect);
    }

    static int zPower(int bp) {
        if (bp <= 55) {
            return 100;
        }
        if (bp <= 65) {
            return 120;
        }
        if (bp <= 75) {
            return 140;
        }
        if (bp <= 85) {
            return 160;
        }
        if (bp <= 95) {
            return 175;
        }
        if (bp <= 100) {
            return 180;
        }
        if (bp <= 110) {
            return 185;
        }
        if (bp <= 125) {
            return 190;
        }
        if (bp <= 130) {
            return 195;
        }
        return 200;
    }

    static int maxPower(PokemonType type, int bp) {
        boolean weak = type == PokemonType.FIGHTING || type == PokemonType.POISON;
        int[] powers = weak ? new int[] {70, 75, 80, 85, 90, 95, 100} : new int[] {90, 100, 110, 120, 130, 140, 150};
        if (bp <= 40) {
            return powers[0];
        }
        if (bp <= 50) {
            return powers[1];
        }
        if (bp <= 60) {
            return powers[2];
        }
        if (bp <= 70) {
            return powers[3];
        }
        if (bp <= 100) {
            return powers[4];
        }
        if (bp <= 140) {
            return powers[5];
        }
        return powers[6];
    }

    private static MoveEffect maxMoveEffect(PokemonType type) {
        switch (type) {
            case FIRE:
                return new MoveEffect(MoveEffectKind.SET_WEATHER, EffectTarget.SELF, 1.0).withWeather(Weather.SUN);
            case WATER:
                return new MoveEffect(MoveEffectKind.SET_WEATHER, EffectTarget.SELF, 1.0).withWeather(Weather.RAIN);
            case ROCK:
                return new MoveEffect(MoveEffectKind.SET_WEATHER, EffectTarget.SELF, 1.0).withWeather(Weather.SAND);
            case ICE:
                return new MoveEffect(MoveEffectKind.SET_WEATHER, EffectTarget.SELF, 1.0).withWeather(Weather.HAIL);
            case ELECTRIC:
                return new MoveEffect(MoveEffectKind.SET_TERRAIN, EffectTarget.SELF, 1.0).withTerrain(Terrain.ELECTRIC);
            case GRASS:
                return new MoveEffect(MoveEffectKind.SET_TERRAIN, EffectTarget.SELF, 1.0).withTerrain(Terrain.GRASSY);
            case PSYCHIC:
                return new MoveEffect(MoveEffectKind.SET_TERRAIN, EffectTarget.SELF, 1.0).withTerrain(Terrain.PSYCHIC);
            case FAIRY:
                return new MoveEffect(MoveEffectKind.SET_TERRAIN, EffectTarget.SELF, 1.0).withTerrain(Terrain.MISTY);
            case NORMAL:
                return boost(EffectTarget.FOE, Stat.SPE, -1);
            case BUG:
                return boost(EffectTarget.FOE, Stat.SPA, -1);
            case DARK:
                return boost(EffectTarget.FOE, Stat.SPD, -1);
            case DRAGON:
                return boost(EffectTarget.FOE, Stat.ATK, -1);
            case GHOST:
                return boost(EffectTarget.FOE, Stat.DEF, -1);
            case STEEL:
                return boost(EffectTarget.SELF, Stat.DEF, 1);
            case FIGHTING:
                return boost(EffectTarget.SELF, Stat.ATK, 1);
            case FLYING:
                return boost(EffectTarget.SELF, Stat.SPE, 1);
            case POISON:
                return boost(EffectTarget.SELF, Stat.SPA, 1);
            case GROUND:
                return boost(EffectTarget.SELF, Stat.SPD, 1);
            default:
                return null;
        }
    }

    private static MoveEffect boost(EffectTarget target, Stat stat, int stages) {
        return new MoveEffect(MoveEffectKind.BOOST, target, 1.0).withBoosts(ImmutableMap.of(stat, stages));
    }

    @Override
    public String toString() {
        return mode == MoveMode.NORMAL ? move.getName() : mode + ":" + move.getName();
    }
}
